package io.tsvstream.runtime;

import io.tsvstream.core.LineListener;
import io.tsvstream.core.LineSource;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test source driven by the test thread. Pushes are synchronous and ignore pause, so a test can model lines
 * that were already in flight when the pause was requested.
 */
class ManualLineSource implements LineSource {
    final AtomicInteger pauses = new AtomicInteger();
    final AtomicInteger resumes = new AtomicInteger();
    private volatile LineListener listener;
    private volatile boolean paused = false;
    private volatile boolean closed = false;

    @Override public void start(LineListener l) { this.listener = l; }

    boolean started() { return listener != null; }
    boolean closed() { return closed; }

    void push(String... lines) { for (String l : lines) listener.onLine(l); }
    void finish() { listener.onClosed(); }
    void fail(IOException e) { listener.onError(e); listener.onClosed(); }

    @Override public void pause() { paused = true; pauses.incrementAndGet(); }
    @Override public void resume() { paused = false; resumes.incrementAndGet(); }
    @Override public boolean isPaused() { return paused; }
    @Override public void close() { closed = true; }
    @Override public String name() { return "manual"; }
}
