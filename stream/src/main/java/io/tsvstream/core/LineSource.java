package io.tsvstream.core;

import java.io.Closeable;

/**
 * A pausable producer of text lines. Lines are pushed to a single listener in arrival order.
 */
public interface LineSource extends Closeable {
    /**
     * Begin delivering lines to the listener. May be called once.
     */
    void start(LineListener listener);

    /**
     * Stop pushing lines until {@link #resume()}. A line already being delivered may still arrive.
     */
    void pause();

    void resume();

    boolean isPaused();

    /**
     * Stop delivering and release the underlying stream. The listener still receives {@link LineListener#onClosed()}.
     */
    @Override
    void close();

    default String name() { return getClass().getSimpleName(); }
}
