package io.tsvstream.source;

import io.tsvstream.core.LineListener;
import io.tsvstream.core.LineSource;
import io.tsvstream.error.SourceNotFoundException;
import io.tsvstream.error.TsvStreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reads lines from an InputStream on a daemon thread and pushes them to the listener.
 * Lines end at {@code \n} or {@code \r\n}; a final line without a terminator is still delivered.
 * While paused the thread parks before pushing the next line, so at most the line it already holds is delayed.
 */
public class StreamLineSource implements LineSource {
    private static final Logger LOG = LoggerFactory.getLogger(StreamLineSource.class);

    private final InputStream in;
    private final Charset charset;
    private final String name;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition resumed = lock.newCondition();
    private boolean paused = false;
    private volatile boolean closed = false;
    private volatile Thread reader;

    public StreamLineSource(InputStream in) { this(in, StandardCharsets.UTF_8, "stream"); }

    public StreamLineSource(InputStream in, Charset charset, String name) {
        this.in = in;
        this.charset = charset;
        this.name = name;
    }

    public static StreamLineSource ofFile(Path file, Charset charset) {
        try {
            return new StreamLineSource(Files.newInputStream(file), charset, file.toString());
        } catch (NoSuchFileException e) {
            throw new SourceNotFoundException(file);
        } catch (IOException e) {
            throw new TsvStreamException("cannot open " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String name() { return name; }

    @Override
    public synchronized void start(LineListener listener) {
        if (reader != null) throw new IllegalStateException("source already started: " + name);
        Thread t = new Thread(() -> pump(listener), "tsv-source-" + name);
        t.setDaemon(true);
        reader = t;
        t.start();
    }

    private void pump(LineListener listener) {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, charset))) {
            String line;
            while (!closed && (line = readLine(br)) != null) {
                if (!awaitResumed()) break;
                listener.onLine(line);
            }
        } catch (IOException e) {
            if (closed) {
                LOG.debug("read on {} interrupted by close: {}", name, e.toString());
            } else {
                LOG.error("read failed on {}", name, e);
                listener.onError(e);
            }
        } finally {
            LOG.debug("source {} finished", name);
            listener.onClosed();
        }
    }

    // splits on \n and \r\n only; a lone \r stays inside the line
    private static String readLine(Reader r) throws IOException {
        StringBuilder sb = new StringBuilder();
        int c;
        while ((c = r.read()) != -1) {
            if (c == '\n') {
                int last = sb.length() - 1;
                if (last >= 0 && sb.charAt(last) == '\r') sb.setLength(last);
                return sb.toString();
            }
            sb.append((char) c);
        }
        return sb.length() == 0 ? null : sb.toString();
    }

    /** @return false when the source was closed while waiting */
    private boolean awaitResumed() {
        lock.lock();
        try {
            while (paused && !closed) {
                resumed.awaitUninterruptibly();
            }
            return !closed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void pause() {
        lock.lock();
        try {
            paused = true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void resume() {
        lock.lock();
        try {
            paused = false;
            resumed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isPaused() {
        lock.lock();
        try {
            return paused;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) return;
            closed = true;
            resumed.signalAll();
        } finally {
            lock.unlock();
        }
        // unblocks a reader parked in read(); on the reader's own thread the pump closes the stream
        if (reader != Thread.currentThread()) closeQuietly();
    }

    private void closeQuietly() {
        try {
            in.close();
        } catch (IOException e) {
            LOG.debug("closing {} failed: {}", name, e.toString());
        }
    }
}
