package io.tsvstream.runtime;

import com.codahale.metrics.Timer;
import io.tsvstream.config.StreamConfig;
import io.tsvstream.core.LineListener;
import io.tsvstream.core.LineSource;
import io.tsvstream.core.Record;
import io.tsvstream.core.RecordModel;
import io.tsvstream.error.DeadLetterSink;
import io.tsvstream.error.MalformedRecordException;
import io.tsvstream.error.MalformedRecordPolicy;
import io.tsvstream.error.SourceReadException;
import io.tsvstream.metrics.StreamMetrics;
import io.tsvstream.model.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntSupplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Pull-based view over a pushing line source. Lines are parsed on the source's thread into a bounded buffer;
 * the source is paused when the buffer fills and resumed when the consumer drains it.
 * <p>
 * {@link #next()} returns the next record in line order, or empty once the source has closed and the buffer is
 * drained; after that every call returns empty. Calls must be serialized: a second call while one is still
 * waiting fails with {@link IllegalStateException}. {@link #close()} cancels a waiting call.
 */
public class RecordStream<T> implements Iterable<Record<T>>, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(RecordStream.class);

    private final RecordModel<T> model;
    private final LineSource source;
    private final RecordBuffer<Entry<T>> buffer;
    private final MalformedRecordPolicy malformedPolicy;
    private final DeadLetterSink deadLetter; // optional
    private final StreamMetrics metrics;
    private final IntSupplier depth;

    private final AtomicBoolean callInFlight = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean iterated = new AtomicBoolean(false);
    private final AtomicBoolean sourcePaused = new AtomicBoolean(false);

    // source thread only
    private long lineNumber = 0;
    private long seq = 0;

    RecordStream(RecordModel<T> model, LineSource source, StreamConfig config, DeadLetterSink deadLetter, StreamMetrics metrics) {
        this.model = Objects.requireNonNull(model);
        this.source = Objects.requireNonNull(source);
        this.malformedPolicy = config.malformedPolicy();
        this.deadLetter = deadLetter;
        this.metrics = Objects.requireNonNull(metrics);
        this.buffer = new RecordBuffer<>(config.maxCapacity(), config.lowWatermark(), new RecordBuffer.FlowControl() {
            @Override public void onFull() { pauseSource(); }
            @Override public void onDrained() { resumeSource(); }
        });
        this.depth = buffer::size;
        metrics.registerDepth(depth);
    }

    public static <T> RecordStreamBuilder<T> builder() { return new RecordStreamBuilder<>(false); }

    /** Builder for streams decoded by the default column model. */
    public static RecordStreamBuilder<Row> rows() { return new RecordStreamBuilder<>(true); }

    void start() {
        buffer.start();
        LOG.debug("starting source {} with capacity {}", source.name(), buffer.capacity());
        source.start(new Feed());
    }

    /**
     * Waits without limit for the next record.
     *
     * @return the next record, or empty once every line has been delivered
     * @throws MalformedRecordException in place of a line the model rejected, under {@link MalformedRecordPolicy#FAIL}
     * @throws SourceReadException when the source failed; iteration ends after it
     * @throws CancellationException if the stream is closed while waiting
     */
    public Optional<Record<T>> next() throws InterruptedException {
        enter();
        try (Timer.Context ignored = metrics.nextWait().time()) {
            return unwrap(buffer.take());
        } finally {
            callInFlight.set(false);
        }
    }

    /**
     * Like {@link #next()}, giving up after the timeout.
     */
    public Optional<Record<T>> next(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
        enter();
        try (Timer.Context ignored = metrics.nextWait().time()) {
            return unwrap(buffer.take(timeout, unit));
        } finally {
            callInFlight.set(false);
        }
    }

    /**
     * Non-blocking variant of {@link #next()}. Failures complete the stage exceptionally.
     */
    public CompletionStage<Optional<Record<T>>> nextAsync() {
        enter();
        Timer.Context timer = metrics.nextWait().time();
        CompletableFuture<Optional<Entry<T>>> taken;
        try {
            taken = buffer.takeAsync();
        } catch (RuntimeException e) {
            timer.stop();
            callInFlight.set(false);
            throw e;
        }
        return taken
                .whenComplete((e, ex) -> {
                    timer.stop();
                    callInFlight.set(false);
                })
                .thenApply(this::unwrap);
    }

    private void enter() {
        if (closed.get()) throw new IllegalStateException("record stream is closed");
        if (!callInFlight.compareAndSet(false, true)) {
            throw new IllegalStateException("another next() call is still waiting on this stream");
        }
    }

    private Optional<Record<T>> unwrap(Optional<Entry<T>> taken) {
        if (taken.isEmpty()) return Optional.empty();
        Entry<T> e = taken.get();
        if (e.error != null) throw e.error;
        metrics.recordsOut().mark();
        return Optional.of(e.record);
    }

    // called with the buffer lock held
    private void pauseSource() {
        if (sourcePaused.compareAndSet(false, true)) {
            metrics.pauses().inc();
            LOG.debug("buffer full, pausing {}", source.name());
        }
        source.pause();
    }

    // called with the buffer lock held
    private void resumeSource() {
        if (sourcePaused.compareAndSet(true, false)) {
            metrics.resumes().inc();
            LOG.debug("buffer drained, resuming {}", source.name());
        }
        source.resume();
    }

    public int bufferedCount() { return buffer.size(); }
    public int capacity() { return buffer.capacity(); }
    public SourceState sourceState() { return buffer.state(); }
    public boolean isExhausted() { return buffer.isExhausted(); }
    public boolean isSourcePaused() { return source.isPaused(); }
    public boolean isClosed() { return closed.get(); }
    public StreamMetrics metrics() { return metrics; }

    /**
     * Single-use iterator over the remaining records. {@link Iterator#hasNext()} blocks like {@link #next()}.
     */
    @Override
    public Iterator<Record<T>> iterator() {
        if (!iterated.compareAndSet(false, true)) throw new IllegalStateException("a record stream can only be iterated once");
        return new RecordIterator<>(this);
    }

    /** Sequential stream of the remaining records; closing it closes this record stream. */
    public Stream<Record<T>> stream() {
        return StreamSupport.stream(spliterator(), false).onClose(this::close);
    }

    /**
     * Stops the source and releases buffered records. A call blocked in next() fails with CancellationException,
     * later calls with IllegalStateException.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        LOG.debug("closing record stream over {}", source.name());
        buffer.cancel();
        source.close();
        metrics.unregisterDepth(depth);
    }

    private final class Feed implements LineListener {
        @Override
        public void onLine(String line) {
            long n = ++lineNumber;
            if (line.isEmpty()) {
                metrics.blankLines().inc();
                return;
            }
            metrics.linesIn().mark();
            Entry<T> entry;
            try {
                entry = Entry.of(new Record<>(seq, n, model.parseLine(line)));
                seq++;
            } catch (MalformedRecordException e) {
                entry = rejected(e.atLine(n));
            } catch (RuntimeException e) {
                entry = rejected(new MalformedRecordException(e.toString(), line, e).atLine(n));
            }
            if (entry != null) buffer.append(entry);
        }

        private Entry<T> rejected(MalformedRecordException e) {
            metrics.malformed().mark();
            if (malformedPolicy == MalformedRecordPolicy.SKIP) {
                LOG.warn("skipping malformed line {} of {}: {}", e.lineNumber(), source.name(), e.reason());
                if (deadLetter != null) deadLetter.acceptFailure(e);
                return null;
            }
            return Entry.failed(e);
        }

        @Override
        public void onError(IOException e) {
            buffer.append(Entry.failed(new SourceReadException(source.name(), e)));
        }

        @Override
        public void onClosed() {
            if (buffer.finish()) {
                LOG.debug("source {} closed after {} lines", source.name(), lineNumber);
            }
        }
    }

    private static final class Entry<T> {
        final Record<T> record;
        final RuntimeException error;

        private Entry(Record<T> record, RuntimeException error) {
            this.record = record;
            this.error = error;
        }

        static <T> Entry<T> of(Record<T> r) { return new Entry<>(r, null); }
        static <T> Entry<T> failed(RuntimeException e) { return new Entry<>(null, e); }
    }
}
