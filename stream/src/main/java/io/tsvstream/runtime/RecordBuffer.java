package io.tsvstream.runtime;

import java.util.ArrayDeque;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO between a pushing producer and a pulling consumer, guarded by one lock.
 * <p>
 * Flow control is edge-triggered: {@link FlowControl#onFull()} fires when an append brings the size to exactly
 * {@code capacity}, so lines already in flight may push the size past it. {@link FlowControl#onDrained()} fires
 * when a consumer finds the buffer empty, and after a dequeue leaves {@code lowWatermark} or fewer entries.
 * Both callbacks run while the lock is held, which keeps a pause from being ordered after the resume meant to undo it.
 * <p>
 * The buffer is exhausted once the source is {@link SourceState#CLOSED} and nothing is left to take.
 */
public final class RecordBuffer<E> {

    public interface FlowControl {
        void onFull();
        void onDrained();
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final ArrayDeque<E> entries = new ArrayDeque<>();
    private final int capacity;
    private final int lowWatermark;
    private final FlowControl flow;

    private SourceState state = SourceState.NOT_STARTED;
    private boolean cancelled = false;
    private CompletableFuture<Optional<E>> waiter; // pending takeAsync, only set while entries is empty

    public RecordBuffer(int capacity, int lowWatermark, FlowControl flow) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be positive: " + capacity);
        if (lowWatermark < 0 || lowWatermark >= capacity) throw new IllegalArgumentException("lowWatermark out of range: " + lowWatermark);
        this.capacity = capacity;
        this.lowWatermark = lowWatermark;
        this.flow = flow;
    }

    public int capacity() { return capacity; }

    public void start() {
        lock.lock();
        try {
            if (state != SourceState.NOT_STARTED) throw new IllegalStateException("buffer already started, state=" + state);
            state = SourceState.ACTIVE;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Producer side. Never blocks beyond the lock; entries arriving after {@link #cancel()} are dropped.
     */
    public void append(E e) {
        CompletableFuture<Optional<E>> handoff = null;
        lock.lock();
        try {
            if (state == SourceState.CLOSED) throw new IllegalStateException("append after the source closed");
            if (cancelled) return;
            if (waiter != null) {
                handoff = waiter;
                waiter = null;
            } else {
                entries.addLast(e);
                if (entries.size() == capacity) flow.onFull();
                changed.signalAll();
            }
        } finally {
            lock.unlock();
        }
        if (handoff != null) handoff.complete(Optional.of(e));
    }

    /**
     * Marks the source closed. Only the first call has an effect.
     *
     * @return true if this call performed the transition
     */
    public boolean finish() {
        CompletableFuture<Optional<E>> end = null;
        lock.lock();
        try {
            if (state == SourceState.CLOSED) return false;
            state = SourceState.CLOSED;
            if (waiter != null) {
                end = waiter;
                waiter = null;
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        if (end != null) end.complete(Optional.empty());
        return true;
    }

    /**
     * Waits until an entry is available or the buffer is exhausted.
     *
     * @return the oldest entry, or empty once exhausted
     * @throws CancellationException if the buffer is cancelled while waiting
     */
    public Optional<E> take() throws InterruptedException {
        return await(-1L);
    }

    public Optional<E> take(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
        Optional<E> r = await(Math.max(0L, unit.toNanos(timeout)));
        if (r == null) throw new TimeoutException("no record within " + timeout + " " + unit);
        return r;
    }

    // null means timed out; negative nanos waits without limit
    private Optional<E> await(long nanos) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            if (entries.isEmpty() && !cancelled) flow.onDrained();
            long remaining = nanos;
            while (entries.isEmpty() && state != SourceState.CLOSED && !cancelled) {
                if (nanos < 0) {
                    changed.await();
                } else {
                    if (remaining <= 0) return null;
                    remaining = changed.awaitNanos(remaining);
                }
            }
            if (cancelled) throw new CancellationException("buffer cancelled");
            if (entries.isEmpty()) return Optional.empty();
            return Optional.of(dequeue());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Non-blocking take: the returned future completes when an entry arrives or the buffer is exhausted.
     * At most one may be pending.
     */
    public CompletableFuture<Optional<E>> takeAsync() {
        lock.lock();
        try {
            if (cancelled) return CompletableFuture.failedFuture(new CancellationException("buffer cancelled"));
            if (entries.isEmpty() && state != SourceState.CLOSED) {
                if (waiter != null) throw new IllegalStateException("a take is already pending");
                // a synchronous source may append or close from inside the callback
                flow.onDrained();
            }
            if (!entries.isEmpty()) return CompletableFuture.completedFuture(Optional.of(dequeue()));
            if (state == SourceState.CLOSED) return CompletableFuture.completedFuture(Optional.empty());
            waiter = new CompletableFuture<>();
            return waiter;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wakes any waiting consumer with a {@link CancellationException} and discards buffered entries.
     */
    public void cancel() {
        CompletableFuture<Optional<E>> pending;
        lock.lock();
        try {
            cancelled = true;
            entries.clear();
            pending = waiter;
            waiter = null;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        if (pending != null) pending.completeExceptionally(new CancellationException("buffer cancelled"));
    }

    private E dequeue() {
        E e = entries.pollFirst();
        if (e == null) throw new IllegalStateException("dequeue from an empty buffer");
        if (entries.size() <= lowWatermark) flow.onDrained();
        return e;
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public SourceState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isExhausted() {
        lock.lock();
        try {
            return state == SourceState.CLOSED && entries.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public boolean isCancelled() {
        lock.lock();
        try {
            return cancelled;
        } finally {
            lock.unlock();
        }
    }
}
