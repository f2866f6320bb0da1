package io.tsvstream.runtime;

import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class RecordBufferTest {
    static class CountingFlow implements RecordBuffer.FlowControl {
        final AtomicInteger full = new AtomicInteger();
        final AtomicInteger drained = new AtomicInteger();
        @Override public void onFull() { full.incrementAndGet(); }
        @Override public void onDrained() { drained.incrementAndGet(); }
    }

    @Test
    void delivers_in_fifo_order_then_exhausts() throws Exception {
        var buf = new RecordBuffer<String>(10, 0, new CountingFlow());
        buf.start();
        buf.append("a");
        buf.append("b");
        buf.append("c");
        buf.finish();
        assertEquals("a", buf.take().orElseThrow());
        assertEquals("b", buf.take().orElseThrow());
        assertFalse(buf.isExhausted());
        assertEquals("c", buf.take().orElseThrow());
        assertTrue(buf.isExhausted());
        assertEquals(Optional.empty(), buf.take());
        assertEquals(Optional.empty(), buf.take());
    }

    @Test
    void full_fires_only_at_exact_capacity() {
        var flow = new CountingFlow();
        var buf = new RecordBuffer<Integer>(3, 0, flow);
        buf.start();
        buf.append(1);
        buf.append(2);
        assertEquals(0, flow.full.get());
        buf.append(3);
        assertEquals(1, flow.full.get());
        buf.append(4); // in flight when the pause was requested
        buf.append(5);
        assertEquals(1, flow.full.get(), "edge-triggered, not level-triggered");
        assertEquals(5, buf.size());
    }

    @Test
    void drained_fires_when_consumer_finds_buffer_empty_or_at_watermark() throws Exception {
        var flow = new CountingFlow();
        var buf = new RecordBuffer<Integer>(4, 1, flow);
        buf.start();
        buf.append(1);
        buf.append(2);
        buf.append(3);
        buf.take(); // 2 left
        assertEquals(0, flow.drained.get());
        buf.take(); // 1 left, at watermark
        assertEquals(1, flow.drained.get());
        buf.take();
        buf.finish();
        buf.take(); // empty on entry
        assertTrue(flow.drained.get() >= 2);
    }

    @Test
    void finish_transitions_once() {
        var buf = new RecordBuffer<String>(2, 0, new CountingFlow());
        assertEquals(SourceState.NOT_STARTED, buf.state());
        buf.start();
        assertEquals(SourceState.ACTIVE, buf.state());
        assertTrue(buf.finish());
        assertFalse(buf.finish());
        assertEquals(SourceState.CLOSED, buf.state());
        assertThrows(IllegalStateException.class, () -> buf.append("late"));
        assertThrows(IllegalStateException.class, buf::start);
    }

    @Test
    void take_times_out_when_nothing_arrives() {
        var buf = new RecordBuffer<String>(2, 0, new CountingFlow());
        buf.start();
        assertThrows(TimeoutException.class, () -> buf.take(20, TimeUnit.MILLISECONDS));
    }

    @Test
    void waiting_take_wakes_on_append() throws Exception {
        var buf = new RecordBuffer<String>(2, 0, new CountingFlow());
        buf.start();
        ExecutorService ex = Executors.newSingleThreadExecutor();
        try {
            Future<Optional<String>> f = ex.submit(() -> buf.take());
            Thread.sleep(50);
            assertFalse(f.isDone());
            buf.append("x");
            assertEquals("x", f.get(2, TimeUnit.SECONDS).orElseThrow());
        } finally {
            ex.shutdownNow();
        }
    }

    @Test
    void cancel_wakes_waiting_take() throws Exception {
        var buf = new RecordBuffer<String>(2, 0, new CountingFlow());
        buf.start();
        ExecutorService ex = Executors.newSingleThreadExecutor();
        try {
            Future<Optional<String>> f = ex.submit(() -> buf.take());
            Thread.sleep(50);
            buf.cancel();
            ExecutionException e = assertThrows(ExecutionException.class, () -> f.get(2, TimeUnit.SECONDS));
            assertInstanceOf(CancellationException.class, e.getCause());
            buf.append("dropped");
            assertEquals(0, buf.size());
        } finally {
            ex.shutdownNow();
        }
    }

    @Test
    void async_take_completes_on_append_and_on_finish() throws Exception {
        var buf = new RecordBuffer<String>(2, 0, new CountingFlow());
        buf.start();
        CompletableFuture<Optional<String>> first = buf.takeAsync();
        assertFalse(first.isDone());
        assertThrows(IllegalStateException.class, buf::takeAsync);
        buf.append("x");
        assertEquals("x", first.get(1, TimeUnit.SECONDS).orElseThrow());
        assertEquals(0, buf.size());

        CompletableFuture<Optional<String>> second = buf.takeAsync();
        buf.finish();
        assertEquals(Optional.empty(), second.get(1, TimeUnit.SECONDS));
        assertEquals(Optional.empty(), buf.takeAsync().get());
    }

    @Test
    void rejects_invalid_bounds() {
        assertThrows(IllegalArgumentException.class, () -> new RecordBuffer<String>(0, 0, new CountingFlow()));
        assertThrows(IllegalArgumentException.class, () -> new RecordBuffer<String>(3, 3, new CountingFlow()));
    }
}
