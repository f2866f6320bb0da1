package io.tsvstream.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.IntSupplier;

/**
 * Named metrics of one record stream. Names share the prefix so several streams can report into one registry.
 */
public class StreamMetrics {
    public static final String DEFAULT_PREFIX = "tsvstream";

    private final MetricRegistry registry;
    private final String prefix;
    private final Meter linesIn;
    private final Meter recordsOut;
    private final Meter malformed;
    private final Counter blankLines;
    private final Counter pauses;
    private final Counter resumes;
    private final Timer nextWait;

    public StreamMetrics(MetricRegistry registry) { this(registry, DEFAULT_PREFIX); }

    public StreamMetrics(MetricRegistry registry, String prefix) {
        this.registry = registry;
        this.prefix = prefix;
        this.linesIn = registry.meter(prefix + ".lines.in");
        this.recordsOut = registry.meter(prefix + ".records.out");
        this.malformed = registry.meter(prefix + ".records.malformed");
        this.blankLines = registry.counter(prefix + ".lines.blank");
        this.pauses = registry.counter(prefix + ".source.pauses");
        this.resumes = registry.counter(prefix + ".source.resumes");
        this.nextWait = registry.timer(prefix + ".next.wait");
    }

    public MetricRegistry registry() { return registry; }

    public Meter linesIn() { return linesIn; }
    public Meter recordsOut() { return recordsOut; }
    public Meter malformed() { return malformed; }
    public Counter blankLines() { return blankLines; }
    public Counter pauses() { return pauses; }
    public Counter resumes() { return resumes; }
    public Timer nextWait() { return nextWait; }

    /**
     * Adds a buffer to the depth gauge. Streams sharing a registry and prefix report their summed depth.
     *
     * @throws IllegalArgumentException if the gauge name is taken by an unrelated metric
     */
    public void registerDepth(IntSupplier depth) {
        depthGauge().buffers.add(depth);
    }

    public void unregisterDepth(IntSupplier depth) {
        depthGauge().buffers.remove(depth);
    }

    private DepthGauge depthGauge() {
        String name = prefix + ".buffer.depth";
        Gauge<?> g = registry.<Gauge<?>>gauge(name, DepthGauge::new);
        if (!(g instanceof DepthGauge d)) throw new IllegalArgumentException(name + " is already registered as another gauge");
        return d;
    }

    private static final class DepthGauge implements Gauge<Integer> {
        private final List<IntSupplier> buffers = new CopyOnWriteArrayList<>();

        @Override
        public Integer getValue() {
            int sum = 0;
            for (IntSupplier b : buffers) sum += b.getAsInt();
            return sum;
        }
    }

    public String summary() {
        return "linesIn=" + linesIn.getCount() +
                " recordsOut=" + recordsOut.getCount() +
                " malformed=" + malformed.getCount() +
                " blank=" + blankLines.getCount() +
                " pauses=" + pauses.getCount() +
                " resumes=" + resumes.getCount() +
                " wait.p50(ms)=" + String.format("%.3f", nextWait.getSnapshot().getMedian() / 1_000_000.0);
    }
}
