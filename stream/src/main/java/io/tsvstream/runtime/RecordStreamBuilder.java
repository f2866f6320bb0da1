package io.tsvstream.runtime;

import com.codahale.metrics.MetricRegistry;
import io.tsvstream.config.StreamConfig;
import io.tsvstream.core.LineSource;
import io.tsvstream.core.RecordModel;
import io.tsvstream.error.ConfigurationException;
import io.tsvstream.error.DeadLetterSink;
import io.tsvstream.error.MalformedRecordPolicy;
import io.tsvstream.error.SourceNotFoundException;
import io.tsvstream.metrics.StreamMetrics;
import io.tsvstream.model.Column;
import io.tsvstream.model.ColumnModel;
import io.tsvstream.model.ColumnSpec;
import io.tsvstream.source.Input;
import io.tsvstream.source.StreamLineSource;

import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Collects construction options. {@link #build()} validates all of them before touching the input,
 * then starts the source.
 */
public class RecordStreamBuilder<T> {
    private final boolean rows; // T is Row, so the column model may be used
    private RecordModel<T> model;
    private List<Column> columns;
    private Input input;
    private int maxCapacity = StreamConfig.DEFAULT_CAPACITY;
    private int lowWatermark = 0;
    private MalformedRecordPolicy malformedPolicy = MalformedRecordPolicy.FAIL;
    private char separator = ColumnModel.TAB;
    private Charset charset = StreamConfig.defaults().charset();
    private DeadLetterSink deadLetter;
    private MetricRegistry metricRegistry = new MetricRegistry();
    private String metricsPrefix = StreamMetrics.DEFAULT_PREFIX;

    RecordStreamBuilder(boolean rows) { this.rows = rows; }

    public RecordStreamBuilder<T> model(RecordModel<T> m) { this.model = m; return this; }
    /**
     * Decode with the default {@link ColumnModel}. Only builders from {@link RecordStream#rows()} accept columns,
     * since the stream then yields {@code Row} payloads.
     */
    public RecordStreamBuilder<T> columns(List<Column> c) {
        if (!rows) throw new ConfigurationException("columns yield Row records; start from RecordStream.rows()");
        this.columns = c == null ? null : List.copyOf(c);
        return this;
    }
    public RecordStreamBuilder<T> columns(String spec) { return columns(ColumnSpec.parse(spec)); }
    public RecordStreamBuilder<T> input(Input in) {
        if (this.input != null) throw new ConfigurationException("input already set to " + this.input);
        this.input = in;
        return this;
    }
    public RecordStreamBuilder<T> file(Path p) { return input(Input.file(p)); }
    public RecordStreamBuilder<T> stream(InputStream in) { return input(Input.stream(in)); }
    public RecordStreamBuilder<T> source(LineSource s) { return input(Input.source(s)); }
    public RecordStreamBuilder<T> config(StreamConfig c) {
        this.maxCapacity = c.maxCapacity();
        this.lowWatermark = c.lowWatermark();
        this.malformedPolicy = c.malformedPolicy();
        this.separator = c.separator();
        this.charset = c.charset();
        return this;
    }
    public RecordStreamBuilder<T> maxCapacity(int n) { this.maxCapacity = n; return this; }
    public RecordStreamBuilder<T> lowWatermark(int n) { this.lowWatermark = n; return this; }
    public RecordStreamBuilder<T> malformedPolicy(MalformedRecordPolicy p) { this.malformedPolicy = p; return this; }
    public RecordStreamBuilder<T> separator(char c) { this.separator = c; return this; }
    public RecordStreamBuilder<T> charset(Charset c) { this.charset = c; return this; }
    public RecordStreamBuilder<T> deadLetter(DeadLetterSink d) { this.deadLetter = d; return this; }
    public RecordStreamBuilder<T> metrics(MetricRegistry r) { this.metricRegistry = r; return this; }
    public RecordStreamBuilder<T> metrics(MetricRegistry r, String prefix) { this.metricRegistry = r; this.metricsPrefix = prefix; return this; }

    public RecordStream<T> build() {
        StreamConfig cfg = new StreamConfig(maxCapacity, lowWatermark, malformedPolicy, separator, charset);
        RecordModel<T> m = resolveModel(cfg);
        if (input == null) throw new ConfigurationException("Either a file path or a stream must be specified");
        if (metricRegistry == null) throw new ConfigurationException("metric registry must not be null");
        LineSource src = openSource(cfg);
        try {
            RecordStream<T> stream = new RecordStream<>(m, src, cfg, deadLetter, new StreamMetrics(metricRegistry, metricsPrefix));
            stream.start();
            return stream;
        } catch (RuntimeException e) {
            src.close();
            throw e;
        }
    }

    @SuppressWarnings("unchecked") // columns are only accepted when T is Row
    private RecordModel<T> resolveModel(StreamConfig cfg) {
        if (model != null && columns != null) throw new ConfigurationException("specify either a model or columns, not both");
        if (model != null) return model;
        if (columns == null) throw new ConfigurationException("If a model is not specified please specify columns for standard model");
        return (RecordModel<T>) new ColumnModel(columns, cfg.separator());
    }

    private LineSource openSource(StreamConfig cfg) {
        if (input instanceof Input.FileInput f) {
            Path p = f.path();
            if (!Files.exists(p)) throw new SourceNotFoundException(p);
            if (Files.isDirectory(p)) throw new ConfigurationException("expected a file but found a directory: " + p);
            return StreamLineSource.ofFile(p, cfg.charset());
        }
        if (input instanceof Input.StreamInput s) {
            return new StreamLineSource(s.in(), cfg.charset(), "stream");
        }
        if (input instanceof Input.SourceInput s) {
            return s.source();
        }
        throw new ConfigurationException("unsupported input: " + input.getClass().getName());
    }
}
