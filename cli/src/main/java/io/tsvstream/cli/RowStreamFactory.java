package io.tsvstream.cli;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Inject;
import io.tsvstream.config.StreamConfig;
import io.tsvstream.error.DeadLetterSink;
import io.tsvstream.model.Column;
import io.tsvstream.model.Row;
import io.tsvstream.runtime.RecordStream;
import io.tsvstream.runtime.RecordStreamBuilder;
import io.tsvstream.source.Input;

import java.util.List;
import java.util.Optional;

/**
 * Opens row streams with the injected configuration, registry and dead-letter sink.
 */
public class RowStreamFactory {
    private final StreamConfig config;
    private final MetricRegistry registry;
    private final Optional<DeadLetterSink> deadLetter;

    @Inject
    public RowStreamFactory(StreamConfig config, MetricRegistry registry, Optional<DeadLetterSink> deadLetter) {
        this.config = config;
        this.registry = registry;
        this.deadLetter = deadLetter;
    }

    public RecordStream<Row> open(Input input, List<Column> columns) {
        RecordStreamBuilder<Row> b = RecordStream.rows()
                .config(config)
                .columns(columns)
                .input(input)
                .metrics(registry);
        deadLetter.ifPresent(b::deadLetter);
        return b.build();
    }

    public Optional<DeadLetterSink> deadLetter() { return deadLetter; }
}
