package io.tsvstream.cli;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.tsvstream.config.StreamConfig;
import io.tsvstream.error.DeadLetterSink;
import io.tsvstream.error.FileDeadLetterSink;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

public class CliModule extends AbstractModule {
    private final StreamConfig config;
    private final Path deadLetterFile; // optional

    public CliModule(StreamConfig config, Path deadLetterFile) {
        this.config = config;
        this.deadLetterFile = deadLetterFile;
    }

    @Override
    protected void configure() {
        bind(StreamConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Optional<DeadLetterSink> deadLetter() throws IOException {
        if (deadLetterFile == null) return Optional.empty();
        return Optional.of(new FileDeadLetterSink(deadLetterFile));
    }
}
