package io.tsvstream.cli;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.tsvstream.config.StreamConfig;
import io.tsvstream.model.ColumnSpec;
import io.tsvstream.model.Row;
import io.tsvstream.runtime.RecordStream;
import io.tsvstream.source.Input;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class CliModuleTest {
    @Test
    void factory_streams_share_the_injected_registry() throws Exception {
        Injector injector = Guice.createInjector(new CliModule(StreamConfig.defaults().withMaxCapacity(3), null));
        RowStreamFactory factory = injector.getInstance(RowStreamFactory.class);
        assertTrue(factory.deadLetter().isEmpty());

        Input in = Input.stream(new ByteArrayInputStream("a\nb\n".getBytes(StandardCharsets.UTF_8)));
        try (RecordStream<Row> s = factory.open(in, ColumnSpec.parse("v:text"))) {
            assertEquals(3, s.capacity());
            assertEquals("a", s.next().orElseThrow().payload().getString("v"));
            assertEquals("b", s.next().orElseThrow().payload().getString("v"));
            assertTrue(s.next().isEmpty());
        }
        MetricRegistry registry = injector.getInstance(MetricRegistry.class);
        assertEquals(2, registry.meter("tsvstream.records.out").getCount());
    }
}
