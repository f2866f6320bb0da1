package io.tsvstream.cli;

import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import io.tsvstream.config.StreamConfig;
import io.tsvstream.core.Record;
import io.tsvstream.error.ConfigurationException;
import io.tsvstream.error.MalformedRecordException;
import io.tsvstream.error.MalformedRecordPolicy;
import io.tsvstream.error.SourceNotFoundException;
import io.tsvstream.error.SourceReadException;
import io.tsvstream.model.Column;
import io.tsvstream.model.ColumnSpec;
import io.tsvstream.model.Row;
import io.tsvstream.runtime.RecordStream;
import io.tsvstream.source.Input;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI that streams a TSV file (or stdin) through a bounded record stream and prints one line per record.
 * Exit codes: 0 ok, 1 bad input data, 2 bad options, missing file or unusable dead-letter file.
 */
@CommandLine.Command(name = "tsv-cat", mixinStandardHelpOptions = true, description = "Stream tab-separated records as typed rows")
public final class TsvCatMain implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(TsvCatMain.class);

    @CommandLine.Parameters(index = "0", arity = "0..1", defaultValue = "-", description = "Input file, or - for stdin")
    String input;

    @CommandLine.Option(names = {"-c", "--columns"}, required = true, description = "Columns, e.g. name:text,age:integer")
    String columns;

    @CommandLine.Option(names = "--capacity", description = "Max buffered records (default: tsvstream.capacity or 100)")
    Integer capacity;

    @CommandLine.Option(names = "--low-watermark", description = "Resume reading once this many records or fewer are buffered")
    Integer lowWatermark;

    @CommandLine.Option(names = "--separator", description = "Field separator; \\t or tab for tab")
    String separator;

    @CommandLine.Option(names = "--skip-malformed", description = "Skip lines that do not match the columns instead of failing")
    boolean skipMalformed;

    @CommandLine.Option(names = "--dead-letter", description = "Append skipped lines to this JSONL file")
    Path deadLetter;

    @CommandLine.Option(names = "--limit", defaultValue = "-1", description = "Stop after this many records")
    long limit;

    @CommandLine.Option(names = "--summary", description = "Print stream metrics to stderr when done")
    boolean summary;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final InputStream stdin;

    public TsvCatMain() { this(System.in); }

    TsvCatMain(InputStream stdin) { this.stdin = stdin; }

    public static void main(String[] args) {
        int code = new CommandLine(new TsvCatMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        StreamConfig cfg;
        List<Column> cols;
        try {
            cfg = config();
            cols = ColumnSpec.parse(columns);
        } catch (ConfigurationException e) {
            err.println(e.getMessage());
            return 2;
        }

        RowStreamFactory factory;
        try {
            Injector injector = Guice.createInjector(new CliModule(cfg, deadLetter));
            factory = injector.getInstance(RowStreamFactory.class);
        } catch (ProvisionException | CreationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            err.println("cannot open dead-letter file " + deadLetter + ": " + cause);
            return 2;
        }
        Input in = "-".equals(input) ? Input.stream(stdin) : Input.file(Path.of(input));
        LOG.debug("streaming {} with columns {} and capacity {}", input, cols, cfg.maxCapacity());

        long n = 0;
        try (RecordStream<Row> stream = factory.open(in, cols)) {
            Optional<Record<Row>> r;
            while ((limit < 0 || n < limit) && (r = stream.next()).isPresent()) {
                out.println(format(r.get().payload()));
                n++;
            }
            out.flush();
            if (summary) err.println("records=" + n + " " + stream.metrics().summary());
            return 0;
        } catch (SourceNotFoundException | ConfigurationException e) {
            err.println(e.getMessage());
            return 2;
        } catch (MalformedRecordException | SourceReadException e) {
            out.flush();
            err.println(e.getMessage());
            return 1;
        } finally {
            factory.deadLetter().ifPresent(d -> d.close());
        }
    }

    private StreamConfig config() {
        StreamConfig cfg = StreamConfig.fromEnv();
        if (capacity != null) cfg = cfg.withMaxCapacity(capacity);
        if (lowWatermark != null) cfg = cfg.withLowWatermark(lowWatermark);
        if (separator != null) cfg = cfg.withSeparator(StreamConfig.parseSeparator(separator));
        if (skipMalformed) cfg = cfg.withMalformedPolicy(MalformedRecordPolicy.SKIP);
        return cfg;
    }

    static String format(Row row) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < row.size(); i++) {
            if (i > 0) sb.append('\t');
            sb.append(row.get(i));
        }
        return sb.toString();
    }
}
