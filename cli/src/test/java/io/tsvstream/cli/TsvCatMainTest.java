package io.tsvstream.cli;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TsvCatMainTest {
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String stdin, String... args) {
        CommandLine cmd = new CommandLine(new TsvCatMain(new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8))));
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private String stdout() { return out.toString().replace("\r\n", "\n"); }

    @Test
    void prints_rows_from_stdin() {
        int code = run("a\t1\nb\t2\n\nc\t3\n", "-c", "name:text,n:integer", "--capacity", "2");
        assertEquals(0, code, err.toString());
        assertEquals("a\t1\nb\t2\nc\t3\n", stdout());
    }

    @Test
    void reads_file_argument_and_prints_summary() throws Exception {
        Path f = Files.createTempFile("tsv-cat", ".tsv");
        Files.writeString(f, "x\t\ny\t5\n");
        int code = run("", "-c", "k:text,v:long", "--summary", f.toString());
        assertEquals(0, code, err.toString());
        assertEquals("x\tnull\ny\t5\n", stdout());
        assertTrue(err.toString().contains("records=2"), err.toString());
        assertTrue(err.toString().contains("linesIn=2"), err.toString());
    }

    @Test
    void stops_at_limit() {
        int code = run("1\n2\n3\n", "-c", "integer", "--limit", "2");
        assertEquals(0, code);
        assertEquals("1\n2\n", stdout());
    }

    @Test
    void malformed_line_fails_with_exit_code_one() {
        int code = run("a\t1\nb\tx\nc\t3\n", "-c", "name:text,n:integer");
        assertEquals(1, code);
        assertEquals("a\t1\n", stdout());
        assertTrue(err.toString().contains("line 2"), err.toString());
    }

    @Test
    void skip_malformed_writes_dead_letters() throws Exception {
        Path dlq = Files.createTempDirectory("tsv-cat-dlq").resolve("dead.jsonl");
        int code = run("a\t1\nb\tx\nc\t3\n", "-c", "name:text,n:integer", "--skip-malformed", "--dead-letter", dlq.toString());
        assertEquals(0, code, err.toString());
        assertEquals("a\t1\nc\t3\n", stdout());
        List<String> dead = Files.readAllLines(dlq);
        assertEquals(1, dead.size());
        assertTrue(dead.get(0).contains("\"line\":2"), dead.get(0));
    }

    @Test
    void unusable_dead_letter_path_exits_with_two() throws Exception {
        Path notADir = Files.createTempFile("tsv-cat-plain", ".txt");
        int code = run("a\t1\n", "-c", "name:text,n:integer", "--skip-malformed",
                "--dead-letter", notADir.resolve("dead.jsonl").toString());
        assertEquals(2, code, err.toString());
        assertEquals("", stdout());
        assertTrue(err.toString().contains("cannot open dead-letter file"), err.toString());
    }

    @Test
    void custom_separator() {
        int code = run("a,1\n", "-c", "name:text,n:integer", "--separator", ",");
        assertEquals(0, code, err.toString());
        assertEquals("a\t1\n", stdout());
    }

    @Test
    void missing_file_exits_with_two() {
        int code = run("", "-c", "a:text", "no-such-file-" + System.nanoTime() + ".tsv");
        assertEquals(2, code);
        assertTrue(err.toString().contains("Cannot find file"), err.toString());
    }

    @Test
    void bad_options_exit_with_two() {
        assertEquals(2, run("", "-c", "a:uuid"));
        assertEquals(2, run("", "-c", "a:text", "--capacity", "0"));
    }
}
