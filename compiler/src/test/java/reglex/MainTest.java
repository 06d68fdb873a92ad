/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package reglex;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import com.google.common.io.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

public class MainTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static final String SPEC =
        "%%\n" +
        "emit_main\n" +
        "%%\n" +
        "%%\n" +
        "[a-z]+ %{ System.out.println(lexeme()); %}\n" +
        "\\s+   %{ %}\n" +
        "%%\n";

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String stdin, String... args) {
        InputStream in = new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8));
        return Main.run(args, in,
                        new PrintStream(out, true),
                        new PrintStream(err, true));
    }

    private String out() {
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    private String err() {
        return new String(err.toByteArray(), StandardCharsets.UTF_8);
    }

    private File write(String name, String text) throws IOException {
        File file = folder.newFile(name);
        Files.asCharSink(file, StandardCharsets.UTF_8).write(text);
        return file;
    }

    @Test
    public void readsStandardInput() {
        assertEquals(0, run(SPEC));
        assertThat(out(), containsString("public class Lexer extends ScanSession"));
        assertThat(out(), containsString("public static void main(String[] args)"));
        assertEquals("", err());
    }

    @Test
    public void dashMeansStandardInput() {
        assertEquals(0, run(SPEC, "-"));
        assertThat(out(), containsString("public class Lexer extends ScanSession"));
    }

    @Test
    public void writesOutputFile() throws IOException {
        File spec = write("words.rl", SPEC);
        File output = new File(folder.getRoot(), "WordLexer.java");

        assertEquals(0, run("", "-o", output.getPath(), spec.getPath()));
        assertEquals("", out());

        String code = Files.asCharSource(output, StandardCharsets.UTF_8).read();
        assertThat(code, containsString("public class WordLexer extends ScanSession"));
    }

    @Test
    public void concatenatesInputs() throws IOException {
        File head = write("head.rl", "%%\n%%\n");
        File tail = write("tail.rl", "%%\nabc %{ %}\n%%\n");

        assertEquals(0, run("", head.getPath(), tail.getPath()));
        assertThat(out(), containsString("if (c == 'a')"));
    }

    @Test
    public void reportsErrorLocationInInput() throws IOException {
        File head = write("head.rl", "%%\n%%\n");
        File tail = write("tail.rl", "%%\nabc %{ %}\n  x* %{ %}\n%%\n");

        assertEquals(2, run("", head.getPath(), tail.getPath()));
        assertThat(err(), startsWith(tail.getPath() + ":3:3: no token expressions may accept an empty string"));
        assertEquals("", out());
    }

    @Test
    public void reportsErrorOnSharedLine() throws IOException {
        // the first input does not end with a newline
        File head = write("head.rl", "%%\nemit_main");
        File tail = write("tail.rl", " bogus\n%%\n%%\na %{ %}\n%%\n");

        assertEquals(2, run("", head.getPath(), tail.getPath()));
        assertThat(err(), startsWith(tail.getPath() + ":1:2: invalid instruction 'bogus'"));
    }

    @Test
    public void reportsErrorBeforeSharedLine() throws IOException {
        File head = write("head.rl", "%%\nbogus emit_main");
        File tail = write("tail.rl", " emit_main\n%%\n%%\na %{ %}\n%%\n");

        assertEquals(2, run("", head.getPath(), tail.getPath()));
        assertThat(err(), startsWith(head.getPath() + ":2:1: invalid instruction 'bogus'"));
    }

    @Test
    public void reportsErrorInStandardInput() {
        assertEquals(2, run("%%\nbogus\n%%\n%%\n%%\n"));
        assertThat(err(), startsWith("<stdin>:2:1: invalid instruction 'bogus'"));
    }

    @Test
    public void missingFile() {
        assertEquals(2, run("", new File(folder.getRoot(), "nothing.rl").getPath()));
        assertThat(err(), startsWith("reglex: "));
    }

    @Test
    public void unknownOption() {
        assertEquals(1, run(SPEC, "-x"));
        assertThat(err(), containsString("usage: reglex"));
    }

    @Test
    public void invalidClassName() {
        assertEquals(1, run(SPEC, "-o", new File(folder.getRoot(), "my-lexer.java").getPath()));
        assertThat(err(), containsString("invalid class name: my-lexer"));
    }

    @Test
    public void version() {
        assertEquals(0, run("", "-v"));
        assertThat(out(), startsWith("reglex "));
    }

    @Test
    public void help() {
        assertEquals(0, run("", "--help"));
        assertThat(out(), containsString("usage: reglex"));
        assertThat(out(), containsString("--output <FILE>"));
    }

    @Test
    public void debugDumpsAutomata() {
        assertEquals(0, run(SPEC, "-d"));
        assertThat(err(), containsString("parser default"));
        assertThat(err(), containsString("(START STATE)"));
    }

    @Test
    public void classNameFromOutputFile() {
        assertEquals("Foo", Main.className("/tmp/out/Foo.java"));
        assertEquals("Foo", Main.className("Foo"));
    }
}
