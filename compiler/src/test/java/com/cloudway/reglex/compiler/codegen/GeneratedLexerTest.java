/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.compiler.codegen;

import java.io.File;
import java.io.Reader;
import java.io.StringReader;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;

import com.google.common.collect.ImmutableSet;
import com.google.common.io.Files;
import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.junit.ClassRule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;
import static org.junit.Assume.assumeNotNull;
import static org.hamcrest.CoreMatchers.*;

import com.cloudway.reglex.compiler.LexerCompiler;
import com.cloudway.reglex.compiler.spec.SpecificationParser;
import com.cloudway.reglex.runtime.ParserSpec;
import com.cloudway.reglex.runtime.ScanResult;
import com.cloudway.reglex.runtime.ScanSession;

/**
 * Compiles a generated lexer with the system Java compiler and scans
 * through the loaded class.
 */
public class GeneratedLexerTest {
    @ClassRule
    public static TemporaryFolder folder = new TemporaryFolder();

    private static final String SPEC =
        "import java.util.ArrayList;\n" +
        "%%\n" +
        "emit_main emit_input_fs_var\n" +
        "%%\n" +
        "%%\n" +
        "aba       %{ token(\"ABA\"); %}\n" +
        "a         %{ token(\"A\"); %}\n" +
        "b         %{ token(\"B\"); %}\n" +
        "x\\ny\\nz   %{ token(\"XYZ\"); %}\n" +
        "x         %{ token(\"X\"); %}\n" +
        "y         %{ token(\"Y\"); %}\n" +
        "\\n       %{ %}\n" +
        "\\#       %{ token(\"HASH\"); switchTo(\"pair\"); %}\n" +
        "%{pair%}\n" +
        "ab        %{ token(\"AB\"); %}\n" +
        "a(b)      %{ token(\"A(B)\"); %}\n" +
        "\\#       %{ switchTo(\"default\"); return; %}\n" +
        "%%\n" +
        "    public final List<String> tokens = new ArrayList<>();\n" +
        "\n" +
        "    private void token(String kind) {\n" +
        "        tokens.add(kind + \" \" + lexeme() + \"@\" + line() + \":\" + column());\n" +
        "    }\n";

    private static URLClassLoader loader;
    private static Class<?> lexerClass;

    @BeforeClass
    public static void compileLexer() throws Exception {
        JavaCompiler javac = ToolProvider.getSystemJavaCompiler();
        assumeNotNull(javac);

        String code = new JavaLexerGenerator()
            .packageName("org.example.lex")
            .className("TestLexer")
            .generate(LexerCompiler.compile(SpecificationParser.parse(SPEC)));

        File source = new File(folder.newFolder("src"), "TestLexer.java");
        File classes = folder.newFolder("classes");
        Files.asCharSink(source, StandardCharsets.UTF_8).write(code);

        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        try (StandardJavaFileManager fm = javac.getStandardFileManager(diagnostics, null, StandardCharsets.UTF_8)) {
            List<String> options = Arrays.asList("-d", classes.getPath(), "-classpath", classpath());
            boolean success = javac.getTask(null, fm, diagnostics, options, null,
                                            fm.getJavaFileObjects(source)).call();
            assertTrue(diagnostics.getDiagnostics() + "\n" + code, success);
        }

        loader = new URLClassLoader(new URL[] { classes.toURI().toURL() },
                                    GeneratedLexerTest.class.getClassLoader());
        lexerClass = loader.loadClass("org.example.lex.TestLexer");
    }

    @AfterClass
    public static void closeLoader() throws Exception {
        if (loader != null)
            loader.close();
    }

    /**
     * The generated class needs the runtime classes and the libraries
     * they expose in their signatures.
     */
    private static String classpath() throws Exception {
        Set<String> paths = new LinkedHashSet<>();
        for (Class<?> c : Arrays.asList(ScanSession.class, ImmutableSet.class))
            paths.add(new File(c.getProtectionDomain().getCodeSource().getLocation().toURI()).getPath());
        paths.add(System.getProperty("java.class.path"));
        return String.join(File.pathSeparator, paths);
    }

    private static ScanSession lexer(String input) throws Exception {
        return (ScanSession)lexerClass.getConstructor(Reader.class, String.class)
                                      .newInstance(new StringReader(input), "test");
    }

    @SuppressWarnings("unchecked")
    private static List<String> tokens(ScanSession lexer) throws Exception {
        return (List<String>)lexerClass.getField("tokens").get(lexer);
    }

    @Test
    public void generatedClassIsASession() throws Exception {
        ScanSession lexer = lexer("");
        assertEquals(ImmutableSet.of(ParserSpec.DEFAULT, "pair"), lexer.parsers());
        assertNotNull(lexerClass.getMethod("main", String[].class));
        assertNotNull(lexerClass.getConstructor());
        assertEquals(ScanResult.END, lexer.scanToken());
    }

    @Test
    public void longestMatchResumesAfterFailedAttempt() throws Exception {
        ScanSession lexer = lexer("ab");

        assertEquals(0, lexer.scan());
        assertThat(tokens(lexer), is(Arrays.asList("A a@1:1", "B b@1:2")));
        assertEquals(0, lexer.scan());
        assertEquals(2, tokens(lexer).size());
    }

    @Test
    public void equalLengthMatchPrefersEarlierRule() throws Exception {
        ScanSession lexer = lexer("#ab");

        assertEquals(ScanResult.TOKEN, lexer.scanToken());
        assertEquals("pair", lexer.activeParser());
        assertEquals(ScanResult.TOKEN, lexer.scanToken());
        assertEquals("ab", lexer.lexeme());
        assertEquals(0, lexer.tag());
        assertThat(tokens(lexer), is(Arrays.asList("HASH #@1:1", "AB ab@1:2")));
    }

    @Test
    public void actionsSwitchParsersKeepingLookahead() throws Exception {
        ScanSession lexer = lexer("#ab#aba");

        assertEquals(0, lexer.scan());
        assertThat(tokens(lexer), is(Arrays.asList("HASH #@1:1", "AB ab@1:2", "ABA aba@1:5")));
        assertEquals(ParserSpec.DEFAULT, lexer.activeParser());
    }

    @Test
    public void stuckInput() throws Exception {
        ScanSession lexer = lexer("ac");

        assertEquals(ScanResult.TOKEN, lexer.scanToken());
        assertEquals(ScanResult.STUCK, lexer.scanToken());
        assertEquals("", lexer.lexeme());
        assertEquals("c", lexer.pending());
        assertEquals(2, lexer.column());
        assertEquals(1, lexer.scan());
        assertThat(tokens(lexer), is(Arrays.asList("A a@1:1")));
    }

    @Test
    public void rollbackAcrossNewlineRestoresPosition() throws Exception {
        ScanSession lexer = lexer("x\ny\nx\ny\nz");

        assertEquals(0, lexer.scan());
        assertThat(tokens(lexer), is(Arrays.asList(
            "X x@1:1", "Y y@2:1", "XYZ x\ny\nz@3:1")));
    }
}
