/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.compiler.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import org.junit.Test;
import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import com.cloudway.reglex.compiler.CompiledLexer;
import com.cloudway.reglex.compiler.LexerCompiler;
import com.cloudway.reglex.compiler.spec.SpecificationParser;

public class JavaLexerGeneratorTest {
    private static final String SPEC =
        "import java.util.ArrayList;\n" +
        "%%\n" +
        "emit_main emit_input_fs_var\n" +
        "%%\n" +
        "%%\n" +
        "[a-z]+ %{ words.add(lexeme()); %}\n" +
        "\\\"   %{ switchTo(\"string\"); %}\n" +
        "\\s    %{ return; %}\n" +
        "%{string%}\n" +
        "[^\\\"]+ %{ strings.add(lexeme()); %}\n" +
        "\\\"   %{ switchTo(\"default\"); %}\n" +
        "%%\n" +
        "    final ArrayList<String> words = new ArrayList<>();\n" +
        "    final ArrayList<String> strings = new ArrayList<>();\n";

    private static CompiledLexer compile(String text) {
        return LexerCompiler.compile(SpecificationParser.parse(text));
    }

    @Test
    public void generatesLexerClass() {
        String code = new JavaLexerGenerator()
            .packageName("org.example.lex")
            .className("WordLexer")
            .version("1.0")
            .generate(compile(SPEC));

        assertThat(code, startsWith("package org.example.lex;\n"));
        assertThat(code, containsString("import com.cloudway.reglex.runtime.ScanSession;\n"));
        assertThat(code, containsString("import java.util.ArrayList;\n"));
        assertThat(code, containsString("Generated by reglex 1.0."));
        assertThat(code, containsString("public class WordLexer extends ScanSession {"));

        // the parser table in declaration order
        int def = code.indexOf("ParserSpec.of(\"default\", WordLexer::scan_default,");
        int str = code.indexOf("ParserSpec.of(\"string\", WordLexer::scan_string,");
        assertTrue(def > 0 && str > def);
        assertThat(code, containsString("((WordLexer)session).perform_string(tag)"));

        assertThat(code, containsString("super(PARSERS, new InputStreamReader(System.in, StandardCharsets.UTF_8), \"<stdin>\");"));
        assertThat(code, containsString("public WordLexer(Reader input, String name) {"));
        assertThat(code, containsString("private static ScanResult scan_default(ScanPrimitives p) {\n        int state = 0, c;\n"));
        assertThat(code, containsString("private static ScanResult scan_string(ScanPrimitives p) {"));
        assertThat(code, containsString("case 1:\n            action_default_1();\n            break;"));
        assertThat(code, containsString("private void action_default_2() {\n return; \n    }"));
        assertThat(code, containsString("private void action_string_0() {\n strings.add(lexeme()); \n    }"));
        assertThat(code, containsString("System.exit(new WordLexer().scan());"));

        // the trailing code goes into the class body
        int epilogue = code.indexOf("final ArrayList<String> strings");
        assertTrue(epilogue > code.indexOf("public static void main"));
        assertThat(code.trim(), endsWith("}"));
        assertEquals(code.lastIndexOf('}'), code.trim().length() - 1);
        assertTrue(epilogue < code.lastIndexOf('}'));
    }

    @Test
    public void instructionsAreOptional() {
        String code = new JavaLexerGenerator().generate(compile("%%\n%%\n%%\nx %{ %}\n%%\n"));

        assertThat(code, startsWith("import java.io.InputStreamReader;"));
        assertThat(code, containsString("public class Lexer extends ScanSession {"));
        assertThat(code, not(containsString("public static void main")));
        assertThat(code, not(containsString("Reader input, String name")));
        assertThat(code, not(containsString("package ")));
    }

    @Test
    public void inputNameIsQuoted() {
        String code = new JavaLexerGenerator()
            .inputName("standard \"input\"")
            .generate(compile("%%\n%%\n%%\nx %{ %}\n%%\n"));
        assertThat(code, containsString("UTF_8), \"standard \\\"input\\\"\");"));
    }

    @Test
    public void engineLogsNoWarnings() {
        // Velocity logs through slf4j-jdk14 into this logger tree
        Logger velocityLog = Logger.getLogger("org.apache.velocity");
        List<String> warnings = new ArrayList<>();
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                if (record.getLevel().intValue() >= Level.WARNING.intValue())
                    warnings.add(record.getMessage());
            }
            @Override public void flush() {}
            @Override public void close() {}
        };

        velocityLog.addHandler(handler);
        try {
            new JavaLexerGenerator().generate(compile(SPEC));
        } finally {
            velocityLog.removeHandler(handler);
        }
        assertThat(warnings, is(Collections.<String>emptyList()));
    }

    @Test
    public void quote() {
        assertEquals("\"a\\\\b\\n\"", JavaLexerGenerator.quote("a\\b\n"));
        assertEquals("\"\\001\"", JavaLexerGenerator.quote("\u0001"));
        assertEquals("\"\\u00e9\"", JavaLexerGenerator.quote("\u00e9"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidClassName() {
        new JavaLexerGenerator().className("my-lexer");
    }

    @Test(expected = IllegalArgumentException.class)
    public void keywordIsNotClassName() {
        new JavaLexerGenerator().className("class");
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidPackageName() {
        new JavaLexerGenerator().packageName("org..example");
    }
}
