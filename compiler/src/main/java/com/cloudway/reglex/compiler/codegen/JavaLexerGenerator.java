/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.compiler.codegen;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Logger;

import javax.lang.model.SourceVersion;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.apache.velocity.VelocityContext;
import org.apache.velocity.app.VelocityEngine;

import com.cloudway.reglex.compiler.CompiledLexer;
import com.cloudway.reglex.compiler.CompiledParser;
import com.cloudway.reglex.compiler.spec.Instruction;
import com.cloudway.reglex.compiler.spec.LexerSpecification;
import com.cloudway.reglex.compiler.spec.TokenRule;

/**
 * Generates the Java source of a lexer class from a compiled lexer. The
 * source is rendered by a Velocity template. Each parser becomes a static
 * transition procedure and an action dispatcher, and all parsers are wired
 * into a parser table that the generated class hands to its
 * {@link com.cloudway.reglex.runtime.ScanSession} superclass.
 */
public final class JavaLexerGenerator {
    private static final Logger logger = Logger.getLogger(JavaLexerGenerator.class.getName());

    private static final String TEMPLATE = "lexer.java.vm";

    private final VelocityEngine ve;
    private String packageName = "";
    private String className = "Lexer";
    private String inputName = "<stdin>";
    private String version = "unknown";

    public JavaLexerGenerator() {
        ve = new VelocityEngine();

        // Configuring velocity engine.
        Properties vconf = new Properties();
        try (InputStream ins = getClass().getResourceAsStream("velocity.properties")) {
            vconf.load(ins);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        ve.init(vconf);
    }

    /**
     * Set the package of the generated class, empty for the unnamed package.
     */
    public JavaLexerGenerator packageName(String name) {
        Preconditions.checkArgument(name.isEmpty() || SourceVersion.isName(name),
            "invalid package name: %s", name);
        this.packageName = name;
        return this;
    }

    /**
     * Set the simple name of the generated class.
     */
    public JavaLexerGenerator className(String name) {
        Preconditions.checkArgument(SourceVersion.isIdentifier(name) && !SourceVersion.isKeyword(name),
            "invalid class name: %s", name);
        this.className = name;
        return this;
    }

    /**
     * Set the display name of the standard input in the generated class.
     */
    public JavaLexerGenerator inputName(String name) {
        this.inputName = Objects.requireNonNull(name);
        return this;
    }

    /**
     * Set the tool version recorded in the generated source.
     */
    public JavaLexerGenerator version(String version) {
        this.version = Objects.requireNonNull(version);
        return this;
    }

    /**
     * Generate the lexer source to a writer.
     */
    public void generate(CompiledLexer lexer, Writer writer) throws IOException {
        VelocityContext vc = new VelocityContext();
        vc.put("lexer", new LexerModel(lexer));

        try (Reader reader = new InputStreamReader(
                getClass().getResourceAsStream(TEMPLATE), StandardCharsets.UTF_8)) {
            ve.evaluate(vc, writer, TEMPLATE, reader);
        }
        writer.flush();

        logger.fine(() -> String.format("generated class %s with %d parsers",
                                        className, lexer.parsers().size()));
    }

    /**
     * Generate the lexer source as a string.
     */
    public String generate(CompiledLexer lexer) {
        StringWriter writer = new StringWriter();
        try {
            generate(lexer, writer);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return writer.toString();
    }

    /**
     * Returns a Java string literal for the given text.
     */
    static String quote(String text) {
        StringBuilder buf = new StringBuilder("\"");
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
            case '"':  buf.append("\\\""); break;
            case '\\': buf.append("\\\\"); break;
            case '\n': buf.append("\\n"); break;
            case '\r': buf.append("\\r"); break;
            case '\t': buf.append("\\t"); break;
            default:
                if (c < ' ') {
                    buf.append(String.format("\\%03o", (int)c));
                } else if (c >= 0x7f) {
                    buf.append(String.format("\\u%04x", (int)c));
                } else {
                    buf.append(c);
                }
            }
        }
        return buf.append('"').toString();
    }

    /*------------------------------------------------------------------------
     * Template model. The getters are invoked by the template.
     */

    public final class LexerModel {
        private final LexerSpecification spec;
        private final ImmutableList<ParserModel> parsers;

        LexerModel(CompiledLexer lexer) {
            this.spec = lexer.specification();
            this.parsers = lexer.parsers().stream()
                .map(ParserModel::new)
                .collect(ImmutableList.toImmutableList());
        }

        public boolean hasPackage() {
            return !packageName.isEmpty();
        }

        public String getPackageName() {
            return packageName;
        }

        public String getClassName() {
            return className;
        }

        public String getInputName() {
            return quote(inputName);
        }

        public String getVersion() {
            return version;
        }

        public String getPrologue() {
            return spec.prologue();
        }

        public String getEpilogue() {
            return spec.epilogue();
        }

        public boolean isEmitMain() {
            return spec.has(Instruction.EMIT_MAIN);
        }

        public boolean isEmitInputFsVar() {
            return spec.has(Instruction.EMIT_INPUT_FS_VAR);
        }

        public List<ParserModel> getParsers() {
            return parsers;
        }
    }

    public static final class ParserModel {
        private final CompiledParser parser;

        ParserModel(CompiledParser parser) {
            this.parser = parser;
        }

        public String getName() {
            return parser.name();
        }

        public String getProcedure() {
            return TransitionWriter.write(parser.automaton(), 2);
        }

        public List<TokenRule> getRules() {
            return parser.rules();
        }
    }
}
