/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.compiler;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import com.cloudway.reglex.compiler.automaton.AutomatonBuilder;
import com.cloudway.reglex.compiler.automaton.CompiledAutomaton;
import com.cloudway.reglex.compiler.automaton.LexError;
import com.cloudway.reglex.compiler.spec.LexerSpecification;
import com.cloudway.reglex.compiler.spec.ParserDecl;
import com.cloudway.reglex.compiler.spec.SpecError;
import com.cloudway.reglex.compiler.spec.TokenRule;
import com.cloudway.reglex.runtime.Automaton;

/**
 * Compiles the rules of every parser in a specification into a minimal
 * deterministic automaton.
 */
public final class LexerCompiler {
    private static final Logger logger = Logger.getLogger(LexerCompiler.class.getName());

    private LexerCompiler() {}

    /**
     * Compile a lexer specification.
     *
     * @throws SpecError if a pattern is malformed or accepts the empty string
     */
    public static CompiledLexer compile(LexerSpecification spec) {
        List<CompiledParser> parsers = new ArrayList<>();
        for (ParserDecl decl : spec.parsers()) {
            parsers.add(new CompiledParser(decl, compile(spec, decl)));
        }
        return new CompiledLexer(spec, parsers);
    }

    private static CompiledAutomaton compile(LexerSpecification spec, ParserDecl decl) {
        AutomatonBuilder builder = new AutomatonBuilder();
        spec.definitions().forEach(builder::define);

        for (TokenRule rule : decl.rules()) {
            try {
                builder.pattern(rule.pattern());
            } catch (LexError ex) {
                throw new SpecError(rule.location(), ex.getMessage(), ex);
            }
        }

        try {
            CompiledAutomaton automaton = builder.build();
            logger.fine(() -> String.format("parser %s: %d rules, %d states",
                decl.name(), decl.rules().size(), automaton.size()));
            return automaton;
        } catch (LexError ex) {
            TokenRule rule = ex.getTag() != Automaton.NONE
                ? decl.rules().get(ex.getTag())
                : decl.rules().get(0);
            throw new SpecError(rule.location(), ex.getMessage(), ex);
        }
    }
}
