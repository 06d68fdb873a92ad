/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.compiler;

import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.cloudway.reglex.compiler.spec.LexerSpecification;

/**
 * The result of compiling a lexer specification: one automaton for each
 * declared parser.
 */
public final class CompiledLexer {
    private final LexerSpecification spec;
    private final ImmutableList<CompiledParser> parsers;

    CompiledLexer(LexerSpecification spec, List<CompiledParser> parsers) {
        this.spec = spec;
        this.parsers = ImmutableList.copyOf(parsers);
    }

    public LexerSpecification specification() {
        return spec;
    }

    /**
     * Returns the compiled parsers in declaration order. The first one is
     * the default parser.
     */
    public ImmutableList<CompiledParser> parsers() {
        return parsers;
    }

    public Optional<CompiledParser> parser(String name) {
        return parsers.stream().filter(p -> p.name().equals(name)).findFirst();
    }
}
