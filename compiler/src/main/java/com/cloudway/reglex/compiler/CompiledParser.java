/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.compiler;

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.cloudway.reglex.compiler.automaton.CompiledAutomaton;
import com.cloudway.reglex.compiler.spec.ParserDecl;
import com.cloudway.reglex.compiler.spec.TokenRule;
import com.cloudway.reglex.runtime.Action;
import com.cloudway.reglex.runtime.ParserSpec;

/**
 * A parser declaration together with its compiled automaton.
 */
public final class CompiledParser {
    private final ParserDecl decl;
    private final CompiledAutomaton automaton;

    CompiledParser(ParserDecl decl, CompiledAutomaton automaton) {
        this.decl = decl;
        this.automaton = automaton;
    }

    public String name() {
        return decl.name();
    }

    public List<TokenRule> rules() {
        return decl.rules();
    }

    public CompiledAutomaton automaton() {
        return automaton;
    }

    /**
     * Create a runtime parser that interprets the automaton directly.
     *
     * @param actions the actions indexed by tag, one for each rule
     */
    public ParserSpec toParserSpec(List<? extends Action> actions) {
        Preconditions.checkArgument(actions.size() == decl.rules().size(),
            "parser %s has %s rules but %s actions were given",
            decl.name(), decl.rules().size(), actions.size());
        return ParserSpec.of(decl.name(), automaton, actions);
    }

    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("name", name())
            .add("rules", rules().size())
            .add("states", automaton.size())
            .toString();
    }
}
