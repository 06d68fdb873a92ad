/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.runtime;

import java.util.List;
import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * A named set of token patterns, compiled into one transition procedure,
 * together with the actions of its patterns. This is the unit of runtime
 * switching. Instances are immutable.
 */
public final class ParserSpec {
    /**
     * The name of the parser whose patterns are declared without a header.
     */
    public static final String DEFAULT = "default";

    private final String name;
    private final TransitionProcedure procedure;
    private final ActionTable actions;

    private ParserSpec(String name, TransitionProcedure procedure, ActionTable actions) {
        this.name = Objects.requireNonNull(name);
        this.procedure = Objects.requireNonNull(procedure);
        this.actions = Objects.requireNonNull(actions);
    }

    /**
     * Create a parser from a transition procedure and an action dispatcher.
     */
    public static ParserSpec of(String name, TransitionProcedure procedure, ActionTable actions) {
        return new ParserSpec(name, procedure, actions);
    }

    /**
     * Create a parser that interprets the given automaton.
     *
     * @param name the parser name
     * @param automaton the automaton of the parser
     * @param actions the actions indexed by tag
     * @throws IllegalArgumentException if the automaton accepts the empty string
     */
    public static ParserSpec of(String name, Automaton automaton, List<? extends Action> actions) {
        return new ParserSpec(name, new AutomatonProcedure(automaton), ActionTable.of(actions));
    }

    public String name() {
        return name;
    }

    public TransitionProcedure procedure() {
        return procedure;
    }

    public ActionTable actions() {
        return actions;
    }

    public String toString() {
        return MoreObjects.toStringHelper(this).add("name", name).toString();
    }
}
