/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.runtime;

import static com.cloudway.reglex.runtime.Automaton.NONE;
import static com.cloudway.reglex.runtime.ReadAheadBuffer.EOI;

/**
 * A transition procedure that interprets an automaton directly, instead of
 * running generated code.
 */
public final class AutomatonProcedure implements TransitionProcedure {
    private final Automaton automaton;

    /**
     * Construct the procedure.
     *
     * @throws IllegalArgumentException if the start state is accepting
     */
    public AutomatonProcedure(Automaton automaton) {
        if (automaton.acceptTag(automaton.start()) != NONE)
            throw new IllegalArgumentException("start state must not be accepting");
        this.automaton = automaton;
    }

    @Override
    public ScanResult scan(ScanPrimitives p) {
        Automaton dfa = automaton;
        int state = dfa.start();
        int c, tag;

        while ((c = p.next()) != EOI && (state = dfa.transition(state, c)) != NONE) {
            if ((tag = dfa.acceptTag(state)) != NONE) {
                p.accept(tag);
            }
        }
        return p.reject();
    }
}
