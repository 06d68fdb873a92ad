/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.compiler.automaton;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

import com.cloudway.reglex.runtime.Automaton;

/**
 * A Thompson NFA. The states are allocated from an array, so the machine
 * can also be considered as an array where the state number is the array
 * index. Discarded states are recycled.
 */
final class Nfa {
    /* Non-character values of State.edge */
    static final int EPSILON  = -1;
    static final int CCL      = -2;
    static final int EMPTY    = -3;

    /* The column that stands for all characters beyond Latin-1 */
    static final int OTHER    = CompiledAutomaton.OTHER;

    /* The NFA state */
    static final class State
    {
        int         num;            /* The state number of this node.        */
        int         edge;           /* Label for edge: character, CCL, EMPTY */
                                    /* or EPSILON. */
        BitSet      bitset;         /* Set to store character classes.       */
        boolean     compl;          /* is a negative character class set.    */
        State       next;           /* Next state (or null if none)          */
        State       next2;          /* Another next state if edge==EPSILON   */
        int         tag;            /* NONE if not an accepting state, else  */
                                    /* the tag of the pattern                */

        State       end;            /* temporarily used for machine building */

        /**
         * Returns true if this state moves on the given alphabet column.
         */
        boolean matches(int c) {
            if (edge == CCL)
                return bitset.get(c) ^ compl;
            return edge == c;
        }
    }

    private final List<State> states = new ArrayList<>();
    private final Deque<State> free = new ArrayDeque<>();
    private State start;

    State newState() {
        State p;

        if (free.isEmpty()) {
            p = new State();
            p.num = states.size();
            states.add(p);
        } else {
            p = free.pop();
        }

        p.edge = EPSILON;
        p.tag  = Automaton.NONE;
        return p;
    }

    void discard(State p) {
        p.edge   = EMPTY;
        p.bitset = null;
        p.compl  = false;
        p.next   = null;
        p.next2  = null;
        p.tag    = Automaton.NONE;
        p.end    = null;
        free.push(p);
    }

    /**
     * Join the machine of a pattern to the start state with an epsilon
     * transition.
     */
    void join(State machine) {
        State p;

        if (start == null) {
            p = start = newState();
        } else {
            p = start.end;
            p.next2 = newState();
            p = p.next2;
        }
        start.end = p;
        p.next = machine;
    }

    State start() {
        return start;
    }

    State get(int num) {
        return states.get(num);
    }

    /**
     * Returns the number of allocated states, including discarded ones.
     */
    int size() {
        return states.size();
    }

    /**
     * Returns the number of live states.
     */
    int liveStates() {
        return states.size() - free.size();
    }
}
