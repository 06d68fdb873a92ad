/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.compiler.automaton;

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.cloudway.reglex.runtime.Automaton;

import static com.cloudway.reglex.compiler.automaton.TransitionTable.FAIL;

/**
 * A minimal deterministic automaton with tagged accepting states. The
 * alphabet is compressed into character classes: all characters of a
 * class have the same transitions from every state. All characters
 * beyond Latin-1 belong to the class of the {@link #OTHER} column.
 */
public final class CompiledAutomaton implements Automaton {
    /** Number of distinct characters in the alphabet. */
    public static final int ALPHABET_SIZE = 256;

    /** The column that stands for every character outside of the alphabet. */
    public static final int OTHER = ALPHABET_SIZE;

    private final int[] classMap;           /* column to character class */
    private final int nclasses;             /* number of character classes */
    private final TransitionTable table;    /* state x class transitions */
    private final int[] tags;               /* accepting tags */

    CompiledAutomaton(Minimizer dfa) {
        TransitionTable dtran = dfa.table();
        this.classMap = new int[dtran.columns()];
        this.nclasses = dtran.classify(classMap);
        this.table = dtran.squash(classMap, nclasses);
        this.tags = new int[dfa.size()];
        for (int s = 0; s < tags.length; s++) {
            tags[s] = dfa.tag(s);
        }
    }

    @Override
    public int start() {
        return 0;
    }

    @Override
    public int size() {
        return tags.length;
    }

    /**
     * Returns the number of character classes.
     */
    public int classes() {
        return nclasses;
    }

    /**
     * Returns the character class of a character.
     */
    public int classOf(int c) {
        return classMap[c < ALPHABET_SIZE ? c : OTHER];
    }

    /**
     * Returns the successor of a state on a character class, or {@link #NONE}.
     */
    public int target(int state, int cls) {
        int next = table.get(state, cls);
        return next == FAIL ? NONE : next;
    }

    @Override
    public int transition(int state, int c) {
        if (c < 0)
            return NONE;
        return target(state, classOf(c));
    }

    @Override
    public int acceptTag(int state) {
        return tags[state];
    }

    /**
     * Returns the outgoing transitions of a state as ranges of characters,
     * ordered by character. Adjacent characters that move to the same state
     * are folded into one range. The last range may extend to
     * {@link Character#MAX_VALUE}.
     */
    public List<Edge> edges(int state) {
        ImmutableList.Builder<Edge> edges = ImmutableList.builder();
        int lo = 0, target = transition(state, 0);

        for (int c = 1; c <= ALPHABET_SIZE; c++) {
            int t = transition(state, c);
            if (t != target) {
                if (target != NONE)
                    edges.add(new Edge(lo, c - 1, target));
                lo = c;
                target = t;
            }
        }
        if (target != NONE)
            edges.add(new Edge(lo, Character.MAX_VALUE, target));
        return edges.build();
    }

    /**
     * A transition on a range of characters.
     */
    public static final class Edge {
        private final int first;
        private final int last;
        private final int target;

        Edge(int first, int last, int target) {
            this.first = first;
            this.last = last;
            this.target = target;
        }

        /** Returns the first character of the range. */
        public int first() {
            return first;
        }

        /** Returns the last character of the range, inclusive. */
        public int last() {
            return last;
        }

        public int target() {
            return target;
        }

        public boolean isSingle() {
            return first == last;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj)
                return true;
            if (!(obj instanceof Edge))
                return false;
            Edge other = (Edge)obj;
            return first == other.first && last == other.last && target == other.target;
        }

        @Override
        public int hashCode() {
            return (first * 31 + last) * 31 + target;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                .add("first", first)
                .add("last", last)
                .add("target", target)
                .toString();
        }
    }
}
