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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.cloudway.reglex.compiler.automaton.Nfa.State;

import static com.cloudway.reglex.compiler.automaton.Nfa.EPSILON;
import static com.cloudway.reglex.compiler.automaton.TransitionTable.FAIL;
import static com.cloudway.reglex.runtime.Automaton.NONE;

/**
 * Turns an NFA into a DFA by simulating the NFA. Each DFA state stands for
 * a set of NFA states, and its tag is the merge of the tags of all
 * accepting NFA states in the set.
 */
final class SubsetConstruction {
    static final int NCOLS = CompiledAutomaton.ALPHABET_SIZE + 1;

    private final Nfa nfa;
    private final List<BitSet> dstates = new ArrayList<>();     /* DFA state table      */
    private final Map<BitSet, Integer> dmap = new HashMap<>();  /* NFA-set to DFA state */
    private final List<Integer> tags = new ArrayList<>();
    private int lastMarked;                                     /* Most-recently marked */

    private final TransitionTable dtran = new TransitionTable(NCOLS);

    SubsetConstruction(Nfa nfa) {
        this.nfa = nfa;
        makeDtran();
    }

    TransitionTable table() {
        return dtran;
    }

    int size() {
        return dstates.size();
    }

    int tag(int state) {
        return tags.get(state);
    }

    /**
     * Compute the epsilon closure set for the input states. The set is
     * updated with all states that can be reached by making epsilon
     * transitions from all NFA states in the input set. Returns the merged
     * tag of the accepting states in the output set, or NONE.
     */
    private int closure(BitSet nfaSet) {
        Deque<State> stack = new ArrayDeque<>();
        int tag = NONE;

        for (int i = nfaSet.nextSetBit(0); i >= 0; i = nfaSet.nextSetBit(i+1)) {
            stack.push(nfa.get(i));
        }

        while (!stack.isEmpty()) {
            State p = stack.pop();

            tag = Tags.merge(tag, p.tag);

            if (p.edge == EPSILON) {
                if (p.next != null && !nfaSet.get(p.next.num)) {
                    nfaSet.set(p.next.num);
                    stack.push(p.next);
                }
                if (p.next2 != null && !nfaSet.get(p.next2.num)) {
                    nfaSet.set(p.next2.num);
                    stack.push(p.next2);
                }
            }
        }

        return tag;
    }

    /**
     * Returns a set that contains all NFA states that can be reached by
     * making transitions on "c" from any NFA states in "inpset". Returns
     * null if there are no such transitions. The "inpset" is not modified.
     */
    private BitSet move(BitSet inpset, int c) {
        BitSet outset = null;

        for (int i = inpset.nextSetBit(0); i >= 0; i = inpset.nextSetBit(i+1)) {
            State p = nfa.get(i);

            if (p.edge != EPSILON && p.next != null && p.matches(c)) {
                if (outset == null)
                    outset = new BitSet();
                outset.set(p.next.num);
            }
        }

        return outset;
    }

    private void makeDtran() {
        BitSet nfaSet;
        int current;

        /* Initially dstates contains a single, unmarked, start state
         * formed by taking the epsilon closure of the NFA start state.
         * So, dstates[0] is the DFA start state.
         */
        nfaSet = new BitSet();
        if (nfa.start() != null)
            nfaSet.set(nfa.start().num);
        addToDstates(nfaSet, closure(nfaSet));
        dtran.set(0, 0, FAIL);

        while ((current = getUnmarked()) != NONE) {
            BitSet currentSet = dstates.get(current);

            for (int c = 0; c < NCOLS; c++) {
                int nextstate = FAIL;
                nfaSet = move(currentSet, c);
                if (nfaSet != null) {
                    int tag = closure(nfaSet);
                    nextstate = addToDstates(nfaSet, tag);
                }
                dtran.set(current, c, nextstate);
            }
        }
    }

    private int addToDstates(BitSet nfaSet, int tag) {
        // If there's a set in dstates that is identical to nfaSet, return
        // the index of the dstate entry.
        Integer existing = dmap.get(nfaSet);
        if (existing != null)
            return existing;

        int nextstate = dstates.size();
        dstates.add(nfaSet);
        tags.add(tag);
        dmap.put(nfaSet, nextstate);
        return nextstate;
    }

    /**
     * Returns an unmarked state in dstates. If no such state exists,
     * return NONE.
     */
    private int getUnmarked() {
        return lastMarked < dstates.size() ? lastMarked++ : NONE;
    }
}
