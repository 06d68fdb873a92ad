/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.compiler.automaton;

import java.util.HashMap;
import java.util.Map;

import com.google.common.primitives.ImmutableIntArray;

import static com.cloudway.reglex.compiler.automaton.TransitionTable.FAIL;

/**
 * Minimize a DFA by partition refinement. The initial partition puts states
 * with the same tag into the same group, then groups are split until all
 * states in a group have transitions into the same groups on every column.
 * The group that holds the start state becomes the start state 0.
 */
final class Minimizer {
    private final TransitionTable table;
    private final int[] tags;
    private int ngroups;

    Minimizer(SubsetConstruction dfa) {
        int nstates = dfa.size();
        TransitionTable dtran = dfa.table();
        int[] group = initialPartition(dfa);

        // Refine until the number of groups is stable. A split never merges
        // groups so an unchanged count means an unchanged partition.
        for (;;) {
            Map<ImmutableIntArray, Integer> signatures = new HashMap<>();
            int[] next = new int[nstates];

            for (int s = 0; s < nstates; s++) {
                ImmutableIntArray.Builder sig = ImmutableIntArray.builder(dtran.columns() + 1);
                sig.add(group[s]);
                for (int c = 0; c < dtran.columns(); c++) {
                    int t = dtran.get(s, c);
                    sig.add(t == FAIL ? FAIL : group[t]);
                }
                next[s] = signatures.computeIfAbsent(sig.build(), k -> signatures.size());
            }

            boolean stable = signatures.size() == ngroups;
            group = next;
            ngroups = signatures.size();
            if (stable)
                break;
        }

        // Build the minimized machine from one representative of each group.
        table = new TransitionTable(dtran.columns(), ngroups);
        tags = new int[ngroups];

        boolean[] done = new boolean[ngroups];
        for (int s = 0; s < nstates; s++) {
            int g = group[s];
            if (done[g]) {
                tags[g] = Tags.merge(tags[g], dfa.tag(s));
                continue;
            }
            done[g] = true;
            tags[g] = dfa.tag(s);
            for (int c = 0; c < dtran.columns(); c++) {
                int t = dtran.get(s, c);
                table.set(g, c, t == FAIL ? FAIL : group[t]);
            }
        }
    }

    private int[] initialPartition(SubsetConstruction dfa) {
        Map<Integer, Integer> byTag = new HashMap<>();
        int[] group = new int[dfa.size()];
        for (int s = 0; s < dfa.size(); s++) {
            group[s] = byTag.computeIfAbsent(dfa.tag(s), k -> byTag.size());
        }
        ngroups = byTag.size();
        return group;
    }

    TransitionTable table() {
        return table;
    }

    int tag(int state) {
        return tags[state];
    }

    int size() {
        return ngroups;
    }
}
