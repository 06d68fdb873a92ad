/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.compiler.automaton;

import static com.cloudway.reglex.runtime.Automaton.NONE;

/**
 * Accepting tags of automaton states.
 */
final class Tags {
    private Tags() {}

    /**
     * Merge the tags of two states that are represented by a single state.
     * The smallest, that is the earliest declared, tag survives.
     */
    static int merge(int a, int b) {
        if (a == NONE)
            return b;
        if (b == NONE)
            return a;
        return Math.min(a, b);
    }

    static String toString(int tag) {
        return tag == NONE ? "-" : String.valueOf(tag);
    }
}
