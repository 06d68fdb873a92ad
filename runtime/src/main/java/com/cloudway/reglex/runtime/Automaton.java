/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.runtime;

/**
 * A deterministic automaton with tagged accepting states.
 *
 * <p>States are dense integers starting at 0. When states of several
 * patterns are merged, the surviving tag is the smallest one, so the
 * earliest declared pattern wins among matches of equal length.</p>
 */
public interface Automaton {
    /**
     * Marks the absence of a transition or of an accepting tag.
     */
    int NONE = -1;

    /**
     * Returns the start state.
     */
    int start();

    /**
     * Returns the number of states.
     */
    int size();

    /**
     * Returns the successor of a state on a character, or {@link #NONE}.
     */
    int transition(int state, int c);

    /**
     * Returns the tag of an accepting state, or {@link #NONE} if the state
     * is not accepting.
     */
    int acceptTag(int state);
}
