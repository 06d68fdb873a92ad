/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.runtime;

/**
 * The runtime primitives a transition procedure is written in.
 */
public interface ScanPrimitives {
    /**
     * Returns the next character of the current attempt, or
     * {@link ReadAheadBuffer#EOI} at the end of input.
     */
    int next();

    /**
     * Records that the characters read so far match the pattern with the
     * given tag. Must be called on every accepting state reached, not only
     * on the last one.
     */
    void accept(int tag);

    /**
     * Ends the current attempt because no transition exists for the last
     * character read, and resolves its outcome.
     */
    ScanResult reject();
}
