/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.compiler.automaton;

import com.cloudway.reglex.runtime.Automaton;

/**
 * The exception type represents errors in token patterns.
 */
@SuppressWarnings("ExceptionClassNameDoesntEndWithException")
public class LexError extends RuntimeException {
    private static final long serialVersionUID = 3075088474004684963L;

    private final String pattern;
    private final int tag;

    public LexError(String message) {
        this(message, null, Automaton.NONE);
    }

    public LexError(String message, String pattern, int tag) {
        super(message);
        this.pattern = pattern;
        this.tag = tag;
    }

    /**
     * Returns the offending pattern text, or null if unknown.
     */
    public String getPattern() {
        return pattern;
    }

    /**
     * Returns the tag of the offending pattern, or {@link Automaton#NONE}.
     */
    public int getTag() {
        return tag;
    }

    @Override
    public String getMessage() {
        String msg = super.getMessage();
        return pattern != null ? msg + ": " + pattern : msg;
    }
}
