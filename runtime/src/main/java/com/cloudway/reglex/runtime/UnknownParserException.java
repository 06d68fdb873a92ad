/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.runtime;

/**
 * Thrown when switching to a parser that was never declared.
 */
public class UnknownParserException extends IllegalArgumentException {
    private static final long serialVersionUID = 5218340077364150924L;

    private final String name;

    public UnknownParserException(String name) {
        super("unknown parser: " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
