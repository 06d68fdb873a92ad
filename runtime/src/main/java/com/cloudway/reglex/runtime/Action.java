/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.runtime;

/**
 * The code attached to a token pattern. It is performed when a token of
 * the pattern is completed, and may query the lexeme and its position or
 * switch the active parser.
 */
@FunctionalInterface
public interface Action {
    void perform(ScanSession session);
}
