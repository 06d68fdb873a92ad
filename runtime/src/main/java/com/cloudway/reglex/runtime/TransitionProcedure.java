/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.runtime;

/**
 * A scanning procedure for one parser. It reads characters with
 * {@link ScanPrimitives#next()}, follows the automaton of the parser,
 * calls {@link ScanPrimitives#accept(int)} on every accepting state and
 * returns the result of {@link ScanPrimitives#reject()} as soon as no
 * transition exists.
 */
@FunctionalInterface
public interface TransitionProcedure {
    ScanResult scan(ScanPrimitives p);
}
