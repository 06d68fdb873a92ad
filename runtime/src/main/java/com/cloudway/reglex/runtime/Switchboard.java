/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.runtime;

import java.util.List;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Holds the declared parsers of a scanning session, exactly one of which is
 * active. The first declared parser is the default, active from the start.
 *
 * <p>Switching replaces only the active parser. The read-ahead buffer and
 * the position are shared by all parsers and are not touched.</p>
 */
public class Switchboard {
    private static final Logger logger = Logger.getLogger(Switchboard.class.getName());

    private final ImmutableMap<String, ParserSpec> parsers;
    private final ParserSpec initial;
    private ParserSpec active;

    /**
     * Construct the switchboard.
     *
     * @param parsers the declared parsers, in declaration order
     * @throws IllegalArgumentException if no parser is given or a name
     * is declared twice
     */
    public Switchboard(List<ParserSpec> parsers) {
        if (parsers.isEmpty())
            throw new IllegalArgumentException("at least one parser must be declared");

        ImmutableMap.Builder<String, ParserSpec> builder = ImmutableMap.builder();
        parsers.forEach(p -> builder.put(p.name(), p));
        this.parsers = builder.buildOrThrow();
        this.initial = parsers.get(0);
        this.active  = initial;
    }

    public Switchboard(ParserSpec parser) {
        this(ImmutableList.of(parser));
    }

    /**
     * Returns the active parser.
     */
    public ParserSpec active() {
        return active;
    }

    /**
     * Make the named parser active.
     *
     * @throws UnknownParserException if no parser has the given name
     */
    public void switchTo(String name) {
        ParserSpec target = parsers.get(name);
        if (target == null)
            throw new UnknownParserException(name);
        if (target != active)
            logger.finer(() -> "switch parser " + active.name() + " -> " + name);
        active = target;
    }

    /**
     * Make the default parser active again.
     */
    public void reset() {
        active = initial;
    }

    /**
     * Returns the names of the declared parsers, in declaration order.
     */
    public ImmutableSet<String> names() {
        return parsers.keySet();
    }
}
