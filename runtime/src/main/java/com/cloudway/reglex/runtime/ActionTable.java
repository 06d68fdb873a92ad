/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.runtime;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Dispatches a completed token to the action of its pattern.
 */
@FunctionalInterface
public interface ActionTable {
    /**
     * Perform the action attached to the pattern with the given tag.
     */
    void perform(int tag, ScanSession session);

    /**
     * Returns an action table indexed by tag.
     */
    static ActionTable of(List<? extends Action> actions) {
        ImmutableList<Action> table = ImmutableList.copyOf(actions);
        return (tag, session) -> table.get(tag).perform(session);
    }

    /**
     * Returns an action table that does nothing.
     */
    static ActionTable none() {
        return (tag, session) -> {};
    }
}
