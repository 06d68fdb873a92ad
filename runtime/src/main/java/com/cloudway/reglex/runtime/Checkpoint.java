/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.runtime;

import com.google.common.base.MoreObjects;

/**
 * The most recent accepting tag and position reached during one token
 * attempt. A newer checkpoint always supersedes an older one.
 */
public final class Checkpoint {
    /**
     * The tag of a checkpoint that has not accepted anything yet.
     */
    public static final int NONE = -1;

    private final int tag;
    private final Location location;

    private Checkpoint(int tag, Location location) {
        this.tag = tag;
        this.location = location;
    }

    /**
     * Returns the checkpoint that starts a token attempt at the given position.
     */
    public static Checkpoint initial(Location location) {
        return new Checkpoint(NONE, location);
    }

    /**
     * Returns a checkpoint recording an accept of the given tag.
     */
    public static Checkpoint accepted(int tag, Location location) {
        if (tag < 0)
            throw new IllegalArgumentException("invalid tag: " + tag);
        return new Checkpoint(tag, location);
    }

    public int tag() {
        return tag;
    }

    public Location location() {
        return location;
    }

    /**
     * Returns true if some pattern has matched in the current attempt.
     */
    public boolean isAccepted() {
        return tag != NONE;
    }

    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("tag", tag)
            .add("location", location)
            .toString();
    }
}
