/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.runtime;

/**
 * Line and column bookkeeping for a scanning session.
 *
 * <p>The running position follows every character delivered to a token
 * attempt. A rollback restores the whole position, including the
 * pending-newline flag, and replayed characters advance it again from
 * there. The token start is latched on the first character of each
 * attempt.</p>
 */
public class PositionTracker {
    private Location current = Location.START;
    private Location tokenStart = Location.START;
    private boolean latched;

    /**
     * Advance the running position over a character.
     */
    public void advance(int c) {
        current = current.advance(c);
        if (!latched) {
            tokenStart = current;
            latched = true;
        }
    }

    /**
     * Restore the running position captured by a checkpoint.
     */
    public void restore(Location location) {
        current = location;
    }

    /**
     * Begin a new token attempt. The token start is latched again on the
     * next character.
     */
    public void beginToken() {
        latched = false;
    }

    /**
     * Start over at the beginning of a new source.
     */
    public void reset() {
        current = Location.START;
        tokenStart = Location.START;
        latched = false;
    }

    /**
     * Returns the running position.
     */
    public Location current() {
        return current;
    }

    /**
     * Returns the position of the first character of the current token.
     */
    public Location tokenStart() {
        return tokenStart;
    }
}
