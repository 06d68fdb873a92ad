/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.runtime;

import java.util.Objects;

/**
 * Represents a source position.
 *
 * <p>The position describes the last character read: line and column are
 * 1-based, and column 0 means no character has been read on the line yet.
 * A newline does not advance the line by itself. Instead it sets the
 * pending-newline flag, and the line is advanced when the next character
 * arrives, so a trailing newline never reports a line that has no
 * characters.</p>
 *
 * <p>This object is immutable, any mutable operation will return a fresh
 * new {@code Location} object.</p>
 */
public final class Location implements Comparable<Location> {
    /**
     * The position before any character has been read.
     */
    public static final Location START = new Location(1, 0, false);

    private final int line;
    private final int column;
    private final boolean pendingNewline;

    /**
     * Construct a source position.
     *
     * @param line the line number in the source
     * @param column the column number in the source
     * @param pendingNewline true if the last character read was a newline
     */
    public Location(int line, int column, boolean pendingNewline) {
        this.line = line;
        this.column = column;
        this.pendingNewline = pendingNewline;
    }

    /**
     * Construct a source position without a pending newline.
     */
    public Location(int line, int column) {
        this(line, column, false);
    }

    /**
     * Returns the line number in the source.
     */
    public int getLine() {
        return line;
    }

    /**
     * Returns the column number in the source.
     */
    public int getColumn() {
        return column;
    }

    /**
     * Returns true if the last character read was a newline.
     */
    public boolean isPendingNewline() {
        return pendingNewline;
    }

    /**
     * Returns the position after reading the given character.
     */
    public Location advance(int c) {
        int ln = line, col = column;
        if (pendingNewline) {
            ln++;
            col = 0;
        }
        return new Location(ln, col + 1, c == '\n');
    }

    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Location))
            return false;
        Location other = (Location)obj;
        return line == other.line && column == other.column
            && pendingNewline == other.pendingNewline;
    }

    public int hashCode() {
        return Objects.hash(line, column, pendingNewline);
    }

    @Override
    public int compareTo(Location other) {
        if (this.line != other.line)
            return Integer.compare(this.line, other.line);
        if (this.column != other.column)
            return Integer.compare(this.column, other.column);
        return Boolean.compare(this.pendingNewline, other.pendingNewline);
    }

    public String toString() {
        return line + ":" + column;
    }
}
