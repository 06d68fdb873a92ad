/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.runtime;

import org.junit.Test;
import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

public class LocationTest {
    private static Location read(String s) {
        Location loc = Location.START;
        for (char c : s.toCharArray())
            loc = loc.advance(c);
        return loc;
    }

    @Test
    public void columnsCountFromOne() {
        assertThat(read("a"), is(new Location(1, 1)));
        assertThat(read("abc"), is(new Location(1, 3)));
    }

    @Test
    public void newlineIsPendingUntilNextCharacter() {
        Location loc = read("ab\n");
        assertEquals(1, loc.getLine());
        assertEquals(3, loc.getColumn());
        assertTrue(loc.isPendingNewline());

        loc = loc.advance('c');
        assertThat(loc, is(new Location(2, 1)));
    }

    @Test
    public void consecutiveNewlines() {
        assertThat(read("\n\n"), is(new Location(2, 1, true)));
        assertThat(read("\n\nx"), is(new Location(3, 1)));
    }

    @Test
    public void pendingFlagTakesPartInEquality() {
        assertNotEquals(new Location(1, 2, true), new Location(1, 2, false));
        assertTrue(new Location(1, 2, false).compareTo(new Location(1, 2, true)) < 0);
        assertTrue(new Location(1, 9).compareTo(new Location(2, 1)) < 0);
    }

    @Test
    public void startPosition() {
        assertEquals(1, Location.START.getLine());
        assertEquals(0, Location.START.getColumn());
        assertEquals("1:0", Location.START.toString());
    }
}
