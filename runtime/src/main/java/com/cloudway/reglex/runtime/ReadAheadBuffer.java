/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.runtime;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;

/**
 * The low-level read-ahead buffer.
 *
 * <p>The buffer holds characters that were read from the source but are not
 * yet committed to a lexeme. The tail of the buffer may be "unconsumed":
 * those characters were read during an earlier, rolled back attempt and are
 * replayed by {@link #next()} before the source is read again.</p>
 *
 * <pre>
 *   | consumed by current attempt | unconsumed (replayed next) |
 *   0                     length-unconsumed                 length
 * </pre>
 */
public class ReadAheadBuffer {
    /**
     * The end of input sentinel. It is never buffered.
     */
    public static final int EOI = -1;

    private Reader source;

    // Characters read from the source but not yet committed
    private final StringBuilder buf = new StringBuilder();

    // Number of characters at the tail of buf not yet delivered to the
    // current attempt, always 0 <= unconsumed <= buf.length()
    private int unconsumed;

    // Sticky end of input
    private boolean eoi;

    public ReadAheadBuffer(Reader source) {
        this.source = source;
    }

    /**
     * Replace the character source. Pending characters of the previous
     * source are discarded.
     */
    public void reset(Reader source) {
        this.source = source;
        this.buf.setLength(0);
        this.unconsumed = 0;
        this.eoi = false;
    }

    /**
     * Read next character, replaying unconsumed characters first.
     *
     * @return the next character or {@link #EOI}
     * @throws UncheckedIOException if the source failed
     */
    public int next() {
        if (unconsumed > 0) {
            return buf.charAt(buf.length() - unconsumed--);
        }

        if (eoi || source == null) {
            return EOI;
        }

        int c;
        try {
            c = source.read();
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }

        if (c == EOI) {
            eoi = true;
        } else {
            buf.append((char)c);
        }
        return c;
    }

    /**
     * Move the characters consumed by the current attempt to the end of the
     * given lexeme, and shrink the buffer's front accordingly. Only the
     * unconsumed characters remain in the buffer.
     *
     * @return the number of characters moved
     */
    public int commit(StringBuilder lexeme) {
        int n = consumed();
        if (n > 0) {
            lexeme.append(buf, 0, n);
            buf.delete(0, n);
        }
        return n;
    }

    /**
     * Mark all buffered characters as unconsumed, so that the next attempt
     * replays them from the beginning.
     */
    public void rewind() {
        unconsumed = buf.length();
    }

    /**
     * Discard the first buffered character. The buffer must be rewound.
     *
     * @return the discarded character, or {@link #EOI} if the buffer is empty
     */
    public int drop() {
        if (buf.length() == 0) {
            return EOI;
        }
        char c = buf.charAt(0);
        buf.deleteCharAt(0);
        if (unconsumed > buf.length()) {
            unconsumed = buf.length();
        }
        return c;
    }

    /**
     * Returns true if no character is buffered.
     */
    public boolean isEmpty() {
        return buf.length() == 0;
    }

    /**
     * Returns the number of buffered characters.
     */
    public int length() {
        return buf.length();
    }

    /**
     * Returns the number of buffered characters not yet delivered to the
     * current attempt.
     */
    public int unconsumed() {
        return unconsumed;
    }

    /**
     * Returns the number of buffered characters delivered to the current
     * attempt since the last commit.
     */
    public int consumed() {
        return buf.length() - unconsumed;
    }

    /**
     * Returns true if the end of the source has been observed.
     */
    public boolean isEndOfInput() {
        return eoi;
    }

    /**
     * Returns the buffered characters.
     */
    public String text() {
        return buf.toString();
    }
}
