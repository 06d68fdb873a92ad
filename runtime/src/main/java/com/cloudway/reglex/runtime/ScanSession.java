/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.runtime;

import java.io.Reader;
import java.io.StringReader;
import java.util.List;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableSet;

import static com.cloudway.reglex.runtime.ReadAheadBuffer.EOI;

/**
 * A scanning session over one character source.
 *
 * <p>The session owns all mutable scanning state: the read-ahead buffer,
 * the checkpoint, the lexeme, the position and the active parser. A token
 * scan runs the transition procedure of the active parser, which calls
 * back into {@link #next()}, {@link #accept(int)} and {@link #reject()}.
 * Every accept moves the characters matched so far into the lexeme, so
 * they are never replayed, and a reject rewinds the buffer and the
 * position to the last accept.</p>
 *
 * <p>A session is not thread-safe, and calls must not be interleaved with
 * a token scan in progress. Generated lexers extend this class.</p>
 */
public class ScanSession implements ScanPrimitives {
    private static final Logger logger = Logger.getLogger(ScanSession.class.getName());

    private final ReadAheadBuffer buffer;
    private final PositionTracker tracker = new PositionTracker();
    private final StringBuilder lexeme = new StringBuilder();
    private final Switchboard switchboard;

    private Checkpoint checkpoint = Checkpoint.initial(Location.START);
    private String sourceName;
    private boolean scanning;

    // The token completed by the last scan
    private String text;
    private int tag = Checkpoint.NONE;

    /**
     * Construct a session without input.
     */
    public ScanSession(List<ParserSpec> parsers) {
        this(new Switchboard(parsers), null, "");
    }

    /**
     * Construct a session reading from the given source.
     *
     * @param parsers the declared parsers, the first one is the default
     * @param input the character source
     * @param name the display name of the source
     */
    public ScanSession(List<ParserSpec> parsers, Reader input, String name) {
        this(new Switchboard(parsers), input, name);
    }

    public ScanSession(Switchboard switchboard, Reader input, String name) {
        this.switchboard = switchboard;
        this.buffer = new ReadAheadBuffer(input);
        this.sourceName = name;
    }

    /**
     * Replace the input source. Characters still pending from the previous
     * source are discarded, the position starts over and the first parser
     * becomes active again.
     */
    public void setInput(Reader input, String name) {
        checkNotScanning();
        buffer.reset(input);
        tracker.reset();
        switchboard.reset();
        lexeme.setLength(0);
        checkpoint = Checkpoint.initial(Location.START);
        sourceName = name;
        text = null;
        tag = Checkpoint.NONE;
    }

    /**
     * Replace the input source with a string.
     */
    public void setInput(String input, String name) {
        setInput(new StringReader(input), name);
    }

    /*--------------------------------------------------------------*/
    /* Runtime primitives */

    @Override
    public int next() {
        int c = buffer.next();
        if (c != EOI) {
            tracker.advance(c);
        }
        return c;
    }

    @Override
    public void accept(int tag) {
        checkpoint = Checkpoint.accepted(tag, tracker.current());
        buffer.commit(lexeme);
    }

    @Override
    public ScanResult reject() {
        buffer.rewind();
        tracker.restore(checkpoint.location());

        ScanResult result;
        if (checkpoint.isAccepted()) {
            text = lexeme.toString();
            tag = checkpoint.tag();
            lexeme.setLength(0);
            result = ScanResult.TOKEN;
        } else if (buffer.isEmpty()) {
            result = ScanResult.END;
        } else {
            result = ScanResult.STUCK;
        }

        checkpoint = Checkpoint.initial(tracker.current());
        return result;
    }

    /*--------------------------------------------------------------*/
    /* Scanning */

    /**
     * Scan one token with the active parser. If a token is completed, the
     * action of its pattern is performed before this method returns.
     */
    public ScanResult scanToken() {
        checkNotScanning();

        ParserSpec parser = switchboard.active();
        ScanResult result;

        text = null;
        tag = Checkpoint.NONE;
        checkpoint = Checkpoint.initial(tracker.current());
        tracker.beginToken();

        scanning = true;
        try {
            result = parser.procedure().scan(this);
        } finally {
            scanning = false;
        }

        switch (result) {
        case TOKEN:
            logger.finer(() -> String.format("%s:%s: token %d '%s'",
                sourceName, tracker.tokenStart(), tag, text));
            parser.actions().perform(tag, this);
            break;

        case STUCK:
            logger.fine(() -> String.format("%s:%s: no pattern of parser '%s' matches '%s'",
                sourceName, tracker.tokenStart(), parser.name(), buffer.text()));
            break;

        default:
            break;
        }

        return result;
    }

    /**
     * Scan tokens until the input is exhausted or no pattern matches.
     *
     * @return 0 if the input was scanned to its end, 1 if scanning got stuck
     */
    public int scan() {
        ScanResult result;
        while ((result = scanToken()) == ScanResult.TOKEN)
            ;
        return result == ScanResult.END ? 0 : 1;
    }

    /**
     * Discard the first pending character, so that scanning can resume
     * after {@link ScanResult#STUCK}.
     *
     * @return the discarded character, or {@link ReadAheadBuffer#EOI}
     */
    public int skip() {
        checkNotScanning();

        if (buffer.isEmpty()) {
            if (buffer.next() == EOI)
                return EOI;
            buffer.rewind();
        }

        int c = buffer.drop();
        tracker.advance(c);
        checkpoint = Checkpoint.initial(tracker.current());
        return c;
    }

    /**
     * Make the named parser active for the following tokens. May be called
     * from an action or between token scans.
     *
     * @throws UnknownParserException if no parser has the given name
     * @throws IllegalStateException if a token scan is in progress
     */
    public void switchTo(String name) {
        checkNotScanning();
        switchboard.switchTo(name);
    }

    private void checkNotScanning() {
        if (scanning)
            throw new IllegalStateException("token scan in progress");
    }

    /*--------------------------------------------------------------*/
    /* Queries */

    /**
     * Returns the text of the token completed by the last scan. Valid until
     * the next token scan begins.
     */
    public String lexeme() {
        return text != null ? text : "";
    }

    /**
     * Returns the tag of the token completed by the last scan, or
     * {@link Checkpoint#NONE}.
     */
    public int tag() {
        return tag;
    }

    /**
     * Returns the position of the first character of the current token.
     */
    public Location location() {
        return tracker.tokenStart();
    }

    /**
     * Returns the line of the first character of the current token.
     */
    public int line() {
        return tracker.tokenStart().getLine();
    }

    /**
     * Returns the column of the first character of the current token.
     */
    public int column() {
        return tracker.tokenStart().getColumn();
    }

    /**
     * Returns the running position.
     */
    public Location position() {
        return tracker.current();
    }

    /**
     * Returns the display name of the input source.
     */
    public String sourceName() {
        return sourceName;
    }

    /**
     * Returns the characters read ahead but not committed to a token.
     */
    public String pending() {
        return buffer.text();
    }

    /**
     * Returns the name of the active parser.
     */
    public String activeParser() {
        return switchboard.active().name();
    }

    /**
     * Returns the names of the declared parsers.
     */
    public ImmutableSet<String> parsers() {
        return switchboard.names();
    }
}
