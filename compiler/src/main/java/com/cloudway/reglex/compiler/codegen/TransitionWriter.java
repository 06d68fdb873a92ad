/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.compiler.codegen;

import java.util.List;

import com.cloudway.reglex.compiler.automaton.CompiledAutomaton;
import com.cloudway.reglex.compiler.automaton.CompiledAutomaton.Edge;

import static com.cloudway.reglex.runtime.Automaton.NONE;

/**
 * Writes the body of a transition procedure for an automaton. The body
 * is a loop over a switch on the state number and uses only the scanning
 * primitives next, accept and reject:
 *
 * <pre>
 *     int state = 0, c;
 *     for (;;) {
 *         c = p.next();
 *         switch (state) {
 *         case 0:
 *             if (c == 'a') { state = 1; p.accept(0); continue; }
 *             return p.reject();
 *         ...
 *         }
 *     }
 * </pre>
 *
 * The end of input never matches a transition, so it always rejects.
 */
public final class TransitionWriter {
    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();
    private final int indent;

    private TransitionWriter(int indent) {
        this.indent = indent;
    }

    /**
     * Write the procedure body of an automaton.
     *
     * @param automaton the automaton
     * @param indent the indentation level of the body statements
     */
    public static String write(CompiledAutomaton automaton, int indent) {
        TransitionWriter w = new TransitionWriter(indent);
        w.body(automaton);
        return w.out.toString();
    }

    private void body(CompiledAutomaton automaton) {
        line(0, "int state = " + automaton.start() + ", c;");
        line(0, "for (;;) {");
        line(1, "c = p.next();");
        line(1, "switch (state) {");

        for (int s = 0; s < automaton.size(); s++) {
            List<Edge> edges = automaton.edges(s);
            if (edges.isEmpty())
                continue;

            line(1, "case " + s + ":");
            for (Edge e : edges) {
                int tag = automaton.acceptTag(e.target());
                StringBuilder stmt = new StringBuilder();
                stmt.append("if (").append(condition(e)).append(") { ");
                stmt.append("state = ").append(e.target()).append("; ");
                if (tag != NONE)
                    stmt.append("p.accept(").append(tag).append("); ");
                stmt.append("continue; }");
                line(2, stmt.toString());
            }
            line(2, "return p.reject();");
        }

        line(1, "default:");
        line(2, "return p.reject();");
        line(1, "}");
        line(0, "}");
    }

    private static String condition(Edge e) {
        if (e.isSingle())
            return "c == " + literal(e.first());
        if (e.last() == Character.MAX_VALUE)
            return "c >= " + literal(e.first());
        return "c >= " + literal(e.first()) + " && c <= " + literal(e.last());
    }

    /**
     * Returns a Java expression for a character value. Printable ASCII
     * characters are written as char literals, other characters as numbers
     * since unicode escapes are translated before the source is parsed.
     */
    static String literal(int c) {
        switch (c) {
        case '\t': return "'\\t'";
        case '\n': return "'\\n'";
        case '\r': return "'\\r'";
        case '\f': return "'\\f'";
        case '\'': return "'\\''";
        case '\\': return "'\\\\'";
        }
        if (c >= ' ' && c < 0x7f)
            return "'" + (char)c + "'";
        return String.valueOf(c);
    }

    private void line(int level, String text) {
        for (int i = 0; i < indent + level; i++)
            out.append(INDENT);
        out.append(text).append('\n');
    }
}
