/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.compiler.automaton;

import java.io.PrintWriter;
import java.io.StringWriter;

import com.cloudway.reglex.compiler.automaton.CompiledAutomaton.Edge;

/**
 * Debugging aid that prints an automaton in a human readable form.
 */
public final class AutomatonPrinter {
    private AutomatonPrinter() {}

    public static String toString(CompiledAutomaton automaton) {
        StringWriter buf = new StringWriter();
        print(automaton, new PrintWriter(buf));
        return buf.toString();
    }

    public static void print(CompiledAutomaton automaton, PrintWriter out) {
        out.printf("---------------- DFA (%d states, %d classes) ----------------%n",
                   automaton.size(), automaton.classes());

        for (int s = 0; s < automaton.size(); s++) {
            out.printf("state %d", s);
            if (s == automaton.start())
                out.print(" (START STATE)");
            if (automaton.acceptTag(s) != CompiledAutomaton.NONE)
                out.printf(" accepting %d", automaton.acceptTag(s));
            out.println();

            for (Edge e : automaton.edges(s)) {
                String label = e.isSingle()
                    ? plab(e.first())
                    : plab(e.first()) + "-" + plab(e.last());
                out.printf("    %-16s --> %d%n", label, e.target());
            }
        }

        out.println("------------------------------------------------------------");
        out.flush();
    }

    /**
     * Print a character in a readable form.
     */
    static String plab(int c) {
        switch (c) {
        case '\t': return "\\t";
        case '\n': return "\\n";
        case '\r': return "\\r";
        case '\f': return "\\f";
        case ' ':  return "' '";
        }
        if (c < ' ' || c >= 0x7f)
            return String.format("\\u%04x", c);
        return String.valueOf((char)c);
    }
}
