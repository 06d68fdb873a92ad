/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.compiler.automaton;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;
import com.cloudway.reglex.runtime.Automaton;

/**
 * Builds a minimal deterministic automaton that recognizes a prioritized
 * set of patterns. The tag of a pattern is its index in declaration order,
 * and when more than one pattern matches the same input the smallest tag
 * wins.
 *
 * <p>The regular expression syntax is:</p>
 * <pre>
 *   c          a literal character
 *   \t \n \r \f  tab, newline, carriage return, form feed
 *   \c         the character c literally
 *   "..."      a quoted literal string
 *   .          any character except newline
 *   [...]      a character class, with ranges such as a-z
 *   [^...]     a negative character class, never matches newline
 *   \d \s \w   digits, white spaces, word characters
 *   \D \S \W   the complement of the above
 *   {name}     the regular definition with the given name
 *   (r)        grouping
 *   rs         concatenation
 *   r|s        alternation
 *   r* r+ r?   closures
 * </pre>
 */
public final class AutomatonBuilder {
    private static final Logger logger = Logger.getLogger(AutomatonBuilder.class.getName());

    private final Map<String, String> definitions = new HashMap<>();
    private final List<String> patterns = new ArrayList<>();
    private final Nfa nfa = new Nfa();

    /**
     * Add a regular definition. Definitions must be added before the
     * patterns that refer to them.
     *
     * @param name the definition name
     * @param text the regular expression to be substituted
     * @throws IllegalArgumentException if the name is already defined
     */
    public AutomatonBuilder define(String name, String text) {
        Objects.requireNonNull(text);
        Preconditions.checkArgument(!definitions.containsKey(name), "%s already defined", name);
        definitions.put(name, text);
        return this;
    }

    /**
     * Add a pattern. The pattern is parsed immediately.
     *
     * @param regex the regular expression of the pattern
     * @return the tag of the pattern
     * @throws LexError if the regular expression is malformed
     */
    public int pattern(String regex) {
        int tag = patterns.size();
        nfa.join(RegexParser.parse(nfa, definitions, regex, tag));
        patterns.add(regex);
        return tag;
    }

    /**
     * Returns the number of patterns added so far.
     */
    public int patterns() {
        return patterns.size();
    }

    /**
     * Build the automaton.
     *
     * @throws LexError if the automaton accepts the empty string
     */
    public CompiledAutomaton build() {
        SubsetConstruction dfa = new SubsetConstruction(nfa);
        Minimizer min = new Minimizer(dfa);
        CompiledAutomaton automaton = new CompiledAutomaton(min);

        int tag = automaton.acceptTag(automaton.start());
        if (tag != Automaton.NONE) {
            throw new LexError("no token expressions may accept an empty string",
                               patterns.get(tag), tag);
        }

        logger.fine(() -> String.format(
            "%d patterns: %d NFA states, %d DFA states, %d minimized, %d character classes",
            patterns.size(), nfa.liveStates(), dfa.size(), min.size(), automaton.classes()));
        return automaton;
    }

    /**
     * Convenient method to build an automaton from definitions and patterns.
     */
    public static CompiledAutomaton compile(List<String> patterns, Map<String, String> definitions) {
        AutomatonBuilder builder = new AutomatonBuilder();
        definitions.forEach(builder::define);
        patterns.forEach(builder::pattern);
        return builder.build();
    }
}
