/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.reglex.compiler.automaton;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Map;

import com.cloudway.reglex.compiler.automaton.Nfa.State;

import static com.cloudway.reglex.compiler.automaton.Nfa.CCL;
import static com.cloudway.reglex.compiler.automaton.Nfa.EPSILON;
import static com.cloudway.reglex.compiler.automaton.Nfa.OTHER;

/**
 * A simple recursive descent parser that creates a Thompson NFA for a
 * regular expression, appending its states to a shared {@link Nfa}.
 */
final class RegexParser {
    /* Tokens */
    static final int EOS         = 1,       /* end of string     */
                     ANY         = 2,       /* .                 */
                     CCL_END     = 3,       /* ]                 */
                     CCL_START   = 4,       /* [                 */
                     CLOSE_PAREN = 6,       /* )                 */
                     CLOSURE     = 7,       /* *                 */
                     COMPLEMENT  = 8,       /* ^                 */
                     DASH        = 9,       /* -                 */
                     L           = 10,      /* literal character */
                     OPEN_PAREN  = 12,      /* (                 */
                     OPTIONAL    = 13,      /* ?                 */
                     OR          = 14,      /* |                 */
                     PCCL        = 15,      /* predefined CCL    */
                     PLUS_CLOSE  = 16;      /* +                 */

    private static final int[] TOKMAP = new int[128];

    static {
        Arrays.fill(TOKMAP, L);
        TOKMAP['('] = OPEN_PAREN;
        TOKMAP[')'] = CLOSE_PAREN;
        TOKMAP['*'] = CLOSURE;
        TOKMAP['+'] = PLUS_CLOSE;
        TOKMAP['-'] = DASH;
        TOKMAP['.'] = ANY;
        TOKMAP['?'] = OPTIONAL;
        TOKMAP['['] = CCL_START;
        TOKMAP[']'] = CCL_END;
        TOKMAP['^'] = COMPLEMENT;
        TOKMAP['|'] = OR;
    }

    /* Maximum nesting of definition references */
    static final int MAX_DEPTH = 32;

    /*----------------------------------------------------------------
     * Predefined character classes
     */

    private static final BitSet LETTERS = new BitSet();
    private static final BitSet DIGITS  = new BitSet();
    private static final BitSet SPACES  = new BitSet();

    static {
        LETTERS.set('a', 'z'+1);
        LETTERS.set('A', 'Z'+1);
        LETTERS.set('0', '9'+1);
        LETTERS.set('_');

        DIGITS.set('0', '9'+1);

        SPACES.set(' ');
        SPACES.set('\t');
        SPACES.set('\n');
        SPACES.set('\r');
        SPACES.set('\f');
    }

    /*----------------------------------------------------------------
     * Error processing stuff. Note that all errors are fatal.
     */

    enum Err {
        E_BADEXPR("Malformed regular expression"),
        E_PAREN("Missing close parenthesis"),
        E_BRACKET("Missing [ in character class"),
        E_CLOSE("+ ? or * must follow expression"),
        E_BADDEF("Missing } in definition reference"),
        E_NODEF("Regular definition doesn't exist"),
        E_EMPTYDEF("Regular definition is empty"),
        E_DEPTH("Definition references nested too deeply"),
        E_QUOTE("Missing close quote"),
        E_CHAR("Character outside of the Latin-1 range");

        final String errmsg;
        Err(String msg) { this.errmsg = msg; }
    }

    private final Nfa nfa;
    private final Map<String, String> definitions;
    private final String pattern;
    private final int tag;

    private String   input;                          /* The current input string */
    private int      next;                           /* The position of current token */
    private boolean  inquote;                        /* Processing quoted string */
    private int      currentTok;                     /* Current token */
    private int      lexeme;                         /* Value associated with the token */

    private final String[] defStack = new String[MAX_DEPTH]; /* Input-source stack */
    private int      defSp = -1;                             /* and stack pointer */

    private RegexParser(Nfa nfa, Map<String, String> definitions, String pattern, int tag) {
        this.nfa = nfa;
        this.definitions = definitions;
        this.pattern = pattern;
        this.tag = tag;
        this.input = pattern;
    }

    /**
     * Parse a pattern and return the start state of its machine. The end
     * state of the machine is accepting with the given tag.
     *
     * @throws LexError if the pattern is malformed
     */
    static State parse(Nfa nfa, Map<String, String> definitions, String pattern, int tag) {
        return new RegexParser(nfa, definitions, pattern, tag).rule();
    }

    private void error(Err type) {
        throw new LexError(type.errmsg, pattern, tag);
    }

    /*----------------------------------------------------------------
     * Lexical analyzer:
     *
     * All lexemes are single-character values. The complications are
     * escape sequences, quoted strings and definition references. A
     * definition reference "{name}" stacks the current input and continues
     * with the definition text, so MAX_DEPTH controls the maximum nesting.
     */
    private int advance() {
        int t, c;

        for (;;) {
            while (next >= input.length()) {
                if (defSp >= 0) {           // Restore previous input source
                    input = defStack[defSp--];
                    next = 0;
                    continue;
                }

                if (inquote)
                    error(Err.E_QUOTE);
                currentTok = EOS;           // No more input sources to restore
                lexeme = 0;                 // ie. you're at the real end of string.
                return EOS;
            }

            if (!inquote && input.charAt(next) == '{') {
                expand();
                continue;
            }

            c = input.charAt(next++);

            if (c == '"') {
                inquote = !inquote;
                continue;
            }

            if (c == '\\' && next < input.length()) {
                c = input.charAt(next++);
                t = L;
                switch (c) {
                case 't': c = '\t'; break;
                case 'n': c = '\n'; break;
                case 'r': c = '\r'; break;
                case 'f': c = '\f'; break;
                // predefined character classes
                case 'd': case 'D':
                case 's': case 'S':
                case 'w': case 'W': if (!inquote) t = PCCL; break;
                }
            } else if (inquote) {
                t = L;
            } else {
                t = c < TOKMAP.length ? TOKMAP[c] : L;
            }

            if (c >= OTHER)
                error(Err.E_CHAR);

            currentTok = t;
            lexeme = c;
            return t;
        }
    }

    private void expand() {
        int i = input.indexOf('}', next + 1);
        if (i == -1)
            error(Err.E_BADDEF);

        String name = input.substring(next + 1, i);
        String text = definitions.get(name);
        if (text == null)
            error(Err.E_NODEF);
        if (text.isEmpty())
            error(Err.E_EMPTYDEF);
        if (defSp + 1 >= defStack.length)
            error(Err.E_DEPTH);

        // Stack current input string. Use definition body as input string.
        defStack[++defSp] = input.substring(i + 1);
        input = "(" + text + ")";
        next = 0;
    }

    /*--------------------------------------------------------------
     * The Parser
     */

    private State rule() {
        /*      rule    --> expr  EOS
         */

        advance();
        State start = expr();
        if (currentTok != EOS)
            error(Err.E_BADEXPR);
        start.end.tag = tag;
        return start;
    }

    private State expr() {
        /*      expr    -> cat_expr expr'
         *      expr'   -> OR cat_expr expr'
         *                 epsilon
         */

        State start, end;
        State e2_start, e2_end;
        State compose = null;
        State p;

        start = catExpr();
        end   = start.end;

        if (isSingleEdge(start))
            compose = start;

        while (currentTok == OR) {
            advance();
            e2_start = catExpr();
            e2_end   = e2_start.end;

            if (compose != null && isSingleEdge(e2_start)) {
                // Compose multiple terms into one character class.
                // For example, given an expression "a|b", convert it to
                // an equivalent expression "[ab]".

                if (compose.edge != CCL) {
                    compose.bitset = new BitSet();
                    compose.bitset.set(compose.edge);
                    compose.edge = CCL;
                }

                if (e2_start.edge == CCL) {                         // handle complement sets
                    if (!compose.compl && !e2_start.compl) {        // A | B
                        compose.bitset.or(e2_start.bitset);
                    } else if (compose.compl && e2_start.compl) {   // ~A | ~B = ~(A & B)
                        compose.bitset.and(e2_start.bitset);
                    } else if (compose.compl) {                     // ~A | B = ~(A & ~B)
                        compose.bitset.andNot(e2_start.bitset);
                    } else {                                        // A | ~B = ~(B & ~A)
                        BitSet b = (BitSet)e2_start.bitset.clone();
                        b.andNot(compose.bitset);
                        compose.bitset = b;
                        compose.compl = true;
                    }
                } else {
                    compose.bitset.set(e2_start.edge, !compose.compl);
                }

                nfa.discard(e2_start);
                nfa.discard(e2_end);
            } else {
                p = nfa.newState();
                p.next2 = e2_start;
                p.next  = start;
                start   = p;

                p = nfa.newState();
                end.next = p;
                e2_end.next = p;
                end = p;

                compose = null;
            }
        }

        start.end = end;
        return start;
    }

    private static boolean isSingleEdge(State start) {
        return start.next == start.end && start.edge != EPSILON;
    }

    private State catExpr() {
        /*      cat_expr  -> factor cat_expr'
         *      cat_expr' -> factor cat_expr'
         *                   epsilon
         */

        State start;
        State e2_start;

        if (!firstInCat(currentTok)) {
            // empty alternative, as in "(a|)"
            start = nfa.newState();
            start.end = start.next = nfa.newState();
            return start;
        }

        start = factor();

        while (firstInCat(currentTok)) {
            e2_start = factor();

            // discard e2_start
            start.end.edge   = e2_start.edge;
            start.end.bitset = e2_start.bitset;
            start.end.compl  = e2_start.compl;
            start.end.next   = e2_start.next;
            start.end.next2  = e2_start.next2;
            start.end        = e2_start.end;
            nfa.discard(e2_start);
        }

        return start;
    }

    private boolean firstInCat(int tok) {
        switch (tok) {
        case CLOSE_PAREN:
        case OR:
        case EOS:           return false;

        case CLOSURE:
        case PLUS_CLOSE:
        case OPTIONAL:      error(Err.E_CLOSE);   return false;

        case CCL_END:       error(Err.E_BRACKET); return false;
        }

        return true;
    }

    private State factor() {
        /* factor --> term*  | term+  | term? */

        State startp, endp;
        State start, end;

        startp = term();
        endp   = startp.end;

        if (currentTok == CLOSURE || currentTok == PLUS_CLOSE || currentTok == OPTIONAL) {
            start = nfa.newState();
            end   = nfa.newState();
            start.next = startp;
            endp.next  = end;

            if (currentTok == CLOSURE || currentTok == OPTIONAL)
                start.next2 = end;

            if (currentTok == CLOSURE || currentTok == PLUS_CLOSE)
                endp.next2 = startp;

            startp = start;
            startp.end = end;
            advance();
        }

        return startp;
    }

    private State term() {
        /* term  --> [...]  |  [^...]  |  .  | (expr) | <character> */

        State start;

        if (currentTok == OPEN_PAREN) {
            advance();
            start = expr();
            if (currentTok == CLOSE_PAREN)
                advance();
            else
                error(Err.E_PAREN);
        } else {
            start = nfa.newState();
            start.end = start.next = nfa.newState();

            if (!(currentTok == ANY || currentTok == CCL_START || currentTok == PCCL)) {
                start.edge = lexeme;
                advance();
            } else if (currentTok == PCCL) {
                start.edge = CCL;
                predefined(start);
                advance();
            } else {
                start.edge = CCL;
                start.bitset = new BitSet();

                if (currentTok == ANY) {
                    start.bitset.set('\n');
                    start.compl = true;
                } else {
                    advance();
                    if (currentTok == COMPLEMENT) {     // Negative character class
                        advance();
                        start.bitset.set('\n');
                        start.compl = true;
                    }
                    if (currentTok == CCL_END)          // [] or [^]
                        error(Err.E_BADEXPR);
                    dodash(start.bitset);
                    if (currentTok != CCL_END)
                        error(Err.E_BRACKET);
                }
                advance();
            }
        }

        return start;
    }

    private void predefined(State p) {
        switch (lexeme) {
        case 'D': p.compl = true;
        case 'd': p.bitset = (BitSet)DIGITS.clone();
                  break;

        case 'S': p.compl = true;
        case 's': p.bitset = (BitSet)SPACES.clone();
                  break;

        case 'W': p.compl = true;
        case 'w': p.bitset = (BitSet)LETTERS.clone();
                  break;

        default:  throw new AssertionError();
        }
    }

    private void dodash(BitSet set) {
        int first = 0;

        if (currentTok == DASH) {           // Treat [-...] as a literal dash
            set.set('-');
            advance();
        }

        for (; currentTok != EOS && currentTok != CCL_END; advance()) {
            if (currentTok == PCCL) {
                State tmp = new State();
                predefined(tmp);
                if (tmp.compl)
                    error(Err.E_BADEXPR);
                set.or(tmp.bitset);
            } else if (currentTok != DASH) {
                first = lexeme;
                set.set(lexeme);
            } else { // looking at a dash
                advance();
                if (currentTok == CCL_END) {    // Treat [...-] as literal
                    set.set('-');
                    break;
                } else if (first <= lexeme) {
                    set.set(first, lexeme+1);
                }
            }
        }
    }
}
