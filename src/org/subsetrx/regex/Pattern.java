/*
 * @LICENSE@
 */

package org.subsetrx.regex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A compiled representation of a pattern over an {@link Alphabet}; loosely
 * analogous to the {@link java.util.regex.Pattern} class. Instances are
 * immutable and thread safe.
 * <p>
 * <strong>Syntax:</strong>
 * <ul>
 * <li>Any character not listed below is a literal.</li>
 * <li><code>\</code> escapes the next character, which is then a literal.</li>
 * <li><code>|</code> alternation, lowest precedence.</li>
 * <li><code>*</code>, <code>+</code>, <code>?</code> postfix quantifiers.</li>
 * <li><code>(...)</code> grouping. Groups affect precedence only; nothing is
 * captured.</li>
 * <li><code>.</code> explicit concatenation: <code>a.b</code> is the same
 * pattern as <code>ab</code>.</li>
 * <li><code>^</code> at the start of a fragment (start of the pattern, or
 * after <code>(</code>, <code>|</code> or <code>.</code>) is a start
 * anchor; after an operand it negates that operand: it matches any single
 * alphabet symbol the operand does not begin with.</li>
 * <li><code>$</code> end anchor.</li>
 * <li><code>[...]</code> set literal. Its characters are taken verbatim
 * (escapes honored) and match as their joined text, <em>not</em> as a choice
 * of one character: <code>[ab]</code> matches <code>"ab"</code>.
 * <code>[^...]</code> is the set literal negated.</li>
 * </ul>
 * Anchors consume no input. Since every operation is built on whole-string
 * matching, they do not change what a pattern matches.
 * <p>
 * <strong>Matching</strong> is automaton driven only - there is no
 * backtracking. {@link #matches(CharSequence)} decides whether the whole
 * input is accepted. {@link #findAll(CharSequence)} and
 * {@link #search(CharSequence)} test every substring: start positions left to
 * right, and for each start the end positions left to right, so the shortest
 * match at the lowest start comes first, and overlapping matches of every
 * length are all reported.
 */
public final class Pattern {

    private static final Logger logger = Logger.getLogger("org.subsetrx.regex");
    private static final Level level = Level.FINEST;

    final String regex;
    final Alphabet alphabet;
    final Engine engine;

    private Pattern(String regex, Alphabet alphabet, EngineStyle style) {

        if (alphabet == null) throw new NullPointerException("alphabet");
        if (style == null) throw new NullPointerException("style");
        this.regex = regex;
        logger.log(level, "regex: " + regex);
        this.alphabet = alphabet;
        List<Token> postfix = new RegexParser().parse(regex);
        logger.log(level, "postfix: " + Token.stringFrom(postfix));
        this.engine = style.engineFor(new NFA(regex, postfix, alphabet));
    }

    /**
     * Compiles a pattern, using the default {@link EngineStyle#DFA_TABLE}
     * matching algorithm.
     *
     * @param regex
     *            the pattern to be compiled.
     * @param alphabet
     *            every symbol that can legally appear in matched input.
     * @return the pattern.
     * @throws MalformedPatternException
     *             if the grouping delimiters do not balance.
     * @throws BuildException
     *             if an operator lacks operands.
     */
    public static Pattern compile(String regex, Alphabet alphabet) {
        return new Pattern(regex, alphabet, EngineStyle.DFA_TABLE);
    }

    /**
     * This factory method allows direct selection of a
     * {@linkplain EngineStyle matching algorithm}.
     *
     * @param regex
     *            the pattern to be compiled.
     * @param alphabet
     *            every symbol that can legally appear in matched input.
     * @param style
     *            The EngineStyle specified.
     * @return the pattern.
     */
    public static Pattern compile(String regex, Alphabet alphabet, EngineStyle style) {
        return new Pattern(regex, alphabet, style);
    }

    public Alphabet alphabet() {
        return alphabet;
    }

    /**
     * The matching algorithm, as represented by the {@link EngineStyle} class,
     * selected for use with this Pattern instance.
     *
     * @return the matching algorithm.
     */
    public EngineStyle style() {
        return engine.style;
    }

    public Matcher matcher(CharSequence csq) {
        return new Matcher(this, csq);
    }

    public boolean matches(CharSequence csq) {
        return engine.eval(csq, 0, csq.length());
    }

    public static boolean matches(String regex, CharSequence input, Alphabet alphabet) {
        return compile(regex, alphabet).matches(input);
    }

    /**
     * @return every matching substring, in scan order; possibly overlapping,
     *         possibly several for one start position. Never contains the
     *         empty string.
     */
    public List<String> findAll(CharSequence input) {
        List<String> result = new ArrayList<String>();
        Matcher m = matcher(input);
        while (m.find()) {
            result.add(m.group());
        }
        return result;
    }

    /**
     * @return the start index of the first match in scan order, or -1.
     */
    public int search(CharSequence input) {
        Matcher m = matcher(input);
        return m.find() ? m.start() : -1;
    }

    /**
     * Splits the input around the matches reported by
     * {@link #findAll(CharSequence)}. Each match is located by text, as its
     * first occurrence at or after the end of the previous located match; a
     * match which can not be located there overlaps a span already consumed
     * and is skipped.
     *
     * @return the text between consecutive matches, starting with the text
     *         before the first, ending with the text after the last. Empty
     *         strings are kept.
     */
    public List<String> split(CharSequence input) {
        final String s = input.toString();
        List<String> result = new ArrayList<String>();
        int last = 0;
        for (int[] span : spans(s)) {
            result.add(s.substring(last, span[0]));
            last = span[1];
        }
        result.add(s.substring(last));
        return result;
    }

    /**
     * As {@link #split(CharSequence)}, but the result keeps the text between
     * matches and puts <code>replacement</code> in place of each match.
     * The replacement is literal text.
     */
    public String substitute(String replacement, CharSequence input) {
        if (replacement == null) throw new NullPointerException("replacement");
        final String s = input.toString();
        StringBuilder sb = new StringBuilder();
        int last = 0;
        for (int[] span : spans(s)) {
            sb.append(s, last, span[0]).append(replacement);
            last = span[1];
        }
        sb.append(s, last, s.length());
        return sb.toString();
    }

    private List<int[]> spans(String s) {
        List<int[]> ret = new ArrayList<int[]>();
        int last = 0;
        for (String match : findAll(s)) {
            int start = s.indexOf(match, last);
            if (start < 0) {
                logger.log(level, "overlapping match skipped: " + match);
                continue;
            }
            last = start + match.length();
            ret.add(new int[] {start, last});
        }
        return Collections.unmodifiableList(ret);
    }

    public String pattern() {
        return regex;
    }

    /**
     * @return a pattern which matches <code>s</code> literally: every
     *         operator character escaped with a backslash.
     */
    public static String quote(String s) {
        return Misc.Esc.QUOTE.esc(s);
    }

    @Override
    public String toString() {
        return regex;
    }

    /**
     * For testability: create an NFA from a Pattern instance.
     *
     * @param p
     *            the Pattern instance
     * @return the NFA
     */
    static NFA NFAfor(Pattern p) {
        return new NFA(p.regex, new RegexParser().parse(p.regex), p.alphabet);
    }
}
