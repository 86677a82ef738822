/*
 * @LICENSE@
 */

package org.subsetrx.regex;

import java.util.List;

/**
 * One-shot entry points. Every call compiles its pattern from scratch - parse,
 * NFA, DFA - and discards the automata on return; nothing is shared between
 * calls. Callers matching one pattern repeatedly should hold on to a
 * {@link Pattern}, or use a {@link PatternCache}.
 *
 * @see Pattern
 */
public final class Regex {

    private Regex() {}   // not instantiable.

    /**
     * @return true iff <code>pattern</code> matches the whole of
     *         <code>input</code>.
     * @throws MalformedPatternException
     *             if the grouping delimiters do not balance.
     * @throws BuildException
     *             if an operator lacks operands.
     */
    public static boolean match(String pattern, CharSequence input, Alphabet alphabet) {
        return Pattern.compile(pattern, alphabet).matches(input);
    }

    /**
     * @see Pattern#findAll(CharSequence)
     */
    public static List<String> findAll(String pattern, CharSequence input, Alphabet alphabet) {
        return Pattern.compile(pattern, alphabet).findAll(input);
    }

    /**
     * @return the start index of the first match in scan order, or -1.
     * @see Pattern#search(CharSequence)
     */
    public static int search(String pattern, CharSequence input, Alphabet alphabet) {
        return Pattern.compile(pattern, alphabet).search(input);
    }

    /**
     * @see Pattern#split(CharSequence)
     */
    public static List<String> split(String pattern, CharSequence input, Alphabet alphabet) {
        return Pattern.compile(pattern, alphabet).split(input);
    }

    /**
     * @see Pattern#substitute(String, CharSequence)
     */
    public static String substitute(String pattern, String replacement,
            CharSequence input, Alphabet alphabet) {
        return Pattern.compile(pattern, alphabet).substitute(replacement, input);
    }
}
