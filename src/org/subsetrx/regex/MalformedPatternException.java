/*
 * @LICENSE@
 */

package org.subsetrx.regex;

import java.util.regex.PatternSyntaxException;

/**
 * Thrown by {@link Pattern#compile(String, Alphabet)} when the grouping
 * delimiters of a pattern do not balance: a <code>')'</code> without a
 * preceding <code>'('</code> or vice versa, an unterminated or stray bracket
 * set, an empty bracket set, or a trailing lone backslash.
 */
public final class MalformedPatternException extends PatternSyntaxException {

    private static final long serialVersionUID = 1L;

    public MalformedPatternException(String desc, String regex, int index) {
        super(desc, regex, index);
    }
}
