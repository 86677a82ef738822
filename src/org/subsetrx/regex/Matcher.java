/*
 * @LICENSE@
 */
package org.subsetrx.regex;

import java.util.regex.MatchResult;

/**
 * Analog to the {@link java.util.regex.Matcher} class, with a different notion
 * of "find": {@link #find()} walks every substring of the input - start
 * positions left to right, and for each start the end positions left to right -
 * and stops at each one the pattern matches as a whole. Successive matches may
 * overlap, and a single start position may yield several matches of
 * increasing length. Empty substrings are never tried.
 * <p>
 * There are no capturing groups; {@link #groupCount()} is always zero.
 * <p>
 * Note that like the analagous {@link java.util.regex.Matcher} class of the
 * standard regex package, instances of this class are <em>not</em> thread
 * safe.
 */
public final class Matcher implements MatchResult {

    private final Pattern pattern;
    private CharSequence csq;

    /*
     * scan cursor: the last candidate tried was csq[i, j)
     */
    private int i;
    private int j;

    private boolean found;
    private int start;
    private int end;

    Matcher(Pattern pattern, CharSequence csq) {
        this.pattern = pattern;
        reset(csq);
    }

    public Pattern pattern() {
        return pattern;
    }

    public Matcher reset() {
        return reset(csq);
    }

    public Matcher reset(CharSequence csq) {
        if (csq == null) throw new NullPointerException("input");
        this.csq = csq;
        i = 0;
        j = 0;
        found = false;
        start = -1;
        end = -1;
        return this;
    }

    /**
     * Whole input matching. Does not move the {@link #find()} cursor.
     */
    public boolean matches() {
        if (found = pattern.engine.eval(csq, 0, csq.length())) {
            start = 0;
            end = csq.length();
        }
        return found;
    }

    /**
     * Advances to the next substring, in scan order, which the pattern
     * matches.
     *
     * @return false when the scan is exhausted.
     */
    public boolean find() {
        final int n = csq.length();
        while (i < n) {
            while (j < n) {
                ++j;
                if (pattern.engine.eval(csq, i, j)) {
                    start = i;
                    end = j;
                    return found = true;
                }
            }
            ++i;
            j = i;
        }
        return found = false;
    }

    private void checkMatch() {
        if (!found) throw new IllegalStateException("No match available");
    }

    private static void checkGroup(int group) {
        if (group != 0) throw new IndexOutOfBoundsException("No group " + group);
    }

    public int start() {
        checkMatch();
        return start;
    }

    public int start(int group) {
        checkGroup(group);
        return start();
    }

    public int end() {
        checkMatch();
        return end;
    }

    public int end(int group) {
        checkGroup(group);
        return end();
    }

    public String group() {
        checkMatch();
        return csq.subSequence(start, end).toString();
    }

    public String group(int group) {
        checkGroup(group);
        return group();
    }

    public int groupCount() {
        return 0;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Matcher[pattern=").append(pattern)
            .append(" style=").append(pattern.style())
            .append(" lastmatch=");
        if (found) sb.append(group());
        sb.append(']');
        return sb.toString();
    }
}
