/*
 * @LICENSE@
 */

package org.subsetrx.regex;

/**
 * Thrown when the automaton for a syntactically balanced pattern cannot be
 * built: an operator was applied with too few operands (a leading
 * <code>'*'</code>, a dangling <code>'|'</code> or <code>'$'</code>, etc.),
 * or the construction did not end with exactly one automaton fragment.
 */
public final class BuildException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String operator;
    private final String reason;
    private final String regex;

    public BuildException(String operator, String reason, String regex) {
        super((operator == null ? "" : "operator '" + operator + "': ")
                + reason + " in pattern: " + regex);
        this.operator = operator;
        this.reason = reason;
        this.regex = regex;
    }

    /**
     * @return the symbol of the offending operator, or <code>null</code> if
     *         the failure is the final fragment count.
     */
    public String getOperator() {
        return operator;
    }

    public String getReason() {
        return reason;
    }

    public String getPattern() {
        return regex;
    }
}
