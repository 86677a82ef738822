/* @LICENSE@
 */
package org.subsetrx.regex;

/**
 * An automaton driven whole-string matching algorithm. An Engine holds no
 * per-match state, so one instance serves any number of {@link Matcher}s.
 */
abstract class Engine {

    final EngineStyle style;
    protected Engine(EngineStyle style) {
        this.style = style;
    }

    /**
     * @return true iff the automaton accepts exactly the chars of
     *         <code>csq</code> from <code>start</code> (inclusive) to
     *         <code>end</code> (exclusive).
     */
    abstract protected boolean eval(CharSequence csq, int start, int end);

    @Override
    public final String toString() {
        return style + ": " + doToString();
    }

    protected String doToString() {
        return getClass().getName() + "@" + Integer.toHexString(hashCode());
    }
}
