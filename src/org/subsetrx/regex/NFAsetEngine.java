/* @LICENSE@
 */
package org.subsetrx.regex;

import java.util.BitSet;

/**
 * Simulates the NFA directly, one epsilon closed set of active states per
 * input position. Does the work of subset construction on the fly for just
 * the subsets the input visits, and keeps none of them.
 */
final class NFAsetEngine extends Engine {

    private final NFA nfa;

    NFAsetEngine(EngineStyle style, NFA nfa) {
        super(style);
        this.nfa = nfa;
    }

    @Override
    protected boolean eval(CharSequence csq, int start, int end) {
        BitSet active = nfa.initial();
        for (int i = start; i < end; ++i) {
            char c = csq.charAt(i);
            if (!nfa.alphabet.contains(c)) return false;
            active = nfa.closure(nfa.move(active, c));
            if (active.isEmpty()) return false;
        }
        return nfa.accepts(active);
    }

    @Override
    protected String doToString() {
        return nfa.size() + " nfa states";
    }
}
