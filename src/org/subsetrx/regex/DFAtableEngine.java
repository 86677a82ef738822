/* @LICENSE@
 */
package org.subsetrx.regex;

import static org.subsetrx.regex.DFA.State;

final class DFAtableEngine extends Engine {

    private final DFA dfa;
    DFA dfa() {
        return dfa;
    }

    DFAtableEngine(EngineStyle style, NFA nfa) {
        super(style);
        dfa = new DFA(nfa);
    }

    /*
     * No backtracking: a char with no arc out of the current state is a
     * failed match.
     */
    @Override
    protected boolean eval(CharSequence csq, int start, int end) {
        State state = dfa.init;
        for (int i = start; i < end; ++i) {
            state = DFA.delta(csq.charAt(i), state.arcs);
            if (state == null) return false;
        }
        return state.accept;
    }

    @Override
    protected String doToString() {
        return dfa.size() + " states";
    }
}
