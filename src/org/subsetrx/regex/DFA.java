/* @LICENSE@
 */


package org.subsetrx.regex;


import static org.subsetrx.regex.Misc.LS;
import static org.subsetrx.regex.Misc.clear;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.subsetrx.regex.Misc.BreadthFirstVisitor;
import org.subsetrx.regex.Misc.Edge;
import org.subsetrx.regex.Misc.Vertex;



final class DFA {

    private static final Logger logger = Logger.getLogger("org.subsetrx.regex");
    // private static final Level level = Level.INFO;
    private static final Level level = Level.FINEST;

    /**
     * An entry in the transition table: a symbol mapped to a next state.
     */
    static final class Arc implements Edge<State> {

        final char c;
        final State ns;

        private Arc(char c, State ns) {
            this.c = c;
            this.ns = ns;
        }

        public State vertex() {
            return ns;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append('{').append(Misc.Esc.RXP.esc(c)).append(" -> ");
            ns.toLabel(sb);
            sb.append('}');
            return sb.toString();
        }
    }


    static final class State implements Vertex<Arc> {

        final int id;
        private final BitSet nfaStates;
        /* private */ Arc[] arcs;   // sorted by symbol; set once, during construction
        final boolean accept;

        private State(int id, NFA nfa, BitSet nfaStates) {
            this.id = id;
            this.nfaStates = nfaStates;
            this.accept = nfa.accepts(nfaStates);
        }

        private void arcs(Arc[] arcs) {
            this.arcs = arcs;
        }

        public Iterable<Arc> edges() {
            return Collections.unmodifiableList(Arrays.asList(arcs));
        }

        BitSet nfaStates() {
            return (BitSet) nfaStates.clone();
        }

        private String toLabel(StringBuilder sb) {
            final int mark = sb.length();
            for (int id = nfaStates.nextSetBit(0); id >= 0;
                    id = nfaStates.nextSetBit(id + 1)) {
                sb.append(sb.length() == mark ? '{' : ',');
                sb.append(id);
            }
            sb.append('}');
            return sb.toString();
        }

        String toLabel() {
            return toLabel(new StringBuilder());
        }

        private static final String INDENT = "    ";
        private transient StringBuilder sb = new StringBuilder();

        @Override
        public String toString() {

            clear(sb);

            sb.append("state: ").append(id).append(' ');
            toLabel(sb);        sb.append(' ');
            if (accept)         sb.append("(accept) ");
            sb.append(LS);

            for (Arc arc : arcs) {
                sb.append(INDENT).append(arc).append(LS);
            }

            return sb.toString();
        }
    }

    /*
     * Binary search of a sorted arc table.
     */
    static State delta(char c, Arc[] arcs) {
        int lo = 0;
        int hi = arcs.length;
        while (lo < hi) {
            int m = (hi + lo) >>> 1;
            if (arcs[m].c < c) {
                lo = m + 1;
            } else if (c < arcs[m].c) {
                hi = m;
            } else {
                return arcs[m].ns;
            }
        }
        return null;
    }

    final NFA nfa;
    final State init;
    private final Collection<State> states;

    /**
     * Construct a complete DFA from an NFA: subset construction over the
     * states reachable from the epsilon closure of the NFA start state. Each
     * distinct set of NFA states, compared as a set, becomes exactly one DFA
     * state. Nothing is added after the constructor returns.
     *
     * @param nfa
     */
    DFA(final NFA nfa) {

        this.nfa = nfa;

        final class StateFactory {

            private final Map<BitSet, State> map =
                new LinkedHashMap<BitSet, State>();

            private State stateFrom(BitSet nfaStates) {
                State state = map.get(nfaStates);
                if (state == null) {
                    state = new State(map.size(), nfa, nfaStates);
                    map.put(state.nfaStates, state);
                }
                return state;
            }
        }
        final StateFactory factory = new StateFactory();
        final char[] sigma = nfa.alphabet.symbols();

        /*
         * Subset construction as breadth first search
         */
        init = factory.stateFrom(nfa.initial());
        new BreadthFirstVisitor<State, Arc>() {

            final List<Arc> arcs = new ArrayList<Arc>();

            /*
             * Create all the arcs for the state already discovered.
             */
            @Override
            protected void visit(State state) {
                arcs.clear();
                for (char c : sigma) {
                    BitSet next = nfa.closure(nfa.move(state.nfaStates, c));
                    if (!next.isEmpty()) {
                        arcs.add(new Arc(c, factory.stateFrom(next)));
                    }
                }
                // sigma is sorted, so the arcs are too
                state.arcs(arcs.toArray(new Arc[arcs.size()]));
            }
        }.start(init);

        this.states = Collections.unmodifiableCollection(factory.map.values());

        assert new Object() {
            boolean test() {
                for (State state : states) {
                    if (state.arcs == null) return false;
                    for (int i = 1; i < state.arcs.length; ++i) {
                        if (state.arcs[i - 1].c >= state.arcs[i].c) return false;
                    }
                }
                return true;
            }
        }.test();

        if (logger.isLoggable(level)) {
            logger.log(level, "dfa: " + toString(), this);
        }
    }

    /**
     * @return the states in order of discovery; the first is {@link #init}.
     */
    Iterable<State> states() {
        return states;
    }

    int size() {
        return states.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        int nArcs = 0;
        for (State state : states) nArcs += state.arcs.length;
        sb
            .append("total states: ").append(size())
            .append(" total arcs ").append(nArcs)
            .append(LS);
        for (State state : states) {
            sb.append(state);
        }
        return sb.toString();
    }
}
