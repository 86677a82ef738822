/*
 * @LICENSE@
 */

/**
 * NFA: Nondeterministic Finite Automata - Thompson's construction.
 */
package org.subsetrx.regex;

import static org.subsetrx.regex.Misc.LS;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;


final class NFA {

    private static final Logger logger = Logger.getLogger("org.subsetrx.regex");
    private static final Level level = Level.FINER;

    /**
     * A node of the automaton graph. States are addressed by their
     * {@link #id}, which is also their index in the arena of the NFA which
     * created them; state sets are {@link BitSet}s of ids.
     */
    static final class State {

        final int id;
        boolean accept;
        private final Map<Character, List<State>> arcs =
                new TreeMap<Character, List<State>>();
        private final List<State> epsilons = new ArrayList<State>(2);

        private State(int id, boolean accept) {
            this.id = id;
            this.accept = accept;
        }

        private void arc(char c, State ns) {
            List<State> nss = arcs.get(c);
            if (nss == null) {
                arcs.put(c, nss = new ArrayList<State>(1));
            }
            if (!nss.contains(ns)) nss.add(ns);
        }

        private void epsilon(State ns) {
            if (!epsilons.contains(ns)) epsilons.add(ns);
        }

        /**
         * @return the symbols which have at least one non-epsilon transition
         *         out of this state, ascending.
         */
        Iterable<Character> symbols() {
            return Collections.unmodifiableSet(arcs.keySet());
        }

        List<State> next(char c) {
            List<State> nss = arcs.get(c);
            return nss == null
                    ? Collections.<State>emptyList()
                    : Collections.unmodifiableList(nss);
        }

        List<State> epsilons() {
            return Collections.unmodifiableList(epsilons);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append("state: ").append(id);
            if (accept) sb.append(" (accept)");
            for (Map.Entry<Character, List<State>> e : arcs.entrySet()) {
                sb.append(LS).append("    ")
                    .append(Misc.Esc.RXP.esc(e.getKey().charValue())).append(" -> ");
                appendIds(sb, e.getValue());
            }
            if (!epsilons.isEmpty()) {
                sb.append(LS).append("    ").append(Misc.EPSILON).append(" -> ");
                appendIds(sb, epsilons);
            }
            return sb.toString();
        }

        private static void appendIds(StringBuilder sb, List<State> states) {
            final int mark = sb.length();
            for (State s : states) {
                sb.append(sb.length() == mark ? '{' : ',').append(s.id);
            }
            sb.append('}');
        }
    }

    /**
     * A single entry, single exit sub-automaton. Before it is combined into a
     * larger fragment, <code>accept</code> is the one accepting state
     * reachable from <code>start</code>.
     */
    static final class Fragment {
        final State start;
        final State accept;

        Fragment(State start, State accept) {
            assert accept.accept;
            this.start = start;
            this.accept = accept;
        }
    }

    final String regex;
    final Alphabet alphabet;
    final List<Token> postfix;
    private final List<State> states = new ArrayList<State>();
    final State start;
    final State accept;

    /**
     * Thompson's construction over the postfix token stream, using an
     * explicit stack of fragments.
     *
     * @param regex
     *            the pattern text, for error reporting.
     * @param postfix
     *            the output of {@link RegexParser#parse(String)}.
     * @param alphabet
     *            bounds negation.
     * @throws BuildException
     *             if an operator finds too few operands on the stack, or
     *             the stack does not end with exactly one fragment.
     */
    NFA(String regex, List<Token> postfix, Alphabet alphabet) {

        this.regex = regex;
        this.alphabet = alphabet;
        this.postfix = postfix;

        final LinkedList<Fragment> stack = new LinkedList<Fragment>();

        for (Token t : postfix) {
            if (stack.size() < t.type.arity) {
                throw new BuildException(t.type.symbol, "requires "
                        + t.type.arity + " operand(s), found " + stack.size(),
                        regex);
            }
            switch (t.type) {
            case LITERAL:
            case SET:
                stack.push(chain(t.text));
                break;
            case CONCAT: {
                Fragment f2 = stack.pop();
                Fragment f1 = stack.pop();
                stack.push(concat(f1, f2));
                break;
            }
            case ALT: {
                Fragment f2 = stack.pop();
                Fragment f1 = stack.pop();
                stack.push(alt(f1, f2));
                break;
            }
            case STAR:
                stack.push(star(stack.pop()));
                break;
            case PLUS:
                stack.push(plus(stack.pop()));
                break;
            case QUESTION:
                stack.push(question(stack.pop()));
                break;
            case NEGATE:
                stack.push(negate(stack.pop()));
                break;
            case ANCHOR_START:
                stack.push(anchorStart(stack.pop()));
                break;
            case ANCHOR_END:
                stack.push(anchorEnd(stack.pop()));
                break;
            default:
                throw new AssertionError(t);
            }
        }
        if (stack.size() != 1) {
            throw new BuildException(null, "expected exactly one fragment, found "
                    + stack.size(), regex);
        }
        Fragment f = stack.pop();
        this.start = f.start;
        this.accept = f.accept;

        logger.log(level, "nfa: " + regex + " states: " + states.size());
    }

    private State newState(boolean accept) {
        State s = new State(states.size(), accept);
        states.add(s);
        return s;
    }

    /*
     * demote the old accept state, link it onward.
     */
    private static void demote(State oldAccept, State... targets) {
        oldAccept.accept = false;
        for (State target : targets) {
            oldAccept.epsilon(target);
        }
    }

    /*
     * A literal, or the joined text of a set literal: one transition per
     * symbol, in sequence.
     */
    private Fragment chain(String text) {
        State start = newState(false);
        State s = start;
        for (int i = 0; i < text.length(); ++i) {
            State ns = newState(i == text.length() - 1);
            s.arc(text.charAt(i), ns);
            s = ns;
        }
        return new Fragment(start, s);
    }

    private Fragment concat(Fragment f1, Fragment f2) {
        demote(f1.accept, f2.start);
        return new Fragment(f1.start, f2.accept);
    }

    private Fragment alt(Fragment f1, Fragment f2) {
        State start = newState(false);
        State accept = newState(true);
        start.epsilon(f1.start);
        start.epsilon(f2.start);
        demote(f1.accept, accept);
        demote(f2.accept, accept);
        return new Fragment(start, accept);
    }

    private Fragment star(Fragment f) {
        State start = newState(false);
        State accept = newState(true);
        start.epsilon(f.start);
        start.epsilon(accept);
        demote(f.accept, f.start, accept);
        return new Fragment(start, accept);
    }

    /*
     * as star, minus the bypass: at least one pass through f.
     */
    private Fragment plus(Fragment f) {
        State start = newState(false);
        State accept = newState(true);
        start.epsilon(f.start);
        demote(f.accept, f.start, accept);
        return new Fragment(start, accept);
    }

    private Fragment question(Fragment f) {
        State start = newState(false);
        State accept = newState(true);
        start.epsilon(f.start);
        start.epsilon(accept);
        demote(f.accept, accept);
        return new Fragment(start, accept);
    }

    /*
     * Every alphabet symbol not already leaving f.start goes straight to the
     * new accept state. Exact for a single literal operand only; f itself is
     * abandoned.
     */
    private Fragment negate(Fragment f) {
        State start = newState(false);
        State accept = newState(true);
        for (char c : alphabet.symbols()) {
            if (f.start.next(c).isEmpty()) {
                start.arc(c, accept);
            }
        }
        return new Fragment(start, accept);
    }

    private Fragment anchorStart(Fragment f) {
        State start = newState(false);
        start.epsilon(f.start);
        return new Fragment(start, f.accept);
    }

    private Fragment anchorEnd(Fragment f) {
        State accept = newState(true);
        demote(f.accept, accept);
        return new Fragment(f.start, accept);
    }

    int size() {
        return states.size();
    }

    State state(int id) {
        return states.get(id);
    }

    /**
     * Work-list computation of the smallest superset of <code>ids</code>
     * closed under epsilon transitions.
     */
    BitSet closure(BitSet ids) {
        BitSet ret = (BitSet) ids.clone();
        LinkedList<State> work = new LinkedList<State>();
        for (int id = ids.nextSetBit(0); id >= 0; id = ids.nextSetBit(id + 1)) {
            work.push(states.get(id));
        }
        while (!work.isEmpty()) {
            for (State ns : work.pop().epsilons) {
                if (!ret.get(ns.id)) {
                    ret.set(ns.id);
                    work.push(ns);
                }
            }
        }
        return ret;
    }

    BitSet move(BitSet ids, char c) {
        BitSet ret = new BitSet(states.size());
        for (int id = ids.nextSetBit(0); id >= 0; id = ids.nextSetBit(id + 1)) {
            for (State ns : states.get(id).next(c)) {
                ret.set(ns.id);
            }
        }
        return ret;
    }

    BitSet initial() {
        BitSet ids = new BitSet(states.size());
        ids.set(start.id);
        return closure(ids);
    }

    boolean accepts(BitSet ids) {
        for (int id = ids.nextSetBit(0); id >= 0; id = ids.nextSetBit(id + 1)) {
            if (states.get(id).accept) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("nfa: ").append(regex)
            .append(" postfix: ").append(Token.stringFrom(postfix))
            .append(" start: ").append(start.id)
            .append(" accept: ").append(accept.id).append(LS);
        for (State s : states) {
            sb.append(s).append(LS);
        }
        return sb.toString();
    }
}
