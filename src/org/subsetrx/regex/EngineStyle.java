/* @LICENSE@
 */
package org.subsetrx.regex;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Represents each implemented matching algorithm. Internally, this enum
 * class is used as a factory to create matcher "Engine"s. Both algorithms are
 * purely automaton driven and produce identical results for every pattern
 * and input; they differ in where the subset construction work is done.
 */
public enum EngineStyle {

    /**
     * The default style: the complete DFA is built by subset construction
     * when the pattern is compiled, and matching walks its transition
     * tables.
     */
    DFA_TABLE {
        @Override
        Engine newEngine(NFA nfa) {
            return new DFAtableEngine(this, nfa);
        }
    },

    /**
     * Simulation of the NFA, tracking the set of active states. Compiles
     * faster and matches slower than {@link #DFA_TABLE}.
     */
    NFA_SET {
        @Override
        Engine newEngine(NFA nfa) {
            return new NFAsetEngine(this, nfa);
        }
    };

    private static final Logger logger = Logger.getLogger("org.subsetrx.regex");
    private static final Level level = Level.FINEST;

    abstract Engine newEngine(NFA nfa);

    Engine engineFor(NFA nfa) {
        Engine engine = newEngine(nfa);
        logger.log(level, "engine: " + engine);
        return engine;
    }
}
