/*
 * @LICENSE@
 */

/**
 * <h3><b>subsetrx</b> - A small finite automata based Java pattern matching
 * package: Thompson's construction and the subset construction, end to end.</h3>
 * <p>
 * <h4>Pipeline.</h4>
 * <p>
 * A pattern goes through four stages, each depending only on the ones before
 * it:
 * <ol>
 * <li>An operator precedence parser turns the infix pattern into a postfix
 * token stream, making implicit concatenation explicit.</li>
 * <li>Thompson's construction turns the postfix stream into an NFA with one
 * start and one accepting state, one fixed local graph transformation per
 * operator.</li>
 * <li>The subset construction turns the NFA into a DFA, eagerly, over the
 * symbols of the caller supplied {@link org.subsetrx.regex.Alphabet}. Each DFA
 * state stands for one epsilon closed set of NFA states.</li>
 * <li>The matching engine walks the DFA one input char at a time. There is no
 * backtracking: a char without a transition is a failed match.</li>
 * </ol>
 * Every operation is built on whole-string matching. Substring operations
 * ({@link org.subsetrx.regex.Pattern#findAll(CharSequence) findAll},
 * {@link org.subsetrx.regex.Pattern#search(CharSequence) search},
 * {@link org.subsetrx.regex.Pattern#split(CharSequence) split},
 * {@link org.subsetrx.regex.Pattern#substitute(String, CharSequence) substitute})
 * try every non-empty substring: lowest start first, and for each start the
 * shortest first. This ordering is part of the contract.
 * <p>
 * <h4>What this package does not do.</h4>
 * <ul>
 * <li>Parenthesis group; they do not capture.</li>
 * <li>Bracket sets are literal text, not character classes, and negation
 * (<code>^</code> after an operand, or <code>[^...]</code>) excludes the
 * symbols its operand starts with - exact for single symbols only.</li>
 * <li>No DFA minimization, no streaming input, no Unicode classes: the
 * alphabet is whatever the caller says it is.</li>
 * <li>No implicit caching. {@link org.subsetrx.regex.Regex} compiles on every
 * call; {@link org.subsetrx.regex.PatternCache} is there for callers who want
 * otherwise. The DFA of a pathological pattern can be exponential in the
 * size of the NFA, and nothing stops its construction.</li>
 * </ul>
 * <h4>References:</h4>
 * <ul>
 * <li>For an introduction to the theory behind regular expression and their
 * implementation as automata, see the first chapters of the <a
 * href="http://en.wikipedia.org/wiki/Compilers:_Principles,_Techniques,_and_Tools">Dragon
 * Book.</a>
 * <li>Russ Cox, <a href="http://swtch.com/~rsc/regexp/regexp1.html">Regular
 * Expression Matching Can Be Simple And Fast</a>, which walks through
 * Thompson's construction and NFA simulation.</li>
 * </ul>
 */
package org.subsetrx.regex;
