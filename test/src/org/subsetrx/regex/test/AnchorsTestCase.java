/* @LICENSE@
 */

package org.subsetrx.regex.test;

import org.subsetrx.regex.AbstractRxTestCase;

import static org.subsetrx.regex.RegexAssert.*;


public class AnchorsTestCase extends AbstractRxTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(AnchorsTestCase.class);
    }

    public AnchorsTestCase(String arg0) {
        super(arg0);
    }

    public void testStartAnchor() {
        assertMatches("^a", LOWER, "a");
        assertNotMatches("^a", LOWER, "ba");
        assertMatches("(^a)|b", LOWER, "a");
        assertMatches("(^a)|b", LOWER, "b");
        assertMatches("a|^b", LOWER, "a");
        assertMatches("a|^b", LOWER, "b");
        assertMatches("^^a", LOWER, "a");
        assertMatches("^a*", LOWER, "");
        assertMatches("^a*", LOWER, "aaa");
    }

    public void testEndAnchor() {
        assertMatches("a$", LOWER, "a");
        assertNotMatches("a$", LOWER, "ab");
        assertMatches("a$$", LOWER, "a");
        // anchors consume nothing, so they never constrain a whole string match
        assertMatches("a$b", LOWER, "ab");
        assertMatches("^a$", LOWER, "a");
    }

    public void testNegation() {
        assertMatches("a^", ABC, "b");
        assertMatches("a^", ABC, "c");
        assertNotMatches("a^", ABC, "a");
        assertNotMatches("a^", ABC, "");
        // twice negated: back to the operand
        assertMatches("a^^", ABC, "a");
        assertNotMatches("a^^", ABC, "b");
        assertMatches("x(a^)y", ABC.union(LOWER), "xby");
        assertNotMatches("x(a^)y", ABC.union(LOWER), "xay");
    }

    public void testSets() {
        assertMatches("[ab]", ABC, "ab");
        assertNotMatches("[ab]", ABC, "a");
        assertNotMatches("[ab]", ABC, "b");
        // negation looks at the first symbol of the joined text
        assertNotMatches("[^ab]", ABC, "a");
        assertMatches("[^ab]", ABC, "b");
        assertMatches("[^ab]", ABC, "c");
        assertMatches("[ab]*", ABC, "ababab");
        assertNotMatches("[ab]*", ABC, "aba");
    }

    public void testBareAnchors() {
        assertEquals("\\A", assertBuildFails("^").getOperator());
        assertEquals("$", assertBuildFails("$").getOperator());
        assertEquals("$", assertBuildFails("$a").getOperator());
    }
}
