/* @LICENSE@
 */

package org.subsetrx.regex;

import static org.subsetrx.regex.RegexAssert.*;

import java.util.List;

public class RegexParserTestCase extends AbstractRxTestCase {

    public RegexParserTestCase(String name) {
        super(name);
    }

    public void testImplicitConcat() {
        assertEquals("a", postfixOf("a"));
        assertEquals("ab.", postfixOf("ab"));
        assertEquals("ab.c.", postfixOf("abc"));
        assertEquals("ab.", postfixOf("a.b"));     // explicit
    }

    public void testPrecedence() {
        assertEquals("ab|", postfixOf("a|b"));
        assertEquals("a*b.c|", postfixOf("a*b|c"));
        assertEquals("ab*.", postfixOf("ab*"));
        assertEquals("ab*c.|", postfixOf("a|b*c"));
        assertEquals("a?b+.", postfixOf("a?b+"));
        assertEquals("a$", postfixOf("a$"));
    }

    public void testGroups() {
        assertEquals("ab.", postfixOf("(ab)"));
        assertEquals("ab.*", postfixOf("(ab)*"));
        assertEquals("abc|.", postfixOf("a(b|c)"));
        assertEquals("ab|c.", postfixOf("(a|b)c"));
        assertEquals("ab.c.", postfixOf("((a)(b))c"));
    }

    public void testCaret() {
        // opens a fragment: start anchor
        assertEquals("a\\A", postfixOf("^a"));
        assertEquals("ab.\\A", postfixOf("^(ab)"));
        assertEquals("ab\\A|", postfixOf("a|^b"));
        assertEquals("a\\A*", postfixOf("^a*"));   // ^ binds tighter than *
        // follows an operand: negation
        assertEquals("a^", postfixOf("a^"));
        assertEquals("ab^.", postfixOf("ab^"));
    }

    public void testSets() {
        assertEquals("[abc]", postfixOf("[abc]"));
        assertEquals("[a]^", postfixOf("[^a]"));
        assertEquals("x[ab]^.", postfixOf("x[^ab]"));
        assertEquals("[ab]*", postfixOf("[ab]*"));
        // operators are verbatim inside brackets
        assertEquals("[\\*\\|]", postfixOf("[*|]"));
        assertEquals("x[y\\]].", postfixOf("x[y\\]]"));

        List<Token> tokens = tokensOf("[ab]");
        assertEquals(1, tokens.size());
        assertEquals(Token.Type.SET, tokens.get(0).type);
        assertEquals("ab", tokens.get(0).text);
    }

    public void testEscape() {
        assertEquals("\\*a.", postfixOf("\\*a"));
        assertEquals("\\(\\).\\|.\\..", postfixOf("\\(\\)\\|\\."));
        List<Token> tokens = tokensOf("\\*");
        assertEquals(Token.literal('*'), tokens.get(0));
    }

    /*
     * the parser checks balance only; operand counts are the builder's job.
     */
    public void testUnderflowParses() {
        assertEquals("*a.", postfixOf("*a"));
        assertEquals("a|", postfixOf("a|"));
        assertEquals("\\A", postfixOf("^"));
        assertEquals("", postfixOf(""));
    }

    public void testSyntax() {
        assertEquals(0, assertMalformed(")a").getIndex());
        assertEquals(3, assertMalformed("(a))").getIndex());
        assertEquals(0, assertMalformed("(a").getIndex());
        assertEquals(1, assertMalformed("a(b").getIndex());
        assertEquals(1, assertMalformed("a(b(c)").getIndex());
        assertEquals(0, assertMalformed("[ab").getIndex());
        assertEquals(1, assertMalformed("a]").getIndex());
        assertEquals(0, assertMalformed("[]").getIndex());
        assertEquals(0, assertMalformed("[^]").getIndex());
        assertEquals(1, assertMalformed("a\\").getIndex());
        assertEquals(2, assertMalformed("[a\\").getIndex());
    }

    public void testMalformedDescription() {
        MalformedPatternException e = assertMalformed(")a");
        assertEquals("unbalanced ')'", e.getDescription());
    }
}
