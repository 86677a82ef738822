/* @LICENSE@
 */

package org.subsetrx.regex;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;

public class AlphabetTestCase extends AbstractRxTestCase {

    public AlphabetTestCase(String name) {
        super(name);
    }

    public void testSortedAndDistinct() {
        Alphabet a = Alphabet.of("cabbac");
        assertEquals(3, a.size());
        assertTrue(Arrays.equals(new char[] {'a', 'b', 'c'}, a.symbols()));
        assertEquals(ABC, a);
        assertEquals(ABC.hashCode(), a.hashCode());
    }

    public void testFromCollection() {
        HashSet<Character> set = new HashSet<Character>(Arrays.asList('z', 'x', 'y'));
        assertEquals(Alphabet.of("xyz"), Alphabet.of(set));
    }

    public void testRange() {
        assertEquals(26, LOWER.size());
        assertTrue(LOWER.contains('a'));
        assertTrue(LOWER.contains('z'));
        assertFalse(LOWER.contains('A'));
        assertEquals(Alphabet.of("0123456789"), Alphabet.range('0', '9'));
        try {
            Alphabet.range('z', 'a');
            fail("should throw");
        } catch (IllegalArgumentException e) {}
    }

    public void testUnion() {
        Alphabet a = Alphabet.of("ab").union(Alphabet.of("bc"));
        assertEquals(ABC, a);
    }

    public void testEpsilonRejected() {
        try {
            Alphabet.of("a\u03b5");
            fail("should throw");
        } catch (IllegalArgumentException e) {}
    }

    public void testSymbolsIsACopy() {
        char[] symbols = ABC.symbols();
        symbols[0] = 'z';
        assertTrue(ABC.contains('a'));
        assertFalse(ABC.contains('z'));
    }

    public void testIterator() {
        StringBuilder sb = new StringBuilder();
        for (char c : Alphabet.of("cba")) {
            sb.append(c);
        }
        assertEquals("abc", sb.toString());
        Iterator<Character> it = ABC.iterator();
        it.next(); it.next(); it.next();
        assertFalse(it.hasNext());
    }

    public void testEmpty() {
        Alphabet empty = Alphabet.of("");
        assertEquals(0, empty.size());
        assertTrue(Pattern.compile("a*", empty).matches(""));
        assertFalse(Pattern.compile("a*", empty).matches("a"));
    }

    public void testToString() {
        assertEquals("{abc}", ABC.toString());
        assertEquals("{\\*a}", Alphabet.of("a*").toString());
    }
}
