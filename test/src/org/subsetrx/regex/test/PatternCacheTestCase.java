/* @LICENSE@
 */

package org.subsetrx.regex.test;

import org.subsetrx.regex.AbstractRxTestCase;
import org.subsetrx.regex.Alphabet;
import org.subsetrx.regex.BuildException;
import org.subsetrx.regex.EngineStyle;
import org.subsetrx.regex.Pattern;
import org.subsetrx.regex.PatternCache;

public class PatternCacheTestCase extends AbstractRxTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(PatternCacheTestCase.class);
    }

    public PatternCacheTestCase(String name) {
        super(name);
    }

    public void testHit() {
        PatternCache cache = new PatternCache();
        assertEquals(PatternCache.DEFAULT_CAPACITY, cache.capacity());
        Pattern p = cache.compile("a*b", LOWER);
        assertSame(p, cache.compile("a*b", LOWER));
        // equal alphabets, not only the same instance
        assertSame(p, cache.compile("a*b", Alphabet.range('a', 'z')));
        assertSame(p, cache.compile("a*b", LOWER, EngineStyle.DFA_TABLE));
        assertEquals(1, cache.size());
        assertTrue(p.matches("aab"));
    }

    public void testKeyParts() {
        PatternCache cache = new PatternCache();
        Pattern p = cache.compile("a^", LOWER);
        Pattern q = cache.compile("a^", ABC);
        Pattern r = cache.compile("a^", LOWER, EngineStyle.NFA_SET);
        assertNotSame(p, q);
        assertNotSame(p, r);
        assertEquals(3, cache.size());
        assertTrue(p.matches("z"));
        assertFalse(q.matches("z"));
        assertSame(EngineStyle.NFA_SET, r.style());
    }

    public void testEviction() {
        PatternCache cache = new PatternCache(2);
        Pattern a = cache.compile("a", LOWER);
        Pattern b = cache.compile("b", LOWER);
        assertSame(a, cache.compile("a", LOWER));    // b is now eldest
        cache.compile("c", LOWER);
        assertEquals(2, cache.size());
        assertSame(a, cache.compile("a", LOWER));
        assertNotSame(b, cache.compile("b", LOWER));
        cache.clear();
        assertEquals(0, cache.size());
    }

    public void testFailuresNotCached() {
        PatternCache cache = new PatternCache();
        for (int i = 0; i < 2; ++i) {
            try {
                cache.compile("a|", LOWER);
                fail();
            } catch (BuildException e) {}
        }
        assertEquals(0, cache.size());
    }

    public void testArguments() {
        try {
            new PatternCache(0);
            fail();
        } catch (IllegalArgumentException e) {}
        try {
            new PatternCache().compile(null, LOWER);
            fail();
        } catch (NullPointerException e) {}
        try {
            new PatternCache().compile("a", null);
            fail();
        } catch (NullPointerException e) {}
    }
}
