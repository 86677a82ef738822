/*
 * @LICENSE@
 */

package org.subsetrx.regex;

import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * The finite set of symbols every automaton of a {@link Pattern} is defined
 * over. The alphabet bounds subset construction (only symbols of the alphabet
 * are explored) and gives meaning to negation: a negated pattern matches the
 * symbols of the alphabet its operand does not start with.
 * <p>
 * Any character that may legally appear in matched input must be a member.
 * Characters outside the alphabet never match anything; they are not an
 * error. The epsilon symbol (<code>'ε'</code>) denotes the empty
 * transition and can never be a member.
 * <p>
 * Instances are immutable; the symbols are kept sorted and de-duplicated, so
 * two alphabets with the same members are {@linkplain #equals(Object) equal}
 * regardless of the order they were supplied in.
 */
public final class Alphabet implements Iterable<Character> {

    /**
     * The 26 lowercase ASCII letters.
     */
    public static final Alphabet LOWERCASE = range('a', 'z');

    private final char[] symbols;

    private Alphabet(char[] symbols) {
        this.symbols = symbols;
    }

    private static Alphabet from(char[] raw) {
        char[] sorted = raw.clone();
        Arrays.sort(sorted);
        int n = 0;
        for (int i = 0; i < sorted.length; ++i) {
            if (sorted[i] == Misc.EPSILON) {
                throw new IllegalArgumentException(
                    "epsilon is not an alphabet symbol");
            }
            if (n == 0 || sorted[n - 1] != sorted[i]) {
                sorted[n++] = sorted[i];
            }
        }
        return new Alphabet(Arrays.copyOf(sorted, n));
    }

    public static Alphabet of(CharSequence symbols) {
        char[] raw = new char[symbols.length()];
        for (int i = 0; i < raw.length; ++i) {
            raw[i] = symbols.charAt(i);
        }
        return from(raw);
    }

    public static Alphabet of(Collection<Character> symbols) {
        char[] raw = new char[symbols.size()];
        int i = 0;
        for (Character c : symbols) {
            raw[i++] = c;
        }
        return from(raw);
    }

    /**
     * @param first
     *            the lowest symbol, inclusive.
     * @param last
     *            the highest symbol, inclusive.
     * @return the alphabet of all chars between <code>first</code> and
     *         <code>last</code>.
     */
    public static Alphabet range(char first, char last) {
        if (last < first) {
            throw new IllegalArgumentException(
                "empty range: " + Misc.Esc.RXP.esc(first) + '-'
                + Misc.Esc.RXP.esc(last));
        }
        char[] raw = new char[last - first + 1];
        for (int i = 0; i < raw.length; ++i) {
            raw[i] = (char) (first + i);
        }
        return from(raw);
    }

    public Alphabet union(Alphabet other) {
        char[] raw = Arrays.copyOf(symbols, symbols.length + other.symbols.length);
        System.arraycopy(other.symbols, 0, raw, symbols.length, other.symbols.length);
        return from(raw);
    }

    public boolean contains(char c) {
        return Arrays.binarySearch(symbols, c) >= 0;
    }

    public int size() {
        return symbols.length;
    }

    /**
     * @return a copy of the symbols, in ascending order.
     */
    public char[] symbols() {
        return symbols.clone();
    }

    public Iterator<Character> iterator() {
        return new Iterator<Character>() {
            private int i = 0;

            public boolean hasNext() {
                return i < symbols.length;
            }

            public Character next() {
                if (!hasNext()) throw new NoSuchElementException();
                return symbols[i++];
            }

            public void remove() {
                throw new UnsupportedOperationException();
            }
        };
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(symbols);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alphabet))
            return false;
        return Arrays.equals(symbols, ((Alphabet) o).symbols);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('{');
        Misc.Esc.RXP.esc(sb, new String(symbols));
        sb.append('}');
        return sb.toString();
    }
}
