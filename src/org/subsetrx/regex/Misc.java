/*
 * @LICENSE@
 */

package org.subsetrx.regex;

import java.util.AbstractQueue;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.Map;
import java.util.Queue;


/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects, interfaces, classes, and methods.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");
    public static final char EPSILON = '\u03b5';    // display only; never an arc label

    /*
     * idiom suppression for clearing StringBuilders
     */
    public static void clear(StringBuilder sb) {
        sb.delete(0, sb.length());
    }

    private static abstract class Escaper {
        abstract boolean esc(StringBuilder sb, int c);
    }

    private static final class MapEscaper extends Escaper {
        private final Map<Character, String> map =
                new HashMap<Character, String>();

        public boolean esc(StringBuilder sb, int c) {
            boolean ret = (c == (char) c) ? map.containsKey((char) c) : false;
            if (ret)
                sb.append(map.get((char) c));
            return ret;
        }

        MapEscaper map(Character c, String s) {
            map.put(c, s);
            return this;
        }
    }

    private static final MapEscaper rxEscaper =
            new MapEscaper().map('\r', "\\r").map('\n', "\\n").map('\t', "\\t");
    private static final MapEscaper rxpEscaper =
            new MapEscaper().map('\\', "\\\\").map('.', "\\.").map('^', "\\^")
                .map('$', "\\$").map('[', "\\[").map(']', "\\]").map('|', "\\|")
                .map('(', "\\(").map(')', "\\)").map('*', "\\*").map('+', "\\+")
                .map('?', "\\?");

    private static final Escaper unicodeEscaper = new Escaper() {
        public boolean esc(StringBuilder sb, int c) {
            boolean ret = false;
            if (c < 32 || 126 < c) {
                int mark = sb.length();
                sb.append(Integer.toHexString(c));
                while (sb.length() - mark < 4) {
                    sb.insert(mark, "0");
                }
                sb.insert(mark, "\\u");
                ret = true;
            }
            return ret;
        }
    };

    /**
     * A collection of singleton objects which implement methods used to create
     * Strings where certain characters are replaced by escape sequences.
     */
    enum Esc {

        /**
         * Pattern escaper - escapes every operator character with a backslash,
         * leaves everything else alone. The output is a valid pattern which
         * matches the input text literally.
         */
        QUOTE(rxpEscaper),
        /**
         * Display escaper - operator characters as QUOTE, plus some ASCII
         * control characters, non-printable-ASCII and beyond -> \\u codes
         */
        RXP(rxpEscaper, rxEscaper, unicodeEscaper);

        private final Escaper[] path;

        Esc(final Escaper... path) {
            this.path = path;
        }

        void esc(StringBuilder sb, int c) {
            for (Escaper e : path) {
                if (e.esc(sb, c))
                    return;
            }
            sb.append((char) c);
        }

        String esc(int c) {
            StringBuilder sb = new StringBuilder();
            esc(sb, c);
            return sb.toString();
        }

        void esc(StringBuilder sb, CharSequence cs) {
            for (int i = 0; i < cs.length(); ++i) {
                esc(sb, cs.charAt(i));
            }
        }

        String esc(CharSequence cs) {
            StringBuilder sb = new StringBuilder();
            esc(sb, cs);
            return sb.toString();
        }
    }

    static final class IdentitySetQueue<E> extends AbstractQueue<E> {

        final Map<E, Void> map = new IdentityHashMap<E, Void>();
        final LinkedList<E> list = new LinkedList<E>();

        @Override
        public Iterator<E> iterator() {
            return list.iterator();
        }

        @Override
        public int size() {
            assert list.size() == map.size();
            return map.size();
        }

        public boolean offer(E o) {
            if (o == null || map.containsKey(o)) return false;
            map.put(o, null);
            return list.offer(o);
        }

        public E peek() {
            return list.peek();
        }

        public E poll() {
            if (isEmpty()) return null;
            E ret = list.poll();
            assert map.containsKey(ret);
            map.remove(ret);
            return ret;
        }
    }

    /*
     * Generic digraph visitors
     */
    private interface SimpleVertex {
        Iterable<? extends SimpleEdge> edges();
    }
    private interface SimpleEdge {
        SimpleVertex vertex();
    }
    interface Vertex<E extends SimpleEdge> extends SimpleVertex {
        Iterable<E> edges();
    }
    interface Edge<V extends SimpleVertex> extends SimpleEdge {
         V vertex();
    }

    /*
     * The edges of a vertex are read after visit(vertex) returns, so visit()
     * may create them - subset construction discovers states this way.
     */
    static abstract class BreadthFirstVisitor<V extends Vertex<E>, E extends Edge<V>> {

        final Map<V, Void> black = new IdentityHashMap<V, Void>();
        final Queue<V> gray = new IdentitySetQueue<V>();
        V vertex;

        final BreadthFirstVisitor<V, E> start(V init) {
            black.clear(); gray.clear();
            visitFrom(init);
            return this;
        }

        private void visitFrom(V init) {
            gray.offer(init);
            while (!gray.isEmpty()) {
                black.put(vertex = gray.remove(), null);
                visit(vertex);
                for (E edge : vertex.edges()) {
                    if (black.containsKey(edge.vertex())) {
                        visit(edge, false);
                    } else {
                        visit(edge, gray.offer(edge.vertex()));
                    }
                }
            }
        }
        /*
         * tree edges can be identified, but no more without augmenting the data structures.
         */
        protected void visit(E edge, boolean tree) {}
        protected void visit(V vertex) {}
    }
}
