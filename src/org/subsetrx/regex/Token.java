/*
 * @LICENSE@
 */

package org.subsetrx.regex;

import java.util.List;

/**
 * An element of the postfix (operator last) token stream produced by the
 * {@link RegexParser} and consumed by the {@link NFA} construction. Operand
 * tokens carry their text; operator tokens are shared singletons.
 */
final class Token {

    enum Type {
        LITERAL     (0, 0, ""),
        SET         (0, 0, ""),
        ALT         (1, 2, "|"),
        CONCAT      (2, 2, "."),
        PLUS        (3, 1, "+"),
        QUESTION    (4, 1, "?"),
        STAR        (5, 1, "*"),
        NEGATE      (6, 1, "^"),
        ANCHOR_START(6, 1, "\\A"),
        ANCHOR_END  (7, 1, "$"),
        /*
         * Only ever on the parser's operator stack, never in the output.
         */
        GROUP       (8, 0, "(");

        final int precedence;
        final int arity;
        final String symbol;

        Type(int precedence, int arity, String symbol) {
            this.precedence = precedence;
            this.arity = arity;
            this.symbol = symbol;
        }
    }

    static final Token ALT          = new Token(Type.ALT, null);
    static final Token CONCAT       = new Token(Type.CONCAT, null);
    static final Token PLUS         = new Token(Type.PLUS, null);
    static final Token QUESTION     = new Token(Type.QUESTION, null);
    static final Token STAR         = new Token(Type.STAR, null);
    static final Token NEGATE       = new Token(Type.NEGATE, null);
    static final Token ANCHOR_START = new Token(Type.ANCHOR_START, null);
    static final Token ANCHOR_END   = new Token(Type.ANCHOR_END, null);
    static final Token GROUP        = new Token(Type.GROUP, null);

    final Type type;
    final String text;  // null for operators

    private Token(Type type, String text) {
        this.type = type;
        this.text = text;
    }

    static Token literal(char c) {
        return new Token(Type.LITERAL, String.valueOf(c));
    }

    static Token set(String text) {
        assert text.length() > 0;
        return new Token(Type.SET, text);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + (text == null ? 0 : text.hashCode());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Token))
            return false;
        final Token t = (Token) o;
        return type == t.type
                && (text == null ? t.text == null : text.equals(t.text));
    }

    @Override
    public String toString() {
        switch (type) {
        case LITERAL:
            return Misc.Esc.RXP.esc(text);
        case SET:
            return '[' + Misc.Esc.RXP.esc(text) + ']';
        default:
            return type.symbol;
        }
    }

    /**
     * Concatenated rendering of a token stream, e.g. <code>"ab.c|"</code> for
     * the pattern <code>"ab|c"</code>.
     */
    static String stringFrom(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token t : tokens) {
            sb.append(t);
        }
        return sb.toString();
    }
}
