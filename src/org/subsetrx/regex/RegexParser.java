/* @LICENSE@
 */

package org.subsetrx.regex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;

/**
 * Operator precedence (shunting-yard) translation of a pattern into a postfix
 * token stream. Two explicit stacks - the output and the pending operators -
 * and a single left to right scan; no recursion.
 * <p>
 * Implicit concatenation is made explicit: a {@link Token#CONCAT} is
 * inserted wherever an operand start follows an operand end. Postfix
 * operators bind to the operand on their left and are emitted as soon as the
 * stacked operators of higher precedence are reduced.
 */
final class RegexParser {

    /*
     * fields to hold parameters
     */
    private String regex;

    /*
     * aux fields for parsing
     */
    private List<Token> output;
    private LinkedList<Token> operators;
    private LinkedList<Integer> groupStarts;   // index of each pending '('
    private boolean operand;    // true iff the last thing scanned ends an operand

    private void init(String regex) {
        this.regex = regex;
        output = new ArrayList<Token>();
        operators = new LinkedList<Token>();
        groupStarts = new LinkedList<Integer>();
        operand = false;
    }

    List<Token> parse(String regex) {

        init(regex);

        for (int i = 0; i < regex.length(); ++i) {
            final char c = regex.charAt(i);
            switch (c) {
            case '\\':
                if (i + 1 == regex.length()) {
                    throw malformed("dangling escape", i);
                }
                operand(Token.literal(regex.charAt(++i)));
                break;
            case '[':
                i = set(i);
                break;
            case ']':
                throw malformed("unbalanced ']'", i);
            case '(':
                if (operand) binary(Token.CONCAT);
                operators.push(Token.GROUP);
                groupStarts.push(i);
                operand = false;
                break;
            case ')':
                while (!operators.isEmpty() && operators.peek() != Token.GROUP) {
                    output.add(operators.pop());
                }
                if (operators.isEmpty()) {
                    throw malformed("unbalanced ')'", i);
                }
                operators.pop();
                groupStarts.pop();
                operand = true;
                break;
            case '|':
                binary(Token.ALT);
                break;
            case '.':
                binary(Token.CONCAT);
                break;
            case '*':
                postfix(Token.STAR);
                break;
            case '+':
                postfix(Token.PLUS);
                break;
            case '?':
                postfix(Token.QUESTION);
                break;
            case '$':
                postfix(Token.ANCHOR_END);
                break;
            case '^':
                if (operand) {
                    postfix(Token.NEGATE);
                } else {
                    // opens a fragment: prefix operator, waits for its operand
                    operators.push(Token.ANCHOR_START);
                }
                break;
            default:
                operand(Token.literal(c));
            }
        }

        while (!operators.isEmpty()) {
            Token t = operators.pop();
            if (t == Token.GROUP) {
                throw malformed("unbalanced '('", groupStarts.pop());
            }
            output.add(t);
        }
        assert groupStarts.isEmpty();
        return Collections.unmodifiableList(output);
    }

    /*
     * Accumulates a bracket set verbatim, honoring escapes. A leading '^'
     * negates the set. Returns the index of the closing ']'.
     */
    private int set(final int open) {
        StringBuilder sb = new StringBuilder();
        boolean negated = false;
        int i = open + 1;
        if (i < regex.length() && regex.charAt(i) == '^') {
            negated = true;
            ++i;
        }
        for (; i < regex.length(); ++i) {
            char c = regex.charAt(i);
            if (c == ']') break;
            if (c == '\\') {
                if (++i == regex.length()) {
                    throw malformed("dangling escape", i - 1);
                }
                c = regex.charAt(i);
            }
            sb.append(c);
        }
        if (i == regex.length()) {
            throw malformed("unclosed character set", open);
        }
        if (sb.length() == 0) {
            throw malformed("empty character set", open);
        }
        operand(Token.set(sb.toString()));
        if (negated) {
            postfix(Token.NEGATE);
        }
        return i;
    }

    private void operand(Token t) {
        if (operand) binary(Token.CONCAT);
        output.add(t);
        operand = true;
    }

    /*
     * left associative: reduce everything of equal or higher precedence.
     */
    private void binary(Token t) {
        reduce(t.type.precedence);
        operators.push(t);
        operand = false;
    }

    private void postfix(Token t) {
        reduce(t.type.precedence + 1);
        output.add(t);
        operand = true;
    }

    private void reduce(int precedence) {
        while (!operators.isEmpty()
                && operators.peek() != Token.GROUP
                && operators.peek().type.precedence >= precedence) {
            output.add(operators.pop());
        }
    }

    private MalformedPatternException malformed(String desc, int index) {
        return new MalformedPatternException(desc, regex, index);
    }
}
