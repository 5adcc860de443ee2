package com.jreinhal.hragent.tools;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Recursive-descent evaluator for arithmetic expressions: {@code + - * /}, parentheses and unary sign.
 *
 * <p>{@link #evaluate(String)} never throws; malformed input yields an {@code "Error: ..."} text
 * the language model can read.</p>
 */
public class ExpressionCalculator {

    private static final Pattern ALLOWED = Pattern.compile("[0-9+\\-*/().\\s]+");

    public String evaluate(String expression) {
        if (expression == null || expression.isBlank()) {
            return "Error: Empty expression.";
        }
        if (!ALLOWED.matcher(expression).matches()) {
            return "Error: Invalid characters in expression.";
        }
        try {
            double value = new Parser(expression).parse();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return "Error: Result is not a finite number.";
            }
            return format(value);
        } catch (IllegalArgumentException e) {
            return "Error: " + e.getMessage();
        }
    }

    static String format(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static final class Parser {
        private final String expr;
        private int pos = -1;
        private int ch;

        Parser(String expr) {
            this.expr = expr;
        }

        void nextChar() {
            ch = ++pos < expr.length() ? expr.charAt(pos) : -1;
        }

        boolean eat(int charToEat) {
            while (ch == ' ' || ch == '\t') {
                nextChar();
            }
            if (ch == charToEat) {
                nextChar();
                return true;
            }
            return false;
        }

        double parse() {
            nextChar();
            double x = parseExpression();
            while (ch == ' ' || ch == '\t') {
                nextChar();
            }
            if (pos < expr.length()) {
                throw new IllegalArgumentException("Unexpected '" + (char) ch + "' at position " + pos);
            }
            return x;
        }

        double parseExpression() {
            double x = parseTerm();
            while (true) {
                if (eat('+')) {
                    x += parseTerm();
                } else if (eat('-')) {
                    x -= parseTerm();
                } else {
                    return x;
                }
            }
        }

        double parseTerm() {
            double x = parseFactor();
            while (true) {
                if (eat('*')) {
                    x *= parseFactor();
                } else if (eat('/')) {
                    double divisor = parseFactor();
                    if (divisor == 0.0) {
                        throw new IllegalArgumentException("Division by zero");
                    }
                    x /= divisor;
                } else {
                    return x;
                }
            }
        }

        double parseFactor() {
            if (eat('+')) {
                return parseFactor();
            }
            if (eat('-')) {
                return -parseFactor();
            }
            double x;
            int startPos = pos;
            if (eat('(')) {
                x = parseExpression();
                if (!eat(')')) {
                    throw new IllegalArgumentException("Missing closing parenthesis");
                }
            } else if ((ch >= '0' && ch <= '9') || ch == '.') {
                while ((ch >= '0' && ch <= '9') || ch == '.') {
                    nextChar();
                }
                String number = expr.substring(startPos, pos);
                try {
                    x = Double.parseDouble(number);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Malformed number '" + number + "'");
                }
            } else if (ch == -1) {
                throw new IllegalArgumentException("Unexpected end of expression");
            } else {
                throw new IllegalArgumentException("Unexpected '" + (char) ch + "' at position " + pos);
            }
            return x;
        }
    }
}
