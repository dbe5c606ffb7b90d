package com.questrail.las.api;

import com.questrail.las.codec.LasNumberFormat;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * OperatorExpression
 * -----------------------------------------------------------------------------
 * A binary arithmetic operator with a constant right-hand operand, applied
 * elementwise by a derivation: {@code +5}, {@code -2.5}, {@code *10},
 * {@code /2}.
 *
 * <h2>Accepted text</h2>
 * Whitespace anywhere is ignored. A leading {@code x} or {@code X}, and the
 * glyphs {@code ×} and {@code ÷}, are read as {@code *} and {@code /}. The
 * operand is an unsigned decimal with an optional exponent.
 *
 * <h2>Validation</h2>
 * Everything is checked at parse time, before any document is touched:
 * malformed text and a zero divisor are both rejected with
 * {@link CurveMutationException.Reason#INVALID_OPERAND}.
 *
 * @param operator the operator
 * @param operand  the constant operand, finite
 */
public record OperatorExpression(
        Operator operator,
        double operand
) {
    private static final Pattern SYNTAX =
            Pattern.compile("^([+\\-*/])([0-9]*\\.?[0-9]+(?:[eE][+\\-]?[0-9]+)?)$");

    /**
     * Supported elementwise operators.
     */
    public enum Operator {
        ADD('+'),
        SUBTRACT('-'),
        MULTIPLY('*'),
        DIVIDE('/');

        private final char symbol;

        Operator(char symbol) {
            this.symbol = symbol;
        }

        public char symbol() {
            return symbol;
        }

        public double apply(double value, double operand) {
            return switch (this) {
                case ADD -> value + operand;
                case SUBTRACT -> value - operand;
                case MULTIPLY -> value * operand;
                case DIVIDE -> value / operand;
            };
        }

        static Operator fromSymbol(char symbol) {
            for (Operator op : values()) {
                if (op.symbol == symbol) {
                    return op;
                }
            }
            throw CurveMutationException.invalidOperand("Unsupported operator: " + symbol);
        }
    }

    public OperatorExpression {
        Objects.requireNonNull(operator, "operator");
        if (!Double.isFinite(operand)) {
            throw CurveMutationException.invalidOperand("Operand must be finite: " + operand);
        }
        if (operator == Operator.DIVIDE && operand == 0.0) {
            throw CurveMutationException.invalidOperand("Division by zero");
        }
    }

    /**
     * Parses operator text such as {@code "*2"} or {@code "÷ 4"}.
     *
     * @throws CurveMutationException with reason {@code INVALID_OPERAND} on
     *         malformed text or a zero divisor
     */
    public static OperatorExpression parse(String text) {
        Objects.requireNonNull(text, "text");

        String t = text.replaceAll("\\s+", "")
                .replaceFirst("^[xX]", "*")
                .replace('×', '*')
                .replace('÷', '/');

        Matcher m = SYNTAX.matcher(t);
        if (!m.matches()) {
            throw CurveMutationException.invalidOperand(
                    "Invalid operator '" + text + "'. Use like +5, *10, /2, -3");
        }

        Operator op = Operator.fromSymbol(m.group(1).charAt(0));
        double k = Double.parseDouble(m.group(2));
        return new OperatorExpression(op, k);
    }

    /**
     * Applies the operator to one value.
     */
    public double apply(double value) {
        return operator.apply(value, operand);
    }

    /**
     * Canonical text, e.g. {@code "*2"} or {@code "-0.5"}.
     */
    @Override
    public String toString() {
        return operator.symbol + LasNumberFormat.plain(operand);
    }
}
