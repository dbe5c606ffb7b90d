package com.questrail.las.api;

import com.questrail.las.api.CurveMutationException.Reason;
import com.questrail.las.api.OperatorExpression.Operator;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class OperatorExpressionTest
{
    @Test
    void parsesEachOperator() {
        assertEquals(new OperatorExpression(Operator.ADD, 5), OperatorExpression.parse("+5"));
        assertEquals(new OperatorExpression(Operator.SUBTRACT, 2.5), OperatorExpression.parse("- 2.5"));
        assertEquals(new OperatorExpression(Operator.MULTIPLY, 10), OperatorExpression.parse("*10"));
        assertEquals(new OperatorExpression(Operator.DIVIDE, 2), OperatorExpression.parse(" / 2 "));
    }

    @Test
    void acceptsAlternateMultiplyAndDivideGlyphs() {
        assertEquals(Operator.MULTIPLY, OperatorExpression.parse("x3").operator());
        assertEquals(Operator.MULTIPLY, OperatorExpression.parse("X3").operator());
        assertEquals(Operator.MULTIPLY, OperatorExpression.parse("×3").operator());
        assertEquals(Operator.DIVIDE, OperatorExpression.parse("÷4").operator());
    }

    @Test
    void acceptsExponentAndLeadingDotOperands() {
        assertEquals(1500.0, OperatorExpression.parse("*1.5e3").operand());
        assertEquals(0.5, OperatorExpression.parse("+.5").operand());
    }

    @Test
    void rejectsDivisionByZero() {
        CurveMutationException ex = assertThrows(CurveMutationException.class, () -> OperatorExpression.parse("/0"));
        assertEquals(Reason.INVALID_OPERAND, ex.reason());

        assertThrows(CurveMutationException.class, () -> OperatorExpression.parse("/0.000"));
        assertThrows(CurveMutationException.class, () -> new OperatorExpression(Operator.DIVIDE, 0.0));
    }

    @Test
    void rejectsMalformedText() {
        for (String bad : new String[] {"", "5", "+", "++5", "*-2", "^2", "+5abc", "*1e"}) {
            CurveMutationException ex = assertThrows(CurveMutationException.class,
                    () -> OperatorExpression.parse(bad), bad);
            assertEquals(Reason.INVALID_OPERAND, ex.reason(), bad);
        }
    }

    @Test
    void rejectsNonFiniteOperand() {
        assertThrows(CurveMutationException.class, () -> new OperatorExpression(Operator.ADD, Double.NaN));
    }

    @Test
    void appliesToValue() {
        assertEquals(110.4, OperatorExpression.parse("*2").apply(55.2));
        assertEquals(-1.0, OperatorExpression.parse("-3").apply(2.0));
        assertEquals(0.25, OperatorExpression.parse("/4").apply(1.0));
    }

    @Test
    void canonicalText() {
        assertEquals("*2", OperatorExpression.parse("x 2.0").toString());
        assertEquals("-0.5", OperatorExpression.parse("-.5").toString());
    }
}
