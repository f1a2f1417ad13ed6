package org.pragmatica.bet;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.bet.BoolExpressions.eval;
import static org.pragmatica.bet.BoolExpressions.evalTf;
import static org.pragmatica.bet.BoolExpressions.infix;
import static org.pragmatica.bet.BoolExpressions.parse;

/**
 * Building and evaluating boolean expressions, T being true and F false.
 */
class BoolEvaluationTest {

    @Test
    void singleAtoms() {
        assertTrue(evalTf("T"));
        assertFalse(evalTf("F"));
        assertTrue(evalTf("(((T)))"));
        assertFalse(evalTf("((F))"));
    }

    @Test
    void unaryOperators() {
        assertFalse(evalTf("!T"));
        assertTrue(evalTf("!F"));
        assertFalse(evalTf("!!F"));
        assertTrue(evalTf("!!!F"));
    }

    @Test
    void binaryOperators() {
        assertTrue(evalTf("F | T"));
        assertFalse(evalTf("F & T"));
        assertFalse(evalTf("F | !T"));
        assertTrue(evalTf("!F | !T"));
    }

    @Test
    void parentheses() {
        assertTrue(evalTf("!(F & T)"));
        assertFalse(evalTf("!(T | T)"));
        assertTrue(evalTf("T | !(T | T)"));
        assertFalse(evalTf("T & (T & F)"));
        assertTrue(evalTf("!F & !(T & F & T)"));
        assertFalse(evalTf("(T | F) & !T"));
        assertFalse(evalTf("!(T | F | T)"));
        assertFalse(evalTf("(T | F) & !(T | F | T)"));
        assertFalse(evalTf("F | !T | !(T & T | F)"));
    }

    @Test
    void nestedExpressions() {
        assertFalse(evalTf("!((T|F)&T)"));
        assertTrue(evalTf("!(!((T|F)&(F|T)&T)) & !F & (T | (T|F))"));
    }

    @Test
    void sameExpression_withDifferentInputs() {
        var expr = parse("(A | B) & !(C | D | E)");

        assertFalse(eval(expr, Set.of('A', 'C', 'E')));
        assertTrue(eval(expr, Set.of('A', 'B')));
        assertFalse(eval(expr, Set.of()));
        assertTrue(eval(expr, Set.of('B')));
    }

    @Test
    void noPrecedence_leftToRightGrouping() {
        var trues = Set.of('A', 'B', 'C');

        assertTrue(eval(parse("(A & B)|(C & D)"), trues));
        assertFalse(eval(parse(" A & B | C & D "), trues));
        assertTrue(evalTf("(T & T) | (T & F)"));
        assertFalse(evalTf("T & T | T & F"));
    }

    @Test
    void chainedOperators_atRootLevel() {
        assertFalse(evalTf("F | F | F"));
        assertFalse(evalTf("F | F | F | F"));
        assertTrue(evalTf("F | T | F"));
        assertTrue(evalTf("F | T | F | F"));
        assertFalse(evalTf("F | F & F"));
        assertFalse(evalTf("F | F & F | F"));
        assertFalse(evalTf("F | T & F"));
        assertFalse(evalTf("F | T & F | F"));
        assertFalse(evalTf("F | F | T & F"));
    }

    @Test
    void unaryOperand_thenDifferentBinaryOperator_atRootLevel() {
        assertFalse(evalTf("T | !T & F"));
        assertEquals("((T | !T) & F)", infix(parse("T | !T & F")));
        assertFalse(evalTf("!F | T & F"));
        assertTrue(evalTf("F & !T | T"));
        assertFalse(evalTf("T | !!T & F"));
        assertTrue(evalTf("F & !!F | T"));
    }

    @Test
    void unaryOperand_thenDifferentBinaryOperator_insideParentheses() {
        assertFalse(evalTf("(T | !T & F)"));
        assertTrue(evalTf("!(T | !T & F)"));
        assertFalse(evalTf("(T | !(F) & F)"));
        assertTrue(evalTf("T & (F & !T | T)"));
    }

    @Test
    void unaryOperand_thenDifferentBinaryOperator_afterParentheses() {
        assertFalse(evalTf("T | (F & !T) & F"));
        assertEquals("((T | (F & !T)) & F)", infix(parse("T | (F & !T) & F")));
        assertFalse(evalTf("!(F) | T & F"));
        assertFalse(evalTf("(T) | !T & F"));
        assertFalse(evalTf("T | !(F & T) & F"));
        assertTrue(evalTf("F & !(T) | T"));
    }

    @Test
    void multiCharacterAtoms_accumulatedThenParsed() throws Exception {
        BeTree<BoolOperator, StringBuilder> raw = BeTree.create();
        for (var c : "true & !(false | yes)".toCharArray()) {
            switch (c) {
                case '&' -> raw.pushOperator(BoolOperator.AND);
                case '|' -> raw.pushOperator(BoolOperator.OR);
                case '!' -> raw.pushOperator(BoolOperator.NOT);
                case ' ' -> {}
                case '(' -> raw.openPar();
                case ')' -> raw.closePar();
                default -> raw.mutateOrCreateAtom(StringBuilder::new)
                              .append(c);
            }
        }

        var expr = raw.tryMapAtoms(sb -> parseBool(sb.toString()));

        assertEquals(3, expr.atomCount());
        assertEquals(false, expr.eval(b -> b, BoolOperator::apply, BoolOperator::shortCircuits)
                                .orElseThrow());
    }

    private static boolean parseBool(String text) throws Exception {
        switch (text) {
            case "true":
            case "yes":
                return true;
            case "false":
            case "no":
                return false;
            default:
                throw new Exception("Not a boolean: " + text);
        }
    }
}
