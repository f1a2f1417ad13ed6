package org.pragmatica.bet.error;

/**
 * Grammar violation detected while building or validating an expression.
 * Positions are zero-based token indexes.
 */
public sealed interface SyntaxError {
    int position();

    String message();

    /**
     * Atom where a binary operator or a closing parenthesis was expected.
     */
    record UnexpectedAtom(int position) implements SyntaxError {
        @Override
        public String message() {
            return "Unexpected atom at token " + position + ", expected binary operator or closing parenthesis";
        }
    }

    /**
     * Operator which can't be used here, e.g. an operator right after an opening parenthesis
     * when the tree is used with binary-only operators. Carries the operator as text.
     */
    record UnexpectedOperator(int position, String operator) implements SyntaxError {
        @Override
        public String message() {
            return "Unexpected operator '" + operator + "' at token " + position;
        }
    }

    /**
     * Opening parenthesis right after a complete operand.
     */
    record UnexpectedOpeningParenthesis(int position) implements SyntaxError {
        @Override
        public String message() {
            return "Unexpected opening parenthesis at token " + position + ", expected binary operator";
        }
    }

    /**
     * Closing parenthesis with nothing to close, or closing an empty or unfinished operand.
     */
    record UnmatchedClosingParenthesis(int position) implements SyntaxError {
        @Override
        public String message() {
            return "Unmatched closing parenthesis at token " + position;
        }
    }

    /**
     * Expression finished with parentheses still open.
     */
    record UnclosedParenthesis(int position, int openness) implements SyntaxError {
        @Override
        public String message() {
            return openness + " unclosed parenthesis at end of expression (token " + position + ")";
        }
    }

    /**
     * Expression finished right after an operator or an opening parenthesis.
     */
    record DanglingOperator(int position) implements SyntaxError {
        @Override
        public String message() {
            return "Missing operand at end of expression (token " + position + ")";
        }
    }

    /**
     * No atom was ever pushed.
     */
    record EmptyExpression(int position) implements SyntaxError {
        @Override
        public String message() {
            return "Empty expression";
        }
    }
}
