package com.questrail.plc.lang.ast;

import com.questrail.plc.api.Value;

import java.util.List;
import java.util.Objects;

/**
 * Expression
 * =============================================================================
 * Immutable expression tree produced by the parser.
 *
 * <p>The variants mirror the operator families of the grammar; each family has
 * its own operator enum so that evaluation can switch exhaustively on it.</p>
 */
public sealed interface Expression
        permits Expression.Literal,
                Expression.VariableRef,
                Expression.BinaryArithmetic,
                Expression.Comparison,
                Expression.Logical,
                Expression.Unary,
                Expression.Call
{
    enum ArithmeticOperator
    {
        ADD("+"), SUBTRACT("-"), MULTIPLY("*"), DIVIDE("/");

        private final String symbol;

        ArithmeticOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    enum ComparisonOperator
    {
        GREATER(">"), LESS("<"), GREATER_OR_EQUAL(">="), LESS_OR_EQUAL("<="), EQUAL("="), NOT_EQUAL("<>");

        private final String symbol;

        ComparisonOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    enum LogicalOperator
    {
        AND, OR
    }

    enum UnaryOperator
    {
        NOT, NEG
    }

    record Literal(Value value) implements Expression {
        public Literal {
            Objects.requireNonNull(value, "value");
        }
    }

    record VariableRef(String name) implements Expression {
        public VariableRef {
            Objects.requireNonNull(name, "name");
        }
    }

    record BinaryArithmetic(ArithmeticOperator op, Expression left, Expression right) implements Expression {
        public BinaryArithmetic {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record Comparison(ComparisonOperator op, Expression left, Expression right) implements Expression {
        public Comparison {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record Logical(LogicalOperator op, Expression left, Expression right) implements Expression {
        public Logical {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record Unary(UnaryOperator op, Expression operand) implements Expression {
        public Unary {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(operand, "operand");
        }
    }

    /** Function call used as a value, e.g. {@code LIMIT(0, x, 100)}. */
    record Call(String name, List<Expression> args) implements Expression {
        public Call {
            Objects.requireNonNull(name, "name");
            args = List.copyOf(args);
        }
    }
}
