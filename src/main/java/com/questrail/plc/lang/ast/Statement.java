package com.questrail.plc.lang.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Statement
 * =============================================================================
 * Immutable statement tree produced by the parser.
 */
public sealed interface Statement
        permits Statement.Assignment, Statement.If, Statement.FunctionCall
{
    /** {@code target := expr;} */
    record Assignment(String target, Expression expr) implements Statement {
        public Assignment {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(expr, "expr");
        }
    }

    /** One {@code ELSIF cond THEN ...} arm. */
    record ElsIf(Expression condition, List<Statement> block) {
        public ElsIf {
            Objects.requireNonNull(condition, "condition");
            block = List.copyOf(block);
        }
    }

    /**
     * {@code IF ... THEN ... ELSIF ... ELSE ... END_IF;}
     *
     * <p>The ELSIF arms are kept in source order; that order decides which arm
     * runs when several conditions hold.</p>
     */
    record If(Expression condition,
              List<Statement> thenBlock,
              List<ElsIf> elsIfs,
              Optional<List<Statement>> elseBlock) implements Statement {
        public If {
            Objects.requireNonNull(condition, "condition");
            thenBlock = List.copyOf(thenBlock);
            elsIfs = List.copyOf(elsIfs);
            Objects.requireNonNull(elseBlock, "elseBlock");
            elseBlock = elseBlock.map(List::copyOf);
        }
    }

    /** {@code NAME(args);} used as a statement. */
    record FunctionCall(String name, List<Expression> args) implements Statement {
        public FunctionCall {
            Objects.requireNonNull(name, "name");
            args = List.copyOf(args);
        }
    }
}
