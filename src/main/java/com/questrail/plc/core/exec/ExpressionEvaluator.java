package com.questrail.plc.core.exec;

import com.questrail.plc.api.BoolValue;
import com.questrail.plc.api.DataType;
import com.questrail.plc.api.DurationValue;
import com.questrail.plc.api.IntValue;
import com.questrail.plc.api.RealValue;
import com.questrail.plc.api.Value;
import com.questrail.plc.core.EvaluationError;
import com.questrail.plc.core.PlcMemory;
import com.questrail.plc.lang.ast.Expression;
import com.questrail.plc.lang.ast.Expression.ArithmeticOperator;
import com.questrail.plc.lang.ast.Expression.ComparisonOperator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ExpressionEvaluator
 * =============================================================================
 * Tree-walking evaluator for {@link Expression}s against {@link PlcMemory}.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>Arithmetic needs numeric operands. The result is REAL if either side is
 *       REAL, otherwise TIME if either side is TIME, otherwise INT. Integer
 *       division truncates toward zero.</li>
 *   <li>Division by zero yields zero of the result type; it is not an error.</li>
 *   <li>Comparisons and {@code AND}/{@code OR} always evaluate both operands
 *       (no short circuit).</li>
 *   <li>Numbers compare numerically; BOOLs support only {@code =} and
 *       {@code <>}. Any other mix is a type mismatch.</li>
 *   <li>{@code NOT} and the logical operators use the truth view of a value.</li>
 *   <li>A reference to a name that is in no memory area is an error.</li>
 * </ul>
 */
public final class ExpressionEvaluator
{
    private final BuiltinRegistry builtins;

    public ExpressionEvaluator(BuiltinRegistry builtins) {
        this.builtins = Objects.requireNonNull(builtins, "builtins");
    }

    public Evaluation evaluate(Expression expr, PlcMemory memory) {
        Objects.requireNonNull(expr, "expr");
        Objects.requireNonNull(memory, "memory");

        if (expr instanceof Expression.Literal lit) {
            return Evaluation.ok(lit.value());
        }
        if (expr instanceof Expression.VariableRef ref) {
            return memory.read(ref.name())
                    .map(Evaluation::ok)
                    .orElseGet(() -> Evaluation.failed(EvaluationError.undefinedVariable(ref.name())));
        }
        if (expr instanceof Expression.BinaryArithmetic bin) {
            Evaluation left = evaluate(bin.left(), memory);
            Evaluation right = evaluate(bin.right(), memory);
            return both(left, right, (l, r) -> arithmetic(bin.op(), l, r));
        }
        if (expr instanceof Expression.Comparison cmp) {
            Evaluation left = evaluate(cmp.left(), memory);
            Evaluation right = evaluate(cmp.right(), memory);
            return both(left, right, (l, r) -> compare(cmp.op(), l, r));
        }
        if (expr instanceof Expression.Logical logical) {
            Evaluation left = evaluate(logical.left(), memory);
            Evaluation right = evaluate(logical.right(), memory);
            return both(left, right, (l, r) -> Evaluation.ok(BoolValue.of(switch (logical.op()) {
                case AND -> l.asBoolean() && r.asBoolean();
                case OR -> l.asBoolean() || r.asBoolean();
            })));
        }
        if (expr instanceof Expression.Unary unary) {
            return evaluate(unary.operand(), memory).then(v -> switch (unary.op()) {
                case NOT -> Evaluation.ok(BoolValue.of(!v.asBoolean()));
                case NEG -> negate(v);
            });
        }
        if (expr instanceof Expression.Call call) {
            List<Value> args = new ArrayList<>(call.args().size());
            for (Expression a : call.args()) {
                Evaluation e = evaluate(a, memory);
                if (e instanceof Evaluation.Failed) {
                    return e;
                }
                args.add(((Evaluation.Ok) e).value());
            }
            return builtins.lookup(call.name()).invoke(call.name(), List.copyOf(args));
        }
        throw new IllegalArgumentException("Unsupported expression: " + expr);
    }

    private interface BinaryStep {
        Evaluation apply(Value left, Value right);
    }

    private static Evaluation both(Evaluation left, Evaluation right, BinaryStep step) {
        if (left instanceof Evaluation.Failed) {
            return left;
        }
        if (right instanceof Evaluation.Failed) {
            return right;
        }
        return step.apply(((Evaluation.Ok) left).value(), ((Evaluation.Ok) right).value());
    }

    static Evaluation arithmetic(ArithmeticOperator op, Value l, Value r) {
        if (!l.isNumeric() || !r.isNumeric()) {
            return Evaluation.failed(EvaluationError.typeMismatch(
                    "Operator " + op.symbol() + " needs numeric operands, got " + l.type() + " and " + r.type()));
        }

        if (l.type() == DataType.REAL || r.type() == DataType.REAL) {
            double a = l.asReal();
            double b = r.asReal();
            double result = switch (op) {
                case ADD -> a + b;
                case SUBTRACT -> a - b;
                case MULTIPLY -> a * b;
                case DIVIDE -> b == 0.0 ? 0.0 : a / b;
            };
            return Evaluation.ok(new RealValue(result));
        }

        long a = (long) l.asReal();
        long b = (long) r.asReal();
        long result = switch (op) {
            case ADD -> a + b;
            case SUBTRACT -> a - b;
            case MULTIPLY -> a * b;
            case DIVIDE -> b == 0 ? 0 : a / b;
        };
        if (l.type() == DataType.TIME || r.type() == DataType.TIME) {
            return Evaluation.ok(new DurationValue(result));
        }
        return Evaluation.ok(new IntValue(result));
    }

    static Evaluation compare(ComparisonOperator op, Value l, Value r) {
        if (l.isNumeric() && r.isNumeric()) {
            double a = l.asReal();
            double b = r.asReal();
            return Evaluation.ok(BoolValue.of(switch (op) {
                case GREATER -> a > b;
                case LESS -> a < b;
                case GREATER_OR_EQUAL -> a >= b;
                case LESS_OR_EQUAL -> a <= b;
                case EQUAL -> a == b;
                case NOT_EQUAL -> a != b;
            }));
        }
        if (!l.isNumeric() && !r.isNumeric()) {
            if (op == ComparisonOperator.EQUAL) {
                return Evaluation.ok(BoolValue.of(l.asBoolean() == r.asBoolean()));
            }
            if (op == ComparisonOperator.NOT_EQUAL) {
                return Evaluation.ok(BoolValue.of(l.asBoolean() != r.asBoolean()));
            }
        }
        return Evaluation.failed(EvaluationError.typeMismatch(
                "Cannot compare " + l.type() + " " + op.symbol() + " " + r.type()));
    }

    private static Evaluation negate(Value v) {
        if (v instanceof IntValue i) {
            return Evaluation.ok(new IntValue(-i.value()));
        }
        if (v instanceof RealValue real) {
            return Evaluation.ok(new RealValue(-real.value()));
        }
        if (v instanceof DurationValue d) {
            return Evaluation.ok(new DurationValue(-d.millis()));
        }
        return Evaluation.failed(EvaluationError.typeMismatch("Unary '-' needs a numeric operand, got " + v.type()));
    }
}
