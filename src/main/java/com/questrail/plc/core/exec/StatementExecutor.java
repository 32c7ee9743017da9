package com.questrail.plc.core.exec;

import com.questrail.plc.api.Value;
import com.questrail.plc.api.VariableClass;
import com.questrail.plc.core.EvaluationError;
import com.questrail.plc.core.PlcMemory;
import com.questrail.plc.lang.ast.Expression;
import com.questrail.plc.lang.ast.Statement;
import com.questrail.plc.lang.ast.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * StatementExecutor
 * =============================================================================
 * Executes statement lists against {@link PlcMemory}.
 *
 * <h2>Assignment targets</h2>
 * <ul>
 *   <li>Output variables are written (coerced to their declared type).</li>
 *   <li>Input variables are never written: the assignment is logged and
 *       dropped, memory is unchanged, and execution continues.</li>
 *   <li>Anything else is internal; undeclared names are created on first
 *       write and keep the type of the assigned value.</li>
 * </ul>
 *
 * <h2>IF</h2>
 * The THEN condition is tested first, then each ELSIF in source order. The
 * first true branch runs and the statement ends; later conditions are not
 * evaluated. ELSE runs only if nothing matched.
 *
 * <h2>Errors</h2>
 * The first {@link EvaluationError} stops the list and is returned; the
 * statements after it do not run.
 */
public final class StatementExecutor
{
    private static final Logger log = LoggerFactory.getLogger(StatementExecutor.class);

    private final ExpressionEvaluator evaluator;
    private final BuiltinRegistry builtins;
    private final Map<String, Variable> declarations;

    public StatementExecutor(ExpressionEvaluator evaluator,
                             BuiltinRegistry builtins,
                             Map<String, Variable> declarations) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.builtins = Objects.requireNonNull(builtins, "builtins");
        this.declarations = Map.copyOf(Objects.requireNonNull(declarations, "declarations"));
    }

    public Optional<EvaluationError> execute(List<Statement> statements, PlcMemory memory) {
        Objects.requireNonNull(statements, "statements");
        Objects.requireNonNull(memory, "memory");

        for (Statement s : statements) {
            Optional<EvaluationError> error = execute(s, memory);
            if (error.isPresent()) {
                return error;
            }
        }
        return Optional.empty();
    }

    private Optional<EvaluationError> execute(Statement statement, PlcMemory memory) {
        if (statement instanceof Statement.Assignment a) {
            return assign(a, memory);
        }
        if (statement instanceof Statement.If ifStmt) {
            return executeIf(ifStmt, memory);
        }
        if (statement instanceof Statement.FunctionCall call) {
            return call(call, memory);
        }
        throw new IllegalArgumentException("Unsupported statement: " + statement);
    }

    private Optional<EvaluationError> assign(Statement.Assignment a, PlcMemory memory) {
        Evaluation result = evaluator.evaluate(a.expr(), memory);
        if (result instanceof Evaluation.Failed f) {
            return Optional.of(f.error());
        }
        Value value = ((Evaluation.Ok) result).value();

        Variable declared = declarations.get(a.target());
        VariableClass target = declared != null
                ? declared.variableClass()
                : memory.classOf(a.target()).orElse(VariableClass.INTERNAL);

        if (target == VariableClass.INPUT) {
            log.warn("Cannot assign to input variable: {}", a.target());
            return Optional.empty();
        }

        Value stored = declared != null ? value.coerceTo(declared.declaredType()) : value;
        memory.store(target, a.target(), stored);
        return Optional.empty();
    }

    private Optional<EvaluationError> executeIf(Statement.If ifStmt, PlcMemory memory) {
        Evaluation condition = evaluator.evaluate(ifStmt.condition(), memory);
        if (condition instanceof Evaluation.Failed f) {
            return Optional.of(f.error());
        }
        if (((Evaluation.Ok) condition).value().asBoolean()) {
            return execute(ifStmt.thenBlock(), memory);
        }

        for (Statement.ElsIf arm : ifStmt.elsIfs()) {
            Evaluation c = evaluator.evaluate(arm.condition(), memory);
            if (c instanceof Evaluation.Failed f) {
                return Optional.of(f.error());
            }
            if (((Evaluation.Ok) c).value().asBoolean()) {
                return execute(arm.block(), memory);
            }
        }

        if (ifStmt.elseBlock().isPresent()) {
            return execute(ifStmt.elseBlock().get(), memory);
        }
        return Optional.empty();
    }

    private Optional<EvaluationError> call(Statement.FunctionCall call, PlcMemory memory) {
        List<Value> args = new ArrayList<>(call.args().size());
        for (Expression argument : call.args()) {
            Evaluation e = evaluator.evaluate(argument, memory);
            if (e instanceof Evaluation.Failed f) {
                return Optional.of(f.error());
            }
            args.add(((Evaluation.Ok) e).value());
        }

        Evaluation result = builtins.lookup(call.name()).invoke(call.name(), List.copyOf(args));
        // A call statement discards its value, so "no value" is fine here.
        return result.failure().filter(err -> err.kind() != EvaluationError.Kind.NO_VALUE);
    }
}
