package com.questrail.plc.core.exec;

import com.questrail.plc.api.Value;
import com.questrail.plc.core.EvaluationError;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Evaluation
 * -----------------------------------------------------------------------------
 * Result of evaluating one expression: either a value or an
 * {@link EvaluationError}.
 *
 * <p>Errors travel back up the expression tree as ordinary return values; the
 * interpreter turns them into an alarm at a single point per cycle.</p>
 */
public sealed interface Evaluation permits Evaluation.Ok, Evaluation.Failed
{
    record Ok(Value value) implements Evaluation {
        public Ok {
            Objects.requireNonNull(value, "value");
        }
    }

    record Failed(EvaluationError error) implements Evaluation {
        public Failed {
            Objects.requireNonNull(error, "error");
        }
    }

    static Evaluation ok(Value value) {
        return new Ok(value);
    }

    static Evaluation failed(EvaluationError error) {
        return new Failed(error);
    }

    static Evaluation failed(EvaluationError.Kind kind, String message) {
        return new Failed(new EvaluationError(kind, message));
    }

    /**
     * Applies {@code next} to the value, or passes a failure through untouched.
     */
    default Evaluation then(Function<Value, Evaluation> next) {
        if (this instanceof Ok ok) {
            return next.apply(ok.value());
        }
        return this;
    }

    default Optional<EvaluationError> failure() {
        if (this instanceof Failed f) {
            return Optional.of(f.error());
        }
        return Optional.empty();
    }
}
