package com.questrail.plc.core;

import java.util.Objects;

/**
 * Describes why an expression or statement could not be evaluated.
 *
 * <p>An evaluation error never escapes a scan cycle: it raises the alarm
 * output, is logged, and ends the current cycle's statement sequence.</p>
 */
public record EvaluationError(Kind kind, String message)
{
    public enum Kind
    {
        /** A name that is in no memory area. */
        UNDEFINED_VARIABLE,
        /** An operator applied to values it does not accept. */
        TYPE_MISMATCH,
        /** A function used as a value that produced none. */
        NO_VALUE,
        /** A builtin rejected its arguments. */
        BAD_ARGUMENTS,
        /** Unexpected failure inside the cycle. */
        INTERNAL
    }

    public EvaluationError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public static EvaluationError undefinedVariable(String name) {
        return new EvaluationError(Kind.UNDEFINED_VARIABLE, "Variable '" + name + "' not found in memory");
    }

    public static EvaluationError typeMismatch(String message) {
        return new EvaluationError(Kind.TYPE_MISMATCH, message);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
