package com.questrail.plc.core.exec;

import com.questrail.plc.api.Value;

import java.util.List;

/**
 * A named function callable from Structured Text.
 *
 * <p>Builtins that perform an action but produce nothing return a
 * {@link com.questrail.plc.core.EvaluationError.Kind#NO_VALUE} failure; that
 * is harmless when the call is a statement and an error when it is used as a
 * value.</p>
 */
@FunctionalInterface
public interface Builtin
{
    Evaluation invoke(String name, List<Value> args);
}
