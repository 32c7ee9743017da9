package com.questrail.plc.lang.ast;

import com.questrail.plc.api.DataType;
import com.questrail.plc.api.Value;
import com.questrail.plc.api.VariableClass;

import java.util.Objects;
import java.util.Optional;

/**
 * A declared program variable.
 *
 * <p>Created once at load time from a {@code VAR}, {@code VAR_INPUT} or
 * {@code VAR_OUTPUT} block; never changes afterwards.</p>
 */
public record Variable(
        String name,
        DataType declaredType,
        Optional<Value> initialValue,
        VariableClass variableClass
) {
    public Variable {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(declaredType, "declaredType");
        Objects.requireNonNull(initialValue, "initialValue");
        Objects.requireNonNull(variableClass, "variableClass");
    }

    /**
     * The value the variable holds before the first cycle: the initializer
     * coerced to the declared type, or the type default.
     */
    public Value startValue() {
        return initialValue
                .map(v -> v.coerceTo(declaredType))
                .orElseGet(() -> Value.defaultFor(declaredType));
    }
}
