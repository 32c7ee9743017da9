package com.questrail.plc.lang.ast;

import com.questrail.plc.api.VariableClass;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Program
 * -----------------------------------------------------------------------------
 * A parsed Structured Text program: its name, its declared variables (unique
 * names, in declaration order) and its top-level statements in source order.
 *
 * <p>Immutable. The statements are executed top to bottom on every scan cycle.</p>
 */
public record Program(String name, Map<String, Variable> variables, List<Statement> statements)
{
    public Program {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(variables, "variables");
        Objects.requireNonNull(statements, "statements");
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        statements = List.copyOf(statements);
    }

    public List<Variable> variablesOf(VariableClass variableClass) {
        return variables.values().stream()
                .filter(v -> v.variableClass() == variableClass)
                .collect(Collectors.toList());
    }
}
