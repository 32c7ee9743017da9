package com.questrail.plc.core;

import com.questrail.plc.api.BoolValue;
import com.questrail.plc.api.Value;
import com.questrail.plc.api.VariableClass;
import com.questrail.plc.lang.ast.Program;
import com.questrail.plc.lang.ast.Variable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * PlcMemory
 * =============================================================================
 * Working memory of the interpreter: three named areas (input, output,
 * internal) holding typed {@link Value}s.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>A name belongs to exactly one {@link VariableClass} for the lifetime of
 *       the memory. Storing an existing name under another class is rejected.</li>
 *   <li>Reads resolve input, then output, then internal; the first hit wins.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Not thread-safe. The scan task is the only mutator; other threads exchange
 * data with the interpreter through the register table, never through this
 * object.
 */
public final class PlcMemory
{
    private final Map<VariableClass, Map<String, Value>> areas = new EnumMap<>(VariableClass.class);

    public PlcMemory() {
        for (VariableClass c : VariableClass.values()) {
            areas.put(c, new LinkedHashMap<>());
        }
    }

    /**
     * Builds memory for a parsed program: every declared variable starts at
     * its initializer (coerced to the declared type) or its type default.
     */
    public static PlcMemory forProgram(Program program) {
        Objects.requireNonNull(program, "program");
        PlcMemory memory = new PlcMemory();
        for (Variable v : program.variables().values()) {
            memory.store(v.variableClass(), v.name(), v.startValue());
        }
        return memory;
    }

    /**
     * Builds the memory used by the built-in HVAC controller when no program
     * is loaded.
     */
    public static PlcMemory withHvacDefaults() {
        PlcMemory m = new PlcMemory();

        m.store(VariableClass.INPUT, HvacSignals.SYSTEM_ENABLE, BoolValue.FALSE);
        m.store(VariableClass.INPUT, HvacSignals.ROOM_TEMPERATURE, Value.ofReal(20.0));
        m.store(VariableClass.INPUT, HvacSignals.ROOM_HUMIDITY, Value.ofReal(50.0));
        m.store(VariableClass.INPUT, HvacSignals.SETPOINT_TEMP, Value.ofReal(22.0));
        m.store(VariableClass.INPUT, HvacSignals.SETPOINT_HUMIDITY, Value.ofReal(45.0));
        m.store(VariableClass.INPUT, HvacSignals.TEMP_DEADBAND, Value.ofReal(1.0));
        m.store(VariableClass.INPUT, HvacSignals.HUMIDITY_DEADBAND, Value.ofReal(5.0));

        m.store(VariableClass.OUTPUT, HvacSignals.FAN_SPEED, Value.ofInt(0));
        m.store(VariableClass.OUTPUT, HvacSignals.CHILLER_ON, BoolValue.FALSE);
        m.store(VariableClass.OUTPUT, HvacSignals.SYSTEM_STATUS, Value.ofInt(0));
        m.store(VariableClass.OUTPUT, HvacSignals.ALARM_ACTIVE, BoolValue.FALSE);

        m.store(VariableClass.INTERNAL, HvacSignals.TEMP_ERROR, Value.ofReal(0.0));
        m.store(VariableClass.INTERNAL, HvacSignals.HUMIDITY_ERROR, Value.ofReal(0.0));
        m.store(VariableClass.INTERNAL, HvacSignals.COOLING_REQUIRED, BoolValue.FALSE);
        m.store(VariableClass.INTERNAL, HvacSignals.DEHUMID_REQUIRED, BoolValue.FALSE);
        return m;
    }

    /**
     * Resolves a name using the input → output → internal lookup order.
     */
    public Optional<Value> read(String name) {
        Objects.requireNonNull(name, "name");
        for (VariableClass c : VariableClass.values()) {
            Value v = areas.get(c).get(name);
            if (v != null) {
                return Optional.of(v);
            }
        }
        return Optional.empty();
    }

    /**
     * Reads a name from one area only.
     */
    public Optional<Value> read(VariableClass variableClass, String name) {
        Objects.requireNonNull(variableClass, "variableClass");
        Objects.requireNonNull(name, "name");
        return Optional.ofNullable(areas.get(variableClass).get(name));
    }

    /**
     * Returns the class that owns the name, if any.
     */
    public Optional<VariableClass> classOf(String name) {
        Objects.requireNonNull(name, "name");
        for (VariableClass c : VariableClass.values()) {
            if (areas.get(c).containsKey(name)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    /**
     * Stores a value, creating the name in the given class on first write.
     *
     * @throws IllegalStateException if the name already belongs to another class
     */
    public void store(VariableClass variableClass, String name, Value value) {
        Objects.requireNonNull(variableClass, "variableClass");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");

        Optional<VariableClass> owner = classOf(name);
        if (owner.isPresent() && owner.get() != variableClass) {
            throw new IllegalStateException(
                    "'" + name + "' is " + owner.get() + ", cannot store it as " + variableClass);
        }
        areas.get(variableClass).put(name, value);
    }

    /**
     * Returns true if the name is unowned or already belongs to the class.
     */
    public boolean canStore(VariableClass variableClass, String name) {
        return classOf(name).map(c -> c == variableClass).orElse(true);
    }

    /**
     * Read-only view of one area, in insertion order.
     */
    public Map<String, Value> snapshot(VariableClass variableClass) {
        Objects.requireNonNull(variableClass, "variableClass");
        return Collections.unmodifiableMap(new LinkedHashMap<>(areas.get(variableClass)));
    }

    @Override
    public String toString() {
        return "PlcMemory" + areas;
    }
}
