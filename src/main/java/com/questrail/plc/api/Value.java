package com.questrail.plc.api;

import java.util.Objects;

/**
 * Value
 * =============================================================================
 * Closed, immutable representation of every value a PLC program can observe.
 *
 * <p>The set of variants is fixed: {@link BoolValue}, {@link IntValue},
 * {@link RealValue} and {@link DurationValue}. Conversions between them are
 * explicit and total:</p>
 *
 * <ul>
 *   <li><b>Numeric view</b> ({@link #asReal()}): INT, REAL and TIME (milliseconds)
 *       have one; BOOL does not ({@link #isNumeric()} is false)</li>
 *   <li><b>Truth view</b> ({@link #asBoolean()}): BOOL is itself, numbers are
 *       true when non-zero</li>
 *   <li><b>Coercion</b> ({@link #coerceTo(DataType)}): used when a value is stored
 *       into a declared variable</li>
 * </ul>
 */
public sealed interface Value permits BoolValue, IntValue, RealValue, DurationValue
{
    /**
     * Returns the type of this value.
     */
    DataType type();

    /**
     * Returns true if this value has a numeric view.
     */
    default boolean isNumeric() {
        return type() != DataType.BOOL;
    }

    /**
     * Numeric view of this value.
     *
     * @throws IllegalStateException for BOOL values
     */
    double asReal();

    /**
     * Truth view of this value.
     */
    boolean asBoolean();

    /**
     * Converts this value to the given declared type.
     *
     * <p>INT and TIME conversions truncate toward zero.</p>
     */
    default Value coerceTo(DataType target) {
        Objects.requireNonNull(target, "target");
        if (type() == target) {
            return this;
        }
        return switch (target) {
            case BOOL -> BoolValue.of(asBoolean());
            case INT -> new IntValue(isNumeric() ? (long) asReal() : (asBoolean() ? 1 : 0));
            case REAL -> new RealValue(isNumeric() ? asReal() : (asBoolean() ? 1.0 : 0.0));
            case TIME -> new DurationValue(isNumeric() ? (long) asReal() : 0);
        };
    }

    static Value of(boolean b) {
        return BoolValue.of(b);
    }

    static Value ofInt(long v) {
        return new IntValue(v);
    }

    static Value ofReal(double v) {
        return new RealValue(v);
    }

    static Value ofMillis(long millis) {
        return new DurationValue(millis);
    }

    /**
     * Value a variable of the given type holds when declared without an initializer.
     */
    static Value defaultFor(DataType type) {
        Objects.requireNonNull(type, "type");
        return switch (type) {
            case BOOL -> BoolValue.FALSE;
            case INT -> new IntValue(0);
            case REAL -> new RealValue(0.0);
            case TIME -> new DurationValue(0);
        };
    }
}
