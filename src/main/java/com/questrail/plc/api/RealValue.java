package com.questrail.plc.api;

/**
 * REAL value. Numeric literals in program text always produce this variant.
 */
public record RealValue(double value) implements Value
{
    @Override
    public DataType type() {
        return DataType.REAL;
    }

    @Override
    public double asReal() {
        return value;
    }

    @Override
    public boolean asBoolean() {
        return value != 0.0;
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
