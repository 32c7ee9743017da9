package com.questrail.plc.api;

/**
 * INT value (64-bit signed).
 */
public record IntValue(long value) implements Value
{
    @Override
    public DataType type() {
        return DataType.INT;
    }

    @Override
    public double asReal() {
        return value;
    }

    @Override
    public boolean asBoolean() {
        return value != 0;
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
