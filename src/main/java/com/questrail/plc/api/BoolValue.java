package com.questrail.plc.api;

/**
 * BOOL value. Use {@link #of(boolean)} to obtain the shared instances.
 */
public record BoolValue(boolean value) implements Value
{
    public static final BoolValue TRUE = new BoolValue(true);
    public static final BoolValue FALSE = new BoolValue(false);

    public static BoolValue of(boolean b) {
        return b ? TRUE : FALSE;
    }

    @Override
    public DataType type() {
        return DataType.BOOL;
    }

    @Override
    public double asReal() {
        throw new IllegalStateException("BOOL has no numeric view");
    }

    @Override
    public boolean asBoolean() {
        return value;
    }

    @Override
    public String toString() {
        return value ? "TRUE" : "FALSE";
    }
}
