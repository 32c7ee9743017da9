package com.questrail.plc.api;

/**
 * TIME value held as whole milliseconds. Its numeric view is the millisecond count.
 */
public record DurationValue(long millis) implements Value
{
    @Override
    public DataType type() {
        return DataType.TIME;
    }

    @Override
    public double asReal() {
        return millis;
    }

    @Override
    public boolean asBoolean() {
        return millis != 0;
    }

    @Override
    public String toString() {
        return "T#" + millis + "ms";
    }
}
