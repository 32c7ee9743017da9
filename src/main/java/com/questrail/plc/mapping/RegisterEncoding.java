package com.questrail.plc.mapping;

/**
 * How a process value is represented in a single 16-bit register word.
 */
public enum RegisterEncoding
{
    /** 0 or 1. */
    FLAG,
    /** Fixed point with one decimal digit: word = truncate(value * 10). */
    SCALED_X10,
    /** Whole percent, 0–100. */
    PERCENT,
    /** Plain unsigned integer. */
    WORD
}
