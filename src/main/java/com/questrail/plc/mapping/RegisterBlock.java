package com.questrail.plc.mapping;

/**
 * RegisterBlock
 * -----------------------------------------------------------------------------
 * The four fixed 100-register blocks of the holding register space.
 *
 * <ul>
 *   <li>{@link #COMMANDS}: written by the supervisory system</li>
 *   <li>{@link #STATUS}: published by the PLC for the supervisory system</li>
 *   <li>{@link #SENSORS}: measured values, as read from the plant</li>
 *   <li>{@link #ACTUATORS}: commands, as written to the plant</li>
 * </ul>
 */
public enum RegisterBlock
{
    COMMANDS(0),
    STATUS(100),
    SENSORS(200),
    ACTUATORS(300);

    public static final int BLOCK_SIZE = 100;

    private final int firstAddress;

    RegisterBlock(int firstAddress) {
        this.firstAddress = firstAddress;
    }

    public int firstAddress() {
        return firstAddress;
    }

    public int lastAddress() {
        return firstAddress + BLOCK_SIZE - 1;
    }

    public boolean contains(int address) {
        return address >= firstAddress && address <= lastAddress();
    }
}
