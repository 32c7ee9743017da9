package com.questrail.plc.protocol.modbus.model;

import java.util.Optional;

/**
 * Function codes serviced by this runtime.
 */
public enum ModbusFunctionCode
{
    READ_HOLDING_REGISTERS(0x03),
    WRITE_SINGLE_REGISTER(0x06),
    WRITE_MULTIPLE_REGISTERS(0x10);

    /** Bit set in the function code of an exception response. */
    public static final int EXCEPTION_FLAG = 0x80;

    private final int code;

    ModbusFunctionCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<ModbusFunctionCode> fromCode(int code) {
        for (ModbusFunctionCode fc : values()) {
            if (fc.code == code) {
                return Optional.of(fc);
            }
        }
        return Optional.empty();
    }
}
