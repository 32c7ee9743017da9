package com.questrail.plc.protocol.modbus.model;

import java.util.Optional;

/**
 * Exception codes carried by a Modbus exception response.
 */
public enum ModbusExceptionCode
{
    /** The function code is not supported. */
    ILLEGAL_FUNCTION(0x01),
    /** The start address, or start address plus quantity, is outside the table. */
    ILLEGAL_DATA_ADDRESS(0x02),
    /** The quantity or byte count is invalid. */
    ILLEGAL_DATA_VALUE(0x03),
    SERVER_DEVICE_FAILURE(0x04);

    private final int code;

    ModbusExceptionCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<ModbusExceptionCode> fromCode(int code) {
        for (ModbusExceptionCode ec : values()) {
            if (ec.code == code) {
                return Optional.of(ec);
            }
        }
        return Optional.empty();
    }
}
