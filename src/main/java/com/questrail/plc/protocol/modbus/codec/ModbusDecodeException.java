package com.questrail.plc.protocol.modbus.codec;

import com.questrail.plc.protocol.modbus.model.ModbusExceptionCode;

import java.util.Optional;

/**
 * Indicates that bytes received from the wire could not be decoded into a
 * Modbus ADU or PDU.
 *
 * <p>When the request's function code was readable and the defect maps onto a
 * Modbus exception (unsupported function, bad quantity), the exception carries
 * both so the server can answer with an exception response. Otherwise the
 * frame is unanswerable.</p>
 */
public final class ModbusDecodeException extends RuntimeException
{
    private final int functionCode;
    private final ModbusExceptionCode exceptionCode;

    public ModbusDecodeException(String message) {
        super(message);
        this.functionCode = -1;
        this.exceptionCode = null;
    }

    public ModbusDecodeException(String message, int functionCode, ModbusExceptionCode exceptionCode) {
        super(message);
        this.functionCode = functionCode;
        this.exceptionCode = exceptionCode;
    }

    /** Function code of the offending request, or -1 if none was readable. */
    public int functionCode() {
        return functionCode;
    }

    public Optional<ModbusExceptionCode> exceptionCode() {
        return Optional.ofNullable(exceptionCode);
    }
}
