package com.questrail.plc.protocol.modbus.client;

import com.questrail.plc.protocol.modbus.model.ModbusExceptionCode;

import java.io.IOException;
import java.util.Optional;

/**
 * Signals that a Modbus exchange did not complete: connection failure, I/O
 * timeout, malformed reply, or an exception response from the remote device.
 */
public class ModbusTransportException extends IOException
{
    private final ModbusExceptionCode exceptionCode;

    public ModbusTransportException(String message) {
        this(message, null, null);
    }

    public ModbusTransportException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public ModbusTransportException(String message, ModbusExceptionCode exceptionCode) {
        this(message, null, exceptionCode);
    }

    private ModbusTransportException(String message, Throwable cause, ModbusExceptionCode exceptionCode) {
        super(message, cause);
        this.exceptionCode = exceptionCode;
    }

    /** Present when the remote device answered with an exception response. */
    public Optional<ModbusExceptionCode> exceptionCode() {
        return Optional.ofNullable(exceptionCode);
    }
}
