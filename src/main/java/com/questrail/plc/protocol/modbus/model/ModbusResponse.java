package com.questrail.plc.protocol.modbus.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * ModbusResponse
 * =============================================================================
 * Semantic form of a server → client Modbus PDU.
 *
 * <p>Every request yields exactly one response: either the normal response for
 * its function or an {@link ExceptionResponse}.</p>
 */
public sealed interface ModbusResponse
{
    /** Function code as it appears on the wire (with the exception flag for exceptions). */
    int wireFunctionCode();

    record ReadHoldingRegistersResponse(int[] values) implements ModbusResponse
    {
        public ReadHoldingRegistersResponse {
            values = values.clone();
        }

        @Override
        public int[] values() {
            return values.clone();
        }

        @Override
        public int wireFunctionCode() {
            return ModbusFunctionCode.READ_HOLDING_REGISTERS.code();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ReadHoldingRegistersResponse r && Arrays.equals(r.values, values);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return "ReadHoldingRegistersResponse" + Arrays.toString(values);
        }
    }

    /** Echo of the written address and value. */
    record WriteSingleRegisterResponse(int address, int value) implements ModbusResponse
    {
        @Override
        public int wireFunctionCode() {
            return ModbusFunctionCode.WRITE_SINGLE_REGISTER.code();
        }
    }

    /** Echo of the start address and register count. */
    record WriteMultipleRegistersResponse(int address, int quantity) implements ModbusResponse
    {
        @Override
        public int wireFunctionCode() {
            return ModbusFunctionCode.WRITE_MULTIPLE_REGISTERS.code();
        }
    }

    /**
     * Exception response. {@code functionCode} is the request's function code
     * without the exception flag; it may be one this runtime does not support.
     */
    record ExceptionResponse(int functionCode, ModbusExceptionCode exceptionCode) implements ModbusResponse
    {
        public ExceptionResponse {
            Objects.requireNonNull(exceptionCode, "exceptionCode");
        }

        @Override
        public int wireFunctionCode() {
            return (functionCode | ModbusFunctionCode.EXCEPTION_FLAG) & 0xFF;
        }
    }
}
