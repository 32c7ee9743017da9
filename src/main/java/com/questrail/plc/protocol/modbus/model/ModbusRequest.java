package com.questrail.plc.protocol.modbus.model;

import java.util.Arrays;

/**
 * ModbusRequest
 * =============================================================================
 * Semantic form of a client → server Modbus PDU.
 *
 * <p>Only the holding-register functions are representable. Anything else is
 * rejected during decoding, before an instance of this type exists.</p>
 *
 * <p>Addresses are zero-based; register values are unsigned 16-bit words held
 * in an {@code int}.</p>
 */
public sealed interface ModbusRequest
{
    ModbusFunctionCode functionCode();

    /** FC3. */
    record ReadHoldingRegisters(int address, int quantity) implements ModbusRequest
    {
        @Override
        public ModbusFunctionCode functionCode() {
            return ModbusFunctionCode.READ_HOLDING_REGISTERS;
        }
    }

    /** FC6. */
    record WriteSingleRegister(int address, int value) implements ModbusRequest
    {
        @Override
        public ModbusFunctionCode functionCode() {
            return ModbusFunctionCode.WRITE_SINGLE_REGISTER;
        }
    }

    /** FC16. */
    record WriteMultipleRegisters(int address, int[] values) implements ModbusRequest
    {
        public WriteMultipleRegisters {
            values = values.clone();
        }

        @Override
        public int[] values() {
            return values.clone();
        }

        public int quantity() {
            return values.length;
        }

        @Override
        public ModbusFunctionCode functionCode() {
            return ModbusFunctionCode.WRITE_MULTIPLE_REGISTERS;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof WriteMultipleRegisters w
                    && w.address == address
                    && Arrays.equals(w.values, values);
        }

        @Override
        public int hashCode() {
            return 31 * address + Arrays.hashCode(values);
        }

        @Override
        public String toString() {
            return "WriteMultipleRegisters[address=" + address + ", values=" + Arrays.toString(values) + "]";
        }
    }
}
