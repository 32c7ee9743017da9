package com.questrail.plc.protocol.modbus.codec;

import com.questrail.plc.protocol.modbus.model.ModbusExceptionCode;
import com.questrail.plc.protocol.modbus.model.ModbusRequest;
import com.questrail.plc.protocol.modbus.model.ModbusResponse;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModbusPduCodecTest {

    private static byte[] bytes(int... v) {
        byte[] b = new byte[v.length];
        for (int i = 0; i < v.length; i++) {
            b[i] = (byte) v[i];
        }
        return b;
    }

    @Test
    void readHoldingRegistersRequestLayout() {
        ModbusRequest r = new ModbusRequest.ReadHoldingRegisters(200, 2);

        assertArrayEquals(bytes(0x03, 0x00, 0xC8, 0x00, 0x02), ModbusPduCodec.encodeRequest(r));
        assertEquals(r, ModbusPduCodec.decodeRequest(bytes(0x03, 0x00, 0xC8, 0x00, 0x02)));
    }

    @Test
    void writeMultipleRegistersRequestLayout() {
        byte[] pdu = bytes(0x10, 0x01, 0x2C, 0x00, 0x02, 0x04, 0x00, 0x3C, 0x00, 0x01);

        assertArrayEquals(pdu, ModbusPduCodec.encodeRequest(
                new ModbusRequest.WriteMultipleRegisters(300, new int[] { 60, 1 })));
        assertEquals(new ModbusRequest.WriteMultipleRegisters(300, new int[] { 60, 1 }),
                ModbusPduCodec.decodeRequest(pdu));
    }

    @Test
    void unknownFunctionCodeIsIllegalFunction() {
        ModbusDecodeException e = assertThrows(ModbusDecodeException.class,
                () -> ModbusPduCodec.decodeRequest(bytes(0x2B, 0x0E, 0x01, 0x00)));

        assertEquals(0x2B, e.functionCode());
        assertEquals(ModbusExceptionCode.ILLEGAL_FUNCTION, e.exceptionCode().orElseThrow());
    }

    @Test
    void readQuantityLimits() {
        assertEquals(new ModbusRequest.ReadHoldingRegisters(0, 125),
                ModbusPduCodec.decodeRequest(bytes(0x03, 0, 0, 0, 125)));

        for (int q : new int[] { 0, 126 }) {
            ModbusDecodeException e = assertThrows(ModbusDecodeException.class,
                    () -> ModbusPduCodec.decodeRequest(bytes(0x03, 0, 0, 0, q)));
            assertEquals(ModbusExceptionCode.ILLEGAL_DATA_VALUE, e.exceptionCode().orElseThrow());
        }
    }

    @Test
    void writeMultipleByteCountMustMatchQuantity() {
        ModbusDecodeException e = assertThrows(ModbusDecodeException.class,
                () -> ModbusPduCodec.decodeRequest(bytes(0x10, 0, 0, 0, 2, 2, 0, 1)));

        assertEquals(0x10, e.functionCode());
        assertEquals(ModbusExceptionCode.ILLEGAL_DATA_VALUE, e.exceptionCode().orElseThrow());
    }

    @Test
    void truncatedRequestIsIllegalDataValue() {
        ModbusDecodeException e = assertThrows(ModbusDecodeException.class,
                () -> ModbusPduCodec.decodeRequest(bytes(0x06, 0, 1)));
        assertEquals(ModbusExceptionCode.ILLEGAL_DATA_VALUE, e.exceptionCode().orElseThrow());
    }

    @Test
    void emptyPduIsUnanswerable() {
        ModbusDecodeException e = assertThrows(ModbusDecodeException.class,
                () -> ModbusPduCodec.decodeRequest(new byte[0]));
        assertTrue(e.exceptionCode().isEmpty());
    }

    @Test
    void readResponseLayout() {
        byte[] pdu = bytes(0x03, 0x04, 0x00, 0xDC, 0x01, 0xC2);

        assertArrayEquals(pdu, ModbusPduCodec.encodeResponse(
                new ModbusResponse.ReadHoldingRegistersResponse(new int[] { 220, 450 })));
        assertEquals(new ModbusResponse.ReadHoldingRegistersResponse(new int[] { 220, 450 }),
                ModbusPduCodec.decodeResponse(pdu));
    }

    @Test
    void exceptionResponseSetsHighBit() {
        ModbusResponse.ExceptionResponse r =
                new ModbusResponse.ExceptionResponse(0x03, ModbusExceptionCode.ILLEGAL_DATA_ADDRESS);

        assertArrayEquals(bytes(0x83, 0x02), ModbusPduCodec.encodeResponse(r));
        assertEquals(r, ModbusPduCodec.decodeResponse(bytes(0x83, 0x02)));
    }

    @Test
    void writeResponsesEchoAddressAndWord() {
        assertEquals(new ModbusResponse.WriteSingleRegisterResponse(1, 230),
                ModbusPduCodec.decodeResponse(bytes(0x06, 0, 1, 0, 230)));
        assertEquals(new ModbusResponse.WriteMultipleRegistersResponse(300, 2),
                ModbusPduCodec.decodeResponse(bytes(0x10, 0x01, 0x2C, 0, 2)));
    }

    @Test
    void inconsistentReadResponseIsRejected() {
        assertThrows(ModbusDecodeException.class,
                () -> ModbusPduCodec.decodeResponse(bytes(0x03, 0x04, 0x00, 0x01)));
    }
}
