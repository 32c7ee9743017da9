package com.questrail.plc.protocol.modbus.codec;

import com.questrail.plc.protocol.modbus.model.ModbusAdu;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MbapCodecTest {

    private static byte[] bytes(int... v) {
        byte[] b = new byte[v.length];
        for (int i = 0; i < v.length; i++) {
            b[i] = (byte) v[i];
        }
        return b;
    }

    @Test
    void encodesHeaderBigEndianWithLengthIncludingUnitId() {
        ModbusAdu adu = new ModbusAdu(0x1234, 1, bytes(0x03, 0x00, 0x64, 0x00, 0x06));

        assertArrayEquals(
                bytes(0x12, 0x34, 0x00, 0x00, 0x00, 0x06, 0x01, 0x03, 0x00, 0x64, 0x00, 0x06),
                MbapCodec.encode(adu));
    }

    @Test
    void decodesCompleteFrame() {
        ModbusAdu adu = MbapCodec.decode(bytes(0xFF, 0xFE, 0x00, 0x00, 0x00, 0x03, 0x11, 0x83, 0x02));

        assertEquals(0xFFFE, adu.transactionId());
        assertEquals(0x11, adu.unitId());
        assertArrayEquals(bytes(0x83, 0x02), adu.pdu());
    }

    @Test
    void rejectsNonZeroProtocolId() {
        assertThrows(ModbusDecodeException.class,
                () -> MbapCodec.decode(bytes(0, 1, 0, 1, 0, 2, 1, 3)));
    }

    @Test
    void rejectsLengthMismatch() {
        ModbusDecodeException e = assertThrows(ModbusDecodeException.class,
                () -> MbapCodec.decode(bytes(0, 1, 0, 0, 0, 9, 1, 3)));
        assertEquals(-1, e.functionCode());
        assertTrue(e.exceptionCode().isEmpty());
    }

    @Test
    void rejectsShortFrame() {
        assertThrows(ModbusDecodeException.class, () -> MbapCodec.decode(bytes(0, 1, 0, 0, 0, 1, 1)));
    }

    @Test
    void refusesToEncodeEmptyPdu() {
        assertThrows(IllegalArgumentException.class, () -> MbapCodec.encode(new ModbusAdu(1, 1, new byte[0])));
    }
}
