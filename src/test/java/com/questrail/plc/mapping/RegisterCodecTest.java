package com.questrail.plc.mapping;

import com.questrail.plc.api.BoolValue;
import com.questrail.plc.api.Value;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RegisterCodecTest {

    @Test
    void scaledValuesAreMultipliedByTenAndTruncated() {
        assertEquals(220, RegisterCodec.encode(Value.ofReal(22.0), RegisterEncoding.SCALED_X10));
        assertEquals(225, RegisterCodec.encode(Value.ofReal(22.5), RegisterEncoding.SCALED_X10));
        assertEquals(225, RegisterCodec.encode(Value.ofReal(22.59), RegisterEncoding.SCALED_X10));
        assertEquals(50, RegisterCodec.encode(Value.ofInt(5), RegisterEncoding.SCALED_X10));

        assertEquals(Value.ofReal(22.5), RegisterCodec.decode(225, RegisterEncoding.SCALED_X10));
    }

    @Test
    void encodedWordsSaturate() {
        assertEquals(0, RegisterCodec.encode(Value.ofReal(-4.0), RegisterEncoding.SCALED_X10));
        assertEquals(RegisterCodec.MAX_WORD, RegisterCodec.encode(Value.ofReal(7000.0), RegisterEncoding.SCALED_X10));
        assertEquals(100, RegisterCodec.encode(Value.ofInt(140), RegisterEncoding.PERCENT));
        assertEquals(0, RegisterCodec.encode(Value.ofInt(-3), RegisterEncoding.WORD));
        assertEquals(RegisterCodec.MAX_WORD, RegisterCodec.encode(Value.ofInt(70_000), RegisterEncoding.WORD));
    }

    @Test
    void flags() {
        assertEquals(1, RegisterCodec.encode(BoolValue.TRUE, RegisterEncoding.FLAG));
        assertEquals(0, RegisterCodec.encode(BoolValue.FALSE, RegisterEncoding.FLAG));
        assertEquals(1, RegisterCodec.encode(Value.ofInt(7), RegisterEncoding.FLAG));

        assertEquals(BoolValue.TRUE, RegisterCodec.decode(2, RegisterEncoding.FLAG));
        assertEquals(BoolValue.FALSE, RegisterCodec.decode(0, RegisterEncoding.FLAG));
    }

    @Test
    void boolsEncodeAsOneOrZeroInNumericEncodings() {
        assertEquals(1, RegisterCodec.encode(BoolValue.TRUE, RegisterEncoding.WORD));
        assertEquals(10, RegisterCodec.encode(BoolValue.TRUE, RegisterEncoding.SCALED_X10));
    }

    @Test
    void decodeUsesOnlyTheLowSixteenBits() {
        assertEquals(Value.ofInt(65535), RegisterCodec.decode(-1, RegisterEncoding.WORD));
        assertEquals(Value.ofInt(1), RegisterCodec.decode(0x10001, RegisterEncoding.PERCENT));
    }
}
