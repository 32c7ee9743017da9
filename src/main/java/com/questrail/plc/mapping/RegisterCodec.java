package com.questrail.plc.mapping;

import com.questrail.plc.api.BoolValue;
import com.questrail.plc.api.Value;

import java.util.Objects;

/**
 * RegisterCodec
 * -----------------------------------------------------------------------------
 * Converts between {@link Value}s and unsigned 16-bit register words.
 *
 * <p>Scaled quantities are encoded by multiplying by 10 and truncating toward
 * zero, and decoded by dividing by 10. Encoded words are clamped into
 * {@code [0, 65535]} so out-of-range values saturate instead of wrapping.</p>
 */
public final class RegisterCodec
{
    public static final int MAX_WORD = 0xFFFF;

    private RegisterCodec() {}

    public static int encode(Value value, RegisterEncoding encoding) {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(encoding, "encoding");

        return switch (encoding) {
            case FLAG -> value.asBoolean() ? 1 : 0;
            case SCALED_X10 -> clamp(numeric(value) * 10.0, MAX_WORD);
            case PERCENT -> clamp(numeric(value), 100);
            case WORD -> clamp(numeric(value), MAX_WORD);
        };
    }

    public static Value decode(int word, RegisterEncoding encoding) {
        Objects.requireNonNull(encoding, "encoding");
        int w = word & MAX_WORD;

        return switch (encoding) {
            case FLAG -> BoolValue.of(w != 0);
            case SCALED_X10 -> Value.ofReal(w / 10.0);
            case PERCENT, WORD -> Value.ofInt(w);
        };
    }

    private static double numeric(Value value) {
        if (value.isNumeric()) {
            return value.asReal();
        }
        return value.asBoolean() ? 1.0 : 0.0;
    }

    private static int clamp(double v, int max) {
        long truncated = (long) v;
        return (int) Math.max(0, Math.min(max, truncated));
    }
}
