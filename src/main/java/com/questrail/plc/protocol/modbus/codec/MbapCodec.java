package com.questrail.plc.protocol.modbus.codec;

import com.questrail.plc.protocol.modbus.model.ModbusAdu;

import java.util.Arrays;
import java.util.Objects;

/**
 * MbapCodec
 * -----------------------------------------------------------------------------
 * Encodes and decodes the Modbus/TCP MBAP header.
 *
 * <pre>
 *  0      2      4      6       7
 *  +------+------+------+-------+-----------------+
 *  | tid  | pid  | len  | unit  | PDU ...         |
 *  +------+------+------+-------+-----------------+
 * </pre>
 *
 * <p>All fields are big-endian. {@code pid} is always 0. {@code len} counts
 * the unit id byte plus the PDU.</p>
 *
 * <p>This class works on complete ADUs only. Splitting the TCP byte stream
 * into ADUs is the transport's job.</p>
 */
public final class MbapCodec
{
    public static final int HEADER_LENGTH = 7;

    /** Offset of the length field within the header. */
    public static final int LENGTH_FIELD_OFFSET = 4;

    /** Largest PDU permitted by the Modbus application protocol. */
    public static final int MAX_PDU_LENGTH = 253;

    private MbapCodec() {}

    public static byte[] encode(ModbusAdu adu) {
        Objects.requireNonNull(adu, "adu");

        byte[] pdu = adu.pdu();
        if (pdu.length == 0 || pdu.length > MAX_PDU_LENGTH) {
            throw new IllegalArgumentException("PDU length out of range: " + pdu.length);
        }

        byte[] out = new byte[HEADER_LENGTH + pdu.length];
        putWord(out, 0, adu.transactionId());
        putWord(out, 2, 0);
        putWord(out, LENGTH_FIELD_OFFSET, pdu.length + 1);
        out[6] = (byte) adu.unitId();
        System.arraycopy(pdu, 0, out, HEADER_LENGTH, pdu.length);
        return out;
    }

    /**
     * Decodes exactly one ADU.
     *
     * @throws ModbusDecodeException if the header is short, the protocol id is
     *         not 0, or the length field disagrees with the byte count
     */
    public static ModbusAdu decode(byte[] frame) {
        Objects.requireNonNull(frame, "frame");

        if (frame.length < HEADER_LENGTH + 1) {
            throw new ModbusDecodeException("Frame too short for MBAP header and PDU: " + frame.length);
        }

        int protocolId = getWord(frame, 2);
        if (protocolId != 0) {
            throw new ModbusDecodeException("Unsupported protocol id " + protocolId);
        }

        int length = getWord(frame, LENGTH_FIELD_OFFSET);
        if (length != frame.length - (HEADER_LENGTH - 1)) {
            throw new ModbusDecodeException(
                    "MBAP length " + length + " does not match frame of " + frame.length + " bytes");
        }

        int transactionId = getWord(frame, 0);
        int unitId = frame[6] & 0xFF;
        return new ModbusAdu(transactionId, unitId, Arrays.copyOfRange(frame, HEADER_LENGTH, frame.length));
    }

    static void putWord(byte[] b, int offset, int word) {
        b[offset] = (byte) ((word >>> 8) & 0xFF);
        b[offset + 1] = (byte) (word & 0xFF);
    }

    static int getWord(byte[] b, int offset) {
        return ((b[offset] & 0xFF) << 8) | (b[offset + 1] & 0xFF);
    }
}
