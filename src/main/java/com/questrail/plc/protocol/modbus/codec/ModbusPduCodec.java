package com.questrail.plc.protocol.modbus.codec;

import com.questrail.plc.protocol.modbus.model.ModbusExceptionCode;
import com.questrail.plc.protocol.modbus.model.ModbusFunctionCode;
import com.questrail.plc.protocol.modbus.model.ModbusRequest;
import com.questrail.plc.protocol.modbus.model.ModbusRequest.ReadHoldingRegisters;
import com.questrail.plc.protocol.modbus.model.ModbusRequest.WriteMultipleRegisters;
import com.questrail.plc.protocol.modbus.model.ModbusRequest.WriteSingleRegister;
import com.questrail.plc.protocol.modbus.model.ModbusResponse;
import com.questrail.plc.protocol.modbus.model.ModbusResponse.ExceptionResponse;
import com.questrail.plc.protocol.modbus.model.ModbusResponse.ReadHoldingRegistersResponse;
import com.questrail.plc.protocol.modbus.model.ModbusResponse.WriteMultipleRegistersResponse;
import com.questrail.plc.protocol.modbus.model.ModbusResponse.WriteSingleRegisterResponse;

import java.util.Objects;

import static com.questrail.plc.protocol.modbus.codec.MbapCodec.getWord;
import static com.questrail.plc.protocol.modbus.codec.MbapCodec.putWord;

/**
 * ModbusPduCodec
 * =============================================================================
 * Translates between PDU bytes and the semantic {@link ModbusRequest} /
 * {@link ModbusResponse} model.
 *
 * <h2>Request validation</h2>
 * Decoding a request checks everything that can be checked without knowing
 * the register table: the function code and the quantity/byte-count fields.
 * Address range is the request processor's concern.
 *
 * <ul>
 *   <li>FC3: quantity 1..{@value #MAX_READ_QUANTITY}</li>
 *   <li>FC16: quantity 1..{@value #MAX_WRITE_QUANTITY}, byte count = 2 × quantity</li>
 * </ul>
 */
public final class ModbusPduCodec
{
    public static final int MAX_READ_QUANTITY = 125;
    public static final int MAX_WRITE_QUANTITY = 123;

    private ModbusPduCodec() {}

    // ---------------------------------------------------------------------
    // Requests
    // ---------------------------------------------------------------------

    public static byte[] encodeRequest(ModbusRequest request) {
        Objects.requireNonNull(request, "request");

        if (request instanceof ReadHoldingRegisters r) {
            return fcAddrWord(request.functionCode().code(), r.address(), r.quantity());
        }
        if (request instanceof WriteSingleRegister w) {
            return fcAddrWord(request.functionCode().code(), w.address(), w.value());
        }
        if (request instanceof WriteMultipleRegisters w) {
            int[] values = w.values();
            byte[] pdu = new byte[6 + values.length * 2];
            pdu[0] = (byte) request.functionCode().code();
            putWord(pdu, 1, w.address());
            putWord(pdu, 3, values.length);
            pdu[5] = (byte) (values.length * 2);
            for (int i = 0; i < values.length; i++) {
                putWord(pdu, 6 + i * 2, values[i]);
            }
            return pdu;
        }
        throw new IllegalArgumentException("Unsupported request: " + request);
    }

    public static ModbusRequest decodeRequest(byte[] pdu) {
        Objects.requireNonNull(pdu, "pdu");
        if (pdu.length == 0) {
            throw new ModbusDecodeException("Empty PDU");
        }

        int fc = pdu[0] & 0xFF;
        ModbusFunctionCode function = ModbusFunctionCode.fromCode(fc)
                .orElseThrow(() -> new ModbusDecodeException(
                        "Unsupported function code " + fc, fc, ModbusExceptionCode.ILLEGAL_FUNCTION));

        return switch (function) {
            case READ_HOLDING_REGISTERS -> {
                requireLength(pdu, 5, fc);
                int quantity = getWord(pdu, 3);
                if (quantity < 1 || quantity > MAX_READ_QUANTITY) {
                    throw illegalValue("Read quantity out of range: " + quantity, fc);
                }
                yield new ReadHoldingRegisters(getWord(pdu, 1), quantity);
            }
            case WRITE_SINGLE_REGISTER -> {
                requireLength(pdu, 5, fc);
                yield new WriteSingleRegister(getWord(pdu, 1), getWord(pdu, 3));
            }
            case WRITE_MULTIPLE_REGISTERS -> {
                if (pdu.length < 6) {
                    throw illegalValue("Truncated write-multiple request", fc);
                }
                int quantity = getWord(pdu, 3);
                int byteCount = pdu[5] & 0xFF;
                if (quantity < 1 || quantity > MAX_WRITE_QUANTITY) {
                    throw illegalValue("Write quantity out of range: " + quantity, fc);
                }
                if (byteCount != quantity * 2 || pdu.length != 6 + byteCount) {
                    throw illegalValue("Byte count " + byteCount + " inconsistent with quantity " + quantity, fc);
                }
                int[] values = new int[quantity];
                for (int i = 0; i < quantity; i++) {
                    values[i] = getWord(pdu, 6 + i * 2);
                }
                yield new WriteMultipleRegisters(getWord(pdu, 1), values);
            }
        };
    }

    // ---------------------------------------------------------------------
    // Responses
    // ---------------------------------------------------------------------

    public static byte[] encodeResponse(ModbusResponse response) {
        Objects.requireNonNull(response, "response");

        if (response instanceof ReadHoldingRegistersResponse r) {
            int[] values = r.values();
            byte[] pdu = new byte[2 + values.length * 2];
            pdu[0] = (byte) r.wireFunctionCode();
            pdu[1] = (byte) (values.length * 2);
            for (int i = 0; i < values.length; i++) {
                putWord(pdu, 2 + i * 2, values[i]);
            }
            return pdu;
        }
        if (response instanceof WriteSingleRegisterResponse w) {
            return fcAddrWord(w.wireFunctionCode(), w.address(), w.value());
        }
        if (response instanceof WriteMultipleRegistersResponse w) {
            return fcAddrWord(w.wireFunctionCode(), w.address(), w.quantity());
        }
        if (response instanceof ExceptionResponse e) {
            return new byte[] { (byte) e.wireFunctionCode(), (byte) e.exceptionCode().code() };
        }
        throw new IllegalArgumentException("Unsupported response: " + response);
    }

    public static ModbusResponse decodeResponse(byte[] pdu) {
        Objects.requireNonNull(pdu, "pdu");
        if (pdu.length == 0) {
            throw new ModbusDecodeException("Empty PDU");
        }

        int wireFc = pdu[0] & 0xFF;
        if ((wireFc & ModbusFunctionCode.EXCEPTION_FLAG) != 0) {
            if (pdu.length != 2) {
                throw new ModbusDecodeException("Malformed exception response of " + pdu.length + " bytes");
            }
            int code = pdu[1] & 0xFF;
            ModbusExceptionCode exceptionCode = ModbusExceptionCode.fromCode(code)
                    .orElseThrow(() -> new ModbusDecodeException("Unknown exception code " + code));
            return new ExceptionResponse(wireFc & ~ModbusFunctionCode.EXCEPTION_FLAG, exceptionCode);
        }

        ModbusFunctionCode function = ModbusFunctionCode.fromCode(wireFc)
                .orElseThrow(() -> new ModbusDecodeException("Unsupported function code " + wireFc));

        return switch (function) {
            case READ_HOLDING_REGISTERS -> {
                if (pdu.length < 2) {
                    throw new ModbusDecodeException("Truncated read response");
                }
                int byteCount = pdu[1] & 0xFF;
                if (byteCount % 2 != 0 || pdu.length != 2 + byteCount) {
                    throw new ModbusDecodeException("Inconsistent read response byte count " + byteCount);
                }
                int[] values = new int[byteCount / 2];
                for (int i = 0; i < values.length; i++) {
                    values[i] = getWord(pdu, 2 + i * 2);
                }
                yield new ReadHoldingRegistersResponse(values);
            }
            case WRITE_SINGLE_REGISTER -> {
                requireResponseLength(pdu);
                yield new WriteSingleRegisterResponse(getWord(pdu, 1), getWord(pdu, 3));
            }
            case WRITE_MULTIPLE_REGISTERS -> {
                requireResponseLength(pdu);
                yield new WriteMultipleRegistersResponse(getWord(pdu, 1), getWord(pdu, 3));
            }
        };
    }

    private static byte[] fcAddrWord(int fc, int address, int word) {
        byte[] pdu = new byte[5];
        pdu[0] = (byte) fc;
        putWord(pdu, 1, address);
        putWord(pdu, 3, word);
        return pdu;
    }

    private static void requireLength(byte[] pdu, int expected, int fc) {
        if (pdu.length != expected) {
            throw illegalValue("Expected " + expected + " PDU bytes, got " + pdu.length, fc);
        }
    }

    private static void requireResponseLength(byte[] pdu) {
        if (pdu.length != 5) {
            throw new ModbusDecodeException("Expected 5 response bytes, got " + pdu.length);
        }
    }

    private static ModbusDecodeException illegalValue(String message, int fc) {
        return new ModbusDecodeException(message, fc, ModbusExceptionCode.ILLEGAL_DATA_VALUE);
    }
}
