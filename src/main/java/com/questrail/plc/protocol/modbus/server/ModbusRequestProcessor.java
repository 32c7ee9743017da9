package com.questrail.plc.protocol.modbus.server;

import com.questrail.plc.protocol.modbus.codec.ModbusDecodeException;
import com.questrail.plc.protocol.modbus.codec.ModbusPduCodec;
import com.questrail.plc.protocol.modbus.model.ModbusExceptionCode;
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
import java.util.Optional;

/**
 * ModbusRequestProcessor
 * -----------------------------------------------------------------------------
 * Services decoded requests against a {@link RegisterTable}.
 *
 * <p>This class is transport-agnostic: it consumes and produces PDU bytes and
 * knows nothing of sockets or MBAP headers. The unit id is not checked; the
 * server answers as a single device.</p>
 */
public final class ModbusRequestProcessor
{
    private final RegisterTable table;

    public ModbusRequestProcessor(RegisterTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    /**
     * Decodes a request PDU, services it, and returns the response PDU.
     *
     * @return the response PDU, or empty if the request is too malformed to
     *         answer (no function code)
     */
    public Optional<byte[]> handle(byte[] requestPdu) {
        Objects.requireNonNull(requestPdu, "requestPdu");

        ModbusResponse response;
        try {
            response = process(ModbusPduCodec.decodeRequest(requestPdu));
        }
        catch (ModbusDecodeException e) {
            if (e.exceptionCode().isEmpty()) {
                return Optional.empty();
            }
            response = new ExceptionResponse(e.functionCode(), e.exceptionCode().get());
        }
        return Optional.of(ModbusPduCodec.encodeResponse(response));
    }

    public ModbusResponse process(ModbusRequest request) {
        Objects.requireNonNull(request, "request");
        int fc = request.functionCode().code();

        if (request instanceof ReadHoldingRegisters r) {
            if (!table.contains(r.address(), r.quantity())) {
                return new ExceptionResponse(fc, ModbusExceptionCode.ILLEGAL_DATA_ADDRESS);
            }
            return new ReadHoldingRegistersResponse(table.read(r.address(), r.quantity()));
        }
        if (request instanceof WriteSingleRegister w) {
            if (!table.contains(w.address(), 1)) {
                return new ExceptionResponse(fc, ModbusExceptionCode.ILLEGAL_DATA_ADDRESS);
            }
            table.write(w.address(), w.value());
            return new WriteSingleRegisterResponse(w.address(), w.value());
        }
        if (request instanceof WriteMultipleRegisters w) {
            if (!table.contains(w.address(), w.quantity())) {
                return new ExceptionResponse(fc, ModbusExceptionCode.ILLEGAL_DATA_ADDRESS);
            }
            table.write(w.address(), w.values());
            return new WriteMultipleRegistersResponse(w.address(), w.quantity());
        }
        return new ExceptionResponse(fc, ModbusExceptionCode.ILLEGAL_FUNCTION);
    }
}
