package com.questrail.plc.protocol.modbus.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * One Modbus/TCP application data unit: the MBAP addressing fields plus the
 * raw PDU bytes (function code first).
 *
 * <p>The protocol identifier is always 0 and the length field is derived from
 * the PDU, so neither is stored.</p>
 */
public record ModbusAdu(int transactionId, int unitId, byte[] pdu)
{
    public ModbusAdu {
        Objects.requireNonNull(pdu, "pdu");
        if (transactionId < 0 || transactionId > 0xFFFF) {
            throw new IllegalArgumentException("transactionId out of range: " + transactionId);
        }
        if (unitId < 0 || unitId > 0xFF) {
            throw new IllegalArgumentException("unitId out of range: " + unitId);
        }
        pdu = pdu.clone();
    }

    @Override
    public byte[] pdu() {
        return pdu.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ModbusAdu a
                && a.transactionId == transactionId
                && a.unitId == unitId
                && Arrays.equals(a.pdu, pdu);
    }

    @Override
    public int hashCode() {
        return (transactionId * 31 + unitId) * 31 + Arrays.hashCode(pdu);
    }

    @Override
    public String toString() {
        return "ModbusAdu[transactionId=" + transactionId + ", unitId=" + unitId
                + ", pdu=" + Arrays.toString(pdu) + "]";
    }
}
