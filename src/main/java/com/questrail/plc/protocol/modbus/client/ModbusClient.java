package com.questrail.plc.protocol.modbus.client;

/**
 * ModbusClient
 * -----------------------------------------------------------------------------
 * Blocking Modbus/TCP client port used by the bridge to talk to the plant.
 *
 * <p>Every request waits at most the client's configured I/O timeout. A failed
 * request leaves the client in an unspecified state; callers are expected to
 * {@link #close()} it and create a fresh one.</p>
 *
 * <p>Not thread-safe. The scan thread is the only caller.</p>
 */
public interface ModbusClient extends AutoCloseable
{
    void connect() throws ModbusTransportException;

    boolean isConnected();

    int[] readHoldingRegisters(int address, int quantity) throws ModbusTransportException;

    void writeSingleRegister(int address, int value) throws ModbusTransportException;

    void writeMultipleRegisters(int address, int[] values) throws ModbusTransportException;

    /**
     * Release the connection. Idempotent; never throws.
     */
    @Override
    void close();
}
