package com.questrail.plc.protocol.modbus.client;

/**
 * Creates unconnected {@link ModbusClient}s. The bridge asks for a new client
 * each time it reconnects to the plant.
 *
 * <p>{@link #close()} releases resources shared by the clients this factory
 * created. It is called once, when the plant link shuts down.</p>
 */
@FunctionalInterface
public interface ModbusClientFactory extends AutoCloseable
{
    ModbusClient create();

    @Override
    default void close()
    {
    }
}
