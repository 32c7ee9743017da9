package com.questrail.plc.protocol.modbus.transport;

import com.questrail.plc.protocol.modbus.client.ModbusTransportException;

import java.net.InetSocketAddress;
import java.util.Optional;

/**
 * ModbusServerEndpoint
 * -----------------------------------------------------------------------------
 * Port for a Modbus/TCP server that exposes a register table to supervisory
 * clients.
 *
 * <p>Implementations accept connections, split the byte stream into ADUs, and
 * hand each PDU to a request processor. A failure on one client connection
 * closes that connection only.</p>
 */
public interface ModbusServerEndpoint extends AutoCloseable
{
    /**
     * Bind the listening socket. Returns once the socket is bound.
     *
     * @throws ModbusTransportException if the address cannot be bound
     */
    void start() throws ModbusTransportException;

    /**
     * The address actually bound, once started. Useful when binding port 0.
     */
    Optional<InetSocketAddress> boundAddress();

    /**
     * Close the listening socket and all client connections.
     */
    @Override
    void close();
}
