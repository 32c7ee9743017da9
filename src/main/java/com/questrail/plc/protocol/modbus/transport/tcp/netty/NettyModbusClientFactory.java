package com.questrail.plc.protocol.modbus.transport.tcp.netty;

import com.questrail.plc.protocol.modbus.client.ModbusClient;
import com.questrail.plc.protocol.modbus.client.ModbusClientFactory;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Creates {@link NettyModbusTcpClient}s for one remote device.
 *
 * <p>All clients share one event loop thread, owned by the factory for its
 * whole life and released by {@link #close()}. Reconnect attempts never start
 * or stop threads.</p>
 */
public final class NettyModbusClientFactory implements ModbusClientFactory
{
    private final InetSocketAddress remote;
    private final int unitId;
    private final Duration ioTimeout;
    private final EventLoopGroup group = new NioEventLoopGroup(1);

    public NettyModbusClientFactory(InetSocketAddress remote, int unitId, Duration ioTimeout)
    {
        this.remote = Objects.requireNonNull(remote, "remote");
        this.unitId = unitId;
        this.ioTimeout = Objects.requireNonNull(ioTimeout, "ioTimeout");
    }

    @Override
    public ModbusClient create()
    {
        if (group.isShuttingDown()) {
            throw new IllegalStateException("Client factory for " + remote + " is closed");
        }
        return new NettyModbusTcpClient(group, false, remote, unitId, ioTimeout);
    }

    @Override
    public void close()
    {
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
    }

    EventLoopGroup eventLoopGroup()
    {
        return group;
    }
}
