package com.questrail.plc.protocol.modbus.transport.tcp.netty;

import com.questrail.plc.protocol.modbus.client.ModbusClient;
import com.questrail.plc.protocol.modbus.client.ModbusTransportException;
import com.questrail.plc.protocol.modbus.codec.MbapCodec;
import com.questrail.plc.protocol.modbus.codec.ModbusDecodeException;
import com.questrail.plc.protocol.modbus.codec.ModbusPduCodec;
import com.questrail.plc.protocol.modbus.model.ModbusAdu;
import com.questrail.plc.protocol.modbus.model.ModbusRequest;
import com.questrail.plc.protocol.modbus.model.ModbusResponse;
import com.questrail.plc.protocol.modbus.model.ModbusResponse.ExceptionResponse;
import com.questrail.plc.protocol.modbus.model.ModbusResponse.ReadHoldingRegistersResponse;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;

import java.net.InetSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * NettyModbusTcpClient
 * =============================================================================
 * Netty-backed, blocking implementation of the {@link ModbusClient} port.
 *
 * <p>Requests are written on the Netty channel and correlated with their
 * replies by MBAP transaction id. The calling thread waits on the pending
 * reply for at most the configured I/O timeout.</p>
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package.
 *
 * <h2>Lifecycle</h2>
 * Each instance owns one connection. A client built with the public
 * constructor also owns its event loop thread; clients from
 * {@link NettyModbusClientFactory} run on the factory's shared loop.
 * {@link #close()} fails every pending request and releases what the client
 * owns; a closed client is not reused.
 */
public final class NettyModbusTcpClient implements ModbusClient
{
    private final InetSocketAddress remote;
    private final int unitId;
    private final Duration ioTimeout;

    private final EventLoopGroup group;
    private final boolean ownsGroup;
    private final Bootstrap bootstrap;

    private final AtomicInteger nextTransactionId = new AtomicInteger();
    private final Map<Integer, CompletableFuture<byte[]>> pending = new ConcurrentHashMap<>();

    private volatile Channel channel;

    public NettyModbusTcpClient(InetSocketAddress remote, int unitId, Duration ioTimeout)
    {
        this(new NioEventLoopGroup(1), true, remote, unitId, ioTimeout);
    }

    NettyModbusTcpClient(EventLoopGroup group, boolean ownsGroup,
                         InetSocketAddress remote, int unitId, Duration ioTimeout)
    {
        this.group = Objects.requireNonNull(group, "group");
        this.ownsGroup = ownsGroup;
        this.remote = Objects.requireNonNull(remote, "remote");
        this.ioTimeout = Objects.requireNonNull(ioTimeout, "ioTimeout");
        if (unitId < 0 || unitId > 0xFF) {
            throw new IllegalArgumentException("unitId out of range: " + unitId);
        }
        this.unitId = unitId;

        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) ioTimeout.toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new LengthFieldBasedFrameDecoder(
                                NettyModbusTcpServer.MAX_FRAME_LENGTH, MbapCodec.LENGTH_FIELD_OFFSET, 2, 0, 0));
                        p.addLast(new ResponseHandler());
                    }
                });
    }

    @Override
    public void connect() throws ModbusTransportException
    {
        if (isConnected()) {
            return;
        }

        ChannelFuture f = bootstrap.connect(remote);
        if (!f.awaitUninterruptibly(ioTimeout.toMillis() * 2, TimeUnit.MILLISECONDS)) {
            f.cancel(true);
            throw new ModbusTransportException("Timed out connecting to " + remote);
        }
        if (!f.isSuccess()) {
            throw new ModbusTransportException("Unable to connect to " + remote, f.cause());
        }
        channel = f.channel();
    }

    @Override
    public boolean isConnected()
    {
        Channel ch = channel;
        return ch != null && ch.isActive();
    }

    @Override
    public int[] readHoldingRegisters(int address, int quantity) throws ModbusTransportException
    {
        ModbusResponse response = exchange(new ModbusRequest.ReadHoldingRegisters(address, quantity));
        if (!(response instanceof ReadHoldingRegistersResponse r)) {
            throw new ModbusTransportException("Unexpected reply to read: " + response);
        }
        int[] values = r.values();
        if (values.length != quantity) {
            throw new ModbusTransportException(
                    "Asked for " + quantity + " registers, got " + values.length);
        }
        return values;
    }

    @Override
    public void writeSingleRegister(int address, int value) throws ModbusTransportException
    {
        ModbusResponse response = exchange(new ModbusRequest.WriteSingleRegister(address, value));
        if (!(response instanceof ModbusResponse.WriteSingleRegisterResponse)) {
            throw new ModbusTransportException("Unexpected reply to write: " + response);
        }
    }

    @Override
    public void writeMultipleRegisters(int address, int[] values) throws ModbusTransportException
    {
        ModbusResponse response = exchange(new ModbusRequest.WriteMultipleRegisters(address, values));
        if (!(response instanceof ModbusResponse.WriteMultipleRegistersResponse)) {
            throw new ModbusTransportException("Unexpected reply to write: " + response);
        }
    }

    @Override
    public void close()
    {
        Channel ch = channel;
        channel = null;
        if (ch != null) {
            ch.close();
        }
        failPending(new ClosedChannelException());
        if (ownsGroup) {
            group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        }
    }

    private ModbusResponse exchange(ModbusRequest request) throws ModbusTransportException
    {
        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            throw new ModbusTransportException("Not connected to " + remote);
        }

        int tid = nextTransactionId.getAndIncrement() & 0xFFFF;
        CompletableFuture<byte[]> reply = new CompletableFuture<>();
        pending.put(tid, reply);

        byte[] frame = MbapCodec.encode(new ModbusAdu(tid, unitId, ModbusPduCodec.encodeRequest(request)));
        ch.writeAndFlush(Unpooled.wrappedBuffer(frame)).addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                reply.completeExceptionally(f.cause());
            }
        });

        byte[] pdu;
        try {
            pdu = reply.get(ioTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (TimeoutException e) {
            throw new ModbusTransportException(
                    request.functionCode() + " to " + remote + " timed out after " + ioTimeout.toMillis() + " ms");
        }
        catch (ExecutionException e) {
            throw new ModbusTransportException(request.functionCode() + " to " + remote + " failed", e.getCause());
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModbusTransportException("Interrupted waiting for " + remote, e);
        }
        finally {
            pending.remove(tid);
        }

        ModbusResponse response;
        try {
            response = ModbusPduCodec.decodeResponse(pdu);
        }
        catch (ModbusDecodeException e) {
            throw new ModbusTransportException("Malformed reply from " + remote, e);
        }

        if (response instanceof ExceptionResponse ex) {
            throw new ModbusTransportException(
                    request.functionCode() + " rejected by " + remote + " with " + ex.exceptionCode(),
                    ex.exceptionCode());
        }
        return response;
    }

    private void failPending(Throwable cause)
    {
        for (CompletableFuture<byte[]> f : pending.values()) {
            f.completeExceptionally(cause);
        }
    }

    /**
     * ResponseHandler
     * -------------------------------------------------------------------------
     * Completes the pending request whose transaction id matches the reply.
     * Replies that match nothing (late, after a timeout) are dropped.
     */
    private final class ResponseHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame)
        {
            byte[] bytes = new byte[frame.readableBytes()];
            frame.getBytes(frame.readerIndex(), bytes);

            ModbusAdu adu = MbapCodec.decode(bytes);
            CompletableFuture<byte[]> reply = pending.get(adu.transactionId());
            if (reply != null) {
                reply.complete(adu.pdu());
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            failPending(new ClosedChannelException());
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            failPending(cause);
            ctx.close();
        }
    }
}
