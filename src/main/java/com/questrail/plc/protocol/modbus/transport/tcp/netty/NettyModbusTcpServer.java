package com.questrail.plc.protocol.modbus.transport.tcp.netty;

import com.questrail.plc.protocol.modbus.client.ModbusTransportException;
import com.questrail.plc.protocol.modbus.codec.MbapCodec;
import com.questrail.plc.protocol.modbus.codec.ModbusDecodeException;
import com.questrail.plc.protocol.modbus.model.ModbusAdu;
import com.questrail.plc.protocol.modbus.server.ModbusRequestProcessor;
import com.questrail.plc.protocol.modbus.transport.ModbusServerEndpoint;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * NettyModbusTcpServer
 * =============================================================================
 * Netty-backed implementation of the {@link ModbusServerEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * A pure transport adapter: it splits the TCP stream into MBAP frames and
 * passes each PDU to a {@link ModbusRequestProcessor}. It never touches
 * register contents itself.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Inbound frames are copied into
 * {@code byte[]} before they leave the pipeline.
 *
 * <h2>Failure isolation</h2>
 * A frame whose MBAP header cannot be decoded, or any exception raised in a
 * client's pipeline, closes that client channel and is logged. Other clients
 * and the listening socket are unaffected.
 */
public final class NettyModbusTcpServer implements ModbusServerEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyModbusTcpServer.class);

    static final int MAX_FRAME_LENGTH = MbapCodec.HEADER_LENGTH + MbapCodec.MAX_PDU_LENGTH;

    private final InetSocketAddress bindAddress;
    private final ModbusRequestProcessor processor;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ServerBootstrap bootstrap;

    private volatile Channel channel;

    public NettyModbusTcpServer(InetSocketAddress bindAddress, ModbusRequestProcessor processor)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.processor = Objects.requireNonNull(processor, "processor");

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup(1);
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new LengthFieldBasedFrameDecoder(
                                MAX_FRAME_LENGTH, MbapCodec.LENGTH_FIELD_OFFSET, 2, 0, 0));
                        p.addLast(new RequestHandler());
                    }
                });
    }

    @Override
    public void start() throws ModbusTransportException
    {
        ChannelFuture f = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!f.isSuccess()) {
            close();
            throw new ModbusTransportException("Unable to bind Modbus server on " + bindAddress, f.cause());
        }
        channel = f.channel();
        log.info("Modbus server listening on {}", channel.localAddress());
    }

    @Override
    public Optional<InetSocketAddress> boundAddress()
    {
        Channel ch = channel;
        if (ch == null) {
            return Optional.empty();
        }
        return Optional.of((InetSocketAddress) ch.localAddress());
    }

    @Override
    public void close()
    {
        Channel ch = channel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
            channel = null;
        }
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
    }

    /**
     * RequestHandler
     * -------------------------------------------------------------------------
     * Receives complete MBAP frames, services them, and writes the reply with
     * the request's transaction and unit ids.
     */
    private final class RequestHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame)
        {
            byte[] bytes = new byte[frame.readableBytes()];
            frame.getBytes(frame.readerIndex(), bytes);

            ModbusAdu request;
            try {
                request = MbapCodec.decode(bytes);
            }
            catch (ModbusDecodeException e) {
                log.warn("Closing Modbus client {}: {}", ctx.channel().remoteAddress(), e.getMessage());
                ctx.close();
                return;
            }

            Optional<byte[]> reply = processor.handle(request.pdu());
            if (reply.isEmpty()) {
                log.warn("Closing Modbus client {}: unanswerable request", ctx.channel().remoteAddress());
                ctx.close();
                return;
            }

            ModbusAdu response = new ModbusAdu(request.transactionId(), request.unitId(), reply.get());
            ctx.writeAndFlush(Unpooled.wrappedBuffer(MbapCodec.encode(response)));
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            log.debug("Modbus client connected: {}", ctx.channel().remoteAddress());
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.warn("Modbus client {} failed; closing channel", ctx.channel().remoteAddress(), cause);
            ctx.close();
        }
    }
}
