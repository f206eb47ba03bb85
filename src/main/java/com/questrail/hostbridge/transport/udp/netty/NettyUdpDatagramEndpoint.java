package com.questrail.hostbridge.transport.udp.netty;

import com.questrail.hostbridge.transport.DatagramEndpoint;
import com.questrail.hostbridge.transport.DatagramEndpointListener;
import com.questrail.hostbridge.transport.TransportBindException;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link DatagramEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Parse JSON</li>
 *   <li>Classify or execute commands</li>
 *   <li>Write anything back to a sender</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <p>Inbound payloads are copied into {@code byte[]} and emitted to the port
 * listener. All reference-counted buffers are released internally.</p>
 *
 * <h2>Datagram size</h2>
 * The receive buffer is fixed at {@code maxDatagramBytes}. A larger datagram
 * is truncated by the socket and then fails JSON decoding, so it is dropped
 * like any other malformed datagram.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds synchronously and throws {@link TransportBindException} on failure.
 * - {@link #stop()} closes the channel and shuts down the event loop group.
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyUdpDatagramEndpoint.class);

    private final InetSocketAddress bindAddress;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile DatagramEndpointListener listener;
    private volatile Channel channel;

    /**
     * Construct a Netty UDP endpoint binding to the specified local address.
     *
     * <p>A dedicated single-threaded {@link NioEventLoopGroup} keeps datagram
     * delivery serial and independent of the TCP event loops.</p>
     */
    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress, int maxDatagramBytes)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        if (maxDatagramBytes <= 0) {
            throw new IllegalArgumentException("maxDatagramBytes must be positive");
        }

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, false)
                .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(maxDatagramBytes))
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(DatagramEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        DatagramEndpointListener l = requireListener();
        if (stopped.get()) {
            throw new IllegalStateException("Endpoint has been stopped");
        }

        ChannelFuture f = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!f.isSuccess()) {
            group.shutdownGracefully();
            throw new TransportBindException(bindAddress, f.cause());
        }

        channel = f.channel();
        l.onTransportUp();
    }

    @Override
    public void stop()
    {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }

        Channel ch = channel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }

        group.shutdownGracefully().awaitUninterruptibly();

        DatagramEndpointListener l = listener;
        if (l != null && ch != null) {
            l.onTransportDown(null);
        }
    }

    @Override
    public SocketAddress localAddress()
    {
        Channel ch = channel;
        return ch != null ? ch.localAddress() : null;
    }

    private DatagramEndpointListener requireListener()
    {
        DatagramEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("DatagramEndpointListener must be set before start()");
        }
        return l;
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Receives Netty {@link DatagramPacket}s and forwards raw payload bytes
     * to the port listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            DatagramEndpointListener l = listener;
            if (l == null) {
                return;
            }

            // Copy the payload into a plain byte[] (Netty containment rule).
            ByteBuf content = packet.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            l.onDatagram(packet.sender(), bytes);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            // A datagram socket survives a failed read; keep receiving.
            log.warn("UDP receive failed on {}", bindAddress, cause);
        }
    }
}
