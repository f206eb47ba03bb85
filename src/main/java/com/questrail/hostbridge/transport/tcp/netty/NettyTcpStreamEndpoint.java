package com.questrail.hostbridge.transport.tcp.netty;

import com.questrail.hostbridge.transport.StreamConnection;
import com.questrail.hostbridge.transport.StreamEndpoint;
import com.questrail.hostbridge.transport.StreamEndpointListener;
import com.questrail.hostbridge.transport.TransportBindException;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.GlobalEventExecutor;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * NettyTcpStreamEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link StreamEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * Accepts connections, frames each connection's byte stream with
 * {@link JsonObjectFrameDecoder}, and hands complete messages to the port
 * listener. It does not decode JSON, classify, or execute anything.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Connections are exposed as
 * {@link StreamConnection}; messages as {@code byte[]}.
 *
 * <h2>Threading</h2>
 * Each connection is pinned to one worker event loop, so callbacks for a
 * connection are serial and in stream order. The listener must not block.
 */
public final class NettyTcpStreamEndpoint implements StreamEndpoint
{
    private final InetSocketAddress bindAddress;
    private final int maxMessageBytes;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ChannelGroup connections = new DefaultChannelGroup("host-bridge-tcp", GlobalEventExecutor.INSTANCE);
    private final AtomicLong connectionIds = new AtomicLong();
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile StreamEndpointListener listener;
    private volatile Channel serverChannel;

    public NettyTcpStreamEndpoint(InetSocketAddress bindAddress, int maxMessageBytes)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        if (maxMessageBytes < 2) {
            throw new IllegalArgumentException("maxMessageBytes must be >= 2");
        }
        this.maxMessageBytes = maxMessageBytes;

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup();
    }

    @Override
    public void setListener(StreamEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        StreamEndpointListener l = requireListener();
        if (stopped.get()) {
            throw new IllegalStateException("Endpoint has been stopped");
        }

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ch.pipeline().addLast(
                                new JsonObjectFrameDecoder(maxMessageBytes),
                                new ConnectionHandler());
                    }
                });

        ChannelFuture f = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!f.isSuccess()) {
            shutdownGroups();
            throw new TransportBindException(bindAddress, f.cause());
        }

        serverChannel = f.channel();
        l.onTransportUp();
    }

    @Override
    public void stopAccepting()
    {
        Channel ch = serverChannel;
        if (ch != null && ch.isOpen()) {
            ch.close().awaitUninterruptibly();
        }
    }

    @Override
    public void stop()
    {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }

        stopAccepting();
        connections.close().awaitUninterruptibly();
        shutdownGroups();

        StreamEndpointListener l = listener;
        if (l != null && serverChannel != null) {
            l.onTransportDown(null);
        }
    }

    @Override
    public SocketAddress localAddress()
    {
        Channel ch = serverChannel;
        return ch != null ? ch.localAddress() : null;
    }

    /**
     * Number of currently open connections.
     */
    public int connectionCount()
    {
        return connections.size();
    }

    private void shutdownGroups()
    {
        bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
        workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
    }

    private StreamEndpointListener requireListener()
    {
        StreamEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("StreamEndpointListener must be set before start()");
        }
        return l;
    }

    /**
     * ConnectionHandler
     * -------------------------------------------------------------------------
     * One per channel. Translates channel events into listener callbacks.
     */
    private final class ConnectionHandler extends ChannelInboundHandlerAdapter
    {
        private NettyStreamConnection connection;
        private Throwable failure;

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            connection = new NettyStreamConnection("tcp-" + connectionIds.incrementAndGet(), ctx.channel());
            connections.add(ctx.channel());

            StreamEndpointListener l = listener;
            if (l != null) {
                l.onConnectionOpened(connection);
            }
            ctx.fireChannelActive();
        }

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg)
        {
            StreamEndpointListener l = listener;
            if (l == null || connection == null) {
                return;
            }

            if (msg instanceof byte[] message) {
                l.onMessage(connection, message);
            }
            else if (msg instanceof JsonObjectFrameDecoder.MalformedFrame malformed) {
                l.onMalformedMessage(connection, malformed.reason());
            }
            else {
                ctx.fireChannelRead(msg);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            StreamEndpointListener l = listener;
            if (l != null && connection != null) {
                l.onConnectionClosed(connection, failure);
            }
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            // Socket-level failure: fatal for this connection only.
            failure = cause;
            ctx.close();
        }
    }
}
