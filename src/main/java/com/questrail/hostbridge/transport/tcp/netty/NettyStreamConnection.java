package com.questrail.hostbridge.transport.tcp.netty;

import com.questrail.hostbridge.transport.StreamConnection;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;

import java.net.SocketAddress;
import java.util.Objects;

/**
 * {@link StreamConnection} view of one accepted Netty channel.
 */
final class NettyStreamConnection implements StreamConnection
{
    private final String id;
    private final Channel channel;

    NettyStreamConnection(String id, Channel channel)
    {
        this.id = Objects.requireNonNull(id, "id");
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    @Override
    public String id()
    {
        return id;
    }

    @Override
    public SocketAddress remoteAddress()
    {
        return channel.remoteAddress();
    }

    @Override
    public boolean isOpen()
    {
        return channel.isActive();
    }

    @Override
    public void write(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");
        if (!channel.isActive()) {
            return;
        }
        channel.writeAndFlush(Unpooled.wrappedBuffer(payload));
    }

    @Override
    public void pauseReading()
    {
        channel.config().setAutoRead(false);
    }

    @Override
    public void resumeReading()
    {
        channel.config().setAutoRead(true);
    }

    @Override
    public void close()
    {
        channel.close();
    }

    @Override
    public String toString()
    {
        return id + "(" + channel.remoteAddress() + ")";
    }
}
