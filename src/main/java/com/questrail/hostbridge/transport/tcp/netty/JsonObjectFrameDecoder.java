package com.questrail.hostbridge.transport.tcp.netty;

import com.questrail.hostbridge.codec.impl.JsonObjectFramer;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.util.List;

/**
 * Splits a TCP byte stream into complete JSON objects.
 *
 * <p>Emits {@code byte[]} for every complete object and {@link MalformedFrame}
 * for every run of bytes the framer discarded. Never throws on bad input, so
 * one garbled request does not take the connection down.</p>
 *
 * <p>Stateful; one instance per channel.</p>
 */
final class JsonObjectFrameDecoder extends ByteToMessageDecoder
{
    record MalformedFrame(String reason) {}

    private final JsonObjectFramer framer;

    JsonObjectFrameDecoder(int maxMessageBytes)
    {
        this.framer = new JsonObjectFramer(maxMessageBytes);
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out)
    {
        int readable = in.readableBytes();
        if (readable == 0) {
            return;
        }

        byte[] chunk = new byte[readable];
        in.readBytes(chunk);

        framer.feed(chunk, new JsonObjectFramer.Sink() {
            @Override
            public void onFrame(byte[] frame)
            {
                out.add(frame);
            }

            @Override
            public void onMalformed(String reason)
            {
                out.add(new MalformedFrame(reason));
            }
        });
    }

    int bufferedBytes()
    {
        return framer.bufferedBytes();
    }
}
