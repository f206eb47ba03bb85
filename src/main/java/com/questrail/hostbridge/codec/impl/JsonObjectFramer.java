package com.questrail.hostbridge.codec.impl;

import java.io.ByteArrayOutputStream;
import java.util.Objects;

/**
 * JsonObjectFramer
 * =============================================================================
 * Incremental framer that cuts a TCP byte stream into complete top-level JSON
 * objects.
 *
 * <h2>Framing rule</h2>
 * A frame starts at a <code>{</code> seen between frames and ends at the byte
 * that brings the nesting depth back to zero. Braces and brackets inside JSON
 * strings (including escaped quotes) are ignored. Only structure is tracked;
 * whether the frame is valid JSON is decided later by the decoder.
 *
 * <h2>Between frames</h2>
 * Whitespace, including newlines, is skipped, so newline-delimited clients work
 * unchanged. Any other byte starts a run of stray bytes. A run ends at a newline
 * or at the next <code>{</code> and is reported once through
 * {@link Sink#onMalformed(String)}.
 *
 * <h2>Size limit</h2>
 * A frame that grows past {@code maxFrameBytes} is consumed to its end without
 * being buffered and then reported once as malformed.
 *
 * <h2>Threading</h2>
 * One instance per connection. Not thread-safe; the owning transport delivers
 * bytes serially.
 */
public final class JsonObjectFramer
{
    /**
     * Receives framing outcomes, in stream order.
     */
    public interface Sink
    {
        void onFrame(byte[] frame);

        void onMalformed(String reason);
    }

    private final int maxFrameBytes;
    private final ByteArrayOutputStream frame = new ByteArrayOutputStream(256);

    private int depth;
    private boolean inString;
    private boolean escaped;
    private boolean oversized;
    private int strayBytes;

    public JsonObjectFramer(int maxFrameBytes)
    {
        if (maxFrameBytes < 2) {
            throw new IllegalArgumentException("maxFrameBytes must be >= 2");
        }
        this.maxFrameBytes = maxFrameBytes;
    }

    /**
     * Feed the next chunk of the stream.
     */
    public void feed(byte[] bytes, int offset, int length, Sink sink)
    {
        Objects.requireNonNull(bytes, "bytes");
        Objects.requireNonNull(sink, "sink");
        Objects.checkFromIndexSize(offset, length, bytes.length);

        for (int i = offset; i < offset + length; i++) {
            if (depth == 0) {
                betweenFrames(bytes[i], sink);
            }
            else {
                insideFrame(bytes[i], sink);
            }
        }
    }

    public void feed(byte[] bytes, Sink sink)
    {
        feed(bytes, 0, bytes.length, sink);
    }

    /**
     * Bytes held for an incomplete frame.
     */
    public int bufferedBytes()
    {
        return frame.size();
    }

    /**
     * True if a frame or stray run has started but not ended.
     */
    public boolean hasPartialInput()
    {
        return depth > 0 || strayBytes > 0;
    }

    private void betweenFrames(byte b, Sink sink)
    {
        if (b == '{') {
            flushStray(sink);
            depth = 1;
            inString = false;
            escaped = false;
            oversized = false;
            frame.reset();
            frame.write(b);
        }
        else if (b == '\n') {
            flushStray(sink);
        }
        else if (!isWhitespace(b)) {
            strayBytes++;
        }
    }

    private void insideFrame(byte b, Sink sink)
    {
        append(b);

        if (inString) {
            if (escaped) {
                escaped = false;
            }
            else if (b == '\\') {
                escaped = true;
            }
            else if (b == '"') {
                inString = false;
            }
            return;
        }

        switch (b) {
            case '"' -> inString = true;
            case '{', '[' -> depth++;
            case '}', ']' -> {
                depth--;
                if (depth == 0) {
                    complete(sink);
                }
            }
            default -> { }
        }
    }

    private void append(byte b)
    {
        if (oversized) {
            return;
        }
        if (frame.size() >= maxFrameBytes) {
            oversized = true;
            frame.reset();
            return;
        }
        frame.write(b);
    }

    private void complete(Sink sink)
    {
        if (oversized) {
            oversized = false;
            frame.reset();
            sink.onMalformed("Message exceeds " + maxFrameBytes + " bytes");
            return;
        }
        byte[] bytes = frame.toByteArray();
        frame.reset();
        sink.onFrame(bytes);
    }

    private void flushStray(Sink sink)
    {
        if (strayBytes > 0) {
            int discarded = strayBytes;
            strayBytes = 0;
            sink.onMalformed("Discarded " + discarded + " byte(s) outside a JSON object");
        }
    }

    private static boolean isWhitespace(byte b)
    {
        return b == ' ' || b == '\t' || b == '\r';
    }
}
