package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RespDecoder / RespEncoder 在 Netty pipeline 中的行为 (不走真实 socket)
 */
class RespPipelineTest {

    private ByteBuf buf(String s) {
        return Unpooled.copiedBuffer(s, StandardCharsets.US_ASCII);
    }

    @Test
    void testDecoderWaitsForSplitFrame() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        // 第一次读只到了半个帧
        assertFalse(channel.writeInbound(buf("*2\r\n$3\r\nGET\r\n$")));
        assertNull(channel.readInbound());

        assertTrue(channel.writeInbound(buf("1\r\nk\r\n")));
        RespFrame frame = channel.readInbound();
        assertEquals(RespArray.of(new BulkString("GET"), new BulkString("k")), frame);
        assertNull(channel.readInbound());

        assertFalse(channel.finish());
    }

    @Test
    void testDecoderEmitsPipelinedFrames() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        assertTrue(channel.writeInbound(buf("*1\r\n$4\r\nPING\r\n*2\r\n$4\r\nECHO\r\n$2\r\nhi\r\n:1")));
        assertEquals(RespArray.of(new BulkString("PING")), channel.readInbound());
        assertEquals(RespArray.of(new BulkString("ECHO"), new BulkString("hi")), channel.readInbound());
        // 尾部不完整的 :1 留在累积缓冲区中
        assertNull(channel.readInbound());

        channel.writeInbound(buf("\r\n"));
        assertEquals(RespInteger.ONE, channel.readInbound());
        channel.finish();
    }

    @Test
    void testDecoderRejectsMalformedFrame() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespDecoder());

        DecoderException e = assertThrows(DecoderException.class, () -> channel.writeInbound(buf("?what\r\n")));
        assertInstanceOf(RespFormatException.class, e.getCause());
        channel.finishAndReleaseAll();
    }

    @Test
    void testEncoder() {
        EmbeddedChannel channel = new EmbeddedChannel(new RespEncoder());

        assertTrue(channel.writeOutbound(RespArray.of(RespInteger.ONE, RespInteger.ONE, RespInteger.ZERO)));
        ByteBuf out = channel.readOutbound();
        try {
            assertEquals("*3\r\n:1\r\n:1\r\n:0\r\n", out.toString(StandardCharsets.US_ASCII));
        } finally {
            out.release();
        }
        assertFalse(channel.finish());
    }
}
