package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class BulkStringTest {

    private ByteBuf buf(String s) {
        return Unpooled.copiedBuffer(s, StandardCharsets.US_ASCII);
    }

    private String encoded(RespFrame frame) {
        return new String(frame.encode(), StandardCharsets.US_ASCII);
    }

    @Test
    void testEncode() {
        assertEquals("$5\r\nhello\r\n", encoded(new BulkString("hello")));
        assertEquals("$-1\r\n", encoded(BulkString.NULL));
        assertEquals("$-1\r\n", encoded(new BulkString((String) null)));
    }

    @Test
    void testEmptyIsNotNull() {
        BulkString empty = new BulkString("");
        assertFalse(empty.isNull());
        assertEquals("$0\r\n\r\n", encoded(empty));
        assertNotEquals(BulkString.NULL, empty);
    }

    @Test
    void testBinaryPayload() {
        byte[] payload = {0, '\r', '\n', (byte) 0xff};
        ByteBuf buf = Unpooled.wrappedBuffer(new BulkString(payload).encode());

        assertEquals(new BulkString(payload), BulkString.decode(buf));
        assertFalse(buf.isReadable());
    }

    @Test
    void testDecodeAcrossReads() {
        ByteBuf buf = buf("$5\r\nhello\r\n");
        assertEquals(new BulkString("hello"), BulkString.decode(buf));

        // 第二帧只到了一半：缺少结尾 CRLF
        buf.writeCharSequence("$5\r\nhello", StandardCharsets.US_ASCII);
        int readerIndex = buf.readerIndex();
        assertThrows(RespNotCompleteException.class, () -> BulkString.decode(buf));
        assertEquals(readerIndex, buf.readerIndex(), "half frame must not be consumed");

        buf.writeCharSequence("\r\n", StandardCharsets.US_ASCII);
        assertEquals(new BulkString("hello"), BulkString.decode(buf));
        assertEquals(0, buf.readableBytes());
    }

    @Test
    void testDecodeNull() {
        ByteBuf buf = buf("$-1\r\n");
        assertSame(BulkString.NULL, BulkString.decode(buf));
        assertFalse(buf.isReadable());

        assertThrows(RespNotCompleteException.class, () -> BulkString.decode(buf("$-")));
        assertThrows(RespNotCompleteException.class, () -> BulkString.decode(buf("$-1\r")));
        assertThrows(RespFormatException.class, () -> BulkString.decode(buf("$-2\r\n")));
    }

    @Test
    void testMalformed() {
        assertThrows(RespFormatException.class, () -> BulkString.decode(buf("+OK\r\n")));
        assertThrows(RespFormatException.class, () -> BulkString.decode(buf("$abc\r\nhello\r\n")));
        // payload 后面不是 CRLF
        ByteBuf buf = buf("$5\r\nhelloXY");
        assertThrows(RespFormatException.class, () -> BulkString.decode(buf));
        assertEquals(0, buf.readerIndex());
    }

    @Test
    void testExpectLength() {
        // 只需要头部，payload 还没到齐也能算出整帧长度
        assertEquals(11, BulkString.expectLength(buf("$5\r\nhel"), 0));
        assertEquals(5, BulkString.expectLength(buf("$-1\r\n"), 0));
        assertThrows(RespNotCompleteException.class, () -> BulkString.expectLength(buf("$5"), 0));
    }

    @Test
    void testContentIsCopied() {
        byte[] payload = "value".getBytes(StandardCharsets.UTF_8);
        BulkString bulk = new BulkString(payload);

        // 修改传入的数组和读出的数组都不影响帧本身
        payload[0] = 'X';
        bulk.content()[1] = 'Y';
        assertEquals(new BulkString("value"), bulk);
        assertEquals("value", bulk.asString());
    }
}
