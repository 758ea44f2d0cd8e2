package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import org.muma.mini.kv.utils.RespCodecUtil;
import org.muma.mini.kv.utils.RespCodecUtil.LengthHeader;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.muma.mini.kv.utils.RespCodecUtil.CRLF;
import static org.muma.mini.kv.utils.RespCodecUtil.CRLF_LEN;

/**
 * 批量字符串 ($)
 * content 为 null 时表示 Null Bulk String ($-1)，与空串 ($0) 是两个不同的值。
 * 内部数组在构造和读取时都会复制，存入存储引擎后不会被调用方修改。
 */
public record BulkString(byte[] content) implements RespFrame {

    static final byte PREFIX = '$';

    private static final byte[] NULL_BYTES = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    public static final BulkString NULL = new BulkString((byte[]) null);

    public BulkString {
        if (content != null) {
            content = content.clone();
        }
    }

    public BulkString(String s) {
        this(s == null ? null : s.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public byte[] content() {
        return content == null ? null : content.clone();
    }

    public boolean isNull() {
        return content == null;
    }

    public String asString() {
        return content == null ? null : new String(content, StandardCharsets.UTF_8);
    }

    @Override
    public void encode(ByteBuf out) {
        if (content == null) {
            out.writeBytes(NULL_BYTES);
            return;
        }
        RespCodecUtil.writeHeader(out, PREFIX, content.length);
        out.writeBytes(content);
        out.writeBytes(CRLF);
    }

    public static BulkString decode(ByteBuf in) {
        int index = in.readerIndex();
        if (isNullMarker(in, index)) {
            RespCodecUtil.extractFixedData(in, index, NULL_BYTES, "NullBulkString");
            in.skipBytes(NULL_BYTES.length);
            return NULL;
        }

        LengthHeader header = RespCodecUtil.parseLength(in, index, PREFIX, "BulkString");
        int length = header.length();
        long total = (long) header.headerLength() + length + CRLF_LEN;
        if (in.writerIndex() - index < total) {
            throw RespNotCompleteException.INSTANCE;
        }

        int dataStart = index + header.headerLength();
        int tail = dataStart + length;
        if (in.getByte(tail) != '\r' || in.getByte(tail + 1) != '\n') {
            throw new RespFormatException("BulkString payload is not terminated by CRLF");
        }

        byte[] data = new byte[length];
        in.getBytes(dataStart, data);
        in.readerIndex(tail + CRLF_LEN);
        return new BulkString(data);
    }

    /**
     * 只需要长度头即可算出整帧长度，不要求 payload 已经到达
     */
    static int expectLength(ByteBuf in, int index) {
        if (isNullMarker(in, index)) {
            RespCodecUtil.extractFixedData(in, index, NULL_BYTES, "NullBulkString");
            return NULL_BYTES.length;
        }
        LengthHeader header = RespCodecUtil.parseLength(in, index, PREFIX, "BulkString");
        if (header.length() < 0) {
            throw new RespFormatException("invalid BulkString length: " + header.length());
        }
        return header.headerLength() + header.length() + CRLF_LEN;
    }

    private static boolean isNullMarker(ByteBuf in, int index) {
        return in.writerIndex() > index + 1 && in.getByte(index + 1) == '-';
    }

    // byte[] 组件需要按内容比较
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BulkString other)) return false;
        return Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return content == null ? "BulkString[null]" : "BulkString[" + asString() + "]";
    }
}
