package org.muma.mini.kv.utils;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import org.muma.mini.kv.protocol.RespFormatException;
import org.muma.mini.kv.protocol.RespFrame;
import org.muma.mini.kv.protocol.RespNotCompleteException;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * RESP 编解码的公共工具：前缀校验、CRLF 扫描、长度解析。
 * 所有读取都使用绝对下标 (getXxx)，不会移动 readerIndex，
 * 由各帧类型在确认数据完整后自行推进。
 */
public final class RespCodecUtil {

    public static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);
    public static final int CRLF_LEN = 2;

    // 与 Redis proto-max-bulk-len 默认值一致
    public static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;

    private static final byte CR = '\r';
    private static final byte LF = '\n';

    /**
     * 长度头：prefix + 十进制数字 + CRLF
     *
     * @param headerLength 头部占用的字节数 (含前缀与 CRLF)
     * @param length       解析出的长度，-1 表示 null
     */
    public record LengthHeader(int headerLength, int length) {
    }

    private RespCodecUtil() {
    }

    /**
     * 从 from 开始查找第一个 CRLF，返回 CR 的下标；数据中还没有 CRLF 时返回 -1
     */
    public static int findCrlf(ByteBuf buf, int from) {
        int last = buf.writerIndex() - 1;
        for (int i = from; i < last; i++) {
            if (buf.getByte(i) == CR && buf.getByte(i + 1) == LF) {
                return i;
            }
        }
        return -1;
    }

    public static void checkPrefix(ByteBuf buf, int index, byte prefix, String type) {
        if (index >= buf.writerIndex()) {
            throw RespNotCompleteException.INSTANCE;
        }
        byte actual = buf.getByte(index);
        if (actual != prefix) {
            throw new RespFormatException("expect " + type + " prefix '" + (char) prefix
                    + "', got '" + (char) actual + "'");
        }
    }

    /**
     * 行类型帧 (+ - : , 等)：校验前缀并返回行尾 CR 的下标
     */
    public static int lineEnd(ByteBuf buf, int index, byte prefix, String type) {
        checkPrefix(buf, index, prefix, type);
        int end = findCrlf(buf, index + 1);
        if (end < 0) {
            throw RespNotCompleteException.INSTANCE;
        }
        return end;
    }

    /**
     * 读取行内容 (不含前缀与 CRLF)。
     * 行内出现单独的 CR / LF 或非法 UTF-8 字节都视为格式错误。
     */
    public static String lineContent(ByteBuf buf, int index, int end) {
        int start = index + 1;
        int length = end - start;
        if (buf.forEachByte(start, length, b -> b != CR && b != LF) >= 0) {
            throw new RespFormatException("line contains a bare CR or LF");
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(buf.nioBuffer(start, length))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new RespFormatException("line is not valid UTF-8");
        }
    }

    /**
     * 行类型帧的内容不能包含 CR / LF，否则编码后无法原样解码
     *
     * @throws IllegalArgumentException content 为 null 或包含 CR / LF
     */
    public static String requireSingleLine(String content, String type) {
        if (content == null) {
            throw new IllegalArgumentException(type + " must not be null");
        }
        if (content.indexOf(CR) >= 0 || content.indexOf(LF) >= 0) {
            throw new IllegalArgumentException(type + " must not contain CR or LF");
        }
        return content;
    }

    public static long parseLong(String text, String type) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new RespFormatException("invalid " + type + " number: '" + text + "'");
        }
    }

    /**
     * 解析 $ * % ~ 等类型的长度头。
     * 头部还没收完时抛出半包信号；-1 仅作为 null 标记合法，其余负数和超大值视为格式错误。
     */
    public static LengthHeader parseLength(ByteBuf buf, int index, byte prefix, String type) {
        int end = lineEnd(buf, index, prefix, type);
        long length = parseLong(lineContent(buf, index, end), type);
        if (length < -1 || length > MAX_BULK_LENGTH) {
            throw new RespFormatException("invalid " + type + " length: " + length);
        }
        return new LengthHeader(end + CRLF_LEN - index, (int) length);
    }

    /**
     * 固定字面量匹配 (如 $-1\r\n, #t\r\n)。
     * 已有的字节与字面量冲突时报格式错误；是字面量的严格前缀时抛出半包信号。
     */
    public static void extractFixedData(ByteBuf buf, int index, byte[] expected, String type) {
        int available = Math.min(buf.writerIndex() - index, expected.length);
        for (int i = 0; i < available; i++) {
            if (buf.getByte(index + i) != expected[i]) {
                throw new RespFormatException("expect " + type + " literal '"
                        + escape(expected) + "'");
            }
        }
        if (available < expected.length) {
            throw RespNotCompleteException.INSTANCE;
        }
    }

    /**
     * 写入 prefix + 十进制数字 + CRLF
     */
    public static void writeHeader(ByteBuf out, byte prefix, long value) {
        out.writeByte(prefix);
        out.writeCharSequence(Long.toString(value), StandardCharsets.US_ASCII);
        out.writeBytes(CRLF);
    }

    public static void writeLine(ByteBuf out, byte prefix, String content) {
        out.writeByte(prefix);
        out.writeCharSequence(content, StandardCharsets.UTF_8);
        out.writeBytes(CRLF);
    }

    /**
     * 将任意帧编码为字节数组 (测试和日志使用；网络路径直接写 ByteBuf)
     */
    public static byte[] encode(RespFrame frame) {
        ByteBuf buf = Unpooled.buffer(64);
        try {
            frame.encode(buf);
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }

    private static String escape(byte[] bytes) {
        return new String(bytes, StandardCharsets.US_ASCII)
                .replace("\r", "\\r")
                .replace("\n", "\\n");
    }
}
