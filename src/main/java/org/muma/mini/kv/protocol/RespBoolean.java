package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import org.muma.mini.kv.utils.RespCodecUtil;

import java.nio.charset.StandardCharsets;

// RESP3 布尔 (#t / #f)
public record RespBoolean(boolean value) implements RespFrame {

    static final byte PREFIX = '#';

    private static final byte[] TRUE_BYTES = "#t\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] FALSE_BYTES = "#f\r\n".getBytes(StandardCharsets.US_ASCII);

    public static final RespBoolean TRUE = new RespBoolean(true);
    public static final RespBoolean FALSE = new RespBoolean(false);

    @Override
    public void encode(ByteBuf out) {
        out.writeBytes(value ? TRUE_BYTES : FALSE_BYTES);
    }

    public static RespBoolean decode(ByteBuf in) {
        int index = in.readerIndex();
        boolean value = literalFor(in, index) == TRUE_BYTES;
        in.skipBytes(TRUE_BYTES.length);
        return value ? TRUE : FALSE;
    }

    static int expectLength(ByteBuf in, int index) {
        return literalFor(in, index).length;
    }

    private static byte[] literalFor(ByteBuf in, int index) {
        RespCodecUtil.checkPrefix(in, index, PREFIX, "Boolean");
        if (in.writerIndex() <= index + 1) {
            throw RespNotCompleteException.INSTANCE;
        }
        byte flag = in.getByte(index + 1);
        byte[] expected = switch (flag) {
            case 't' -> TRUE_BYTES;
            case 'f' -> FALSE_BYTES;
            default -> throw new RespFormatException("invalid Boolean value: '" + (char) flag + "'");
        };
        RespCodecUtil.extractFixedData(in, index, expected, "Boolean");
        return expected;
    }
}
