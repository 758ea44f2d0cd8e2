package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import org.muma.mini.kv.utils.RespCodecUtil;

import static org.muma.mini.kv.utils.RespCodecUtil.CRLF_LEN;

// 整数 (:)，有符号 64 位
public record RespInteger(long value) implements RespFrame {

    static final byte PREFIX = ':';

    public static final RespInteger ZERO = new RespInteger(0);
    public static final RespInteger ONE = new RespInteger(1);

    public static RespInteger of(boolean flag) {
        return flag ? ONE : ZERO;
    }

    @Override
    public void encode(ByteBuf out) {
        RespCodecUtil.writeHeader(out, PREFIX, value);
    }

    public static RespInteger decode(ByteBuf in) {
        int index = in.readerIndex();
        int end = RespCodecUtil.lineEnd(in, index, PREFIX, "Integer");
        long value = RespCodecUtil.parseLong(RespCodecUtil.lineContent(in, index, end), "Integer");
        in.readerIndex(end + CRLF_LEN);
        return new RespInteger(value);
    }

    static int expectLength(ByteBuf in, int index) {
        return RespCodecUtil.lineEnd(in, index, PREFIX, "Integer") + CRLF_LEN - index;
    }
}
