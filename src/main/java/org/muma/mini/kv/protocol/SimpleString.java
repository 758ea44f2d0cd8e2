package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import org.muma.mini.kv.utils.RespCodecUtil;

import static org.muma.mini.kv.utils.RespCodecUtil.CRLF_LEN;

// 简单字符串 (+)
public record SimpleString(String content) implements RespFrame {

    static final byte PREFIX = '+';

    public static final SimpleString OK = new SimpleString("OK");

    public SimpleString {
        RespCodecUtil.requireSingleLine(content, "SimpleString");
    }

    @Override
    public void encode(ByteBuf out) {
        RespCodecUtil.writeLine(out, PREFIX, content);
    }

    public static SimpleString decode(ByteBuf in) {
        int index = in.readerIndex();
        int end = RespCodecUtil.lineEnd(in, index, PREFIX, "SimpleString");
        String content = RespCodecUtil.lineContent(in, index, end);
        in.readerIndex(end + CRLF_LEN);
        return new SimpleString(content);
    }

    static int expectLength(ByteBuf in, int index) {
        return RespCodecUtil.lineEnd(in, index, PREFIX, "SimpleString") + CRLF_LEN - index;
    }
}
