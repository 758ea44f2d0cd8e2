package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import org.muma.mini.kv.utils.RespCodecUtil;

import static org.muma.mini.kv.utils.RespCodecUtil.CRLF_LEN;

// 错误 (-)
public record SimpleError(String content) implements RespFrame {

    static final byte PREFIX = '-';

    public SimpleError {
        RespCodecUtil.requireSingleLine(content, "SimpleError");
    }

    /**
     * 构造 "ERR ..." 回复。message 中可能带有客户端传入的文本，
     * CR / LF 替换为空格，保证回复始终是单个帧。
     */
    public static SimpleError err(String message) {
        String text = message == null ? "unknown error" : message;
        return new SimpleError("ERR " + text.replace('\r', ' ').replace('\n', ' '));
    }

    @Override
    public void encode(ByteBuf out) {
        RespCodecUtil.writeLine(out, PREFIX, content);
    }

    public static SimpleError decode(ByteBuf in) {
        int index = in.readerIndex();
        int end = RespCodecUtil.lineEnd(in, index, PREFIX, "SimpleError");
        String content = RespCodecUtil.lineContent(in, index, end);
        in.readerIndex(end + CRLF_LEN);
        return new SimpleError(content);
    }

    static int expectLength(ByteBuf in, int index) {
        return RespCodecUtil.lineEnd(in, index, PREFIX, "SimpleError") + CRLF_LEN - index;
    }
}
