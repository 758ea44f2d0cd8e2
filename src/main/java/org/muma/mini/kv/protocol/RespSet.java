package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import org.muma.mini.kv.utils.RespCodecUtil;
import org.muma.mini.kv.utils.RespCodecUtil.LengthHeader;

import java.util.List;

/**
 * RESP3 集合 (~)
 * 线上编码与数组相同，只是前缀不同；元素顺序按写入顺序保留，不做去重。
 */
public record RespSet(List<RespFrame> elements) implements RespFrame {

    static final byte PREFIX = '~';

    public RespSet {
        elements = List.copyOf(elements);
    }

    @Override
    public void encode(ByteBuf out) {
        RespCodecUtil.writeHeader(out, PREFIX, elements.size());
        for (RespFrame element : elements) {
            element.encode(out);
        }
    }

    public static RespSet decode(ByteBuf in) {
        int index = in.readerIndex();
        RespCodec.requireComplete(in, expectLength(in, index, 0));

        LengthHeader header = RespCodecUtil.parseLength(in, index, PREFIX, "Set");
        in.skipBytes(header.headerLength());
        return new RespSet(RespCodec.decodeFrames(in, header.length()));
    }

    static int expectLength(ByteBuf in, int index, int depth) {
        LengthHeader header = RespCodecUtil.parseLength(in, index, PREFIX, "Set");
        if (header.length() < 0) {
            throw new RespFormatException("invalid Set length: " + header.length());
        }
        return RespCodec.expectFramesLength(in, index, header, header.length(), depth);
    }
}
