package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import org.muma.mini.kv.utils.RespCodecUtil;

import java.nio.charset.StandardCharsets;

// RESP3 Null (_)
public record RespNull() implements RespFrame {

    static final byte PREFIX = '_';

    private static final byte[] BYTES = "_\r\n".getBytes(StandardCharsets.US_ASCII);

    public static final RespNull INSTANCE = new RespNull();

    @Override
    public void encode(ByteBuf out) {
        out.writeBytes(BYTES);
    }

    public static RespNull decode(ByteBuf in) {
        RespCodecUtil.extractFixedData(in, in.readerIndex(), BYTES, "Null");
        in.skipBytes(BYTES.length);
        return INSTANCE;
    }

    static int expectLength(ByteBuf in, int index) {
        RespCodecUtil.extractFixedData(in, index, BYTES, "Null");
        return BYTES.length;
    }
}
