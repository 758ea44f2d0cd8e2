package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import org.muma.mini.kv.utils.RespCodecUtil;
import org.muma.mini.kv.utils.RespCodecUtil.LengthHeader;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 数组 (*)
 * elements 为 null 时表示 Null Array (*-1)
 */
public record RespArray(List<RespFrame> elements) implements RespFrame {

    static final byte PREFIX = '*';

    private static final byte[] NULL_BYTES = "*-1\r\n".getBytes(StandardCharsets.US_ASCII);

    public static final RespArray NULL = new RespArray(null);
    public static final RespArray EMPTY = new RespArray(List.of());

    public RespArray {
        if (elements != null) {
            elements = List.copyOf(elements);
        }
    }

    public static RespArray of(RespFrame... elements) {
        return new RespArray(List.of(elements));
    }

    public boolean isNull() {
        return elements == null;
    }

    public int size() {
        return elements == null ? 0 : elements.size();
    }

    public RespFrame get(int i) {
        return elements.get(i);
    }

    @Override
    public void encode(ByteBuf out) {
        if (elements == null) {
            out.writeBytes(NULL_BYTES);
            return;
        }
        RespCodecUtil.writeHeader(out, PREFIX, elements.size());
        for (RespFrame element : elements) {
            element.encode(out);
        }
    }

    public static RespArray decode(ByteBuf in) {
        int index = in.readerIndex();
        if (isNullMarker(in, index)) {
            RespCodecUtil.extractFixedData(in, index, NULL_BYTES, "NullArray");
            in.skipBytes(NULL_BYTES.length);
            return NULL;
        }
        // 先确认整个数组 (含所有嵌套元素) 都已到达，再开始消费
        RespCodec.requireComplete(in, expectLength(in, index, 0));

        LengthHeader header = RespCodecUtil.parseLength(in, index, PREFIX, "Array");
        in.skipBytes(header.headerLength());
        return new RespArray(RespCodec.decodeFrames(in, header.length()));
    }

    static int expectLength(ByteBuf in, int index, int depth) {
        if (isNullMarker(in, index)) {
            RespCodecUtil.extractFixedData(in, index, NULL_BYTES, "NullArray");
            return NULL_BYTES.length;
        }
        LengthHeader header = RespCodecUtil.parseLength(in, index, PREFIX, "Array");
        return RespCodec.expectFramesLength(in, index, header, header.length(), depth);
    }

    private static boolean isNullMarker(ByteBuf in, int index) {
        return in.writerIndex() > index + 1 && in.getByte(index + 1) == '-';
    }
}
