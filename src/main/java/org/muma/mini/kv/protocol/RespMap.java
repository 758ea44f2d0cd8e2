package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import org.muma.mini.kv.utils.RespCodecUtil;
import org.muma.mini.kv.utils.RespCodecUtil.LengthHeader;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RESP3 映射 (%)
 * 编码为 %N\r\n 后跟 N 个 (SimpleString key, value) 对，按插入顺序输出。
 */
public record RespMap(Map<String, RespFrame> entries) implements RespFrame {

    static final byte PREFIX = '%';

    public RespMap {
        entries.keySet().forEach(key -> RespCodecUtil.requireSingleLine(key, "Map key"));
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    @Override
    public void encode(ByteBuf out) {
        RespCodecUtil.writeHeader(out, PREFIX, entries.size());
        for (Map.Entry<String, RespFrame> entry : entries.entrySet()) {
            new SimpleString(entry.getKey()).encode(out);
            entry.getValue().encode(out);
        }
    }

    public static RespMap decode(ByteBuf in) {
        int index = in.readerIndex();
        RespCodec.requireComplete(in, expectLength(in, index, 0));

        LengthHeader header = RespCodecUtil.parseLength(in, index, PREFIX, "Map");
        in.skipBytes(header.headerLength());
        Map<String, RespFrame> entries = new LinkedHashMap<>();
        for (int i = 0; i < header.length(); i++) {
            String key = SimpleString.decode(in).content();
            entries.put(key, RespCodec.decode(in));
        }
        return new RespMap(entries);
    }

    static int expectLength(ByteBuf in, int index, int depth) {
        LengthHeader header = RespCodecUtil.parseLength(in, index, PREFIX, "Map");
        if (header.length() < 0) {
            throw new RespFormatException("invalid Map length: " + header.length());
        }
        long total = header.headerLength();
        for (int i = 0; i < header.length(); i++) {
            // key 只允许 SimpleString
            total += SimpleString.expectLength(in, (int) (index + total));
            total += RespCodec.expectLength(in, (int) (index + total), depth + 1);
            RespCodec.checkFrameLength(total);
        }
        return (int) total;
    }
}
