package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import org.muma.mini.kv.utils.RespCodecUtil;

/**
 * RESP 帧 (密封接口，限制实现类)。
 * 编码逻辑放在各实现类中，通过多态分发；解码按前缀字节在 {@link RespCodec} 中分发。
 */
public sealed interface RespFrame permits
        SimpleString, SimpleError, RespInteger, BulkString, RespArray,
        RespNull, RespBoolean, RespDouble, RespMap, RespSet {

    /**
     * 写出本帧的完整编码，总是成功
     */
    void encode(ByteBuf out);

    default byte[] encode() {
        return RespCodecUtil.encode(this);
    }
}
