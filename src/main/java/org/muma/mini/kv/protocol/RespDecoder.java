package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.util.List;

/**
 * RESP 协议解码器
 * ByteToMessageDecoder 负责累积字节；每次先用 expectLength 探测是否已有完整帧，
 * 半包时直接返回等待下一次 channelRead，不消费任何字节。
 * 格式错误以 RespFormatException 抛出，由 Netty 包装为 DecoderException 交给 exceptionCaught。
 */
public class RespDecoder extends ByteToMessageDecoder {

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        try {
            if (!RespCodec.hasCompleteFrame(in)) {
                return;
            }
            out.add(RespCodec.decode(in));
        } catch (RespFormatException e) {
            // 流位置已经损坏：丢弃剩余字节，避免连接关闭时 decodeLast 重复解析同一段坏数据
            in.skipBytes(in.readableBytes());
            throw e;
        }
    }
}
