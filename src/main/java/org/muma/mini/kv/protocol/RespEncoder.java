package org.muma.mini.kv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

public class RespEncoder extends MessageToByteEncoder<RespFrame> {

    @Override
    protected void encode(ChannelHandlerContext ctx, RespFrame msg, ByteBuf out) {
        // 编码逻辑在各帧类型内部，递归处理嵌套数组
        msg.encode(out);
    }
}
