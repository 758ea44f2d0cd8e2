package org.muma.mini.kv.server;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import org.muma.mini.kv.command.CommandDispatcher;
import org.muma.mini.kv.protocol.RespArray;
import org.muma.mini.kv.protocol.RespFrame;
import org.muma.mini.kv.protocol.SimpleError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 每个连接一个实例，运行在该连接所属的 EventLoop 线程上。
 * 所有连接共享同一个 CommandDispatcher (以及其背后的存储引擎)。
 */
public class RedisCommandHandler extends SimpleChannelInboundHandler<RespFrame> {

    private static final Logger log = LoggerFactory.getLogger(RedisCommandHandler.class);

    // 记录连接的客户端数量
    private static final AtomicInteger connectedClients = new AtomicInteger();

    private final CommandDispatcher dispatcher;

    public RedisCommandHandler(CommandDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    public static int connectedClients() {
        return connectedClients.get();
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        int total = connectedClients.incrementAndGet();
        log.info("Client connected: {}, total clients: {}", ctx.channel().remoteAddress(), total);
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        int total = connectedClients.decrementAndGet();
        log.info("Client disconnected: {}, total clients: {}", ctx.channel().remoteAddress(), total);
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RespFrame msg) {
        if (msg instanceof RespArray) {
            ctx.writeAndFlush(dispatcher.dispatch(msg));
        } else {
            log.warn("Received non-array message: {}", msg);
            ctx.writeAndFlush(SimpleError.err("Protocol error: expected array"));
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException) {
            // 格式错误无法通过等待更多数据恢复：回复错误后关闭连接
            Throwable root = cause.getCause() != null ? cause.getCause() : cause;
            log.warn("Protocol error from {}: {}", ctx.channel().remoteAddress(), root.getMessage());
            ctx.writeAndFlush(SimpleError.err("Protocol error: " + root.getMessage()))
                    .addListener(ChannelFutureListener.CLOSE);
        } else {
            log.error("Unexpected error on channel {}", ctx.channel().remoteAddress(), cause);
            ctx.close();
        }
    }
}
