package org.muma.mini.kv;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import org.muma.mini.kv.config.MiniKvConfig;
import org.muma.mini.kv.server.RedisServerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class MiniKvServer {

    private static final Logger log = LoggerFactory.getLogger(MiniKvServer.class);

    private final RedisServerContext context;

    public MiniKvServer(RedisServerContext context) {
        this.context = context;
    }

    public void start() throws InterruptedException {
        MiniKvConfig config = context.getConfig();
        EventLoopGroup bossGroup = new NioEventLoopGroup(1);
        EventLoopGroup workerGroup = new NioEventLoopGroup(config.getWorkerThreads());

        try {
            var bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    // 在 Boss 线程增加 Netty 自带的日志 Handler，可以看到 TCP 连接握手细节
                    .handler(new LoggingHandler(LogLevel.INFO))
                    // 开启 TCP_NODELAY (禁用 Nagle 算法)，降低延迟
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            context.initPipeline(ch.pipeline());
                        }
                    });

            log.info("Starting Mini-KV server on {}:{}", config.getBind(), config.getPort());
            ChannelFuture future = bootstrap.bind(config.getBind(), config.getPort()).sync();

            log.info("Mini-KV started successfully.");
            future.channel().closeFuture().sync();
        } finally {
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
        }
    }

    public static void main(String[] args) throws InterruptedException {
        // 初始化配置并解析参数
        MiniKvConfig config = MiniKvConfig.getInstance();
        config.load(args);
        new MiniKvServer(new RedisServerContext(config)).start();
    }
}
