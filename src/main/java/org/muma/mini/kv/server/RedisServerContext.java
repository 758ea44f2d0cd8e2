package org.muma.mini.kv.server;

import io.netty.channel.ChannelPipeline;
import lombok.Getter;
import org.muma.mini.kv.command.CommandDispatcher;
import org.muma.mini.kv.config.MiniKvConfig;
import org.muma.mini.kv.protocol.RespDecoder;
import org.muma.mini.kv.protocol.RespEncoder;
import org.muma.mini.kv.store.StorageEngine;
import org.muma.mini.kv.store.impl.MemoryStorageEngine;

/**
 * 服务器上下文
 * 负责组装各个模块：进程内只有一个存储引擎和一个分发器，被所有连接共享引用。
 */
@Getter
public class RedisServerContext {

    private final MiniKvConfig config;
    private final StorageEngine storage;
    private final CommandDispatcher dispatcher;

    public RedisServerContext(MiniKvConfig config) {
        this(config, new MemoryStorageEngine());
    }

    public RedisServerContext(MiniKvConfig config, StorageEngine storage) {
        this.config = config;
        this.storage = storage;
        this.dispatcher = new CommandDispatcher(storage);
    }

    /**
     * 为新连接装配 pipeline：解码 -> 编码 -> 命令处理
     */
    public void initPipeline(ChannelPipeline pipeline) {
        pipeline.addLast(new RespDecoder())
                .addLast(new RespEncoder())
                .addLast(new RedisCommandHandler(dispatcher));
    }
}
