package org.muma.mini.kv.command;

import org.muma.mini.kv.protocol.RespFrame;
import org.muma.mini.kv.store.StorageEngine;

/**
 * 已经通过校验的命令。
 * 每个请求解析出一个实例，执行一次后丢弃；副作用只作用于存储引擎。
 */
public interface RedisCommand {

    RespFrame execute(StorageEngine storage);
}
