package org.muma.mini.kv.command;

import org.muma.mini.kv.protocol.RespArray;

/**
 * 从请求数组构造命令，校验失败时抛出 {@link CommandException}
 */
@FunctionalInterface
public interface CommandParser {

    RedisCommand parse(RespArray request);
}
