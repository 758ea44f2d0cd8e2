package org.muma.mini.kv.command.impl.string;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RespArray;
import org.muma.mini.kv.protocol.RespFrame;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.store.StorageEngine;

import static org.muma.mini.kv.command.CommandArgs.bulkArg;
import static org.muma.mini.kv.command.CommandArgs.stringArg;
import static org.muma.mini.kv.command.CommandArgs.validateCommand;

/**
 * SET key value
 * 值按原始 Bulk String 保存，允许二进制内容；后写覆盖先写
 */
public record SetCommand(String key, RespFrame value) implements RedisCommand {

    public static SetCommand parse(RespArray request) {
        validateCommand(request, "set", 2);
        return new SetCommand(stringArg(request, 1), bulkArg(request, 2));
    }

    @Override
    public RespFrame execute(StorageEngine storage) {
        storage.set(key, value);
        return SimpleString.OK;
    }
}
