package org.muma.mini.kv.command.impl.hash;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RespArray;
import org.muma.mini.kv.protocol.RespFrame;
import org.muma.mini.kv.store.StorageEngine;

import static org.muma.mini.kv.command.CommandArgs.stringArg;
import static org.muma.mini.kv.command.CommandArgs.validateCommand;

// HGET key field，key 或 field 不存在时返回 Nil
public record HGetCommand(String key, String field) implements RedisCommand {

    public static HGetCommand parse(RespArray request) {
        validateCommand(request, "hget", 2);
        return new HGetCommand(stringArg(request, 1), stringArg(request, 2));
    }

    @Override
    public RespFrame execute(StorageEngine storage) {
        RespFrame value = storage.hget(key, field);
        return value == null ? BulkString.NULL : value;
    }
}
