package org.muma.mini.kv.command.impl.hash;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RespArray;
import org.muma.mini.kv.protocol.RespFrame;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.store.StorageEngine;

import static org.muma.mini.kv.command.CommandArgs.bulkArg;
import static org.muma.mini.kv.command.CommandArgs.stringArg;
import static org.muma.mini.kv.command.CommandArgs.validateCommand;

// HSET key field value
public record HSetCommand(String key, String field, RespFrame value) implements RedisCommand {

    public static HSetCommand parse(RespArray request) {
        validateCommand(request, "hset", 3);
        return new HSetCommand(stringArg(request, 1), stringArg(request, 2), bulkArg(request, 3));
    }

    @Override
    public RespFrame execute(StorageEngine storage) {
        storage.hset(key, field, value);
        return SimpleString.OK;
    }
}
