package org.muma.mini.kv.command.impl.string;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RespArray;
import org.muma.mini.kv.protocol.RespFrame;
import org.muma.mini.kv.store.StorageEngine;

import static org.muma.mini.kv.command.CommandArgs.stringArg;
import static org.muma.mini.kv.command.CommandArgs.validateCommand;

public record GetCommand(String key) implements RedisCommand {

    public static GetCommand parse(RespArray request) {
        validateCommand(request, "get", 1);
        return new GetCommand(stringArg(request, 1));
    }

    @Override
    public RespFrame execute(StorageEngine storage) {
        RespFrame value = storage.get(key);
        return value == null ? BulkString.NULL : value; // Nil
    }
}
