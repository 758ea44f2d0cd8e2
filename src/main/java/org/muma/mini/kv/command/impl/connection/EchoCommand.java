package org.muma.mini.kv.command.impl.connection;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RespArray;
import org.muma.mini.kv.protocol.RespFrame;
import org.muma.mini.kv.store.StorageEngine;

import static org.muma.mini.kv.command.CommandArgs.bulkArg;
import static org.muma.mini.kv.command.CommandArgs.validateCommand;

public record EchoCommand(RespFrame message) implements RedisCommand {

    public static EchoCommand parse(RespArray request) {
        validateCommand(request, "echo", 1);
        return new EchoCommand(bulkArg(request, 1));
    }

    @Override
    public RespFrame execute(StorageEngine storage) {
        return message;
    }
}
