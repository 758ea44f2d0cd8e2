package org.muma.mini.kv.command.impl.connection;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RespArray;
import org.muma.mini.kv.protocol.RespFrame;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.store.StorageEngine;

import static org.muma.mini.kv.command.CommandArgs.bulkArg;
import static org.muma.mini.kv.command.CommandArgs.validateArgRange;

// PING [message]，message 为 null 时回复 PONG
public record PingCommand(RespFrame message) implements RedisCommand {

    private static final SimpleString PONG = new SimpleString("PONG");

    public static PingCommand parse(RespArray request) {
        validateArgRange(request, "ping", 0, 1);
        return new PingCommand(request.size() == 2 ? bulkArg(request, 1) : null);
    }

    @Override
    public RespFrame execute(StorageEngine storage) {
        return message == null ? PONG : message;
    }
}
