package org.muma.mini.kv.command.impl.set;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RespArray;
import org.muma.mini.kv.protocol.RespFrame;
import org.muma.mini.kv.protocol.RespInteger;
import org.muma.mini.kv.store.StorageEngine;

import static org.muma.mini.kv.command.CommandArgs.stringArg;
import static org.muma.mini.kv.command.CommandArgs.validateCommand;

/**
 * SISMEMBER key member
 * Time Complexity: O(1)
 */
public record SIsMemberCommand(String key, String member) implements RedisCommand {

    public static SIsMemberCommand parse(RespArray request) {
        validateCommand(request, "sismember", 2);
        return new SIsMemberCommand(stringArg(request, 1), stringArg(request, 2));
    }

    @Override
    public RespFrame execute(StorageEngine storage) {
        return RespInteger.of(storage.sismember(key, member));
    }
}
