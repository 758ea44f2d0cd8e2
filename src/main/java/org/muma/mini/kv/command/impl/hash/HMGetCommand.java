package org.muma.mini.kv.command.impl.hash;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RespArray;
import org.muma.mini.kv.protocol.RespFrame;
import org.muma.mini.kv.store.StorageEngine;

import java.util.List;

import static org.muma.mini.kv.command.CommandArgs.stringArg;
import static org.muma.mini.kv.command.CommandArgs.stringArgs;
import static org.muma.mini.kv.command.CommandArgs.validateMinArgs;

/**
 * HMGET key field [field ...]
 * 不存在的 field 在对应位置返回 Nil
 */
public record HMGetCommand(String key, List<String> fields) implements RedisCommand {

    public HMGetCommand {
        fields = List.copyOf(fields);
    }

    public static HMGetCommand parse(RespArray request) {
        validateMinArgs(request, "hmget", 2);
        return new HMGetCommand(stringArg(request, 1), stringArgs(request, 2));
    }

    @Override
    public RespFrame execute(StorageEngine storage) {
        List<RespFrame> result = storage.hmget(key, fields).stream()
                .map(v -> v == null ? BulkString.NULL : v)
                .toList();
        return new RespArray(result);
    }
}
