package org.muma.mini.kv.command.impl.set;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RespArray;
import org.muma.mini.kv.protocol.RespFrame;
import org.muma.mini.kv.store.StorageEngine;

import java.util.List;
import java.util.Set;

import static org.muma.mini.kv.command.CommandArgs.stringArg;
import static org.muma.mini.kv.command.CommandArgs.validateCommand;

// SMEMBERS key，结果按字典序排列，key 不存在时返回空数组
public record SMembersCommand(String key) implements RedisCommand {

    public static SMembersCommand parse(RespArray request) {
        validateCommand(request, "smembers", 1);
        return new SMembersCommand(stringArg(request, 1));
    }

    @Override
    public RespFrame execute(StorageEngine storage) {
        Set<String> members = storage.smembers(key);
        if (members == null) {
            return RespArray.EMPTY;
        }
        List<RespFrame> result = members.stream()
                .sorted()
                .<RespFrame>map(BulkString::new)
                .toList();
        return new RespArray(result);
    }
}
