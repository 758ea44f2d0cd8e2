package org.muma.mini.kv.command.impl.set;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.RespArray;
import org.muma.mini.kv.protocol.RespFrame;
import org.muma.mini.kv.protocol.RespInteger;
import org.muma.mini.kv.store.StorageEngine;

import java.util.List;

import static org.muma.mini.kv.command.CommandArgs.stringArg;
import static org.muma.mini.kv.command.CommandArgs.stringArgs;
import static org.muma.mini.kv.command.CommandArgs.validateMinArgs;

/**
 * SADD key member [member ...]
 * 按输入顺序逐个添加，每个成员对应一个 1 (新加入) 或 0 (已存在)
 */
public record SAddCommand(String key, List<String> members) implements RedisCommand {

    public SAddCommand {
        members = List.copyOf(members);
    }

    public static SAddCommand parse(RespArray request) {
        validateMinArgs(request, "sadd", 2);
        return new SAddCommand(stringArg(request, 1), stringArgs(request, 2));
    }

    @Override
    public RespFrame execute(StorageEngine storage) {
        RespFrame[] result = new RespFrame[members.size()];
        for (int i = 0; i < members.size(); i++) {
            result[i] = RespInteger.of(storage.sadd(key, members.get(i)));
        }
        return RespArray.of(result);
    }
}
