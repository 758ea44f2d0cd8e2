package org.muma.mini.kv.command.impl.hash;

import org.muma.mini.kv.command.RedisCommand;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RespArray;
import org.muma.mini.kv.protocol.RespFrame;
import org.muma.mini.kv.store.StorageEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.muma.mini.kv.command.CommandArgs.stringArg;
import static org.muma.mini.kv.command.CommandArgs.validateCommand;

public record HGetAllCommand(String key) implements RedisCommand {

    public static HGetAllCommand parse(RespArray request) {
        validateCommand(request, "hgetall", 1);
        return new HGetAllCommand(stringArg(request, 1));
    }

    @Override
    public RespFrame execute(StorageEngine storage) {
        Map<String, RespFrame> all = storage.hgetall(key);
        if (all == null) {
            return RespArray.EMPTY; // 返回空数组
        }

        // 构造 RESP 数组: [field1, value1, field2, value2, ...]，按 field 排序保证输出稳定
        List<RespFrame> result = new ArrayList<>(all.size() * 2);
        for (Map.Entry<String, RespFrame> entry : new TreeMap<>(all).entrySet()) {
            result.add(new BulkString(entry.getKey()));
            result.add(entry.getValue());
        }
        return new RespArray(result);
    }
}
