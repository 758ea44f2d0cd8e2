package org.muma.mini.kv.command.impl.hash;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.mini.kv.command.InvalidArgumentException;
import org.muma.mini.kv.command.InvalidCommandException;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RespArray;
import org.muma.mini.kv.protocol.RespFrame;
import org.muma.mini.kv.protocol.RespInteger;
import org.muma.mini.kv.protocol.SimpleString;
import org.muma.mini.kv.store.StorageEngine;
import org.muma.mini.kv.store.impl.MemoryStorageEngine;

import static org.junit.jupiter.api.Assertions.*;

class HashIntegrationTest {

    private StorageEngine storage;

    @BeforeEach
    void setUp() {
        storage = new MemoryStorageEngine();
    }

    // --- 辅助方法：构建参数 ---
    private RespArray args(String... args) {
        RespFrame[] frames = new RespFrame[args.length];
        for (int i = 0; i < args.length; i++) {
            frames[i] = new BulkString(args[i]);
        }
        return RespArray.of(frames);
    }

    private RespFrame hset(String... args) {
        return HSetCommand.parse(args(args)).execute(storage);
    }

    private RespFrame hget(String... args) {
        return HGetCommand.parse(args(args)).execute(storage);
    }

    @Test
    void testHSetAndHGet() {
        // 1. 新增字段
        assertEquals(SimpleString.OK, hset("HSET", "user:1", "name", "root"));

        // 2. 更新字段
        assertEquals(SimpleString.OK, hset("HSET", "user:1", "name", "admin"));

        // 3. 获取字段
        assertEquals(new BulkString("admin"), hget("HGET", "user:1", "name"));

        // 4. 获取不存在的字段 / key
        assertEquals(BulkString.NULL, hget("HGET", "user:1", "age"));
        assertEquals(BulkString.NULL, hget("HGET", "user:2", "name"));
    }

    @Test
    void testHSetKeepsBinaryValue() {
        byte[] value = {(byte) 0xff, 0, 1};
        RespArray request = RespArray.of(new BulkString("HSET"), new BulkString("bin"),
                new BulkString("f"), new BulkString(value));
        HSetCommand.parse(request).execute(storage);

        assertEquals(new BulkString(value), hget("HGET", "bin", "f"));
    }

    @Test
    void testHGetAll() {
        hset("HSET", "u1", "k2", "v2");
        hset("HSET", "u1", "k1", "v1");

        RespFrame result = HGetAllCommand.parse(args("HGETALL", "u1")).execute(storage);
        assertEquals(RespArray.of(
                new BulkString("k1"), new BulkString("v1"),
                new BulkString("k2"), new BulkString("v2")), result);

        assertEquals(RespArray.EMPTY, HGetAllCommand.parse(args("HGETALL", "none")).execute(storage));
    }

    @Test
    void testHMGet() {
        hset("HSET", "u1", "a", "1");

        RespFrame result = HMGetCommand.parse(args("HMGET", "u1", "a", "b")).execute(storage);
        assertEquals(RespArray.of(new BulkString("1"), BulkString.NULL), result);
    }

    @Test
    void testArity() {
        assertThrows(InvalidCommandException.class, () -> HSetCommand.parse(args("HSET", "k", "f")));
        assertThrows(InvalidCommandException.class, () -> HSetCommand.parse(args("HSET", "k", "f", "v", "f2", "v2")));
        assertThrows(InvalidCommandException.class, () -> HGetCommand.parse(args("HGET", "k")));
        assertThrows(InvalidCommandException.class, () -> HGetAllCommand.parse(args("HGETALL")));
        assertThrows(InvalidCommandException.class, () -> HMGetCommand.parse(args("HMGET", "k")));
    }

    @Test
    void testValueMustBeBulkString() {
        RespArray request = RespArray.of(new BulkString("HSET"), new BulkString("k"),
                new BulkString("f"), RespInteger.ONE);
        assertThrows(InvalidArgumentException.class, () -> HSetCommand.parse(request));
        assertNull(storage.hgetall("k"));
    }
}
