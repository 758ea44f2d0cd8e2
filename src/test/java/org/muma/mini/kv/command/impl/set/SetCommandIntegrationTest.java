package org.muma.mini.kv.command.impl.set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.mini.kv.command.InvalidCommandException;
import org.muma.mini.kv.protocol.BulkString;
import org.muma.mini.kv.protocol.RespArray;
import org.muma.mini.kv.protocol.RespFrame;
import org.muma.mini.kv.protocol.RespInteger;
import org.muma.mini.kv.store.StorageEngine;
import org.muma.mini.kv.store.impl.MemoryStorageEngine;

import static org.junit.jupiter.api.Assertions.*;

class SetCommandIntegrationTest {

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

    private RespFrame sadd(String... args) {
        return SAddCommand.parse(args(args)).execute(storage);
    }

    private RespFrame sismember(String... args) {
        return SIsMemberCommand.parse(args(args)).execute(storage);
    }

    @Test
    void testSAddReportsEachMemberInOrder() {
        RespFrame result = sadd("SADD", "key", "m1", "m2", "m1");
        assertEquals(RespArray.of(RespInteger.ONE, RespInteger.ONE, RespInteger.ZERO), result);

        // 再次添加：全部已存在
        assertEquals(RespArray.of(RespInteger.ZERO), sadd("SADD", "key", "m2"));
    }

    @Test
    void testSAddArity() {
        assertThrows(InvalidCommandException.class, () -> SAddCommand.parse(args("SADD")));
        assertThrows(InvalidCommandException.class, () -> SAddCommand.parse(args("SADD", "key")));
        assertThrows(InvalidCommandException.class, () -> SAddCommand.parse(args("SREM", "key", "m")));
    }

    @Test
    void testSIsMember() {
        sadd("SADD", "myset", "a", "b");

        assertEquals(RespInteger.ONE, sismember("SISMEMBER", "myset", "a"));
        assertEquals(RespInteger.ZERO, sismember("SISMEMBER", "myset", "z"));
        assertEquals(RespInteger.ZERO, sismember("SISMEMBER", "nokey", "a"));
    }

    @Test
    void testSIsMemberArity() {
        InvalidCommandException e = assertThrows(InvalidCommandException.class,
                () -> SIsMemberCommand.parse(args("SISMEMBER", "myset")));
        assertEquals("sismember command needs 2 argument(s), got 1", e.getMessage());

        assertThrows(InvalidCommandException.class,
                () -> SIsMemberCommand.parse(args("SISMEMBER", "myset", "a", "b")));
    }

    @Test
    void testSMembersSorted() {
        sadd("SADD", "s", "c", "a", "b", "a");

        RespFrame result = SMembersCommand.parse(args("SMEMBERS", "s")).execute(storage);
        assertEquals(RespArray.of(new BulkString("a"), new BulkString("b"), new BulkString("c")), result);

        assertEquals(RespArray.EMPTY, SMembersCommand.parse(args("SMEMBERS", "missing")).execute(storage));
    }
}
