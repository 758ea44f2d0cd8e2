package org.muma.mini.kv.store.impl;

import org.muma.mini.kv.protocol.RespFrame;
import org.muma.mini.kv.store.StorageEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于 ConcurrentHashMap 的存储实现。
 * <p>
 * 外层 Map 的桶级锁保证不同 key 并行；内层 Hash/Set 对象本身作为该 key 的锁，
 * 写入和快照在锁内完成，单字段读取 (hget / sismember) 直接走并发容器不加锁。
 */
public class MemoryStorageEngine implements StorageEngine {

    private static final Logger log = LoggerFactory.getLogger(MemoryStorageEngine.class);

    // 1. 字符串 (key -> value)
    private final Map<String, RespFrame> strings = new ConcurrentHashMap<>();

    // 2. Hash (key -> field -> value)
    private final Map<String, Map<String, RespFrame>> hashes = new ConcurrentHashMap<>();

    // 3. Set (key -> members)
    private final Map<String, Set<String>> sets = new ConcurrentHashMap<>();

    @Override
    public RespFrame get(String key) {
        return strings.get(key);
    }

    @Override
    public void set(String key, RespFrame value) {
        strings.put(key, value);
    }

    @Override
    public RespFrame hget(String key, String field) {
        Map<String, RespFrame> hash = hashes.get(key);
        return hash == null ? null : hash.get(field);
    }

    @Override
    public void hset(String key, String field, RespFrame value) {
        Map<String, RespFrame> hash = hashes.computeIfAbsent(key, k -> {
            log.debug("Create hash for key: {}", k);
            return new ConcurrentHashMap<>();
        });
        synchronized (hash) {
            hash.put(field, value);
        }
    }

    @Override
    public Map<String, RespFrame> hgetall(String key) {
        Map<String, RespFrame> hash = hashes.get(key);
        if (hash == null) return null;
        synchronized (hash) {
            return new HashMap<>(hash);
        }
    }

    @Override
    public List<RespFrame> hmget(String key, List<String> fields) {
        List<RespFrame> values = new ArrayList<>(fields.size());
        Map<String, RespFrame> hash = hashes.get(key);
        if (hash == null) {
            fields.forEach(f -> values.add(null));
            return values;
        }
        synchronized (hash) {
            for (String field : fields) {
                values.add(hash.get(field));
            }
        }
        return values;
    }

    @Override
    public boolean sadd(String key, String member) {
        Set<String> set = sets.computeIfAbsent(key, k -> {
            log.debug("Create set for key: {}", k);
            return ConcurrentHashMap.newKeySet();
        });
        synchronized (set) {
            return set.add(member);
        }
    }

    @Override
    public boolean sismember(String key, String member) {
        Set<String> set = sets.get(key);
        return set != null && set.contains(member);
    }

    @Override
    public Set<String> smembers(String key) {
        Set<String> set = sets.get(key);
        if (set == null) return null;
        synchronized (set) {
            return new HashSet<>(set);
        }
    }
}
