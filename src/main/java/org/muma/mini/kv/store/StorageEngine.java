package org.muma.mini.kv.store;

import org.muma.mini.kv.protocol.RespFrame;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 共享的内存存储引擎。
 * 字符串、Hash、Set 三类数据各自独立存放，互不争用；
 * 同一个 key 上的操作互斥串行，不同 key 之间可以并行。
 * 所有操作对合法输入都不会失败，"不存在" 统一用 null 表示。
 */
public interface StorageEngine {

    // --- String ---

    RespFrame get(String key);

    void set(String key, RespFrame value);

    // --- Hash ---

    RespFrame hget(String key, String field);

    /**
     * key 对应的 Hash 不存在时先创建，再写入 (或覆盖) field
     */
    void hset(String key, String field, RespFrame value);

    /**
     * 某一时刻的快照，之后的修改不会反映到返回值中；key 不存在时返回 null
     */
    Map<String, RespFrame> hgetall(String key);

    /**
     * 按请求顺序返回每个 field 的值，缺失的 field 对应位置为 null；
     * 所有值取自同一时刻
     */
    List<RespFrame> hmget(String key, List<String> fields);

    // --- Set ---

    /**
     * @return true 表示新加入，false 表示已经是成员
     */
    boolean sadd(String key, String member);

    boolean sismember(String key, String member);

    /**
     * 成员快照；key 不存在时返回 null
     */
    Set<String> smembers(String key);
}
