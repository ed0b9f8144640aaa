package org.muma.redis.cli.protocol;

import java.util.List;
import java.util.Optional;

/**
 * RESP3 映射 (%)
 * 按插入顺序保存键值对，key 不要求可哈希，也不检查重复。
 */
public record RedisMap(List<Entry> entries) implements RedisMessage {

    public RedisMap {
        entries = List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    /**
     * 按字符串 key 顺序查找第一个匹配项 (SimpleString / BulkString 均可)
     */
    public Optional<RedisMessage> get(String key) {
        for (Entry entry : entries) {
            if (key.equals(RespText.of(entry.key()))) {
                return Optional.of(entry.value());
            }
        }
        return Optional.empty();
    }

    public record Entry(RedisMessage key, RedisMessage value) {
    }
}
