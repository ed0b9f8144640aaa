package org.muma.redis.cli.protocol;

import java.util.List;

// 数组 (*)
public record RedisArray(List<RedisMessage> elements) implements RedisMessage {

    public RedisArray {
        elements = List.copyOf(elements);
    }

    public static RedisArray of(RedisMessage... elements) {
        return new RedisArray(List.of(elements));
    }

    public int size() {
        return elements.size();
    }
}
