package org.muma.redis.cli.protocol;

import java.util.List;

/**
 * RESP3 集合 (~)
 * 保留服务端发送的顺序，不做去重。
 */
public record RedisSet(List<RedisMessage> elements) implements RedisMessage {

    public RedisSet {
        elements = List.copyOf(elements);
    }
}
