package org.muma.redis.cli.protocol;

// 整数 (:)
public record RedisInteger(long value) implements RedisMessage {
}
