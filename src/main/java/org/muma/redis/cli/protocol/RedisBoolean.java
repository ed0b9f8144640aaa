package org.muma.redis.cli.protocol;

// RESP3 布尔 (#t / #f)
public record RedisBoolean(boolean value) implements RedisMessage {
}
