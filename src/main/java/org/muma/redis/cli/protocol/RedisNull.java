package org.muma.redis.cli.protocol;

/**
 * 空值: RESP3 的 _ 以及 RESP2 的 $-1 / *-1
 */
public record RedisNull() implements RedisMessage {

    public static final RedisNull INSTANCE = new RedisNull();
}
