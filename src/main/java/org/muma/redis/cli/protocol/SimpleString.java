package org.muma.redis.cli.protocol;

// 简单字符串 (+)
public record SimpleString(String content) implements RedisMessage {
}
