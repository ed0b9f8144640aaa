package org.muma.redis.cli.protocol;

// 简单错误 (-)
public record ErrorMessage(String content) implements RedisMessage {

    @Override
    public boolean isError() {
        return true;
    }
}
