package org.muma.redis.cli.protocol;

// RESP3 批量错误 (!)
public record BulkError(String content) implements RedisMessage {

    @Override
    public boolean isError() {
        return true;
    }
}
