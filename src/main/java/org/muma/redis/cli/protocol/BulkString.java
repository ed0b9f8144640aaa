package org.muma.redis.cli.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 批量字符串 ($)，二进制安全
 * RESP2 的 $-1 不用它表示，而是解码成 {@link RedisNull}。
 */
public record BulkString(byte[] content) implements RedisMessage {

    public BulkString {
        if (content == null) {
            throw new IllegalArgumentException("bulk string content must not be null");
        }
    }

    public BulkString(String s) {
        this(s.getBytes(StandardCharsets.UTF_8));
    }

    public String asString() {
        return new String(content, StandardCharsets.UTF_8);
    }

    // record 默认按数组引用比较，这里改成按内容
    @Override
    public boolean equals(Object o) {
        return o instanceof BulkString other && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "BulkString[" + asString() + "]";
    }
}
