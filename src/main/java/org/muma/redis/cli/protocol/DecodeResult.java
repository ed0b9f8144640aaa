package org.muma.redis.cli.protocol;

/**
 * 一次解码尝试的结果
 * <ul>
 *     <li>{@link Complete}: 得到一个完整的值</li>
 *     <li>{@link Incomplete}: 字节还不够，读游标已回到尝试之前，读到更多数据后重试即可</li>
 *     <li>{@link Malformed}: 字节违反协议语法，连接不可再用</li>
 * </ul>
 */
public sealed interface DecodeResult {

    Incomplete INCOMPLETE = new Incomplete();

    static DecodeResult complete(RedisMessage value) {
        return new Complete(value);
    }

    static DecodeResult incomplete() {
        return INCOMPLETE;
    }

    static DecodeResult malformed(String reason) {
        return new Malformed(reason);
    }

    record Complete(RedisMessage value) implements DecodeResult {
    }

    record Incomplete() implements DecodeResult {
    }

    record Malformed(String reason) implements DecodeResult {
    }
}
