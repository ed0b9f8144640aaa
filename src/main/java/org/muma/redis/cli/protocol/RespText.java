package org.muma.redis.cli.protocol;

/**
 * 从字符串类 / 错误类值里取出文本
 */
public final class RespText {

    private RespText() {
    }

    // 非字符串类型返回 null
    public static String of(RedisMessage msg) {
        if (msg instanceof BulkString b) return b.asString();
        if (msg instanceof SimpleString s) return s.content();
        return null;
    }

    /**
     * 错误类值的文本，非错误类型返回 null
     */
    public static String errorText(RedisMessage msg) {
        if (msg instanceof ErrorMessage e) return e.content();
        if (msg instanceof BulkError e) return e.content();
        return null;
    }
}
