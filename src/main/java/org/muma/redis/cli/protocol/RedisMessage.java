package org.muma.redis.cli.protocol;

/**
 * RESP2/RESP3 值模型 (密封接口，限制实现类)
 * 聚合类型 (Array / Map / Set) 可以任意嵌套。
 */
public sealed interface RedisMessage permits
        SimpleString, BulkString, RedisInteger, RedisBoolean, RedisNull,
        ErrorMessage, BulkError, RedisArray, RedisMap, RedisSet {

    /**
     * 服务端返回的是否是错误 (SimpleError 或 BulkError)
     */
    default boolean isError() {
        return false;
    }
}
