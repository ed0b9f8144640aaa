package org.muma.redis.cli.client;

import java.io.IOException;

/**
 * 客户端层面的致命错误基类
 * 出现任何子类异常后连接都不可再用，调用方需要重新建立连接。
 */
public class RedisClientException extends IOException {

    public RedisClientException(String message) {
        super(message);
    }

    public RedisClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
