package org.muma.redis.cli.client;

/**
 * 服务端字节流违反 RESP 语法 (类型字节非法、长度不是数字等)
 */
public class ProtocolException extends RedisClientException {

    public ProtocolException(String message) {
        super(message);
    }
}
