package org.muma.redis.cli.client;

import lombok.Getter;

/**
 * 服务端拒绝了 HELLO 握手 (例如认证失败、不支持的协议版本)
 */
@Getter
public class HandshakeRejectedException extends RedisClientException {

    private final String serverError;

    public HandshakeRejectedException(String serverError) {
        super("Handshake rejected by server: " + serverError);
        this.serverError = serverError;
    }
}
