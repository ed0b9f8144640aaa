package org.muma.redis.cli.client;

/**
 * 还在等待数据时对端正常关闭了连接
 * 与普通 IOException 区分开，调用方可以选择静默重连。
 */
public class ConnectionClosedException extends RedisClientException {

    public ConnectionClosedException(String message) {
        super(message);
    }
}
