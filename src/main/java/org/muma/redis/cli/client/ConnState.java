package org.muma.redis.cli.client;

public enum ConnState {
    UNCONNECTED,    // 尚未完成握手
    CONNECTED,      // 握手成功，可以收发命令
    CLOSED          // 终态：主动关闭或出现致命错误
}
