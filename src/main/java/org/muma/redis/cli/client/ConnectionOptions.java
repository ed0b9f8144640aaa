package org.muma.redis.cli.client;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 连接调优参数，与协议逻辑无关
 */
@Data
@NoArgsConstructor
public class ConnectionOptions {

    // 默认 4MB，单个 RESP 帧的编码大小不能超过它
    public static final int DEFAULT_BUFFER_SIZE = 4 * 1024 * 1024;

    private int bufferSize = DEFAULT_BUFFER_SIZE;
    private int connectTimeoutMs = 3000;
    // 0 表示读操作无限等待
    private int soTimeoutMs = 0;
    private boolean tcpNoDelay = true;
    private boolean keepAlive = true;
}
