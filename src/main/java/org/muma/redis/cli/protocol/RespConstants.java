package org.muma.redis.cli.protocol;

import java.nio.charset.StandardCharsets;

/**
 * RESP 协议常量
 */
public final class RespConstants {

    private RespConstants() {
    }

    // --- 类型标识字节 ---
    public static final byte SIMPLE_STRING = '+';
    public static final byte SIMPLE_ERROR = '-';
    public static final byte INTEGER = ':';
    public static final byte BULK_STRING = '$';
    public static final byte BULK_ERROR = '!';
    public static final byte BOOLEAN = '#';
    public static final byte NULL = '_';
    public static final byte ARRAY = '*';
    public static final byte MAP = '%';
    public static final byte SET = '~';

    public static final byte BOOLEAN_TRUE = 't';
    public static final byte BOOLEAN_FALSE = 'f';

    // 回车换行
    public static final byte CR = '\r';
    public static final byte LF = '\n';
    public static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    // RESP2 中 $-1 / *-1 表示空值
    public static final long NULL_LENGTH = -1;
}
