package org.muma.redis.cli.protocol;

import org.muma.redis.cli.buffer.StreamBuffer;

import java.nio.charset.StandardCharsets;

import static org.muma.redis.cli.protocol.RespConstants.*;

/**
 * RESP 请求编码
 * 客户端只会发出两种形状：BulkString，以及由 BulkString 组成的 Array。
 */
public final class RespEncoder {

    private RespEncoder() {
    }

    public static void encode(RedisMessage msg, StreamBuffer out) {
        if (msg instanceof BulkString b) {
            // $<length>\r\n<data>\r\n
            out.putByte(BULK_STRING);
            out.putBytes(ascii(b.content().length));
            out.putBytes(CRLF);
            out.putBytes(b.content());
            out.putBytes(CRLF);
        } else if (msg instanceof RedisArray a) {
            // *<count>\r\n 后面依次是每个元素
            out.putByte(ARRAY);
            out.putBytes(ascii(a.size()));
            out.putBytes(CRLF);
            for (RedisMessage element : a.elements()) {
                encode(element, out);
            }
        } else {
            // 命令参数只可能是 BulkString，出现其他类型说明调用方逻辑有误
            throw new IllegalArgumentException("Unsupported type in outbound command: " + msg.getClass().getSimpleName());
        }
    }

    private static byte[] ascii(long n) {
        return Long.toString(n).getBytes(StandardCharsets.US_ASCII);
    }
}
