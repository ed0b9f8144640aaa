package org.muma.redis.cli.protocol;

import io.netty.buffer.ByteBuf;
import org.muma.redis.cli.buffer.StreamBuffer;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.muma.redis.cli.protocol.RespConstants.*;

/**
 * RESP2/RESP3 流式解码器
 * <p>
 * 每次调用都针对缓冲区里"已经到达"的字节做一次乐观解析：
 * 只要任何一处字节不够，整帧 (包括已经解析出的聚合子元素) 全部作废，
 * 读游标退回到类型字节之前，返回 Incomplete。下次调用从头重新解析整帧。
 * <p>
 * 聚合类型不走递归，而是用显式的栈记录"未填满的聚合 + 剩余个数"，
 * 嵌套深度只受缓冲区大小限制，不会撑爆调用栈。
 */
public final class RespDecoder {

    // 防止恶意的超大 count 让 ArrayList 预分配过多内存
    private static final int MAX_PREALLOCATE = 1024;

    private RespDecoder() {
    }

    public static DecodeResult decode(StreamBuffer buffer) {
        int start = buffer.readPosition();
        DecodeResult result = decodeFrame(buffer);
        if (result instanceof DecodeResult.Incomplete) {
            buffer.rewind(start);
        }
        return result;
    }

    private static DecodeResult decodeFrame(StreamBuffer buffer) {
        Deque<PendingAggregate> stack = new ArrayDeque<>();

        while (true) {
            DecodeResult step = readValue(buffer, stack);
            if (step == null) {
                // 读到的是一个非空聚合的头部，已压栈，继续读它的第一个子元素
                continue;
            }
            if (!(step instanceof DecodeResult.Complete complete)) {
                return step;
            }

            // 向上归并：子元素填进栈顶聚合，聚合满了再作为一个值交给上一层
            RedisMessage value = complete.value();
            while (true) {
                PendingAggregate top = stack.peek();
                if (top == null) {
                    return DecodeResult.complete(value);
                }
                top.add(value);
                if (!top.isFull()) {
                    break;
                }
                stack.pop();
                value = top.build();
            }
        }
    }

    /**
     * 读取一个值
     *
     * @return 标量或空聚合时返回 Complete；非空聚合压栈后返回 null；否则 Incomplete / Malformed
     */
    private static DecodeResult readValue(StreamBuffer buffer, Deque<PendingAggregate> stack) {
        if (!buffer.hasRemaining()) {
            return DecodeResult.incomplete();
        }

        byte type = buffer.takeByte();
        return switch (type) {
            case SIMPLE_STRING -> readSimpleString(buffer);
            case SIMPLE_ERROR -> readSimpleError(buffer);
            case INTEGER -> readInteger(buffer);
            case BULK_STRING -> readBulk(buffer, false);
            case BULK_ERROR -> readBulk(buffer, true);
            case BOOLEAN -> readBoolean(buffer);
            case NULL -> readNull(buffer);
            case ARRAY, MAP, SET -> readAggregateHeader(buffer, type, stack);
            default -> DecodeResult.malformed("Unknown RESP type byte: 0x" + Integer.toHexString(type & 0xFF));
        };
    }

    // +<string>\r\n
    private static DecodeResult readSimpleString(StreamBuffer buffer) {
        ByteBuf line = buffer.takeUntil(CRLF);
        if (line == null) {
            return DecodeResult.incomplete();
        }
        return DecodeResult.complete(new SimpleString(line.toString(StandardCharsets.UTF_8)));
    }

    // -<error>\r\n
    private static DecodeResult readSimpleError(StreamBuffer buffer) {
        ByteBuf line = buffer.takeUntil(CRLF);
        if (line == null) {
            return DecodeResult.incomplete();
        }
        return DecodeResult.complete(new ErrorMessage(line.toString(StandardCharsets.UTF_8)));
    }

    // :<number>\r\n
    private static DecodeResult readInteger(StreamBuffer buffer) {
        ByteBuf line = buffer.takeUntil(CRLF);
        if (line == null) {
            return DecodeResult.incomplete();
        }
        String digits = line.toString(StandardCharsets.US_ASCII);
        try {
            return DecodeResult.complete(new RedisInteger(Long.parseLong(digits)));
        } catch (NumberFormatException e) {
            return DecodeResult.malformed("Invalid integer: '" + digits + "'");
        }
    }

    // $<length>\r\n<data>\r\n 或 !<length>\r\n<error>\r\n
    private static DecodeResult readBulk(StreamBuffer buffer, boolean error) {
        ByteBuf line = buffer.takeUntil(CRLF);
        if (line == null) {
            return DecodeResult.incomplete();
        }
        String digits = line.toString(StandardCharsets.US_ASCII);
        long length;
        try {
            length = parseLength(digits);
        } catch (NumberFormatException e) {
            return DecodeResult.malformed("Invalid bulk length: '" + digits + "'");
        }

        if (length == NULL_LENGTH && !error) {
            return DecodeResult.complete(RedisNull.INSTANCE);
        }
        if (length < 0 || length > Integer.MAX_VALUE - CRLF.length) {
            return DecodeResult.malformed("Bulk length out of range: " + length);
        }

        int len = (int) length;
        if (!buffer.hasRemainingAtLeast(len + CRLF.length)) {
            return DecodeResult.incomplete();
        }

        byte[] content = new byte[len];
        buffer.takeSlice(len).readBytes(content);
        if (!takeTerminator(buffer)) {
            return DecodeResult.malformed("Bulk payload not terminated by CRLF");
        }

        return DecodeResult.complete(error
                ? new BulkError(new String(content, StandardCharsets.UTF_8))
                : new BulkString(content));
    }

    // #t\r\n 或 #f\r\n
    private static DecodeResult readBoolean(StreamBuffer buffer) {
        if (!buffer.hasRemainingAtLeast(1 + CRLF.length)) {
            return DecodeResult.incomplete();
        }
        byte flag = buffer.takeByte();
        if (!takeTerminator(buffer)) {
            return DecodeResult.malformed("Boolean not terminated by CRLF");
        }
        return switch (flag) {
            case BOOLEAN_TRUE -> DecodeResult.complete(new RedisBoolean(true));
            case BOOLEAN_FALSE -> DecodeResult.complete(new RedisBoolean(false));
            default -> DecodeResult.malformed("Invalid boolean flag: '" + (char) flag + "'");
        };
    }

    // _\r\n
    private static DecodeResult readNull(StreamBuffer buffer) {
        if (!buffer.hasRemainingAtLeast(CRLF.length)) {
            return DecodeResult.incomplete();
        }
        if (!takeTerminator(buffer)) {
            return DecodeResult.malformed("Null not terminated by CRLF");
        }
        return DecodeResult.complete(RedisNull.INSTANCE);
    }

    // *<count>\r\n / %<count>\r\n / ~<count>\r\n
    private static DecodeResult readAggregateHeader(StreamBuffer buffer, byte type, Deque<PendingAggregate> stack) {
        ByteBuf line = buffer.takeUntil(CRLF);
        if (line == null) {
            return DecodeResult.incomplete();
        }
        String digits = line.toString(StandardCharsets.US_ASCII);
        long count;
        try {
            count = parseLength(digits);
        } catch (NumberFormatException e) {
            return DecodeResult.malformed("Invalid element count: '" + digits + "'");
        }

        // RESP2 的 Null Array
        if (count == NULL_LENGTH && type == ARRAY) {
            return DecodeResult.complete(RedisNull.INSTANCE);
        }
        // Map 的子元素个数是 count 的两倍，先限制 count 再翻倍，避免 long 溢出
        long limit = type == MAP ? Integer.MAX_VALUE / 2 : Integer.MAX_VALUE;
        if (count < 0 || count > limit) {
            return DecodeResult.malformed("Element count out of range: " + count);
        }
        int children = type == MAP ? (int) count * 2 : (int) count;

        PendingAggregate aggregate = new PendingAggregate(type, children);
        if (aggregate.isFull()) {
            return DecodeResult.complete(aggregate.build());
        }
        stack.push(aggregate);
        return null;
    }

    /**
     * 长度和个数只能是十进制数字，可带负号 (用于 -1)；Long.parseLong 接受的前导 '+' 在这里不合法
     */
    private static long parseLength(String digits) {
        if (digits.startsWith("+")) {
            throw new NumberFormatException("Leading '+' in length: " + digits);
        }
        return Long.parseLong(digits);
    }

    private static boolean takeTerminator(StreamBuffer buffer) {
        byte cr = buffer.takeByte();
        byte lf = buffer.takeByte();
        return cr == CR && lf == LF;
    }

    /**
     * 解析中的聚合：类型 + 期望的子元素个数 + 已解析的子元素
     */
    private static final class PendingAggregate {
        private final byte type;
        private final int expected;
        private final List<RedisMessage> items;

        PendingAggregate(byte type, int expected) {
            this.type = type;
            this.expected = expected;
            this.items = new ArrayList<>(Math.min(expected, MAX_PREALLOCATE));
        }

        void add(RedisMessage value) {
            items.add(value);
        }

        boolean isFull() {
            return items.size() == expected;
        }

        RedisMessage build() {
            return switch (type) {
                case ARRAY -> new RedisArray(items);
                case SET -> new RedisSet(items);
                case MAP -> {
                    List<RedisMap.Entry> entries = new ArrayList<>(items.size() / 2);
                    for (int i = 0; i < items.size(); i += 2) {
                        entries.add(new RedisMap.Entry(items.get(i), items.get(i + 1)));
                    }
                    yield new RedisMap(entries);
                }
                default -> throw new IllegalStateException("Not an aggregate type: " + (char) type);
            };
        }
    }
}
