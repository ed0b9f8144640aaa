package org.muma.redis.cli.buffer;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * 固定容量的字节缓冲区 (读写双游标 + 回滚标记 + 原地压缩)
 * <p>
 * 底层存储是一块 Netty 堆内 ByteBuf，capacity == maxCapacity，永不扩容。
 * 不变式: 0 <= readPosition <= writePosition <= capacity，
 * 只有 [readPosition, writePosition) 区间内的字节是有效数据。
 * <p>
 * 本类对 RESP 协议一无所知，也不是线程安全的：一个连接独占一个缓冲区。
 */
public class StreamBuffer {

    private static final int NO_MARK = -1;

    private final ByteBuf buf;
    private final int capacity;

    // 回滚点，NO_MARK 表示没有标记
    private int mark = NO_MARK;

    public StreamBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.buf = Unpooled.buffer(capacity, capacity);
    }

    // =========================================================
    // I/O
    // =========================================================

    /**
     * 从输入源读取一次，写入空闲区 [writePosition, capacity)
     *
     * @return 实际读到的字节数，对端正常关闭时返回 0
     * @throws IllegalStateException 缓冲区已没有空闲空间 (单帧超过容量属于配置错误)
     */
    public int fillFrom(InputStream in) throws IOException {
        int writable = buf.writableBytes();
        if (writable == 0) {
            throw new IllegalStateException("No free space left in buffer of capacity " + capacity);
        }
        // InputStream 到达 EOF 时 Netty 返回 -1
        int count = buf.writeBytes(in, writable);
        return Math.max(count, 0);
    }

    /**
     * 把 [readPosition, writePosition) 全部写出，然后压缩
     */
    public void drainTo(OutputStream out) throws IOException {
        buf.readBytes(out, buf.readableBytes());
        out.flush();
        compact();
    }

    // =========================================================
    // 标记与回滚
    // =========================================================

    public void mark() {
        mark = buf.readerIndex();
    }

    /**
     * 有标记时回到标记位置并清除标记，否则什么都不做
     */
    public void reset() {
        if (mark != NO_MARK) {
            buf.readerIndex(mark);
            mark = NO_MARK;
        }
    }

    public boolean isMarked() {
        return mark != NO_MARK;
    }

    public int readPosition() {
        return buf.readerIndex();
    }

    public int writePosition() {
        return buf.writerIndex();
    }

    public int capacity() {
        return capacity;
    }

    /**
     * 把读游标退回到之前记下的位置 (只能后退，不能越过已写入的数据)
     */
    public void rewind(int position) {
        if (position < 0 || position > buf.readerIndex()) {
            throw new IndexOutOfBoundsException(
                    "rewind position " + position + " outside [0, " + buf.readerIndex() + "]");
        }
        buf.readerIndex(position);
    }

    // =========================================================
    // 读取
    // =========================================================

    /**
     * 调用方必须先确认 {@link #hasRemaining()}，否则抛 IndexOutOfBoundsException
     */
    public byte takeByte() {
        return buf.readByte();
    }

    /**
     * 返回从读游标开始 length 个字节的视图，并前移读游标。
     * 视图与缓冲区共享存储，下一次压缩后即失效，调用方需要立即拷贝。
     */
    public ByteBuf takeSlice(int length) {
        return buf.readSlice(length);
    }

    /**
     * 向前扫描直到完整匹配 delimiter。
     * <p>
     * 找到时返回分隔符之前的字节视图 (分隔符被消费但不包含在结果中)，并清除标记；
     * 数据耗尽仍未匹配完整时，读游标回到扫描开始的位置并返回 null，表示数据不完整。
     */
    public ByteBuf takeUntil(byte[] delimiter) {
        if (delimiter.length == 0) {
            throw new IllegalArgumentException("delimiter must not be empty");
        }
        mark();
        int start = buf.readerIndex();
        int matched = 0;

        while (hasRemaining()) {
            byte b = takeByte();
            if (b == delimiter[matched]) {
                matched++;
            } else {
                // 失配后当前字节可能是新一轮匹配的开头，例如 "\r\r\n"
                matched = b == delimiter[0] ? 1 : 0;
            }

            if (matched == delimiter.length) {
                mark = NO_MARK;
                int end = buf.readerIndex() - delimiter.length;
                return buf.slice(start, end - start);
            }
        }

        reset();
        return null;
    }

    public boolean hasRemaining() {
        return buf.isReadable();
    }

    public boolean hasRemainingAtLeast(int n) {
        return buf.isReadable(n);
    }

    public int remaining() {
        return buf.readableBytes();
    }

    /**
     * 丢弃所有未读数据
     */
    public void skipRemaining() {
        buf.skipBytes(buf.readableBytes());
    }

    // =========================================================
    // 写入 (编码用)
    // =========================================================

    public void putByte(int b) {
        buf.writeByte(b);
    }

    public void putBytes(byte[] bytes) {
        buf.writeBytes(bytes);
    }

    public int freeSpace() {
        return buf.writableBytes();
    }

    /**
     * 把未读数据整体搬到偏移 0
     * 读写游标相等时直接归零；否则做一次允许重叠的拷贝，字节内容保持不变。
     */
    public void compact() {
        int shift = buf.readerIndex();
        if (shift == 0) {
            return;
        }
        if (buf.readerIndex() == buf.writerIndex()) {
            buf.clear();
        } else {
            buf.discardReadBytes();
        }
        if (mark != NO_MARK) {
            mark = mark >= shift ? mark - shift : NO_MARK;
        }
    }

    @Override
    public String toString() {
        return "StreamBuffer{read=" + buf.readerIndex() + ", write=" + buf.writerIndex()
                + ", capacity=" + capacity + ", mark=" + mark + "}";
    }
}
