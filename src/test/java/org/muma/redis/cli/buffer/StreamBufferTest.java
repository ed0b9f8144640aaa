package org.muma.redis.cli.buffer;

import io.netty.buffer.ByteBuf;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class StreamBufferTest {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    private StreamBuffer buffer;

    @BeforeEach
    void setUp() {
        buffer = new StreamBuffer(64);
    }

    // 辅助方法：往缓冲区里读一次
    private int feed(String s) throws IOException {
        return buffer.fillFrom(new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8)));
    }

    private static String str(ByteBuf slice) {
        return slice.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testFillAdvancesWritePosition() throws IOException {
        assertEquals(5, feed("hello"));
        assertEquals(0, buffer.readPosition());
        assertEquals(5, buffer.writePosition());
        assertEquals(5, buffer.remaining());
        assertTrue(buffer.hasRemainingAtLeast(5));
        assertFalse(buffer.hasRemainingAtLeast(6));
    }

    @Test
    void testFillReturnsZeroOnEof() throws IOException {
        assertEquals(0, buffer.fillFrom(new ByteArrayInputStream(new byte[0])));
        assertFalse(buffer.hasRemaining());
    }

    @Test
    void testFillOnFullBufferIsRejected() throws IOException {
        StreamBuffer small = new StreamBuffer(4);
        small.fillFrom(new ByteArrayInputStream("abcdef".getBytes(StandardCharsets.US_ASCII)));
        assertEquals(4, small.writePosition());
        assertThrows(IllegalStateException.class,
                () -> small.fillFrom(new ByteArrayInputStream("x".getBytes(StandardCharsets.US_ASCII))));
    }

    @Test
    void testTakeByteAndSlice() throws IOException {
        feed("+OK\r\n");
        assertEquals('+', buffer.takeByte());
        assertEquals("OK", str(buffer.takeSlice(2)));
        assertEquals(3, buffer.readPosition());
    }

    @Test
    void testTakeByteWithoutDataIsProgrammingError() {
        assertThrows(IndexOutOfBoundsException.class, () -> buffer.takeByte());
    }

    @Test
    void testTakeUntilFindsDelimiter() throws IOException {
        feed("hello\r\nworld");
        ByteBuf line = buffer.takeUntil(CRLF);
        assertNotNull(line);
        assertEquals("hello", str(line));
        // 分隔符被消费
        assertEquals(7, buffer.readPosition());
        assertFalse(buffer.isMarked());
    }

    @Test
    void testTakeUntilIncompleteRestoresCursor() throws IOException {
        feed("abc\r");
        buffer.takeByte();

        assertNull(buffer.takeUntil(CRLF));
        assertEquals(1, buffer.readPosition());

        // 补齐后可以重新扫描
        feed("\n");
        assertEquals("bc", str(buffer.takeUntil(CRLF)));
    }

    @Test
    void testTakeUntilRestartsMatchOnRepeatedFirstByte() throws IOException {
        feed("a\r\r\nb");
        assertEquals("a\r", str(buffer.takeUntil(CRLF)));
        assertEquals('b', buffer.takeByte());
    }

    @Test
    void testTakeUntilEmptyLine() throws IOException {
        feed("\r\n");
        ByteBuf line = buffer.takeUntil(CRLF);
        assertNotNull(line);
        assertEquals(0, line.readableBytes());
    }

    @Test
    void testMarkAndReset() throws IOException {
        feed("abcdef");
        buffer.takeByte();
        buffer.mark();
        buffer.takeSlice(3);
        assertEquals(4, buffer.readPosition());

        buffer.reset();
        assertEquals(1, buffer.readPosition());
        assertFalse(buffer.isMarked());

        // 没有标记时 reset 什么都不做
        buffer.takeByte();
        buffer.reset();
        assertEquals(2, buffer.readPosition());
    }

    @Test
    void testRewindCannotMoveForward() throws IOException {
        feed("abc");
        buffer.takeByte();
        assertThrows(IndexOutOfBoundsException.class, () -> buffer.rewind(2));
        buffer.rewind(0);
        assertEquals(0, buffer.readPosition());
    }

    @Test
    void testCompactPreservesUnreadBytes() throws IOException {
        feed("0123456789");
        buffer.takeSlice(4);

        buffer.compact();

        assertEquals(0, buffer.readPosition());
        assertEquals(6, buffer.writePosition());
        assertEquals("456789", str(buffer.takeSlice(6)));
    }

    @Test
    void testCompactWithOverlappingRegion() throws IOException {
        // 未读区间比已读区间长，拷贝时源和目标重叠
        feed("ab0123456789abcdef");
        buffer.takeSlice(2);
        buffer.compact();
        assertEquals("0123456789abcdef", str(buffer.takeSlice(16)));
    }

    @Test
    void testCompactEmptyResetsCursors() throws IOException {
        feed("abc");
        buffer.takeSlice(3);
        buffer.compact();
        assertEquals(0, buffer.readPosition());
        assertEquals(0, buffer.writePosition());
        assertEquals(64, buffer.freeSpace());
    }

    @Test
    void testCompactShiftsMark() throws IOException {
        feed("abcdef");
        buffer.takeSlice(2);
        buffer.mark();
        buffer.compact();

        assertEquals('c', buffer.takeByte());
        buffer.reset();
        assertEquals(0, buffer.readPosition());
        assertEquals('c', buffer.takeByte());
    }

    @Test
    void testCompactDropsMarkOnDiscardedBytes() throws IOException {
        feed("abcdef");
        buffer.mark();
        buffer.takeSlice(2);
        buffer.compact();

        assertFalse(buffer.isMarked());
        assertEquals('c', buffer.takeByte());
    }

    @Test
    void testDrainWritesUnreadBytesAndCompacts() throws IOException {
        buffer.putBytes("*1\r\n".getBytes(StandardCharsets.US_ASCII));
        buffer.putByte('$');

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        buffer.drainTo(out);

        assertEquals("*1\r\n$", out.toString(StandardCharsets.US_ASCII));
        assertFalse(buffer.hasRemaining());
        assertEquals(0, buffer.writePosition());
    }

    @Test
    void testRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new StreamBuffer(0));
    }
}
