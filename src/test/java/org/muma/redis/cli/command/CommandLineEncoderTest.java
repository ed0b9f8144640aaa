package org.muma.redis.cli.command;

import org.junit.jupiter.api.Test;
import org.muma.redis.cli.protocol.BulkString;
import org.muma.redis.cli.protocol.RedisArray;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineEncoderTest {

    @Test
    void testSplitsOnWhitespace() {
        assertEquals(RedisArray.of(new BulkString("set"), new BulkString("hello"), new BulkString("world")),
                CommandLineEncoder.encode("set hello world"));
    }

    @Test
    void testCollapsesRepeatedWhitespace() {
        assertEquals(List.of("get", "k"), CommandLineEncoder.tokenize("  get \t  k  "));
    }

    @Test
    void testQuotesAreNotInterpreted() {
        // 已知限制：不支持引号，含空格的值会被拆开
        assertEquals(List.of("set", "k", "\"a", "b\""), CommandLineEncoder.tokenize("set k \"a b\""));
    }

    @Test
    void testEmptyLineIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> CommandLineEncoder.encode("   "));
        assertTrue(CommandLineEncoder.tokenize(null).isEmpty());
    }

    @Test
    void testCommandName() {
        assertEquals("HGETALL", CommandLineEncoder.commandName(" hgetall user:1"));
        assertNull(CommandLineEncoder.commandName(""));
    }
}
