package org.muma.redis.cli.format;

import org.junit.jupiter.api.Test;
import org.muma.redis.cli.protocol.BulkError;
import org.muma.redis.cli.protocol.BulkString;
import org.muma.redis.cli.protocol.ErrorMessage;
import org.muma.redis.cli.protocol.RedisArray;
import org.muma.redis.cli.protocol.RedisBoolean;
import org.muma.redis.cli.protocol.RedisInteger;
import org.muma.redis.cli.protocol.RedisMap;
import org.muma.redis.cli.protocol.RedisNull;
import org.muma.redis.cli.protocol.RedisSet;
import org.muma.redis.cli.protocol.SimpleString;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RespFormatterTest {

    private static final String NL = System.lineSeparator();

    @Test
    void testScalars() {
        assertEquals("OK", RespFormatter.format(new SimpleString("OK")));
        assertEquals("hello", RespFormatter.format(new BulkString("hello")));
        assertEquals("-3", RespFormatter.format(new RedisInteger(-3)));
        assertEquals("true", RespFormatter.format(new RedisBoolean(true)));
        assertEquals("nil", RespFormatter.format(RedisNull.INSTANCE));
        assertEquals("ERR wrong type", RespFormatter.format(new ErrorMessage("ERR wrong type")));
        assertEquals("SYNTAX bad", RespFormatter.format(new BulkError("SYNTAX bad")));
    }

    @Test
    void testEmptyAggregates() {
        assertEquals("{}", RespFormatter.format(new RedisMap(List.of())));
        assertEquals("#{}", RespFormatter.format(new RedisSet(List.of())));
        assertEquals("[]", RespFormatter.format(new RedisArray(List.of())));
    }

    @Test
    void testArrayOneElementPerLine() {
        String out = RespFormatter.format(RedisArray.of(new BulkString("a"), RedisNull.INSTANCE, new RedisInteger(1)));
        assertEquals("a" + NL + "nil" + NL + "1", out);
    }

    @Test
    void testMapPairsAndNesting() {
        RedisMap map = new RedisMap(List.of(
                new RedisMap.Entry(new BulkString("server"), new BulkString("redis")),
                new RedisMap.Entry(new BulkString("modules"), RedisArray.of(new BulkString("json"), new BulkString("search")))));

        assertEquals("server: redis" + NL
                + "modules:" + NL
                + "  json" + NL
                + "  search", RespFormatter.format(map));
    }

    @Test
    void testNestedArrayIsIndented() {
        String out = RespFormatter.format(RedisArray.of(
                new BulkString("0"),
                RedisArray.of(new BulkString("k1"), new BulkString("k2"))));
        assertEquals("0" + NL + "  k1" + NL + "  k2", out);
    }
}
