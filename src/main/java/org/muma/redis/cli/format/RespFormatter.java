package org.muma.redis.cli.format;

import org.muma.redis.cli.protocol.BulkError;
import org.muma.redis.cli.protocol.BulkString;
import org.muma.redis.cli.protocol.ErrorMessage;
import org.muma.redis.cli.protocol.RedisArray;
import org.muma.redis.cli.protocol.RedisBoolean;
import org.muma.redis.cli.protocol.RedisInteger;
import org.muma.redis.cli.protocol.RedisMap;
import org.muma.redis.cli.protocol.RedisMessage;
import org.muma.redis.cli.protocol.RedisNull;
import org.muma.redis.cli.protocol.RedisSet;
import org.muma.redis.cli.protocol.SimpleString;

import java.util.ArrayList;
import java.util.List;

/**
 * 把回复渲染成给人看的文本 (纯函数，不涉及协议逻辑)
 * <p>
 * 标量直接输出字面值，Null 输出 nil；Map 每个键值对一行 "key: value"，
 * Array / Set 每个元素一行，嵌套的聚合缩进两个空格。
 */
public final class RespFormatter {

    public static final String NIL = "nil";
    public static final String EMPTY_MAP = "{}";
    public static final String EMPTY_SET = "#{}";
    public static final String EMPTY_ARRAY = "[]";

    private static final String INDENT = "  ";

    private RespFormatter() {
    }

    public static String format(RedisMessage msg) {
        List<String> lines = new ArrayList<>();
        render(msg, "", lines);
        return String.join(System.lineSeparator(), lines);
    }

    private static void render(RedisMessage msg, String indent, List<String> lines) {
        if (msg instanceof RedisMap map) {
            if (map.entries().isEmpty()) {
                lines.add(indent + EMPTY_MAP);
                return;
            }
            for (RedisMap.Entry entry : map.entries()) {
                String key = scalar(entry.key());
                if (isAggregate(entry.value())) {
                    lines.add(indent + key + ":");
                    render(entry.value(), indent + INDENT, lines);
                } else {
                    lines.add(indent + key + ": " + scalar(entry.value()));
                }
            }
        } else if (msg instanceof RedisArray array) {
            renderElements(array.elements(), EMPTY_ARRAY, indent, lines);
        } else if (msg instanceof RedisSet set) {
            renderElements(set.elements(), EMPTY_SET, indent, lines);
        } else {
            lines.add(indent + scalar(msg));
        }
    }

    private static void renderElements(List<RedisMessage> elements, String empty, String indent, List<String> lines) {
        if (elements.isEmpty()) {
            lines.add(indent + empty);
            return;
        }
        for (RedisMessage element : elements) {
            render(element, isAggregate(element) ? indent + INDENT : indent, lines);
        }
    }

    private static boolean isAggregate(RedisMessage msg) {
        return msg instanceof RedisArray || msg instanceof RedisMap || msg instanceof RedisSet;
    }

    private static String scalar(RedisMessage msg) {
        if (msg instanceof SimpleString s) return s.content();
        if (msg instanceof BulkString b) return b.asString();
        if (msg instanceof RedisInteger i) return String.valueOf(i.value());
        if (msg instanceof RedisBoolean b) return String.valueOf(b.value());
        if (msg instanceof RedisNull) return NIL;
        if (msg instanceof ErrorMessage e) return e.content();
        if (msg instanceof BulkError e) return e.content();
        // 聚合类型作为 Map 的 key 时压成一行
        return format(msg).replace(System.lineSeparator(), " ");
    }
}
