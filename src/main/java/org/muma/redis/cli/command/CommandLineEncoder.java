package org.muma.redis.cli.command;

import org.muma.redis.cli.protocol.BulkString;
import org.muma.redis.cli.protocol.RedisArray;
import org.muma.redis.cli.protocol.RedisMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 把一行命令文本转成 RESP 请求
 * 例如 "set hello world" => Array([Bulk("set"), Bulk("hello"), Bulk("world")])
 * <p>
 * 只按 ASCII 空白切分，不支持引号和转义：含空格的值无法作为一个参数发送。
 */
public final class CommandLineEncoder {

    private static final Pattern WHITESPACE = Pattern.compile("[ \\t\\n\\x0B\\f\\r]+");

    private CommandLineEncoder() {
    }

    public static RedisArray encode(String commandLine) {
        List<String> tokens = tokenize(commandLine);
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("Empty command line");
        }
        List<RedisMessage> elements = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            elements.add(new BulkString(token));
        }
        return new RedisArray(elements);
    }

    public static List<String> tokenize(String commandLine) {
        String trimmed = commandLine == null ? "" : commandLine.strip();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return List.of(WHITESPACE.split(trimmed));
    }

    /**
     * 第一个单词 (命令名) 的大写形式，空行返回 null
     */
    public static String commandName(String commandLine) {
        List<String> tokens = tokenize(commandLine);
        return tokens.isEmpty() ? null : tokens.get(0).toUpperCase(Locale.ROOT);
    }
}
