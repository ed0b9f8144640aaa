package org.muma.redis.cli.docs;

import org.muma.redis.cli.protocol.RedisArray;
import org.muma.redis.cli.protocol.RedisBoolean;
import org.muma.redis.cli.protocol.RedisMap;
import org.muma.redis.cli.protocol.RedisMessage;
import org.muma.redis.cli.protocol.RedisSet;
import org.muma.redis.cli.protocol.RespText;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 解析 COMMAND DOCS &lt;name&gt; 的回复
 * <p>
 * RESP3 下是嵌套 Map；RESP2 下同样的结构被压平成 "key, value, key, value..." 的数组，
 * 两种形状统一按键值对处理。
 */
public final class CommandDocParser {

    private CommandDocParser() {
    }

    public static CommandDoc parse(String command, RedisMessage reply) {
        List<RedisMap.Entry> top = pairs(reply);
        if (top == null || top.isEmpty()) {
            return CommandDoc.empty(command);
        }

        // 顶层是 {命令名 -> 文档}，只取第一项
        List<RedisMap.Entry> doc = pairs(top.get(0).value());
        if (doc == null) {
            return CommandDoc.empty(command);
        }

        String summary = "";
        List<CommandDoc.Argument> arguments = new ArrayList<>();
        for (RedisMap.Entry entry : doc) {
            String key = RespText.of(entry.key());
            if ("summary".equals(key)) {
                String text = RespText.of(entry.value());
                summary = text != null ? text : "";
            } else if ("arguments".equals(key)) {
                for (RedisMessage arg : elements(entry.value())) {
                    CommandDoc.Argument parsed = parseArgument(arg);
                    if (parsed != null) {
                        arguments.add(parsed);
                    }
                }
            }
        }
        return new CommandDoc(command.toUpperCase(Locale.ROOT), summary, arguments);
    }

    private static CommandDoc.Argument parseArgument(RedisMessage arg) {
        List<RedisMap.Entry> fields = pairs(arg);
        if (fields == null) {
            return null;
        }

        String name = null;
        String type = "string";
        boolean optional = false;
        for (RedisMap.Entry field : fields) {
            String key = RespText.of(field.key());
            if (key == null) continue;
            switch (key) {
                case "name" -> name = RespText.of(field.value());
                case "type" -> {
                    String t = RespText.of(field.value());
                    if (t != null) type = t;
                }
                // 旧格式直接给布尔值，新格式放在 flags 里
                case "optional" -> optional = field.value() instanceof RedisBoolean b && b.value();
                case "flags" -> optional |= elements(field.value()).stream()
                        .anyMatch(flag -> "optional".equals(RespText.of(flag)));
                default -> {
                }
            }
        }
        return name == null || name.isEmpty() ? null : new CommandDoc.Argument(name, type, optional);
    }

    private static List<RedisMap.Entry> pairs(RedisMessage msg) {
        if (msg instanceof RedisMap map) {
            return map.entries();
        }
        if (msg instanceof RedisArray array && array.size() % 2 == 0) {
            List<RedisMap.Entry> entries = new ArrayList<>(array.size() / 2);
            for (int i = 0; i < array.size(); i += 2) {
                entries.add(new RedisMap.Entry(array.elements().get(i), array.elements().get(i + 1)));
            }
            return entries;
        }
        return null;
    }

    private static List<RedisMessage> elements(RedisMessage msg) {
        if (msg instanceof RedisArray array) return array.elements();
        if (msg instanceof RedisSet set) return set.elements();
        return List.of();
    }
}
