package org.muma.redis.cli.command;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * 会话内的命令历史 (只在内存里，不落盘)
 * 忽略空行，连续重复的命令只记一次，超过上限时淘汰最旧的。
 */
public class CommandHistory {

    public static final int MAX_HISTORY_SIZE = 1000;
    public static final String HISTORY_COMMAND = "_history";

    private final int maxSize;
    private final Deque<String> commands = new ArrayDeque<>();

    public CommandHistory() {
        this(MAX_HISTORY_SIZE);
    }

    public CommandHistory(int maxSize) {
        this.maxSize = maxSize;
    }

    public void add(String command) {
        if (command == null) return;
        String trimmed = command.strip();
        if (trimmed.isEmpty()) return;

        if (trimmed.equals(commands.peekLast())) return;
        if (commands.size() >= maxSize) {
            commands.pollFirst();
        }
        commands.addLast(trimmed);
    }

    public List<String> getAll() {
        return List.copyOf(commands);
    }

    public int size() {
        return commands.size();
    }

    public String render() {
        if (commands.isEmpty()) {
            return "No command history.";
        }
        StringBuilder sb = new StringBuilder();
        int idx = 1;
        for (String cmd : commands) {
            sb.append(String.format("%4d: %s%n", idx++, cmd));
        }
        sb.append("Total: ").append(commands.size()).append(" commands");
        return sb.toString();
    }

    public static boolean isHistoryCommand(String input) {
        return input != null && HISTORY_COMMAND.equalsIgnoreCase(input.strip());
    }
}
