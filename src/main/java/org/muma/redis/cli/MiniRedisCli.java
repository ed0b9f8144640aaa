package org.muma.redis.cli;

import org.muma.redis.cli.client.RedisConnection;
import org.muma.redis.cli.command.CommandHistory;
import org.muma.redis.cli.command.CommandLineEncoder;
import org.muma.redis.cli.config.ClientConfig;
import org.muma.redis.cli.docs.CommandDocCache;
import org.muma.redis.cli.docs.CommandDocs;
import org.muma.redis.cli.format.RespFormatter;
import org.muma.redis.cli.protocol.Hello;
import org.muma.redis.cli.protocol.RedisMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * 交互式命令行入口
 * 每行输入按空白切分成一条命令发给服务端，打印渲染后的回复。
 */
public class MiniRedisCli {

    private static final Logger log = LoggerFactory.getLogger(MiniRedisCli.class);

    static final String QUIT = "quit";

    // 启动时预热这些命令的文档
    private static final List<String> COMMON_COMMANDS = List.of(
            "GET", "SET", "DEL", "EXISTS", "KEYS", "EXPIRE", "TTL", "TYPE", "RENAME",
            "HGET", "HSET", "HDEL", "HEXISTS", "HGETALL", "HKEYS", "HLEN", "HVALS",
            "LPUSH", "RPUSH", "LPOP", "RPOP", "LLEN", "LRANGE", "LSET",
            "SADD", "SREM", "SMEMBERS", "SISMEMBER", "SCARD", "SUNION", "SINTER",
            "ZADD", "ZRANGE", "ZREM", "ZCARD", "ZSCORE",
            "SELECT", "INFO", "PING", "FLUSHDB", "FLUSHALL", "DBSIZE", "CONFIG");

    private final ClientConfig config;
    private final CommandHistory history = new CommandHistory();

    public MiniRedisCli(ClientConfig config) {
        this.config = config;
    }

    /**
     * @return 进程退出码
     */
    public int start(BufferedReader in, PrintStream out) {
        Hello hello = config.toHello();
        RedisConnection connection;
        try {
            connection = RedisConnection.connect(config.getHost(), config.getPort(), hello, config.toConnectionOptions());
        } catch (IOException e) {
            out.println("Error: " + e.getMessage());
            log.debug("Connect failed", e);
            return 1;
        }

        out.println("Connected successfully!");
        out.println(RespFormatter.format(connection.getHandshakeReply()));

        CommandDocCache docs = null;
        if (config.isHintsEnabled()) {
            docs = new CommandDocCache(() -> RedisConnection.connect(
                    config.getHost(), config.getPort(), hello, config.toConnectionOptions()));
            docs.prefetch(COMMON_COMMANDS);
        }

        try {
            return repl(connection, docs, in, out);
        } finally {
            if (docs != null) {
                docs.close();
            }
            connection.close();
        }
    }

    int repl(RedisConnection connection, CommandDocs docs, BufferedReader in, PrintStream out) {
        String prompt = connection.getAddress() + "> ";
        while (true) {
            out.print(prompt);
            out.flush();

            String line;
            try {
                line = in.readLine();
            } catch (IOException e) {
                out.println("Error: " + e.getMessage());
                return 1;
            }
            if (line == null) {
                return 0;
            }

            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (QUIT.equalsIgnoreCase(trimmed)) {
                return 0;
            }
            if (CommandHistory.isHistoryCommand(trimmed)) {
                out.println(history.render());
                history.add(trimmed);
                continue;
            }

            history.add(trimmed);
            try {
                RedisMessage reply = connection.send(trimmed);
                if (reply.isError()) {
                    out.println("(error) " + RespFormatter.format(reply));
                    hint(docs, trimmed).ifPresent(h -> out.println("  " + h));
                } else {
                    out.println(RespFormatter.format(reply));
                }
            } catch (IOException e) {
                // 连接已不可用，交给用户重新启动
                out.println("Error: " + e.getMessage());
                return 1;
            }
        }
    }

    private Optional<String> hint(CommandDocs docs, String line) {
        if (docs == null) {
            return Optional.empty();
        }
        String name = CommandLineEncoder.commandName(line);
        return docs.lookup(name).map(doc -> doc.name() + ": " + doc.hint());
    }

    public static void main(String[] args) {
        ClientConfig config = ClientConfig.getInstance();
        try {
            config.load(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(ClientConfig.USAGE);
            System.exit(2);
            return;
        }

        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        int code = new MiniRedisCli(config).start(in, System.out);
        System.exit(code);
    }
}
