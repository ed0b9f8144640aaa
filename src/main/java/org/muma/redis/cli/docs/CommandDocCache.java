package org.muma.redis.cli.docs;

import org.muma.redis.cli.client.RedisConnection;
import org.muma.redis.cli.protocol.BulkString;
import org.muma.redis.cli.protocol.RedisArray;
import org.muma.redis.cli.protocol.RedisMessage;
import org.muma.redis.cli.utils.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 异步填充的命令文档缓存
 * <p>
 * lookup 只读缓存，未命中时把 COMMAND DOCS 请求丢给后台单线程，立即返回 empty。
 * 后台线程使用自己独立的连接：RESP 没有请求 ID，不能和交互请求共用一条连接。
 */
public class CommandDocCache implements CommandDocs, Closeable {

    private static final Logger log = LoggerFactory.getLogger(CommandDocCache.class);

    @FunctionalInterface
    public interface ConnectionFactory {
        RedisConnection open() throws IOException;
    }

    private final ConnectionFactory connectionFactory;
    private final Executor executor;
    private final ExecutorService ownedExecutor;

    private final Map<String, CommandDoc> docs = new ConcurrentHashMap<>();
    // 已提交但还没有结果的命令，避免重复请求
    private final Set<String> pending = ConcurrentHashMap.newKeySet();

    // 后台线程写入，close() 在调用方线程读取
    private volatile RedisConnection connection;
    private volatile boolean closed;

    public CommandDocCache(ConnectionFactory connectionFactory) {
        this.connectionFactory = connectionFactory;
        this.ownedExecutor = Executors.newSingleThreadExecutor(ThreadUtils.daemonThreadFactory("command-docs"));
        this.executor = ownedExecutor;
    }

    CommandDocCache(ConnectionFactory connectionFactory, Executor executor) {
        this.connectionFactory = connectionFactory;
        this.ownedExecutor = null;
        this.executor = executor;
    }

    @Override
    public Optional<CommandDoc> lookup(String commandName) {
        if (commandName == null || commandName.isBlank()) {
            return Optional.empty();
        }
        String name = commandName.toUpperCase(Locale.ROOT);
        CommandDoc doc = docs.get(name);
        if (doc == null) {
            request(name);
        }
        return Optional.ofNullable(doc);
    }

    /**
     * 预热一批常用命令
     */
    public void prefetch(Collection<String> commandNames) {
        for (String name : commandNames) {
            request(name.toUpperCase(Locale.ROOT));
        }
    }

    public int size() {
        return docs.size();
    }

    private void request(String name) {
        if (closed || docs.containsKey(name) || !pending.add(name)) {
            return;
        }
        executor.execute(() -> {
            try {
                fetch(name);
            } finally {
                pending.remove(name);
            }
        });
    }

    private void fetch(String name) {
        if (closed) {
            return;
        }
        try {
            if (connection == null || !connection.isConnected()) {
                connection = connectionFactory.open();
                // open 期间缓存可能已被关闭，此时 close() 看不到这条新连接
                if (closed) {
                    connection.close();
                    return;
                }
            }
            RedisMessage reply = connection.send(RedisArray.of(
                    new BulkString("COMMAND"), new BulkString("DOCS"), new BulkString(name)));
            if (reply.isError()) {
                // 老版本服务端不支持 COMMAND DOCS，记一个空文档，不再重复请求
                log.debug("COMMAND DOCS {} not supported: {}", name, reply);
                docs.put(name, CommandDoc.empty(name));
                return;
            }
            docs.put(name, CommandDocParser.parse(name, reply));
        } catch (IOException e) {
            // 连接已被 RedisConnection 关闭，下次查询时重连
            log.debug("Failed to fetch docs for {}: {}", name, e.toString());
            connection = null;
        }
    }

    @Override
    public void close() {
        closed = true;
        if (ownedExecutor != null) {
            ThreadUtils.shutdown(ownedExecutor, 1000);
        }
        RedisConnection conn = connection;
        if (conn != null) {
            conn.close();
        }
    }
}
