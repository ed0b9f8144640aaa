package org.muma.redis.cli.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 后台线程工具
 */
public final class ThreadUtils {

    private static final Logger log = LoggerFactory.getLogger(ThreadUtils.class);

    private ThreadUtils() {
    }

    /**
     * 命名的守护线程，未捕获的异常记日志而不是打印到控制台
     */
    public static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(1);
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.getAndIncrement());
            t.setDaemon(true); // 不能阻止 CLI 退出
            t.setUncaughtExceptionHandler((thread, e) ->
                    log.error("Uncaught exception in thread {}", thread.getName(), e));
            return t;
        };
    }

    public static void shutdown(ExecutorService executor, long timeoutMs) {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.debug("Executor did not terminate within {} ms", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
