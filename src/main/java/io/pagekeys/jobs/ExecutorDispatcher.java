package io.pagekeys.jobs;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * {@link Dispatcher} over a fixed-size {@link ThreadPoolExecutor} with a bounded backlog.
 * A full backlog surfaces as {@link RejectedExecutionException}. Idle workers exit after
 * the keep-alive and are started again by the next submission.
 */
public final class ExecutorDispatcher implements Dispatcher {
    public static final Duration DEFAULT_KEEP_ALIVE = Duration.ofSeconds(1);

    private final ThreadPoolExecutor executor;

    public ExecutorDispatcher(String queueName, int maxWorkers, int queueCapacity) {
        this(queueName, maxWorkers, queueCapacity, DEFAULT_KEEP_ALIVE);
    }

    public ExecutorDispatcher(String queueName, int maxWorkers, int queueCapacity, Duration keepAlive) {
        int workers = Math.max(1, maxWorkers);
        this.executor = new ThreadPoolExecutor(
                workers,
                workers,
                Math.max(1L, keepAlive.toMillis()),
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
                new ThreadFactoryBuilder()
                        .setNameFormat("pagekeys-queue-" + threadSafeName(queueName) + "-%d")
                        .setDaemon(true)
                        .build(),
                new ThreadPoolExecutor.AbortPolicy()
        );
        executor.allowCoreThreadTimeOut(true);
    }

    public static DispatcherFactory factory() {
        return ExecutorDispatcher::new;
    }

    @Override
    public void dispatch(Runnable work) {
        executor.execute(work);
    }

    @Override
    public void shutdown() {
        executor.shutdown();
    }

    int liveWorkers() {
        return executor.getPoolSize();
    }

    // The name format goes through String.format.
    private static String threadSafeName(String queueName) {
        String raw = queueName == null || queueName.isBlank() ? "unnamed" : queueName;
        return raw.replace('%', '_');
    }
}
