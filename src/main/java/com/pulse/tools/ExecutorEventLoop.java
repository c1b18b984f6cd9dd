package com.pulse.tools;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 基于单线程 ScheduledExecutorService 的事件循环
 */
@Slf4j
public class ExecutorEventLoop implements EventLoop, AutoCloseable {

    private final ScheduledExecutorService executor;
    private volatile Thread loopThread;

    public ExecutorEventLoop(String name) {
        this.executor = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("pulse-" + name + "-%d")
                .setDaemon(true)
                .setUncaughtExceptionHandler((t, e) -> log.error("事件循环线程异常退出 thread={}", t.getName(), e))
                .build());
    }

    @Override
    public void execute(Runnable task) {
        try {
            executor.execute(guard(task));
        } catch (RejectedExecutionException ex) {
            log.debug("事件循环已关闭，丢弃任务");
        }
    }

    @Override
    public ScheduledTask schedule(Duration delay, Runnable task) {
        try {
            ScheduledFuture<?> future = executor.schedule(guard(task), delay.toMillis(), TimeUnit.MILLISECONDS);
            return () -> future.cancel(false);
        } catch (RejectedExecutionException ex) {
            log.debug("事件循环已关闭，丢弃定时任务");
            return () -> { };
        }
    }

    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }

    @Override
    public boolean inEventLoop() {
        return Thread.currentThread() == loopThread;
    }

    private Runnable guard(Runnable task) {
        return () -> {
            loopThread = Thread.currentThread();
            try {
                task.run();
            } catch (Exception ex) {
                log.error("事件循环任务执行失败", ex);
            }
        };
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
