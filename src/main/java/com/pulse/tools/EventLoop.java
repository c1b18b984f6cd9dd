package com.pulse.tools;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * 单线程事件循环。一个通话代理的所有状态修改都在同一个循环上串行执行，
 * 因此代理内部不需要额外的锁。
 */
public interface EventLoop {

    void execute(Runnable task);

    ScheduledTask schedule(Duration delay, Runnable task);

    long currentTimeMillis();

    boolean inEventLoop();

    default <T> CompletableFuture<T> submit(Callable<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        execute(() -> {
            try {
                future.complete(task.call());
            } catch (Throwable ex) {
                future.completeExceptionally(ex);
            }
        });
        return future;
    }
}
