package com.pulse.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
public class ThreadPoolConfig {

    /**
     * 来电唤醒通知的发送线程，队列满时直接拒绝，由调用方记录日志
     */
    @Bean(name = "wakeExecutor", destroyMethod = "shutdown")
    public ThreadPoolExecutor wakeExecutor() {
        return new ThreadPoolExecutor(
                2,
                8,
                10,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(100),
                new ThreadFactoryBuilder().setNameFormat("pulse-wake-%d").setDaemon(true).build(),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }
}
