package com.pulse.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * 信令存储的重试配置
 */
@Slf4j
@Configuration
@EnableRetry
public class RetryConfig {

    /**
     * 只重试连接类故障，退避要短：信令操作在事件循环上同步执行，长时间退避会拖住整个代理
     */
    @Bean("signalingRetryTemplate")
    public RetryTemplate signalingRetryTemplate() {
        RetryTemplate retryTemplate = new RetryTemplate();

        Map<Class<? extends Throwable>, Boolean> retryableExceptions = new HashMap<>();
        retryableExceptions.put(org.springframework.data.redis.RedisConnectionFailureException.class, true);
        retryableExceptions.put(org.springframework.dao.QueryTimeoutException.class, true);
        retryableExceptions.put(IllegalArgumentException.class, false);
        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(3, retryableExceptions);

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(100);
        backOffPolicy.setMultiplier(2);
        backOffPolicy.setMaxInterval(500);

        retryTemplate.setRetryPolicy(retryPolicy);
        retryTemplate.setBackOffPolicy(backOffPolicy);

        retryTemplate.registerListener(new RetryListener() {
            @Override
            public <T, E extends Throwable> void close(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
                if (throwable != null && context.getRetryCount() > 0) {
                    log.error("信令存储操作重试失败，已达到最大重试次数", throwable);
                } else if (context.getRetryCount() > 0) {
                    log.info("信令存储操作重试成功，重试次数：{}", context.getRetryCount());
                }
            }

            @Override
            public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
                log.warn("信令存储操作失败，第{}次重试，异常：{}", context.getRetryCount(), throwable.getMessage());
            }
        });

        return retryTemplate;
    }
}
