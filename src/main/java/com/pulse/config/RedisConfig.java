package com.pulse.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.util.concurrent.Executors;

@Configuration
@ConditionalOnProperty(prefix = "pulse.signaling", name = "store", havingValue = "redis")
public class RedisConfig {

    /**
     * 信令通知的订阅容器，订阅在运行时按通话动态增删
     */
    @Bean
    public RedisMessageListenerContainer signalingListenerContainer(RedisConnectionFactory redisConnectionFactory) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(redisConnectionFactory);
        container.setTaskExecutor(Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("pulse-redis-listener-%d")
                .setDaemon(true)
                .build()));
        return container;
    }
}
