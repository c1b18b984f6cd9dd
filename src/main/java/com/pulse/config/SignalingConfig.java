package com.pulse.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulse.rtc.LoopbackTransportFactory;
import com.pulse.rtc.PeerTransportFactory;
import com.pulse.service.SignalingChannel;
import com.pulse.service.impl.InMemorySignalingChannel;
import com.pulse.service.impl.RedisSignalingChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.retry.support.RetryTemplate;

/**
 * 信令存储和传输的装配，pulse.signaling.store 选择存储实现
 */
@Slf4j
@Configuration
public class SignalingConfig {

    @Bean
    @ConditionalOnProperty(prefix = "pulse.signaling", name = "store", havingValue = "memory", matchIfMissing = true)
    public SignalingChannel inMemorySignalingChannel() {
        log.info("使用进程内信令存储");
        return new InMemorySignalingChannel();
    }

    @Bean
    @ConditionalOnProperty(prefix = "pulse.signaling", name = "store", havingValue = "redis")
    public SignalingChannel redisSignalingChannel(StringRedisTemplate stringRedisTemplate,
                                                  RedisMessageListenerContainer signalingListenerContainer,
                                                  @Qualifier("signalingRetryTemplate") RetryTemplate retryTemplate,
                                                  ObjectMapper objectMapper,
                                                  PulseProperties pulseProperties) {
        log.info("使用redis信令存储 prefix={}", pulseProperties.getSignaling().getKeyPrefix());
        return new RedisSignalingChannel(stringRedisTemplate, signalingListenerContainer, retryTemplate,
                objectMapper, pulseProperties.getSignaling());
    }

    @Bean
    public PeerTransportFactory peerTransportFactory(PulseProperties pulseProperties) {
        return new LoopbackTransportFactory(pulseProperties.getTransport().getCandidatesPerDescription());
    }
}
