package com.pulse.config;

import com.pulse.publisher.LoggingWakeNotifier;
import com.pulse.publisher.RabbitWakeNotifier;
import com.pulse.publisher.WakeNotifier;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 来电唤醒通知。pulse.wake.enabled=true 时投递到 RabbitMQ，否则只打日志
 */
@Configuration
public class RabbitMQConfig {

    @Bean
    @ConditionalOnProperty(prefix = "pulse.wake", name = "enabled", havingValue = "false", matchIfMissing = true)
    public WakeNotifier loggingWakeNotifier() {
        return new LoggingWakeNotifier();
    }

    @Configuration
    @ConditionalOnProperty(prefix = "pulse.wake", name = "enabled", havingValue = "true")
    public static class RabbitWakeConfig {

        // Direct交换机：按路由键精确投递给推送服务
        @Bean
        public DirectExchange wakeExchange(PulseProperties pulseProperties) {
            return ExchangeBuilder.directExchange(pulseProperties.getWake().getExchange())
                    .durable(true)
                    .build();
        }

        @Bean
        public Queue wakeQueue(PulseProperties pulseProperties) {
            // 唤醒通知过期就没有意义了，30秒未消费直接丢弃
            return QueueBuilder.durable(pulseProperties.getWake().getQueue())
                    .ttl(30_000)
                    .build();
        }

        @Bean
        public Binding wakeBinding(Queue wakeQueue, DirectExchange wakeExchange, PulseProperties pulseProperties) {
            return BindingBuilder.bind(wakeQueue)
                    .to(wakeExchange)
                    .with(pulseProperties.getWake().getRoutingKey());
        }

        @Bean
        public MessageConverter jsonMessageConverter() {
            return new Jackson2JsonMessageConverter();
        }

        @Bean
        public WakeNotifier rabbitWakeNotifier(RabbitTemplate rabbitTemplate, PulseProperties pulseProperties) {
            return new RabbitWakeNotifier(rabbitTemplate, pulseProperties.getWake().getExchange(),
                    pulseProperties.getWake().getRoutingKey());
        }
    }
}
