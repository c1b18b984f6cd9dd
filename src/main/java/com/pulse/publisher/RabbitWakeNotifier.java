package com.pulse.publisher;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

/**
 * 通过 RabbitMQ 把唤醒通知投递给推送服务
 */
@Slf4j
@RequiredArgsConstructor
public class RabbitWakeNotifier implements WakeNotifier {

    private final RabbitTemplate rabbitTemplate;
    private final String exchange;
    private final String routingKey;

    @Override
    public void notifyCallee(WakeSignal signal) {
        log.info("发送来电唤醒：{}", signal);
        // 消息ID用于发布确认
        rabbitTemplate.convertAndSend(exchange, routingKey, signal, new CorrelationData(signal.getId()));
    }
}
