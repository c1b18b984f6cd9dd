package com.pulse.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "pulse")
@Component
public class PulseProperties {

    private Call call = new Call();

    private Signaling signaling = new Signaling();

    private Transport transport = new Transport();

    private Media media = new Media();

    private Wake wake = new Wake();

    @Data
    public static class Call {
        /** OFFERING 状态内未被对方确认的超时 */
        private Duration offeringTimeout = Duration.ofSeconds(10);
        /** 主叫 RINGING 状态内未进入 CONNECTING 的超时 */
        private Duration ringingTimeout = Duration.ofSeconds(15);
        /** CONNECTING 状态内链路未建立的超时，覆盖候选地址交换的时间 */
        private Duration connectingTimeout = Duration.ofSeconds(20);
        private Duration renegotiationCooldown = Duration.ofSeconds(2);
        /** 超过该时长的来电直接忽略 */
        private Duration offerStaleAfter = Duration.ofSeconds(10);
        private boolean autoAnswer = true;
    }

    @Data
    public static class Signaling {
        /** memory 或 redis */
        private String store = "memory";
        private String keyPrefix = "pulse";
        /** 通话记录和候选地址在 redis 中的过期时间，兜底清理异常退出留下的记录 */
        private Duration recordTtl = Duration.ofHours(1);
        /** 条件更新遇到并发修改时的最多尝试次数 */
        private int guardedUpdateAttempts = 5;
    }

    @Data
    public static class Transport {
        private int candidatesPerDescription = 2;
    }

    @Data
    public static class Media {
        /** virtual 或 javasound */
        private String type = "virtual";
    }

    @Data
    public static class Wake {
        private boolean enabled = false;
        private String exchange = "pulse.wake.exchange";
        private String queue = "pulse.wake.queue";
        private String routingKey = "pulse.wake.call";
    }
}
