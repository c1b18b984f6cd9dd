package com.pulse.call;

import com.pulse.config.PulseProperties;
import com.pulse.metrics.CallMetrics;
import com.pulse.publisher.WakeNotifier;
import com.pulse.repository.CallHistoryRepository;
import com.pulse.rtc.JavaSoundMediaSource;
import com.pulse.rtc.LocalMediaSource;
import com.pulse.rtc.PeerTransportFactory;
import com.pulse.rtc.VirtualMediaSource;
import com.pulse.service.SignalingChannel;
import com.pulse.tools.ExecutorEventLoop;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;

/**
 * 为每个身份创建独立事件循环上的通话代理
 */
@Component
public class CallAgentFactory {

    private final SignalingChannel signalingChannel;
    private final PeerTransportFactory transportFactory;
    private final PulseProperties pulseProperties;
    private final CallMetrics callMetrics;
    private final CallHistoryRepository historyRepository;
    private final WakeNotifier wakeNotifier;
    private final Executor wakeExecutor;

    public CallAgentFactory(SignalingChannel signalingChannel, PeerTransportFactory transportFactory,
                            PulseProperties pulseProperties, CallMetrics callMetrics,
                            CallHistoryRepository historyRepository, WakeNotifier wakeNotifier,
                            @Qualifier("wakeExecutor") Executor wakeExecutor) {
        this.signalingChannel = signalingChannel;
        this.transportFactory = transportFactory;
        this.pulseProperties = pulseProperties;
        this.callMetrics = callMetrics;
        this.historyRepository = historyRepository;
        this.wakeNotifier = wakeNotifier;
        this.wakeExecutor = wakeExecutor;
    }

    public CallAgent create(String userId, String displayName) {
        return CallAgent.builder()
                .localId(userId)
                .displayName(displayName)
                .channel(signalingChannel)
                .transportFactory(transportFactory)
                .mediaSource(newMediaSource())
                .loop(new ExecutorEventLoop("agent-" + userId))
                .config(pulseProperties.getCall())
                .metrics(callMetrics)
                .historyRepository(historyRepository)
                .wakeNotifier(wakeNotifier)
                .wakeExecutor(wakeExecutor)
                .build();
    }

    private LocalMediaSource newMediaSource() {
        if ("javasound".equalsIgnoreCase(pulseProperties.getMedia().getType())) {
            return new JavaSoundMediaSource();
        }
        return new VirtualMediaSource();
    }
}
