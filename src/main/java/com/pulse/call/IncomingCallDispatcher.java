package com.pulse.call;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.pulse.entity.dto.call.CallSession;
import com.pulse.entity.dto.call.CallStatus;
import com.pulse.service.SignalingChannel;
import com.pulse.service.Subscription;
import com.pulse.tools.EventLoop;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * 监听发给本地身份的记录，把新的有效来电交给代理。
 * 自己发起的、已不是 OFFERING 的、过期的和已经处理过的来电都在这里过滤掉。
 */
@Slf4j
class IncomingCallDispatcher {

    private final String localId;
    private final SignalingChannel channel;
    private final EventLoop loop;
    private final Duration staleAfter;
    private final CallAgent agent;

    private final Cache<String, Boolean> handled = CacheBuilder.newBuilder()
            .maximumSize(1024)
            .expireAfterWrite(Duration.ofMinutes(5))
            .build();

    private Subscription subscription;

    IncomingCallDispatcher(String localId, SignalingChannel channel, EventLoop loop, Duration staleAfter,
                           CallAgent agent) {
        this.localId = localId;
        this.channel = channel;
        this.loop = loop;
        this.staleAfter = staleAfter;
        this.agent = agent;
    }

    void start() {
        if (subscription != null) {
            return;
        }
        subscription = channel.watchInbound(localId,
                (callId, record) -> loop.execute(() -> onInbound(callId, record)));
    }

    void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
    }

    void onInbound(String callId, CallSession record) {
        if (subscription == null || record == null || record.getStatus() != CallStatus.OFFERING) {
            return;
        }
        if (localId.equals(record.getCallerId())) {
            return;
        }
        if (handled.getIfPresent(callId) != null) {
            return;
        }
        handled.put(callId, Boolean.TRUE);
        Long startedAt = record.getStartedAt();
        if (startedAt == null || loop.currentTimeMillis() - startedAt > staleAfter.toMillis()) {
            log.info("忽略过期来电 callId={} caller={} startedAt={}", callId, record.getCallerId(), startedAt);
            return;
        }
        log.info("收到来电 callId={} caller={}", callId, record.getCallerId());
        agent.onInboundOffer(record);
    }
}
