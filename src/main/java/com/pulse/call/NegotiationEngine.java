package com.pulse.call;

import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;
import com.pulse.entity.dto.call.CallSession;
import com.pulse.entity.dto.call.CallStatus;
import com.pulse.entity.dto.call.CallUpdate;
import com.pulse.entity.dto.call.CandidateDirection;
import com.pulse.entity.dto.call.IceCandidate;
import com.pulse.entity.dto.call.SessionDescription;
import com.pulse.exception.CallException;
import com.pulse.exception.NegotiationException;
import com.pulse.exception.SignalingException;
import com.pulse.metrics.CallMetrics;
import com.pulse.rtc.CaptureHandle;
import com.pulse.rtc.PeerTransport;
import com.pulse.rtc.PeerTransportFactory;
import com.pulse.rtc.SignalingState;
import com.pulse.rtc.TransportState;
import com.pulse.service.SignalingChannel;
import com.pulse.service.Subscription;
import com.pulse.tools.EventLoop;
import com.pulse.tools.ScheduledTask;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 单个通话的协商引擎，生命周期与通话一致。
 * <p>
 * 负责交换会话描述和候选地址：远端描述设置之前到达的候选地址按到达顺序缓存，
 * 设置之后一次性按序应用；所有候选地址按内容哈希去重，重复投递不产生任何效果。
 * 链路失败时只有主叫一方发起重协商（ICE restart）。
 * <p>
 * 除构造外，所有方法都必须在所属代理的事件循环上调用。
 */
@Slf4j
public class NegotiationEngine {

    public enum Role {
        OFFERER,
        ANSWERER
    }

    public interface Listener {

        void onTransportConnected(String callId);

        void onNegotiationFailed(String callId, Exception cause);

        default void onRemoteTrack(String callId) {
        }
    }

    private final String callId;
    private final Role role;
    private final SignalingChannel channel;
    private final EventLoop loop;
    private final Listener listener;
    private final CallMetrics metrics;
    private final Duration renegotiationCooldown;
    private final PeerTransport transport;

    private final Deque<IceCandidate> pendingCandidates = new ArrayDeque<>();
    private final Set<HashCode> seenCandidates = new HashSet<>();
    private final List<Subscription> subscriptions = new ArrayList<>();

    private boolean remoteDescriptionSet;
    private boolean renegotiating;
    private boolean closed;
    private String lastOfferPayload;
    private String lastAnswerPayload;
    private ScheduledTask cooldownTask;

    public NegotiationEngine(String callId, Role role, SignalingChannel channel, PeerTransportFactory transportFactory,
                             EventLoop loop, CaptureHandle capture, Duration renegotiationCooldown,
                             CallMetrics metrics, Listener listener) {
        this.callId = callId;
        this.role = role;
        this.channel = channel;
        this.loop = loop;
        this.listener = listener;
        this.metrics = metrics;
        this.renegotiationCooldown = renegotiationCooldown;
        this.transport = transportFactory.create(callId, new TransportObserver());
        this.transport.attachOutbound(capture);
    }

    /**
     * 主叫流程：生成offer，写入初始记录，订阅被叫的候选地址
     *
     * @param draft 除offer/status外已填好的记录
     */
    public CallSession startOffer(CallSession draft) {
        SessionDescription offer = transport.createOffer(false);
        transport.setLocalDescription(offer);
        lastOfferPayload = offer.getPayload();

        CallSession record = draft.copy();
        record.setCallId(callId);
        record.setOffer(offer);
        record.setStatus(CallStatus.OFFERING);
        channel.create(record);
        subscribeRemoteCandidates();
        log.info("发出offer callId={} caller={} callee={}", callId, record.getCallerId(), record.getCalleeId());
        return record;
    }

    /**
     * 被叫抢占：仅当记录仍是 OFFERING 时改为 RINGING，并发的第二台设备会失败
     */
    public boolean claim() {
        boolean claimed = channel.guardedUpdate(callId,
                record -> record.getStatus() == CallStatus.OFFERING,
                CallUpdate.status(CallStatus.RINGING));
        log.info("抢占来电 callId={} claimed={}", callId, claimed);
        return claimed;
    }

    /**
     * 被叫流程：应用offer，生成answer并写入 CONNECTING，再冲刷缓存的候选地址
     *
     * @return 写入answer时记录已不在 RINGING 则返回 false
     */
    public boolean acceptOffer() {
        subscribeRemoteCandidates();
        CallSession record = channel.get(callId)
                .orElseThrow(() -> new NegotiationException("通话记录不存在 callId=" + callId));
        if (record.getStatus() != CallStatus.RINGING || record.getOffer() == null) {
            throw new NegotiationException("通话状态不允许应答 callId=" + callId + " status=" + record.getStatus());
        }
        applyRemoteDescription(record.getOffer());
        lastOfferPayload = record.getOffer().getPayload();

        SessionDescription answer = transport.createAnswer();
        transport.setLocalDescription(answer);
        boolean written = channel.guardedUpdate(callId,
                current -> current.getStatus() == CallStatus.RINGING,
                CallUpdate.create().withAnswer(answer).withStatus(CallStatus.CONNECTING));
        if (!written) {
            log.warn("写入answer失败，记录已变化 callId={}", callId);
        }
        return written;
    }

    /**
     * 处理记录变化：主叫应用新的answer，被叫识别新的offer（重协商请求）
     */
    public void onRemoteRecord(CallSession record) {
        if (closed || record == null) {
            return;
        }
        if (role == Role.OFFERER) {
            SessionDescription answer = record.getAnswer();
            if (answer == null || Objects.equals(answer.getPayload(), lastAnswerPayload)) {
                return;
            }
            if (transport.signalingState() != SignalingState.HAVE_LOCAL_OFFER) {
                log.debug("忽略answer，当前没有待确认的offer callId={}", callId);
                return;
            }
            lastAnswerPayload = answer.getPayload();
            try {
                applyRemoteDescription(answer);
                log.info("已应用answer callId={}", callId);
            } catch (NegotiationException ex) {
                log.error("应用answer失败 callId={}", callId, ex);
                listener.onNegotiationFailed(callId, ex);
            }
            return;
        }
        SessionDescription offer = record.getOffer();
        if (!remoteDescriptionSet || offer == null || Objects.equals(offer.getPayload(), lastOfferPayload)) {
            return;
        }
        if (transport.signalingState() != SignalingState.STABLE) {
            log.debug("协商进行中，暂不处理新offer callId={}", callId);
            return;
        }
        handleRestartOffer(offer);
    }

    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (Subscription subscription : subscriptions) {
            subscription.unsubscribe();
        }
        subscriptions.clear();
        pendingCandidates.clear();
        seenCandidates.clear();
        if (cooldownTask != null) {
            cooldownTask.cancel();
        }
        try {
            transport.close();
        } catch (RuntimeException ex) {
            log.warn("关闭传输失败 callId={}", callId, ex);
        }
        log.debug("协商引擎已关闭 callId={}", callId);
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean isRenegotiating() {
        return renegotiating;
    }

    public boolean isRemoteDescriptionSet() {
        return remoteDescriptionSet;
    }

    public int pendingCandidateCount() {
        return pendingCandidates.size();
    }

    void onRemoteCandidate(IceCandidate candidate) {
        if (closed) {
            return;
        }
        HashCode hash = Hashing.sha256().hashString(candidate.contentKey(), StandardCharsets.UTF_8);
        if (!seenCandidates.add(hash)) {
            log.debug("重复的候选地址 callId={}", callId);
            return;
        }
        if (remoteDescriptionSet) {
            applyCandidate(candidate);
        } else {
            pendingCandidates.addLast(candidate);
        }
    }

    private void applyRemoteDescription(SessionDescription description) {
        transport.setRemoteDescription(description);
        remoteDescriptionSet = true;
        while (!pendingCandidates.isEmpty()) {
            applyCandidate(pendingCandidates.pollFirst());
        }
    }

    private void applyCandidate(IceCandidate candidate) {
        try {
            transport.addIceCandidate(candidate);
        } catch (NegotiationException ex) {
            metrics.candidateDropped();
            log.warn("应用候选地址失败 callId={} reason={}", callId, ex.getMessage());
        }
    }

    private void handleRestartOffer(SessionDescription offer) {
        log.info("收到新的offer，按重协商处理 callId={}", callId);
        lastOfferPayload = offer.getPayload();
        try {
            applyRemoteDescription(offer);
        } catch (NegotiationException ex) {
            log.error("重协商时应用offer失败 callId={}", callId, ex);
            listener.onNegotiationFailed(callId, ex);
            return;
        }
        try {
            SessionDescription answer = transport.createAnswer();
            transport.setLocalDescription(answer);
            channel.update(callId, CallUpdate.create().withAnswer(answer));
        } catch (CallException ex) {
            log.error("重协商应答失败 callId={}", callId, ex);
        }
    }

    private void handleConnectionFailure(TransportState state) {
        if (role != Role.OFFERER) {
            log.info("链路{}，等待主叫重协商 callId={}", state, callId);
            return;
        }
        if (renegotiating || transport.signalingState() != SignalingState.STABLE) {
            log.debug("重协商已在进行或协商未稳定 callId={}", callId);
            return;
        }
        renegotiating = true;
        metrics.renegotiation();
        try {
            log.info("链路{}，发起ICE restart callId={}", state, callId);
            SessionDescription offer = transport.createOffer(true);
            transport.setLocalDescription(offer);
            lastOfferPayload = offer.getPayload();
            channel.update(callId, CallUpdate.create().withOffer(offer).clearAnswer());
        } catch (CallException ex) {
            log.error("ICE restart失败 callId={}", callId, ex);
        } finally {
            cooldownTask = loop.schedule(renegotiationCooldown, () -> renegotiating = false);
        }
    }

    private void subscribeRemoteCandidates() {
        CandidateDirection remote = role == Role.OFFERER ? CandidateDirection.CALLEE : CandidateDirection.CALLER;
        subscriptions.add(channel.subscribeCandidates(callId, remote,
                candidate -> loop.execute(() -> onRemoteCandidate(candidate))));
    }

    private CandidateDirection localDirection() {
        return role == Role.OFFERER ? CandidateDirection.CALLER : CandidateDirection.CALLEE;
    }

    /**
     * 传输层回调统一投递到事件循环，关闭后的回调直接丢弃
     */
    private final class TransportObserver implements PeerTransport.Observer {

        @Override
        public void onLocalCandidate(IceCandidate candidate) {
            loop.execute(() -> {
                if (closed) {
                    return;
                }
                try {
                    channel.appendCandidate(callId, localDirection(), candidate);
                } catch (SignalingException ex) {
                    log.warn("上传候选地址失败 callId={} reason={}", callId, ex.getMessage());
                }
            });
        }

        @Override
        public void onConnectionStateChange(TransportState state) {
            loop.execute(() -> {
                if (closed) {
                    return;
                }
                log.info("链路状态 callId={} state={}", callId, state);
                if (state == TransportState.CONNECTED) {
                    listener.onTransportConnected(callId);
                } else if (state.isFailure()) {
                    handleConnectionFailure(state);
                }
            });
        }

        @Override
        public void onRemoteTrack() {
            loop.execute(() -> {
                if (!closed) {
                    listener.onRemoteTrack(callId);
                }
            });
        }
    }
}
