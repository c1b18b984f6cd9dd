package com.pulse.call;

import cn.hutool.core.util.IdUtil;
import cn.hutool.core.util.StrUtil;
import com.pulse.config.PulseProperties;
import com.pulse.entity.dto.call.CallEndReason;
import com.pulse.entity.dto.call.CallHistoryEntry;
import com.pulse.entity.dto.call.CallSession;
import com.pulse.entity.dto.call.CallStateSnapshot;
import com.pulse.entity.dto.call.CallStatus;
import com.pulse.entity.dto.call.CallUpdate;
import com.pulse.exception.CallStateException;
import com.pulse.exception.MediaUnavailableException;
import com.pulse.exception.NegotiationException;
import com.pulse.exception.SignalingException;
import com.pulse.metrics.CallMetrics;
import com.pulse.publisher.WakeNotifier;
import com.pulse.publisher.WakeSignal;
import com.pulse.repository.CallHistoryRepository;
import com.pulse.rtc.CaptureHandle;
import com.pulse.rtc.GatedRemotePlayback;
import com.pulse.rtc.LocalMediaSource;
import com.pulse.rtc.PeerTransportFactory;
import com.pulse.rtc.RemotePlayback;
import com.pulse.service.SignalingChannel;
import com.pulse.service.Subscription;
import com.pulse.tools.EventLoop;
import com.pulse.tools.ExecutorEventLoop;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 一个身份对应一个通话代理，同一时刻最多持有一个通话。
 * <p>
 * 状态只沿 OFFERING → RINGING → CONNECTING → CONNECTED 前进，任意非终态都可以进入终态；
 * 收到跳跃式的前进通知时逐级补齐中间状态，倒退的通知直接忽略。
 * 存储通知、传输回调、看门狗和对外API全部投递到同一个事件循环上串行处理。
 */
@Slf4j
public class CallAgent implements AutoCloseable {

    private final String localId;
    private final String displayName;
    private final SignalingChannel channel;
    private final PeerTransportFactory transportFactory;
    private final LocalMediaSource mediaSource;
    private final RemotePlayback playback;
    private final EventLoop loop;
    private final PulseProperties.Call config;
    private final CallMetrics metrics;
    private final CallHistoryRepository historyRepository;
    private final WakeNotifier wakeNotifier;
    private final Executor wakeExecutor;

    private final WatchdogTimers timers;
    private final GlareArbitrator arbitrator = new GlareArbitrator();
    private final IncomingCallDispatcher dispatcher;
    private final List<CallStateListener> listeners = new CopyOnWriteArrayList<>();

    // 以下字段只在事件循环上读写
    private ActiveCall current;
    private CaptureHandle capture;
    private boolean talking;
    private CallStatus lastTerminalStatus;
    private CallEndReason lastEndReason;
    private boolean started;
    private boolean closed;

    private volatile CallStateSnapshot snapshot;

    @Builder
    public CallAgent(String localId, String displayName, SignalingChannel channel,
                     PeerTransportFactory transportFactory, LocalMediaSource mediaSource, RemotePlayback playback,
                     EventLoop loop, PulseProperties.Call config, CallMetrics metrics,
                     CallHistoryRepository historyRepository, WakeNotifier wakeNotifier, Executor wakeExecutor) {
        if (StrUtil.isBlank(localId)) {
            throw new IllegalArgumentException("localId不能为空");
        }
        this.localId = localId;
        this.displayName = StrUtil.blankToDefault(displayName, localId);
        this.channel = Objects.requireNonNull(channel, "channel");
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
        this.mediaSource = Objects.requireNonNull(mediaSource, "mediaSource");
        this.playback = playback != null ? playback : new GatedRemotePlayback(localId);
        this.loop = Objects.requireNonNull(loop, "loop");
        this.config = config != null ? config : new PulseProperties.Call();
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.historyRepository = Objects.requireNonNull(historyRepository, "historyRepository");
        this.wakeNotifier = wakeNotifier;
        this.wakeExecutor = wakeExecutor != null ? wakeExecutor : Runnable::run;
        this.timers = new WatchdogTimers(loop);
        this.dispatcher = new IncomingCallDispatcher(localId, channel, loop, this.config.getOfferStaleAfter(), this);
        this.playback.setMuted(true);
        this.snapshot = buildSnapshot();
    }

    /**
     * 开始监听来电
     */
    public CompletableFuture<Void> start() {
        return loop.submit(() -> {
            if (!started && !closed) {
                started = true;
                dispatcher.start();
                log.info("通话代理已启动 user={}", localId);
            }
            return null;
        });
    }

    /**
     * 发起呼叫。已有通话时先结束当前通话。
     * 本地采集失败时以 {@link MediaUnavailableException} 结束。
     */
    public CompletableFuture<CallSession> makeCall(String calleeId, String calleeName) {
        return loop.submit(() -> doMakeCall(calleeId, calleeName));
    }

    /**
     * 手动接听当前的来电
     */
    public CompletableFuture<CallSession> answerCall() {
        return loop.submit(() -> {
            ActiveCall call = current;
            if (call == null || call.role != NegotiationEngine.Role.ANSWERER || call.answering) {
                throw new CallStateException("没有待接听的来电");
            }
            return answer(call);
        });
    }

    public CompletableFuture<Boolean> rejectCall() {
        return loop.submit(() -> {
            ActiveCall call = current;
            if (call == null || call.role != NegotiationEngine.Role.ANSWERER || call.answering) {
                throw new CallStateException("没有待拒绝的来电");
            }
            terminate(call, CallStatus.REJECTED, CallEndReason.REJECTED, true);
            return true;
        });
    }

    /**
     * 结束当前通话，没有通话时返回 false，重复调用没有副作用
     */
    public CompletableFuture<Boolean> endCall() {
        return loop.submit(() -> {
            ActiveCall call = current;
            if (call == null) {
                return false;
            }
            terminate(call, CallStatus.ENDED, CallEndReason.NORMAL, true);
            return true;
        });
    }

    /**
     * 按下或松开通话键。没有通话时返回 false
     */
    public CompletableFuture<Boolean> toggleTalk(boolean isTalking) {
        return loop.submit(() -> doToggleTalk(isTalking));
    }

    public CallStateSnapshot state() {
        return snapshot;
    }

    public String localId() {
        return localId;
    }

    public void addListener(CallStateListener listener) {
        listeners.add(listener);
    }

    public void removeListener(CallStateListener listener) {
        listeners.remove(listener);
    }

    /**
     * 结束通话并停止监听，释放采集设备
     */
    public CompletableFuture<Void> shutdown() {
        return loop.submit(() -> {
            if (closed) {
                return null;
            }
            if (current != null) {
                terminate(current, CallStatus.ENDED, CallEndReason.DISCONNECTED, true);
            }
            closed = true;
            dispatcher.stop();
            timers.cancelAll();
            mediaSource.release();
            capture = null;
            log.info("通话代理已关闭 user={}", localId);
            return null;
        });
    }

    /**
     * 阻塞直到关闭完成，自有的事件循环一并关闭。不要在事件循环线程上调用
     */
    @Override
    public void close() {
        if (loop.inEventLoop()) {
            throw new IllegalStateException("不能在事件循环线程上同步关闭代理");
        }
        shutdown().join();
        if (loop instanceof ExecutorEventLoop) {
            ((ExecutorEventLoop) loop).close();
        }
    }

    // ------------------------------------------------------------------ 呼出

    private CallSession doMakeCall(String calleeId, String calleeName) {
        if (closed) {
            throw new CallStateException("通话代理已关闭");
        }
        if (StrUtil.isBlank(calleeId)) {
            throw new IllegalArgumentException("被叫不能为空");
        }
        if (localId.equals(calleeId)) {
            throw new IllegalArgumentException("不能呼叫自己");
        }
        if (current != null) {
            log.info("发起新呼叫前结束当前通话 callId={}", current.callId);
            terminate(current, CallStatus.ENDED, CallEndReason.NORMAL, true);
        }

        CaptureHandle handle = acquireCapture();
        String callId = channel.allocateId();
        ActiveCall call = new ActiveCall(callId, NegotiationEngine.Role.OFFERER, calleeId);
        current = call;
        try {
            call.engine = newEngine(call, handle);
            CallSession draft = CallSession.builder()
                    .callId(callId)
                    .callerId(localId)
                    .callerName(displayName)
                    .calleeId(calleeId)
                    .calleeName(StrUtil.blankToDefault(calleeName, calleeId))
                    .startedAt(call.startedAt)
                    .build();
            call.record = call.engine.startOffer(draft);
            enter(call, CallStatus.OFFERING, null);
            channel.endOnDisconnect(localId, callId);
            call.disconnectGuarded = true;
            call.recordSubscription = channel.subscribe(callId,
                    (id, record) -> loop.execute(() -> onRecord(call, record)));
        } catch (NegotiationException ex) {
            log.error("发起呼叫失败 callId={}", callId, ex);
            terminate(call, CallStatus.ENDED, CallEndReason.NEGOTIATION_FAILED, true);
            throw ex;
        } catch (SignalingException ex) {
            log.error("写入呼叫记录失败 callId={}", callId, ex);
            terminate(call, CallStatus.ENDED, CallEndReason.UNKNOWN, true);
            throw ex;
        }
        metrics.callStarted();
        sendWake(call.record);
        publish();
        return call.record.copy();
    }

    // ------------------------------------------------------------------ 来电

    /**
     * 由来电分发器在事件循环上调用，已经过滤掉了自己发起的、非 OFFERING 的和过期的来电
     */
    void onInboundOffer(CallSession record) {
        if (closed) {
            return;
        }
        ActiveCall call = current;
        if (call == null) {
            acceptIncoming(record, config.isAutoAnswer());
            return;
        }
        if (call.callId.equals(record.getCallId())) {
            return;
        }
        GlareArbitrator.Decision decision =
                arbitrator.arbitrate(localId, call.role, call.remoteId, call.status, record);
        log.info("忙线时收到来电 callId={} caller={} decision={}", record.getCallId(), record.getCallerId(), decision);
        metrics.glare(decision.name());
        switch (decision) {
            case YIELD -> {
                terminate(call, CallStatus.ENDED, CallEndReason.GLARE_YIELD, true);
                acceptIncoming(record, true);
            }
            case BUSY, KEEP -> markBusy(record);
        }
    }

    private void acceptIncoming(CallSession record, boolean autoAnswer) {
        ActiveCall call = new ActiveCall(record.getCallId(), NegotiationEngine.Role.ANSWERER, record.getCallerId());
        call.record = record.copy();
        current = call;
        enter(call, CallStatus.RINGING, null);
        call.recordSubscription = channel.subscribe(call.callId,
                (id, latest) -> loop.execute(() -> onRecord(call, latest)));
        publish();
        if (!autoAnswer) {
            log.info("来电等待接听 callId={} caller={}", call.callId, call.remoteId);
            return;
        }
        try {
            answer(call);
        } catch (RuntimeException ex) {
            log.error("自动接听失败 callId={}", call.callId, ex);
        }
    }

    private CallSession answer(ActiveCall call) {
        call.answering = true;
        try {
            CaptureHandle handle = acquireCapture();
            call.engine = newEngine(call, handle);
            if (!call.engine.claim()) {
                terminate(call, CallStatus.ENDED, CallEndReason.ALREADY_CLAIMED, false);
                return null;
            }
            channel.endOnDisconnect(localId, call.callId);
            call.disconnectGuarded = true;
            if (!call.engine.acceptOffer()) {
                terminate(call, CallStatus.ENDED, CallEndReason.REMOTE_ENDED, false);
                return null;
            }
            call.record = channel.get(call.callId).orElse(call.record);
            advance(call, CallStatus.CONNECTING);
        } catch (MediaUnavailableException ex) {
            terminate(call, CallStatus.ENDED, CallEndReason.MEDIA_UNAVAILABLE, true);
            throw ex;
        } catch (NegotiationException ex) {
            terminate(call, CallStatus.ENDED, CallEndReason.NEGOTIATION_FAILED, true);
            throw ex;
        } catch (SignalingException ex) {
            log.error("接听时信令写入失败 callId={}", call.callId, ex);
            terminate(call, CallStatus.ENDED, CallEndReason.UNKNOWN, true);
            throw ex;
        }
        publish();
        return call.record == null ? null : call.record.copy();
    }

    private void markBusy(CallSession record) {
        long now = loop.currentTimeMillis();
        try {
            boolean marked = channel.guardedUpdate(record.getCallId(),
                    latest -> latest.getStatus() == CallStatus.OFFERING,
                    CallUpdate.status(CallStatus.BUSY).withEndedAt(now));
            if (marked) {
                historyRepository.save(CallHistoryEntry.from(record, CallStatus.BUSY, CallEndReason.BUSY, now, null));
            }
        } catch (SignalingException ex) {
            log.warn("标记占线失败 callId={} reason={}", record.getCallId(), ex.getMessage());
        }
    }

    // ------------------------------------------------------------------ 记录变化

    private void onRecord(ActiveCall call, CallSession record) {
        if (call.tornDown || current != call) {
            return;
        }
        if (record == null) {
            terminate(call, CallStatus.ENDED, CallEndReason.REMOTE_ENDED, false);
            return;
        }
        CallStatus remote = record.getStatus();
        if (remote == null) {
            return;
        }
        if (remote.isTerminal()) {
            call.record = record;
            terminate(call, remoteTerminal(remote), remoteReason(remote), false);
            return;
        }
        if (call.role == NegotiationEngine.Role.ANSWERER && !call.answering && remote != CallStatus.OFFERING) {
            // 同一身份的其他设备已经接听
            terminate(call, CallStatus.ENDED, CallEndReason.ALREADY_CLAIMED, false);
            return;
        }
        if (remote.rank() < call.status.rank()) {
            log.debug("忽略过时的记录通知 callId={} local={} remote={}", call.callId, call.status, remote);
            return;
        }
        call.record = record;
        advance(call, remote);
        if (call.engine != null) {
            call.engine.onRemoteRecord(record);
        }
        if (!call.tornDown) {
            applyFloorControl();
            publish();
        }
    }

    private void onTransportConnected(ActiveCall call) {
        if (call.tornDown || current != call || call.status == CallStatus.CONNECTED) {
            return;
        }
        advance(call, CallStatus.CONNECTED);
        try {
            channel.guardedUpdate(call.callId,
                    record -> record.getStatus() == CallStatus.CONNECTING,
                    CallUpdate.status(CallStatus.CONNECTED));
        } catch (SignalingException ex) {
            log.warn("写入CONNECTED失败 callId={} reason={}", call.callId, ex.getMessage());
        }
        applyFloorControl();
        publish();
    }

    // ------------------------------------------------------------------ 状态机

    /**
     * 前进到 target，逐级经过中间状态；不是前进时忽略
     */
    private void advance(ActiveCall call, CallStatus target) {
        if (call.tornDown || target.isTerminal() || call.status == null) {
            return;
        }
        if (target.rank() <= call.status.rank()) {
            if (target.rank() < call.status.rank()) {
                log.debug("忽略倒退的状态通知 callId={} local={} remote={}", call.callId, call.status, target);
            }
            return;
        }
        while (!call.tornDown && call.status.rank() < target.rank()) {
            CallStatus step = call.status.next();
            if (!call.status.canTransitionTo(step)) {
                log.warn("非法的状态迁移 callId={} {} -> {}", call.callId, call.status, step);
                return;
            }
            enter(call, step, null);
        }
    }

    private void enter(ActiveCall call, CallStatus next, CallEndReason reason) {
        CallStatus from = call.status;
        call.status = next;
        log.info("通话状态 {} -> {} callId={} user={}", from, next, call.callId, localId);
        for (CallStateListener listener : listeners) {
            try {
                listener.onTransition(call.callId, from, next, reason);
            } catch (RuntimeException ex) {
                log.warn("状态监听回调异常 callId={}", call.callId, ex);
            }
        }
        if (next.isTerminal()) {
            return;
        }
        switch (next) {
            case OFFERING -> timers.arm(call.callId, next, config.getOfferingTimeout(), () -> onWatchdog(call));
            case RINGING -> {
                if (call.role == NegotiationEngine.Role.OFFERER) {
                    timers.arm(call.callId, next, config.getRingingTimeout(), () -> onWatchdog(call));
                } else {
                    timers.cancel(call.callId);
                }
            }
            case CONNECTING -> timers.arm(call.callId, next, config.getConnectingTimeout(), () -> onWatchdog(call));
            case CONNECTED -> {
                timers.cancel(call.callId);
                call.connectedAt = loop.currentTimeMillis();
                metrics.setupTime(call.connectedAt - call.startedAt);
            }
            default -> {
            }
        }
    }

    private void onWatchdog(ActiveCall call) {
        if (call.tornDown || current != call) {
            return;
        }
        log.warn("通话超时 callId={} status={}", call.callId, call.status);
        terminate(call, CallStatus.ENDED, CallEndReason.TIMEOUT, true);
    }

    /**
     * 结束通话，同一个通话只执行一次。
     *
     * @param initiatedLocally 本方发起时尝试把终态写回存储并归档
     */
    private void terminate(ActiveCall call, CallStatus status, CallEndReason reason, boolean initiatedLocally) {
        if (call.tornDown) {
            return;
        }
        call.tornDown = true;
        timers.cancel(call.callId);
        if (call.recordSubscription != null) {
            call.recordSubscription.unsubscribe();
        }
        if (call.engine != null) {
            call.engine.close();
        }
        if (current == call) {
            current = null;
            talking = false;
            if (capture != null) {
                capture.setOutboundEnabled(false);
            }
            playback.setMuted(true);
        }
        if (call.status != null && call.status.canTransitionTo(status)) {
            enter(call, status, reason);
        }
        lastTerminalStatus = status;
        lastEndReason = reason;
        metrics.outcome(status, reason);
        writeTerminal(call, status, reason, initiatedLocally);
        publish();
    }

    private void writeTerminal(ActiveCall call, CallStatus status, CallEndReason reason, boolean initiatedLocally) {
        long now = loop.currentTimeMillis();
        try {
            // 同一身份的其他设备可能登记了同一个通话，只撤销自己登记的
            if (call.disconnectGuarded) {
                channel.cancelOnDisconnect(localId, call.callId);
            }
            if (initiatedLocally && call.record != null) {
                CallUpdate update = CallUpdate.status(status).withEndedAt(now).withActiveSpeaker(null);
                if (call.connectedAt != null) {
                    update.withDuration(now - call.connectedAt);
                }
                boolean claimed = channel.guardedUpdate(call.callId,
                        record -> record.getStatus() != null && !record.getStatus().isTerminal(), update);
                if (claimed) {
                    historyRepository.save(CallHistoryEntry.from(call.record, status, reason, now, call.connectedAt));
                } else {
                    log.debug("终态已由对方写入 callId={}", call.callId);
                }
            } else if (!initiatedLocally && isTerminalRecord(call.record)) {
                // 终态可能来自断线兜底，没有一方赢得终态写入；归档按callId去重
                historyRepository.save(CallHistoryEntry.from(call.record, status, reason, now, call.connectedAt));
            }
            if (call.role == NegotiationEngine.Role.OFFERER && call.record != null) {
                channel.remove(call.callId);
            }
        } catch (SignalingException ex) {
            log.warn("写入通话终态失败 callId={} reason={}", call.callId, ex.getMessage());
        }
    }

    private static boolean isTerminalRecord(CallSession record) {
        return record != null && record.getStatus() != null && record.getStatus().isTerminal();
    }

    private static CallStatus remoteTerminal(CallStatus remote) {
        return switch (remote) {
            case REJECTED, BUSY -> remote;
            default -> CallStatus.ENDED;
        };
    }

    private static CallEndReason remoteReason(CallStatus remote) {
        return switch (remote) {
            case REJECTED -> CallEndReason.REJECTED;
            case BUSY -> CallEndReason.BUSY;
            default -> CallEndReason.REMOTE_ENDED;
        };
    }

    // ------------------------------------------------------------------ 对讲

    private boolean doToggleTalk(boolean isTalking) {
        ActiveCall call = current;
        if (call == null) {
            log.debug("没有通话，忽略对讲键 user={}", localId);
            return false;
        }
        talking = isTalking;
        if (capture != null) {
            capture.setOutboundEnabled(isTalking);
        }
        try {
            if (isTalking) {
                channel.update(call.callId, CallUpdate.create().withActiveSpeaker(localId));
            } else {
                channel.guardedUpdate(call.callId,
                        record -> localId.equals(record.getActiveSpeakerId()),
                        CallUpdate.create().withActiveSpeaker(null));
            }
        } catch (SignalingException ex) {
            log.warn("更新发言人失败 callId={} reason={}", call.callId, ex.getMessage());
        }
        publish();
        return true;
    }

    private void applyFloorControl() {
        ActiveCall call = current;
        boolean play = call != null && call.record != null
                && FloorControl.shouldPlayRemote(call.status, call.record.getActiveSpeakerId(), localId, call.remoteId);
        playback.setMuted(!play);
    }

    // ------------------------------------------------------------------ 其它

    private CaptureHandle acquireCapture() {
        CaptureHandle handle = mediaSource.acquire();
        handle.setOutboundEnabled(false);
        capture = handle;
        talking = false;
        return handle;
    }

    private NegotiationEngine newEngine(ActiveCall call, CaptureHandle handle) {
        return new NegotiationEngine(call.callId, call.role, channel, transportFactory, loop, handle,
                config.getRenegotiationCooldown(), metrics, call);
    }

    private void sendWake(CallSession record) {
        if (wakeNotifier == null) {
            return;
        }
        WakeSignal signal = WakeSignal.builder()
                .id(IdUtil.fastSimpleUUID())
                .callId(record.getCallId())
                .callerId(record.getCallerId())
                .callerName(record.getCallerName())
                .calleeId(record.getCalleeId())
                .sentAt(loop.currentTimeMillis())
                .build();
        try {
            wakeExecutor.execute(() -> {
                try {
                    wakeNotifier.notifyCallee(signal);
                } catch (RuntimeException ex) {
                    log.warn("来电唤醒发送失败 callId={} reason={}", signal.getCallId(), ex.getMessage());
                }
            });
        } catch (RejectedExecutionException ex) {
            log.warn("唤醒线程池已满，放弃通知 callId={}", signal.getCallId());
        }
    }

    private void publish() {
        CallStateSnapshot next = buildSnapshot();
        if (next.equals(snapshot)) {
            return;
        }
        snapshot = next;
        for (CallStateListener listener : listeners) {
            try {
                listener.onStateChanged(next);
            } catch (RuntimeException ex) {
                log.warn("状态监听回调异常 user={}", localId, ex);
            }
        }
    }

    private CallStateSnapshot buildSnapshot() {
        ActiveCall call = current;
        boolean pendingIncoming = call != null && call.role == NegotiationEngine.Role.ANSWERER && !call.answering;
        CallSession record = call == null || call.record == null ? null : call.record.copy();
        return CallStateSnapshot.builder()
                .userId(localId)
                .status(call == null ? CallStatus.ENDED : call.status)
                .activeCall(pendingIncoming ? null : record)
                .incomingCall(pendingIncoming ? record : null)
                .talking(talking)
                .remotePlaybackMuted(playback.isMuted())
                .remoteTrackReady(call != null && call.remoteTrackReady)
                .lastTerminalStatus(lastTerminalStatus)
                .lastEndReason(lastEndReason)
                .build();
    }

    /**
     * 当前通话的本地状态，只在事件循环上访问
     */
    private final class ActiveCall implements NegotiationEngine.Listener {
        private final String callId;
        private final NegotiationEngine.Role role;
        private final String remoteId;
        private final long startedAt;

        private CallStatus status;
        private CallSession record;
        private NegotiationEngine engine;
        private Subscription recordSubscription;
        private boolean answering;
        private boolean tornDown;
        private boolean disconnectGuarded;
        private boolean remoteTrackReady;
        private Long connectedAt;

        private ActiveCall(String callId, NegotiationEngine.Role role, String remoteId) {
            this.callId = callId;
            this.role = role;
            this.remoteId = remoteId;
            this.startedAt = loop.currentTimeMillis();
        }

        @Override
        public void onTransportConnected(String id) {
            CallAgent.this.onTransportConnected(this);
        }

        @Override
        public void onNegotiationFailed(String id, Exception cause) {
            if (!tornDown) {
                log.error("协商失败，结束通话 callId={}", callId, cause);
                terminate(this, CallStatus.ENDED, CallEndReason.NEGOTIATION_FAILED, true);
            }
        }

        @Override
        public void onRemoteTrack(String id) {
            if (!tornDown && current == this) {
                remoteTrackReady = true;
                publish();
            }
        }
    }
}
