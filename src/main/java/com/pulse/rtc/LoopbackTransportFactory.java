package com.pulse.rtc;

import com.pulse.entity.dto.call.IceCandidate;
import com.pulse.entity.dto.call.SdpType;
import com.pulse.entity.dto.call.SessionDescription;
import com.pulse.exception.NegotiationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 进程内模拟的点对点传输。
 * <p>
 * 会话描述格式为 {@code loopback:{transportKey}:{epoch}}，每次设置本地描述后按配置数量产生候选地址；
 * 双方描述都已设置且收到对端当前代际的候选地址后进入 CONNECTED。
 */
@Slf4j
public class LoopbackTransportFactory implements PeerTransportFactory {

    private static final String DESCRIPTION_PREFIX = "loopback:";
    private static final String CANDIDATE_PREFIX = "candidate:";

    private final int candidatesPerDescription;
    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, LoopbackTransport> transports = new ConcurrentHashMap<>();

    public LoopbackTransportFactory(int candidatesPerDescription) {
        this.candidatesPerDescription = Math.max(1, candidatesPerDescription);
    }

    @Override
    public PeerTransport create(String callId, PeerTransport.Observer observer) {
        String key = "t" + sequence.incrementAndGet();
        LoopbackTransport transport = new LoopbackTransport(key, callId, observer);
        transports.put(key, transport);
        log.debug("创建模拟传输 key={} callId={}", key, callId);
        return transport;
    }

    /**
     * 某个通话下尚未关闭的传输，按创建顺序
     */
    public List<LoopbackTransport> transportsFor(String callId) {
        List<LoopbackTransport> result = new ArrayList<>();
        for (LoopbackTransport transport : transports.values()) {
            if (transport.callId.equals(callId)) {
                result.add(transport);
            }
        }
        result.sort((a, b) -> Long.compare(a.ordinal, b.ordinal));
        return result;
    }

    public class LoopbackTransport implements PeerTransport {

        private final String key;
        private final String callId;
        private final long ordinal;
        private final PeerTransport.Observer observer;
        private final List<IceCandidate> applied = new ArrayList<>();

        private SignalingState signalingState = SignalingState.STABLE;
        private TransportState connectionState = TransportState.NEW;
        private long localEpoch;
        private boolean localSet;
        private String remoteKey;
        private long remoteEpoch;
        private long maxRemoteCandidateEpoch;
        private boolean remoteTrackFired;
        private CaptureHandle outbound;

        LoopbackTransport(String key, String callId, PeerTransport.Observer observer) {
            this.key = key;
            this.callId = callId;
            this.ordinal = sequence.get();
            this.observer = observer;
        }

        public String key() {
            return key;
        }

        @Override
        public synchronized SessionDescription createOffer(boolean iceRestart) {
            ensureOpen();
            localEpoch++;
            return SessionDescription.offer(DESCRIPTION_PREFIX + key + ":" + localEpoch);
        }

        @Override
        public synchronized SessionDescription createAnswer() {
            ensureOpen();
            if (signalingState != SignalingState.HAVE_REMOTE_OFFER) {
                throw new NegotiationException("没有待应答的远端offer state=" + signalingState);
            }
            localEpoch++;
            return SessionDescription.answer(DESCRIPTION_PREFIX + key + ":" + localEpoch);
        }

        @Override
        public synchronized void setLocalDescription(SessionDescription description) {
            ensureOpen();
            Parsed parsed = parseDescription(description);
            if (!key.equals(parsed.key)) {
                throw new NegotiationException("本地描述不属于该传输 key=" + parsed.key);
            }
            if (description.getType() == SdpType.OFFER && signalingState == SignalingState.STABLE) {
                signalingState = SignalingState.HAVE_LOCAL_OFFER;
            } else if (description.getType() == SdpType.ANSWER && signalingState == SignalingState.HAVE_REMOTE_OFFER) {
                signalingState = SignalingState.STABLE;
            } else {
                throw new NegotiationException("非法的本地描述 type=" + description.getType() + " state=" + signalingState);
            }
            localSet = true;
            for (int i = 0; i < candidatesPerDescription; i++) {
                observer.onLocalCandidate(new IceCandidate(
                        CANDIDATE_PREFIX + key + ":" + parsed.epoch + ":" + i
                                + " 1 udp 2122260223 127.0.0.1 " + (50_000 + i) + " typ host",
                        "0", 0));
            }
            maybeConnect();
        }

        @Override
        public synchronized void setRemoteDescription(SessionDescription description) {
            ensureOpen();
            Parsed parsed = parseDescription(description);
            if (description.getType() == SdpType.OFFER && signalingState == SignalingState.STABLE) {
                signalingState = SignalingState.HAVE_REMOTE_OFFER;
            } else if (description.getType() == SdpType.ANSWER && signalingState == SignalingState.HAVE_LOCAL_OFFER) {
                signalingState = SignalingState.STABLE;
            } else {
                throw new NegotiationException("非法的远端描述 type=" + description.getType() + " state=" + signalingState);
            }
            remoteKey = parsed.key;
            remoteEpoch = parsed.epoch;
            if (!remoteTrackFired) {
                remoteTrackFired = true;
                observer.onRemoteTrack();
            }
            if (connectionState == TransportState.NEW || connectionState.isFailure()) {
                changeState(TransportState.CONNECTING);
            }
            maybeConnect();
        }

        @Override
        public synchronized void addIceCandidate(IceCandidate candidate) {
            ensureOpen();
            if (remoteKey == null) {
                throw new NegotiationException("远端描述尚未设置");
            }
            String raw = candidate.getCandidate();
            if (raw == null || !raw.startsWith(CANDIDATE_PREFIX)) {
                throw new NegotiationException("无法解析的候选地址 " + raw);
            }
            String token = raw.substring(CANDIDATE_PREFIX.length()).split(" ", 2)[0];
            String[] parts = token.split(":");
            if (parts.length != 3 || !parts[0].equals(remoteKey)) {
                throw new NegotiationException("候选地址不属于当前对端 " + token);
            }
            long epoch = parseLong(parts[1]);
            applied.add(candidate);
            maxRemoteCandidateEpoch = Math.max(maxRemoteCandidateEpoch, epoch);
            maybeConnect();
        }

        @Override
        public synchronized SignalingState signalingState() {
            return signalingState;
        }

        @Override
        public synchronized TransportState connectionState() {
            return connectionState;
        }

        @Override
        public synchronized void attachOutbound(CaptureHandle capture) {
            this.outbound = capture;
        }

        @Override
        public synchronized void close() {
            if (connectionState == TransportState.CLOSED) {
                return;
            }
            signalingState = SignalingState.CLOSED;
            connectionState = TransportState.CLOSED;
            transports.remove(key);
            log.debug("关闭模拟传输 key={}", key);
        }

        /**
         * 模拟链路中断
         */
        public synchronized void simulateFailure() {
            ensureOpen();
            changeState(TransportState.FAILED);
        }

        public synchronized List<IceCandidate> appliedCandidates() {
            return List.copyOf(applied);
        }

        public synchronized CaptureHandle outbound() {
            return outbound;
        }

        public synchronized boolean isClosed() {
            return connectionState == TransportState.CLOSED;
        }

        private void maybeConnect() {
            if (localSet && remoteKey != null && signalingState == SignalingState.STABLE
                    && maxRemoteCandidateEpoch >= remoteEpoch && connectionState != TransportState.CONNECTED) {
                changeState(TransportState.CONNECTED);
            }
        }

        private void changeState(TransportState next) {
            connectionState = next;
            observer.onConnectionStateChange(next);
        }

        private void ensureOpen() {
            if (connectionState == TransportState.CLOSED) {
                throw new NegotiationException("传输已关闭 key=" + key);
            }
        }
    }

    private static Parsed parseDescription(SessionDescription description) {
        String payload = description == null ? null : description.getPayload();
        if (payload == null || !payload.startsWith(DESCRIPTION_PREFIX) || description.getType() == null) {
            throw new NegotiationException("无法解析的会话描述 " + payload);
        }
        String body = payload.substring(DESCRIPTION_PREFIX.length());
        int split = body.lastIndexOf(':');
        if (split <= 0) {
            throw new NegotiationException("无法解析的会话描述 " + payload);
        }
        return new Parsed(body.substring(0, split), parseLong(body.substring(split + 1)));
    }

    private static long parseLong(String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            throw new NegotiationException("无法解析的代际 " + raw, ex);
        }
    }

    private record Parsed(String key, long epoch) {
    }
}
