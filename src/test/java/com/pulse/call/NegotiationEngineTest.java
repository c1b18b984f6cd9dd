package com.pulse.call;

import com.pulse.entity.dto.call.CallSession;
import com.pulse.entity.dto.call.CallStatus;
import com.pulse.entity.dto.call.IceCandidate;
import com.pulse.metrics.CallMetrics;
import com.pulse.rtc.LoopbackTransportFactory;
import com.pulse.rtc.TransportState;
import com.pulse.rtc.VirtualMediaSource;
import com.pulse.service.impl.InMemorySignalingChannel;
import com.pulse.tools.ManualEventLoop;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NegotiationEngineTest {

    private static final String CALL_ID = "call-1";

    private ManualEventLoop loop;
    private InMemorySignalingChannel channel;
    private LoopbackTransportFactory transports;
    private CallMetrics metrics;
    private RecordingListener offererEvents;
    private RecordingListener answererEvents;
    private NegotiationEngine offerer;
    private NegotiationEngine answerer;

    private static final class RecordingListener implements NegotiationEngine.Listener {
        private int connected;
        private final List<Exception> failures = new ArrayList<>();

        @Override
        public void onTransportConnected(String callId) {
            connected++;
        }

        @Override
        public void onNegotiationFailed(String callId, Exception cause) {
            failures.add(cause);
        }
    }

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        channel = new InMemorySignalingChannel();
        transports = new LoopbackTransportFactory(2);
        metrics = new CallMetrics(new SimpleMeterRegistry());
        offererEvents = new RecordingListener();
        answererEvents = new RecordingListener();
        offerer = engine(NegotiationEngine.Role.OFFERER, offererEvents);
        CallSession draft = CallSession.builder()
                .callId(CALL_ID)
                .callerId("a1")
                .calleeId("b2")
                .startedAt(loop.currentTimeMillis())
                .build();
        offerer.startOffer(draft);
        answerer = engine(NegotiationEngine.Role.ANSWERER, answererEvents);
    }

    private NegotiationEngine engine(NegotiationEngine.Role role, NegotiationEngine.Listener listener) {
        return new NegotiationEngine(CALL_ID, role, channel, transports, loop, new VirtualMediaSource().acquire(),
                Duration.ofSeconds(2), metrics, listener);
    }

    private LoopbackTransportFactory.LoopbackTransport offererTransport() {
        return transports.transportsFor(CALL_ID).get(0);
    }

    private LoopbackTransportFactory.LoopbackTransport answererTransport() {
        return transports.transportsFor(CALL_ID).get(1);
    }

    private IceCandidate remoteCandidate(int index) {
        return new IceCandidate("candidate:" + offererTransport().key() + ":1:" + index
                + " 1 udp 2122260223 10.0.0.1 6000" + index + " typ host", "0", 0);
    }

    @Test
    void startOfferWritesOfferingRecord() {
        CallSession record = channel.get(CALL_ID).orElseThrow();

        assertThat(record.getStatus()).isEqualTo(CallStatus.OFFERING);
        assertThat(record.getOffer()).isNotNull();
        assertThat(record.getAnswer()).isNull();
    }

    @Test
    void candidatesBeforeRemoteDescriptionAreBufferedInArrivalOrder() {
        answerer.onRemoteCandidate(remoteCandidate(7));
        answerer.onRemoteCandidate(remoteCandidate(8));
        answerer.onRemoteCandidate(remoteCandidate(7));
        assertThat(answerer.pendingCandidateCount()).isEqualTo(2);
        assertThat(answerer.isRemoteDescriptionSet()).isFalse();

        assertThat(answerer.claim()).isTrue();
        assertThat(answerer.acceptOffer()).isTrue();

        assertThat(answerer.pendingCandidateCount()).isZero();
        assertThat(answererTransport().appliedCandidates())
                .containsExactly(remoteCandidate(7), remoteCandidate(8));
    }

    @Test
    void duplicateDeliveryHasNoEffect() {
        answerer.claim();
        answerer.acceptOffer();
        loop.runUntilIdle();
        int applied = answererTransport().appliedCandidates().size();
        assertThat(applied).isEqualTo(2);

        for (IceCandidate candidate : offererTransport().appliedCandidates()) {
            answerer.onRemoteCandidate(candidate);
        }
        for (IceCandidate candidate : answererTransport().appliedCandidates()) {
            answerer.onRemoteCandidate(candidate);
        }
        loop.runUntilIdle();

        assertThat(answererTransport().appliedCandidates()).hasSize(applied);
    }

    @Test
    void secondClaimFails() {
        NegotiationEngine otherDevice = engine(NegotiationEngine.Role.ANSWERER, new RecordingListener());

        assertThat(answerer.claim()).isTrue();
        assertThat(otherDevice.claim()).isFalse();
    }

    @Test
    void fullExchangeConnectsBothTransports() {
        answerer.claim();
        answerer.acceptOffer();
        loop.runUntilIdle();

        offerer.onRemoteRecord(channel.get(CALL_ID).orElseThrow());
        loop.runUntilIdle();

        assertThat(channel.get(CALL_ID).orElseThrow().getStatus()).isEqualTo(CallStatus.CONNECTING);
        assertThat(offererTransport().connectionState()).isEqualTo(TransportState.CONNECTED);
        assertThat(answererTransport().connectionState()).isEqualTo(TransportState.CONNECTED);
        assertThat(offererEvents.connected).isEqualTo(1);
        assertThat(answererEvents.connected).isEqualTo(1);
        assertThat(offererEvents.failures).isEmpty();
    }

    @Test
    void onlyOffererRestartsAndCooldownBlocksRepeats() {
        fullExchangeConnectsBothTransports();
        String firstOffer = channel.get(CALL_ID).orElseThrow().getOffer().getPayload();

        answererTransport().simulateFailure();
        loop.runUntilIdle();
        assertThat(channel.get(CALL_ID).orElseThrow().getOffer().getPayload()).isEqualTo(firstOffer);
        assertThat(answerer.isRenegotiating()).isFalse();

        offererTransport().simulateFailure();
        loop.runUntilIdle();
        CallSession restarted = channel.get(CALL_ID).orElseThrow();
        assertThat(restarted.getOffer().getPayload()).isNotEqualTo(firstOffer);
        assertThat(restarted.getAnswer()).isNull();
        assertThat(offerer.isRenegotiating()).isTrue();
        assertThat(metrics.count("pulse.call.renegotiation")).isEqualTo(1d);

        loop.advance(Duration.ofSeconds(2));
        assertThat(offerer.isRenegotiating()).isFalse();
    }

    @Test
    void closedEngineIgnoresLateEvents() {
        answerer.claim();
        answerer.acceptOffer();
        answerer.close();
        answerer.close();
        loop.runUntilIdle();

        answerer.onRemoteCandidate(remoteCandidate(9));

        assertThat(answerer.isClosed()).isTrue();
        assertThat(answerer.pendingCandidateCount()).isZero();
        assertThat(answererEvents.connected).isZero();
    }
}
