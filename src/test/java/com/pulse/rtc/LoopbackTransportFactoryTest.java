package com.pulse.rtc;

import com.pulse.entity.dto.call.IceCandidate;
import com.pulse.entity.dto.call.SessionDescription;
import com.pulse.exception.NegotiationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LoopbackTransportFactoryTest {

    private final LoopbackTransportFactory factory = new LoopbackTransportFactory(2);

    private static final class Recorder implements PeerTransport.Observer {
        private final List<IceCandidate> candidates = new ArrayList<>();
        private final List<TransportState> states = new ArrayList<>();
        private int remoteTracks;

        @Override
        public void onLocalCandidate(IceCandidate candidate) {
            candidates.add(candidate);
        }

        @Override
        public void onConnectionStateChange(TransportState state) {
            states.add(state);
        }

        @Override
        public void onRemoteTrack() {
            remoteTracks++;
        }
    }

    @Test
    void connectsOnceDescriptionsAndCandidatesAreExchanged() {
        Recorder callerEvents = new Recorder();
        Recorder calleeEvents = new Recorder();
        PeerTransport caller = factory.create("c1", callerEvents);
        PeerTransport callee = factory.create("c1", calleeEvents);

        SessionDescription offer = caller.createOffer(false);
        caller.setLocalDescription(offer);
        assertThat(caller.signalingState()).isEqualTo(SignalingState.HAVE_LOCAL_OFFER);
        assertThat(callerEvents.candidates).hasSize(2);

        callee.setRemoteDescription(offer);
        SessionDescription answer = callee.createAnswer();
        callee.setLocalDescription(answer);
        callerEvents.candidates.forEach(callee::addIceCandidate);
        assertThat(callee.connectionState()).isEqualTo(TransportState.CONNECTED);

        caller.setRemoteDescription(answer);
        assertThat(caller.connectionState()).isEqualTo(TransportState.CONNECTING);
        calleeEvents.candidates.forEach(caller::addIceCandidate);

        assertThat(caller.connectionState()).isEqualTo(TransportState.CONNECTED);
        assertThat(caller.signalingState()).isEqualTo(SignalingState.STABLE);
        assertThat(callerEvents.remoteTracks).isEqualTo(1);
        assertThat(callerEvents.states).containsExactly(TransportState.CONNECTING, TransportState.CONNECTED);
        assertThat(factory.transportsFor("c1")).hasSize(2);
    }

    @Test
    void candidateBeforeRemoteDescriptionIsRejected() {
        PeerTransport transport = factory.create("c1", new Recorder());

        assertThatThrownBy(() -> transport.addIceCandidate(new IceCandidate("candidate:t9:1:0 1 udp", "0", 0)))
                .isInstanceOf(NegotiationException.class);
    }

    @Test
    void malformedDescriptionIsRejected() {
        PeerTransport transport = factory.create("c1", new Recorder());

        assertThatThrownBy(() -> transport.setRemoteDescription(SessionDescription.offer("v=0 garbage")))
                .isInstanceOf(NegotiationException.class);
        assertThatThrownBy(transport::createAnswer).isInstanceOf(NegotiationException.class);
    }

    @Test
    void restartOfferBumpsEpochAndFailureCanBeSimulated() {
        Recorder events = new Recorder();
        LoopbackTransportFactory.LoopbackTransport transport =
                (LoopbackTransportFactory.LoopbackTransport) factory.create("c1", events);

        SessionDescription first = transport.createOffer(false);
        SessionDescription second = transport.createOffer(true);
        assertThat(first.getPayload()).isNotEqualTo(second.getPayload());

        transport.simulateFailure();
        assertThat(transport.connectionState()).isEqualTo(TransportState.FAILED);

        transport.close();
        assertThat(transport.isClosed()).isTrue();
        assertThatThrownBy(() -> transport.createOffer(false)).isInstanceOf(NegotiationException.class);
    }
}
