package com.pulse.service.impl;

import com.pulse.entity.dto.call.CallSession;
import com.pulse.entity.dto.call.CallStatus;
import com.pulse.entity.dto.call.CallUpdate;
import com.pulse.entity.dto.call.CandidateDirection;
import com.pulse.entity.dto.call.IceCandidate;
import com.pulse.entity.dto.call.SessionDescription;
import com.pulse.service.Subscription;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemorySignalingChannelTest {

    private final InMemorySignalingChannel channel = new InMemorySignalingChannel();

    private CallSession offering(String callId) {
        return CallSession.builder()
                .callId(callId)
                .callerId("a1")
                .calleeId("b2")
                .status(CallStatus.OFFERING)
                .offer(SessionDescription.offer("loopback:t1:1"))
                .startedAt(1L)
                .build();
    }

    @Test
    void guardedUpdateLetsOnlyOneClaimWin() {
        channel.create(offering("c1"));

        boolean first = channel.guardedUpdate("c1", r -> r.getStatus() == CallStatus.OFFERING,
                CallUpdate.status(CallStatus.RINGING));
        boolean second = channel.guardedUpdate("c1", r -> r.getStatus() == CallStatus.OFFERING,
                CallUpdate.status(CallStatus.RINGING));

        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(channel.get("c1")).get().extracting(CallSession::getStatus).isEqualTo(CallStatus.RINGING);
    }

    @Test
    void updateOnMissingRecordReportsAbsence() {
        assertThat(channel.update("missing", CallUpdate.status(CallStatus.ENDED))).isFalse();
        assertThat(channel.get("missing")).isEmpty();
    }

    @Test
    void nullFieldInUpdateClearsIt() {
        CallSession record = offering("c1");
        record.setAnswer(SessionDescription.answer("loopback:t2:1"));
        record.setActiveSpeakerId("a1");
        channel.create(record);

        channel.update("c1", CallUpdate.create().clearAnswer().withActiveSpeaker(null));

        CallSession stored = channel.get("c1").orElseThrow();
        assertThat(stored.getAnswer()).isNull();
        assertThat(stored.getActiveSpeakerId()).isNull();
        assertThat(stored.getOffer()).isNotNull();
    }

    @Test
    void subscriptionReplaysCurrentValueThenChangesThenRemoval() {
        channel.create(offering("c1"));
        List<CallSession> seen = new ArrayList<>();

        Subscription subscription = channel.subscribe("c1", (id, record) -> seen.add(record));
        channel.update("c1", CallUpdate.status(CallStatus.RINGING));
        channel.remove("c1");

        assertThat(seen).hasSize(3);
        assertThat(seen.get(0).getStatus()).isEqualTo(CallStatus.OFFERING);
        assertThat(seen.get(1).getStatus()).isEqualTo(CallStatus.RINGING);
        assertThat(seen.get(2)).isNull();

        subscription.unsubscribe();
        subscription.unsubscribe();
        channel.create(offering("c1"));
        assertThat(seen).hasSize(3);
    }

    @Test
    void snapshotsAreCopies() {
        channel.create(offering("c1"));

        CallSession copy = channel.get("c1").orElseThrow();
        copy.setStatus(CallStatus.ENDED);

        assertThat(channel.get("c1").orElseThrow().getStatus()).isEqualTo(CallStatus.OFFERING);
    }

    @Test
    void watchInboundSeesExistingAndNewRecordsForCallee() {
        channel.create(offering("c1"));
        List<String> seen = new ArrayList<>();

        channel.watchInbound("b2", (id, record) -> seen.add(id + ":" + (record == null ? "gone" : record.getStatus())));
        channel.create(offering("c2"));
        channel.watchInbound("someone-else", (id, record) -> seen.add("wrong"));
        channel.remove("c1");

        assertThat(seen).containsExactly("c1:OFFERING", "c2:OFFERING", "c1:gone");
    }

    @Test
    void candidatesAreReplayedThenStreamedAndDroppedAfterRemoval() {
        channel.create(offering("c1"));
        IceCandidate first = new IceCandidate("candidate:1", "0", 0);
        IceCandidate second = new IceCandidate("candidate:2", "0", 0);
        channel.appendCandidate("c1", CandidateDirection.CALLER, first);
        List<IceCandidate> seen = new ArrayList<>();

        channel.subscribeCandidates("c1", CandidateDirection.CALLER, seen::add);
        channel.appendCandidate("c1", CandidateDirection.CALLER, second);
        channel.appendCandidate("c1", CandidateDirection.CALLEE, new IceCandidate("candidate:x", "0", 0));

        assertThat(seen).containsExactly(first, second);
        assertThat(channel.candidates("c1", CandidateDirection.CALLEE)).hasSize(1);

        channel.remove("c1");
        channel.appendCandidate("c1", CandidateDirection.CALLER, new IceCandidate("candidate:3", "0", 0));
        assertThat(channel.candidates("c1", CandidateDirection.CALLER)).isEmpty();
    }

    @Test
    void unsubscribingAndRemovalDropEmptyListenerKeys() {
        channel.create(offering("c1"));
        Subscription record = channel.subscribe("c1", (id, r) -> { });
        Subscription inbound = channel.watchInbound("b2", (id, r) -> { });
        Subscription candidates = channel.subscribeCandidates("c1", CandidateDirection.CALLER, c -> { });
        assertThat(channel.listenerKeyCount()).isEqualTo(3);

        record.unsubscribe();
        candidates.unsubscribe();
        assertThat(channel.listenerKeyCount()).isEqualTo(1);

        inbound.unsubscribe();
        assertThat(channel.listenerKeyCount()).isZero();

        // 通话删除时仍挂着的监听也一并清掉
        channel.create(offering("c2"));
        channel.subscribe("c2", (id, r) -> { });
        channel.subscribeCandidates("c2", CandidateDirection.CALLEE, c -> { });
        channel.remove("c2");
        assertThat(channel.listenerKeyCount()).isZero();
    }

    @Test
    void disconnectEndsOnlyGuardedLiveRecords() {
        channel.create(offering("c1"));
        channel.create(offering("c2"));
        channel.create(offering("c3"));
        channel.endOnDisconnect("a1", "c1");
        channel.endOnDisconnect("a1", "c2");
        channel.cancelOnDisconnect("a1", "c2");
        channel.update("c3", CallUpdate.status(CallStatus.REJECTED));
        channel.endOnDisconnect("a1", "c3");

        channel.disconnect("a1");

        assertThat(channel.get("c1").orElseThrow().getStatus()).isEqualTo(CallStatus.ENDED);
        assertThat(channel.get("c2").orElseThrow().getStatus()).isEqualTo(CallStatus.OFFERING);
        assertThat(channel.get("c3").orElseThrow().getStatus()).isEqualTo(CallStatus.REJECTED);

        channel.update("c2", CallUpdate.status(CallStatus.RINGING));
        channel.disconnect("a1");
        assertThat(channel.get("c2").orElseThrow().getStatus()).isEqualTo(CallStatus.RINGING);
    }
}
