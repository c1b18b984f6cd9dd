package com.pulse.repository;

import com.pulse.entity.dto.call.CallEndReason;
import com.pulse.entity.dto.call.CallHistoryEntry;
import com.pulse.entity.dto.call.CallStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryCallHistoryRepositoryTest {

    private final InMemoryCallHistoryRepository repository = new InMemoryCallHistoryRepository();

    private static CallHistoryEntry entry(String callId, String caller, String callee, long endedAt) {
        return CallHistoryEntry.builder()
                .callId(callId)
                .callerId(caller)
                .calleeId(callee)
                .status(CallStatus.ENDED)
                .endReason(CallEndReason.NORMAL)
                .endedAt(endedAt)
                .build();
    }

    @Test
    void newestFirstForBothRoles() {
        repository.save(entry("c1", "a1", "b2", 100L));
        repository.save(entry("c2", "b2", "a1", 300L));
        repository.save(entry("c3", "c3", "b2", 200L));

        List<CallHistoryEntry> forA1 = repository.findByParticipant("a1", 10);

        assertThat(forA1).extracting(CallHistoryEntry::getCallId).containsExactly("c2", "c1");
        assertThat(repository.findByParticipant("b2", 2)).extracting(CallHistoryEntry::getCallId)
                .containsExactly("c2", "c3");
    }

    @Test
    void firstArchiveOfACallWins() {
        repository.save(entry("c1", "a1", "b2", 100L));
        CallHistoryEntry duplicate = entry("c1", "a1", "b2", 999L);
        duplicate.setStatus(CallStatus.MISSED);

        repository.save(duplicate);

        assertThat(repository.findByParticipant("a1", 10))
                .singleElement()
                .extracting(CallHistoryEntry::getStatus)
                .isEqualTo(CallStatus.ENDED);
    }
}
