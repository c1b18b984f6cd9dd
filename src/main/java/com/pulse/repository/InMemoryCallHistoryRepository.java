package com.pulse.repository;

import com.pulse.entity.dto.call.CallHistoryEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class InMemoryCallHistoryRepository implements CallHistoryRepository {

    private final Map<String, CallHistoryEntry> history = new ConcurrentHashMap<>();

    @Override
    public void save(CallHistoryEntry entry) {
        CallHistoryEntry existing = history.putIfAbsent(entry.getCallId(), entry);
        if (existing != null) {
            log.debug("通话已归档，忽略重复写入 callId={}", entry.getCallId());
            return;
        }
        log.info("归档通话 callId={} status={} reason={} duration={}ms",
                entry.getCallId(), entry.getStatus(), entry.getEndReason(), entry.getDuration());
    }

    @Override
    public List<CallHistoryEntry> findByParticipant(String userId, int limit) {
        return history.values().stream()
                .filter(entry -> userId.equals(entry.getCallerId()) || userId.equals(entry.getCalleeId()))
                .sorted(Comparator.comparing(CallHistoryEntry::getEndedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(Math.max(0, limit))
                .toList();
    }
}
