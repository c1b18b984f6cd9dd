package com.pulse.entity.dto.call;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 通话结束后的归档记录，不包含SDP和候选地址
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CallHistoryEntry {
    private String callId;
    private String callerId;
    private String callerName;
    private String calleeId;
    private String calleeName;
    private CallStatus status;
    private CallEndReason endReason;
    private Long startedAt;
    private Long endedAt;
    private Long duration;

    /**
     * @param connectedAt 到达CONNECTED的时间，从未接通时为null
     */
    public static CallHistoryEntry from(CallSession record, CallStatus terminal, CallEndReason reason,
                                        long endedAt, Long connectedAt) {
        CallStatus archived = terminal == CallStatus.ENDED && connectedAt == null ? CallStatus.MISSED : terminal;
        return CallHistoryEntry.builder()
                .callId(record.getCallId())
                .callerId(record.getCallerId())
                .callerName(record.getCallerName())
                .calleeId(record.getCalleeId())
                .calleeName(record.getCalleeName())
                .status(archived)
                .endReason(reason)
                .startedAt(record.getStartedAt())
                .endedAt(endedAt)
                .duration(connectedAt == null ? 0L : Math.max(0L, endedAt - connectedAt))
                .build();
    }
}
