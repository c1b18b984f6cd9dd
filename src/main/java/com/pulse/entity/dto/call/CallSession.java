package com.pulse.entity.dto.call;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 共享存储里的通话记录
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CallSession {
    private String callId;
    private String callerId;
    private String callerName;
    private String calleeId;
    private String calleeName;
    private CallStatus status;
    private SessionDescription offer;
    private SessionDescription answer;
    private Long startedAt;
    private Long endedAt;
    private Long duration;
    private String activeSpeakerId;

    public CallSession copy() {
        return toBuilder().build();
    }
}
