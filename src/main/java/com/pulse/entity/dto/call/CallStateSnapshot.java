package com.pulse.entity.dto.call;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * 对外暴露的通话状态，每次状态变化生成一份新的快照
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CallStateSnapshot {
    String userId;
    CallStatus status;
    CallSession activeCall;
    CallSession incomingCall;
    boolean talking;
    boolean remotePlaybackMuted;
    boolean remoteTrackReady;
    CallStatus lastTerminalStatus;
    CallEndReason lastEndReason;
}
