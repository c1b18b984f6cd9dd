package com.pulse.entity.dto.call;

public enum CallEndReason {
    NORMAL,
    REMOTE_ENDED,
    REJECTED,
    BUSY,
    GLARE_YIELD,
    TIMEOUT,
    MEDIA_UNAVAILABLE,
    NEGOTIATION_FAILED,
    ALREADY_CLAIMED,
    DISCONNECTED,
    UNKNOWN
}
