package com.pulse.rtc;

public enum TransportState {
    NEW,
    CONNECTING,
    CONNECTED,
    DISCONNECTED,
    FAILED,
    CLOSED;

    public boolean isFailure() {
        return this == DISCONNECTED || this == FAILED;
    }
}
