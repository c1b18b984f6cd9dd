package com.pulse.rtc;

public interface PeerTransportFactory {

    PeerTransport create(String callId, PeerTransport.Observer observer);
}
