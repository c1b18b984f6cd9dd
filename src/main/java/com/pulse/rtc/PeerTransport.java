package com.pulse.rtc;

import com.pulse.entity.dto.call.IceCandidate;
import com.pulse.entity.dto.call.SessionDescription;

/**
 * 点对点媒体传输。一个实例只属于一个通话，关闭后不能复用。
 * 除 close 外的方法失败时抛出 {@link com.pulse.exception.NegotiationException}。
 */
public interface PeerTransport {

    SessionDescription createOffer(boolean iceRestart);

    SessionDescription createAnswer();

    void setLocalDescription(SessionDescription description);

    void setRemoteDescription(SessionDescription description);

    void addIceCandidate(IceCandidate candidate);

    SignalingState signalingState();

    TransportState connectionState();

    void attachOutbound(CaptureHandle capture);

    void close();

    /**
     * 传输层事件，可能在任意线程回调
     */
    interface Observer {

        void onLocalCandidate(IceCandidate candidate);

        void onConnectionStateChange(TransportState state);

        default void onRemoteTrack() {
        }
    }
}
