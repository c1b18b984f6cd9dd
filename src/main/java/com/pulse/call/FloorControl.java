package com.pulse.call;

import com.pulse.entity.dto.call.CallStatus;

/**
 * 半双工发言权。activeSpeakerId 是唯一的发言信号：
 * 只有通话已接通并且发言人是对端时才播放远端音频，发言人是自己时永远静音。
 */
public final class FloorControl {

    private FloorControl() {
    }

    public static boolean shouldPlayRemote(CallStatus status, String activeSpeakerId, String localId, String remoteId) {
        if (status != CallStatus.CONNECTED || activeSpeakerId == null) {
            return false;
        }
        if (activeSpeakerId.equals(localId)) {
            return false;
        }
        return activeSpeakerId.equals(remoteId);
    }
}
