package com.pulse.rtc;

import lombok.extern.slf4j.Slf4j;

/**
 * 默认的播放闸门，初始为静音
 */
@Slf4j
public class GatedRemotePlayback implements RemotePlayback {

    private final String ownerId;
    private volatile boolean muted = true;

    public GatedRemotePlayback(String ownerId) {
        this.ownerId = ownerId;
    }

    @Override
    public void setMuted(boolean muted) {
        if (this.muted != muted) {
            log.debug("远端播放{} user={}", muted ? "静音" : "开启", ownerId);
        }
        this.muted = muted;
    }

    @Override
    public boolean isMuted() {
        return muted;
    }
}
