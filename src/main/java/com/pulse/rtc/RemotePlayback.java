package com.pulse.rtc;

/**
 * 远端音频播放闸门，只由发言权控制开关
 */
public interface RemotePlayback {

    void setMuted(boolean muted);

    boolean isMuted();
}
