package com.pulse.rtc;

public interface LocalMediaSource {

    /**
     * 获取采集设备，已获取时直接返回已有句柄
     *
     * @throws com.pulse.exception.MediaUnavailableException 设备不可用或被拒绝
     */
    CaptureHandle acquire();

    void release();

    boolean isAcquired();
}
