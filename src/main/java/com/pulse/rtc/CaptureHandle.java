package com.pulse.rtc;

/**
 * 本地采集句柄，进程内只获取一次，跨通话复用；
 * 半双工时只开关发送轨道，不释放设备。
 */
public interface CaptureHandle {

    String id();

    void setOutboundEnabled(boolean enabled);

    boolean isOutboundEnabled();
}
