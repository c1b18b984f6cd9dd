package com.pulse.rtc;

import cn.hutool.core.util.IdUtil;
import lombok.extern.slf4j.Slf4j;

/**
 * 不依赖硬件的采集源，适用于服务端托管的代理
 */
@Slf4j
public class VirtualMediaSource implements LocalMediaSource {

    private CaptureHandle handle;
    private int acquisitions;

    @Override
    public synchronized CaptureHandle acquire() {
        if (handle != null) {
            return handle;
        }
        acquisitions++;
        handle = new SimpleCaptureHandle("virtual-" + IdUtil.fastSimpleUUID());
        log.info("获取虚拟采集设备 handle={}", handle.id());
        return handle;
    }

    @Override
    public synchronized void release() {
        if (handle != null) {
            handle.setOutboundEnabled(false);
            log.info("释放虚拟采集设备 handle={}", handle.id());
            handle = null;
        }
    }

    @Override
    public synchronized boolean isAcquired() {
        return handle != null;
    }

    /**
     * 实际打开设备的次数
     */
    public synchronized int acquisitions() {
        return acquisitions;
    }

    static final class SimpleCaptureHandle implements CaptureHandle {
        private final String id;
        private volatile boolean outboundEnabled;

        SimpleCaptureHandle(String id) {
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public void setOutboundEnabled(boolean enabled) {
            this.outboundEnabled = enabled;
        }

        @Override
        public boolean isOutboundEnabled() {
            return outboundEnabled;
        }
    }
}
