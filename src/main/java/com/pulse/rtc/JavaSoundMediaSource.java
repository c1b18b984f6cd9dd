package com.pulse.rtc;

import com.pulse.exception.MediaUnavailableException;
import lombok.extern.slf4j.Slf4j;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.TargetDataLine;

/**
 * 通过 javax.sound 打开麦克风。48kHz 单声道 16bit，
 * 发送关闭时停止读取但不关闭设备，避免反复申请权限。
 */
@Slf4j
public class JavaSoundMediaSource implements LocalMediaSource {

    private static final AudioFormat FORMAT = new AudioFormat(48_000f, 16, 1, true, false);

    private LineCaptureHandle handle;

    @Override
    public synchronized CaptureHandle acquire() {
        if (handle != null) {
            return handle;
        }
        DataLine.Info info = new DataLine.Info(TargetDataLine.class, FORMAT);
        if (!AudioSystem.isLineSupported(info)) {
            throw new MediaUnavailableException("没有可用的音频采集设备");
        }
        try {
            TargetDataLine line = (TargetDataLine) AudioSystem.getLine(info);
            line.open(FORMAT);
            handle = new LineCaptureHandle(line);
            log.info("打开麦克风 format={}", FORMAT);
            return handle;
        } catch (LineUnavailableException | SecurityException | IllegalArgumentException ex) {
            throw new MediaUnavailableException("打开麦克风失败: " + ex.getMessage(), ex);
        }
    }

    @Override
    public synchronized void release() {
        if (handle != null) {
            handle.line.stop();
            handle.line.close();
            log.info("关闭麦克风");
            handle = null;
        }
    }

    @Override
    public synchronized boolean isAcquired() {
        return handle != null;
    }

    private static final class LineCaptureHandle implements CaptureHandle {
        private final TargetDataLine line;
        private volatile boolean outboundEnabled;

        private LineCaptureHandle(TargetDataLine line) {
            this.line = line;
        }

        @Override
        public String id() {
            return "javasound-" + Integer.toHexString(System.identityHashCode(line));
        }

        @Override
        public void setOutboundEnabled(boolean enabled) {
            if (enabled) {
                line.start();
            } else {
                line.stop();
            }
            this.outboundEnabled = enabled;
        }

        @Override
        public boolean isOutboundEnabled() {
            return outboundEnabled;
        }
    }
}
