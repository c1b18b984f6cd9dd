package com.pulse.publisher;

/**
 * 来电唤醒通知。尽力而为：失败只记录日志，不影响通话本身
 */
public interface WakeNotifier {

    void notifyCallee(WakeSignal signal);
}
