package com.pulse.publisher;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingWakeNotifier implements WakeNotifier {

    @Override
    public void notifyCallee(WakeSignal signal) {
        log.info("来电唤醒(未启用推送) callId={} caller={} callee={}",
                signal.getCallId(), signal.getCallerId(), signal.getCalleeId());
    }
}
