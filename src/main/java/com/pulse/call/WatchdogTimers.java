package com.pulse.call;

import com.pulse.entity.dto.call.CallStatus;
import com.pulse.tools.EventLoop;
import com.pulse.tools.ScheduledTask;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * 按通话ID管理的看门狗定时器。每个通话同一时刻最多一个定时器，
 * 进入新状态时替换，进入终态时取消。
 * <p>
 * 只在事件循环上使用：定时器触发时先核对登记项是否仍是自己，
 * 因此取消之后即使任务已经出队也不会再执行回调。
 */
@Slf4j
public class WatchdogTimers {

    private final EventLoop loop;
    private final Map<String, Armed> armed = new HashMap<>();

    public WatchdogTimers(EventLoop loop) {
        this.loop = loop;
    }

    public void arm(String callId, CallStatus phase, Duration timeout, Runnable onExpire) {
        cancel(callId);
        Armed entry = new Armed();
        entry.task = loop.schedule(timeout, () -> {
            if (armed.get(callId) != entry) {
                return;
            }
            armed.remove(callId);
            log.info("看门狗超时 callId={} phase={} timeout={}ms", callId, phase, timeout.toMillis());
            onExpire.run();
        });
        armed.put(callId, entry);
    }

    public void cancel(String callId) {
        Armed entry = armed.remove(callId);
        if (entry != null && entry.task != null) {
            entry.task.cancel();
        }
    }

    public void cancelAll() {
        for (Armed entry : armed.values()) {
            if (entry.task != null) {
                entry.task.cancel();
            }
        }
        armed.clear();
    }

    private static final class Armed {
        private ScheduledTask task;
    }
}
