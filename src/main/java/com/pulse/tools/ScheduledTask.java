package com.pulse.tools;

public interface ScheduledTask {

    /**
     * 取消尚未执行的任务，重复调用无副作用
     */
    void cancel();
}
