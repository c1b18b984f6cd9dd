package com.pulse.call;

import com.pulse.entity.dto.call.CallEndReason;
import com.pulse.entity.dto.call.CallStateSnapshot;
import com.pulse.entity.dto.call.CallStatus;

/**
 * 通话状态监听，回调发生在代理的事件循环线程上，不要阻塞
 */
public interface CallStateListener {

    /**
     * @param from   进入前的状态，新会话为 null
     * @param reason 仅在进入终态时非空
     */
    default void onTransition(String callId, CallStatus from, CallStatus to, CallEndReason reason) {
    }

    default void onStateChanged(CallStateSnapshot snapshot) {
    }
}
