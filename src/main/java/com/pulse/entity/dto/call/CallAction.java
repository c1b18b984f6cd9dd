package com.pulse.entity.dto.call;

/**
 * WebSocket消息类型：STATE/ERROR由服务端推送，其余由客户端发出
 */
public enum CallAction {
    DIAL,
    ANSWER,
    REJECT,
    END,
    TALK,
    HEARTBEAT,
    STATE,
    ERROR
}
