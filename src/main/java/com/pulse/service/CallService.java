package com.pulse.service;

import com.pulse.call.CallAgent;
import com.pulse.entity.dto.call.CallHistoryEntry;
import com.pulse.entity.dto.call.CallSession;
import com.pulse.entity.dto.call.CallStateSnapshot;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 服务端托管的通话代理，每个在线身份一个
 */
public interface CallService {

    /**
     * 注册并启动代理，已注册时直接返回已有代理
     */
    CallAgent register(String userId, String displayName);

    /**
     * 结束当前通话、停止代理，并触发该身份的断线兜底
     */
    void unregister(String userId);

    Optional<CallAgent> findAgent(String userId);

    Set<String> onlineUsers();

    CallSession dial(String userId, String calleeId, String calleeName);

    CallSession answer(String userId);

    boolean reject(String userId);

    boolean hangUp(String userId);

    boolean talk(String userId, boolean talking);

    CallStateSnapshot state(String userId);

    List<CallHistoryEntry> history(String userId, int limit);
}
