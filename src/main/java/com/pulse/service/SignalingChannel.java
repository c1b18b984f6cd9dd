package com.pulse.service;

import com.pulse.entity.dto.call.CallSession;
import com.pulse.entity.dto.call.CallUpdate;
import com.pulse.entity.dto.call.CandidateDirection;
import com.pulse.entity.dto.call.IceCandidate;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * 共享信令存储的适配层。
 * <p>
 * 通知至少送达一次，记录通道与候选地址通道之间没有顺序保证。
 * 所有方法都可能抛出 {@link com.pulse.exception.SignalingException}。
 */
public interface SignalingChannel {

    String allocateId();

    /**
     * 写入新记录，callId 为空时由存储分配
     *
     * @return 记录ID
     */
    String create(CallSession record);

    Optional<CallSession> get(String callId);

    /**
     * @return 记录不存在时返回 false
     */
    boolean update(String callId, CallUpdate update);

    /**
     * 条件更新：仅当 guard 对当前值成立时才写入，并发下只有一方成功
     */
    boolean guardedUpdate(String callId, Predicate<CallSession> guard, CallUpdate update);

    void remove(String callId);

    /**
     * 订阅单条记录，订阅时会先推送一次当前值
     */
    Subscription subscribe(String callId, CallRecordListener listener);

    /**
     * 订阅所有发给 calleeId 的记录，已有记录会先回放一次
     */
    Subscription watchInbound(String calleeId, CallRecordListener listener);

    void appendCandidate(String callId, CandidateDirection direction, IceCandidate candidate);

    List<IceCandidate> candidates(String callId, CandidateDirection direction);

    /**
     * 订阅候选地址子集合，先回放已有条目，再推送新追加的条目
     */
    Subscription subscribeCandidates(String callId, CandidateDirection direction, Consumer<IceCandidate> consumer);

    /**
     * 连接断开时把记录置为 ENDED
     */
    void endOnDisconnect(String ownerId, String callId);

    void cancelOnDisconnect(String ownerId, String callId);

    /**
     * 触发 ownerId 登记过的所有断线兜底写入
     */
    void disconnect(String ownerId);
}
