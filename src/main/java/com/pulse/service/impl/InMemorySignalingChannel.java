package com.pulse.service.impl;

import cn.hutool.core.util.IdUtil;
import cn.hutool.core.util.StrUtil;
import com.pulse.entity.dto.call.CallSession;
import com.pulse.entity.dto.call.CallStatus;
import com.pulse.entity.dto.call.CallUpdate;
import com.pulse.entity.dto.call.CandidateDirection;
import com.pulse.entity.dto.call.IceCandidate;
import com.pulse.service.CallRecordListener;
import com.pulse.service.SignalingChannel;
import com.pulse.service.Subscription;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * 进程内信令存储。写操作与通知在同一把锁内完成，保证同一条记录的通知按写入顺序送达；
 * 监听器只应做投递（例如投递到事件循环），不要在回调里阻塞。
 */
@Slf4j
public class InMemorySignalingChannel implements SignalingChannel {

    private final Object mutex = new Object();
    private final Map<String, CallSession> records = new HashMap<>();
    private final Map<String, List<IceCandidate>> candidates = new HashMap<>();
    private final Map<String, List<CallRecordListener>> recordListeners = new ConcurrentHashMap<>();
    private final Map<String, List<CallRecordListener>> inboundListeners = new ConcurrentHashMap<>();
    private final Map<String, List<Consumer<IceCandidate>>> candidateListeners = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> disconnectGuards = new ConcurrentHashMap<>();

    @Override
    public String allocateId() {
        return IdUtil.fastSimpleUUID();
    }

    @Override
    public String create(CallSession record) {
        synchronized (mutex) {
            String callId = StrUtil.isBlank(record.getCallId()) ? allocateId() : record.getCallId();
            CallSession stored = record.copy();
            stored.setCallId(callId);
            records.put(callId, stored);
            log.debug("写入通话记录 callId={} caller={} callee={}", callId, stored.getCallerId(), stored.getCalleeId());
            notifyRecord(callId, stored);
            return callId;
        }
    }

    @Override
    public Optional<CallSession> get(String callId) {
        synchronized (mutex) {
            CallSession record = records.get(callId);
            return Optional.ofNullable(record == null ? null : record.copy());
        }
    }

    @Override
    public boolean update(String callId, CallUpdate update) {
        return guardedUpdate(callId, record -> true, update);
    }

    @Override
    public boolean guardedUpdate(String callId, Predicate<CallSession> guard, CallUpdate update) {
        synchronized (mutex) {
            CallSession current = records.get(callId);
            if (current == null) {
                return false;
            }
            if (!guard.test(current.copy())) {
                return false;
            }
            update.applyTo(current);
            notifyRecord(callId, current);
            return true;
        }
    }

    @Override
    public void remove(String callId) {
        synchronized (mutex) {
            CallSession removed = records.remove(callId);
            for (CandidateDirection direction : CandidateDirection.values()) {
                candidates.remove(candidateKey(callId, direction));
            }
            if (removed != null) {
                log.debug("删除通话记录 callId={}", callId);
                deliver(recordListeners.remove(callId), callId, null);
                deliver(inboundListeners.get(removed.getCalleeId()), callId, null);
            }
            for (CandidateDirection direction : CandidateDirection.values()) {
                candidateListeners.remove(candidateKey(callId, direction));
            }
        }
    }

    @Override
    public Subscription subscribe(String callId, CallRecordListener listener) {
        synchronized (mutex) {
            List<CallRecordListener> listeners = recordListeners.computeIfAbsent(callId, k -> new CopyOnWriteArrayList<>());
            listeners.add(listener);
            CallSession current = records.get(callId);
            listener.onRecord(callId, current == null ? null : current.copy());
            return unsubscriber(recordListeners, callId, listener);
        }
    }

    @Override
    public Subscription watchInbound(String calleeId, CallRecordListener listener) {
        synchronized (mutex) {
            List<CallRecordListener> listeners = inboundListeners.computeIfAbsent(calleeId, k -> new CopyOnWriteArrayList<>());
            listeners.add(listener);
            for (CallSession record : new ArrayList<>(records.values())) {
                if (calleeId.equals(record.getCalleeId())) {
                    listener.onRecord(record.getCallId(), record.copy());
                }
            }
            return unsubscriber(inboundListeners, calleeId, listener);
        }
    }

    @Override
    public void appendCandidate(String callId, CandidateDirection direction, IceCandidate candidate) {
        synchronized (mutex) {
            if (!records.containsKey(callId)) {
                log.debug("记录已不存在，丢弃候选地址 callId={} direction={}", callId, direction);
                return;
            }
            String key = candidateKey(callId, direction);
            candidates.computeIfAbsent(key, k -> new ArrayList<>()).add(candidate);
            List<Consumer<IceCandidate>> listeners = candidateListeners.get(key);
            if (listeners != null) {
                for (Consumer<IceCandidate> consumer : listeners) {
                    consumer.accept(candidate);
                }
            }
        }
    }

    @Override
    public List<IceCandidate> candidates(String callId, CandidateDirection direction) {
        synchronized (mutex) {
            return List.copyOf(candidates.getOrDefault(candidateKey(callId, direction), List.of()));
        }
    }

    @Override
    public Subscription subscribeCandidates(String callId, CandidateDirection direction, Consumer<IceCandidate> consumer) {
        synchronized (mutex) {
            String key = candidateKey(callId, direction);
            List<Consumer<IceCandidate>> listeners = candidateListeners.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>());
            listeners.add(consumer);
            for (IceCandidate existing : candidates.getOrDefault(key, List.of())) {
                consumer.accept(existing);
            }
            return unsubscriber(candidateListeners, key, consumer);
        }
    }

    @Override
    public void endOnDisconnect(String ownerId, String callId) {
        disconnectGuards.computeIfAbsent(ownerId, k -> ConcurrentHashMap.newKeySet()).add(callId);
    }

    @Override
    public void cancelOnDisconnect(String ownerId, String callId) {
        disconnectGuards.computeIfPresent(ownerId, (owner, guarded) -> {
            guarded.remove(callId);
            return guarded.isEmpty() ? null : guarded;
        });
    }

    @Override
    public void disconnect(String ownerId) {
        Set<String> guarded = disconnectGuards.remove(ownerId);
        if (guarded == null) {
            return;
        }
        for (String callId : guarded) {
            boolean ended = guardedUpdate(callId, record -> record.getStatus() != null && !record.getStatus().isTerminal(),
                    CallUpdate.status(CallStatus.ENDED));
            log.info("断线兜底 owner={} callId={} ended={}", ownerId, callId, ended);
        }
    }

    /**
     * 当前存活的记录数，供监控使用
     */
    public int size() {
        synchronized (mutex) {
            return records.size();
        }
    }

    /**
     * 仍登记着监听器的键数量（记录、来电、候选地址），通话结束后应回落
     */
    public int listenerKeyCount() {
        synchronized (mutex) {
            return recordListeners.size() + inboundListeners.size() + candidateListeners.size();
        }
    }

    private void notifyRecord(String callId, CallSession current) {
        deliver(recordListeners.get(callId), callId, current);
        deliver(inboundListeners.get(current.getCalleeId()), callId, current);
    }

    private void deliver(List<CallRecordListener> listeners, String callId, CallSession record) {
        if (listeners == null) {
            return;
        }
        for (CallRecordListener listener : listeners) {
            listener.onRecord(callId, record == null ? null : record.copy());
        }
    }

    private static String candidateKey(String callId, CandidateDirection direction) {
        return callId + "/" + direction.collection();
    }

    /**
     * 退订时移除监听器，列表空了连同键一起删掉
     */
    private <T> Subscription unsubscriber(Map<String, List<T>> registry, String key, T listener) {
        AtomicBoolean done = new AtomicBoolean();
        return () -> {
            if (!done.compareAndSet(false, true)) {
                return;
            }
            synchronized (mutex) {
                registry.computeIfPresent(key, (k, listeners) -> {
                    listeners.remove(listener);
                    return listeners.isEmpty() ? null : listeners;
                });
            }
        };
    }
}
