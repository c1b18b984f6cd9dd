package com.pulse.service.impl;

import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulse.config.PulseProperties;
import com.pulse.entity.dto.call.CallSession;
import com.pulse.entity.dto.call.CallStatus;
import com.pulse.entity.dto.call.CallUpdate;
import com.pulse.entity.dto.call.CandidateDirection;
import com.pulse.entity.dto.call.IceCandidate;
import com.pulse.exception.SignalingException;
import com.pulse.service.CallRecordListener;
import com.pulse.service.SignalingChannel;
import com.pulse.service.Subscription;
import com.pulse.tools.RedisIdWorker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.retry.support.RetryTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 基于 Redis 的信令存储，多个节点共享。
 * <p>
 * 记录以 JSON 字符串保存，条件更新用 WATCH/MULTI/EXEC 实现乐观锁；
 * 每次写入后向记录频道和被叫的来电频道发布最新值，删除时发布空串。
 * 候选地址保存在列表里，追加后向候选频道发布该条目。
 * 订阅先注册监听再读取当前值，因此同一个值可能收到两次。
 */
@Slf4j
public class RedisSignalingChannel implements SignalingChannel {

    private static final String REMOVED = "";

    private final StringRedisTemplate redis;
    private final RedisMessageListenerContainer container;
    private final RetryTemplate retryTemplate;
    private final ObjectMapper objectMapper;
    private final RedisIdWorker idWorker;
    private final String prefix;
    private final Duration recordTtl;
    private final int guardedUpdateAttempts;

    public RedisSignalingChannel(StringRedisTemplate redis, RedisMessageListenerContainer container,
                                 RetryTemplate retryTemplate, ObjectMapper objectMapper,
                                 PulseProperties.Signaling properties) {
        this.redis = redis;
        this.container = container;
        this.retryTemplate = retryTemplate;
        this.objectMapper = objectMapper;
        this.idWorker = new RedisIdWorker(redis);
        this.prefix = properties.getKeyPrefix();
        this.recordTtl = properties.getRecordTtl();
        this.guardedUpdateAttempts = Math.max(1, properties.getGuardedUpdateAttempts());
    }

    @Override
    public String allocateId() {
        return execute("分配通话ID", () -> String.valueOf(idWorker.nextId(prefix + ":call")));
    }

    @Override
    public String create(CallSession record) {
        String callId = StrUtil.isBlank(record.getCallId()) ? allocateId() : record.getCallId();
        CallSession stored = record.copy();
        stored.setCallId(callId);
        String json = write(stored);
        execute("写入通话记录", () -> {
            redis.opsForValue().set(recordKey(callId), json, recordTtl);
            if (stored.getCalleeId() != null) {
                redis.opsForSet().add(inboundKey(stored.getCalleeId()), callId);
                redis.expire(inboundKey(stored.getCalleeId()), recordTtl);
            }
            return null;
        });
        publishRecord(callId, stored.getCalleeId(), json);
        log.debug("写入通话记录 callId={} caller={} callee={}", callId, stored.getCallerId(), stored.getCalleeId());
        return callId;
    }

    @Override
    public Optional<CallSession> get(String callId) {
        String json = execute("读取通话记录", () -> redis.opsForValue().get(recordKey(callId)));
        return Optional.ofNullable(json == null ? null : read(json));
    }

    @Override
    public boolean update(String callId, CallUpdate update) {
        return guardedUpdate(callId, record -> true, update);
    }

    @Override
    public boolean guardedUpdate(String callId, Predicate<CallSession> guard, CallUpdate update) {
        String key = recordKey(callId);
        for (int attempt = 1; attempt <= guardedUpdateAttempts; attempt++) {
            GuardedResult result = execute("条件更新通话记录", () -> redis.execute(new GuardedWrite(key, guard, update)));
            if (result == null || result.outcome == Outcome.REJECTED) {
                return false;
            }
            if (result.outcome == Outcome.WRITTEN) {
                publishRecord(callId, result.record.getCalleeId(), result.json);
                return true;
            }
            log.debug("条件更新遇到并发修改，重试 callId={} attempt={}", callId, attempt);
        }
        throw new SignalingException("条件更新冲突次数过多 callId=" + callId);
    }

    @Override
    public void remove(String callId) {
        Optional<CallSession> existing = get(callId);
        execute("删除通话记录", () -> {
            List<String> keys = new ArrayList<>();
            keys.add(recordKey(callId));
            for (CandidateDirection direction : CandidateDirection.values()) {
                keys.add(candidateKey(callId, direction));
            }
            redis.delete(keys);
            existing.ifPresent(record -> redis.opsForSet().remove(inboundKey(record.getCalleeId()), callId));
            return null;
        });
        existing.ifPresent(record -> {
            log.debug("删除通话记录 callId={}", callId);
            publishRecord(callId, record.getCalleeId(), REMOVED);
        });
    }

    @Override
    public Subscription subscribe(String callId, CallRecordListener listener) {
        MessageListener messageListener = (message, pattern) -> listener.onRecord(callId, readMessage(message));
        ChannelTopic topic = new ChannelTopic(recordTopic(callId));
        container.addMessageListener(messageListener, topic);
        listener.onRecord(callId, get(callId).orElse(null));
        return unsubscriber(() -> container.removeMessageListener(messageListener, topic));
    }

    @Override
    public Subscription watchInbound(String calleeId, CallRecordListener listener) {
        MessageListener messageListener = (message, pattern) -> {
            String body = new String(message.getBody(), StandardCharsets.UTF_8);
            if (REMOVED.equals(body)) {
                return;
            }
            CallSession record = read(body);
            listener.onRecord(record.getCallId(), record);
        };
        ChannelTopic topic = new ChannelTopic(inboundTopic(calleeId));
        container.addMessageListener(messageListener, topic);
        Set<String> callIds = execute("读取来电索引", () -> redis.opsForSet().members(inboundKey(calleeId)));
        if (callIds != null) {
            for (String callId : callIds) {
                get(callId).ifPresent(record -> listener.onRecord(callId, record));
            }
        }
        return unsubscriber(() -> container.removeMessageListener(messageListener, topic));
    }

    @Override
    public void appendCandidate(String callId, CandidateDirection direction, IceCandidate candidate) {
        String json = write(candidate);
        Boolean exists = execute("追加候选地址", () -> {
            if (!Boolean.TRUE.equals(redis.hasKey(recordKey(callId)))) {
                return false;
            }
            redis.opsForList().rightPush(candidateKey(callId, direction), json);
            redis.expire(candidateKey(callId, direction), recordTtl);
            redis.convertAndSend(candidateTopic(callId, direction), json);
            return true;
        });
        if (!Boolean.TRUE.equals(exists)) {
            log.debug("记录已不存在，丢弃候选地址 callId={} direction={}", callId, direction);
        }
    }

    @Override
    public List<IceCandidate> candidates(String callId, CandidateDirection direction) {
        List<String> raw = execute("读取候选地址", () -> redis.opsForList().range(candidateKey(callId, direction), 0, -1));
        List<IceCandidate> result = new ArrayList<>();
        if (raw != null) {
            for (String json : raw) {
                result.add(readCandidate(json));
            }
        }
        return result;
    }

    @Override
    public Subscription subscribeCandidates(String callId, CandidateDirection direction, Consumer<IceCandidate> consumer) {
        MessageListener messageListener = (message, pattern) ->
                consumer.accept(readCandidate(new String(message.getBody(), StandardCharsets.UTF_8)));
        ChannelTopic topic = new ChannelTopic(candidateTopic(callId, direction));
        container.addMessageListener(messageListener, topic);
        for (IceCandidate existing : candidates(callId, direction)) {
            consumer.accept(existing);
        }
        return unsubscriber(() -> container.removeMessageListener(messageListener, topic));
    }

    @Override
    public void endOnDisconnect(String ownerId, String callId) {
        execute("登记断线兜底", () -> {
            redis.opsForSet().add(guardKey(ownerId), callId);
            redis.expire(guardKey(ownerId), recordTtl);
            return null;
        });
    }

    @Override
    public void cancelOnDisconnect(String ownerId, String callId) {
        execute("取消断线兜底", () -> redis.opsForSet().remove(guardKey(ownerId), callId));
    }

    @Override
    public void disconnect(String ownerId) {
        Set<String> guarded = execute("读取断线兜底", () -> redis.opsForSet().members(guardKey(ownerId)));
        execute("清理断线兜底", () -> redis.delete(guardKey(ownerId)));
        if (guarded == null) {
            return;
        }
        for (String callId : guarded) {
            boolean ended = guardedUpdate(callId, record -> record.getStatus() != null && !record.getStatus().isTerminal(),
                    CallUpdate.status(CallStatus.ENDED));
            log.info("断线兜底 owner={} callId={} ended={}", ownerId, callId, ended);
        }
    }

    private void publishRecord(String callId, String calleeId, String json) {
        execute("发布通话记录", () -> {
            redis.convertAndSend(recordTopic(callId), json);
            if (calleeId != null) {
                redis.convertAndSend(inboundTopic(calleeId), json);
            }
            return null;
        });
    }

    private <T> T execute(String action, Supplier<T> operation) {
        try {
            return retryTemplate.execute(context -> operation.get());
        } catch (DataAccessException ex) {
            throw new SignalingException(action + "失败: " + ex.getMessage(), ex);
        }
    }

    private CallSession readMessage(Message message) {
        String body = new String(message.getBody(), StandardCharsets.UTF_8);
        return REMOVED.equals(body) ? null : read(body);
    }

    private CallSession read(String json) {
        try {
            return objectMapper.readValue(json, CallSession.class);
        } catch (JsonProcessingException ex) {
            throw new SignalingException("通话记录反序列化失败", ex);
        }
    }

    private IceCandidate readCandidate(String json) {
        try {
            return objectMapper.readValue(json, IceCandidate.class);
        } catch (JsonProcessingException ex) {
            throw new SignalingException("候选地址反序列化失败", ex);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new SignalingException("序列化失败", ex);
        }
    }

    private String recordKey(String callId) {
        return prefix + ":call:" + callId;
    }

    private String candidateKey(String callId, CandidateDirection direction) {
        return prefix + ":call:" + callId + ":" + direction.collection();
    }

    private String inboundKey(String calleeId) {
        return prefix + ":inbound:" + calleeId;
    }

    private String guardKey(String ownerId) {
        return prefix + ":disconnect:" + ownerId;
    }

    private String recordTopic(String callId) {
        return prefix + ":topic:call:" + callId;
    }

    private String inboundTopic(String calleeId) {
        return prefix + ":topic:inbound:" + calleeId;
    }

    private String candidateTopic(String callId, CandidateDirection direction) {
        return prefix + ":topic:call:" + callId + ":" + direction.collection();
    }

    private static Subscription unsubscriber(Runnable action) {
        AtomicBoolean done = new AtomicBoolean();
        return () -> {
            if (done.compareAndSet(false, true)) {
                action.run();
            }
        };
    }

    private enum Outcome {
        WRITTEN,
        REJECTED,
        CONFLICT
    }

    private static final class GuardedResult {
        private final Outcome outcome;
        private final CallSession record;
        private final String json;

        private GuardedResult(Outcome outcome, CallSession record, String json) {
            this.outcome = outcome;
            this.record = record;
            this.json = json;
        }
    }

    /**
     * WATCH 记录键，读出当前值判断条件，成立时在事务里写回；EXEC 返回空说明期间被他人修改
     */
    private final class GuardedWrite implements SessionCallback<GuardedResult> {
        private final String key;
        private final Predicate<CallSession> guard;
        private final CallUpdate update;

        private GuardedWrite(String key, Predicate<CallSession> guard, CallUpdate update) {
            this.key = key;
            this.guard = guard;
            this.update = update;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <K, V> GuardedResult execute(RedisOperations<K, V> operations) throws DataAccessException {
            RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
            ops.watch(key);
            String json = ops.opsForValue().get(key);
            if (json == null) {
                ops.unwatch();
                return new GuardedResult(Outcome.REJECTED, null, null);
            }
            CallSession current = read(json);
            if (!guard.test(current.copy())) {
                ops.unwatch();
                return new GuardedResult(Outcome.REJECTED, current, json);
            }
            update.applyTo(current);
            String next = write(current);
            ops.multi();
            ops.opsForValue().set(key, next, recordTtl);
            List<Object> committed = ops.exec();
            if (committed == null || committed.isEmpty()) {
                return new GuardedResult(Outcome.CONFLICT, current, next);
            }
            return new GuardedResult(Outcome.WRITTEN, current, next);
        }
    }
}
