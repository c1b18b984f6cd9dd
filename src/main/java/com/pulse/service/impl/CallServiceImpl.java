package com.pulse.service.impl;

import cn.hutool.core.util.StrUtil;
import com.pulse.call.CallAgent;
import com.pulse.call.CallAgentFactory;
import com.pulse.entity.dto.call.CallHistoryEntry;
import com.pulse.entity.dto.call.CallSession;
import com.pulse.entity.dto.call.CallStateSnapshot;
import com.pulse.exception.CallException;
import com.pulse.exception.CallStateException;
import com.pulse.repository.CallHistoryRepository;
import com.pulse.service.CallService;
import com.pulse.service.SignalingChannel;
import io.micrometer.core.annotation.Timed;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
@Slf4j
@RequiredArgsConstructor
public class CallServiceImpl implements CallService {

    private static final long OPERATION_TIMEOUT_SECONDS = 10;

    private final CallAgentFactory callAgentFactory;
    private final SignalingChannel signalingChannel;
    private final CallHistoryRepository callHistoryRepository;

    private final ConcurrentMap<String, CallAgent> agents = new ConcurrentHashMap<>();

    @Override
    public CallAgent register(String userId, String displayName) {
        if (StrUtil.isBlank(userId)) {
            throw new IllegalArgumentException("userId不能为空");
        }
        CallAgent agent = agents.computeIfAbsent(userId, id -> {
            log.info("注册通话代理 user={} name={}", id, displayName);
            return callAgentFactory.create(id, displayName);
        });
        await(agent.start());
        return agent;
    }

    @Override
    public void unregister(String userId) {
        CallAgent agent = agents.remove(userId);
        if (agent == null) {
            return;
        }
        try {
            agent.close();
        } finally {
            signalingChannel.disconnect(userId);
            log.info("注销通话代理 user={}", userId);
        }
    }

    @Override
    public Optional<CallAgent> findAgent(String userId) {
        return Optional.ofNullable(agents.get(userId));
    }

    @Override
    public Set<String> onlineUsers() {
        return Set.copyOf(agents.keySet());
    }

    @Override
    @Timed(value = "pulse.call.api", extraTags = {"op", "dial"})
    public CallSession dial(String userId, String calleeId, String calleeName) {
        return await(requireAgent(userId).makeCall(calleeId, calleeName));
    }

    @Override
    @Timed(value = "pulse.call.api", extraTags = {"op", "answer"})
    public CallSession answer(String userId) {
        return await(requireAgent(userId).answerCall());
    }

    @Override
    @Timed(value = "pulse.call.api", extraTags = {"op", "reject"})
    public boolean reject(String userId) {
        return await(requireAgent(userId).rejectCall());
    }

    @Override
    @Timed(value = "pulse.call.api", extraTags = {"op", "hangup"})
    public boolean hangUp(String userId) {
        return await(requireAgent(userId).endCall());
    }

    @Override
    public boolean talk(String userId, boolean talking) {
        return await(requireAgent(userId).toggleTalk(talking));
    }

    @Override
    public CallStateSnapshot state(String userId) {
        return requireAgent(userId).state();
    }

    @Override
    public List<CallHistoryEntry> history(String userId, int limit) {
        return callHistoryRepository.findByParticipant(userId, limit);
    }

    @PreDestroy
    public void shutdown() {
        for (String userId : new ArrayList<>(agents.keySet())) {
            try {
                unregister(userId);
            } catch (RuntimeException ex) {
                log.warn("关闭通话代理失败 user={}", userId, ex);
            }
        }
    }

    private CallAgent requireAgent(String userId) {
        CallAgent agent = agents.get(userId);
        if (agent == null) {
            throw new CallStateException("用户未上线 user=" + userId);
        }
        return agent;
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.get(OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new CallException("通话操作失败", cause);
        } catch (TimeoutException ex) {
            throw new CallException("通话操作超时", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CallException("通话操作被中断", ex);
        }
    }
}
