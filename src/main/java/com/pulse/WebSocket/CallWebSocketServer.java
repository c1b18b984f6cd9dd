package com.pulse.WebSocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.RateLimiter;
import com.pulse.call.CallAgent;
import com.pulse.call.CallStateListener;
import com.pulse.entity.dto.call.*;
import com.pulse.exception.CallException;
import com.pulse.service.CallService;
import jakarta.websocket.*;
import jakarta.websocket.server.PathParam;
import jakarta.websocket.server.ServerEndpoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 客户端连接即上线：建立连接时为该身份注册通话代理，断开时注销并触发断线兜底。
 * 代理的状态变化以 STATE 消息推送给客户端。
 */
@Component
@ServerEndpoint("/ws/call/{userId}")
@Slf4j
public class CallWebSocketServer {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final Map<String, ClientConnection> CONNECTIONS = new ConcurrentHashMap<>();
    private static final long HEARTBEAT_TIMEOUT_MS = 30_000;

    private static final Map<String, RateLimiter> RATE_LIMITERS = new ConcurrentHashMap<>();
    private static CallService callService;

    @Autowired
    public void setCallService(CallService callService) {
        CallWebSocketServer.callService = callService;
    }

    @OnOpen
    public void onOpen(Session session, @PathParam("userId") String userId) {
        ClientConnection old = CONNECTIONS.get(userId);
        if (old != null) {
            // 关闭旧连接，保留新连接；先移除登记，旧连接的 onClose 不再注销代理
            CONNECTIONS.remove(userId, old);
            detach(userId, old);
            try {
                old.session().close(new CloseReason(CloseReason.CloseCodes.CANNOT_ACCEPT, "Duplicate connection"));
            } catch (Exception e) {
                log.warn("关闭重复连接失败 userId={}", userId, e);
            }
        }
        CallAgent agent = callService.register(userId, queryParam(session, "name"));
        CallStateListener listener = new CallStateListener() {
            @Override
            public void onStateChanged(CallStateSnapshot snapshot) {
                send(session, stateMessage(snapshot));
            }
        };
        ClientConnection connection = new ClientConnection(session, listener);
        CONNECTIONS.put(userId, connection);
        agent.addListener(listener);
        log.info("呼叫WebSocket建立 userId={} session={}", userId, session.getId());
        send(session, stateMessage(agent.state()));
    }

    @OnMessage
    public void onMessage(String message, @PathParam("userId") String userId) {
        // 对讲键按下松开比较频繁，放宽到 20 QPS
        RateLimiter limiter = RATE_LIMITERS.computeIfAbsent(userId, k -> RateLimiter.create(20));
        if (!limiter.tryAcquire()) {
            log.warn("用户信令频率超限 userId={}", userId);
            send(userId, buildError("RATE_LIMIT_EXCEEDED"));
            return;
        }
        CallSignalMessage signal;
        try {
            signal = OBJECT_MAPPER.readValue(message, CallSignalMessage.class);
        } catch (Exception ex) {
            log.error("解析信令失败 userId={} raw={}", userId, message, ex);
            send(userId, buildError("INVALID_PAYLOAD"));
            return;
        }
        log.debug("收到信令 userId={} action={}", userId, signal.getAction());
        try {
            route(userId, signal);
        } catch (CallException | IllegalArgumentException ex) {
            log.warn("处理信令失败 userId={} action={} reason={}", userId, signal.getAction(), ex.getMessage());
            send(userId, buildError(ex.getMessage()));
        }
    }

    @OnClose
    public void onClose(Session session, @PathParam("userId") String userId) {
        ClientConnection connection = CONNECTIONS.get(userId);
        if (connection == null || connection.session() != session) {
            return;
        }
        detach(userId, connection);
        CONNECTIONS.remove(userId, connection);
        RATE_LIMITERS.remove(userId);
        callService.unregister(userId);
        log.info("呼叫WebSocket关闭 userId={}", userId);
    }

    @OnError
    public void onError(Session session, Throwable error, @PathParam("userId") String userId) {
        log.error("呼叫WebSocket异常 userId={} session={}", userId, session != null ? session.getId() : "N/A", error);
    }

    private void route(String userId, CallSignalMessage message) {
        if (message.getAction() == null) {
            send(userId, buildError("ACTION_REQUIRED"));
            return;
        }
        switch (message.getAction()) {
            case DIAL -> {
                if (message.getCalleeId() == null) {
                    send(userId, buildError("CALLEE_REQUIRED"));
                    return;
                }
                callService.dial(userId, message.getCalleeId(), message.getCalleeName());
            }
            case ANSWER -> callService.answer(userId);
            case REJECT -> callService.reject(userId);
            case END -> callService.hangUp(userId);
            case TALK -> callService.talk(userId, Boolean.TRUE.equals(message.getTalking()));
            case HEARTBEAT -> handleHeartbeat(userId);
            case STATE -> send(userId, stateMessage(callService.state(userId)));
            default -> send(userId, buildError("UNSUPPORTED_ACTION"));
        }
    }

    private void handleHeartbeat(String userId) {
        ClientConnection connection = CONNECTIONS.get(userId);
        if (connection != null) {
            connection.touch();
        }
        send(userId, heartbeatAck());
    }

    private static void detach(String userId, ClientConnection connection) {
        callService.findAgent(userId).ifPresent(agent -> agent.removeListener(connection.listener()));
    }

    private static String queryParam(Session session, String name) {
        List<String> values = session.getRequestParameterMap().get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static CallSignalMessage stateMessage(CallStateSnapshot snapshot) {
        CallSignalMessage state = new CallSignalMessage();
        state.setAction(CallAction.STATE);
        state.setState(snapshot);
        state.setTimestamp(Instant.now().toEpochMilli());
        return state;
    }

    private static CallSignalMessage buildError(String reason) {
        CallSignalMessage error = new CallSignalMessage();
        error.setAction(CallAction.ERROR);
        error.setReason(reason);
        error.setTimestamp(Instant.now().toEpochMilli());
        return error;
    }

    private static CallSignalMessage heartbeatAck() {
        CallSignalMessage ack = new CallSignalMessage();
        ack.setAction(CallAction.HEARTBEAT);
        ack.setTimestamp(Instant.now().toEpochMilli());
        return ack;
    }

    private static void send(String userId, CallSignalMessage message) {
        ClientConnection connection = CONNECTIONS.get(userId);
        if (connection == null) {
            return;
        }
        send(connection.session(), message);
    }

    private static void send(Session session, CallSignalMessage message) {
        try {
            if (session != null && session.isOpen()) {
                session.getAsyncRemote().sendText(OBJECT_MAPPER.writeValueAsString(message));
            }
        } catch (IOException e) {
            log.error("发送信令失败 session={} action={}", session != null ? session.getId() : "N/A", message.getAction(), e);
        }
    }

    /**
     * 关闭心跳超时的连接，注销在 onClose 里完成
     */
    static int cleanupStaleConnections() {
        int closed = 0;
        for (Map.Entry<String, ClientConnection> entry : CONNECTIONS.entrySet()) {
            ClientConnection connection = entry.getValue();
            if (!connection.isExpired()) {
                continue;
            }
            Session session = connection.session();
            if (session != null && session.isOpen()) {
                try {
                    session.close(new CloseReason(CloseReason.CloseCodes.GOING_AWAY, "Heartbeat timeout"));
                    closed++;
                } catch (IOException e) {
                    log.warn("关闭过期连接失败 userId={}", entry.getKey(), e);
                }
            }
        }
        return closed;
    }

    private record ClientConnection(Session session, CallStateListener listener, AtomicLong lastHeartbeat) {
        ClientConnection(Session session, CallStateListener listener) {
            this(session, listener, new AtomicLong(System.currentTimeMillis()));
        }

        void touch() {
            lastHeartbeat.set(System.currentTimeMillis());
        }

        boolean isExpired() {
            return System.currentTimeMillis() - lastHeartbeat.get() > HEARTBEAT_TIMEOUT_MS;
        }
    }
}
