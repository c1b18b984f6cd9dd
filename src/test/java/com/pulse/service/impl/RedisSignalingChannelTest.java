package com.pulse.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulse.config.PulseProperties;
import com.pulse.entity.dto.call.CallSession;
import com.pulse.entity.dto.call.CallStatus;
import com.pulse.entity.dto.call.CallUpdate;
import com.pulse.entity.dto.call.SessionDescription;
import com.pulse.exception.SignalingException;
import com.pulse.service.Subscription;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.DefaultMessage;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.listener.Topic;
import org.springframework.retry.support.RetryTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisSignalingChannelTest {

    private static final String RECORD_KEY = "pulse:call:c1";

    @Mock
    private StringRedisTemplate redis;

    @Mock
    private RedisMessageListenerContainer container;

    @Mock
    private RedisOperations<String, String> session;

    @Mock
    private ValueOperations<String, String> sessionValues;

    @Mock
    private ValueOperations<String, String> values;

    @Mock
    private SetOperations<String, String> sets;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private RedisSignalingChannel channel;

    @BeforeEach
    void setUp() {
        PulseProperties.Signaling properties = new PulseProperties.Signaling();
        properties.setGuardedUpdateAttempts(3);
        channel = new RedisSignalingChannel(redis, container, RetryTemplate.builder().maxAttempts(1).build(),
                objectMapper, properties);
    }

    private String offeringJson() throws Exception {
        CallSession record = CallSession.builder()
                .callId("c1")
                .callerId("a1")
                .calleeId("b2")
                .status(CallStatus.OFFERING)
                .offer(SessionDescription.offer("loopback:t1:1"))
                .startedAt(1L)
                .build();
        return objectMapper.writeValueAsString(record);
    }

    /**
     * 事务回调直接跑在模拟的会话上
     */
    @SuppressWarnings("unchecked")
    private void transactionsRunOnSession(String stored) {
        when(redis.execute(any(SessionCallback.class))).thenAnswer(invocation -> {
            SessionCallback<?> callback = invocation.getArgument(0);
            return callback.execute(session);
        });
        when(session.opsForValue()).thenReturn(sessionValues);
        when(sessionValues.get(RECORD_KEY)).thenReturn(stored);
    }

    @Test
    void rejectedGuardReleasesTheWatchAndWritesNothing() throws Exception {
        transactionsRunOnSession(offeringJson());

        boolean written = channel.guardedUpdate("c1", record -> record.getStatus() == CallStatus.RINGING,
                CallUpdate.status(CallStatus.CONNECTING));

        assertThat(written).isFalse();
        verify(session).watch(RECORD_KEY);
        verify(session).unwatch();
        verify(session, never()).multi();
        verify(redis, never()).convertAndSend(any(), any());
    }

    @Test
    void missingRecordIsRejected() {
        transactionsRunOnSession(null);

        boolean written = channel.update("c1", CallUpdate.status(CallStatus.ENDED));

        assertThat(written).isFalse();
        verify(session).unwatch();
    }

    @Test
    void conflictingExecIsRetriedAndThenPublished() throws Exception {
        transactionsRunOnSession(offeringJson());
        List<Object> committed = List.of(true);
        when(session.exec()).thenReturn(Collections.emptyList()).thenReturn(committed);

        boolean written = channel.guardedUpdate("c1", record -> record.getStatus() == CallStatus.OFFERING,
                CallUpdate.status(CallStatus.RINGING));

        assertThat(written).isTrue();
        verify(session, times(2)).watch(RECORD_KEY);
        verify(session, times(2)).multi();
        verify(sessionValues, times(2)).set(eq(RECORD_KEY), any(), eq(Duration.ofHours(1)));

        ArgumentCaptor<Object> published = ArgumentCaptor.forClass(Object.class);
        verify(redis).convertAndSend(eq("pulse:topic:call:c1"), published.capture());
        CallSession update = objectMapper.readValue((String) published.getValue(), CallSession.class);
        assertThat(update.getStatus()).isEqualTo(CallStatus.RINGING);
        assertThat(update.getOffer().getPayload()).isEqualTo("loopback:t1:1");
        verify(redis).convertAndSend(eq("pulse:topic:inbound:b2"), any());
    }

    @Test
    void endlessConflictsGiveUpAfterConfiguredAttempts() throws Exception {
        transactionsRunOnSession(offeringJson());
        when(session.exec()).thenReturn(null);

        assertThatThrownBy(() -> channel.guardedUpdate("c1", record -> true, CallUpdate.status(CallStatus.RINGING)))
                .isInstanceOf(SignalingException.class)
                .hasMessageContaining("c1");

        verify(session, times(3)).multi();
        verify(redis, never()).convertAndSend(any(), any());
    }

    @Test
    void removePublishesTheEmptySentinel() throws Exception {
        when(redis.opsForValue()).thenReturn(values);
        when(values.get(RECORD_KEY)).thenReturn(offeringJson());
        when(redis.opsForSet()).thenReturn(sets);

        channel.remove("c1");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Collection<String>> deleted = ArgumentCaptor.forClass(Collection.class);
        verify(redis).delete(deleted.capture());
        assertThat(deleted.getValue()).containsExactly(
                RECORD_KEY, "pulse:call:c1:offerCandidates", "pulse:call:c1:answerCandidates");
        verify(sets).remove("pulse:inbound:b2", "c1");
        verify(redis).convertAndSend("pulse:topic:call:c1", "");
        verify(redis).convertAndSend("pulse:topic:inbound:b2", "");
    }

    @Test
    void removingAnUnknownRecordPublishesNothing() {
        when(redis.opsForValue()).thenReturn(values);

        channel.remove("c1");

        verify(redis, never()).convertAndSend(any(), any());
    }

    @Test
    void connectionFailureSurfacesAsSignalingException() {
        when(redis.opsForValue()).thenReturn(values);
        when(values.get(RECORD_KEY)).thenThrow(new RedisConnectionFailureException("连接被拒绝"));

        assertThatThrownBy(() -> channel.get("c1"))
                .isInstanceOf(SignalingException.class)
                .hasCauseInstanceOf(RedisConnectionFailureException.class);
    }

    @Test
    void subscriptionReplaysCurrentValueAndMapsSentinelToRemoval() throws Exception {
        when(redis.opsForValue()).thenReturn(values);
        when(values.get(RECORD_KEY)).thenReturn(offeringJson());
        List<CallSession> seen = new ArrayList<>();

        Subscription subscription = channel.subscribe("c1", (id, record) -> seen.add(record));

        ArgumentCaptor<MessageListener> listener = ArgumentCaptor.forClass(MessageListener.class);
        verify(container).addMessageListener(listener.capture(), any(Topic.class));
        listener.getValue().onMessage(new DefaultMessage("pulse:topic:call:c1".getBytes(StandardCharsets.UTF_8),
                new byte[0]), null);
        assertThat(seen).hasSize(2);
        assertThat(seen.get(0).getStatus()).isEqualTo(CallStatus.OFFERING);
        assertThat(seen.get(1)).isNull();

        subscription.unsubscribe();
        subscription.unsubscribe();
        verify(container, times(1)).removeMessageListener(eq(listener.getValue()), any(Topic.class));
    }
}
