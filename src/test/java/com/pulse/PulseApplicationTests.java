package com.pulse;

import com.pulse.service.CallService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class PulseApplicationTests {

    @Autowired
    private TestRestTemplate rest;

    @Autowired
    private CallService callService;

    @AfterEach
    void tearDown() {
        for (String userId : callService.onlineUsers()) {
            callService.unregister(userId);
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> post(String path) {
        Map<String, Object> body = rest.postForObject(path, null, Map.class);
        assertThat(body).isNotNull();
        return body;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> get(String path) {
        Map<String, Object> body = rest.getForObject(path, Map.class);
        assertThat(body).isNotNull();
        return body;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> awaitState(String userId, Predicate<Map<String, Object>> condition)
            throws InterruptedException {
        Map<String, Object> state = Map.of();
        for (int i = 0; i < 100; i++) {
            state = (Map<String, Object>) get("/call/" + userId + "/state").get("data");
            if (state != null && condition.test(state)) {
                return state;
            }
            Thread.sleep(50);
        }
        throw new AssertionError("状态未达到预期 user=" + userId + " state=" + state);
    }

    @Test
    void dialHangUpAndHistoryOverRest() throws InterruptedException {
        assertThat(post("/call/agents/a1?name=Alice").get("code")).isEqualTo(200);
        assertThat(post("/call/agents/b2?name=Bob").get("code")).isEqualTo(200);
        assertThat((List<?>) get("/call/agents").get("data")).hasSize(2);

        Map<String, Object> dialed = post("/call/a1/dial?calleeId=b2");
        assertThat(dialed.get("code")).isEqualTo(200);

        awaitState("a1", state -> "CONNECTED".equals(state.get("status")));
        awaitState("b2", state -> "CONNECTED".equals(state.get("status")));

        assertThat(post("/call/b2/talk?talking=true").get("data")).isEqualTo(true);
        awaitState("a1", state -> Boolean.FALSE.equals(state.get("remotePlaybackMuted")));

        assertThat(post("/call/a1/end").get("data")).isEqualTo(true);
        awaitState("b2", state -> "REMOTE_ENDED".equals(state.get("lastEndReason")));

        List<?> history = (List<?>) get("/call/a1/history").get("data");
        assertThat(history).hasSize(1);
    }

    @Test
    void operationsOnUnknownAgentReturnError() {
        Map<String, Object> result = post("/call/ghost/end");

        assertThat(result.get("code")).isEqualTo(409);
        assertThat(result.get("msg")).isNotNull();
    }

    @Test
    void selfCallIsRejected() {
        post("/call/agents/a1");

        Map<String, Object> result = post("/call/a1/dial?calleeId=a1");

        assertThat(result.get("code")).isEqualTo(400);
    }
}
