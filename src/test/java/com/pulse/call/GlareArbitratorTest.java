package com.pulse.call;

import com.pulse.entity.dto.call.CallSession;
import com.pulse.entity.dto.call.CallStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GlareArbitratorTest {

    private final GlareArbitrator arbitrator = new GlareArbitrator();

    private static CallSession inboundFrom(String callerId) {
        return CallSession.builder()
                .callId("in-" + callerId)
                .callerId(callerId)
                .status(CallStatus.OFFERING)
                .build();
    }

    @Test
    void smallerIdentityYieldsAndLargerKeeps() {
        assertThat(arbitrator.arbitrate("a1", NegotiationEngine.Role.OFFERER, "b2", CallStatus.OFFERING, inboundFrom("b2")))
                .isEqualTo(GlareArbitrator.Decision.YIELD);
        assertThat(arbitrator.arbitrate("b2", NegotiationEngine.Role.OFFERER, "a1", CallStatus.OFFERING, inboundFrom("a1")))
                .isEqualTo(GlareArbitrator.Decision.KEEP);
    }

    @Test
    void numericIdentitiesCompareByValue() {
        assertThat(arbitrator.arbitrate("9", NegotiationEngine.Role.OFFERER, "10", CallStatus.RINGING, inboundFrom("10")))
                .isEqualTo(GlareArbitrator.Decision.YIELD);
        assertThat(arbitrator.arbitrate("10", NegotiationEngine.Role.OFFERER, "9", CallStatus.RINGING, inboundFrom("9")))
                .isEqualTo(GlareArbitrator.Decision.KEEP);
    }

    @Test
    void callFromSomeoneElseIsBusy() {
        assertThat(arbitrator.arbitrate("a1", NegotiationEngine.Role.OFFERER, "b2", CallStatus.OFFERING, inboundFrom("c3")))
                .isEqualTo(GlareArbitrator.Decision.BUSY);
    }

    @Test
    void establishedOrAnsweringCallIsNeverGlare() {
        assertThat(arbitrator.arbitrate("a1", NegotiationEngine.Role.OFFERER, "b2", CallStatus.CONNECTING, inboundFrom("b2")))
                .isEqualTo(GlareArbitrator.Decision.BUSY);
        assertThat(arbitrator.arbitrate("a1", NegotiationEngine.Role.OFFERER, "b2", CallStatus.CONNECTED, inboundFrom("b2")))
                .isEqualTo(GlareArbitrator.Decision.BUSY);
        assertThat(arbitrator.arbitrate("a1", NegotiationEngine.Role.ANSWERER, "b2", CallStatus.RINGING, inboundFrom("b2")))
                .isEqualTo(GlareArbitrator.Decision.BUSY);
    }
}
