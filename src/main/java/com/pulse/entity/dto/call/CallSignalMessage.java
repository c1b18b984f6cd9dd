package com.pulse.entity.dto.call;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CallSignalMessage {
    private CallAction action;
    private String calleeId;
    private String calleeName;
    private Boolean talking;
    private CallStateSnapshot state;
    private Long timestamp;
    private String reason;
}
