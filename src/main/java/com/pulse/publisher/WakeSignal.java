package com.pulse.publisher;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 发给被叫的唤醒通知，只携带展示所需的信息
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WakeSignal {
    private String id;
    private String callId;
    private String callerId;
    private String callerName;
    private String calleeId;
    private Long sentAt;
}
