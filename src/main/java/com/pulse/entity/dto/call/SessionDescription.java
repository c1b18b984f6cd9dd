package com.pulse.entity.dto.call;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 会话描述，payload 对信令层不透明
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionDescription {
    private SdpType type;
    private String payload;

    public static SessionDescription offer(String payload) {
        return new SessionDescription(SdpType.OFFER, payload);
    }

    public static SessionDescription answer(String payload) {
        return new SessionDescription(SdpType.ANSWER, payload);
    }
}
