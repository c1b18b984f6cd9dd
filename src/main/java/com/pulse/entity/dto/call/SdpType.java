package com.pulse.entity.dto.call;

public enum SdpType {
    OFFER,
    ANSWER
}
