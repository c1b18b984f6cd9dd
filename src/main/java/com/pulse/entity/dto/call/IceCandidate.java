package com.pulse.entity.dto.call;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IceCandidate {
    private String candidate;
    private String sdpMid;
    private Integer sdpMLineIndex;

    /**
     * 去重用的内容键，字段顺序固定
     */
    public String contentKey() {
        return candidate + "|" + sdpMid + "|" + sdpMLineIndex;
    }
}
