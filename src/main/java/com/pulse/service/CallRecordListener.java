package com.pulse.service;

import com.pulse.entity.dto.call.CallSession;

@FunctionalInterface
public interface CallRecordListener {

    /**
     * @param callId 记录ID
     * @param record 记录的最新快照；记录被删除后为 null
     */
    void onRecord(String callId, CallSession record);
}
