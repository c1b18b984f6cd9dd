package com.pulse.repository;

import com.pulse.entity.dto.call.CallHistoryEntry;

import java.util.List;

public interface CallHistoryRepository {
    /*
     * 归档一次已结束的通话，同一个callId只保留第一次写入
     * */
    void save(CallHistoryEntry entry);

    /*
     * 查询某个用户参与过的通话，按结束时间倒序
     * @param userId 主叫或被叫
     * @param limit  最多返回的条数
     * */
    List<CallHistoryEntry> findByParticipant(String userId, int limit);
}
