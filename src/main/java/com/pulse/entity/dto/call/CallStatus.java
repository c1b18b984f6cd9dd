package com.pulse.entity.dto.call;

import java.util.EnumSet;
import java.util.Set;

/**
 * 通话状态
 * <p>
 * 前进链路 OFFERING → RINGING → CONNECTING → CONNECTED，
 * 任意非终态都可以进入 ENDED / REJECTED / BUSY。
 * MISSED 只在归档时使用：通话结束前从未到达 CONNECTED。
 */
public enum CallStatus {
    OFFERING(0),
    RINGING(1),
    CONNECTING(2),
    CONNECTED(3),
    ENDED(-1),
    REJECTED(-1),
    BUSY(-1),
    MISSED(-1);

    private static final Set<CallStatus> TERMINAL = EnumSet.of(ENDED, REJECTED, BUSY, MISSED);

    private final int rank;

    CallStatus(int rank) {
        this.rank = rank;
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public int rank() {
        return rank;
    }

    /**
     * 前进链路上的下一个状态，CONNECTED 和终态没有下一个
     */
    public CallStatus next() {
        return switch (this) {
            case OFFERING -> RINGING;
            case RINGING -> CONNECTING;
            case CONNECTING -> CONNECTED;
            default -> null;
        };
    }

    /**
     * 只允许沿前进链路走一步，或者从非终态进入终态
     */
    public boolean canTransitionTo(CallStatus target) {
        if (target == null || isTerminal()) {
            return false;
        }
        if (target.isTerminal()) {
            return target != MISSED;
        }
        return target.rank == rank + 1;
    }

    /**
     * 兼容存储层的字符串值，未知值返回null
     */
    public static CallStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return CallStatus.valueOf(raw.trim().toUpperCase());
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
