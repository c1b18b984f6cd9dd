package com.pulse.call;

import com.pulse.entity.dto.call.CallSession;
import com.pulse.entity.dto.call.CallStatus;
import com.pulse.tools.IdentityOrder;

/**
 * 本地忙时收到来电的裁决。
 * <p>
 * 双方互呼（glare）时按身份全序决定：较小的一方放弃自己的呼叫并接听对方，
 * 较大的一方保留自己的呼叫并把对方的来电标记为 BUSY。双方独立计算也会得到同一个结果。
 */
public class GlareArbitrator {

    public enum Decision {
        /** 普通占线，来电标记为 BUSY */
        BUSY,
        /** 互呼且本方较小：结束自己的呼叫，接听来电 */
        YIELD,
        /** 互呼且本方较大：保留自己的呼叫，来电标记为 BUSY */
        KEEP
    }

    /**
     * @param localId       本地身份
     * @param localRole     本地当前通话的角色
     * @param localRemoteId 本地当前通话的对端
     * @param localStatus   本地当前通话的状态
     * @param inbound       新到的来电
     */
    public Decision arbitrate(String localId, NegotiationEngine.Role localRole, String localRemoteId,
                              CallStatus localStatus, CallSession inbound) {
        if (!isGlare(localRole, localRemoteId, localStatus, inbound)) {
            return Decision.BUSY;
        }
        return IdentityOrder.compare(localId, inbound.getCallerId()) < 0 ? Decision.YIELD : Decision.KEEP;
    }

    static boolean isGlare(NegotiationEngine.Role localRole, String localRemoteId, CallStatus localStatus,
                           CallSession inbound) {
        return localRole == NegotiationEngine.Role.OFFERER
                && inbound.getCallerId() != null
                && inbound.getCallerId().equals(localRemoteId)
                && (localStatus == CallStatus.OFFERING || localStatus == CallStatus.RINGING);
    }
}
