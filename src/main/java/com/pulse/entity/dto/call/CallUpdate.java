package com.pulse.entity.dto.call;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 对通话记录的部分字段修改。值为 null 表示删除该字段。
 */
public final class CallUpdate {

    public static final String STATUS = "status";
    public static final String OFFER = "offer";
    public static final String ANSWER = "answer";
    public static final String ACTIVE_SPEAKER_ID = "activeSpeakerId";
    public static final String ENDED_AT = "endedAt";
    public static final String DURATION = "duration";

    private final Map<String, Object> fields = new LinkedHashMap<>();

    public static CallUpdate create() {
        return new CallUpdate();
    }

    public static CallUpdate status(CallStatus status) {
        return create().withStatus(status);
    }

    public CallUpdate withStatus(CallStatus status) {
        fields.put(STATUS, status);
        return this;
    }

    public CallUpdate withOffer(SessionDescription offer) {
        fields.put(OFFER, offer);
        return this;
    }

    public CallUpdate withAnswer(SessionDescription answer) {
        fields.put(ANSWER, answer);
        return this;
    }

    public CallUpdate clearAnswer() {
        fields.put(ANSWER, null);
        return this;
    }

    public CallUpdate withActiveSpeaker(String speakerId) {
        fields.put(ACTIVE_SPEAKER_ID, speakerId);
        return this;
    }

    public CallUpdate withEndedAt(long endedAt) {
        fields.put(ENDED_AT, endedAt);
        return this;
    }

    public CallUpdate withDuration(long duration) {
        fields.put(DURATION, duration);
        return this;
    }

    public void applyTo(CallSession record) {
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            Object value = entry.getValue();
            switch (entry.getKey()) {
                case STATUS -> record.setStatus((CallStatus) value);
                case OFFER -> record.setOffer((SessionDescription) value);
                case ANSWER -> record.setAnswer((SessionDescription) value);
                case ACTIVE_SPEAKER_ID -> record.setActiveSpeakerId((String) value);
                case ENDED_AT -> record.setEndedAt((Long) value);
                case DURATION -> record.setDuration((Long) value);
                default -> throw new IllegalStateException("unknown field " + entry.getKey());
            }
        }
    }

    @Override
    public String toString() {
        return "CallUpdate" + fields.keySet();
    }
}
