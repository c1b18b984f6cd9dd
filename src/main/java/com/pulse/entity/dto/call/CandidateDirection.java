package com.pulse.entity.dto.call;

/**
 * 候选地址的发出方，决定写入哪一个子集合
 */
public enum CandidateDirection {
    CALLER("offerCandidates"),
    CALLEE("answerCandidates");

    private final String collection;

    CandidateDirection(String collection) {
        this.collection = collection;
    }

    public String collection() {
        return collection;
    }

    public CandidateDirection opposite() {
        return this == CALLER ? CALLEE : CALLER;
    }
}
