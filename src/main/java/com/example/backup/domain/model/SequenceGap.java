package com.example.backup.domain.model;

import lombok.Value;

/**
 * 누락된 시퀀스 구간 [fromSequence, toSequence] (양 끝 포함)
 */
@Value
public class SequenceGap {
    long fromSequence;
    long toSequence;

    public long size() {
        return toSequence - fromSequence + 1;
    }

    public boolean contains(long sequenceId) {
        return sequenceId >= fromSequence && sequenceId <= toSequence;
    }
}
