package com.example.backup.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ContinuityReport {
    String storeName;
    Long oldestSequence;
    Long newestSequence;
    long archivedCount;
    @Singular
    List<SequenceGap> gaps;
    Instant scannedAt;

    public boolean isContinuous() {
        return gaps.isEmpty();
    }
}
