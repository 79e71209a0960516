package com.example.backup.domain.model;

import com.example.backup.domain.entity.BackupArtifact;
import com.example.backup.domain.entity.LogSegment;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 복구 목표를 해석한 결과
 * base (+ 선택적 증분 체인) 위에 replayFrom 다음 시퀀스부터 targetSequence 까지 세그먼트를 재생
 */
@Value
@Builder
public class RecoveryPlan {
    String storeName;
    RecoveryTarget target;
    BackupArtifact baseArtifact;
    @Singular
    List<BackupArtifact> incrementals;
    @Singular
    List<LogSegment> segments;
    long targetSequence;

    /**
     * 재생 시작 직전 시퀀스 (베이스/마지막 증분의 consistency marker)
     */
    public long getReplayFrom() {
        if (!incrementals.isEmpty()) {
            return incrementals.get(incrementals.size() - 1).getConsistencyMarker();
        }
        return baseArtifact.getConsistencyMarker();
    }

    public boolean isNoOpReplay() {
        return targetSequence == getReplayFrom();
    }
}
