package com.example.backup.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * 스토어 단위 RPO/RTO 평가 결과
 * rpo/rto 가 null 이면 측정 불가(데이터 없음)로 CRITICAL 처리
 */
@Value
@Builder
public class StoreCompliance {
    String storeName;
    StorageTier tier;

    Duration rpo;
    Duration rpoTarget;
    ComplianceLevel rpoLevel;
    Instant newestSegmentAt;
    Instant newestPassedBackupAt;

    Duration rto;
    Duration rtoTarget;
    ComplianceLevel rtoLevel;
    Duration lastMeasuredRestore;

    public ComplianceLevel getLevel() {
        return rpoLevel.worst(rtoLevel);
    }
}
