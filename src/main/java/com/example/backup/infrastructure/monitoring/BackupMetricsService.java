package com.example.backup.infrastructure.monitoring;

import com.example.backup.domain.model.ArtifactType;
import com.example.backup.domain.model.ComplianceLevel;
import com.example.backup.domain.model.RestoreState;
import com.example.backup.domain.model.ValidationVerdict;

/**
 * 백업 엔진 메트릭 수집 인터페이스
 */
public interface BackupMetricsService {

    void recordBackupProduced(String store, ArtifactType type, long sizeBytes, long durationMs);

    void recordBackupFailure(String store, ArtifactType type, String errorKind);

    void recordSegmentArchived(String store, boolean alreadyArchived);

    void recordArchiveFailure(String store, String errorKind);

    void recordGapCount(String store, long missingSegments);

    void recordValidation(String store, ValidationVerdict verdict);

    void recordRehearsalDuration(String store, long durationMs);

    void recordRestore(String store, RestoreState finalState, long durationMs);

    /**
     * 컴플라이언스 틱마다 갱신되는 스토어별 지표 (초 단위, 측정 불가 시 -1)
     */
    void updateStoreAges(String store, long backupAgeSeconds, long walArchiveAgeSeconds, long latestBackupSizeBytes);

    void updateCompliance(String store, long rpoSeconds, long rtoSeconds, ComplianceLevel level);

    void updateStorageUsage(long usedBytes, long availableBytes);

    void recordAlert(String alertType, String severity);
}
