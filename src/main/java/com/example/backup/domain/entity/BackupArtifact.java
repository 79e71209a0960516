package com.example.backup.domain.entity;

import com.example.backup.domain.model.ArtifactType;
import com.example.backup.domain.model.TrustState;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * 백업 아티팩트 카탈로그 엔트리
 * - 아티팩트 바이트는 아카이브에, 메타데이터만 카탈로그에 저장
 * - consistencyMarker: 스냅샷이 일관성을 갖는 로그 시퀀스
 */
@Entity
@Table(name = "backup_artifacts", indexes = {
        @Index(name = "idx_artifact_store", columnList = "storeName"),
        @Index(name = "idx_artifact_marker", columnList = "storeName, consistencyMarker"),
        @Index(name = "idx_artifact_trust", columnList = "trustState")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackupArtifact {

    @Id
    private String artifactId;

    @Column(nullable = false)
    private String storeName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ArtifactType artifactType;

    private String parentArtifactId; // 증분 백업의 부모

    @Column(nullable = false)
    private Instant startedAt; // 스냅샷 시점

    private Instant completedAt;

    private long sizeBytes;

    @Column(nullable = false)
    private String checksum; // SHA-256

    @Column(nullable = false)
    private Long consistencyMarker;

    private Long baseMarker; // 증분 백업이 포함하는 변경의 시작 시퀀스 (FULL 은 0)

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private TrustState trustState = TrustState.UNTESTED;

    @Column(nullable = false)
    private String location;

    private String checksumLocation;

    private long recordCount;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "backup_artifact_counts", joinColumns = @JoinColumn(name = "artifact_id"))
    @MapKeyColumn(name = "collection_name")
    @Column(name = "record_count")
    @Builder.Default
    private Map<String, Long> collectionCounts = new HashMap<>();

    private Instant lastValidatedAt;

    private String lastReportId;

    /**
     * 신뢰 상태 전이 (UNTESTED 에서만 가능)
     */
    public void markTrust(TrustState verdict) {
        if (trustState != TrustState.UNTESTED) {
            throw new IllegalStateException(
                    "Trust state of artifact " + artifactId + " is already " + trustState);
        }
        if (verdict == TrustState.UNTESTED) {
            throw new IllegalArgumentException("Verdict must be PASSED or FAILED");
        }
        this.trustState = verdict;
    }

    public boolean isFull() {
        return artifactType == ArtifactType.FULL;
    }

    public boolean isPassed() {
        return trustState == TrustState.PASSED;
    }

    public Duration getProductionDuration() {
        if (startedAt == null || completedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, completedAt);
    }
}
