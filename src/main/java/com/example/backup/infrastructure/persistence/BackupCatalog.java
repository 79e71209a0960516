package com.example.backup.infrastructure.persistence;

import com.example.backup.domain.entity.BackupArtifact;
import com.example.backup.domain.entity.LogSegment;
import com.example.backup.domain.entity.RestoreRun;
import com.example.backup.domain.entity.ValidationReport;
import com.example.backup.domain.exception.PolicyViolationException;
import com.example.backup.domain.model.ArtifactType;
import com.example.backup.domain.model.RestoreState;
import com.example.backup.domain.model.SegmentStatus;
import com.example.backup.domain.model.TrustState;
import com.example.backup.domain.model.ValidationVerdict;
import com.example.backup.infrastructure.persistence.jpa.BackupArtifactJpaRepository;
import com.example.backup.infrastructure.persistence.jpa.LogSegmentJpaRepository;
import com.example.backup.infrastructure.persistence.jpa.RestoreRunJpaRepository;
import com.example.backup.infrastructure.persistence.jpa.ValidationReportJpaRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 백업 카탈로그 (아티팩트/세그먼트/검증 리포트/복구 실행 메타데이터)
 *
 * 아티팩트 바이트는 아카이브에만 존재하며, 카탈로그 조회는 아카이브를 건드리지 않는다.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class BackupCatalog {

    /**
     * 베이스 선택 tie-break: marker, 완료 시각, ID 순
     */
    public static final Comparator<BackupArtifact> NEWEST_FIRST = Comparator
            .comparing(BackupArtifact::getConsistencyMarker)
            .thenComparing(BackupArtifact::getCompletedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(BackupArtifact::getArtifactId)
            .reversed();

    private final BackupArtifactJpaRepository artifactRepository;
    private final LogSegmentJpaRepository segmentRepository;
    private final ValidationReportJpaRepository reportRepository;
    private final RestoreRunJpaRepository restoreRunRepository;

    // ---------------------------------------------------------------- artifacts

    @Transactional
    public BackupArtifact saveArtifact(BackupArtifact artifact) {
        return artifactRepository.save(artifact);
    }

    @Transactional(readOnly = true)
    public Optional<BackupArtifact> findArtifact(String artifactId) {
        return artifactRepository.findById(artifactId);
    }

    @Transactional(readOnly = true)
    public BackupArtifact requireArtifact(String artifactId) {
        return artifactRepository.findById(artifactId)
                .orElseThrow(() -> PolicyViolationException.notFound("Backup artifact", artifactId));
    }

    @Transactional(readOnly = true)
    public List<BackupArtifact> listArtifacts(String storeName) {
        return artifactRepository.findByStoreNameOrderByConsistencyMarkerDescCompletedAtDescArtifactIdDesc(storeName);
    }

    /**
     * 복구 베이스 후보 FULL 아티팩트 (최신 순). FAILED 는 어떤 경우에도 제외
     */
    @Transactional(readOnly = true)
    public List<BackupArtifact> eligibleFullBases(String storeName, boolean allowUntested) {
        Set<TrustState> states = allowUntested
                ? EnumSet.of(TrustState.PASSED, TrustState.UNTESTED)
                : EnumSet.of(TrustState.PASSED);
        List<BackupArtifact> bases = artifactRepository.findByStoreNameAndArtifactTypeAndTrustStateIn(
                storeName, ArtifactType.FULL, states);
        bases.sort(NEWEST_FIRST);
        return bases;
    }

    @Transactional(readOnly = true)
    public List<BackupArtifact> passedIncrementals(String storeName) {
        List<BackupArtifact> incrementals = artifactRepository.findByStoreNameAndArtifactTypeAndTrustStateIn(
                storeName, ArtifactType.INCREMENTAL, EnumSet.of(TrustState.PASSED));
        incrementals.sort(NEWEST_FIRST.reversed());
        return incrementals;
    }

    /**
     * 증분 백업의 부모 후보: FAILED 가 아닌 최신 아티팩트
     */
    @Transactional(readOnly = true)
    public Optional<BackupArtifact> newestUsableArtifact(String storeName) {
        return listArtifacts(storeName).stream()
                .filter(a -> a.getTrustState() != TrustState.FAILED)
                .min(NEWEST_FIRST);
    }

    @Transactional(readOnly = true)
    public Optional<BackupArtifact> newestPassedArtifact(String storeName) {
        return listArtifacts(storeName).stream()
                .filter(BackupArtifact::isPassed)
                .max(Comparator.comparing(BackupArtifact::getStartedAt));
    }

    @Transactional(readOnly = true)
    public Optional<BackupArtifact> newestPassedFull(String storeName) {
        return eligibleFullBases(storeName, false).stream().findFirst();
    }

    @Transactional(readOnly = true)
    public List<BackupArtifact> pendingValidation() {
        return artifactRepository.findByTrustStateOrderByStartedAtAsc(TrustState.UNTESTED);
    }

    @Transactional(readOnly = true)
    public List<BackupArtifact> childrenOf(String artifactId) {
        return artifactRepository.findByParentArtifactId(artifactId);
    }

    @Transactional(readOnly = true)
    public List<BackupArtifact> expiredArtifacts(ArtifactType type, Instant before) {
        return artifactRepository.findExpired(type, before);
    }

    @Transactional
    public void deleteArtifact(BackupArtifact artifact) {
        reportRepository.deleteAll(reportRepository.findByArtifactId(artifact.getArtifactId()));
        artifactRepository.delete(artifact);
        log.info("Catalog entry removed: artifactId={}", artifact.getArtifactId());
    }

    // ---------------------------------------------------------------- validation

    /**
     * 검증 리포트 저장 + 신뢰 상태 전이
     * UNTESTED 인 아티팩트만 PASSED/FAILED 로 전이하며, INCOMPLETE 는 상태를 바꾸지 않는다.
     *
     * @return 갱신된 아티팩트
     */
    @Transactional
    public BackupArtifact recordValidation(ValidationReport report) {
        BackupArtifact artifact = requireArtifact(report.getArtifactId());
        reportRepository.save(report);

        artifact.setLastValidatedAt(report.getCreatedAt());
        artifact.setLastReportId(report.getReportId());
        if (artifact.getTrustState() == TrustState.UNTESTED) {
            if (report.getVerdict() == ValidationVerdict.PASSED) {
                artifact.markTrust(TrustState.PASSED);
            } else if (report.getVerdict() == ValidationVerdict.FAILED) {
                artifact.markTrust(TrustState.FAILED);
            }
        }
        return artifactRepository.save(artifact);
    }

    @Transactional(readOnly = true)
    public List<ValidationReport> reportsFor(String artifactId) {
        return reportRepository.findByArtifactIdOrderByCreatedAtDesc(artifactId);
    }

    @Transactional
    public int deleteReportsBefore(Instant before) {
        List<ValidationReport> expired = reportRepository.findByCreatedAtBefore(before);
        reportRepository.deleteAll(expired);
        return expired.size();
    }

    // ---------------------------------------------------------------- segments

    @Transactional(readOnly = true)
    public Optional<LogSegment> findSegment(String storeName, long sequenceId) {
        return segmentRepository.findById(LogSegment.idOf(storeName, sequenceId));
    }

    @Transactional
    public LogSegment saveSegment(LogSegment segment) {
        return segmentRepository.save(segment);
    }

    @Transactional(readOnly = true)
    public List<Long> archivedSequenceIds(String storeName) {
        return segmentRepository.findSequenceIds(storeName, SegmentStatus.ARCHIVED);
    }

    @Transactional(readOnly = true)
    public List<LogSegment> failedSegments(String storeName) {
        return segmentRepository.findByStoreNameAndStatusOrderBySequenceIdAsc(storeName, SegmentStatus.FAILED);
    }

    /**
     * 아카이브된 세그먼트 조회 (fromInclusive..toInclusive, 오름차순)
     */
    @Transactional(readOnly = true)
    public List<LogSegment> archivedSegments(String storeName, long fromInclusive, long toInclusive) {
        if (fromInclusive > toInclusive) {
            return List.of();
        }
        return segmentRepository.findByStoreNameAndStatusAndSequenceIdBetweenOrderBySequenceIdAsc(
                storeName, SegmentStatus.ARCHIVED, fromInclusive, toInclusive);
    }

    @Transactional(readOnly = true)
    public Optional<LogSegment> newestArchivedSegment(String storeName) {
        return segmentRepository.findFirstByStoreNameAndStatusOrderBySequenceIdDesc(storeName, SegmentStatus.ARCHIVED);
    }

    /**
     * 시각 이전에 생성된 마지막 세그먼트. FAILED 도 포함하여 목표 구간 안의 누락이 재생 단계에서 드러나게 한다.
     */
    @Transactional(readOnly = true)
    public Optional<LogSegment> lastSegmentAtOrBefore(String storeName, Instant timestamp) {
        return segmentRepository.findFirstByStoreNameAndProducedAtLessThanEqualOrderBySequenceIdDesc(
                storeName, timestamp);
    }

    @Transactional(readOnly = true)
    public Optional<LogSegment> freshestArchivedSegment(String storeName) {
        return segmentRepository.findFirstByStoreNameAndStatusOrderByProducedAtDesc(storeName, SegmentStatus.ARCHIVED);
    }

    @Transactional(readOnly = true)
    public List<LogSegment> segmentsUpTo(String storeName, long sequenceId) {
        return segmentRepository.findByStoreNameAndSequenceIdLessThanEqual(storeName, sequenceId);
    }

    @Transactional
    public void deleteSegments(List<LogSegment> segments) {
        segmentRepository.deleteAll(segments);
    }

    // ---------------------------------------------------------------- restore runs

    @Transactional
    public RestoreRun saveRun(RestoreRun run) {
        return restoreRunRepository.save(run);
    }

    @Transactional(readOnly = true)
    public RestoreRun requireRun(String runId) {
        return restoreRunRepository.findById(runId)
                .orElseThrow(() -> PolicyViolationException.notFound("Restore run", runId));
    }

    @Transactional(readOnly = true)
    public Optional<RestoreRun> lastPromotedRun(String storeName) {
        return restoreRunRepository.findFirstByStoreNameAndStateOrderByFinishedAtDesc(storeName, RestoreState.PROMOTED);
    }

    @Transactional(readOnly = true)
    public List<RestoreRun> runsFor(String storeName) {
        return restoreRunRepository.findByStoreNameOrderByStartedAtDesc(storeName);
    }
}
