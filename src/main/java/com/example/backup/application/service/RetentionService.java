package com.example.backup.application.service;

import com.example.backup.config.BackupProperties;
import com.example.backup.domain.entity.BackupArtifact;
import com.example.backup.domain.entity.LogSegment;
import com.example.backup.domain.exception.BusyException;
import com.example.backup.domain.model.ArtifactType;
import com.example.backup.infrastructure.lock.StoreLockService;
import com.example.backup.infrastructure.persistence.BackupCatalog;
import com.example.backup.infrastructure.store.StoreRegistry;
import com.example.backup.infrastructure.transport.ArchiveObject;
import com.example.backup.infrastructure.transport.ArchiveTransport;
import com.example.backup.infrastructure.transport.ArtifactNaming;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 보존 정책 적용
 *
 * - 최신 PASSED FULL 은 기간과 무관하게 삭제하지 않는다
 * - 만료된 아티팩트를 지우면 그 아티팩트에 의존하는 증분도 함께 삭제
 * - 남은 가장 오래된 FULL 의 marker 이하 세그먼트는 복구에 쓰일 수 없으므로 삭제
 * - 안전 스냅샷과 검증 리포트도 각자의 기간으로 정리
 *
 * 스토어 락을 잡고 실행하며, 점유 중이면 다음 주기로 미룬다.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RetentionService {

    private final BackupCatalog catalog;
    private final ArchiveTransport archiveTransport;
    private final StoreRegistry storeRegistry;
    private final StoreLockService lockService;
    private final BackupProperties properties;
    private final Clock clock;

    @Value
    @Builder
    public static class RetentionResult {
        int artifactsDeleted;
        int segmentsDeleted;
        int safetySnapshotsDeleted;
        int reportsDeleted;
        Set<String> skippedStores;
    }

    public RetentionResult applyRetention() {
        Instant now = clock.instant();
        int artifacts = 0;
        int segments = 0;
        int safety = 0;
        Set<String> skipped = new HashSet<>();

        for (String storeName : storeRegistry.storeNames()) {
            try {
                int[] counts = lockService.executeWithLock(storeName, "retention", () -> applyToStore(storeName, now));
                artifacts += counts[0];
                segments += counts[1];
                safety += counts[2];
            } catch (BusyException e) {
                log.info("Retention skipped for {}: {}", storeName, e.getMessage());
                skipped.add(storeName);
            }
        }
        int reports = catalog.deleteReportsBefore(now.minus(properties.getRetention().getValidationReports()));

        RetentionResult result = RetentionResult.builder()
                .artifactsDeleted(artifacts)
                .segmentsDeleted(segments)
                .safetySnapshotsDeleted(safety)
                .reportsDeleted(reports)
                .skippedStores(skipped)
                .build();
        log.info("Retention applied: artifacts={}, segments={}, safetySnapshots={}, reports={}, skipped={}",
                artifacts, segments, safety, reports, skipped);
        return result;
    }

    private int[] applyToStore(String storeName, Instant now) {
        BackupProperties.Retention retention = properties.getRetention();
        Optional<BackupArtifact> protectedFull = catalog.newestPassedFull(storeName);
        String protectedId = protectedFull.map(BackupArtifact::getArtifactId).orElse(null);

        Set<String> expired = new HashSet<>();
        collectExpired(storeName, ArtifactType.FULL, now.minus(retention.getFull()), protectedId, expired);
        collectExpired(storeName, ArtifactType.INCREMENTAL, now.minus(retention.getIncremental()), protectedId, expired);

        int artifacts = 0;
        for (BackupArtifact artifact : withDependents(expired)) {
            deleteObjects(artifact.getLocation());
            catalog.deleteArtifact(artifact);
            artifacts++;
        }

        int segments = pruneSegments(storeName);
        int safety = pruneSafetySnapshots(storeName, now.minus(retention.getSafety()));
        return new int[]{artifacts, segments, safety};
    }

    private void collectExpired(String storeName, ArtifactType type, Instant before, String protectedId,
                                Set<String> expired) {
        catalog.expiredArtifacts(type, before).stream()
                .filter(a -> storeName.equals(a.getStoreName()))
                .filter(a -> !a.getArtifactId().equals(protectedId))
                .forEach(a -> expired.add(a.getArtifactId()));
    }

    /**
     * 만료 대상 + 이들에 의존하는 모든 증분 (자식 먼저 삭제되도록 역순)
     */
    private List<BackupArtifact> withDependents(Set<String> expiredIds) {
        Deque<BackupArtifact> ordered = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>(expiredIds);
        while (!pending.isEmpty()) {
            String id = pending.poll();
            if (!seen.add(id)) {
                continue;
            }
            catalog.findArtifact(id).ifPresent(ordered::addFirst);
            catalog.childrenOf(id).forEach(child -> pending.add(child.getArtifactId()));
        }
        return List.copyOf(ordered);
    }

    /**
     * 남아 있는 가장 오래된 FULL 의 marker 이하 세그먼트 삭제. FULL 이 없으면 아무것도 지우지 않는다.
     */
    private int pruneSegments(String storeName) {
        Optional<Long> oldestMarker = catalog.listArtifacts(storeName).stream()
                .filter(BackupArtifact::isFull)
                .map(BackupArtifact::getConsistencyMarker)
                .min(Long::compare);
        if (oldestMarker.isEmpty()) {
            return 0;
        }
        List<LogSegment> obsolete = catalog.segmentsUpTo(storeName, oldestMarker.get());
        for (LogSegment segment : obsolete) {
            String location = segment.getLocation() != null
                    ? segment.getLocation()
                    : ArtifactNaming.segmentLocation(storeName, segment.getSequenceId());
            deleteObjects(location);
        }
        catalog.deleteSegments(obsolete);
        if (!obsolete.isEmpty()) {
            log.debug("Pruned {} segments of {} up to seq {}", obsolete.size(), storeName, oldestMarker.get());
        }
        return obsolete.size();
    }

    private int pruneSafetySnapshots(String storeName, Instant before) {
        List<String> snapshots = archiveTransport.list(ArtifactNaming.safetyPrefix(storeName)).stream()
                .filter(location -> !location.endsWith(ArtifactNaming.SIDECAR_EXTENSION))
                .collect(Collectors.toList());
        int deleted = 0;
        for (String location : snapshots) {
            Optional<ArchiveObject> object = archiveTransport.stat(location);
            if (object.isPresent() && object.get().getLastModified().isBefore(before)) {
                deleteObjects(location);
                deleted++;
            }
        }
        return deleted;
    }

    private void deleteObjects(String location) {
        archiveTransport.delete(ArtifactNaming.sidecarOf(location));
        archiveTransport.delete(location);
    }
}
