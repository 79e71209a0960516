package com.example.backup.application.service;

import com.example.backup.domain.entity.BackupArtifact;
import com.example.backup.domain.entity.RestoreRun;
import com.example.backup.domain.event.BackupEvent;
import com.example.backup.domain.exception.BackupException;
import com.example.backup.domain.exception.OperationCancelledException;
import com.example.backup.domain.exception.PolicyViolationException;
import com.example.backup.domain.model.ArtifactType;
import com.example.backup.domain.model.TrustState;
import com.example.backup.infrastructure.codec.BackupContainerCodec;
import com.example.backup.infrastructure.codec.ContainerHeader;
import com.example.backup.infrastructure.lock.StoreLockService;
import com.example.backup.infrastructure.messaging.NotificationDispatcher;
import com.example.backup.infrastructure.monitoring.BackupMetricsService;
import com.example.backup.infrastructure.persistence.BackupCatalog;
import com.example.backup.infrastructure.store.StoreInstance;
import com.example.backup.infrastructure.store.StoreRegistry;
import com.example.backup.infrastructure.store.StoreSnapshot;
import com.example.backup.infrastructure.transport.ArchiveTransport;
import com.example.backup.infrastructure.transport.ArtifactNaming;
import com.example.backup.infrastructure.util.Checksums;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 백업 생성기
 *
 * - FULL: 일관된 전체 스냅샷 (consistency marker = 스냅샷 시점 적용 시퀀스)
 * - INCREMENTAL: 부모 아티팩트 marker 이후 변경분
 * - 스토어 단위 배타 락 (복구와 공유), 점유 중이면 즉시 Busy
 * - 결과는 항상 UNTESTED 로 등록 (신뢰 상태는 검증기만 변경)
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BackupProducer {

    private final StoreRegistry storeRegistry;
    private final StoreLockService lockService;
    private final ArchiveTransport archiveTransport;
    private final BackupContainerCodec containerCodec;
    private final BackupCatalog catalog;
    private final NotificationDispatcher notificationDispatcher;
    private final BackupMetricsService metricsService;
    private final Clock clock;

    public BackupArtifact produceBackup(String storeName, ArtifactType type) {
        StoreInstance store = storeRegistry.get(storeName);
        return lockService.executeWithLock(storeName, "backup:" + type.fileToken(), () -> produce(store, type));
    }

    private BackupArtifact produce(StoreInstance store, ArtifactType type) {
        String storeName = store.getName();
        Instant startedAt = clock.instant();
        String artifactId = uniqueArtifactId(storeName, type, startedAt);
        String location = ArtifactNaming.artifactLocation(storeName, artifactId);
        String sidecar = ArtifactNaming.sidecarOf(location);
        boolean uploaded = false;

        log.info("Starting {} backup: store={}, artifactId={}", type, storeName, artifactId);
        try {
            BackupArtifact parent = type == ArtifactType.INCREMENTAL ? resolveParent(store) : null;
            StoreSnapshot snapshot = parent == null
                    ? store.snapshot()
                    : store.snapshotSince(parent.getConsistencyMarker());

            ContainerHeader header = ContainerHeader.builder()
                    .store(storeName)
                    .artifactId(artifactId)
                    .backupType(type.fileToken())
                    .consistencyMarker(snapshot.getAppliedSequence())
                    .baseMarker(parent == null ? 0L : parent.getConsistencyMarker())
                    .createdAt(startedAt)
                    .build();
            byte[] content = containerCodec.encode(header, snapshot);
            String checksum = Checksums.sha256(content);

            checkCancelled(storeName, artifactId);
            uploaded = true;
            archiveTransport.put(location, content);
            archiveTransport.put(sidecar, ArtifactNaming.sidecarContent(checksum, location));
            checkCancelled(storeName, artifactId);

            BackupArtifact artifact = BackupArtifact.builder()
                    .artifactId(artifactId)
                    .storeName(storeName)
                    .artifactType(type)
                    .parentArtifactId(parent == null ? null : parent.getArtifactId())
                    .startedAt(startedAt)
                    .completedAt(clock.instant())
                    .sizeBytes(content.length)
                    .checksum(checksum)
                    .consistencyMarker(snapshot.getAppliedSequence())
                    .baseMarker(parent == null ? 0L : parent.getConsistencyMarker())
                    .location(location)
                    .checksumLocation(sidecar)
                    .recordCount(snapshot.getRecordCount())
                    .collectionCounts(new HashMap<>(snapshot.getStateCounts()))
                    .build();
            BackupArtifact saved = catalog.saveArtifact(artifact);

            long durationMs = Duration.between(startedAt, saved.getCompletedAt()).toMillis();
            metricsService.recordBackupProduced(storeName, type, content.length, durationMs);

            Map<String, Object> payload = new HashMap<>();
            payload.put("artifactId", artifactId);
            payload.put("type", type.name());
            payload.put("consistencyMarker", saved.getConsistencyMarker());
            payload.put("sizeBytes", saved.getSizeBytes());
            notificationDispatcher.dispatch(new BackupEvent(BackupEvent.BACKUP_CREATED, BackupEvent.Severity.INFO,
                    storeName, "Backup " + artifactId + " created", payload));

            log.info("✅ Backup created: artifactId={}, marker={}, records={}, size={} bytes, duration={}ms",
                    artifactId, saved.getConsistencyMarker(), saved.getRecordCount(), saved.getSizeBytes(), durationMs);
            return saved;

        } catch (BackupException e) {
            metricsService.recordBackupFailure(storeName, type, e.getKind().name());
            if (uploaded) {
                discardUpload(location, sidecar);
            }
            log.error("Backup failed: store={}, type={}, kind={}, code={}", storeName, type, e.getKind(), e.getCode());
            throw e;
        } catch (RuntimeException e) {
            metricsService.recordBackupFailure(storeName, type, "INTERNAL");
            if (uploaded) {
                discardUpload(location, sidecar);
            }
            log.error("Backup failed unexpectedly: store={}, type={}", storeName, type, e);
            throw e;
        }
    }

    /**
     * 같은 밀리초에 시작한 백업끼리 ID 가 겹치지 않도록 순번을 붙인다.
     * 기존 아티팩트(특히 PASSED)는 덮어쓰지 않는다.
     */
    private String uniqueArtifactId(String storeName, ArtifactType type, Instant startedAt) {
        int attempt = 0;
        while (true) {
            String candidate = ArtifactNaming.artifactId(storeName, type, startedAt, attempt);
            if (catalog.findArtifact(candidate).isEmpty()
                    && !archiveTransport.exists(ArtifactNaming.artifactLocation(storeName, candidate))) {
                return candidate;
            }
            attempt++;
        }
    }

    /**
     * 복구 직전 안전 스냅샷. 메모리에 보관하고 아카이브에도 기록한다.
     * 호출자는 해당 스토어의 락을 보유하고 있어야 한다.
     */
    public SafetySnapshot captureSafetySnapshot(StoreInstance store) {
        Instant takenAt = clock.instant();
        StoreSnapshot snapshot = store.snapshot();
        String contentChecksum = store.contentChecksum();
        String location = ArtifactNaming.safetySnapshotLocation(store.getName(), takenAt);

        ContainerHeader header = ContainerHeader.builder()
                .store(store.getName())
                .artifactId("safety-" + takenAt.toEpochMilli())
                .backupType(ArtifactType.FULL.fileToken())
                .consistencyMarker(snapshot.getAppliedSequence())
                .baseMarker(0L)
                .createdAt(takenAt)
                .build();
        byte[] content = containerCodec.encode(header, snapshot);
        archiveTransport.put(location, content);
        archiveTransport.put(ArtifactNaming.sidecarOf(location),
                ArtifactNaming.sidecarContent(Checksums.sha256(content), location));

        log.info("Safety snapshot taken: store={}, seq={}, location={}",
                store.getName(), snapshot.getAppliedSequence(), location);
        return new SafetySnapshot(store.getName(), location, contentChecksum, snapshot, takenAt);
    }

    /**
     * 증분 백업 부모: FAILED 가 아닌 최신 아티팩트. 부모 체인이 FULL 에 닿아야 한다.
     */
    private BackupArtifact resolveParent(StoreInstance store) {
        String storeName = store.getName();
        BackupArtifact parent = catalog.newestUsableArtifact(storeName)
                .orElseThrow(() -> missingFullBase(storeName, "no full backup exists"));

        BackupArtifact cursor = parent;
        while (!cursor.isFull()) {
            String parentId = cursor.getParentArtifactId();
            Optional<BackupArtifact> next = parentId == null ? Optional.empty() : catalog.findArtifact(parentId);
            if (next.isEmpty() || next.get().getTrustState() == TrustState.FAILED) {
                throw missingFullBase(storeName, "chain of " + parent.getArtifactId() + " is broken at " + cursor.getArtifactId());
            }
            cursor = next.get();
        }

        if (parent.getConsistencyMarker() > store.getAppliedSequence()) {
            throw missingFullBase(storeName, "parent " + parent.getArtifactId() + " is ahead of the store");
        }
        Optional<RestoreRun> lastRestore = catalog.lastPromotedRun(storeName);
        if (lastRestore.isPresent() && lastRestore.get().getFinishedAt() != null
                && lastRestore.get().getFinishedAt().isAfter(parent.getStartedAt())) {
            throw missingFullBase(storeName, "store was restored after parent " + parent.getArtifactId());
        }
        return parent;
    }

    private PolicyViolationException missingFullBase(String storeName, String reason) {
        return new PolicyViolationException(PolicyViolationException.MISSING_FULL_BASE,
                "Incremental backup of " + storeName + " needs a full base: " + reason,
                Map.of("store", storeName));
    }

    private void checkCancelled(String storeName, String artifactId) {
        if (Thread.currentThread().isInterrupted()) {
            throw new OperationCancelledException("Backup " + artifactId + " cancelled",
                    Map.of("store", storeName, "artifactId", artifactId));
        }
    }

    /**
     * 취소/실패한 백업은 카탈로그에 남기지 않고 업로드한 객체도 지운다.
     */
    private void discardUpload(String location, String sidecar) {
        boolean interrupted = Thread.interrupted();
        try {
            archiveTransport.delete(sidecar);
            archiveTransport.delete(location);
        } catch (BackupException cleanupError) {
            log.warn("Could not remove partial backup objects at {}: {}", location, cleanupError.getMessage());
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
