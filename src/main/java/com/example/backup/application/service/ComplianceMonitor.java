package com.example.backup.application.service;

import com.example.backup.config.BackupProperties;
import com.example.backup.domain.entity.BackupArtifact;
import com.example.backup.domain.entity.LogSegment;
import com.example.backup.domain.entity.RestoreRun;
import com.example.backup.domain.entity.ValidationReport;
import com.example.backup.domain.event.BackupEvent;
import com.example.backup.domain.exception.TransientIoException;
import com.example.backup.domain.model.ComplianceLevel;
import com.example.backup.domain.model.ComplianceSnapshot;
import com.example.backup.domain.model.StorageTier;
import com.example.backup.domain.model.StoreCompliance;
import com.example.backup.domain.model.ValidationStage;
import com.example.backup.infrastructure.messaging.NotificationDispatcher;
import com.example.backup.infrastructure.monitoring.BackupMetricsService;
import com.example.backup.infrastructure.persistence.BackupCatalog;
import com.example.backup.infrastructure.store.StoreRegistry;
import com.example.backup.infrastructure.transport.ArchiveTransport;
import com.example.backup.infrastructure.transport.StorageUsage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * RPO/RTO 컴플라이언스 모니터
 *
 * - RPO = (최신 아카이브 세그먼트, 최신 PASSED 백업) 중 더 최근 것의 경과 시간
 * - RTO = 마지막 측정 복구 시간 x 안전 계수 (측정값이 없으면 아티팩트 크기로 외삽)
 * - 등급: 목표의 warningMultiplier 배 이상 WARNING, criticalMultiplier 배 이상 CRITICAL
 * - 알림은 레벨 트리거: 조건이 유지되는 동안 매 틱 재발송, 정상 재계산 시 RESOLVED
 *
 * 스냅샷은 불변 객체로 원자적으로 교체된다.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ComplianceMonitor {

    private final BackupCatalog catalog;
    private final StoreRegistry storeRegistry;
    private final ArchiveTransport archiveTransport;
    private final NotificationDispatcher notificationDispatcher;
    private final BackupMetricsService metricsService;
    private final BackupProperties properties;
    private final Clock clock;

    private final AtomicReference<ComplianceSnapshot> current = new AtomicReference<>();

    /**
     * 주기 실행: 재계산, 스냅샷 교체, 알림 및 메트릭 갱신
     */
    public ComplianceSnapshot tick() {
        ComplianceSnapshot next = compute();
        ComplianceSnapshot previous = current.getAndSet(next);

        for (StoreCompliance store : next.getStores().values()) {
            StoreCompliance before = previous == null ? null : previous.getStores().get(store.getStoreName());
            alert(BackupEvent.RPO_BREACH, store, store.getRpoLevel(),
                    before == null ? ComplianceLevel.OK : before.getRpoLevel(), store.getRpo(), store.getRpoTarget());
            alert(BackupEvent.RTO_BREACH, store, store.getRtoLevel(),
                    before == null ? ComplianceLevel.OK : before.getRtoLevel(), store.getRto(), store.getRtoTarget());
            metricsService.updateCompliance(store.getStoreName(), seconds(store.getRpo()), seconds(store.getRto()),
                    store.getLevel());
        }
        updateStorageUsage();

        log.debug("Compliance recomputed: overall={}, stores={}", next.getOverallLevel(), next.getStores().size());
        return next;
    }

    /**
     * 온디맨드 보고 (알림 없이 재계산). tier 가 null 이면 전체
     */
    public ComplianceSnapshot report(StorageTier tier) {
        ComplianceSnapshot snapshot = compute();
        if (tier == null) {
            return snapshot;
        }
        Map<String, StoreCompliance> filtered = new LinkedHashMap<>();
        snapshot.forTier(tier).forEach(s -> filtered.put(s.getStoreName(), s));
        return new ComplianceSnapshot(snapshot.getComputedAt(), filtered);
    }

    public ComplianceSnapshot current() {
        ComplianceSnapshot snapshot = current.get();
        return snapshot != null ? snapshot : ComplianceSnapshot.empty(clock.instant());
    }

    ComplianceSnapshot compute() {
        Instant now = clock.instant();
        Map<String, StoreCompliance> stores = new LinkedHashMap<>();
        for (String storeName : storeRegistry.storeNames()) {
            stores.put(storeName, evaluate(storeName, now));
        }
        return new ComplianceSnapshot(now, stores);
    }

    StoreCompliance evaluate(String storeName, Instant now) {
        StorageTier tier = properties.storeConfig(storeName).getTier();
        BackupProperties.TierTarget target = properties.tierTarget(tier);

        Optional<LogSegment> freshestSegment = catalog.freshestArchivedSegment(storeName);
        Optional<BackupArtifact> newestPassed = catalog.newestPassedArtifact(storeName);
        Instant segmentAt = freshestSegment.map(LogSegment::getProducedAt).orElse(null);
        Instant backupAt = newestPassed.map(BackupArtifact::getStartedAt).orElse(null);

        Instant freshest = latest(segmentAt, backupAt);
        Duration rpo = freshest == null ? null : nonNegative(Duration.between(freshest, now));

        Duration measured = measuredRestoreDuration(storeName);
        Duration rto = measured == null ? null
                : Duration.ofMillis(Math.round(measured.toMillis() * properties.getCompliance().getRtoSafetyFactor()));

        Optional<BackupArtifact> newestArtifact = catalog.newestUsableArtifact(storeName);
        metricsService.updateStoreAges(storeName,
                newestArtifact.map(a -> seconds(Duration.between(a.getStartedAt(), now))).orElse(-1L),
                segmentAt == null ? -1L : seconds(Duration.between(segmentAt, now)),
                newestArtifact.map(BackupArtifact::getSizeBytes).orElse(-1L));

        return StoreCompliance.builder()
                .storeName(storeName)
                .tier(tier)
                .rpo(rpo)
                .rpoTarget(target.getRpo())
                .rpoLevel(grade(rpo, target.getRpo()))
                .newestSegmentAt(segmentAt)
                .newestPassedBackupAt(backupAt)
                .rto(rto)
                .rtoTarget(target.getRto())
                .rtoLevel(grade(rto, target.getRto()))
                .lastMeasuredRestore(measured)
                .build();
    }

    /**
     * 측정 불가(null)는 CRITICAL
     */
    ComplianceLevel grade(Duration value, Duration target) {
        if (value == null) {
            return ComplianceLevel.CRITICAL;
        }
        double ratio = (double) value.toMillis() / Math.max(target.toMillis(), 1L);
        if (ratio >= properties.getCompliance().getCriticalMultiplier()) {
            return ComplianceLevel.CRITICAL;
        }
        if (ratio >= properties.getCompliance().getWarningMultiplier()) {
            return ComplianceLevel.WARNING;
        }
        return ComplianceLevel.OK;
    }

    /**
     * 가장 최근 측정값: 승격된 복구 실행 또는 최신 PASSED FULL 의 리허설(4단계) 시간
     */
    private Duration measuredRestoreDuration(String storeName) {
        Instant measuredAt = null;
        Duration measured = null;

        Optional<RestoreRun> lastRun = catalog.lastPromotedRun(storeName);
        if (lastRun.isPresent() && lastRun.get().getFinishedAt() != null) {
            measuredAt = lastRun.get().getFinishedAt();
            measured = Duration.ofMillis(lastRun.get().getDurationMs());
        }

        Optional<BackupArtifact> passedFull = catalog.newestPassedFull(storeName);
        if (passedFull.isPresent()) {
            for (ValidationReport report : catalog.reportsFor(passedFull.get().getArtifactId())) {
                long rehearsalMs = report.getStageDurationMs(ValidationStage.RESTORE_REHEARSAL);
                if (report.isPassed() && rehearsalMs >= 0) {
                    if (measuredAt == null || report.getCreatedAt().isAfter(measuredAt)) {
                        measured = Duration.ofMillis(rehearsalMs);
                    }
                    break;
                }
            }
            if (measured == null) {
                long bytesPerSecond = properties.getCompliance().getAssumedRestoreBytesPerSecond();
                measured = Duration.ofMillis(passedFull.get().getSizeBytes() * 1000L / bytesPerSecond);
            }
        }
        return measured;
    }

    private void alert(String type, StoreCompliance store, ComplianceLevel level, ComplianceLevel previous,
                       Duration value, Duration target) {
        BackupEvent.Severity severity;
        if (level == ComplianceLevel.OK) {
            if (previous == ComplianceLevel.OK) {
                return;
            }
            severity = BackupEvent.Severity.RESOLVED;
        } else {
            severity = level == ComplianceLevel.CRITICAL ? BackupEvent.Severity.CRITICAL : BackupEvent.Severity.WARNING;
        }

        Map<String, Object> payload = new HashMap<>();
        payload.put("tier", store.getTier().name());
        payload.put("level", level.name());
        payload.put("valueSeconds", seconds(value));
        payload.put("targetSeconds", seconds(target));
        String message = severity == BackupEvent.Severity.RESOLVED
                ? String.format("%s of %s is back within target %s", type, store.getStoreName(), target)
                : String.format("%s of %s: %s against target %s", type, store.getStoreName(),
                        value == null ? "unmeasurable" : value, target);
        notificationDispatcher.dispatch(new BackupEvent(type, severity, store.getStoreName(), message, payload));
        metricsService.recordAlert(type, severity.name());
    }

    private void updateStorageUsage() {
        try {
            StorageUsage usage = archiveTransport.usage();
            metricsService.updateStorageUsage(usage.getUsedBytes(), usage.getAvailableBytes());
        } catch (TransientIoException e) {
            log.warn("Archive storage usage unavailable: {}", e.getMessage());
        }
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }

    private static Duration nonNegative(Duration duration) {
        return duration.isNegative() ? Duration.ZERO : duration;
    }

    private static long seconds(Duration duration) {
        return duration == null ? -1L : duration.getSeconds();
    }
}
