package com.example.backup.infrastructure.monitoring;

import com.example.backup.domain.model.ArtifactType;
import com.example.backup.domain.model.ComplianceLevel;
import com.example.backup.domain.model.RestoreState;
import com.example.backup.domain.model.ValidationVerdict;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 백업 엔진 메트릭 - Prometheus 통합
 *
 * 1. 백업 메트릭: 생성 수/실패 수, 크기, 소요 시간, 경과 시간(age)
 * 2. WAL 메트릭: 아카이브 수/실패 수, 아카이브 age, gap 세그먼트 수
 * 3. 검증 메트릭: verdict 별 카운트, 리허설 소요 시간
 * 4. 복구 메트릭: 최종 상태별 카운트, 소요 시간
 * 5. 컴플라이언스/스토리지: RPO/RTO(초), 레벨, 사용량/여유 공간
 */
@Slf4j
public class PrometheusBackupMetricsService implements BackupMetricsService {

    private final MeterRegistry meterRegistry;

    private final AtomicLong storageUsed = new AtomicLong(0);
    private final AtomicLong storageAvailable = new AtomicLong(-1);

    // 동적 미터 캐시
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    public PrometheusBackupMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        registerGauges();
    }

    private void registerGauges() {
        Gauge.builder("backup.storage.used.bytes", storageUsed, AtomicLong::get)
                .description("Bytes used in the archive")
                .register(meterRegistry);

        Gauge.builder("backup.storage.available.bytes", storageAvailable, AtomicLong::get)
                .description("Bytes available in the archive (-1 if unknown)")
                .register(meterRegistry);

        log.info("✅ Backup Prometheus metrics registered");
    }

    @Override
    public void recordBackupProduced(String store, ArtifactType type, long sizeBytes, long durationMs) {
        counter("backup.produced.count", "Number of produced backups", store, "type", type.fileToken()).increment();
        timer("backup.produce.duration", "Backup production time", store, "type", type.fileToken())
                .record(durationMs, TimeUnit.MILLISECONDS);
        gauge("backup.latest.size.bytes", "Size of the latest produced backup", store, "type", type.fileToken())
                .set(sizeBytes);
    }

    @Override
    public void recordBackupFailure(String store, ArtifactType type, String errorKind) {
        counter("backup.produce.failure", "Number of failed backups", store, "kind", errorKind).increment();
    }

    @Override
    public void recordSegmentArchived(String store, boolean alreadyArchived) {
        counter("wal.archive.count", "Number of archive calls that succeeded", store,
                "outcome", alreadyArchived ? "already_archived" : "archived").increment();
    }

    @Override
    public void recordArchiveFailure(String store, String errorKind) {
        counter("wal.archive.failure", "Number of archive calls that failed", store, "kind", errorKind).increment();
    }

    @Override
    public void recordGapCount(String store, long missingSegments) {
        gauge("wal.gap.segments", "Missing log segments between oldest and newest archived", store, null, null)
                .set(missingSegments);
    }

    @Override
    public void recordValidation(String store, ValidationVerdict verdict) {
        counter("backup.validation.count", "Validation results by verdict", store,
                "verdict", verdict.name().toLowerCase()).increment();
    }

    @Override
    public void recordRehearsalDuration(String store, long durationMs) {
        timer("backup.validation.rehearsal.duration", "Restore rehearsal duration", store, null, null)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordRestore(String store, RestoreState finalState, long durationMs) {
        counter("backup.restore.count", "Restore runs by final state", store,
                "state", finalState.name().toLowerCase()).increment();
        timer("backup.restore.duration", "Restore run duration", store, null, null)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void updateStoreAges(String store, long backupAgeSeconds, long walArchiveAgeSeconds, long latestBackupSizeBytes) {
        gauge("backup.age.seconds", "Age of the newest passed backup", store, null, null).set(backupAgeSeconds);
        gauge("wal.archive.age.seconds", "Age of the newest archived segment", store, null, null).set(walArchiveAgeSeconds);
        gauge("backup.passed.size.bytes", "Size of the newest passed full backup", store, null, null)
                .set(latestBackupSizeBytes);
    }

    @Override
    public void updateCompliance(String store, long rpoSeconds, long rtoSeconds, ComplianceLevel level) {
        gauge("backup.rpo.seconds", "Current RPO exposure", store, null, null).set(rpoSeconds);
        gauge("backup.rto.estimate.seconds", "Estimated RTO", store, null, null).set(rtoSeconds);
        gauge("backup.compliance.level", "0=ok, 1=warning, 2=critical", store, null, null).set(level.ordinal());
    }

    @Override
    public void updateStorageUsage(long usedBytes, long availableBytes) {
        storageUsed.set(usedBytes);
        storageAvailable.set(availableBytes);
    }

    @Override
    public void recordAlert(String alertType, String severity) {
        counters.computeIfAbsent("backup.alerts|" + alertType + "|" + severity, key ->
                Counter.builder("backup.alerts")
                        .tag("type", alertType)
                        .tag("severity", severity)
                        .description("Alerts raised")
                        .register(meterRegistry)
        ).increment();
    }

    private Counter counter(String name, String description, String store, String tagKey, String tagValue) {
        return counters.computeIfAbsent(key(name, store, tagValue), k -> {
            Counter.Builder builder = Counter.builder(name).tag("store", store).description(description);
            if (tagKey != null) {
                builder.tag(tagKey, tagValue);
            }
            return builder.register(meterRegistry);
        });
    }

    private Timer timer(String name, String description, String store, String tagKey, String tagValue) {
        return timers.computeIfAbsent(key(name, store, tagValue), k -> {
            Timer.Builder builder = Timer.builder(name).tag("store", store).description(description);
            if (tagKey != null) {
                builder.tag(tagKey, tagValue);
            }
            return builder.register(meterRegistry);
        });
    }

    private AtomicLong gauge(String name, String description, String store, String tagKey, String tagValue) {
        return gauges.computeIfAbsent(key(name, store, tagValue), k -> {
            AtomicLong value = new AtomicLong(-1);
            Gauge.Builder<AtomicLong> builder = Gauge.builder(name, value, AtomicLong::get)
                    .tag("store", store)
                    .description(description);
            if (tagKey != null) {
                builder.tag(tagKey, tagValue);
            }
            builder.register(meterRegistry);
            return value;
        });
    }

    private static String key(String name, String store, String tagValue) {
        return name + "|" + store + "|" + (tagValue == null ? "" : tagValue);
    }
}
