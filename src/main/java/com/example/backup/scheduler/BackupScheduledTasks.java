package com.example.backup.scheduler;

import com.example.backup.application.service.BackupProducer;
import com.example.backup.application.service.BackupValidator;
import com.example.backup.application.service.ComplianceMonitor;
import com.example.backup.application.service.RetentionService;
import com.example.backup.application.service.WalArchiver;
import com.example.backup.domain.exception.BusyException;
import com.example.backup.domain.model.ArtifactType;
import com.example.backup.domain.model.ComplianceSnapshot;
import com.example.backup.domain.model.ContinuityReport;
import com.example.backup.infrastructure.store.StoreRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 이름 있는 주기 작업들
 * 각 작업은 자기 자신과 겹쳐 실행되지 않으며, 실패는 여기서 기록하고 다음 주기로 넘긴다.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "backup.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class BackupScheduledTasks {

    private final StoreRegistry storeRegistry;
    private final BackupProducer backupProducer;
    private final WalArchiver walArchiver;
    private final BackupValidator backupValidator;
    private final ComplianceMonitor complianceMonitor;
    private final RetentionService retentionService;

    /**
     * 전체 백업 (기본: 매일 새벽 1시)
     */
    @Scheduled(cron = "${backup.scheduling.full-backup-cron:0 0 1 * * *}")
    public void produceFullBackups() {
        produceBackups(ArtifactType.FULL);
    }

    @Scheduled(fixedDelayString = "${backup.scheduling.incremental-backup-interval-ms:3600000}",
            initialDelayString = "${backup.scheduling.incremental-backup-interval-ms:3600000}")
    public void produceIncrementalBackups() {
        produceBackups(ArtifactType.INCREMENTAL);
    }

    /**
     * 실패 세그먼트 재전송 후 연속성 검사
     */
    @Scheduled(fixedDelayString = "${backup.scheduling.continuity-scan-interval-ms:60000}")
    public void scanWalContinuity() {
        try {
            int pending = walArchiver.pendingCount();
            if (pending > 0) {
                int recovered = walArchiver.retryPending();
                log.info("[Scheduler] Re-archived {} of {} pending segments", recovered, pending);
            }
            for (String storeName : storeRegistry.storeNames()) {
                ContinuityReport report = walArchiver.scanContinuity(storeName);
                if (!report.isContinuous()) {
                    log.warn("[Scheduler] WAL of {} has {} gaps", storeName, report.getGaps().size());
                }
            }
        } catch (Exception e) {
            log.error("[Scheduler] Failed to run WAL continuity scan", e);
        }
    }

    @Scheduled(fixedDelayString = "${backup.scheduling.validation-interval-ms:300000}")
    public void validatePendingBackups() {
        try {
            int validated = backupValidator.validatePending();
            if (validated > 0) {
                log.info("[Scheduler] Validated {} pending backups", validated);
            }
        } catch (Exception e) {
            log.error("[Scheduler] Failed to run backup validation", e);
        }
    }

    @Scheduled(fixedDelayString = "${backup.scheduling.compliance-tick-ms:60000}")
    public void recomputeCompliance() {
        try {
            ComplianceSnapshot snapshot = complianceMonitor.tick();
            log.debug("[Scheduler] Compliance tick finished: overall={}", snapshot.getOverallLevel());
        } catch (Exception e) {
            log.error("[Scheduler] Failed to recompute compliance", e);
        }
    }

    /**
     * 보존 정책 (기본: 매일 새벽 3시 30분)
     */
    @Scheduled(cron = "${backup.scheduling.retention-cron:0 30 3 * * *}")
    public void applyRetention() {
        log.info("[Scheduler] Starting retention");
        try {
            retentionService.applyRetention();
        } catch (Exception e) {
            log.error("[Scheduler] Failed to apply retention", e);
        }
    }

    private void produceBackups(ArtifactType type) {
        for (String storeName : storeRegistry.storeNames()) {
            try {
                backupProducer.produceBackup(storeName, type);
            } catch (BusyException e) {
                log.info("[Scheduler] {} backup of {} skipped: {}", type, storeName, e.getMessage());
            } catch (Exception e) {
                log.error("[Scheduler] {} backup of {} failed", type, storeName, e);
            }
        }
    }
}
