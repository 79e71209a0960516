package com.example.backup.application.service;

import com.example.backup.application.validation.ValidationContext;
import com.example.backup.application.validation.ValidationStageHandler;
import com.example.backup.domain.entity.BackupArtifact;
import com.example.backup.domain.entity.ValidationReport;
import com.example.backup.domain.entity.ValidationStageResult;
import com.example.backup.domain.event.BackupEvent;
import com.example.backup.domain.exception.CorruptionException;
import com.example.backup.domain.exception.PolicyViolationException;
import com.example.backup.domain.exception.TransientIoException;
import com.example.backup.domain.exception.ValidationFailureException;
import com.example.backup.domain.model.TrustState;
import com.example.backup.domain.model.ValidationStage;
import com.example.backup.domain.model.ValidationVerdict;
import com.example.backup.infrastructure.messaging.NotificationDispatcher;
import com.example.backup.infrastructure.monitoring.BackupMetricsService;
import com.example.backup.infrastructure.persistence.BackupCatalog;
import com.example.backup.infrastructure.store.StoreRegistry;
import com.example.backup.infrastructure.util.IdGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 백업 검증기 (5단계 파이프라인)
 *
 * 1. 존재/크기 2. 무결성 3. 구조 4. 복구 리허설 5. 내용 검증
 *
 * - 단계는 고정 순서로 실행되며 첫 실패에서 중단 (최초 실패 단계를 root cause 로 기록)
 * - 요청 레벨까지만 실행, 레벨 5 를 모두 통과해야 PASSED
 * - 신뢰 상태는 UNTESTED 에서 한 번만 전이 (이후 재검증은 리포트만 추가)
 * - 전송 장애(TransientIo)는 재시도 소진 후 그대로 전파되며 리포트를 남기지 않는다
 */
@Service
@Slf4j
public class BackupValidator {

    private final List<ValidationStageHandler> stages;
    private final BackupCatalog catalog;
    private final StoreRegistry storeRegistry;
    private final NotificationDispatcher notificationDispatcher;
    private final BackupMetricsService metricsService;
    private final Clock clock;

    public BackupValidator(List<ValidationStageHandler> stages,
                           BackupCatalog catalog,
                           StoreRegistry storeRegistry,
                           NotificationDispatcher notificationDispatcher,
                           BackupMetricsService metricsService,
                           Clock clock) {
        List<ValidationStageHandler> ordered = new ArrayList<>(stages);
        ordered.sort(Comparator.comparingInt(s -> s.stage().getLevel()));
        this.stages = ordered;
        this.catalog = catalog;
        this.storeRegistry = storeRegistry;
        this.notificationDispatcher = notificationDispatcher;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    public ValidationReport validate(String artifactId, int level) {
        if (level < 1 || level > ValidationStage.MAX_LEVEL) {
            throw new PolicyViolationException(PolicyViolationException.INVALID_REQUEST,
                    "Validation level must be between 1 and " + ValidationStage.MAX_LEVEL + ": " + level,
                    Map.of("level", level));
        }
        BackupArtifact artifact = catalog.requireArtifact(artifactId);
        TrustState before = artifact.getTrustState();
        ValidationContext context = new ValidationContext(artifact, level);
        List<ValidationStageResult> results = new ArrayList<>();
        ValidationStage failedStage = null;

        log.info("Validating {} up to level {} (trust={})", artifactId, level, before);
        try {
            for (ValidationStageHandler handler : stages) {
                if (handler.stage().getLevel() > level) {
                    break;
                }
                long started = System.currentTimeMillis();
                try {
                    String message = handler.execute(context);
                    results.add(stageResult(handler.stage(), true, started, message));
                } catch (ValidationFailureException e) {
                    results.add(stageResult(handler.stage(), false, started, e.getMessage()));
                    failedStage = handler.stage();
                    break;
                } catch (CorruptionException e) {
                    results.add(stageResult(handler.stage(), false, started, e.getCode() + ": " + e.getMessage()));
                    failedStage = handler.stage();
                    break;
                }
            }
        } finally {
            storeRegistry.destroy(context.getRehearsal());
        }

        ValidationVerdict verdict;
        if (failedStage != null) {
            verdict = ValidationVerdict.FAILED;
        } else if (level == ValidationStage.MAX_LEVEL) {
            verdict = ValidationVerdict.PASSED;
        } else {
            verdict = ValidationVerdict.INCOMPLETE;
        }

        ValidationReport report = ValidationReport.builder()
                .reportId(IdGenerator.generateReportId())
                .artifactId(artifactId)
                .storeName(artifact.getStoreName())
                .requestedLevel(level)
                .verdict(verdict)
                .failedStage(failedStage)
                .stages(results)
                .warnings(new ArrayList<>(context.getWarnings()))
                .createdAt(clock.instant())
                .build();
        BackupArtifact updated = catalog.recordValidation(report);

        metricsService.recordValidation(artifact.getStoreName(), verdict);
        if (context.getRehearsalDurationMs() >= 0) {
            metricsService.recordRehearsalDuration(artifact.getStoreName(), context.getRehearsalDurationMs());
        }
        publish(artifact, before, updated, report);

        if (verdict == ValidationVerdict.FAILED) {
            log.warn("❌ Validation of {} failed at stage {} ({}): {}", artifactId, failedStage.getLevel(),
                    failedStage, results.get(results.size() - 1).getMessage());
        } else {
            log.info("Validation of {} finished: verdict={}, trust={}, warnings={}",
                    artifactId, verdict, updated.getTrustState(), report.getWarnings().size());
        }
        return report;
    }

    /**
     * 아직 판정되지 않은(UNTESTED) 아티팩트를 오래된 순으로 전체 검증
     * 전송 장애로 검증하지 못한 아티팩트는 UNTESTED 로 남겨 다음 주기에 다시 시도한다.
     */
    public int validatePending() {
        List<BackupArtifact> pending = catalog.pendingValidation();
        int validated = 0;
        for (BackupArtifact artifact : pending) {
            try {
                validate(artifact.getArtifactId(), ValidationStage.MAX_LEVEL);
                validated++;
            } catch (TransientIoException e) {
                log.warn("Validation of {} deferred, archive unavailable: {}", artifact.getArtifactId(), e.getMessage());
            }
        }
        return validated;
    }

    private void publish(BackupArtifact artifact, TrustState before, BackupArtifact updated, ValidationReport report) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("artifactId", artifact.getArtifactId());
        payload.put("reportId", report.getReportId());
        payload.put("verdict", report.getVerdict().name());
        payload.put("trustState", updated.getTrustState().name());
        if (report.getFailedStage() != null) {
            payload.put("failedStage", report.getFailedStage().name());
        }

        if (before == TrustState.PASSED && report.getVerdict() == ValidationVerdict.FAILED) {
            notificationDispatcher.dispatch(new BackupEvent(BackupEvent.VALIDATION_REGRESSION,
                    BackupEvent.Severity.CRITICAL, artifact.getStoreName(),
                    "Previously passed backup " + artifact.getArtifactId() + " now fails validation", payload));
            metricsService.recordAlert(BackupEvent.VALIDATION_REGRESSION, BackupEvent.Severity.CRITICAL.name());
        }
        notificationDispatcher.dispatch(new BackupEvent(BackupEvent.BACKUP_VALIDATED, BackupEvent.Severity.INFO,
                artifact.getStoreName(), "Backup " + artifact.getArtifactId() + " validated: " + report.getVerdict(),
                payload));
    }

    private ValidationStageResult stageResult(ValidationStage stage, boolean passed, long started, String message) {
        return ValidationStageResult.builder()
                .stage(stage)
                .passed(passed)
                .durationMs(System.currentTimeMillis() - started)
                .message(message)
                .build();
    }
}
