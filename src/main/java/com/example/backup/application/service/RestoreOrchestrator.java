package com.example.backup.application.service;

import com.example.backup.application.validation.ContentVerifier;
import com.example.backup.domain.entity.BackupArtifact;
import com.example.backup.domain.entity.LogSegment;
import com.example.backup.domain.entity.RestoreRun;
import com.example.backup.domain.event.BackupEvent;
import com.example.backup.domain.exception.BackupException;
import com.example.backup.domain.exception.BusyException;
import com.example.backup.domain.exception.CorruptionException;
import com.example.backup.domain.exception.GapException;
import com.example.backup.domain.exception.OperationCancelledException;
import com.example.backup.domain.exception.PolicyViolationException;
import com.example.backup.domain.exception.ValidationFailureException;
import com.example.backup.domain.model.RecoveryPlan;
import com.example.backup.domain.model.RecoveryTarget;
import com.example.backup.domain.model.RestoreRequest;
import com.example.backup.domain.model.RestoreScope;
import com.example.backup.domain.model.RestoreState;
import com.example.backup.domain.model.ValidationStage;
import com.example.backup.infrastructure.codec.BackupContainerCodec;
import com.example.backup.infrastructure.codec.SegmentPayloadCodec;
import com.example.backup.infrastructure.lock.StoreLockService;
import com.example.backup.infrastructure.messaging.NotificationDispatcher;
import com.example.backup.infrastructure.monitoring.BackupMetricsService;
import com.example.backup.infrastructure.persistence.BackupCatalog;
import com.example.backup.infrastructure.store.ProducedSegment;
import com.example.backup.infrastructure.store.StoreInstance;
import com.example.backup.infrastructure.store.StoreRegistry;
import com.example.backup.infrastructure.store.StoreSnapshot;
import com.example.backup.infrastructure.transport.ArchiveTransport;
import com.example.backup.infrastructure.util.Checksums;
import com.example.backup.infrastructure.util.IdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 복구 오케스트레이터
 *
 * IDLE -> PREPARING -> SAFETY_SNAPSHOT -> BASE_RESTORE -> LOG_REPLAY -> VALIDATING -> PROMOTED
 *
 * - 스토어 락을 잡은 상태에서만 실행 (백업/다른 복구와 배타)
 * - 파괴적 단계 이전에 항상 안전 스냅샷을 남긴다
 * - 로그 재생은 시퀀스 순서대로, 누락 시 Gap 으로 중단 (건너뛰지 않음)
 * - 파괴 이후 실패는 안전 스냅샷으로 롤백하고 체크섬으로 확인
 * - 테이블 단위 복구는 스테이징 인스턴스에서 진행, 라이브는 승격 시점에만 변경
 *
 * 실패한 실행은 예외 대신 실패 종류/코드를 담은 RestoreRun 으로 반환한다.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RestoreOrchestrator {

    public static final String SEGMENT_CHECKSUM_MISMATCH = "SEGMENT_CHECKSUM_MISMATCH";
    public static final String BASE_CHECKSUM_MISMATCH = "BASE_CHECKSUM_MISMATCH";

    private static final DateTimeFormatter SIDE_TABLE_SUFFIX =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    private final StoreRegistry storeRegistry;
    private final StoreLockService lockService;
    private final RecoveryTargetResolver targetResolver;
    private final BackupProducer backupProducer;
    private final ArchiveTransport archiveTransport;
    private final BackupContainerCodec containerCodec;
    private final SegmentPayloadCodec segmentCodec;
    private final ContentVerifier contentVerifier;
    private final BackupCatalog catalog;
    private final NotificationDispatcher notificationDispatcher;
    private final BackupMetricsService metricsService;
    private final Clock clock;

    public RestoreRun restore(RestoreRequest request) {
        StoreInstance live = storeRegistry.get(request.getStoreName());
        String runId = IdGenerator.generateRestoreRunId();
        return lockService.executeWithLock(request.getStoreName(), StoreLockService.RESTORE_HOLDER_PREFIX + runId,
                () -> execute(runId, live, request));
    }

    /**
     * 테이블 단위 복구 확인: 보관해 둔 이전 데이터(side-table) 삭제
     */
    public RestoreRun confirmTableRestore(String runId) {
        RestoreRun run = catalog.requireRun(runId);
        if (!run.isPromoted() || run.getSideTableName() == null) {
            throw new PolicyViolationException(PolicyViolationException.INVALID_REQUEST,
                    "Run " + runId + " is not a promoted table restore", Map.of("runId", runId));
        }
        if (run.isConfirmed()) {
            return run;
        }
        return lockService.executeWithLock(run.getStoreName(), "confirm:" + runId, () -> {
            storeRegistry.get(run.getStoreName()).dropCollection(run.getSideTableName());
            run.setConfirmed(true);
            log.info("Table restore {} confirmed, side table {} dropped", runId, run.getSideTableName());
            return catalog.saveRun(run);
        });
    }

    private RestoreRun execute(String runId, StoreInstance live, RestoreRequest request) {
        RecoveryTarget target = request.getTarget() == null ? RecoveryTarget.latest() : request.getTarget();
        RestoreScope scope = request.getScope() == null ? RestoreScope.full() : request.getScope();
        String storeName = live.getName();
        Instant startedAt = clock.instant();

        RestoreRun run = RestoreRun.builder()
                .runId(runId)
                .storeName(storeName)
                .target(target.describe())
                .scope(scope.describe())
                .forced(request.isForce())
                .state(RestoreState.IDLE)
                .startedAt(startedAt)
                .build();
        catalog.saveRun(run);
        log.info("🔄 Restore {} started: store={}, target={}, scope={}, force={}",
                runId, storeName, target.describe(), scope.describe(), request.isForce());

        SafetySnapshot safety = null;
        StoreInstance staging = null;
        boolean liveTouched = false;
        try {
            transition(run, RestoreState.PREPARING);
            RecoveryPlan plan = targetResolver.resolve(storeName, target);
            run.setBaseArtifactId(plan.getBaseArtifact().getArtifactId());
            run.setFromSequence(plan.getReplayFrom());
            run.setTargetSequence(plan.getTargetSequence());

            transition(run, RestoreState.SAFETY_SNAPSHOT);
            int consumers = live.activeConsumers();
            if (consumers > 0) {
                if (!request.isForce()) {
                    throw BusyException.destinationBusy(storeName, consumers);
                }
                live.disconnectConsumers();
            }
            safety = backupProducer.captureSafetySnapshot(live);
            run.setSafetySnapshotLocation(safety.getLocation());
            run.setSafetySnapshotChecksum(safety.getContentChecksum());

            transition(run, RestoreState.BASE_RESTORE);
            List<StoreSnapshot> baseChain = fetchBaseChain(plan);
            checkCancelled(run, "before base restore", plan.getReplayFrom() + 1);
            StoreInstance destination;
            if (scope.isFull()) {
                destination = live;
                liveTouched = true;
            } else {
                staging = storeRegistry.createDisposable("staging");
                destination = staging;
            }
            destination.load(baseChain.get(0));
            for (int i = 1; i < baseChain.size(); i++) {
                destination.applyIncremental(baseChain.get(i));
            }

            transition(run, RestoreState.LOG_REPLAY);
            replay(run, plan, destination);

            transition(run, RestoreState.VALIDATING);
            verifyRestored(run, plan, destination, scope);
            if (!scope.isFull()) {
                promoteTable(run, live, staging, scope.getCollection());
            }

            transition(run, RestoreState.PROMOTED);
            finish(run, null);
            log.info("✅ Restore {} promoted: store={}, base={}, replayed {} segments to seq {}",
                    runId, storeName, run.getBaseArtifactId(), run.getReplayedSegments(), run.getTargetSequence());

        } catch (BackupException e) {
            fail(run, e, live, safety, liveTouched);
        } catch (RuntimeException e) {
            fail(run, new CorruptionException("RESTORE_INTERNAL_ERROR", String.valueOf(e.getMessage()),
                    Map.of("runId", runId), e), live, safety, liveTouched);
            throw e;
        } finally {
            storeRegistry.destroy(staging);
        }
        return run;
    }

    /**
     * 베이스와 증분 체인을 파괴적 단계 전에 모두 내려받아 체크섬 확인 후 디코딩
     */
    private List<StoreSnapshot> fetchBaseChain(RecoveryPlan plan) {
        List<BackupArtifact> chain = new ArrayList<>();
        chain.add(plan.getBaseArtifact());
        chain.addAll(plan.getIncrementals());

        List<StoreSnapshot> snapshots = new ArrayList<>();
        for (BackupArtifact artifact : chain) {
            byte[] content = archiveTransport.get(artifact.getLocation());
            String actual = Checksums.sha256(content);
            if (!actual.equals(artifact.getChecksum())) {
                throw new CorruptionException(BASE_CHECKSUM_MISMATCH,
                        "Artifact " + artifact.getArtifactId() + " does not match its catalog checksum",
                        Map.of("artifactId", artifact.getArtifactId(), "expected", artifact.getChecksum(), "actual", actual));
            }
            snapshots.add(containerCodec.decode(content));
        }
        return snapshots;
    }

    private void replay(RestoreRun run, RecoveryPlan plan, StoreInstance destination) {
        String storeName = run.getStoreName();
        long expected = plan.getReplayFrom() + 1;

        for (LogSegment segment : plan.getSegments()) {
            checkCancelled(run, "during log replay", expected);
            long sequence = segment.getSequenceId();
            if (sequence != expected) {
                throw new GapException(storeName, expected, sequence - 1);
            }
            byte[] payload = archiveTransport.get(segment.getLocation());
            String actual = Checksums.sha256(payload);
            if (!actual.equals(segment.getChecksum())) {
                throw new CorruptionException(SEGMENT_CHECKSUM_MISMATCH,
                        "Segment " + sequence + " of " + storeName + " does not match its catalog checksum",
                        Map.of("store", storeName, "sequenceId", sequence));
            }
            ProducedSegment decoded = segmentCodec.decode(payload);
            destination.apply(sequence, decoded.getMutations());
            run.setReplayedSegments(run.getReplayedSegments() + 1);
            expected++;
        }
        if (expected <= plan.getTargetSequence()) {
            throw new GapException(storeName, expected, plan.getTargetSequence());
        }
        log.debug("Replay of {} finished: {} segments, now at seq {}",
                run.getRunId(), run.getReplayedSegments(), destination.getAppliedSequence());
    }

    /**
     * 취소 지점. 인터럽트 플래그는 지우지 않으므로 호출자도 취소 사실을 알 수 있다.
     */
    private void checkCancelled(RestoreRun run, String where, long nextSequence) {
        if (Thread.currentThread().isInterrupted()) {
            throw new OperationCancelledException("Restore " + run.getRunId() + " cancelled " + where,
                    Map.of("runId", run.getRunId(), "nextSequence", nextSequence));
        }
    }

    private void verifyRestored(RestoreRun run, RecoveryPlan plan, StoreInstance destination, RestoreScope scope) {
        List<String> problems = new ArrayList<>();
        if (destination.getAppliedSequence() != plan.getTargetSequence()) {
            problems.add(String.format("restored sequence %d differs from target %d",
                    destination.getAppliedSequence(), plan.getTargetSequence()));
        }
        if (!scope.isFull() && !destination.collectionNames().contains(scope.getCollection())) {
            problems.add("collection " + scope.getCollection() + " does not exist at the target");
        }
        problems.addAll(contentVerifier.verify(run.getStoreName(), destination, null, false).getProblems());

        if (!problems.isEmpty()) {
            throw new ValidationFailureException(ValidationStage.CONTENT_VERIFICATION, String.join("; ", problems),
                    Map.of("runId", run.getRunId()));
        }
    }

    /**
     * 기존 컬렉션은 side-table 로 옮겨두고 스테이징 결과로 교체
     */
    private void promoteTable(RestoreRun run, StoreInstance live, StoreInstance staging, String collection) {
        String sideTable = collection + "__pre_restore_" + SIDE_TABLE_SUFFIX.format(clock.instant());
        if (live.collectionNames().contains(collection)) {
            live.replaceCollection(sideTable, live.readCollection(collection));
            run.setSideTableName(sideTable);
        }
        live.replaceCollection(collection, staging.readCollection(collection));
        log.info("Collection {} of {} replaced from staging (previous data kept in {})",
                collection, run.getStoreName(), run.getSideTableName());
    }

    private void fail(RestoreRun run, BackupException cause, StoreInstance live, SafetySnapshot safety,
                      boolean liveTouched) {
        RestoreState failedIn = run.getState();
        run.setFailureKind(cause.getKind());
        run.setFailureCode(cause.getCode());
        run.setMessage(cause.getMessage());

        boolean rollback = liveTouched
                || failedIn == RestoreState.LOG_REPLAY
                || failedIn == RestoreState.VALIDATING;
        if (rollback && liveTouched) {
            rollbackLive(run, live, safety);
        }
        RestoreState terminal = rollback ? RestoreState.ROLLED_BACK : RestoreState.ABORTED;
        run.setState(terminal);
        finish(run, cause);
        log.warn("Restore {} ended {} during {}: kind={}, code={}, message={}",
                run.getRunId(), terminal, failedIn, cause.getKind(), cause.getCode(), cause.getMessage());
    }

    private void rollbackLive(RestoreRun run, StoreInstance live, SafetySnapshot safety) {
        String restored;
        try {
            live.load(safety.getSnapshot());
            restored = live.contentChecksum();
        } catch (RuntimeException e) {
            log.error("🚨 Rollback of {} could not reload the safety snapshot {}", run.getRunId(), safety.getLocation(), e);
            restored = "unavailable";
        }
        if (!restored.equals(safety.getContentChecksum())) {
            Map<String, Object> payload = new HashMap<>();
            payload.put("runId", run.getRunId());
            payload.put("expectedChecksum", safety.getContentChecksum());
            payload.put("actualChecksum", restored);
            payload.put("safetySnapshot", safety.getLocation());
            notificationDispatcher.dispatch(new BackupEvent(BackupEvent.ROLLBACK_MISMATCH, BackupEvent.Severity.CRITICAL,
                    run.getStoreName(), "Rollback of " + run.getRunId() + " did not reproduce the pre-restore state",
                    payload));
            metricsService.recordAlert(BackupEvent.ROLLBACK_MISMATCH, BackupEvent.Severity.CRITICAL.name());
            log.error("🚨 Rollback of {} does not match the safety snapshot: expected={}, actual={}",
                    run.getRunId(), safety.getContentChecksum(), restored);
        } else {
            log.info("Store {} rolled back to safety snapshot {} (seq {})",
                    run.getStoreName(), safety.getLocation(), live.getAppliedSequence());
        }
    }

    private void transition(RestoreRun run, RestoreState next) {
        if (!run.getState().canTransitionTo(next)) {
            throw new IllegalStateException("Restore " + run.getRunId() + " cannot move from "
                    + run.getState() + " to " + next);
        }
        log.debug("Restore {}: {} -> {}", run.getRunId(), run.getState(), next);
        run.setState(next);
        catalog.saveRun(run);
    }

    private void finish(RestoreRun run, BackupException cause) {
        Instant finishedAt = clock.instant();
        run.setFinishedAt(finishedAt);
        run.setDurationMs(Duration.between(run.getStartedAt(), finishedAt).toMillis());
        catalog.saveRun(run);
        metricsService.recordRestore(run.getStoreName(), run.getState(), run.getDurationMs());

        Map<String, Object> payload = new HashMap<>();
        payload.put("runId", run.getRunId());
        payload.put("state", run.getState().name());
        payload.put("target", run.getTarget());
        payload.put("scope", run.getScope());
        payload.put("durationMs", run.getDurationMs());
        if (cause != null) {
            payload.put("errorKind", cause.getKind().name());
            payload.put("errorCode", cause.getCode());
        }
        BackupEvent.Severity severity = run.isPromoted() ? BackupEvent.Severity.INFO : BackupEvent.Severity.WARNING;
        notificationDispatcher.dispatch(new BackupEvent(BackupEvent.RESTORE_FINISHED, severity, run.getStoreName(),
                "Restore " + run.getRunId() + " finished: " + run.getState(), payload));
    }
}
