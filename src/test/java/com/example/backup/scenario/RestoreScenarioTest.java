package com.example.backup.scenario;

import com.example.backup.application.service.BackupProducer;
import com.example.backup.application.service.BackupValidator;
import com.example.backup.application.service.RestoreOrchestrator;
import com.example.backup.domain.entity.BackupArtifact;
import com.example.backup.domain.entity.LogSegment;
import com.example.backup.domain.entity.RestoreRun;
import com.example.backup.domain.exception.BusyException;
import com.example.backup.domain.exception.ErrorKind;
import com.example.backup.domain.exception.PolicyViolationException;
import com.example.backup.domain.model.ArtifactType;
import com.example.backup.domain.model.RecoveryTarget;
import com.example.backup.domain.model.RestoreRequest;
import com.example.backup.domain.model.RestoreScope;
import com.example.backup.domain.model.RestoreState;
import com.example.backup.domain.model.SegmentStatus;
import com.example.backup.domain.model.TrustState;
import com.example.backup.domain.model.ValidationStage;
import com.example.backup.domain.model.ValidationVerdict;
import com.example.backup.infrastructure.persistence.BackupCatalog;
import com.example.backup.infrastructure.store.LogMutation;
import com.example.backup.infrastructure.store.StoreInstance;
import com.example.backup.infrastructure.store.StoreRegistry;
import com.example.backup.infrastructure.transport.ArchiveTransport;
import com.example.backup.infrastructure.transport.ArtifactNaming;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 복구 시나리오 테스트 (실제 파일시스템 아카이브 + 인메모리 스토어)
 * 1. 시퀀스 지정 PITR 성공 -> PROMOTED
 * 2. 재생 중 손상/누락 -> 안전 스냅샷으로 롤백
 * 3. 연결된 소비자 -> force 없으면 중단
 * 4. 테이블 단위 복구 + 확인
 * 5. 인터럽트에 의한 취소
 */
@SpringBootTest
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class RestoreScenarioTest {

    private static final String STORE = "primary";

    @Autowired
    private StoreRegistry storeRegistry;

    @Autowired
    private BackupProducer backupProducer;

    @Autowired
    private BackupValidator backupValidator;

    @Autowired
    private RestoreOrchestrator restoreOrchestrator;

    @Autowired
    private BackupCatalog catalog;

    @Autowired
    private ArchiveTransport archiveTransport;

    @Autowired
    private ObjectMapper objectMapper;

    private StoreInstance live;

    @BeforeEach
    void setUp() {
        live = storeRegistry.get(STORE);
    }

    @Test
    @DisplayName("100건 커밋 후 전체 백업, 50건 추가 커밋, 시퀀스 120 으로 복구하면 PROMOTED")
    void restoreToSequenceIsPromoted() {
        commitAccounts(1, 100);
        verifiedFullBackup();
        commitAccounts(101, 150);

        RestoreRun run = restore(RecoveryTarget.atSequence(120), RestoreScope.full(), false);

        assertEquals(RestoreState.PROMOTED, run.getState(), run.getMessage());
        assertEquals(120L, live.getAppliedSequence());
        assertEquals(20L, run.getReplayedSegments());
        assertEquals(100L, run.getFromSequence());
        assertEquals(120L, live.collectionCounts().get("accounts"));
        assertNotNull(run.getSafetySnapshotLocation());
        assertTrue(archiveTransport.exists(run.getSafetySnapshotLocation()));
        assertEquals(RestoreState.PROMOTED, catalog.requireRun(run.getRunId()).getState());
        assertTrue(catalog.lastPromotedRun(STORE).isPresent());
    }

    @Test
    @DisplayName("백업 이후 변경이 없으면 latest 복구는 재생 없이 PROMOTED")
    void latestWithoutNewSegmentsReplaysNothing() {
        commitAccounts(1, 100);
        verifiedFullBackup();
        String before = live.contentChecksum();

        RestoreRun run = restore(RecoveryTarget.latest(), RestoreScope.full(), false);

        assertEquals(RestoreState.PROMOTED, run.getState(), run.getMessage());
        assertEquals(0L, run.getReplayedSegments());
        assertEquals(before, live.contentChecksum());
    }

    @Test
    @DisplayName("재생 중 손상된 세그먼트를 만나면 롤백되고 라이브는 복구 전과 동일하다")
    void corruptedSegmentRollsBack() {
        commitAccounts(1, 100);
        verifiedFullBackup();
        commitAccounts(101, 150);
        String before = live.contentChecksum();
        archiveTransport.put(ArtifactNaming.segmentLocation(STORE, 110),
                "tampered".getBytes(StandardCharsets.UTF_8));

        RestoreRun run = restore(RecoveryTarget.atSequence(120), RestoreScope.full(), false);

        assertEquals(RestoreState.ROLLED_BACK, run.getState());
        assertEquals(ErrorKind.CORRUPTION, run.getFailureKind());
        assertEquals(RestoreOrchestrator.SEGMENT_CHECKSUM_MISMATCH, run.getFailureCode());
        assertEquals(before, live.contentChecksum());
        assertEquals(150L, live.getAppliedSequence());
    }

    @Test
    @DisplayName("카탈로그에서 세그먼트가 빠져 있으면 건너뛰지 않고 GAP 으로 롤백")
    void missingSegmentRollsBackWithGap() {
        commitAccounts(1, 100);
        verifiedFullBackup();
        commitAccounts(101, 150);
        String before = live.contentChecksum();
        catalog.deleteSegments(List.of(catalog.findSegment(STORE, 110).orElseThrow()));

        RestoreRun run = restore(RecoveryTarget.atSequence(120), RestoreScope.full(), false);

        assertEquals(RestoreState.ROLLED_BACK, run.getState());
        assertEquals(ErrorKind.GAP, run.getFailureKind());
        assertEquals(9L, run.getReplayedSegments());
        assertEquals(before, live.contentChecksum());
    }

    @Test
    @DisplayName("시각 목표 구간 안에 아카이브 실패 세그먼트가 있으면 이전 세그먼트로 낮추지 않고 GAP 으로 롤백")
    void failedSegmentInsideTimestampWindowRollsBack() {
        commitAccounts(1, 10);
        verifiedFullBackup();
        commitAccounts(11, 20);
        LogSegment failed = catalog.findSegment(STORE, 15).orElseThrow();
        failed.setStatus(SegmentStatus.FAILED);
        catalog.saveSegment(failed);
        String before = live.contentChecksum();

        RestoreRun run = restore(RecoveryTarget.at(failed.getProducedAt()), RestoreScope.full(), false);

        assertEquals(RestoreState.ROLLED_BACK, run.getState(), run.getMessage());
        assertEquals(ErrorKind.GAP, run.getFailureKind());
        assertTrue(run.getTargetSequence() >= 15L);
        assertEquals(4L, run.getReplayedSegments());
        assertEquals(before, live.contentChecksum());
        assertEquals(20L, live.getAppliedSequence());
    }

    @Test
    @DisplayName("호출 스레드가 인터럽트되면 라이브를 건드리지 않고 취소되며 인터럽트 상태는 유지된다")
    void interruptedRestoreIsCancelled() {
        commitAccounts(1, 50);
        verifiedFullBackup();
        commitAccounts(51, 60);
        String before = live.contentChecksum();

        RestoreRun run;
        boolean stillInterrupted;
        Thread.currentThread().interrupt();
        try {
            run = restore(RecoveryTarget.atSequence(55), RestoreScope.full(), false);
        } finally {
            stillInterrupted = Thread.interrupted();
        }

        assertTrue(stillInterrupted);
        assertEquals(ErrorKind.CANCELLED, run.getFailureKind());
        assertTrue(run.getState() == RestoreState.ABORTED || run.getState() == RestoreState.ROLLED_BACK,
                String.valueOf(run.getState()));
        assertEquals(before, live.contentChecksum());
        assertEquals(60L, live.getAppliedSequence());
    }

    @Test
    @DisplayName("소비자가 연결되어 있으면 force 없이는 중단되고, force 면 연결을 끊고 진행")
    void connectedConsumersNeedForce() {
        commitAccounts(1, 100);
        verifiedFullBackup();
        commitAccounts(101, 110);
        storeRegistry.connectConsumer(STORE, "reporting-app");

        RestoreRun refused = restore(RecoveryTarget.atSequence(105), RestoreScope.full(), false);

        assertEquals(RestoreState.ABORTED, refused.getState());
        assertEquals(ErrorKind.BUSY, refused.getFailureKind());
        assertEquals(BusyException.DESTINATION_BUSY, refused.getFailureCode());
        assertEquals(110L, live.getAppliedSequence());
        assertEquals(1, live.activeConsumers());

        RestoreRun forced = restore(RecoveryTarget.atSequence(105), RestoreScope.full(), true);

        assertEquals(RestoreState.PROMOTED, forced.getState(), forced.getMessage());
        assertEquals(0, live.activeConsumers());
        assertEquals(105L, live.getAppliedSequence());
    }

    @Test
    @DisplayName("검증을 통과한 백업이 없으면 아무것도 건드리지 않고 ABORTED")
    void noPassedBackupAborts() {
        commitAccounts(1, 20);
        backupProducer.produceBackup(STORE, ArtifactType.FULL); // UNTESTED
        String before = live.contentChecksum();

        RestoreRun run = restore(RecoveryTarget.latest(), RestoreScope.full(), false);

        assertEquals(RestoreState.ABORTED, run.getState());
        assertEquals(PolicyViolationException.NO_SUITABLE_BACKUP, run.getFailureCode());
        assertNull(run.getSafetySnapshotLocation());
        assertEquals(before, live.contentChecksum());
    }

    @Test
    @DisplayName("테이블 단위 복구는 해당 컬렉션만 교체하고 이전 데이터를 보관, 확인 후 삭제")
    void tableRestoreKeepsSideTableUntilConfirmed() {
        commitAccounts(1, 100);
        verifiedFullBackup();
        commitAccounts(101, 150);
        storeRegistry.commit(STORE, List.of(LogMutation.put("orders", "order-1", record(1))));

        RestoreRun run = restore(RecoveryTarget.atSequence(120), RestoreScope.table("accounts"), false);

        assertEquals(RestoreState.PROMOTED, run.getState(), run.getMessage());
        assertEquals(151L, live.getAppliedSequence());
        assertEquals(120L, live.collectionCounts().get("accounts"));
        assertEquals(1L, live.collectionCounts().get("orders"));
        assertNotNull(run.getSideTableName());
        assertTrue(run.getSideTableName().startsWith("accounts__pre_restore_"));
        assertEquals(150L, live.collectionCounts().get(run.getSideTableName()));
        assertEquals(0, storeRegistry.activeDisposableCount());

        RestoreRun confirmed = restoreOrchestrator.confirmTableRestore(run.getRunId());

        assertTrue(confirmed.isConfirmed());
        assertFalse(live.collectionNames().contains(run.getSideTableName()));
    }

    @Test
    @DisplayName("실패한 아티팩트는 복구 베이스로 쓰이지 않고 더 오래된 PASSED 백업을 사용한다")
    void failedArtifactIsSkippedAsBase() {
        commitAccounts(1, 50);
        BackupArtifact older = verifiedFullBackup();
        commitAccounts(51, 100);
        BackupArtifact newer = backupProducer.produceBackup(STORE, ArtifactType.FULL);
        byte[] content = archiveTransport.get(newer.getLocation());
        content[content.length / 2] ^= 0x5A;
        archiveTransport.put(newer.getLocation(), content);
        assertEquals(ValidationVerdict.FAILED,
                backupValidator.validate(newer.getArtifactId(), ValidationStage.MAX_LEVEL).getVerdict());

        RestoreRun run = restore(RecoveryTarget.atSequence(100), RestoreScope.full(), false);

        assertEquals(RestoreState.PROMOTED, run.getState(), run.getMessage());
        assertEquals(older.getArtifactId(), run.getBaseArtifactId());
        assertEquals(50L, run.getReplayedSegments());
    }

    private BackupArtifact verifiedFullBackup() {
        BackupArtifact artifact = backupProducer.produceBackup(STORE, ArtifactType.FULL);
        assertEquals(ValidationVerdict.PASSED,
                backupValidator.validate(artifact.getArtifactId(), ValidationStage.MAX_LEVEL).getVerdict());
        assertEquals(TrustState.PASSED, catalog.requireArtifact(artifact.getArtifactId()).getTrustState());
        return artifact;
    }

    private RestoreRun restore(RecoveryTarget target, RestoreScope scope, boolean force) {
        return restoreOrchestrator.restore(RestoreRequest.builder()
                .storeName(STORE)
                .target(target)
                .scope(scope)
                .force(force)
                .build());
    }

    private void commitAccounts(int fromInclusive, int toInclusive) {
        for (int i = fromInclusive; i <= toInclusive; i++) {
            storeRegistry.commit(STORE, List.of(LogMutation.put("accounts", "acc-" + i, record(i))));
        }
    }

    private ObjectNode record(int i) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("owner", "user-" + i);
        node.put("balance", i * 100);
        return node;
    }
}
