package com.example.backup.scenario;

import com.example.backup.application.service.BackupProducer;
import com.example.backup.application.service.BackupValidator;
import com.example.backup.domain.entity.BackupArtifact;
import com.example.backup.domain.entity.ValidationReport;
import com.example.backup.domain.exception.PolicyViolationException;
import com.example.backup.domain.model.ArtifactType;
import com.example.backup.domain.model.TrustState;
import com.example.backup.domain.model.ValidationStage;
import com.example.backup.domain.model.ValidationVerdict;
import com.example.backup.infrastructure.persistence.BackupCatalog;
import com.example.backup.infrastructure.store.LogMutation;
import com.example.backup.infrastructure.store.StoreRegistry;
import com.example.backup.infrastructure.transport.ArchiveTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 검증 파이프라인 시나리오
 * - 레벨 N 에서 실패한 아티팩트는 N 이상 모든 레벨에서 실패해야 한다
 * - 레벨 5 미만 검증은 신뢰 상태를 바꾸지 않는다
 */
@SpringBootTest
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class BackupValidationScenarioTest {

    private static final String STORE = "primary";

    @Autowired
    private StoreRegistry storeRegistry;

    @Autowired
    private BackupProducer backupProducer;

    @Autowired
    private BackupValidator backupValidator;

    @Autowired
    private BackupCatalog catalog;

    @Autowired
    private ArchiveTransport archiveTransport;

    @Autowired
    private ObjectMapper objectMapper;

    private BackupArtifact artifact;

    @BeforeEach
    void setUp() {
        for (int i = 1; i <= 30; i++) {
            storeRegistry.commit(STORE, List.of(LogMutation.put("accounts", "acc-" + i,
                    objectMapper.createObjectNode().put("balance", i))));
        }
        artifact = backupProducer.produceBackup(STORE, ArtifactType.FULL);
    }

    @Test
    @DisplayName("레벨 1~4 검증은 INCOMPLETE 이며 신뢰 상태는 UNTESTED 로 유지")
    void partialLevelsAreIncomplete() {
        for (int level = 1; level < ValidationStage.MAX_LEVEL; level++) {
            ValidationReport report = backupValidator.validate(artifact.getArtifactId(), level);

            assertEquals(ValidationVerdict.INCOMPLETE, report.getVerdict(), "level " + level);
            assertEquals(level, report.getStages().size());
            assertNull(report.getFailedStage());
        }
        assertEquals(TrustState.UNTESTED, catalog.requireArtifact(artifact.getArtifactId()).getTrustState());
        assertEquals(4, catalog.reportsFor(artifact.getArtifactId()).size());
    }

    @Test
    @DisplayName("레벨 5 를 모두 통과하면 PASSED 로 전이되고 리허설 시간이 기록된다")
    void fullValidationPasses() {
        ValidationReport report = backupValidator.validate(artifact.getArtifactId(), ValidationStage.MAX_LEVEL);

        assertEquals(ValidationVerdict.PASSED, report.getVerdict());
        assertEquals(ValidationStage.MAX_LEVEL, report.getStages().size());
        assertTrue(report.getStageDurationMs(ValidationStage.RESTORE_REHEARSAL) >= 0);
        assertEquals(TrustState.PASSED, catalog.requireArtifact(artifact.getArtifactId()).getTrustState());
        assertEquals(0, storeRegistry.activeDisposableCount());
        assertTrue(catalog.pendingValidation().isEmpty());
    }

    @Test
    @DisplayName("같은 크기로 바이트가 변조되면 레벨 1 은 통과, 레벨 2 이상은 모두 무결성 단계에서 실패")
    void failureIsMonotonicAcrossLevels() {
        byte[] content = archiveTransport.get(artifact.getLocation());
        content[content.length / 2] ^= 0x01;
        archiveTransport.put(artifact.getLocation(), content);

        ValidationReport levelOne = backupValidator.validate(artifact.getArtifactId(), 1);
        assertEquals(ValidationVerdict.INCOMPLETE, levelOne.getVerdict());

        for (int level = 2; level <= ValidationStage.MAX_LEVEL; level++) {
            ValidationReport report = backupValidator.validate(artifact.getArtifactId(), level);

            assertEquals(ValidationVerdict.FAILED, report.getVerdict(), "level " + level);
            assertEquals(ValidationStage.CONTAINER_INTEGRITY, report.getFailedStage(), "level " + level);
            assertEquals(2, report.getStages().size());
        }
        assertEquals(TrustState.FAILED, catalog.requireArtifact(artifact.getArtifactId()).getTrustState());
    }

    @Test
    @DisplayName("절반으로 잘린 아티팩트는 레벨 1 은 통과하고 무결성/구조 단계에서 멈추며 리허설은 실행되지 않는다")
    void truncatedArtifactHaltsBeforeRehearsal() {
        byte[] content = archiveTransport.get(artifact.getLocation());
        archiveTransport.put(artifact.getLocation(), Arrays.copyOf(content, content.length / 2));

        ValidationReport report = backupValidator.validate(artifact.getArtifactId(), ValidationStage.MAX_LEVEL);

        assertEquals(ValidationVerdict.FAILED, report.getVerdict());
        assertTrue(report.getFailedStage() == ValidationStage.CONTAINER_INTEGRITY
                || report.getFailedStage() == ValidationStage.STRUCTURAL_SANITY, String.valueOf(report.getFailedStage()));
        assertTrue(report.getStages().get(0).isPassed());
        assertTrue(report.getStages().stream().noneMatch(s -> s.getStage() == ValidationStage.RESTORE_REHEARSAL
                || s.getStage() == ValidationStage.CONTENT_VERIFICATION));
        assertEquals(-1L, report.getStageDurationMs(ValidationStage.RESTORE_REHEARSAL));
        assertEquals(0, storeRegistry.activeDisposableCount());
    }

    @Test
    @DisplayName("아카이브에서 아티팩트가 사라지면 레벨 1 에서 실패")
    void missingObjectFailsExistence() {
        archiveTransport.delete(artifact.getLocation());

        ValidationReport report = backupValidator.validate(artifact.getArtifactId(), ValidationStage.MAX_LEVEL);

        assertEquals(ValidationVerdict.FAILED, report.getVerdict());
        assertEquals(ValidationStage.EXISTENCE_SIZE, report.getFailedStage());
    }

    @Test
    @DisplayName("PASSED 이후 재검증 실패는 상태를 바꾸지 않고 리포트만 추가된다")
    void passedStateIsSticky() {
        backupValidator.validate(artifact.getArtifactId(), ValidationStage.MAX_LEVEL);
        archiveTransport.delete(artifact.getLocation());

        ValidationReport regression = backupValidator.validate(artifact.getArtifactId(), ValidationStage.MAX_LEVEL);

        assertEquals(ValidationVerdict.FAILED, regression.getVerdict());
        assertEquals(TrustState.PASSED, catalog.requireArtifact(artifact.getArtifactId()).getTrustState());
        assertEquals(2, catalog.reportsFor(artifact.getArtifactId()).size());
    }

    @Test
    @DisplayName("범위를 벗어난 레벨은 요청 오류")
    void invalidLevelIsRejected() {
        PolicyViolationException e = assertThrows(PolicyViolationException.class,
                () -> backupValidator.validate(artifact.getArtifactId(), 6));
        assertEquals(PolicyViolationException.INVALID_REQUEST, e.getCode());
    }

    @Test
    @DisplayName("증분 백업도 부모 체인 위에서 리허설하여 통과한다")
    void incrementalValidatesOnTopOfParent() {
        backupValidator.validate(artifact.getArtifactId(), ValidationStage.MAX_LEVEL);
        storeRegistry.commit(STORE, List.of(LogMutation.put("accounts", "acc-31",
                objectMapper.createObjectNode().put("balance", 31))));
        BackupArtifact incremental = backupProducer.produceBackup(STORE, ArtifactType.INCREMENTAL);

        ValidationReport report = backupValidator.validate(incremental.getArtifactId(), ValidationStage.MAX_LEVEL);

        assertEquals(ValidationVerdict.PASSED, report.getVerdict(), String.valueOf(report.getStages()));
        assertEquals(artifact.getArtifactId(), incremental.getParentArtifactId());
    }
}
