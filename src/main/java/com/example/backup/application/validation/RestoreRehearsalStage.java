package com.example.backup.application.validation;

import com.example.backup.domain.entity.BackupArtifact;
import com.example.backup.domain.exception.CorruptionException;
import com.example.backup.domain.exception.ValidationFailureException;
import com.example.backup.domain.model.ValidationStage;
import com.example.backup.infrastructure.codec.BackupContainerCodec;
import com.example.backup.infrastructure.persistence.BackupCatalog;
import com.example.backup.infrastructure.store.StoreInstance;
import com.example.backup.infrastructure.store.StoreRegistry;
import com.example.backup.infrastructure.store.StoreSnapshot;
import com.example.backup.infrastructure.transport.ArchiveTransport;
import com.example.backup.infrastructure.util.Checksums;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;

/**
 * 4단계: 격리된 일회용 인스턴스에 실제로 복원
 * 증분 아티팩트는 부모 체인(FULL 부터)을 먼저 복원한 뒤 적용한다.
 * 인스턴스 정리는 BackupValidator 가 담당.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RestoreRehearsalStage implements ValidationStageHandler {

    private final StoreRegistry storeRegistry;
    private final ArchiveTransport archiveTransport;
    private final BackupContainerCodec containerCodec;
    private final BackupCatalog catalog;

    @Override
    public ValidationStage stage() {
        return ValidationStage.RESTORE_REHEARSAL;
    }

    @Override
    public String execute(ValidationContext context) {
        BackupArtifact artifact = context.getArtifact();
        StoreInstance rehearsal = storeRegistry.createDisposable("rehearsal");
        context.setRehearsal(rehearsal);

        long started = System.currentTimeMillis();
        try {
            for (BackupArtifact ancestor : ancestorsOf(artifact)) {
                byte[] content = archiveTransport.get(ancestor.getLocation());
                if (!Checksums.sha256(content).equals(ancestor.getChecksum())) {
                    throw fail(artifact, "ancestor " + ancestor.getArtifactId() + " does not match its checksum");
                }
                applyTo(rehearsal, ancestor, containerCodec.decode(content));
            }
            applyTo(rehearsal, artifact, context.getContainer().toSnapshot());
        } catch (CorruptionException | IllegalStateException e) {
            throw fail(artifact, "rehearsal restore failed: " + e.getMessage());
        }
        long duration = System.currentTimeMillis() - started;
        context.setRehearsalDurationMs(duration);

        log.debug("Rehearsal restore of {} completed in {}ms (seq {})",
                artifact.getArtifactId(), duration, rehearsal.getAppliedSequence());
        return "restored to seq " + rehearsal.getAppliedSequence() + " in " + duration + "ms";
    }

    private void applyTo(StoreInstance instance, BackupArtifact artifact,
                         StoreSnapshot snapshot) {
        if (artifact.isFull()) {
            instance.load(snapshot);
        } else {
            instance.applyIncremental(snapshot);
        }
    }

    /**
     * FULL 부터 직계 부모까지 (오래된 순)
     */
    private Deque<BackupArtifact> ancestorsOf(BackupArtifact artifact) {
        Deque<BackupArtifact> chain = new ArrayDeque<>();
        BackupArtifact cursor = artifact;
        while (!cursor.isFull()) {
            String parentId = cursor.getParentArtifactId();
            Optional<BackupArtifact> parent = parentId == null ? Optional.empty() : catalog.findArtifact(parentId);
            if (parent.isEmpty()) {
                throw fail(artifact, "parent chain is broken at " + cursor.getArtifactId());
            }
            cursor = parent.get();
            chain.addFirst(cursor);
        }
        return chain;
    }

    private ValidationFailureException fail(BackupArtifact artifact, String message) {
        return new ValidationFailureException(stage(), message, Map.of("artifactId", artifact.getArtifactId()));
    }
}
