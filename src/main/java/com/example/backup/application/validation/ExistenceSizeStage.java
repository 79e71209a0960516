package com.example.backup.application.validation;

import com.example.backup.config.BackupProperties;
import com.example.backup.domain.entity.BackupArtifact;
import com.example.backup.domain.exception.ValidationFailureException;
import com.example.backup.domain.model.ValidationStage;
import com.example.backup.infrastructure.transport.ArchiveObject;
import com.example.backup.infrastructure.transport.ArchiveTransport;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 1단계: 존재 여부 및 크기 (0 바이트, 최소 크기 미만)
 */
@Component
@RequiredArgsConstructor
public class ExistenceSizeStage implements ValidationStageHandler {

    private final ArchiveTransport archiveTransport;
    private final BackupProperties properties;

    @Override
    public ValidationStage stage() {
        return ValidationStage.EXISTENCE_SIZE;
    }

    @Override
    public String execute(ValidationContext context) {
        BackupArtifact artifact = context.getArtifact();
        ArchiveObject object = archiveTransport.stat(artifact.getLocation())
                .orElseThrow(() -> fail(artifact, "artifact object is missing at " + artifact.getLocation()));

        if (object.getSizeBytes() == 0) {
            throw fail(artifact, "artifact object is empty");
        }
        long minimum = properties.getValidation().getMinimumSizeBytes();
        if (object.getSizeBytes() < minimum) {
            throw fail(artifact, "artifact is " + object.getSizeBytes() + " bytes, below the minimum of " + minimum);
        }
        return object.getSizeBytes() + " bytes present";
    }

    private ValidationFailureException fail(BackupArtifact artifact, String message) {
        return new ValidationFailureException(stage(), message, Map.of("artifactId", artifact.getArtifactId()));
    }
}
