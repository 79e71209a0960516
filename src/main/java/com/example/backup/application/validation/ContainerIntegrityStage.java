package com.example.backup.application.validation;

import com.example.backup.domain.entity.BackupArtifact;
import com.example.backup.domain.exception.CorruptionException;
import com.example.backup.domain.exception.ValidationFailureException;
import com.example.backup.domain.model.ValidationStage;
import com.example.backup.infrastructure.codec.BackupContainerCodec;
import com.example.backup.infrastructure.transport.ArchiveTransport;
import com.example.backup.infrastructure.transport.ArtifactNaming;
import com.example.backup.infrastructure.util.Checksums;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 2단계: 카탈로그 크기, 체크섬(카탈로그, 사이드카) 일치 및 컨테이너 전체 압축 해제
 */
@Component
@RequiredArgsConstructor
public class ContainerIntegrityStage implements ValidationStageHandler {

    private final ArchiveTransport archiveTransport;
    private final BackupContainerCodec containerCodec;

    @Override
    public ValidationStage stage() {
        return ValidationStage.CONTAINER_INTEGRITY;
    }

    @Override
    public String execute(ValidationContext context) {
        BackupArtifact artifact = context.getArtifact();
        byte[] content = archiveTransport.get(artifact.getLocation());
        if (content.length != artifact.getSizeBytes()) {
            throw fail(artifact, String.format("artifact is %d bytes but the catalog records %d",
                    content.length, artifact.getSizeBytes()));
        }
        String actual = Checksums.sha256(content);
        if (!actual.equals(artifact.getChecksum())) {
            throw fail(artifact, "checksum " + actual + " does not match catalog " + artifact.getChecksum());
        }
        String sidecarLocation = artifact.getChecksumLocation() != null
                ? artifact.getChecksumLocation()
                : ArtifactNaming.sidecarOf(artifact.getLocation());
        if (!archiveTransport.exists(sidecarLocation)) {
            throw fail(artifact, "checksum sidecar is missing at " + sidecarLocation);
        }
        String sidecar = ArtifactNaming.parseSidecar(archiveTransport.get(sidecarLocation));
        if (!actual.equals(sidecar)) {
            throw fail(artifact, "checksum " + actual + " does not match sidecar " + sidecar);
        }

        try {
            context.setDecompressed(containerCodec.decompress(content));
        } catch (CorruptionException e) {
            throw fail(artifact, e.getMessage());
        }
        context.setContent(content);
        return "checksum verified, " + context.getDecompressed().length + " bytes decompressed";
    }

    private ValidationFailureException fail(BackupArtifact artifact, String message) {
        return new ValidationFailureException(stage(), message, Map.of("artifactId", artifact.getArtifactId()));
    }
}
