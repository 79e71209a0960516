package com.example.backup.application.validation;

import com.example.backup.domain.entity.BackupArtifact;
import com.example.backup.domain.exception.ValidationFailureException;
import com.example.backup.domain.model.ValidationStage;
import com.example.backup.infrastructure.codec.BackupContainer;
import com.example.backup.infrastructure.codec.BackupContainerCodec;
import com.example.backup.infrastructure.codec.ContainerHeader;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 3단계: 헤더, 컬렉션 섹션, 트레일러 존재 및 선언된 수와 실제 레코드 수 일치
 */
@Component
@RequiredArgsConstructor
public class StructuralSanityStage implements ValidationStageHandler {

    private final BackupContainerCodec containerCodec;

    @Override
    public ValidationStage stage() {
        return ValidationStage.STRUCTURAL_SANITY;
    }

    @Override
    public String execute(ValidationContext context) {
        BackupArtifact artifact = context.getArtifact();
        BackupContainer container = containerCodec.parse(context.getDecompressed());
        List<String> problems = new ArrayList<>(container.getProblems());

        ContainerHeader header = container.getHeader();
        if (header != null) {
            if (!artifact.getArtifactId().equals(header.getArtifactId())) {
                problems.add("header names artifact " + header.getArtifactId());
            }
            if (!artifact.getStoreName().equals(header.getStore())) {
                problems.add("header names store " + header.getStore());
            }
            if (!artifact.getArtifactType().fileToken().equalsIgnoreCase(String.valueOf(header.getBackupType()))) {
                problems.add("header declares type " + header.getBackupType());
            }
            if (!Objects.equals(artifact.getConsistencyMarker(), header.getConsistencyMarker())) {
                problems.add(String.format("header marker %d differs from catalog %d",
                        header.getConsistencyMarker(), artifact.getConsistencyMarker()));
            }
            if (container.getRecordCount() != artifact.getRecordCount()) {
                problems.add(String.format("container holds %d records, catalog records %d",
                        container.getRecordCount(), artifact.getRecordCount()));
            }
        }

        if (!problems.isEmpty()) {
            throw new ValidationFailureException(stage(), String.join("; ", problems),
                    Map.of("artifactId", artifact.getArtifactId(), "problems", problems));
        }
        context.setContainer(container);
        return header.getCollections().size() + " collections, " + container.getRecordCount() + " records";
    }
}
