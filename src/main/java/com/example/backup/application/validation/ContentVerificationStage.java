package com.example.backup.application.validation;

import com.example.backup.domain.entity.BackupArtifact;
import com.example.backup.domain.exception.ValidationFailureException;
import com.example.backup.domain.model.ValidationStage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 5단계: 리허설 인스턴스의 컬렉션별 레코드 수가 아티팩트 기록과 정확히 일치하는지 확인
 */
@Component
@RequiredArgsConstructor
public class ContentVerificationStage implements ValidationStageHandler {

    private final ContentVerifier contentVerifier;

    @Override
    public ValidationStage stage() {
        return ValidationStage.CONTENT_VERIFICATION;
    }

    @Override
    public String execute(ValidationContext context) {
        BackupArtifact artifact = context.getArtifact();
        ContentVerifier.Outcome outcome = contentVerifier.verify(artifact.getStoreName(), context.getRehearsal(),
                artifact.getCollectionCounts(), true);
        outcome.getWarnings().forEach(context::addWarning);

        if (!outcome.isClean()) {
            throw new ValidationFailureException(stage(), String.join("; ", outcome.getProblems()),
                    Map.of("artifactId", artifact.getArtifactId(), "problems", outcome.getProblems()));
        }
        return artifact.getCollectionCounts().size() + " collections match, "
                + outcome.getWarnings().size() + " warnings";
    }
}
