package com.example.backup.domain.exception;

import com.example.backup.domain.model.ValidationStage;

import java.util.Map;

public class ValidationFailureException extends BackupException {

    private final ValidationStage failedStage;

    public ValidationFailureException(ValidationStage failedStage, String message, Map<String, Object> context) {
        super(ErrorKind.VALIDATION_FAILURE, "STAGE_" + failedStage.name(), message, context);
        this.failedStage = failedStage;
    }

    public ValidationStage getFailedStage() {
        return failedStage;
    }
}
