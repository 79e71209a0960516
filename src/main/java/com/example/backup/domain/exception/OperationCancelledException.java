package com.example.backup.domain.exception;

import java.util.Map;

public class OperationCancelledException extends BackupException {
    public OperationCancelledException(String message, Map<String, Object> context) {
        super(ErrorKind.CANCELLED, "CANCELLED", message, context);
    }
}
