package com.example.backup.domain.exception;

import java.util.Map;

public class PolicyViolationException extends BackupException {

    public static final String NO_SUITABLE_BACKUP = "NO_SUITABLE_BACKUP";
    public static final String TARGET_UNREACHABLE = "TARGET_UNREACHABLE";
    public static final String MISSING_FULL_BASE = "MISSING_FULL_BASE";
    public static final String INVALID_REQUEST = "INVALID_REQUEST";
    public static final String NOT_FOUND = "NOT_FOUND";

    public PolicyViolationException(String code, String message, Map<String, Object> context) {
        super(ErrorKind.POLICY_VIOLATION, code, message, context);
    }

    public static PolicyViolationException noSuitableBackup(String storeName, String target) {
        return new PolicyViolationException(NO_SUITABLE_BACKUP,
                "No eligible full backup of store " + storeName + " precedes target " + target,
                Map.of("store", storeName, "target", target));
    }

    public static PolicyViolationException notFound(String what, String id) {
        return new PolicyViolationException(NOT_FOUND, what + " not found: " + id, Map.of("id", id));
    }
}
