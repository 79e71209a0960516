package com.example.backup.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 명령 결과 상태 (기계 판독용)
 */
public enum CommandStatus {
    OK("ok"),
    DEGRADED("degraded"),
    FAILED("failed");

    private final String value;

    CommandStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static CommandStatus fromValue(String value) {
        for (CommandStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown command status: " + value);
    }

    public static CommandStatus of(ComplianceLevel level) {
        switch (level) {
            case OK:
                return OK;
            case WARNING:
                return DEGRADED;
            default:
                return FAILED;
        }
    }
}
