package com.example.backup.domain.model;

public enum ComplianceLevel {
    OK,
    WARNING,
    CRITICAL;

    public ComplianceLevel worst(ComplianceLevel other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
