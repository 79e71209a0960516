package com.example.backup.domain.model;

/**
 * 스토리지 티어 (엄격도 내림차순)
 */
public enum StorageTier {
    CRITICAL,
    IMPORTANT,
    STANDARD,
    LOW;

    public static StorageTier fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tier name is required");
        }
        return StorageTier.valueOf(name.trim().toUpperCase());
    }
}
