package com.example.backup.domain.model;

public enum ArtifactType {
    FULL,
    INCREMENTAL;

    /**
     * 아티팩트 파일명에 들어가는 토큰 (full / incremental)
     */
    public String fileToken() {
        return name().toLowerCase();
    }

    public static ArtifactType fromToken(String token) {
        if (token == null) {
            throw new IllegalArgumentException("Backup type is required");
        }
        return ArtifactType.valueOf(token.trim().toUpperCase());
    }
}
