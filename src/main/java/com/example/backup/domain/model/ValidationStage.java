package com.example.backup.domain.model;

/**
 * 검증 파이프라인 단계 (고정 순서)
 */
public enum ValidationStage {
    EXISTENCE_SIZE(1, "존재/크기 확인"),
    CONTAINER_INTEGRITY(2, "컨테이너 무결성"),
    STRUCTURAL_SANITY(3, "구조 검사"),
    RESTORE_REHEARSAL(4, "복구 리허설"),
    CONTENT_VERIFICATION(5, "내용 검증");

    public static final int MAX_LEVEL = 5;

    private final int level;
    private final String description;

    ValidationStage(int level, String description) {
        this.level = level;
        this.description = description;
    }

    public int getLevel() {
        return level;
    }

    public String getDescription() {
        return description;
    }
}
