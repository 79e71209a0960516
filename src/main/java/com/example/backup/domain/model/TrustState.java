package com.example.backup.domain.model;

/**
 * 백업 아티팩트 신뢰 상태
 * UNTESTED -> PASSED | FAILED 전이는 검증기만 수행
 */
public enum TrustState {
    UNTESTED("미검증"),
    PASSED("검증 통과"),
    FAILED("검증 실패");

    private final String description;

    TrustState(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
