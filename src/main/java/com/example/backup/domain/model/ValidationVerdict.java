package com.example.backup.domain.model;

public enum ValidationVerdict {
    PASSED,
    FAILED,
    /** 요청 레벨이 5 미만이라 모든 단계가 실행되지 않음 */
    INCOMPLETE
}
