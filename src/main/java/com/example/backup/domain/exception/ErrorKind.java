package com.example.backup.domain.exception;

/**
 * 백업/복구 오류 분류
 * - TRANSIENT_IO 만 재시도 대상
 * - 나머지는 즉시 호출자에게 전파
 */
public enum ErrorKind {
    TRANSIENT_IO("일시적 I/O 오류", true),
    CORRUPTION("체크섬/컨테이너 손상", false),
    GAP("로그 시퀀스 누락", false),
    BUSY("동시 작업 진행 중", false),
    POLICY_VIOLATION("정책 위반", false),
    VALIDATION_FAILURE("검증 실패", false),
    CANCELLED("작업 취소", false);

    private final String description;
    private final boolean retryable;

    ErrorKind(String description, boolean retryable) {
        this.description = description;
        this.retryable = retryable;
    }

    public String getDescription() {
        return description;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
