package com.example.backup.domain.exception;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 백업/아카이브/복구 공통 예외
 *
 * kind: 안정적인 오류 분류 (API/CLI 경계에서 그대로 노출)
 * code: 세부 오류 코드 (예: NO_SUITABLE_BACKUP, DESTINATION_BUSY)
 * context: 스토어, 아티팩트 ID, 세그먼트 ID, 단계 등 진단 정보
 */
public class BackupException extends DomainException {

    private final ErrorKind kind;
    private final String code;
    private final Map<String, Object> context;
    private final Instant occurredAt;

    public BackupException(ErrorKind kind, String code, String message) {
        this(kind, code, message, Map.of(), null);
    }

    public BackupException(ErrorKind kind, String code, String message, Map<String, Object> context) {
        this(kind, code, message, context, null);
    }

    public BackupException(ErrorKind kind, String code, String message,
                           Map<String, Object> context, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code;
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        this.occurredAt = Instant.now();
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    @Override
    public String toString() {
        return String.format("%s[kind=%s, code=%s, message=%s, context=%s]",
                getClass().getSimpleName(), kind, code, getMessage(), context);
    }
}
