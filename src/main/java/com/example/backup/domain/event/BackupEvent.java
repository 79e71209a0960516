package com.example.backup.domain.event;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 알림 디스패처로 전달되는 이벤트
 * - 알림(alert)과 일반 이벤트(백업 생성, 복구 완료 등)를 모두 표현
 */
@Data
@EqualsAndHashCode(callSuper = true)
public class BackupEvent extends BaseEvent<Map<String, Object>> {

    public enum Severity {
        INFO,
        WARNING,
        CRITICAL,
        RESOLVED
    }

    // 이벤트 타입
    public static final String BACKUP_CREATED = "BACKUP_CREATED";
    public static final String BACKUP_VALIDATED = "BACKUP_VALIDATED";
    public static final String RESTORE_FINISHED = "RESTORE_FINISHED";
    public static final String WAL_GAP = "WAL_GAP";
    public static final String WAL_GAP_RISK = "WAL_GAP_RISK";
    public static final String WAL_CORRUPTION = "WAL_CORRUPTION";
    public static final String RPO_BREACH = "RPO_BREACH";
    public static final String RTO_BREACH = "RTO_BREACH";
    public static final String ROLLBACK_MISMATCH = "ROLLBACK_MISMATCH";
    public static final String VALIDATION_REGRESSION = "VALIDATION_REGRESSION";

    private Severity severity;
    private String storeName;
    private String message;

    public BackupEvent() {
        super();
    }

    public BackupEvent(String eventType, Severity severity, String storeName,
                       String message, Map<String, Object> payload) {
        super(eventType, new LinkedHashMap<>(payload));
        this.severity = severity;
        this.storeName = storeName;
        this.message = message;
    }

    public boolean isAlert() {
        return severity == Severity.WARNING || severity == Severity.CRITICAL;
    }
}
