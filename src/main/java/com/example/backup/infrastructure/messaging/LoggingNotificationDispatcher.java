package com.example.backup.infrastructure.messaging;

import com.example.backup.domain.event.BackupEvent;
import lombok.extern.slf4j.Slf4j;

/**
 * 외부 채널이 설정되지 않은 경우의 기본 디스패처
 */
@Slf4j
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    @Override
    public void dispatch(BackupEvent event) {
        switch (event.getSeverity()) {
            case CRITICAL:
                log.error("🚨 [{}] store={} {} {}", event.getEventType(), event.getStoreName(),
                        event.getMessage(), event.getPayload());
                break;
            case WARNING:
                log.warn("⚠️ [{}] store={} {} {}", event.getEventType(), event.getStoreName(),
                        event.getMessage(), event.getPayload());
                break;
            default:
                log.info("[{}] store={} {}", event.getEventType(), event.getStoreName(), event.getMessage());
        }
    }
}
