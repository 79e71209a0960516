package com.example.backup.infrastructure.messaging;

import com.example.backup.domain.event.BackupEvent;

/**
 * 알림/이벤트 외부 채널 팬아웃 (sink)
 * 구현체는 전달 실패를 호출자에게 전파하지 않는다.
 */
public interface NotificationDispatcher {

    void dispatch(BackupEvent event);
}
