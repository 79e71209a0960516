package com.example.backup.infrastructure.lock;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * 스토어 단위 배타 락 (백업 생성과 복구가 공유)
 *
 * 대기하지 않는다. 이미 점유된 경우 즉시 BusyException 을 던진다.
 */
public interface StoreLockService {

    /**
     * 복구 실행이 사용하는 점유자 접두어. 이 점유 중에는 라이브 쓰기도 거부된다.
     */
    String RESTORE_HOLDER_PREFIX = "restore:";

    /**
     * @param storeName 대상 스토어
     * @param holder    점유자 설명 (예: "backup:full", "restore:RST-...")
     * @throws com.example.backup.domain.exception.BusyException 다른 작업이 점유 중인 경우
     */
    <T> T executeWithLock(String storeName, String holder, Supplier<T> action);

    Optional<String> currentHolder(String storeName);
}
