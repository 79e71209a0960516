package com.example.backup.infrastructure.lock;

import com.example.backup.domain.exception.BusyException;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 단일 노드용 프로세스 내 락
 */
@Slf4j
public class LocalStoreLockService implements StoreLockService {

    private final Map<String, String> holders = new ConcurrentHashMap<>();

    @Override
    public <T> T executeWithLock(String storeName, String holder, Supplier<T> action) {
        String existing = holders.putIfAbsent(storeName, holder);
        if (existing != null) {
            log.warn("Store lock busy: store={}, holder={}, requester={}", storeName, existing, holder);
            throw BusyException.storeLocked(storeName, existing);
        }
        log.debug("Store lock acquired: store={}, holder={}", storeName, holder);
        try {
            return action.get();
        } finally {
            holders.remove(storeName, holder);
            log.debug("Store lock released: store={}, holder={}", storeName, holder);
        }
    }

    @Override
    public Optional<String> currentHolder(String storeName) {
        return Optional.ofNullable(holders.get(storeName));
    }
}
