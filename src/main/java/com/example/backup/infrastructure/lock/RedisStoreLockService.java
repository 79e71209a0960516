package com.example.backup.infrastructure.lock;

import com.example.backup.domain.exception.BusyException;
import com.example.backup.domain.exception.TransientIoException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Redis 기반 분산 스토어 락 (여러 노드가 같은 카탈로그/아카이브를 공유하는 경우)
 *
 * SET NX PX 로 획득하고, 값 비교 후 삭제하는 스크립트로 해제하여 다른 점유자의 락을 지우지 않는다.
 */
@Slf4j
public class RedisStoreLockService implements StoreLockService {

    private static final DefaultRedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;
    private final Duration leaseTime;

    public RedisStoreLockService(StringRedisTemplate redisTemplate, String keyPrefix, Duration leaseTime) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix;
        this.leaseTime = leaseTime;
    }

    @Override
    public <T> T executeWithLock(String storeName, String holder, Supplier<T> action) {
        String lockKey = keyPrefix + storeName;
        String lockValue = holder + "|" + UUID.randomUUID();

        Boolean acquired;
        try {
            acquired = redisTemplate.opsForValue().setIfAbsent(lockKey, lockValue, leaseTime);
        } catch (DataAccessException e) {
            throw new TransientIoException("Lock backend unavailable for store " + storeName,
                    Map.of("store", storeName), e);
        }

        if (!Boolean.TRUE.equals(acquired)) {
            String existing = currentHolder(storeName).orElse(null);
            log.warn("Store lock busy: key={}, holder={}, requester={}", lockKey, existing, holder);
            throw BusyException.storeLocked(storeName, existing);
        }

        log.info("Lock acquired successfully: key={}, holder={}", lockKey, holder);
        try {
            return action.get();
        } finally {
            releaseLock(lockKey, lockValue);
        }
    }

    @Override
    public Optional<String> currentHolder(String storeName) {
        String value = redisTemplate.opsForValue().get(keyPrefix + storeName);
        if (value == null) {
            return Optional.empty();
        }
        int separator = value.lastIndexOf('|');
        return Optional.of(separator < 0 ? value : value.substring(0, separator));
    }

    private void releaseLock(String key, String expectedValue) {
        try {
            Long released = redisTemplate.execute(RELEASE_SCRIPT, List.of(key), expectedValue);
            if (released == null || released == 0L) {
                // lease 만료 후 다른 점유자가 획득한 경우
                log.warn("Lock was not held at release: key={}", key);
            } else {
                log.info("Lock released: key={}", key);
            }
        } catch (DataAccessException e) {
            log.error("Failed to release lock (expires after lease): key={}", key, e);
        }
    }
}
