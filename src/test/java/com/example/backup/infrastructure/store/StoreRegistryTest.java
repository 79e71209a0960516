package com.example.backup.infrastructure.store;

import com.example.backup.config.BackupProperties;
import com.example.backup.domain.exception.BusyException;
import com.example.backup.infrastructure.lock.LocalStoreLockService;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StoreRegistryTest {

    private LocalStoreLockService lockService;
    private StoreRegistry registry;

    @BeforeEach
    void setUp() {
        lockService = new LocalStoreLockService();
        registry = new StoreRegistry(new InMemoryStoreInstanceFactory(Clock.systemUTC()), new BackupProperties(),
                lockService);
        registry.commit("primary", List.of(put("a1")));
    }

    @Test
    @DisplayName("복구가 스토어를 점유 중이면 라이브 쓰기는 Busy 로 거부되고 시퀀스는 그대로")
    void writesAreRefusedDuringRestore() {
        BusyException e = lockService.executeWithLock("primary", "restore:RST-1",
                () -> assertThrows(BusyException.class, () -> registry.commit("primary", List.of(put("a2")))));

        assertEquals(BusyException.STORE_LOCKED, e.getCode());
        assertEquals(1L, registry.get("primary").getAppliedSequence());

        registry.commit("primary", List.of(put("a2")));
        assertEquals(2L, registry.get("primary").getAppliedSequence());
    }

    @Test
    @DisplayName("백업이 락을 보유 중이어도 라이브 쓰기는 허용된다")
    void writesAreAllowedDuringBackup() {
        ProducedSegment segment = lockService.executeWithLock("primary", "backup:full",
                () -> registry.commit("primary", List.of(put("a2"))));

        assertEquals(2L, segment.getSequenceId());
    }

    private static LogMutation put(String key) {
        return LogMutation.put("accounts", key, JsonNodeFactory.instance.objectNode().put("balance", 1));
    }
}
