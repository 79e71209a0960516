package com.example.backup.application.validation;

import com.example.backup.config.BackupProperties;
import com.example.backup.infrastructure.store.InMemoryStoreInstance;
import com.example.backup.infrastructure.lock.LocalStoreLockService;
import com.example.backup.infrastructure.store.InMemoryStoreInstanceFactory;
import com.example.backup.infrastructure.store.LogMutation;
import com.example.backup.infrastructure.store.StoreRegistry;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContentVerifierTest {

    private StoreRegistry registry;
    private ContentVerifier verifier;
    private InMemoryStoreInstance restored;

    @BeforeEach
    void setUp() {
        BackupProperties properties = new BackupProperties();
        BackupProperties.Store primary = new BackupProperties.Store();
        primary.setCriticalCollections(List.of("accounts", "ledger"));
        primary.getCountTolerancePercent().put("sessions", 50.0);
        properties.getStores().put("primary", primary);

        Clock clock = Clock.systemUTC();
        registry = new StoreRegistry(new InMemoryStoreInstanceFactory(clock), properties, new LocalStoreLockService());
        verifier = new ContentVerifier(properties, registry);
        restored = new InMemoryStoreInstance("rehearsal", clock);
    }

    @Test
    @DisplayName("기대 레코드 수와 다르면 문제로 기록")
    void countMismatchIsProblem() {
        put(restored, "accounts", 3);
        put(restored, "ledger", 1);

        ContentVerifier.Outcome outcome = verifier.verify("primary", restored,
                Map.of("accounts", 4L, "ledger", 1L), false);

        assertFalse(outcome.isClean());
        assertEquals(1, outcome.getProblems().size());
        assertTrue(outcome.getProblems().get(0).contains("accounts restored 3 records, expected 4"));
    }

    @Test
    @DisplayName("중요 컬렉션이 없거나 비어 있으면 실패")
    void criticalCollectionsMustHaveRecords() {
        put(restored, "accounts", 2);
        restored.replaceCollection("ledger", Map.of());

        ContentVerifier.Outcome outcome = verifier.verify("primary", restored, null, false);

        assertEquals(List.of("critical collection ledger is empty"), outcome.getProblems());

        restored.dropCollection("ledger");
        assertEquals(List.of("critical collection ledger is missing"),
                verifier.verify("primary", restored, null, false).getProblems());
    }

    @Test
    @DisplayName("라이브와의 차이는 허용 오차를 넘을 때만 경고 (컬렉션별 오차 우선)")
    void liveDeviationOnlyWarns() {
        put(restored, "accounts", 10);
        put(restored, "ledger", 1);
        put(restored, "sessions", 10);
        commitLive("accounts", 12);
        commitLive("ledger", 1);
        commitLive("sessions", 14);

        ContentVerifier.Outcome outcome = verifier.verify("primary", restored, null, true);

        assertTrue(outcome.isClean());
        assertEquals(1, outcome.getWarnings().size());
        assertTrue(outcome.getWarnings().get(0).startsWith("collection accounts differs from live"));
    }

    private void put(InMemoryStoreInstance store, String collection, int count) {
        List<LogMutation> mutations = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            mutations.add(LogMutation.put(collection, collection + "-" + i, JsonNodeFactory.instance.numberNode(i)));
        }
        store.commit(mutations);
    }

    private void commitLive(String collection, int count) {
        for (int i = 0; i < count; i++) {
            registry.commit("primary", List.of(
                    LogMutation.put(collection, collection + "-" + i, JsonNodeFactory.instance.numberNode(i))));
        }
    }
}
