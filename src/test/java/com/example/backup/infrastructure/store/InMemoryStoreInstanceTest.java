package com.example.backup.infrastructure.store;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryStoreInstanceTest {

    private InMemoryStoreInstance store;

    @BeforeEach
    void setUp() {
        store = new InMemoryStoreInstance("primary", Clock.systemUTC());
    }

    @Test
    @DisplayName("커밋마다 시퀀스가 1씩 증가하고 세그먼트가 리스너에 전달된다")
    void commitAdvancesSequenceAndNotifiesListeners() {
        List<ProducedSegment> received = new ArrayList<>();
        store.addSegmentListener(received::add);

        store.commit(List.of(put("accounts", "a1", 100)));
        ProducedSegment second = store.commit(List.of(put("accounts", "a2", 200), put("orders", "o1", 1)));

        assertEquals(2, store.getAppliedSequence());
        assertEquals(2, second.getSequenceId());
        assertEquals(2, received.size());
        assertEquals(1L, store.collectionCounts().get("orders"));
        assertEquals(2L, store.collectionCounts().get("accounts"));
    }

    @Test
    @DisplayName("리스너 실패는 이미 커밋된 쓰기를 되돌리지 않는다")
    void listenerFailureDoesNotUndoCommit() {
        store.addSegmentListener(segment -> {
            throw new IllegalStateException("archive down");
        });

        store.commit(List.of(put("accounts", "a1", 100)));

        assertEquals(1, store.getAppliedSequence());
        assertTrue(store.readCollection("accounts").containsKey("a1"));
    }

    @Test
    @DisplayName("증분 스냅샷은 기준 시퀀스 이후의 변경과 삭제만 담는다")
    void snapshotSinceContainsOnlyLaterChanges() {
        store.commit(List.of(put("accounts", "a1", 1), put("accounts", "a2", 2)));
        store.commit(List.of(put("accounts", "a3", 3)));
        store.commit(List.of(LogMutation.delete("accounts", "a1")));

        StoreSnapshot delta = store.snapshotSince(1);

        assertFalse(delta.isFull());
        assertEquals(1, delta.getBaseSequence());
        assertEquals(3, delta.getAppliedSequence());
        assertEquals(1, delta.getRecordCount());
        assertTrue(delta.getCollections().get("accounts").containsKey("a3"));
        assertTrue(delta.getTombstones().get("accounts").contains("a1"));
        assertEquals(2L, delta.getStateCounts().get("accounts"));
    }

    @Test
    @DisplayName("전체 스냅샷 + 증분 적용 결과는 원본과 같은 체크섬을 가진다")
    void fullPlusIncrementalReproducesSource() {
        store.commit(List.of(put("accounts", "a1", 1), put("accounts", "a2", 2)));
        StoreSnapshot base = store.snapshot();
        store.commit(List.of(put("accounts", "a3", 3)));
        store.commit(List.of(LogMutation.delete("accounts", "a2")));
        StoreSnapshot delta = store.snapshotSince(base.getAppliedSequence());

        InMemoryStoreInstance copy = new InMemoryStoreInstance("copy", Clock.systemUTC());
        copy.load(base);
        copy.applyIncremental(delta);

        assertEquals(store.getAppliedSequence(), copy.getAppliedSequence());
        assertEquals(store.contentChecksum(), copy.contentChecksum());
    }

    @Test
    @DisplayName("기준 시퀀스가 맞지 않는 증분은 적용을 거부한다")
    void incrementalWithWrongBaseIsRejected() {
        store.commit(List.of(put("accounts", "a1", 1)));
        StoreSnapshot delta = new StoreSnapshot("primary", 5, 4, false, java.util.Map.of(), java.util.Map.of());

        assertThrows(IllegalStateException.class, () -> store.applyIncremental(delta));
        assertEquals(1, store.getAppliedSequence());
    }

    @Test
    @DisplayName("세그먼트는 바로 다음 시퀀스만 적용할 수 있다")
    void segmentsMustBeAppliedInOrder() {
        store.apply(1, List.of(put("accounts", "a1", 1)));

        assertThrows(IllegalStateException.class, () -> store.apply(3, List.of(put("accounts", "a3", 3))));
        assertThrows(IllegalStateException.class, () -> store.apply(1, List.of(put("accounts", "a1", 1))));
        assertEquals(1, store.getAppliedSequence());
    }

    @Test
    @DisplayName("적용 시퀀스가 다르면 내용이 같아도 체크섬이 다르다")
    void checksumCoversAppliedSequence() {
        InMemoryStoreInstance other = new InMemoryStoreInstance("other", Clock.systemUTC());
        store.commit(List.of(put("accounts", "a1", 1)));
        other.commit(List.of(put("accounts", "a1", 0)));
        other.commit(List.of(put("accounts", "a1", 1)));

        assertEquals(store.readCollection("accounts"), other.readCollection("accounts"));
        assertNotEquals(store.contentChecksum(), other.contentChecksum());
    }

    @Test
    @DisplayName("소비자 강제 해제")
    void disconnectConsumers() {
        store.connect("app-1");
        store.connect("app-2");
        assertEquals(2, store.activeConsumers());

        store.disconnectConsumers();

        assertEquals(0, store.activeConsumers());
    }

    private static LogMutation put(String collection, String key, int balance) {
        return LogMutation.put(collection, key, JsonNodeFactory.instance.objectNode().put("balance", balance));
    }
}
