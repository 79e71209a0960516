package com.example.backup.infrastructure.store;

import com.example.backup.infrastructure.util.Checksums;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 내장 인메모리 스토어 어댑터
 * - 라이브 스토어, 검증 리허설 인스턴스, 테이블 복구 스테이징 인스턴스로 사용
 * - 레코드별 마지막 변경 시퀀스를 보관하여 증분 스냅샷 지원
 */
@Slf4j
public class InMemoryStoreInstance implements StoreInstance {

    private final String name;
    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // collection -> key -> record
    private final Map<String, Map<String, VersionedRecord>> collections = new TreeMap<>();
    // collection -> key -> 삭제된 시퀀스
    private final Map<String, Map<String, Long>> tombstones = new TreeMap<>();
    private final Set<String> consumers = ConcurrentHashMap.newKeySet();
    private final List<SegmentListener> listeners = new CopyOnWriteArrayList<>();

    private long appliedSequence;

    public InMemoryStoreInstance(String name, Clock clock) {
        this.name = name;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public long getAppliedSequence() {
        lock.readLock().lock();
        try {
            return appliedSequence;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 소스 스토어 쓰기: 변경을 다음 시퀀스로 커밋하고 세그먼트를 리스너에 전달
     */
    public ProducedSegment commit(List<LogMutation> mutations) {
        ProducedSegment segment;
        lock.writeLock().lock();
        try {
            long next = appliedSequence + 1;
            applyMutations(next, mutations);
            appliedSequence = next;
            segment = new ProducedSegment(name, next, Instant.now(clock), List.copyOf(mutations));
        } finally {
            lock.writeLock().unlock();
        }

        for (SegmentListener listener : listeners) {
            try {
                listener.onSegment(segment);
            } catch (RuntimeException e) {
                // 아카이브 실패는 아카이버가 gap risk 로 처리. 쓰기 자체는 이미 커밋됨
                log.error("Segment listener failed: store={}, seq={}", name, segment.getSequenceId(), e);
            }
        }
        return segment;
    }

    public void addSegmentListener(SegmentListener listener) {
        listeners.add(listener);
    }

    public void connect(String consumerId) {
        consumers.add(consumerId);
    }

    public void disconnect(String consumerId) {
        consumers.remove(consumerId);
    }

    @Override
    public StoreSnapshot snapshot() {
        lock.readLock().lock();
        try {
            Map<String, Map<String, JsonNode>> copy = new TreeMap<>();
            collections.forEach((collection, records) -> {
                Map<String, JsonNode> values = new TreeMap<>();
                records.forEach((key, record) -> values.put(key, record.value.deepCopy()));
                copy.put(collection, values);
            });
            return StoreSnapshot.full(name, appliedSequence, copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public StoreSnapshot snapshotSince(long sinceSequence) {
        lock.readLock().lock();
        try {
            Map<String, Map<String, JsonNode>> changed = new TreeMap<>();
            collections.forEach((collection, records) -> records.forEach((key, record) -> {
                if (record.version > sinceSequence) {
                    changed.computeIfAbsent(collection, c -> new TreeMap<>()).put(key, record.value.deepCopy());
                }
            }));
            Map<String, Set<String>> removed = new TreeMap<>();
            tombstones.forEach((collection, keys) -> keys.forEach((key, version) -> {
                if (version > sinceSequence) {
                    removed.computeIfAbsent(collection, c -> new TreeSet<>()).add(key);
                }
            }));
            Map<String, Long> counts = new TreeMap<>();
            collections.forEach((collection, records) -> counts.put(collection, (long) records.size()));
            return new StoreSnapshot(name, appliedSequence, sinceSequence, false, changed, removed, counts);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void load(StoreSnapshot snapshot) {
        if (!snapshot.isFull()) {
            throw new IllegalArgumentException("Only a full snapshot can be loaded; use applyIncremental");
        }
        lock.writeLock().lock();
        try {
            collections.clear();
            tombstones.clear();
            long version = snapshot.getAppliedSequence();
            snapshot.getCollections().forEach((collection, records) -> {
                Map<String, VersionedRecord> target = new TreeMap<>();
                records.forEach((key, value) -> target.put(key, new VersionedRecord(value.deepCopy(), version)));
                collections.put(collection, target);
            });
            appliedSequence = version;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void applyIncremental(StoreSnapshot delta) {
        lock.writeLock().lock();
        try {
            if (delta.getBaseSequence() != appliedSequence) {
                throw new IllegalStateException(String.format(
                        "Incremental base %d does not match applied sequence %d of %s",
                        delta.getBaseSequence(), appliedSequence, name));
            }
            long version = delta.getAppliedSequence();
            delta.getCollections().forEach((collection, records) -> records.forEach((key, value) -> {
                collections.computeIfAbsent(collection, c -> new TreeMap<>())
                        .put(key, new VersionedRecord(value.deepCopy(), version));
                removeTombstone(collection, key);
            }));
            delta.getTombstones().forEach((collection, keys) -> keys.forEach(key -> deleteRecord(collection, key, version)));
            appliedSequence = version;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void apply(long sequenceId, List<LogMutation> mutations) {
        lock.writeLock().lock();
        try {
            if (sequenceId != appliedSequence + 1) {
                throw new IllegalStateException(String.format(
                        "Segment %d cannot be applied to %s at sequence %d", sequenceId, name, appliedSequence));
            }
            applyMutations(sequenceId, mutations);
            appliedSequence = sequenceId;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Set<String> collectionNames() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableSet(new TreeSet<>(collections.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Map<String, Long> collectionCounts() {
        lock.readLock().lock();
        try {
            Map<String, Long> counts = new TreeMap<>();
            collections.forEach((collection, records) -> counts.put(collection, (long) records.size()));
            return counts;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Map<String, JsonNode> readCollection(String collection) {
        lock.readLock().lock();
        try {
            Map<String, JsonNode> values = new TreeMap<>();
            collections.getOrDefault(collection, Map.of())
                    .forEach((key, record) -> values.put(key, record.value.deepCopy()));
            return values;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void replaceCollection(String collection, Map<String, JsonNode> records) {
        lock.writeLock().lock();
        try {
            Map<String, VersionedRecord> target = new TreeMap<>();
            records.forEach((key, value) -> target.put(key, new VersionedRecord(value.deepCopy(), appliedSequence)));
            collections.put(collection, target);
            tombstones.remove(collection);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void dropCollection(String collection) {
        lock.writeLock().lock();
        try {
            collections.remove(collection);
            tombstones.remove(collection);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int activeConsumers() {
        return consumers.size();
    }

    @Override
    public void disconnectConsumers() {
        log.warn("Force-disconnecting {} consumers from store {}", consumers.size(), name);
        consumers.clear();
    }

    @Override
    public String contentChecksum() {
        lock.readLock().lock();
        try {
            MessageDigest digest = Checksums.newDigest();
            digest.update(("seq:" + appliedSequence + "\n").getBytes(StandardCharsets.UTF_8));
            collections.forEach((collection, records) -> {
                digest.update(("#" + collection + "\n").getBytes(StandardCharsets.UTF_8));
                records.forEach((key, record) ->
                        digest.update((key + "=" + record.value + "\n").getBytes(StandardCharsets.UTF_8)));
            });
            return Checksums.toHex(digest.digest());
        } finally {
            lock.readLock().unlock();
        }
    }

    private void applyMutations(long sequenceId, List<LogMutation> mutations) {
        for (LogMutation mutation : mutations) {
            if (mutation.getOp() == LogMutation.Operation.DELETE) {
                deleteRecord(mutation.getCollection(), mutation.getKey(), sequenceId);
            } else {
                collections.computeIfAbsent(mutation.getCollection(), c -> new TreeMap<>())
                        .put(mutation.getKey(), new VersionedRecord(mutation.getValue().deepCopy(), sequenceId));
                removeTombstone(mutation.getCollection(), mutation.getKey());
            }
        }
    }

    private void deleteRecord(String collection, String key, long version) {
        Map<String, VersionedRecord> records = collections.get(collection);
        if (records != null) {
            records.remove(key);
        }
        tombstones.computeIfAbsent(collection, c -> new HashMap<>()).put(key, version);
    }

    private void removeTombstone(String collection, String key) {
        Map<String, Long> keys = tombstones.get(collection);
        if (keys != null) {
            keys.remove(key);
        }
    }

    private static final class VersionedRecord {
        private final JsonNode value;
        private final long version;

        private VersionedRecord(JsonNode value, long version) {
            this.value = value;
            this.version = version;
        }
    }
}
