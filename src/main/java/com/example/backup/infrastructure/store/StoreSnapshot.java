package com.example.backup.infrastructure.store;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 스토어의 일관된 사본
 * - full: 전체 레코드 (baseSequence = 0)
 * - incremental: baseSequence 이후 변경된 레코드 + 삭제된 키(tombstone)
 */
@Getter
public class StoreSnapshot {

    private final String storeName;
    private final long appliedSequence;
    private final long baseSequence;
    private final boolean full;
    private final Map<String, Map<String, JsonNode>> collections;
    private final Map<String, Set<String>> tombstones;
    // 스냅샷 시점 스토어 전체의 컬렉션별 레코드 수 (증분 스냅샷에서도 전체 기준)
    private final Map<String, Long> stateCounts;

    public StoreSnapshot(String storeName, long appliedSequence, long baseSequence, boolean full,
                         Map<String, Map<String, JsonNode>> collections,
                         Map<String, Set<String>> tombstones) {
        this(storeName, appliedSequence, baseSequence, full, collections, tombstones, null);
    }

    public StoreSnapshot(String storeName, long appliedSequence, long baseSequence, boolean full,
                         Map<String, Map<String, JsonNode>> collections,
                         Map<String, Set<String>> tombstones,
                         Map<String, Long> stateCounts) {
        this.storeName = storeName;
        this.appliedSequence = appliedSequence;
        this.baseSequence = baseSequence;
        this.full = full;
        this.collections = sortedCopy(collections);
        Map<String, Set<String>> sortedTombstones = new TreeMap<>();
        tombstones.forEach((name, keys) -> sortedTombstones.put(name, Collections.unmodifiableSet(new TreeSet<>(keys))));
        this.tombstones = Collections.unmodifiableMap(sortedTombstones);
        this.stateCounts = stateCounts == null
                ? getCollectionCounts()
                : Collections.unmodifiableMap(new TreeMap<>(stateCounts));
    }

    public static StoreSnapshot full(String storeName, long appliedSequence,
                                     Map<String, Map<String, JsonNode>> collections) {
        return new StoreSnapshot(storeName, appliedSequence, 0L, true, collections, Map.of());
    }

    public long getRecordCount() {
        return collections.values().stream().mapToLong(Map::size).sum();
    }

    public long getTombstoneCount() {
        return tombstones.values().stream().mapToLong(Set::size).sum();
    }

    public Map<String, Long> getCollectionCounts() {
        Map<String, Long> counts = new TreeMap<>();
        collections.forEach((name, records) -> counts.put(name, (long) records.size()));
        return counts;
    }

    /**
     * 컬렉션 정의 목록 (레코드 또는 tombstone 을 가진 모든 컬렉션)
     */
    public Set<String> getCollectionNames() {
        Set<String> names = new TreeSet<>(collections.keySet());
        names.addAll(tombstones.keySet());
        return names;
    }

    private static Map<String, Map<String, JsonNode>> sortedCopy(Map<String, Map<String, JsonNode>> source) {
        Map<String, Map<String, JsonNode>> copy = new TreeMap<>();
        source.forEach((name, records) -> copy.put(name, Collections.unmodifiableMap(new TreeMap<>(records))));
        return Collections.unmodifiableMap(copy);
    }
}
