package com.example.backup.infrastructure.codec;

import com.example.backup.infrastructure.store.StoreSnapshot;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 파싱된 백업 컨테이너
 * problems 가 비어 있지 않으면 구조적으로 손상된 컨테이너
 */
@Getter
public class BackupContainer {

    private final ContainerHeader header;
    private final Map<String, Map<String, JsonNode>> records = new TreeMap<>();
    private final Map<String, Set<String>> tombstones = new TreeMap<>();
    private final List<String> problems = new ArrayList<>();
    private boolean trailerSeen;

    BackupContainer(ContainerHeader header) {
        this.header = header;
    }

    void addRecord(String collection, String key, JsonNode value) {
        records.computeIfAbsent(collection, c -> new TreeMap<>()).put(key, value);
    }

    void addTombstone(String collection, String key) {
        tombstones.computeIfAbsent(collection, c -> new TreeSet<>()).add(key);
    }

    void addProblem(String problem) {
        problems.add(problem);
    }

    void markTrailer() {
        this.trailerSeen = true;
    }

    public boolean isStructurallyValid() {
        return header != null && problems.isEmpty();
    }

    public boolean isFull() {
        return header != null && "full".equalsIgnoreCase(header.getBackupType());
    }

    public List<String> getProblems() {
        return Collections.unmodifiableList(problems);
    }

    public long getRecordCount() {
        return records.values().stream().mapToLong(Map::size).sum();
    }

    public StoreSnapshot toSnapshot() {
        // 선언되었지만 레코드가 없는 컬렉션도 빈 컬렉션으로 유지
        Map<String, Map<String, JsonNode>> collections = new TreeMap<>(records);
        if (header != null) {
            header.getCollections().forEach(name -> collections.putIfAbsent(name, Map.of()));
        }
        if (isFull()) {
            return StoreSnapshot.full(header.getStore(), header.getConsistencyMarker(), collections);
        }
        return new StoreSnapshot(header.getStore(), header.getConsistencyMarker(), header.getBaseMarker(),
                false, collections, tombstones);
    }
}
