package com.example.backup.infrastructure.store;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 보호 대상 트랜잭션 스토어에 대한 포트
 *
 * 스토리지 엔진 내부는 다루지 않으며, 백업/복구 제어 로직이 필요로 하는 연산만 노출한다.
 */
public interface StoreInstance {

    String getName();

    /**
     * 마지막으로 반영된 로그 시퀀스
     */
    long getAppliedSequence();

    /**
     * 일관된 전체 스냅샷 (appliedSequence 가 consistency marker)
     */
    StoreSnapshot snapshot();

    /**
     * sinceSequence 이후 변경분 스냅샷
     */
    StoreSnapshot snapshotSince(long sinceSequence);

    /**
     * 전체 내용 교체
     */
    void load(StoreSnapshot snapshot);

    /**
     * 증분 스냅샷 적용 (변경 레코드 반영 + tombstone 삭제)
     */
    void applyIncremental(StoreSnapshot delta);

    /**
     * 로그 세그먼트 재생. sequenceId 는 appliedSequence + 1 이어야 한다.
     */
    void apply(long sequenceId, List<LogMutation> mutations);

    Set<String> collectionNames();

    Map<String, Long> collectionCounts();

    Map<String, JsonNode> readCollection(String collection);

    void replaceCollection(String collection, Map<String, JsonNode> records);

    void dropCollection(String collection);

    int activeConsumers();

    void disconnectConsumers();

    /**
     * 내용 + appliedSequence 기반 체크섬 (롤백 검증용)
     */
    String contentChecksum();
}
