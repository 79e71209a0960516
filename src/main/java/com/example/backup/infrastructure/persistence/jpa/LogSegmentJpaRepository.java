package com.example.backup.infrastructure.persistence.jpa;

import com.example.backup.domain.entity.LogSegment;
import com.example.backup.domain.model.SegmentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface LogSegmentJpaRepository extends JpaRepository<LogSegment, String> {

    /**
     * 아카이브된 시퀀스 ID 목록 (연속성 검사용, 오름차순)
     */
    @Query("SELECT s.sequenceId FROM LogSegment s WHERE s.storeName = :store AND s.status = :status ORDER BY s.sequenceId ASC")
    List<Long> findSequenceIds(@Param("store") String storeName, @Param("status") SegmentStatus status);

    /**
     * 재생 구간 조회 (from, to 포함)
     */
    List<LogSegment> findByStoreNameAndStatusAndSequenceIdBetweenOrderBySequenceIdAsc(
            String storeName, SegmentStatus status, Long fromSequence, Long toSequence);

    Optional<LogSegment> findFirstByStoreNameAndStatusOrderBySequenceIdDesc(String storeName, SegmentStatus status);

    /**
     * 특정 시각 이전에 생성된 마지막 세그먼트 (상태 무관, timestamp 목표 해석용)
     */
    Optional<LogSegment> findFirstByStoreNameAndProducedAtLessThanEqualOrderBySequenceIdDesc(
            String storeName, Instant producedAt);

    /**
     * 가장 최근에 생성된 아카이브 세그먼트 (RPO 계산용)
     */
    Optional<LogSegment> findFirstByStoreNameAndStatusOrderByProducedAtDesc(String storeName, SegmentStatus status);

    List<LogSegment> findByStoreNameAndStatusOrderBySequenceIdAsc(String storeName, SegmentStatus status);

    /**
     * 보존 marker 이하 세그먼트 (정리용)
     */
    List<LogSegment> findByStoreNameAndSequenceIdLessThanEqual(String storeName, Long sequenceId);

    long countByStatus(SegmentStatus status);
}
