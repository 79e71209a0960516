package com.example.backup.domain.entity;

import com.example.backup.domain.exception.ErrorKind;
import com.example.backup.domain.model.RestoreState;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 복구 실행 이력
 * - PROMOTED 된 실행의 소요 시간은 RTO 추정에 사용
 */
@Entity
@Table(name = "restore_runs", indexes = {
        @Index(name = "idx_restore_store", columnList = "storeName, startedAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestoreRun {

    @Id
    private String runId;

    @Column(nullable = false)
    private String storeName;

    @Column(nullable = false)
    private String target;

    @Column(nullable = false)
    private String scope;

    private boolean forced;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RestoreState state;

    private String baseArtifactId;

    private Long fromSequence; // base marker (exclusive)

    private Long targetSequence;

    private long replayedSegments;

    private String safetySnapshotLocation;

    private String safetySnapshotChecksum;

    private String sideTableName; // 테이블 단위 복구 시 이전 데이터 보관 위치

    private boolean confirmed;

    @Enumerated(EnumType.STRING)
    private ErrorKind failureKind;

    private String failureCode;

    @Column(length = 2000)
    private String message;

    @Column(nullable = false)
    private Instant startedAt;

    private Instant finishedAt;

    private long durationMs;

    public boolean isPromoted() {
        return state == RestoreState.PROMOTED;
    }
}
