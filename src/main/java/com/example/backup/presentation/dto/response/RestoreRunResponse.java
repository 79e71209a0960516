package com.example.backup.presentation.dto.response;

import com.example.backup.domain.entity.RestoreRun;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RestoreRunResponse {

    private String runId;
    private String store;
    private String target;
    private String scope;
    private boolean forced;
    private String state;
    private String baseArtifactId;
    private Long fromSequence;
    private Long targetSequence;
    private long replayedSegments;
    private String safetySnapshotLocation;
    private String sideTableName;
    private boolean confirmed;
    private String failureKind;
    private String failureCode;
    private String message;
    private Instant startedAt;
    private Instant finishedAt;
    private long durationMs;

    public static RestoreRunResponse from(RestoreRun run) {
        return RestoreRunResponse.builder()
                .runId(run.getRunId())
                .store(run.getStoreName())
                .target(run.getTarget())
                .scope(run.getScope())
                .forced(run.isForced())
                .state(run.getState().name())
                .baseArtifactId(run.getBaseArtifactId())
                .fromSequence(run.getFromSequence())
                .targetSequence(run.getTargetSequence())
                .replayedSegments(run.getReplayedSegments())
                .safetySnapshotLocation(run.getSafetySnapshotLocation())
                .sideTableName(run.getSideTableName())
                .confirmed(run.isConfirmed())
                .failureKind(run.getFailureKind() == null ? null : run.getFailureKind().name())
                .failureCode(run.getFailureCode())
                .message(run.getMessage())
                .startedAt(run.getStartedAt())
                .finishedAt(run.getFinishedAt())
                .durationMs(run.getDurationMs())
                .build();
    }
}
