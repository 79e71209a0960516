package com.example.backup.presentation.dto.response;

import com.example.backup.domain.entity.BackupArtifact;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ArtifactResponse {

    private String artifactId;
    private String store;
    private String type;
    private String parentArtifactId;
    private Instant startedAt;
    private Instant completedAt;
    private long sizeBytes;
    private String checksum;
    private Long consistencyMarker;
    private Long baseMarker;
    private String trustState;
    private String location;
    private long recordCount;
    private Map<String, Long> collectionCounts;
    private Instant lastValidatedAt;
    private String lastReportId;

    public static ArtifactResponse from(BackupArtifact artifact) {
        return ArtifactResponse.builder()
                .artifactId(artifact.getArtifactId())
                .store(artifact.getStoreName())
                .type(artifact.getArtifactType().name())
                .parentArtifactId(artifact.getParentArtifactId())
                .startedAt(artifact.getStartedAt())
                .completedAt(artifact.getCompletedAt())
                .sizeBytes(artifact.getSizeBytes())
                .checksum(artifact.getChecksum())
                .consistencyMarker(artifact.getConsistencyMarker())
                .baseMarker(artifact.getBaseMarker())
                .trustState(artifact.getTrustState().name())
                .location(artifact.getLocation())
                .recordCount(artifact.getRecordCount())
                .collectionCounts(new TreeMap<>(artifact.getCollectionCounts()))
                .lastValidatedAt(artifact.getLastValidatedAt())
                .lastReportId(artifact.getLastReportId())
                .build();
    }
}
