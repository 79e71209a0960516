package com.example.backup.presentation.dto.response;

import com.example.backup.domain.model.ContinuityReport;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContinuityResponse {

    private String store;
    private Long oldestSequence;
    private Long newestSequence;
    private long archivedCount;
    private boolean continuous;
    private List<Gap> gaps;
    private Instant scannedAt;

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class Gap {
        private long from;
        private long to;
        private long size;
    }

    public static ContinuityResponse from(ContinuityReport report) {
        return ContinuityResponse.builder()
                .store(report.getStoreName())
                .oldestSequence(report.getOldestSequence())
                .newestSequence(report.getNewestSequence())
                .archivedCount(report.getArchivedCount())
                .continuous(report.isContinuous())
                .gaps(report.getGaps().stream()
                        .map(g -> new Gap(g.getFromSequence(), g.getToSequence(), g.size()))
                        .collect(Collectors.toList()))
                .scannedAt(report.getScannedAt())
                .build();
    }
}
