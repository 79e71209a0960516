package com.example.backup.presentation.dto.response;

import com.example.backup.domain.entity.ValidationReport;
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
public class ValidationReportResponse {

    private String reportId;
    private String artifactId;
    private String store;
    private int requestedLevel;
    private String verdict;
    private Integer failedStage; // 최초 실패 단계 번호
    private List<StageResult> stages;
    private List<String> warnings;
    private Instant createdAt;

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class StageResult {
        private int level;
        private String stage;
        private boolean passed;
        private long durationMs;
        private String message;
    }

    public static ValidationReportResponse from(ValidationReport report) {
        return ValidationReportResponse.builder()
                .reportId(report.getReportId())
                .artifactId(report.getArtifactId())
                .store(report.getStoreName())
                .requestedLevel(report.getRequestedLevel())
                .verdict(report.getVerdict().name())
                .failedStage(report.getFailedStage() == null ? null : report.getFailedStage().getLevel())
                .stages(report.getStages().stream()
                        .map(s -> new StageResult(s.getStage().getLevel(), s.getStage().name(), s.isPassed(),
                                s.getDurationMs(), s.getMessage()))
                        .collect(Collectors.toList()))
                .warnings(List.copyOf(report.getWarnings()))
                .createdAt(report.getCreatedAt())
                .build();
    }
}
