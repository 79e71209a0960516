package com.example.backup.domain.entity;

import com.example.backup.domain.model.ValidationStage;
import com.example.backup.domain.model.ValidationVerdict;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 검증 실행 1회의 결과 (재검증 시 새 리포트 생성)
 */
@Entity
@Table(name = "validation_reports", indexes = {
        @Index(name = "idx_report_artifact", columnList = "artifactId"),
        @Index(name = "idx_report_created", columnList = "createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationReport {

    @Id
    private String reportId;

    @Column(nullable = false)
    private String artifactId;

    @Column(nullable = false)
    private String storeName;

    private int requestedLevel;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ValidationVerdict verdict;

    @Enumerated(EnumType.STRING)
    private ValidationStage failedStage; // 최초 실패 단계 (root cause)

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "validation_stage_results", joinColumns = @JoinColumn(name = "report_id"))
    @OrderColumn(name = "stage_order")
    @Builder.Default
    private List<ValidationStageResult> stages = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "validation_warnings", joinColumns = @JoinColumn(name = "report_id"))
    @OrderColumn(name = "warning_order")
    @Column(name = "warning", length = 1000)
    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    @Column(nullable = false)
    private Instant createdAt;

    public boolean isPassed() {
        return verdict == ValidationVerdict.PASSED;
    }

    public long getStageDurationMs(ValidationStage stage) {
        return stages.stream()
                .filter(s -> s.getStage() == stage && s.isPassed())
                .mapToLong(ValidationStageResult::getDurationMs)
                .findFirst()
                .orElse(-1L);
    }
}
