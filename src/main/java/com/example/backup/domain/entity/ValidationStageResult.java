package com.example.backup.domain.entity;

import com.example.backup.domain.model.ValidationStage;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationStageResult {

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ValidationStage stage;

    private boolean passed;

    private long durationMs;

    @Column(length = 2000)
    private String message;
}
