package com.example.backup.application.validation;

import com.example.backup.domain.entity.BackupArtifact;
import com.example.backup.infrastructure.codec.BackupContainer;
import com.example.backup.infrastructure.store.StoreInstance;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * 단계 간 공유 상태 (앞 단계 결과를 뒤 단계가 재사용)
 */
@Getter
@Setter
public class ValidationContext {

    private final BackupArtifact artifact;
    private final int requestedLevel;
    private final List<String> warnings = new ArrayList<>();

    private byte[] content;          // 2단계: 아카이브에서 읽은 원본
    private byte[] decompressed;     // 2단계: 압축 해제 결과
    private BackupContainer container; // 3단계
    private StoreInstance rehearsal;   // 4단계: 일회용 인스턴스 (검증기가 반드시 정리)
    private long rehearsalDurationMs = -1;

    public ValidationContext(BackupArtifact artifact, int requestedLevel) {
        this.artifact = artifact;
        this.requestedLevel = requestedLevel;
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }
}
