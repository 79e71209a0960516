package com.example.backup.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ArchiveResult {

    public enum Outcome {
        ARCHIVED,
        /** 동일 체크섬으로 이미 아카이브됨 (at-least-once 재전송) */
        ALREADY_ARCHIVED
    }

    String storeName;
    long sequenceId;
    Outcome outcome;
    String location;
    String checksum;
    Instant archivedAt;
}
