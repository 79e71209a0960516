package com.example.backup.domain.model;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * 복구 목표 지점
 * - latest: 아카이브된 가장 최신 세그먼트까지
 * - timestamp: 해당 시각 이전에 생성된 마지막 세그먼트까지
 * - sequence: 지정한 로그 시퀀스까지
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class RecoveryTarget {

    public enum Kind {
        LATEST,
        TIMESTAMP,
        SEQUENCE
    }

    private final Kind kind;
    private final Instant timestamp;
    private final Long sequenceId;

    public static RecoveryTarget latest() {
        return new RecoveryTarget(Kind.LATEST, null, null);
    }

    public static RecoveryTarget at(Instant timestamp) {
        return new RecoveryTarget(Kind.TIMESTAMP, timestamp, null);
    }

    public static RecoveryTarget atSequence(long sequenceId) {
        if (sequenceId < 0) {
            throw new IllegalArgumentException("Sequence id must not be negative: " + sequenceId);
        }
        return new RecoveryTarget(Kind.SEQUENCE, null, sequenceId);
    }

    /**
     * CLI/API 문자열 파싱: latest | 숫자(시퀀스) | ISO-8601 시각
     */
    public static RecoveryTarget parse(String raw) {
        if (raw == null || raw.isBlank() || "latest".equalsIgnoreCase(raw.trim())) {
            return latest();
        }
        String value = raw.trim();
        if (value.chars().allMatch(Character::isDigit)) {
            return atSequence(Long.parseLong(value));
        }
        try {
            return at(Instant.parse(value));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(
                    "Target must be 'latest', a sequence id or an ISO-8601 instant: " + raw, e);
        }
    }

    public String describe() {
        switch (kind) {
            case TIMESTAMP:
                return timestamp.toString();
            case SEQUENCE:
                return "seq:" + sequenceId;
            default:
                return "latest";
        }
    }

    @Override
    public String toString() {
        return describe();
    }
}
