package com.example.backup.infrastructure.transport;

import com.example.backup.domain.model.ArtifactType;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * 아카이브 객체 이름 규칙
 * <pre>
 * backups/{store}/{store}_{type}_{yyyyMMdd'T'HHmmss.SSS'Z'}[-{n}].backup.gz (+ .sha256)
 * safety/{store}/{store}_safety_{timestamp}.backup.gz (+ .sha256)
 * wal/{store}/{16자리 시퀀스}.seg.gz (+ .sha256)
 * </pre>
 */
public final class ArtifactNaming {

    public static final String BACKUP_EXTENSION = ".backup.gz";
    public static final String SEGMENT_EXTENSION = ".seg.gz";
    public static final String SIDECAR_EXTENSION = ".sha256";

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss.SSS'Z'").withZone(ZoneOffset.UTC);

    private ArtifactNaming() {
    }

    /**
     * 아티팩트 ID = 파일명에서 확장자를 뺀 부분
     */
    public static String artifactId(String store, ArtifactType type, Instant startedAt) {
        return artifactId(store, type, startedAt, 0);
    }

    /**
     * 같은 시각의 ID 가 이미 있으면 attempt 순번을 붙인다 (0 이면 붙이지 않음)
     */
    public static String artifactId(String store, ArtifactType type, Instant startedAt, int attempt) {
        String base = store + "_" + type.fileToken() + "_" + TIMESTAMP.format(startedAt);
        return attempt == 0 ? base : base + "-" + attempt;
    }

    public static String artifactLocation(String store, String artifactId) {
        return "backups/" + store + "/" + artifactId + BACKUP_EXTENSION;
    }

    public static String safetySnapshotLocation(String store, Instant takenAt) {
        return "safety/" + store + "/" + store + "_safety_" + TIMESTAMP.format(takenAt) + BACKUP_EXTENSION;
    }

    public static String safetyPrefix(String store) {
        return "safety/" + store + "/";
    }

    public static String segmentLocation(String store, long sequenceId) {
        return segmentPrefix(store) + String.format("%016d", sequenceId) + SEGMENT_EXTENSION;
    }

    public static String segmentPrefix(String store) {
        return "wal/" + store + "/";
    }

    /**
     * 세그먼트 위치에서 시퀀스 추출. 형식이 다르면 -1
     */
    public static long sequenceOf(String segmentLocation) {
        int slash = segmentLocation.lastIndexOf('/');
        String name = segmentLocation.substring(slash + 1);
        if (!name.endsWith(SEGMENT_EXTENSION)) {
            return -1L;
        }
        String digits = name.substring(0, name.length() - SEGMENT_EXTENSION.length());
        if (digits.length() != 16 || !digits.chars().allMatch(Character::isDigit)) {
            return -1L;
        }
        return Long.parseLong(digits);
    }

    public static String sidecarOf(String location) {
        return location + SIDECAR_EXTENSION;
    }

    /**
     * sha256sum 호환 사이드카 내용: "{checksum}  {파일명}\n"
     */
    public static byte[] sidecarContent(String checksum, String location) {
        String fileName = location.substring(location.lastIndexOf('/') + 1);
        return (checksum + "  " + fileName + "\n").getBytes(StandardCharsets.UTF_8);
    }

    public static String parseSidecar(byte[] content) {
        String text = new String(content, StandardCharsets.UTF_8).trim();
        int space = text.indexOf(' ');
        return space < 0 ? text : text.substring(0, space);
    }
}
