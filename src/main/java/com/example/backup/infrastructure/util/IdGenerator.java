package com.example.backup.infrastructure.util;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 백업 엔진에서 사용하는 ID 생성 유틸리티
 */
public class IdGenerator {

    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("yyMMddHHmmss").withZone(ZoneOffset.UTC);
    private static final AtomicInteger SEQUENCE = new AtomicInteger(0);

    private IdGenerator() {
    }

    /**
     * 검증 리포트 ID
     * 형식: VAL-{날짜시간}-{시퀀스}-{랜덤}
     */
    public static String generateReportId() {
        return generate("VAL");
    }

    /**
     * 복구 실행 ID
     * 형식: RST-{날짜시간}-{시퀀스}-{랜덤}
     */
    public static String generateRestoreRunId() {
        return generate("RST");
    }

    /**
     * 일회용 인스턴스 이름 (리허설/스테이징)
     */
    public static String generateInstanceName(String prefix) {
        return prefix + "-" + generateRandomHex(8).toLowerCase();
    }

    public static String generateEventId() {
        return UUID.randomUUID().toString();
    }

    private static String generate(String prefix) {
        String dateTime = DATE_FORMAT.format(Instant.now());
        String sequence = String.format("%03d", nextSequence());
        return prefix + "-" + dateTime + "-" + sequence + "-" + generateRandomHex(4);
    }

    private static int nextSequence() {
        return SEQUENCE.getAndUpdate(current -> (current + 1) % 1000);
    }

    private static String generateRandomHex(int length) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < length; i++) {
            int val = ThreadLocalRandom.current().nextInt(16);
            sb.append(Integer.toHexString(val).toUpperCase());
        }
        return sb.toString();
    }
}
