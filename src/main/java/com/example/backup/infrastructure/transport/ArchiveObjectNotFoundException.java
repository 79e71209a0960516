package com.example.backup.infrastructure.transport;

import com.example.backup.domain.exception.CorruptionException;

import java.util.Map;

/**
 * 카탈로그에는 있으나 아카이브에 객체가 없는 경우 (재시도 대상 아님)
 */
public class ArchiveObjectNotFoundException extends CorruptionException {

    public static final String OBJECT_MISSING = "OBJECT_MISSING";

    public ArchiveObjectNotFoundException(String location) {
        super(OBJECT_MISSING, "Archive object not found: " + location, Map.of("location", location));
    }
}
