package com.example.backup.infrastructure.transport;

import lombok.Value;

import java.time.Instant;

@Value
public class ArchiveObject {
    String location;
    long sizeBytes;
    Instant lastModified;
}
