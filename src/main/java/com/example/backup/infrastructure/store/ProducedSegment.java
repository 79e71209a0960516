package com.example.backup.infrastructure.store;

import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
public class ProducedSegment {
    String storeName;
    long sequenceId;
    Instant producedAt;
    List<LogMutation> mutations;
}
