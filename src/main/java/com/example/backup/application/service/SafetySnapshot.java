package com.example.backup.application.service;

import com.example.backup.infrastructure.store.StoreSnapshot;
import lombok.Value;

import java.time.Instant;

/**
 * 복구 직전 대상 스토어의 사본 (롤백 기준)
 * contentChecksum 은 롤백 후 스토어 체크섬과 일치해야 한다.
 */
@Value
public class SafetySnapshot {
    String storeName;
    String location;
    String contentChecksum;
    StoreSnapshot snapshot;
    Instant takenAt;
}
