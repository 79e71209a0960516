package com.example.backup.infrastructure.transport;

import lombok.Value;

/**
 * 아카이브 사용량. availableBytes 가 음수이면 백엔드가 여유 공간을 알려주지 않음
 */
@Value
public class StorageUsage {
    long usedBytes;
    long availableBytes;
    long objectCount;

    public static StorageUsage unknownCapacity(long usedBytes, long objectCount) {
        return new StorageUsage(usedBytes, -1L, objectCount);
    }
}
