package com.example.backup.infrastructure.store;

/**
 * 소스 스토어가 새 로그 세그먼트를 만들었을 때 호출 (archive_command 역할)
 */
@FunctionalInterface
public interface SegmentListener {
    void onSegment(ProducedSegment segment);
}
