package com.example.backup.domain.model;

public enum SegmentStatus {
    ARCHIVED,
    FAILED
}
