package com.example.backup.domain.entity;

import com.example.backup.domain.model.SegmentStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "log_segments",
        uniqueConstraints = @UniqueConstraint(name = "uk_segment_store_seq", columnNames = {"storeName", "sequenceId"}),
        indexes = {
                @Index(name = "idx_segment_status", columnList = "storeName, status"),
                @Index(name = "idx_segment_produced", columnList = "storeName, producedAt")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogSegment {

    @Id
    private String segmentId; // {store}:{sequence}

    @Column(nullable = false)
    private String storeName;

    @Column(nullable = false)
    private Long sequenceId;

    @Column(nullable = false)
    private Instant producedAt;

    private Instant archivedAt; // 아카이브 전에는 null

    private String location;

    private String checksum;

    private long sizeBytes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SegmentStatus status;

    private int attempts;

    @Column(length = 1000)
    private String lastError;

    public static String idOf(String storeName, long sequenceId) {
        return storeName + ":" + sequenceId;
    }

    public boolean isArchived() {
        return status == SegmentStatus.ARCHIVED && archivedAt != null;
    }
}
