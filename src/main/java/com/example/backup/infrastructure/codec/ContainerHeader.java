package com.example.backup.infrastructure.codec;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 백업 컨테이너 첫 줄 (self-describing 헤더)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContainerHeader {

    public static final String FORMAT = "pitr-backup/1";

    @Builder.Default
    private String type = "header";
    @Builder.Default
    private String format = FORMAT;
    private String store;
    private String artifactId;
    private String backupType; // full | incremental
    private long consistencyMarker;
    private long baseMarker;
    @Builder.Default
    private List<String> collections = new ArrayList<>();
    private Instant createdAt;
}
