package com.example.backup.infrastructure.transport;

import com.example.backup.domain.model.ArtifactType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactNamingTest {

    @Test
    @DisplayName("아티팩트 ID 는 스토어, 종류, UTC 시각으로 구성")
    void artifactIdFormat() {
        String id = ArtifactNaming.artifactId("primary", ArtifactType.FULL, Instant.parse("2024-03-05T07:08:09.123Z"));

        assertEquals("primary_full_20240305T070809.123Z", id);
        assertEquals("backups/primary/primary_full_20240305T070809.123Z.backup.gz",
                ArtifactNaming.artifactLocation("primary", id));
    }

    @Test
    @DisplayName("세그먼트 위치는 16자리 시퀀스이며 다시 파싱된다")
    void segmentLocationRoundTrip() {
        String location = ArtifactNaming.segmentLocation("primary", 515);

        assertEquals("wal/primary/0000000000000515.seg.gz", location);
        assertEquals(515, ArtifactNaming.sequenceOf(location));
        assertEquals(-1, ArtifactNaming.sequenceOf(location + ArtifactNaming.SIDECAR_EXTENSION));
        assertEquals(-1, ArtifactNaming.sequenceOf("wal/primary/abc.seg.gz"));
    }

    @Test
    @DisplayName("사이드카는 sha256sum 형식")
    void sidecarFormat() {
        String location = "backups/primary/x.backup.gz";
        byte[] sidecar = ArtifactNaming.sidecarContent("deadbeef", location);

        assertEquals("deadbeef  x.backup.gz\n", new String(sidecar));
        assertEquals("deadbeef", ArtifactNaming.parseSidecar(sidecar));
        assertEquals("backups/primary/x.backup.gz.sha256", ArtifactNaming.sidecarOf(location));
    }
}
