package com.example.backup.infrastructure.transport;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemArchiveTransportTest {

    @TempDir
    Path root;

    private FileSystemArchiveTransport transport;

    @BeforeEach
    void setUp() {
        transport = new FileSystemArchiveTransport(root);
    }

    @Test
    @DisplayName("객체 저장 후 읽기, stat, 목록 조회")
    void putGetStatList() {
        byte[] content = "segment-1".getBytes(StandardCharsets.UTF_8);
        String location = ArtifactNaming.segmentLocation("primary", 1);

        transport.put(location, content);
        transport.put(ArtifactNaming.sidecarOf(location), ArtifactNaming.sidecarContent("abc", location));

        assertArrayEquals(content, transport.get(location));
        Optional<ArchiveObject> stat = transport.stat(location);
        assertTrue(stat.isPresent());
        assertEquals(content.length, stat.get().getSizeBytes());
        assertEquals(List.of(location, ArtifactNaming.sidecarOf(location)),
                transport.list(ArtifactNaming.segmentPrefix("primary")));
        assertTrue(transport.list("wal/other/").isEmpty());
    }

    @Test
    @DisplayName("업로드 임시 파일은 남지 않는다")
    void noTemporaryFilesRemain() throws Exception {
        transport.put("backups/primary/a.backup.gz", new byte[]{1, 2, 3});

        try (Stream<Path> files = Files.walk(root)) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
    }

    @Test
    @DisplayName("없는 객체 읽기는 ArchiveObjectNotFoundException, stat 은 empty")
    void missingObject() {
        assertThrows(ArchiveObjectNotFoundException.class, () -> transport.get("wal/primary/none.seg.gz"));
        assertTrue(transport.stat("wal/primary/none.seg.gz").isEmpty());
        assertFalse(transport.exists("wal/primary/none.seg.gz"));
    }

    @Test
    @DisplayName("삭제는 멱등")
    void deleteIsIdempotent() {
        transport.put("safety/primary/s.backup.gz", new byte[]{1});

        transport.delete("safety/primary/s.backup.gz");
        transport.delete("safety/primary/s.backup.gz");

        assertFalse(transport.exists("safety/primary/s.backup.gz"));
    }

    @Test
    @DisplayName("아카이브 루트 밖을 가리키는 위치는 거부")
    void locationOutsideRootIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> transport.put("../escape.txt", new byte[]{1}));
    }

    @Test
    @DisplayName("사용량은 저장된 바이트와 객체 수를 합산")
    void usageCountsObjects() {
        transport.put("a/1", new byte[10]);
        transport.put("a/2", new byte[5]);

        StorageUsage usage = transport.usage();

        assertEquals(15, usage.getUsedBytes());
        assertEquals(2, usage.getObjectCount());
        assertTrue(usage.getAvailableBytes() > 0);
    }
}
