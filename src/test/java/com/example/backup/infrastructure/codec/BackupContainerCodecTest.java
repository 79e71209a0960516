package com.example.backup.infrastructure.codec;

import com.example.backup.domain.exception.CorruptionException;
import com.example.backup.infrastructure.store.InMemoryStoreInstance;
import com.example.backup.infrastructure.store.LogMutation;
import com.example.backup.infrastructure.store.ProducedSegment;
import com.example.backup.infrastructure.store.StoreSnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;

class BackupContainerCodecTest {

    private BackupContainerCodec codec;
    private InMemoryStoreInstance store;

    @BeforeEach
    void setUp() {
        codec = new BackupContainerCodec(new ObjectMapper());
        store = new InMemoryStoreInstance("primary", Clock.systemUTC());
        store.commit(List.of(put("accounts", "a1", 10), put("accounts", "a2", 20), put("orders", "o1", 1)));
        store.commit(List.of(LogMutation.delete("orders", "o1")));
    }

    @Test
    @DisplayName("전체 백업 컨테이너는 레코드, 빈 컬렉션, marker 를 보존한다")
    void fullContainerPreservesContent() {
        StoreSnapshot snapshot = store.snapshot();
        byte[] content = codec.encode(header("full", snapshot.getAppliedSequence(), 0), snapshot);

        BackupContainer container = codec.parse(codec.decompress(content));

        assertTrue(container.isStructurallyValid(), () -> container.getProblems().toString());
        assertEquals(2, container.getRecordCount());
        assertEquals(List.of("accounts", "orders"), container.getHeader().getCollections());

        StoreSnapshot decoded = codec.decode(content);
        assertEquals(2, decoded.getAppliedSequence());
        assertTrue(decoded.getCollections().containsKey("orders"));
        assertTrue(decoded.getCollections().get("orders").isEmpty());
    }

    @Test
    @DisplayName("증분 컨테이너는 tombstone 과 base marker 를 담는다")
    void incrementalContainerCarriesTombstones() {
        StoreSnapshot delta = store.snapshotSince(1);
        byte[] content = codec.encode(header("incremental", delta.getAppliedSequence(), 1), delta);

        StoreSnapshot decoded = codec.decode(content);

        assertFalse(decoded.isFull());
        assertEquals(1, decoded.getBaseSequence());
        assertTrue(decoded.getTombstones().get("orders").contains("o1"));
    }

    @Test
    @DisplayName("잘린 컨테이너는 trailer 누락으로 보고된다")
    void truncatedContainerIsReported() {
        StoreSnapshot snapshot = store.snapshot();
        byte[] raw = codec.decompress(codec.encode(header("full", 2, 0), snapshot));
        String text = new String(raw, StandardCharsets.UTF_8);
        String withoutTrailer = text.substring(0, text.lastIndexOf("{\"type\":\"trailer\""));

        BackupContainer container = codec.parse(withoutTrailer.getBytes(StandardCharsets.UTF_8));

        assertFalse(container.isStructurallyValid());
        assertTrue(container.getProblems().stream().anyMatch(p -> p.contains("trailer missing")));
        assertThrows(CorruptionException.class, () -> codec.decode(gzip(withoutTrailer)));
    }

    @Test
    @DisplayName("헤더가 없는 내용은 구조 오류")
    void missingHeaderIsReported() {
        BackupContainer container = codec.parse("{\"type\":\"record\"}\n".getBytes(StandardCharsets.UTF_8));

        assertFalse(container.isStructurallyValid());
        assertNull(container.getHeader());
    }

    @Test
    @DisplayName("gzip 이 아닌 바이트는 CONTAINER_UNREADABLE")
    void garbageIsUnreadable() {
        CorruptionException e = assertThrows(CorruptionException.class,
                () -> codec.decompress("not a container".getBytes(StandardCharsets.UTF_8)));
        assertEquals(BackupContainerCodec.CONTAINER_UNREADABLE, e.getCode());
    }

    @Test
    @DisplayName("압축 스트림이 중간에 끊기면 압축 해제 단계에서 실패")
    void cutCompressedStreamFails() {
        byte[] content = codec.encode(header("full", 2, 0), store.snapshot());
        byte[] cut = Arrays.copyOf(content, content.length / 2);

        assertThrows(CorruptionException.class, () -> codec.decompress(cut));
    }

    @Test
    @DisplayName("세그먼트 페이로드: 선언된 변경 수와 실제 수가 다르면 손상")
    void segmentPayloadCountMismatch() {
        SegmentPayloadCodec segmentCodec = new SegmentPayloadCodec(new ObjectMapper());
        ProducedSegment segment = new ProducedSegment("primary", 7, Instant.parse("2024-01-01T00:00:00Z"),
                List.of(put("accounts", "a1", 1)));

        ProducedSegment decoded = segmentCodec.decode(segmentCodec.encode(segment));
        assertEquals(7, decoded.getSequenceId());
        assertEquals(1, decoded.getMutations().size());

        byte[] tampered = gzip("{\"store\":\"primary\",\"sequenceId\":7,\"producedAt\":\"2024-01-01T00:00:00Z\",\"mutations\":2}\n");
        CorruptionException e = assertThrows(CorruptionException.class, () -> segmentCodec.decode(tampered));
        assertEquals(SegmentPayloadCodec.SEGMENT_UNREADABLE, e.getCode());
    }

    private ContainerHeader header(String type, long marker, long baseMarker) {
        return ContainerHeader.builder()
                .store("primary")
                .artifactId("primary_" + type + "_test")
                .backupType(type)
                .consistencyMarker(marker)
                .baseMarker(baseMarker)
                .createdAt(Instant.now())
                .build();
    }

    private static byte[] gzip(String text) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (GZIPOutputStream out = new GZIPOutputStream(bytes)) {
            out.write(text.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
        return bytes.toByteArray();
    }

    private static LogMutation put(String collection, String key, int value) {
        return LogMutation.put(collection, key, JsonNodeFactory.instance.objectNode().put("value", value));
    }
}
