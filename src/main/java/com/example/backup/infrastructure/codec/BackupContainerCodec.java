package com.example.backup.infrastructure.codec;

import com.example.backup.domain.exception.CorruptionException;
import com.example.backup.infrastructure.store.StoreSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * 백업 컨테이너 인코딩/디코딩
 *
 * 형식: gzip 으로 압축된 JSON lines
 * <pre>
 * {"type":"header", ...}
 * {"type":"collection","name":"users","records":2,"tombstones":0}
 * {"type":"record","collection":"users","key":"u1","value":{...}}
 * {"type":"tombstone","collection":"users","key":"u9"}
 * {"type":"trailer","collections":1,"records":2,"tombstones":0}
 * </pre>
 */
@Slf4j
public class BackupContainerCodec {

    public static final String CONTAINER_UNREADABLE = "CONTAINER_UNREADABLE";
    public static final String CONTAINER_MALFORMED = "CONTAINER_MALFORMED";

    private final ObjectMapper objectMapper;

    public BackupContainerCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.INDENT_OUTPUT);
    }

    public byte[] encode(ContainerHeader header, StoreSnapshot snapshot) {
        Set<String> names = snapshot.getCollectionNames();
        header.setCollections(List.copyOf(names));

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (Writer writer = new OutputStreamWriter(new GZIPOutputStream(bytes), StandardCharsets.UTF_8)) {
            writeLine(writer, objectMapper.valueToTree(header));
            for (String name : names) {
                Map<String, JsonNode> records = snapshot.getCollections().getOrDefault(name, Map.of());
                Set<String> removed = snapshot.getTombstones().getOrDefault(name, Set.of());

                ObjectNode section = objectMapper.createObjectNode()
                        .put("type", "collection")
                        .put("name", name)
                        .put("records", records.size())
                        .put("tombstones", removed.size());
                writeLine(writer, section);

                for (Map.Entry<String, JsonNode> record : records.entrySet()) {
                    ObjectNode line = objectMapper.createObjectNode()
                            .put("type", "record")
                            .put("collection", name)
                            .put("key", record.getKey());
                    line.set("value", record.getValue());
                    writeLine(writer, line);
                }
                for (String key : removed) {
                    writeLine(writer, objectMapper.createObjectNode()
                            .put("type", "tombstone")
                            .put("collection", name)
                            .put("key", key));
                }
            }
            writeLine(writer, objectMapper.createObjectNode()
                    .put("type", "trailer")
                    .put("collections", names.size())
                    .put("records", snapshot.getRecordCount())
                    .put("tombstones", snapshot.getTombstoneCount()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode backup container", e);
        }
        return bytes.toByteArray();
    }

    /**
     * 압축 해제 (전체 스트림을 끝까지 읽어 무결성 확인)
     */
    public byte[] decompress(byte[] compressed) {
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new CorruptionException(CONTAINER_UNREADABLE,
                    "Backup container cannot be decompressed: " + e.getMessage(), Map.of(), e);
        }
    }

    /**
     * 압축 해제된 내용을 파싱. 구조적 문제는 예외 대신 problems 에 기록
     */
    public BackupContainer parse(byte[] raw) {
        BufferedReader reader = new BufferedReader(
                new InputStreamReader(new ByteArrayInputStream(raw), StandardCharsets.UTF_8));
        try {
            String first = reader.readLine();
            if (first == null || first.isBlank()) {
                BackupContainer empty = new BackupContainer(null);
                empty.addProblem("container is empty");
                return empty;
            }
            ContainerHeader header = readHeader(first);
            BackupContainer container = new BackupContainer(header);
            if (header == null) {
                container.addProblem("first line is not a container header");
                return container;
            }
            checkHeader(header, container);
            readBody(reader, header, container);
            return container;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public StoreSnapshot decode(byte[] compressed) {
        BackupContainer container = parse(decompress(compressed));
        if (!container.isStructurallyValid()) {
            throw new CorruptionException(CONTAINER_MALFORMED,
                    "Backup container is malformed: " + String.join("; ", container.getProblems()),
                    Map.of("problems", container.getProblems()));
        }
        return container.toSnapshot();
    }

    private ContainerHeader readHeader(String line) {
        try {
            JsonNode node = objectMapper.readTree(line);
            if (!"header".equals(node.path("type").asText())) {
                return null;
            }
            return objectMapper.treeToValue(node, ContainerHeader.class);
        } catch (JsonProcessingException e) {
            log.debug("Unparseable container header: {}", e.getOriginalMessage());
            return null;
        }
    }

    private void checkHeader(ContainerHeader header, BackupContainer container) {
        if (!ContainerHeader.FORMAT.equals(header.getFormat())) {
            container.addProblem("unsupported format " + header.getFormat());
        }
        if (header.getStore() == null || header.getStore().isBlank()) {
            container.addProblem("header has no store name");
        }
        if (header.getConsistencyMarker() < 0 || header.getBaseMarker() < 0) {
            container.addProblem("negative consistency marker");
        }
        if (header.getBaseMarker() > header.getConsistencyMarker()) {
            container.addProblem(String.format("base marker %d is beyond consistency marker %d",
                    header.getBaseMarker(), header.getConsistencyMarker()));
        }
        boolean full = "full".equalsIgnoreCase(header.getBackupType());
        boolean incremental = "incremental".equalsIgnoreCase(header.getBackupType());
        if (!full && !incremental) {
            container.addProblem("unknown backup type " + header.getBackupType());
        }
        if (full && header.getBaseMarker() != 0) {
            container.addProblem("full backup declares a base marker");
        }
    }

    private void readBody(BufferedReader reader, ContainerHeader header, BackupContainer container) throws IOException {
        Set<String> declared = new HashSet<>(header.getCollections());
        Set<String> sections = new TreeSet<>();
        Map<String, long[]> expected = new HashMap<>(); // [records, tombstones]
        Map<String, long[]> actual = new HashMap<>();
        long lineNo = 1;
        String line;

        while ((line = reader.readLine()) != null) {
            lineNo++;
            if (line.isBlank()) {
                continue;
            }
            if (container.isTrailerSeen()) {
                container.addProblem("content after trailer at line " + lineNo);
                break;
            }
            JsonNode node;
            try {
                node = objectMapper.readTree(line);
            } catch (JsonProcessingException e) {
                container.addProblem("unparseable line " + lineNo);
                break;
            }
            String type = node.path("type").asText();
            String collection = node.path("collection").asText(null);
            switch (type) {
                case "collection":
                    String name = node.path("name").asText();
                    if (!declared.contains(name)) {
                        container.addProblem("collection " + name + " not declared in header");
                    }
                    sections.add(name);
                    expected.put(name, new long[]{node.path("records").asLong(), node.path("tombstones").asLong()});
                    actual.putIfAbsent(name, new long[2]);
                    break;
                case "record":
                    if (collection == null || !sections.contains(collection)) {
                        container.addProblem("record outside a declared collection at line " + lineNo);
                        break;
                    }
                    container.addRecord(collection, node.path("key").asText(), node.path("value"));
                    actual.get(collection)[0]++;
                    break;
                case "tombstone":
                    if (collection == null || !sections.contains(collection)) {
                        container.addProblem("tombstone outside a declared collection at line " + lineNo);
                        break;
                    }
                    container.addTombstone(collection, node.path("key").asText());
                    actual.get(collection)[1]++;
                    break;
                case "trailer":
                    container.markTrailer();
                    checkTrailer(node, container, actual);
                    break;
                default:
                    container.addProblem("unknown line type '" + type + "' at line " + lineNo);
            }
        }

        if (!container.isTrailerSeen()) {
            container.addProblem("trailer missing (container truncated?)");
        }
        for (String name : declared) {
            if (!sections.contains(name)) {
                container.addProblem("declared collection " + name + " has no section");
            }
        }
        expected.forEach((name, counts) -> {
            long[] seen = actual.get(name);
            if (seen[0] != counts[0] || seen[1] != counts[1]) {
                container.addProblem(String.format("collection %s declares %d records/%d tombstones but has %d/%d",
                        name, counts[0], counts[1], seen[0], seen[1]));
            }
        });
    }

    private void checkTrailer(JsonNode trailer, BackupContainer container, Map<String, long[]> actual) {
        long records = actual.values().stream().mapToLong(c -> c[0]).sum();
        long tombstones = actual.values().stream().mapToLong(c -> c[1]).sum();
        if (trailer.path("records").asLong(-1) != records
                || trailer.path("tombstones").asLong(-1) != tombstones
                || trailer.path("collections").asLong(-1) != actual.size()) {
            container.addProblem(String.format("trailer totals do not match content (records=%d, tombstones=%d)",
                    records, tombstones));
        }
    }

    private void writeLine(Writer writer, JsonNode node) throws IOException {
        writer.write(objectMapper.writeValueAsString(node));
        writer.write('\n');
    }
}
