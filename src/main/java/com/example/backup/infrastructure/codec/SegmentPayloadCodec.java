package com.example.backup.infrastructure.codec;

import com.example.backup.domain.exception.CorruptionException;
import com.example.backup.infrastructure.store.LogMutation;
import com.example.backup.infrastructure.store.ProducedSegment;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * 로그 세그먼트 페이로드 (gzip JSON lines: 세그먼트 헤더 + 변경 목록)
 */
public class SegmentPayloadCodec {

    public static final String SEGMENT_UNREADABLE = "SEGMENT_UNREADABLE";

    private final ObjectMapper objectMapper;

    public SegmentPayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.INDENT_OUTPUT);
    }

    public byte[] encode(ProducedSegment segment) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (Writer writer = new OutputStreamWriter(new GZIPOutputStream(bytes), StandardCharsets.UTF_8)) {
            ObjectNode header = objectMapper.createObjectNode()
                    .put("store", segment.getStoreName())
                    .put("sequenceId", segment.getSequenceId())
                    .put("producedAt", segment.getProducedAt().toString())
                    .put("mutations", segment.getMutations().size());
            writer.write(objectMapper.writeValueAsString(header));
            writer.write('\n');
            for (LogMutation mutation : segment.getMutations()) {
                writer.write(objectMapper.writeValueAsString(mutation));
                writer.write('\n');
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode log segment", e);
        }
        return bytes.toByteArray();
    }

    public ProducedSegment decode(byte[] payload) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(
                new GZIPInputStream(new ByteArrayInputStream(payload)), StandardCharsets.UTF_8))) {
            String first = reader.readLine();
            if (first == null) {
                throw new IOException("empty segment payload");
            }
            JsonNode header = objectMapper.readTree(first);
            int declared = header.path("mutations").asInt(-1);
            List<LogMutation> mutations = new ArrayList<>();
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    mutations.add(objectMapper.readValue(line, LogMutation.class));
                }
            }
            if (declared != mutations.size()) {
                throw new IOException("segment declares " + declared + " mutations but has " + mutations.size());
            }
            return new ProducedSegment(header.path("store").asText(), header.path("sequenceId").asLong(),
                    Instant.parse(header.path("producedAt").asText()), mutations);
        } catch (IOException | RuntimeException e) {
            throw new CorruptionException(SEGMENT_UNREADABLE,
                    "Log segment payload cannot be decoded: " + e.getMessage(), Map.of(), e);
        }
    }
}
