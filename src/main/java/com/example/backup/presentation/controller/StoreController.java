package com.example.backup.presentation.controller;

import com.example.backup.infrastructure.store.ProducedSegment;
import com.example.backup.infrastructure.store.StoreInstance;
import com.example.backup.infrastructure.store.StoreRegistry;
import com.example.backup.presentation.dto.common.CommandResponse;
import com.example.backup.presentation.dto.request.CommitRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 내장 스토어 조작 (쓰기 커밋, 소비자 연결 관리, 상태 조회)
 */
@RestController
@RequestMapping("/api/stores/{store}")
@RequiredArgsConstructor
@Slf4j
@Validated
public class StoreController {

    private final StoreRegistry storeRegistry;

    @GetMapping
    public ResponseEntity<CommandResponse<Map<String, Object>>> status(@PathVariable String store) {
        StoreInstance instance = storeRegistry.get(store);
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("appliedSequence", instance.getAppliedSequence());
        status.put("collections", instance.collectionCounts());
        status.put("activeConsumers", instance.activeConsumers());
        status.put("contentChecksum", instance.contentChecksum());
        return ResponseEntity.ok(CommandResponse.ok(store + " at seq " + instance.getAppliedSequence(), status));
    }

    @PostMapping("/commit")
    public ResponseEntity<CommandResponse<Map<String, Object>>> commit(@PathVariable String store,
                                                                       @Valid @RequestBody CommitRequest request) {
        ProducedSegment segment = storeRegistry.commit(store, request.toMutations());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sequenceId", segment.getSequenceId());
        body.put("producedAt", segment.getProducedAt());
        body.put("mutations", segment.getMutations().size());
        return ResponseEntity.ok(CommandResponse.ok("Committed seq " + segment.getSequenceId() + " to " + store, body));
    }

    @PostMapping("/consumers/{consumerId}")
    public ResponseEntity<CommandResponse<Map<String, Object>>> connect(@PathVariable String store,
                                                                        @PathVariable String consumerId) {
        storeRegistry.connectConsumer(store, consumerId);
        return ResponseEntity.ok(CommandResponse.ok("Consumer " + consumerId + " connected to " + store,
                Map.<String, Object>of("activeConsumers", storeRegistry.get(store).activeConsumers())));
    }

    @DeleteMapping("/consumers/{consumerId}")
    public ResponseEntity<CommandResponse<Map<String, Object>>> disconnect(@PathVariable String store,
                                                                           @PathVariable String consumerId) {
        storeRegistry.disconnectConsumer(store, consumerId);
        return ResponseEntity.ok(CommandResponse.ok("Consumer " + consumerId + " disconnected from " + store,
                Map.<String, Object>of("activeConsumers", storeRegistry.get(store).activeConsumers())));
    }
}
