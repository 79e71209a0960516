package com.example.backup.presentation.controller;

import com.example.backup.application.service.WalArchiver;
import com.example.backup.infrastructure.lock.StoreLockService;
import com.example.backup.infrastructure.store.StoreRegistry;
import com.example.backup.infrastructure.transport.ArchiveTransport;
import com.example.backup.presentation.dto.common.CommandResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 엔진 상태 확인
 */
@RestController
@RequestMapping("/api/system")
@RequiredArgsConstructor
@Slf4j
public class SystemController {

    private final StoreRegistry storeRegistry;
    private final StoreLockService lockService;
    private final WalArchiver walArchiver;
    private final ArchiveTransport archiveTransport;

    @GetMapping("/status")
    public ResponseEntity<CommandResponse<Map<String, Object>>> status() {
        Map<String, Object> locks = new LinkedHashMap<>();
        for (String store : storeRegistry.storeNames()) {
            locks.put(store, lockService.currentHolder(store).orElse("free"));
        }

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("stores", storeRegistry.storeNames());
        status.put("locks", locks);
        status.put("pendingSegments", walArchiver.pendingCount());
        status.put("disposableInstances", storeRegistry.activeDisposableCount());
        status.put("archive", archiveTransport.describe());
        return ResponseEntity.ok(CommandResponse.ok("Engine running with " + storeRegistry.storeNames().size()
                + " stores", status));
    }
}
