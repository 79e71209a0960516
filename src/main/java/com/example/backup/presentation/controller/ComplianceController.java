package com.example.backup.presentation.controller;

import com.example.backup.application.service.ComplianceMonitor;
import com.example.backup.domain.model.CommandStatus;
import com.example.backup.domain.model.ComplianceSnapshot;
import com.example.backup.domain.model.StorageTier;
import com.example.backup.presentation.dto.common.CommandResponse;
import com.example.backup.presentation.dto.response.ComplianceResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/compliance")
@RequiredArgsConstructor
public class ComplianceController {

    private final ComplianceMonitor complianceMonitor;

    @GetMapping
    public ResponseEntity<CommandResponse<ComplianceResponse>> report(@RequestParam(required = false) String tier) {
        StorageTier storageTier = tier == null ? null : StorageTier.fromName(tier);
        ComplianceSnapshot snapshot = complianceMonitor.report(storageTier);
        CommandStatus status = CommandStatus.of(snapshot.getOverallLevel());

        String summary = String.format("%d stores%s: overall %s", snapshot.getStores().size(),
                storageTier == null ? "" : " in tier " + storageTier.name().toLowerCase(),
                snapshot.getOverallLevel());
        return ResponseEntity.ok(CommandResponse.of(status, summary, ComplianceResponse.from(snapshot)));
    }
}
