package com.example.backup.presentation.controller;

import com.example.backup.application.service.BackupProducer;
import com.example.backup.application.service.BackupValidator;
import com.example.backup.config.BackupProperties;
import com.example.backup.domain.entity.BackupArtifact;
import com.example.backup.domain.entity.ValidationReport;
import com.example.backup.domain.model.ArtifactType;
import com.example.backup.domain.model.CommandStatus;
import com.example.backup.domain.model.ValidationStage;
import com.example.backup.infrastructure.persistence.BackupCatalog;
import com.example.backup.presentation.dto.common.CommandResponse;
import com.example.backup.presentation.dto.response.ArtifactResponse;
import com.example.backup.presentation.dto.response.ValidationReportResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 백업 생성/검증/조회
 *
 * - POST /api/backups?store=&type=full|incremental
 * - POST /api/backups/{artifactId}/validate?level=1..5
 * - GET  /api/backups?store=
 * - GET  /api/backups/{artifactId}
 * - GET  /api/backups/{artifactId}/reports
 */
@RestController
@RequestMapping("/api/backups")
@RequiredArgsConstructor
@Slf4j
public class BackupController {

    private final BackupProducer backupProducer;
    private final BackupValidator backupValidator;
    private final BackupCatalog catalog;
    private final BackupProperties properties;

    @PostMapping
    public ResponseEntity<CommandResponse<ArtifactResponse>> createBackup(
            @RequestParam(required = false) String store,
            @RequestParam(defaultValue = "full") String type) {

        String storeName = store == null ? properties.getDefaultStore() : store;
        log.info("Backup request: store={}, type={}", storeName, type);

        BackupArtifact artifact = backupProducer.produceBackup(storeName, ArtifactType.fromToken(type));
        String summary = String.format("%s backup %s created at marker %d (%d bytes, trust %s)",
                artifact.getArtifactType().fileToken(), artifact.getArtifactId(),
                artifact.getConsistencyMarker(), artifact.getSizeBytes(), artifact.getTrustState());
        return ResponseEntity.ok(CommandResponse.ok(summary, ArtifactResponse.from(artifact)));
    }

    @PostMapping("/{artifactId}/validate")
    public ResponseEntity<CommandResponse<ValidationReportResponse>> validateBackup(
            @PathVariable String artifactId,
            @RequestParam(defaultValue = "" + ValidationStage.MAX_LEVEL) int level) {

        ValidationReport report = backupValidator.validate(artifactId, level);
        CommandStatus status;
        String summary;
        switch (report.getVerdict()) {
            case PASSED:
                status = CommandStatus.OK;
                summary = "Backup " + artifactId + " passed all " + ValidationStage.MAX_LEVEL + " validation stages";
                break;
            case INCOMPLETE:
                status = CommandStatus.DEGRADED;
                summary = "Backup " + artifactId + " passed stages 1-" + level + "; stages above " + level + " not run";
                break;
            default:
                status = CommandStatus.FAILED;
                summary = "Backup " + artifactId + " failed validation at stage "
                        + report.getFailedStage().getLevel() + " (" + report.getFailedStage().getDescription() + ")";
        }
        return ResponseEntity.ok(CommandResponse.of(status, summary, ValidationReportResponse.from(report)));
    }

    @GetMapping
    public ResponseEntity<CommandResponse<List<ArtifactResponse>>> listBackups(
            @RequestParam(required = false) String store) {
        String storeName = store == null ? properties.getDefaultStore() : store;
        List<ArtifactResponse> artifacts = catalog.listArtifacts(storeName).stream()
                .map(ArtifactResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(CommandResponse.ok(artifacts.size() + " artifacts for " + storeName, artifacts));
    }

    @GetMapping("/{artifactId}")
    public ResponseEntity<CommandResponse<ArtifactResponse>> getBackup(@PathVariable String artifactId) {
        BackupArtifact artifact = catalog.requireArtifact(artifactId);
        return ResponseEntity.ok(CommandResponse.ok("Backup " + artifactId, ArtifactResponse.from(artifact)));
    }

    @GetMapping("/{artifactId}/reports")
    public ResponseEntity<CommandResponse<List<ValidationReportResponse>>> getReports(@PathVariable String artifactId) {
        catalog.requireArtifact(artifactId);
        List<ValidationReportResponse> reports = catalog.reportsFor(artifactId).stream()
                .map(ValidationReportResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(CommandResponse.ok(reports.size() + " reports for " + artifactId, reports));
    }
}
