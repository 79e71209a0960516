package com.example.backup.presentation.controller;

import com.example.backup.application.service.RestoreOrchestrator;
import com.example.backup.domain.entity.RestoreRun;
import com.example.backup.domain.model.CommandStatus;
import com.example.backup.domain.model.RecoveryTarget;
import com.example.backup.domain.model.RestoreRequest;
import com.example.backup.domain.model.RestoreScope;
import com.example.backup.infrastructure.persistence.BackupCatalog;
import com.example.backup.presentation.dto.common.CommandResponse;
import com.example.backup.presentation.dto.request.RestoreRunRequest;
import com.example.backup.presentation.dto.response.RestoreRunResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 복구 실행
 *
 * 실패한 복구도 실행 기록(RestoreRun)과 함께 status=failed 로 응답한다.
 */
@RestController
@RequestMapping("/api/restores")
@RequiredArgsConstructor
@Slf4j
@Validated
public class RestoreController {

    private final RestoreOrchestrator restoreOrchestrator;
    private final BackupCatalog catalog;

    @PostMapping
    public ResponseEntity<CommandResponse<RestoreRunResponse>> runRestore(@Valid @RequestBody RestoreRunRequest request) {
        RestoreRequest restoreRequest = RestoreRequest.builder()
                .storeName(request.getStore())
                .target(RecoveryTarget.parse(request.getTarget()))
                .scope(RestoreScope.parse(request.getScope()))
                .force(request.isForce())
                .build();
        log.info("Restore request: store={}, target={}, scope={}, force={}", restoreRequest.getStoreName(),
                restoreRequest.getTarget(), restoreRequest.getScope(), restoreRequest.isForce());

        RestoreRun run = restoreOrchestrator.restore(restoreRequest);
        return ResponseEntity.ok(toResponse(run));
    }

    @GetMapping("/{runId}")
    public ResponseEntity<CommandResponse<RestoreRunResponse>> getRun(@PathVariable String runId) {
        return ResponseEntity.ok(toResponse(catalog.requireRun(runId)));
    }

    /**
     * 테이블 단위 복구 확인 (side-table 삭제)
     */
    @PostMapping("/{runId}/confirm")
    public ResponseEntity<CommandResponse<RestoreRunResponse>> confirm(@PathVariable String runId) {
        RestoreRun run = restoreOrchestrator.confirmTableRestore(runId);
        return ResponseEntity.ok(CommandResponse.ok("Table restore " + runId + " confirmed",
                RestoreRunResponse.from(run)));
    }

    private CommandResponse<RestoreRunResponse> toResponse(RestoreRun run) {
        RestoreRunResponse body = RestoreRunResponse.from(run);
        if (run.isPromoted()) {
            String summary = String.format("Restore %s promoted: base %s, replayed %d segments to seq %d",
                    run.getRunId(), run.getBaseArtifactId(), run.getReplayedSegments(), run.getTargetSequence());
            return CommandResponse.ok(summary, body);
        }
        if (!run.getState().isTerminal()) {
            return CommandResponse.of(CommandStatus.DEGRADED, "Restore " + run.getRunId() + " is " + run.getState(), body);
        }
        CommandResponse<RestoreRunResponse> response = CommandResponse.of(CommandStatus.FAILED,
                "Restore " + run.getRunId() + " " + run.getState() + ": " + run.getMessage(), body);
        response.setErrorKind(run.getFailureKind() == null ? null : run.getFailureKind().name());
        response.setErrorCode(run.getFailureCode());
        return response;
    }
}
