package com.example.backup.presentation.controller;

import com.example.backup.application.service.WalArchiver;
import com.example.backup.domain.model.ArchiveResult;
import com.example.backup.domain.model.CommandStatus;
import com.example.backup.domain.model.ContinuityReport;
import com.example.backup.presentation.dto.common.CommandResponse;
import com.example.backup.presentation.dto.response.ContinuityResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 외부 스토어의 archive hook 수신 및 연속성 조회
 */
@RestController
@RequestMapping("/api/wal/{store}")
@RequiredArgsConstructor
@Slf4j
public class WalController {

    private final WalArchiver walArchiver;

    @PostMapping(value = "/segments", consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public ResponseEntity<CommandResponse<ArchiveResult>> ingest(@PathVariable String store,
                                                                 @RequestParam long sequenceId,
                                                                 @RequestBody byte[] payload) {
        log.debug("Segment received: store={}, seq={}, bytes={}", store, sequenceId, payload.length);
        ArchiveResult result = walArchiver.ingest(store, sequenceId, payload);
        return ResponseEntity.ok(CommandResponse.ok(
                "Segment " + sequenceId + " of " + store + " " + result.getOutcome(), result));
    }

    @GetMapping("/continuity")
    public ResponseEntity<CommandResponse<ContinuityResponse>> continuity(@PathVariable String store) {
        ContinuityReport report = walArchiver.scanContinuity(store);
        CommandStatus status = report.isContinuous() ? CommandStatus.OK : CommandStatus.DEGRADED;
        String summary = report.isContinuous()
                ? String.format("%d archived segments of %s, no gaps", report.getArchivedCount(), store)
                : String.format("%d archived segments of %s, %d gaps", report.getArchivedCount(), store,
                report.getGaps().size());
        return ResponseEntity.ok(CommandResponse.of(status, summary, ContinuityResponse.from(report)));
    }
}
