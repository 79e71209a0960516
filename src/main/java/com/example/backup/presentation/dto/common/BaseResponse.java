/**
 * 명령 응답 공통 필드
 */
package com.example.backup.presentation.dto.common;

import com.example.backup.domain.model.CommandStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.time.Instant;

@Data
@SuperBuilder
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class BaseResponse {

    protected CommandStatus status; // ok, degraded, failed
    protected String summary;       // 사람이 읽는 요약
    protected String errorKind;     // 실패 시에만
    protected String errorCode;

    @Builder.Default
    protected Instant timestamp = Instant.now();
}
