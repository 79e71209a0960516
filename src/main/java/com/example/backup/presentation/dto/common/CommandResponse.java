package com.example.backup.presentation.dto.common;

import com.example.backup.domain.exception.BackupException;
import com.example.backup.domain.model.CommandStatus;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * 명령 응답: status + summary + 명령별 결과(data)
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class CommandResponse<T> extends BaseResponse {

    private T data;

    public static <T> CommandResponse<T> of(CommandStatus status, String summary, T data) {
        return CommandResponse.<T>builder()
                .status(status)
                .summary(summary)
                .data(data)
                .build();
    }

    public static <T> CommandResponse<T> ok(String summary, T data) {
        return of(CommandStatus.OK, summary, data);
    }

    public static CommandResponse<Void> failed(BackupException e) {
        return CommandResponse.<Void>builder()
                .status(CommandStatus.FAILED)
                .summary(e.getMessage())
                .errorKind(e.getKind().name())
                .errorCode(e.getCode())
                .build();
    }

    public static CommandResponse<Void> failed(String errorKind, String errorCode, String summary) {
        return CommandResponse.<Void>builder()
                .status(CommandStatus.FAILED)
                .summary(summary)
                .errorKind(errorKind)
                .errorCode(errorCode)
                .build();
    }
}
