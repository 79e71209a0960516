package com.example.backup.domain.exception;

import java.util.Map;

/**
 * 체크섬 불일치, 컨테이너 디코딩 실패 등
 * 재시도하지 않으며 해당 아티팩트/세그먼트에 치명적
 */
public class CorruptionException extends BackupException {
    public CorruptionException(String code, String message, Map<String, Object> context) {
        super(ErrorKind.CORRUPTION, code, message, context);
    }

    public CorruptionException(String code, String message, Map<String, Object> context, Throwable cause) {
        super(ErrorKind.CORRUPTION, code, message, context, cause);
    }
}
