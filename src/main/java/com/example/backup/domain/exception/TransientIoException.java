package com.example.backup.domain.exception;

import java.util.Map;

public class TransientIoException extends BackupException {
    public TransientIoException(String message, Map<String, Object> context, Throwable cause) {
        super(ErrorKind.TRANSIENT_IO, "TRANSIENT_IO", message, context, cause);
    }

    public TransientIoException(String message, Throwable cause) {
        this(message, Map.of(), cause);
    }
}
