package com.example.backup.domain.exception;

import java.util.Map;

public class GapException extends BackupException {

    private final long missingFrom;
    private final long missingTo;

    public GapException(String storeName, long missingFrom, long missingTo) {
        super(ErrorKind.GAP, "WAL_GAP",
                String.format("Missing log segments %d..%d for store %s", missingFrom, missingTo, storeName),
                Map.of("store", storeName, "missingFrom", missingFrom, "missingTo", missingTo));
        this.missingFrom = missingFrom;
        this.missingTo = missingTo;
    }

    public long getMissingFrom() {
        return missingFrom;
    }

    public long getMissingTo() {
        return missingTo;
    }
}
