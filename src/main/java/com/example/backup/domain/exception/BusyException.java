package com.example.backup.domain.exception;

import java.util.Map;

public class BusyException extends BackupException {

    public static final String STORE_LOCKED = "STORE_LOCKED";
    public static final String DESTINATION_BUSY = "DESTINATION_BUSY";

    public BusyException(String code, String message, Map<String, Object> context) {
        super(ErrorKind.BUSY, code, message, context);
    }

    public static BusyException storeLocked(String storeName, String holder) {
        return new BusyException(STORE_LOCKED,
                "Another backup or restore is running against store " + storeName,
                Map.of("store", storeName, "holder", holder == null ? "unknown" : holder));
    }

    public static BusyException destinationBusy(String storeName, int activeConsumers) {
        return new BusyException(DESTINATION_BUSY,
                "Store " + storeName + " has " + activeConsumers + " active consumers; use --force to disconnect them",
                Map.of("store", storeName, "activeConsumers", activeConsumers));
    }
}
