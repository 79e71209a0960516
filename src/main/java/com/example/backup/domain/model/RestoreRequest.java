package com.example.backup.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RestoreRequest {
    String storeName;
    RecoveryTarget target;
    @Builder.Default
    RestoreScope scope = RestoreScope.full();
    boolean force;
}
