package com.example.backup.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * 복구 상태 머신
 *
 * IDLE -> PREPARING -> SAFETY_SNAPSHOT -> BASE_RESTORE -> LOG_REPLAY -> VALIDATING -> PROMOTED
 * 파괴적 단계 이후 실패 시 ROLLED_BACK, 그 이전 실패 시 ABORTED
 */
public enum RestoreState {
    IDLE,
    PREPARING,
    SAFETY_SNAPSHOT,
    BASE_RESTORE,
    LOG_REPLAY,
    VALIDATING,
    PROMOTED,
    ROLLED_BACK,
    ABORTED;

    public boolean isTerminal() {
        return this == PROMOTED || this == ROLLED_BACK || this == ABORTED;
    }

    public boolean canTransitionTo(RestoreState next) {
        return allowedNext().contains(next);
    }

    private Set<RestoreState> allowedNext() {
        switch (this) {
            case IDLE:
                return EnumSet.of(PREPARING);
            case PREPARING:
                return EnumSet.of(SAFETY_SNAPSHOT, ABORTED);
            case SAFETY_SNAPSHOT:
                return EnumSet.of(BASE_RESTORE, ABORTED);
            case BASE_RESTORE:
                return EnumSet.of(LOG_REPLAY, ROLLED_BACK, ABORTED);
            case LOG_REPLAY:
                return EnumSet.of(VALIDATING, ROLLED_BACK);
            case VALIDATING:
                return EnumSet.of(PROMOTED, ROLLED_BACK);
            default:
                return EnumSet.noneOf(RestoreState.class);
        }
    }
}
