package com.example.iptvcatalog.domain.enumtype;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Persisted sync lifecycle of an M3U source.
 *
 * <pre>
 * IDLE → FETCHING → PARSING → SUCCESS
 *           ↓          ↓
 *         FAILED     FAILED
 * </pre>
 *
 * SUCCESS and FAILED are terminal for a run; a new sync request starts again at FETCHING.
 */
public enum SourceSyncState {

    IDLE,
    FETCHING,
    PARSING,
    SUCCESS,
    FAILED;

    private static final Set<SourceSyncState> IN_PROGRESS = EnumSet.of(FETCHING, PARSING);

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }

    public boolean isInProgress() {
        return IN_PROGRESS.contains(this);
    }

    public boolean canTransitionTo(SourceSyncState next) {
        if (next == null) {
            return false;
        }
        switch (this) {
            case IDLE:
            case SUCCESS:
            case FAILED:
                return next == FETCHING;
            case FETCHING:
                return next == PARSING || next == FAILED;
            case PARSING:
                return next == SUCCESS || next == FAILED;
            default:
                return false;
        }
    }

    /**
     * Unknown or missing persisted values are reported as IDLE.
     */
    public static SourceSyncState fromValue(String value) {
        if (value == null || value.trim().isEmpty()) {
            return IDLE;
        }
        try {
            return SourceSyncState.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return IDLE;
        }
    }
}
