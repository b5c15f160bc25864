package com.axlabs.neo.yieldshares.governance;

import java.math.BigInteger;

/**
 * The governance parameters with their ids, storage keys and allowed ranges. The id is what a governance parameter
 * proposal carries in its agreement id field.
 */
public enum GovernanceParameter {

    VOTING_DELAY(0, "voting_delay", 3_600L, 604_800L), // seconds, 1 hour to 7 days
    VOTING_PERIOD(1, "voting_period", 86_400L, 2_592_000L), // seconds, 1 day to 30 days
    QUORUM_BP(2, "quorum_bp", 500L, 5_000L),
    THRESHOLD_BP(3, "threshold_bp", 10L, 1_000L);

    private final int id;
    private final String key;
    private final long min;
    private final long max;

    GovernanceParameter(int id, String key, long min, long max) {
        this.id = id;
        this.key = key;
        this.min = min;
        this.max = max;
    }

    public int id() {
        return id;
    }

    public String key() {
        return key;
    }

    public long min() {
        return min;
    }

    public long max() {
        return max;
    }

    public boolean isInRange(BigInteger value) {
        return value.compareTo(BigInteger.valueOf(min)) >= 0 && value.compareTo(BigInteger.valueOf(max)) <= 0;
    }

    public static GovernanceParameter fromId(int id) {
        for (GovernanceParameter p : values()) {
            if (p.id == id) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown governance parameter " + id);
    }
}
