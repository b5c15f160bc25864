package com.axlabs.neo.yieldshares.restriction;

/**
 * The transfer restriction parameters that governance can change, by parameter id.
 */
public enum RestrictionParameter {

    LOCKUP_END_TIMESTAMP(0),
    MAX_SHARES_PER_INVESTOR_BP(1),
    MIN_HOLDING_PERIOD_SECONDS(2);

    public static final long MAX_HOLDING_PERIOD = 365L * 24 * 3600;

    private final int id;

    RestrictionParameter(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    public static RestrictionParameter fromId(int id) {
        for (RestrictionParameter p : values()) {
            if (p.id == id) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown restriction parameter " + id);
    }
}
