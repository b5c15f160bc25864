package com.axlabs.neo.yieldshares.agreement;

import java.math.BigInteger;

/**
 * The agreement terms that governance can change, with their ids and allowed ranges.
 */
public enum AgreementParameter {

    GRACE_PERIOD_DAYS(0, 1, 90),
    DEFAULT_PENALTY_RATE(1, 100, 2000),
    DEFAULT_THRESHOLD(2, 1, 12),
    ALLOW_PARTIAL_REPAYMENTS(3, 0, 1),
    ALLOW_EARLY_REPAYMENT(4, 0, 1);

    private final int id;
    private final long min;
    private final long max;

    AgreementParameter(int id, long min, long max) {
        this.id = id;
        this.min = min;
        this.max = max;
    }

    public int id() {
        return id;
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

    public static AgreementParameter fromId(int id) {
        for (AgreementParameter p : values()) {
            if (p.id == id) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown agreement parameter " + id);
    }
}
