package com.axlabs.neo.yieldshares.ledger;

import java.math.BigInteger;

/**
 * A value a balance took on from {@code time} until the next checkpoint.
 */
public class Checkpoint {

    public final long time;
    public final BigInteger value;

    public Checkpoint(long time, BigInteger value) {
        this.time = time;
        this.value = value;
    }
}
