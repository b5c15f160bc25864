package com.axlabs.neo.yieldshares.governance.power;

import io.neow3j.types.Hash160;

import java.math.BigInteger;

/**
 * Resolves the share balances that voting power and quorum are based on. Implementations return zero for
 * agreements without a configured ledger and never throw.
 */
public interface VotingPowerSource {

    BigInteger balanceOf(Hash160 voter, int agreementId);

    BigInteger totalSupply(int agreementId);

    /**
     * @return the voter's balance at the given time, as recorded by the ledger's checkpoints.
     */
    BigInteger balanceOfAt(Hash160 voter, int agreementId, long time);

    BigInteger totalSupplyAt(int agreementId, long time);
}
