package com.axlabs.neo.yieldshares.agreement;

import io.neow3j.types.Hash160;

import java.math.BigInteger;

/**
 * The registry of yield agreements as seen by governance. Every mutator either succeeds or aborts the calling
 * operation.
 */
public interface AgreementRegistry {

    /**
     * @return the registry's script hash, i.e., the account holding the reserve funds.
     */
    Hash160 getScriptHash();

    /**
     * @return the agreement, or null if it does not exist.
     */
    YieldAgreement getAgreement(int agreementId);

    boolean agreementExists(int agreementId);

    void setAgreementROI(int agreementId, int roiBasisPoints);

    /**
     * Records reserve funds that were transferred to the registry.
     */
    void allocateReserve(int agreementId, BigInteger amount);

    /**
     * Transfers reserve funds from the registry back to the caller.
     */
    void withdrawReserve(int agreementId, BigInteger amount);

    void setGracePeriodDays(int agreementId, int days);

    void setDefaultPenaltyRate(int agreementId, int bp);

    void setDefaultThreshold(int agreementId, int threshold);

    void setAllowPartialRepayments(int agreementId, boolean allow);

    void setAllowEarlyRepayment(int agreementId, boolean allow);
}
