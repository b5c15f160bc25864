package com.axlabs.neo.yieldshares.agreement;

import com.axlabs.neo.yieldshares.ErrorCode;
import com.axlabs.neo.yieldshares.runtime.Runtime;
import com.axlabs.neo.yieldshares.runtime.SmartContract;
import com.axlabs.neo.yieldshares.runtime.StorageMap;
import com.axlabs.neo.yieldshares.token.SettlementToken;
import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.function.Consumer;

/**
 * Keeps the yield agreements and holds their reserve funds.
 * <p>
 * Agreements are created by the owner. All changes to existing agreements can only be made by the governance
 * contract.
 */
public class YieldAgreementRegistry extends SmartContract implements AgreementRegistry {

    //region EVENTS
    public static final String AGREEMENT_CREATED = "AgreementCreated";
    public static final String AGREEMENT_UPDATED = "AgreementUpdated";
    public static final String RESERVE_ALLOCATED = "ReserveAllocated";
    public static final String RESERVE_WITHDRAWN = "ReserveWithdrawn";
    //endregion EVENTS

    static final String OWNER_KEY = "owner";
    static final String GOVERNANCE_KEY = "governance";
    static final String AGREEMENT_COUNT_KEY = "agreementCount";

    private final SettlementToken paymentToken;
    private final StorageMap properties = storageMap("properties");
    private final StorageMap agreements = storageMap("agreements"); // [int id: YieldAgreement]

    public YieldAgreementRegistry(Runtime runtime, String name, Hash160 owner, SettlementToken paymentToken) {
        super(runtime, name);
        this.paymentToken = paymentToken;
        properties.put(OWNER_KEY, owner);
    }

    public Hash160 getOwner() {
        return properties.get(OWNER_KEY, Hash160.class);
    }

    public Hash160 getGovernance() {
        return properties.get(GOVERNANCE_KEY, Hash160.class);
    }

    public void setGovernance(Hash160 governance) {
        invoke("setGovernance", () -> {
            if (!runtime.checkWitness(getOwner()))
                fireErrorAndAbort(ErrorCode.UNAUTHORIZED, "Not authorised", "setGovernance");
            properties.put(GOVERNANCE_KEY, governance);
        });
    }

    /**
     * Registers a new agreement. Only callable by the owner.
     *
     * @param upfrontCapital The capital raised for the agreement.
     * @param roiBasisPoints The initial yield rate in basis points.
     * @param termMonths     The term of the agreement.
     * @return the id of the new agreement. Ids start at 1.
     */
    public int createAgreement(BigInteger upfrontCapital, int roiBasisPoints, int termMonths) {
        return invoke("createAgreement", () -> {
            if (!runtime.checkWitness(getOwner()))
                fireErrorAndAbort(ErrorCode.UNAUTHORIZED, "Not authorised", "createAgreement");
            if (upfrontCapital.signum() <= 0 || roiBasisPoints <= 0 || termMonths <= 0)
                fireErrorAndAbort(ErrorCode.INVALID_ARGUMENT, "Invalid agreement terms", "createAgreement");
            int id = getAgreementCount() + 1;
            properties.put(AGREEMENT_COUNT_KEY, id);
            agreements.put(id, new YieldAgreement(id, upfrontCapital, roiBasisPoints, termMonths));
            fire(AGREEMENT_CREATED, id, upfrontCapital, roiBasisPoints, termMonths);
            return id;
        });
    }

    public int getAgreementCount() {
        Integer count = properties.get(AGREEMENT_COUNT_KEY, Integer.class);
        return count == null ? 0 : count;
    }

    @Override
    public YieldAgreement getAgreement(int agreementId) {
        return agreements.get(agreementId, YieldAgreement.class);
    }

    @Override
    public boolean agreementExists(int agreementId) {
        return agreements.get(agreementId) != null;
    }

    @Override
    public void setAgreementROI(int agreementId, int roiBasisPoints) {
        update(agreementId, "setAgreementROI", a -> a.roiBasisPoints = roiBasisPoints);
    }

    @Override
    public void allocateReserve(int agreementId, BigInteger amount) {
        invoke("allocateReserve", () -> {
            YieldAgreement a = governanceAccess(agreementId, "allocateReserve");
            if (amount.signum() <= 0)
                fireErrorAndAbort(ErrorCode.INVALID_ARGUMENT, "Invalid amount", "allocateReserve");
            a.reserveBalance = a.reserveBalance.add(amount);
            agreements.put(agreementId, a);
            fire(RESERVE_ALLOCATED, agreementId, amount, a.reserveBalance);
        });
    }

    @Override
    public void withdrawReserve(int agreementId, BigInteger amount) {
        invoke("withdrawReserve", () -> {
            YieldAgreement a = governanceAccess(agreementId, "withdrawReserve");
            if (amount.signum() <= 0 || amount.compareTo(a.reserveBalance) > 0)
                fireErrorAndAbort(ErrorCode.INVALID_ARGUMENT, "Invalid withdrawal amount", "withdrawReserve");
            a.reserveBalance = a.reserveBalance.subtract(amount);
            agreements.put(agreementId, a);
            if (!paymentToken.transfer(getScriptHash(), getGovernance(), amount))
                fireErrorAndAbort(ErrorCode.TRANSFER_FAILED, "Reserve transfer failed", "withdrawReserve");
            fire(RESERVE_WITHDRAWN, agreementId, amount, a.reserveBalance);
        });
    }

    @Override
    public void setGracePeriodDays(int agreementId, int days) {
        update(agreementId, "setGracePeriodDays", a -> a.gracePeriodDays = days);
    }

    @Override
    public void setDefaultPenaltyRate(int agreementId, int bp) {
        update(agreementId, "setDefaultPenaltyRate", a -> a.defaultPenaltyRate = bp);
    }

    @Override
    public void setDefaultThreshold(int agreementId, int threshold) {
        update(agreementId, "setDefaultThreshold", a -> a.defaultThreshold = threshold);
    }

    @Override
    public void setAllowPartialRepayments(int agreementId, boolean allow) {
        update(agreementId, "setAllowPartialRepayments", a -> a.allowPartialRepayments = allow);
    }

    @Override
    public void setAllowEarlyRepayment(int agreementId, boolean allow) {
        update(agreementId, "setAllowEarlyRepayment", a -> a.allowEarlyRepayment = allow);
    }

    private void update(int agreementId, String method, Consumer<YieldAgreement> change) {
        invoke(method, () -> {
            YieldAgreement a = governanceAccess(agreementId, method);
            change.accept(a);
            agreements.put(agreementId, a);
            fire(AGREEMENT_UPDATED, agreementId, method);
        });
    }

    private YieldAgreement governanceAccess(int agreementId, String method) {
        Hash160 governance = getGovernance();
        if (governance == null || !governance.equals(getCallingScriptHash()))
            fireErrorAndAbort(ErrorCode.UNAUTHORIZED, "Not authorised", method);
        YieldAgreement a = getAgreement(agreementId);
        if (a == null) fireErrorAndAbort(ErrorCode.AGREEMENT_NOT_FOUND, "Agreement not found", method);
        return a;
    }
}
