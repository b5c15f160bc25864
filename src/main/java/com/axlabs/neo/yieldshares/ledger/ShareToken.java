package com.axlabs.neo.yieldshares.ledger;

import com.axlabs.neo.yieldshares.ErrorCode;
import com.axlabs.neo.yieldshares.kyc.KycRegistry;
import com.axlabs.neo.yieldshares.restriction.RestrictionParameter;
import com.axlabs.neo.yieldshares.restriction.TransferRestrictionValidator;
import com.axlabs.neo.yieldshares.restriction.TransferRestrictions;
import com.axlabs.neo.yieldshares.restriction.ValidationResult;
import com.axlabs.neo.yieldshares.runtime.Runtime;
import com.axlabs.neo.yieldshares.runtime.SmartContract;
import com.axlabs.neo.yieldshares.runtime.StorageMap;
import com.axlabs.neo.yieldshares.token.SettlementToken;
import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Shared implementation of the share token contracts. A share token holds one or more share classes, each with its
 * own {@link ShareholderLedger} and {@link TransferRestrictions}.
 * <p>
 * Repayments are settled in the {@link SettlementToken} given on construction. The contract keeps custody of
 * repayment funds that could not be delivered until the holder claims them.
 */
public abstract class ShareToken extends SmartContract {

    //region EVENTS
    public static final String TRANSFER = "Transfer";
    public static final String POOLED_SHARES_MINTED = "PooledSharesMinted";
    public static final String REPAYMENT_DISTRIBUTED = "RepaymentDistributed";
    public static final String REPAYMENT_TRANSFER_FAILED = "RepaymentTransferFailed";
    public static final String REMAINDER_CLAIMED = "RemainderClaimed";
    public static final String RESTRICTION_UPDATED = "RestrictionUpdated";
    public static final String KYC_REGISTRY_ATTACHED = "KycRegistryAttached";
    //endregion EVENTS

    static final String OWNER_KEY = "owner";
    static final String GOVERNANCE_KEY = "governance";
    static final String KYC_REGISTRY_KEY = "kycRegistry";

    protected final SettlementToken paymentToken;
    protected final StorageMap properties = storageMap("properties");
    private final int maxShareholders;
    private final int poolingToleranceBP;
    private final Map<Integer, ShareholderLedger> ledgers = new HashMap<>();
    private final Map<Integer, TransferRestrictions> restrictions = new HashMap<>();

    protected ShareToken(Runtime runtime, String name, Hash160 owner, SettlementToken paymentToken,
            int maxShareholders, int poolingToleranceBP) {
        super(runtime, name);
        this.paymentToken = paymentToken;
        this.maxShareholders = maxShareholders;
        this.poolingToleranceBP = poolingToleranceBP;
        properties.put(OWNER_KEY, owner);
    }

    public Hash160 getOwner() {
        return properties.get(OWNER_KEY, Hash160.class);
    }

    public Hash160 getGovernance() {
        return properties.get(GOVERNANCE_KEY, Hash160.class);
    }

    /**
     * Sets the governance contract that may change transfer restrictions. Only callable by the owner.
     *
     * @param governance The governance contract hash.
     */
    public void setGovernance(Hash160 governance) {
        invoke("setGovernance", () -> {
            abortIfNotOwner("setGovernance");
            properties.put(GOVERNANCE_KEY, governance);
        });
    }

    /**
     * Attaches a KYC registry. While attached, every holder-to-holder transfer requires a KYC-verified recipient
     * and parties that are not blacklisted. Pass null to detach.
     *
     * @param registry The script hash of a deployed {@link KycRegistry} contract.
     */
    public void attachKycRegistry(Hash160 registry) {
        invoke("attachKycRegistry", () -> {
            abortIfNotOwner("attachKycRegistry");
            if (registry != null && !(runtime.getContract(registry) instanceof KycRegistry))
                fireErrorAndAbort(ErrorCode.INVALID_ARGUMENT, "Not a KYC registry", "attachKycRegistry");
            properties.put(KYC_REGISTRY_KEY, registry);
            fire(KYC_REGISTRY_ATTACHED, registry);
        });
    }

    protected KycRegistry kycRegistry() {
        Hash160 hash = properties.get(KYC_REGISTRY_KEY, Hash160.class);
        return hash == null ? null : (KycRegistry) runtime.getContract(hash);
    }

    /**
     * @return true if the share class exists. Views on classes that don't exist are not cached.
     */
    protected boolean isShareClass(int classId) {
        return true;
    }

    protected ShareholderLedger ledger(int classId) {
        ShareholderLedger ledger = ledgers.get(classId);
        if (ledger == null) {
            ledger = new ShareholderLedger(runtime, getScriptHash() + "." + classId, maxShareholders);
            if (isShareClass(classId)) {
                ledgers.put(classId, ledger);
            }
        }
        return ledger;
    }

    protected TransferRestrictions restrictions(int classId) {
        TransferRestrictions r = restrictions.get(classId);
        if (r == null) {
            r = new TransferRestrictions(ctx, getScriptHash() + "." + classId);
            if (isShareClass(classId)) {
                restrictions.put(classId, r);
            }
        }
        return r;
    }

    //region SHARE MOVEMENTS

    protected void mintShares(int classId, Hash160 to, BigInteger amount, String method) {
        abortIfNotOwner(method);
        if (amount.signum() <= 0) fireErrorAndAbort(ErrorCode.INVALID_ARGUMENT, "Invalid amount", method);
        if (to == null || Hash160.ZERO.equals(to))
            fireErrorAndAbort(ErrorCode.INVALID_ARGUMENT, "Invalid recipient", method);
        credit(classId, to, amount);
    }

    private void credit(int classId, Hash160 to, BigInteger amount) {
        ledger(classId).credit(to, amount);
        TransferRestrictions r = restrictions(classId);
        if (r.getMinHoldingPeriod() != 0) {
            r.recordInboundTransfer(to, runtime.getTime());
        }
        fire(TRANSFER, null, to, amount, classId);
    }

    protected void burnShares(int classId, Hash160 from, BigInteger amount, String method) {
        abortIfNotOwner(method);
        if (amount.signum() <= 0) fireErrorAndAbort(ErrorCode.INVALID_ARGUMENT, "Invalid amount", method);
        ledger(classId).debit(from, amount);
        fire(TRANSFER, from, null, amount, classId);
    }

    /**
     * Mints the shares of a pooled funding round. With {@code exact}, the contributions have to add up to the
     * required capital exactly and every contributor gets one share per unit contributed. Otherwise the sum may
     * deviate within the configured tolerance and the required capital is split pro-rata.
     */
    protected void mintPooledShares(int classId, Map<Hash160, BigInteger> contributions, BigInteger requiredCapital,
            boolean exact, String method) {
        abortIfNotOwner(method);
        Distribution allocation = exact
                ? DistributionEngine.allocatePoolExact(contributions, requiredCapital)
                : DistributionEngine.allocatePool(contributions, requiredCapital, poolingToleranceBP);
        allocation.getPayouts().forEach((contributor, shares) -> {
            if (shares.signum() > 0) {
                credit(classId, contributor, shares);
            }
        });
        fire(POOLED_SHARES_MINTED, classId, requiredCapital, contributions.size());
    }

    protected ValidationResult checkTransfer(int classId, Hash160 from, Hash160 to, BigInteger amount) {
        return new TransferRestrictionValidator(restrictions(classId), ledger(classId))
                .validate(from, to, amount, kycRegistry(), runtime.getTime());
    }

    protected void transferShares(int classId, Hash160 from, Hash160 to, BigInteger amount, String method) {
        if (!runtime.checkWitness(from)) fireErrorAndAbort(ErrorCode.UNAUTHORIZED, "Not authorised", method);
        if (amount.signum() <= 0) fireErrorAndAbort(ErrorCode.INVALID_ARGUMENT, "Invalid amount", method);
        if (TransferRestrictionValidator.isMintOrBurn(from, to))
            fireErrorAndAbort(ErrorCode.INVALID_ARGUMENT, "Invalid transfer party", method);
        ValidationResult result = checkTransfer(classId, from, to, amount);
        if (!result.isAllowed()) fireErrorAndAbort(ErrorCode.TRANSFER_RESTRICTED, result.getReason(), method);
        ledger(classId).move(from, to, amount);
        restrictions(classId).recordInboundTransfer(to, runtime.getTime());
        fire(TRANSFER, from, to, amount, classId);
    }
    //endregion SHARE MOVEMENTS

    //region REPAYMENTS

    /**
     * Distributes a repayment pro-rata over the current holders of a share class. The payer's funds are moved into
     * the custody of this contract first. A payout that cannot be delivered is kept as unclaimed remainder of the
     * holder instead of failing the distribution.
     *
     * @param fullAmount The full payment the amount belongs to. Equal to {@code amount} for full repayments.
     */
    protected Distribution distributeRepayment(int classId, Hash160 payer, BigInteger amount, BigInteger fullAmount,
            String method) {
        if (amount.signum() <= 0) fireErrorAndAbort(ErrorCode.INVALID_ARGUMENT, "Invalid amount", method);
        ShareholderLedger ledger = ledger(classId);
        if (ledger.totalShares().signum() == 0)
            fireErrorAndAbort(ErrorCode.INVALID_ARGUMENT, "No shareholders", method);
        if (!paymentToken.transfer(payer, getScriptHash(), amount))
            fireErrorAndAbort(ErrorCode.TRANSFER_FAILED, "Repayment not funded", method);

        Distribution distribution = amount.equals(fullAmount)
                ? DistributionEngine.allocate(amount, ledger.getHoldings(), ledger.totalShares())
                : DistributionEngine.allocatePartial(amount, fullAmount, ledger.getHoldings(), ledger.totalShares());
        distribution.getPayouts().forEach((holder, payout) -> {
            if (payout.signum() > 0 && !paymentToken.transfer(getScriptHash(), holder, payout)) {
                ledger.addUnclaimed(holder, payout);
                fire(REPAYMENT_TRANSFER_FAILED, classId, holder, payout);
            }
        });
        log.info("Distributed repayment of {} (of {}) over {} holders of {} class {}", amount, fullAmount,
                distribution.getShares().size(), getName(), classId);
        fire(REPAYMENT_DISTRIBUTED, classId, amount, fullAmount, distribution.getRemainder(),
                distribution.getRemainderRecipient());
        return distribution;
    }

    /**
     * Pays out the calling holder's unclaimed remainder. Fails without changing state if the transfer fails.
     */
    protected BigInteger claimRemainder(int classId, String method) {
        Hash160 holder = getCallingScriptHash();
        BigInteger owed = ledger(classId).takeUnclaimed(holder);
        if (owed.signum() == 0) fireErrorAndAbort(ErrorCode.INVALID_ARGUMENT, "Nothing to claim", method);
        if (!paymentToken.transfer(getScriptHash(), holder, owed))
            fireErrorAndAbort(ErrorCode.TRANSFER_FAILED, "Transfer failed", method);
        fire(REMAINDER_CLAIMED, classId, holder, owed);
        return owed;
    }
    //endregion REPAYMENTS

    //region RESTRICTION ADMINISTRATION

    protected void setLockupEnd(int classId, long timestamp, String method) {
        abortIfNotOwnerOrGovernance(method);
        if (timestamp < 0) fireErrorAndAbort(ErrorCode.PARAMETER_OUT_OF_BOUNDS, "Invalid lockup end", method);
        restrictions(classId).setLockupEndTimestamp(timestamp);
        fire(RESTRICTION_UPDATED, classId, "lockupEndTimestamp", timestamp);
    }

    protected void setMaxShares(int classId, int bp, String method) {
        abortIfNotOwnerOrGovernance(method);
        if (bp < 0 || bp > 10_000)
            fireErrorAndAbort(ErrorCode.PARAMETER_OUT_OF_BOUNDS, "Invalid max shares per investor", method);
        restrictions(classId).setMaxSharesPerInvestorBP(bp);
        fire(RESTRICTION_UPDATED, classId, "maxSharesPerInvestorBP", bp);
    }

    protected void setHoldingPeriod(int classId, long seconds, String method) {
        abortIfNotOwnerOrGovernance(method);
        if (seconds < 0 || seconds > RestrictionParameter.MAX_HOLDING_PERIOD)
            fireErrorAndAbort(ErrorCode.PARAMETER_OUT_OF_BOUNDS, "Invalid holding period", method);
        restrictions(classId).setMinHoldingPeriod(seconds);
        fire(RESTRICTION_UPDATED, classId, "minHoldingPeriodSeconds", seconds);
    }

    protected void setPaused(int classId, boolean paused, String method) {
        abortIfNotOwnerOrGovernance(method);
        restrictions(classId).setTransferPaused(paused);
        fire(RESTRICTION_UPDATED, classId, "isTransferPaused", paused);
    }

    protected void setListEnabled(int classId, boolean whitelist, boolean enabled, String method) {
        abortIfNotOwnerOrGovernance(method);
        if (whitelist) {
            restrictions(classId).setWhitelistEnabled(enabled);
        } else {
            restrictions(classId).setBlacklistEnabled(enabled);
        }
        fire(RESTRICTION_UPDATED, classId, whitelist ? "whitelistEnabled" : "blacklistEnabled", enabled);
    }

    protected void setListed(int classId, Hash160 account, boolean whitelist, boolean listed, String method) {
        abortIfNotOwnerOrGovernance(method);
        if (whitelist) {
            restrictions(classId).setWhitelisted(account, listed);
        } else {
            restrictions(classId).setBlacklisted(account, listed);
        }
    }

    /**
     * Applies a transfer restriction change decided by governance.
     */
    protected void updateRestriction(int classId, int parameterId, BigInteger value, String method) {
        if (parameterId < 0 || parameterId > 2)
            fireErrorAndAbort(ErrorCode.PARAMETER_OUT_OF_BOUNDS, "Unknown restriction parameter", method);
        if (value.bitLength() > 63)
            fireErrorAndAbort(ErrorCode.PARAMETER_OUT_OF_BOUNDS, "Restriction value too large", method);
        switch (RestrictionParameter.fromId(parameterId)) {
            case LOCKUP_END_TIMESTAMP:
                setLockupEnd(classId, value.longValueExact(), method);
                break;
            case MAX_SHARES_PER_INVESTOR_BP:
                if (value.compareTo(BigInteger.valueOf(10_000)) > 0)
                    fireErrorAndAbort(ErrorCode.PARAMETER_OUT_OF_BOUNDS, "Invalid max shares per investor", method);
                setMaxShares(classId, value.intValueExact(), method);
                break;
            default:
                setHoldingPeriod(classId, value.longValueExact(), method);
        }
    }
    //endregion RESTRICTION ADMINISTRATION

    protected void abortIfNotOwner(String method) {
        if (!runtime.checkWitness(getOwner())) fireErrorAndAbort(ErrorCode.UNAUTHORIZED, "Not authorised", method);
    }

    protected void abortIfNotOwnerOrGovernance(String method) {
        Hash160 governance = getGovernance();
        boolean byGovernance = governance != null && governance.equals(getCallingScriptHash());
        if (!byGovernance && !runtime.checkWitness(getOwner()))
            fireErrorAndAbort(ErrorCode.UNAUTHORIZED, "Not authorised", method);
    }
}
