package com.axlabs.neo.yieldshares.ledger;

import com.axlabs.neo.yieldshares.ErrorCode;
import com.axlabs.neo.yieldshares.restriction.ValidationResult;
import com.axlabs.neo.yieldshares.runtime.Runtime;
import com.axlabs.neo.yieldshares.runtime.StorageMap;
import com.axlabs.neo.yieldshares.token.SettlementToken;
import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * A single share token contract holding the shares of many yield agreements. Each agreement is a token class
 * with its own id, ledger and transfer restrictions.
 */
public class CombinedYieldToken extends ShareToken {

    public static final String TOKEN_CLASS_CREATED = "TokenClassCreated";

    static final String TOKEN_COUNT_KEY = "tokenCount";

    private final StorageMap tokenAgreements = storageMap("tokenAgreements"); // [int tokenId: int agreementId]

    public CombinedYieldToken(Runtime runtime, String name, Hash160 owner, SettlementToken paymentToken,
            int maxShareholders, int poolingToleranceBP) {
        super(runtime, name, owner, paymentToken, maxShareholders, poolingToleranceBP);
    }

    /**
     * Creates a new token class for the shares of the given agreement. Only callable by the owner.
     *
     * @param agreementId The agreement the token class represents.
     * @return the id of the new token class. Ids start at 1.
     */
    public int createYieldTokenClass(int agreementId) {
        return invoke("createYieldTokenClass", () -> {
            abortIfNotOwner("createYieldTokenClass");
            int tokenId = getTokenClassCount() + 1;
            properties.put(TOKEN_COUNT_KEY, tokenId);
            tokenAgreements.put(tokenId, agreementId);
            fire(TOKEN_CLASS_CREATED, tokenId, agreementId);
            log.info("Created token class {} for agreement {}", tokenId, agreementId);
            return tokenId;
        });
    }

    public int getTokenClassCount() {
        Integer count = properties.get(TOKEN_COUNT_KEY, Integer.class);
        return count == null ? 0 : count;
    }

    /**
     * @return the agreement id of the token class, or null if the token class does not exist.
     */
    public Integer getAgreementId(int tokenId) {
        return tokenAgreements.get(tokenId, Integer.class);
    }

    //region READ

    public BigInteger balanceOf(Hash160 account, int tokenId) {
        return ledger(tokenId).balanceOf(account);
    }

    public BigInteger totalSupply(int tokenId) {
        return ledger(tokenId).totalShares();
    }

    public BigInteger balanceOfAt(Hash160 account, int tokenId, long time) {
        return ledger(tokenId).balanceAt(account, time);
    }

    public BigInteger totalSupplyAt(int tokenId, long time) {
        return ledger(tokenId).totalSharesAt(time);
    }

    public int getShareholderCount(int tokenId) {
        return ledger(tokenId).shareholderCount();
    }

    public List<Hash160> getShareholders(int tokenId) {
        return ledger(tokenId).getShareholders();
    }

    public List<Holding> getHoldings(int tokenId) {
        return ledger(tokenId).getHoldings();
    }

    public BigInteger unclaimedRemainderOf(Hash160 account, int tokenId) {
        return ledger(tokenId).unclaimedOf(account);
    }

    public long getLockupEndTimestamp(int tokenId) {
        return restrictions(tokenId).getLockupEndTimestamp();
    }

    public int getMaxSharesPerInvestorBP(int tokenId) {
        return restrictions(tokenId).getMaxSharesPerInvestorBP();
    }

    public long getMinHoldingPeriod(int tokenId) {
        return restrictions(tokenId).getMinHoldingPeriod();
    }

    public boolean isTransferPaused(int tokenId) {
        return restrictions(tokenId).isTransferPaused();
    }
    //endregion READ

    //region SHARES

    public void mint(Hash160 to, int tokenId, BigInteger amount) {
        invoke("mint", () -> {
            abortIfUnknownTokenClass(tokenId, "mint");
            mintShares(tokenId, to, amount, "mint");
        });
    }

    public void burn(Hash160 from, int tokenId, BigInteger amount) {
        invoke("burn", () -> {
            abortIfUnknownTokenClass(tokenId, "burn");
            burnShares(tokenId, from, amount, "burn");
        });
    }

    public void mintPooled(int tokenId, Map<Hash160, BigInteger> contributions, BigInteger requiredCapital) {
        invoke("mintPooled", () -> {
            abortIfUnknownTokenClass(tokenId, "mintPooled");
            mintPooledShares(tokenId, contributions, requiredCapital, false, "mintPooled");
        });
    }

    public void mintPooledExact(int tokenId, Map<Hash160, BigInteger> contributions, BigInteger requiredCapital) {
        invoke("mintPooledExact", () -> {
            abortIfUnknownTokenClass(tokenId, "mintPooledExact");
            mintPooledShares(tokenId, contributions, requiredCapital, true, "mintPooledExact");
        });
    }

    public void transfer(Hash160 from, Hash160 to, int tokenId, BigInteger amount) {
        invoke("transfer", () -> {
            abortIfUnknownTokenClass(tokenId, "transfer");
            transferShares(tokenId, from, to, amount, "transfer");
        });
    }

    public ValidationResult canTransfer(Hash160 from, Hash160 to, int tokenId, BigInteger amount) {
        return checkTransfer(tokenId, from, to, amount);
    }
    //endregion SHARES

    //region REPAYMENTS

    public Distribution distributeRepayment(int tokenId, Hash160 payer, BigInteger amount) {
        return invoke("distributeRepayment", () -> {
            abortIfUnknownTokenClass(tokenId, "distributeRepayment");
            return distributeRepayment(tokenId, payer, amount, amount, "distributeRepayment");
        });
    }

    public Distribution distributePartialRepayment(int tokenId, Hash160 payer, BigInteger partialAmount,
            BigInteger fullAmount) {
        return invoke("distributePartialRepayment", () -> {
            abortIfUnknownTokenClass(tokenId, "distributePartialRepayment");
            return distributeRepayment(tokenId, payer, partialAmount, fullAmount, "distributePartialRepayment");
        });
    }

    public BigInteger claimUnclaimedRemainder(int tokenId) {
        return invoke("claimUnclaimedRemainder", () -> {
            abortIfUnknownTokenClass(tokenId, "claimUnclaimedRemainder");
            return claimRemainder(tokenId, "claimUnclaimedRemainder");
        });
    }
    //endregion REPAYMENTS

    //region RESTRICTIONS

    public void setLockupEndTimestamp(int tokenId, long timestamp) {
        invoke("setLockupEndTimestamp", () -> {
            abortIfUnknownTokenClass(tokenId, "setLockupEndTimestamp");
            setLockupEnd(tokenId, timestamp, "setLockupEndTimestamp");
        });
    }

    public void setMaxSharesPerInvestor(int tokenId, int bp) {
        invoke("setMaxSharesPerInvestor", () -> {
            abortIfUnknownTokenClass(tokenId, "setMaxSharesPerInvestor");
            setMaxShares(tokenId, bp, "setMaxSharesPerInvestor");
        });
    }

    public void setMinHoldingPeriod(int tokenId, long seconds) {
        invoke("setMinHoldingPeriod", () -> {
            abortIfUnknownTokenClass(tokenId, "setMinHoldingPeriod");
            setHoldingPeriod(tokenId, seconds, "setMinHoldingPeriod");
        });
    }

    public void pauseTransfers(int tokenId) {
        invoke("pauseTransfers", () -> {
            abortIfUnknownTokenClass(tokenId, "pauseTransfers");
            setPaused(tokenId, true, "pauseTransfers");
        });
    }

    public void unpauseTransfers(int tokenId) {
        invoke("unpauseTransfers", () -> {
            abortIfUnknownTokenClass(tokenId, "unpauseTransfers");
            setPaused(tokenId, false, "unpauseTransfers");
        });
    }

    public void setWhitelistEnabled(int tokenId, boolean enabled) {
        invoke("setWhitelistEnabled", () -> {
            abortIfUnknownTokenClass(tokenId, "setWhitelistEnabled");
            setListEnabled(tokenId, true, enabled, "setWhitelistEnabled");
        });
    }

    public void setBlacklistEnabled(int tokenId, boolean enabled) {
        invoke("setBlacklistEnabled", () -> {
            abortIfUnknownTokenClass(tokenId, "setBlacklistEnabled");
            setListEnabled(tokenId, false, enabled, "setBlacklistEnabled");
        });
    }

    public void setWhitelisted(int tokenId, Hash160 account, boolean whitelisted) {
        invoke("setWhitelisted", () -> {
            abortIfUnknownTokenClass(tokenId, "setWhitelisted");
            setListed(tokenId, account, true, whitelisted, "setWhitelisted");
        });
    }

    public void setBlacklisted(int tokenId, Hash160 account, boolean blacklisted) {
        invoke("setBlacklisted", () -> {
            abortIfUnknownTokenClass(tokenId, "setBlacklisted");
            setListed(tokenId, account, false, blacklisted, "setBlacklisted");
        });
    }

    public void updateTransferRestriction(int tokenId, int parameterId, BigInteger value) {
        invoke("updateTransferRestriction", () -> {
            abortIfUnknownTokenClass(tokenId, "updateTransferRestriction");
            updateRestriction(tokenId, parameterId, value, "updateTransferRestriction");
        });
    }
    //endregion RESTRICTIONS

    @Override
    protected boolean isShareClass(int tokenId) {
        return tokenId >= 1 && tokenId <= getTokenClassCount();
    }

    private void abortIfUnknownTokenClass(int tokenId, String method) {
        if (!isShareClass(tokenId))
            fireErrorAndAbort(ErrorCode.INVALID_ARGUMENT, "Unknown token class", method);
    }
}
