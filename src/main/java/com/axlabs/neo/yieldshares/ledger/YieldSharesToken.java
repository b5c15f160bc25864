package com.axlabs.neo.yieldshares.ledger;

import com.axlabs.neo.yieldshares.restriction.ValidationResult;
import com.axlabs.neo.yieldshares.runtime.Runtime;
import com.axlabs.neo.yieldshares.token.SettlementToken;
import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * The share token of a single yield agreement. Each agreement gets its own instance.
 */
public class YieldSharesToken extends ShareToken {

    static final int SHARE_CLASS = 0;

    private final int agreementId;

    public YieldSharesToken(Runtime runtime, int agreementId, Hash160 owner, SettlementToken paymentToken,
            int maxShareholders, int poolingToleranceBP) {
        super(runtime, "YieldSharesToken#" + agreementId, owner, paymentToken, maxShareholders, poolingToleranceBP);
        this.agreementId = agreementId;
    }

    public int getAgreementId() {
        return agreementId;
    }

    //region READ

    public BigInteger balanceOf(Hash160 account) {
        return ledger(SHARE_CLASS).balanceOf(account);
    }

    public BigInteger totalSupply() {
        return ledger(SHARE_CLASS).totalShares();
    }

    public BigInteger balanceOfAt(Hash160 account, long time) {
        return ledger(SHARE_CLASS).balanceAt(account, time);
    }

    public BigInteger totalSupplyAt(long time) {
        return ledger(SHARE_CLASS).totalSharesAt(time);
    }

    public int getShareholderCount() {
        return ledger(SHARE_CLASS).shareholderCount();
    }

    public List<Hash160> getShareholders() {
        return ledger(SHARE_CLASS).getShareholders();
    }

    public List<Holding> getHoldings() {
        return ledger(SHARE_CLASS).getHoldings();
    }

    public BigInteger unclaimedRemainderOf(Hash160 account) {
        return ledger(SHARE_CLASS).unclaimedOf(account);
    }

    public long getLockupEndTimestamp() {
        return restrictions(SHARE_CLASS).getLockupEndTimestamp();
    }

    public int getMaxSharesPerInvestorBP() {
        return restrictions(SHARE_CLASS).getMaxSharesPerInvestorBP();
    }

    public long getMinHoldingPeriod() {
        return restrictions(SHARE_CLASS).getMinHoldingPeriod();
    }

    public boolean isTransferPaused() {
        return restrictions(SHARE_CLASS).isTransferPaused();
    }

    public long getLastTransferTimestamp(Hash160 account) {
        return restrictions(SHARE_CLASS).getLastTransferTimestamp(account);
    }
    //endregion READ

    //region SHARES

    public void mint(Hash160 to, BigInteger amount) {
        invoke("mint", () -> mintShares(SHARE_CLASS, to, amount, "mint"));
    }

    public void burn(Hash160 from, BigInteger amount) {
        invoke("burn", () -> burnShares(SHARE_CLASS, from, amount, "burn"));
    }

    public void mintPooled(Map<Hash160, BigInteger> contributions, BigInteger requiredCapital) {
        invoke("mintPooled", () -> mintPooledShares(SHARE_CLASS, contributions, requiredCapital, false,
                "mintPooled"));
    }

    public void mintPooledExact(Map<Hash160, BigInteger> contributions, BigInteger requiredCapital) {
        invoke("mintPooledExact", () -> mintPooledShares(SHARE_CLASS, contributions, requiredCapital, true,
                "mintPooledExact"));
    }

    /**
     * Transfers shares between two holders. The transfer has to be witnessed by {@code from} and pass the
     * transfer restrictions.
     *
     * @param from   The sender.
     * @param to     The recipient.
     * @param amount The amount of shares.
     */
    public void transfer(Hash160 from, Hash160 to, BigInteger amount) {
        invoke("transfer", () -> transferShares(SHARE_CLASS, from, to, amount, "transfer"));
    }

    public ValidationResult canTransfer(Hash160 from, Hash160 to, BigInteger amount) {
        return checkTransfer(SHARE_CLASS, from, to, amount);
    }
    //endregion SHARES

    //region REPAYMENTS

    public Distribution distributeRepayment(Hash160 payer, BigInteger amount) {
        return invoke("distributeRepayment",
                () -> distributeRepayment(SHARE_CLASS, payer, amount, amount, "distributeRepayment"));
    }

    public Distribution distributePartialRepayment(Hash160 payer, BigInteger partialAmount, BigInteger fullAmount) {
        return invoke("distributePartialRepayment", () -> distributeRepayment(SHARE_CLASS, payer, partialAmount,
                fullAmount, "distributePartialRepayment"));
    }

    public BigInteger claimUnclaimedRemainder() {
        return invoke("claimUnclaimedRemainder", () -> claimRemainder(SHARE_CLASS, "claimUnclaimedRemainder"));
    }
    //endregion REPAYMENTS

    //region RESTRICTIONS

    public void setLockupEndTimestamp(long timestamp) {
        invoke("setLockupEndTimestamp", () -> setLockupEnd(SHARE_CLASS, timestamp, "setLockupEndTimestamp"));
    }

    public void setMaxSharesPerInvestor(int bp) {
        invoke("setMaxSharesPerInvestor", () -> setMaxShares(SHARE_CLASS, bp, "setMaxSharesPerInvestor"));
    }

    public void setMinHoldingPeriod(long seconds) {
        invoke("setMinHoldingPeriod", () -> setHoldingPeriod(SHARE_CLASS, seconds, "setMinHoldingPeriod"));
    }

    public void pauseTransfers() {
        invoke("pauseTransfers", () -> setPaused(SHARE_CLASS, true, "pauseTransfers"));
    }

    public void unpauseTransfers() {
        invoke("unpauseTransfers", () -> setPaused(SHARE_CLASS, false, "unpauseTransfers"));
    }

    public void setWhitelistEnabled(boolean enabled) {
        invoke("setWhitelistEnabled", () -> setListEnabled(SHARE_CLASS, true, enabled, "setWhitelistEnabled"));
    }

    public void setBlacklistEnabled(boolean enabled) {
        invoke("setBlacklistEnabled", () -> setListEnabled(SHARE_CLASS, false, enabled, "setBlacklistEnabled"));
    }

    public void setWhitelisted(Hash160 account, boolean whitelisted) {
        invoke("setWhitelisted", () -> setListed(SHARE_CLASS, account, true, whitelisted, "setWhitelisted"));
    }

    public void setBlacklisted(Hash160 account, boolean blacklisted) {
        invoke("setBlacklisted", () -> setListed(SHARE_CLASS, account, false, blacklisted, "setBlacklisted"));
    }

    public void updateTransferRestriction(int parameterId, BigInteger value) {
        invoke("updateTransferRestriction", () -> updateRestriction(SHARE_CLASS, parameterId, value,
                "updateTransferRestriction"));
    }
    //endregion RESTRICTIONS
}
