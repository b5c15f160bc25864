package com.axlabs.neo.yieldshares.restriction;

import com.axlabs.neo.yieldshares.kyc.KycRegistry;
import com.axlabs.neo.yieldshares.ledger.ShareholderLedger;
import io.neow3j.types.Hash160;

import java.math.BigInteger;

/**
 * Decides whether shares may move from one holder to another.
 * <p>
 * The checks run in a fixed order and the first failing check determines the reason. Minting and burning, i.e.,
 * a transfer from or to {@link Hash160#ZERO}, is not restricted.
 */
public class TransferRestrictionValidator {

    static final BigInteger BASIS_POINTS = BigInteger.valueOf(10_000);

    public static final String TRANSFERS_PAUSED = "Transfers are paused";
    public static final String LOCKUP_ACTIVE = "Lockup period active";
    public static final String HOLDING_PERIOD_NOT_MET = "Minimum holding period not met";
    public static final String MAX_SHARES_EXCEEDED = "Exceeds max shares per investor";
    public static final String RECIPIENT_NOT_WHITELISTED = "Recipient not whitelisted";
    public static final String RECIPIENT_BLACKLISTED = "Recipient blacklisted";
    public static final String SENDER_BLACKLISTED = "Sender blacklisted";
    public static final String RECIPIENT_NOT_KYC_VERIFIED = "Recipient not KYC verified";
    public static final String RECIPIENT_KYC_BLACKLISTED = "Recipient KYC blacklisted";
    public static final String SENDER_KYC_BLACKLISTED = "Sender KYC blacklisted";

    private final TransferRestrictions restrictions;
    private final ShareholderLedger ledger;

    public TransferRestrictionValidator(TransferRestrictions restrictions, ShareholderLedger ledger) {
        this.restrictions = restrictions;
        this.ledger = ledger;
    }

    /**
     * Checks a transfer of {@code amount} shares from {@code from} to {@code to}.
     *
     * @param from   The sender.
     * @param to     The recipient.
     * @param amount The amount of shares.
     * @param kyc    The KYC registry gating transfers, or null if none is attached.
     * @param now    The current time.
     * @return the validation result.
     */
    public ValidationResult validate(Hash160 from, Hash160 to, BigInteger amount, KycRegistry kyc, long now) {
        if (isMintOrBurn(from, to)) {
            return ValidationResult.allowed();
        }
        if (kyc != null) {
            ValidationResult kycResult = validateKyc(from, to, kyc);
            if (!kycResult.isAllowed()) {
                return kycResult;
            }
        }
        return validateRestrictions(from, to, amount, now);
    }

    public static boolean isMintOrBurn(Hash160 from, Hash160 to) {
        return from == null || to == null || Hash160.ZERO.equals(from) || Hash160.ZERO.equals(to);
    }

    private ValidationResult validateKyc(Hash160 from, Hash160 to, KycRegistry kyc) {
        if (!kyc.isWhitelisted(to)) return ValidationResult.rejected(RECIPIENT_NOT_KYC_VERIFIED);
        if (kyc.isBlacklisted(to)) return ValidationResult.rejected(RECIPIENT_KYC_BLACKLISTED);
        if (kyc.isBlacklisted(from)) return ValidationResult.rejected(SENDER_KYC_BLACKLISTED);
        return ValidationResult.allowed();
    }

    private ValidationResult validateRestrictions(Hash160 from, Hash160 to, BigInteger amount, long now) {
        if (restrictions.isTransferPaused()) {
            return ValidationResult.rejected(TRANSFERS_PAUSED);
        }
        long lockupEnd = restrictions.getLockupEndTimestamp();
        if (lockupEnd != 0 && now < lockupEnd) {
            return ValidationResult.rejected(LOCKUP_ACTIVE);
        }
        long holdingPeriod = restrictions.getMinHoldingPeriod();
        long lastInbound = restrictions.getLastTransferTimestamp(from);
        if (holdingPeriod != 0 && lastInbound != 0 && now < lastInbound + holdingPeriod) {
            return ValidationResult.rejected(HOLDING_PERIOD_NOT_MET);
        }
        int maxSharesBP = restrictions.getMaxSharesPerInvestorBP();
        if (maxSharesBP != 0) {
            BigInteger total = ledger.totalShares();
            BigInteger after = ledger.balanceOf(to).add(amount);
            if (after.multiply(BASIS_POINTS).compareTo(total.multiply(BigInteger.valueOf(maxSharesBP))) > 0) {
                return ValidationResult.rejected(MAX_SHARES_EXCEEDED);
            }
        }
        if (restrictions.isWhitelistEnabled() && !restrictions.isWhitelisted(to)) {
            return ValidationResult.rejected(RECIPIENT_NOT_WHITELISTED);
        }
        if (restrictions.isBlacklistEnabled()) {
            if (restrictions.isBlacklisted(to)) return ValidationResult.rejected(RECIPIENT_BLACKLISTED);
            if (restrictions.isBlacklisted(from)) return ValidationResult.rejected(SENDER_BLACKLISTED);
        }
        return ValidationResult.allowed();
    }
}
