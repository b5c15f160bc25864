package com.axlabs.neo.yieldshares.ledger;

import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The result of allocating an amount over a set of holdings.
 */
public class Distribution {

    private final BigInteger amount;
    private final BigInteger referenceAmount;
    private final Map<Hash160, BigInteger> shares;
    private final BigInteger remainder;
    private final Hash160 remainderRecipient;

    Distribution(BigInteger amount, BigInteger referenceAmount, Map<Hash160, BigInteger> shares,
            BigInteger remainder, Hash160 remainderRecipient) {
        this.amount = amount;
        this.referenceAmount = referenceAmount;
        this.shares = Collections.unmodifiableMap(new LinkedHashMap<>(shares));
        this.remainder = remainder;
        this.remainderRecipient = remainderRecipient;
    }

    /**
     * @return the amount that was distributed.
     */
    public BigInteger getAmount() {
        return amount;
    }

    /**
     * @return the full payment amount a partial distribution refers to. Equal to {@link #getAmount()} for regular
     * distributions.
     */
    public BigInteger getReferenceAmount() {
        return referenceAmount;
    }

    /**
     * @return the pro-rata share of each holder, without the remainder.
     */
    public Map<Hash160, BigInteger> getShares() {
        return shares;
    }

    public BigInteger getRemainder() {
        return remainder;
    }

    /**
     * @return the holder that receives the remainder, or null if there are no holders.
     */
    public Hash160 getRemainderRecipient() {
        return remainderRecipient;
    }

    /**
     * Gets the total payout to {@code account}, i.e., its pro-rata share plus the remainder if it is the remainder
     * recipient.
     *
     * @param account The holder.
     * @return the payout.
     */
    public BigInteger payoutOf(Hash160 account) {
        BigInteger payout = shares.getOrDefault(account, BigInteger.ZERO);
        if (account.equals(remainderRecipient)) {
            payout = payout.add(remainder);
        }
        return payout;
    }

    /**
     * @return the payouts of all holders in allocation order, including the remainder.
     */
    public Map<Hash160, BigInteger> getPayouts() {
        Map<Hash160, BigInteger> payouts = new LinkedHashMap<>();
        for (Hash160 account : shares.keySet()) {
            payouts.put(account, payoutOf(account));
        }
        return payouts;
    }
}
