package com.axlabs.neo.yieldshares.ledger;

import com.axlabs.neo.yieldshares.ContractException;
import com.axlabs.neo.yieldshares.ErrorCode;
import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pro-rata allocation of amounts over shareholder balances.
 * <p>
 * Every holder receives {@code floor(amount * balance / totalShares)}. What is left after rounding down goes to
 * the holder with the largest balance, the first one encountered if several hold the same amount.
 */
public final class DistributionEngine {

    static final BigInteger BASIS_POINTS = BigInteger.valueOf(10_000);

    private DistributionEngine() {
    }

    public static Distribution allocate(BigInteger amount, List<Holding> holdings, BigInteger totalShares) {
        return allocate(amount, amount, holdings, totalShares);
    }

    /**
     * Allocates a partial payment. The per-holder shares are calculated from the partial amount alone, the full
     * amount is only carried along on the result.
     *
     * @param partialAmount The amount actually paid.
     * @param fullAmount    The full payment the partial payment belongs to.
     * @param holdings      The holder balances.
     * @param totalShares   The total shares of the ledger.
     * @return the distribution of the partial amount.
     */
    public static Distribution allocatePartial(BigInteger partialAmount, BigInteger fullAmount,
            List<Holding> holdings, BigInteger totalShares) {
        if (partialAmount.compareTo(fullAmount) > 0) {
            throw new ContractException(ErrorCode.INVALID_ARGUMENT, "DistributionEngine.allocatePartial",
                    "Partial amount exceeds full amount");
        }
        return allocate(partialAmount, fullAmount, holdings, totalShares);
    }

    private static Distribution allocate(BigInteger amount, BigInteger referenceAmount, List<Holding> holdings,
            BigInteger totalShares) {
        if (amount.signum() < 0) {
            throw new ContractException(ErrorCode.INVALID_ARGUMENT, "DistributionEngine.allocate",
                    "Negative amount");
        }
        Map<Hash160, BigInteger> shares = new LinkedHashMap<>();
        if (totalShares.signum() == 0 || holdings.isEmpty()) {
            return new Distribution(amount, referenceAmount, shares, amount, null);
        }
        BigInteger distributed = BigInteger.ZERO;
        Holding largest = null;
        for (Holding h : holdings) {
            BigInteger share = amount.multiply(h.getBalance()).divide(totalShares);
            shares.put(h.getAccount(), share);
            distributed = distributed.add(share);
            if (largest == null || h.getBalance().compareTo(largest.getBalance()) > 0) {
                largest = h;
            }
        }
        return new Distribution(amount, referenceAmount, shares, amount.subtract(distributed),
                largest.getAccount());
    }

    /**
     * Allocates pooled capital, tolerating a deviation of the contributed sum from the required capital. Shares
     * are minted 1:1 with the required capital, split pro-rata by contribution.
     *
     * @param contributions The contributed capital per contributor.
     * @param required      The capital the agreement requires.
     * @param toleranceBP   The accepted deviation, in basis points of the required capital.
     * @return the shares per contributor, summing up to {@code required}.
     */
    public static Distribution allocatePool(Map<Hash160, BigInteger> contributions, BigInteger required,
            int toleranceBP) {
        BigInteger sum = sumOf(contributions);
        BigInteger tolerance = required.multiply(BigInteger.valueOf(toleranceBP)).divide(BASIS_POINTS);
        if (sum.subtract(required).abs().compareTo(tolerance) > 0) {
            throw new ContractException(ErrorCode.POOLED_CAPITAL_MISMATCH, "DistributionEngine.allocatePool",
                    "Contributions outside of tolerance");
        }
        return allocate(required, toHoldings(contributions), sum);
    }

    /**
     * Allocates pooled capital that has to match the required capital exactly. Every contributor gets exactly
     * as many shares as it contributed.
     *
     * @param contributions The contributed capital per contributor.
     * @param required      The capital the agreement requires.
     * @return the shares per contributor.
     */
    public static Distribution allocatePoolExact(Map<Hash160, BigInteger> contributions, BigInteger required) {
        BigInteger sum = sumOf(contributions);
        if (sum.compareTo(required) != 0) {
            throw new ContractException(ErrorCode.POOLED_CAPITAL_MISMATCH, "DistributionEngine.allocatePoolExact",
                    "Contributions don't match required capital");
        }
        return allocate(required, toHoldings(contributions), sum);
    }

    private static BigInteger sumOf(Map<Hash160, BigInteger> contributions) {
        if (contributions.isEmpty()) {
            throw new ContractException(ErrorCode.INVALID_ARGUMENT, "DistributionEngine.allocatePool",
                    "No contributors");
        }
        BigInteger sum = BigInteger.ZERO;
        for (BigInteger c : contributions.values()) {
            if (c.signum() <= 0) {
                throw new ContractException(ErrorCode.INVALID_ARGUMENT, "DistributionEngine.allocatePool",
                        "Invalid contribution");
            }
            sum = sum.add(c);
        }
        return sum;
    }

    private static List<Holding> toHoldings(Map<Hash160, BigInteger> contributions) {
        List<Holding> holdings = new ArrayList<>();
        contributions.forEach((account, amount) -> holdings.add(new Holding(account, amount)));
        return holdings;
    }
}
