package com.axlabs.neo.yieldshares.ledger;

import com.axlabs.neo.yieldshares.ContractException;
import com.axlabs.neo.yieldshares.ErrorCode;
import com.axlabs.neo.yieldshares.runtime.Runtime;
import com.axlabs.neo.yieldshares.runtime.StorageContext;
import com.axlabs.neo.yieldshares.runtime.StorageMap;
import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * The registry of shareholders and their balances for one yield agreement.
 * <p>
 * Holders are kept in an index-addressed list next to a membership flag, so that membership checks are O(1) and
 * iteration touches holders only. A holder whose balance drops to zero is removed by moving the last holder into
 * its slot. The sum of all balances always equals {@link #totalShares()}.
 */
public class ShareholderLedger {

    static final String TOTAL_SHARES_KEY = "totalShares";
    static final String COUNT_KEY = "count";
    private static final String TOTAL_CHECKPOINTS = "total";

    private final Runtime runtime;
    private final int maxShareholders;

    private final StorageMap properties;
    private final StorageMap balances; // [Hash160 account: BigInteger balance]
    private final StorageMap members; // [Hash160 account: Boolean]
    private final StorageMap holders; // [int index: Hash160 account]
    private final StorageMap holderIndex; // [Hash160 account: Integer index]
    private final StorageMap unclaimed; // [Hash160 account: BigInteger remainder]
    private final StorageMap checkpointCounts; // [Hash160 account | "total": Integer count]
    private final StorageMap checkpoints; // [account#i: Checkpoint]

    public ShareholderLedger(Runtime runtime, String namespace, int maxShareholders) {
        this.runtime = runtime;
        this.maxShareholders = maxShareholders;
        StorageContext ctx = runtime.getStorageContext();
        properties = new StorageMap(ctx, namespace + ".ledger");
        balances = new StorageMap(ctx, namespace + ".balances");
        members = new StorageMap(ctx, namespace + ".members");
        holders = new StorageMap(ctx, namespace + ".holders");
        holderIndex = new StorageMap(ctx, namespace + ".holderIndex");
        unclaimed = new StorageMap(ctx, namespace + ".unclaimed");
        checkpointCounts = new StorageMap(ctx, namespace + ".checkpointCounts");
        checkpoints = new StorageMap(ctx, namespace + ".checkpoints");
    }

    public int getMaxShareholders() {
        return maxShareholders;
    }

    public BigInteger totalShares() {
        return properties.getIntOrZero(TOTAL_SHARES_KEY);
    }

    public int shareholderCount() {
        Integer count = properties.get(COUNT_KEY, Integer.class);
        return count == null ? 0 : count;
    }

    public BigInteger balanceOf(Hash160 account) {
        return balances.getIntOrZero(account);
    }

    public boolean isShareholder(Hash160 account) {
        return members.getBoolean(account);
    }

    /**
     * Returns the current holders. The order is not stable across balance changes.
     *
     * @return the shareholder accounts.
     */
    public List<Hash160> getShareholders() {
        int n = shareholderCount();
        List<Hash160> list = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            list.add(holders.get(i, Hash160.class));
        }
        return list;
    }

    /**
     * @return a snapshot of all non-zero balances in holder-list order.
     */
    public List<Holding> getHoldings() {
        List<Holding> holdings = new ArrayList<>();
        for (Hash160 account : getShareholders()) {
            holdings.add(new Holding(account, balanceOf(account)));
        }
        return holdings;
    }

    /**
     * Increases the balance of {@code account}. Adding a new holder fails if the ledger is already at its
     * shareholder limit.
     *
     * @param account The account to credit.
     * @param amount  The amount of shares.
     */
    public void credit(Hash160 account, BigInteger amount) {
        if (amount.signum() < 0) {
            throw new ContractException(ErrorCode.INVALID_ARGUMENT, "ShareholderLedger.credit", "Negative amount");
        }
        if (amount.signum() == 0) {
            return;
        }
        if (!isShareholder(account)) {
            int count = shareholderCount();
            if (count + 1 > maxShareholders) {
                throw new ContractException(ErrorCode.MAX_SHAREHOLDERS_EXCEEDED, "ShareholderLedger.credit",
                        "Max shareholders reached");
            }
            members.put(account, true);
            holders.put(count, account);
            holderIndex.put(account, count);
            properties.put(COUNT_KEY, count + 1);
        }
        setBalance(account, balanceOf(account).add(amount));
        setTotalShares(totalShares().add(amount));
    }

    /**
     * Decreases the balance of {@code account}. A holder whose balance reaches zero is removed from the registry.
     *
     * @param account The account to debit.
     * @param amount  The amount of shares.
     */
    public void debit(Hash160 account, BigInteger amount) {
        if (amount.signum() < 0) {
            throw new ContractException(ErrorCode.INVALID_ARGUMENT, "ShareholderLedger.debit", "Negative amount");
        }
        BigInteger balance = balanceOf(account);
        if (balance.compareTo(amount) < 0) {
            throw new ContractException(ErrorCode.INSUFFICIENT_BALANCE, "ShareholderLedger.debit",
                    "Insufficient balance");
        }
        if (amount.signum() == 0) {
            return;
        }
        BigInteger newBalance = balance.subtract(amount);
        setBalance(account, newBalance);
        setTotalShares(totalShares().subtract(amount));
        if (newBalance.signum() == 0) {
            removeHolder(account);
        }
    }

    /**
     * Moves shares between two holders. The recipient is credited before the sender is debited, so moving a
     * sender's whole balance to a new holder needs a free slot in the registry.
     */
    public void move(Hash160 from, Hash160 to, BigInteger amount) {
        if (balanceOf(from).compareTo(amount) < 0) {
            throw new ContractException(ErrorCode.INSUFFICIENT_BALANCE, "ShareholderLedger.move",
                    "Insufficient balance");
        }
        credit(to, amount);
        debit(from, amount);
    }

    private void removeHolder(Hash160 account) {
        int index = holderIndex.get(account, Integer.class);
        int last = shareholderCount() - 1;
        if (index != last) {
            Hash160 moved = holders.get(last, Hash160.class);
            holders.put(index, moved);
            holderIndex.put(moved, index);
        }
        holders.delete(last);
        holderIndex.delete(account);
        members.delete(account);
        properties.put(COUNT_KEY, last);
    }

    private void setBalance(Hash160 account, BigInteger balance) {
        if (balance.signum() == 0) {
            balances.delete(account);
        } else {
            balances.put(account, balance);
        }
        writeCheckpoint(account.toString(), balance);
    }

    private void setTotalShares(BigInteger total) {
        properties.put(TOTAL_SHARES_KEY, total);
        writeCheckpoint(TOTAL_CHECKPOINTS, total);
    }

    //region UNCLAIMED REMAINDERS

    public BigInteger unclaimedOf(Hash160 account) {
        return unclaimed.getIntOrZero(account);
    }

    public void addUnclaimed(Hash160 account, BigInteger amount) {
        unclaimed.put(account, unclaimedOf(account).add(amount));
    }

    /**
     * Clears the unclaimed remainder of {@code account}.
     *
     * @return the amount that was owed.
     */
    public BigInteger takeUnclaimed(Hash160 account) {
        BigInteger owed = unclaimedOf(account);
        unclaimed.delete(account);
        return owed;
    }
    //endregion UNCLAIMED REMAINDERS

    //region CHECKPOINTS

    public BigInteger balanceAt(Hash160 account, long time) {
        return valueAt(account.toString(), time);
    }

    public BigInteger totalSharesAt(long time) {
        return valueAt(TOTAL_CHECKPOINTS, time);
    }

    private void writeCheckpoint(String owner, BigInteger value) {
        int n = checkpointCount(owner);
        long now = runtime.getTime();
        if (n > 0 && checkpoints.get(owner + "#" + (n - 1), Checkpoint.class).time == now) {
            checkpoints.put(owner + "#" + (n - 1), new Checkpoint(now, value));
            return;
        }
        checkpoints.put(owner + "#" + n, new Checkpoint(now, value));
        checkpointCounts.put(owner, n + 1);
    }

    private int checkpointCount(String owner) {
        Integer n = checkpointCounts.get(owner, Integer.class);
        return n == null ? 0 : n;
    }

    // Last checkpoint at or before the given time.
    private BigInteger valueAt(String owner, long time) {
        int low = 0;
        int high = checkpointCount(owner);
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (checkpoints.get(owner + "#" + mid, Checkpoint.class).time <= time) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low == 0 ? BigInteger.ZERO : checkpoints.get(owner + "#" + (low - 1), Checkpoint.class).value;
    }
    //endregion CHECKPOINTS
}
