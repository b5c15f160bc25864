package com.axlabs.neo.yieldshares.restriction;

import com.axlabs.neo.yieldshares.runtime.StorageContext;
import com.axlabs.neo.yieldshares.runtime.StorageMap;
import io.neow3j.types.Hash160;

/**
 * The transfer restriction parameters of one share ledger.
 * <p>
 * Zero disables the lockup, the concentration limit and the holding period. The whitelist and blacklist held here
 * are local to the ledger and only consulted when the corresponding flag is enabled.
 */
public class TransferRestrictions {

    static final String LOCKUP_END_KEY = "lockupEnd";
    static final String MAX_SHARES_BP_KEY = "maxSharesBP";
    static final String MIN_HOLDING_PERIOD_KEY = "minHoldingPeriod";
    static final String PAUSED_KEY = "paused";
    static final String WHITELIST_ENABLED_KEY = "whitelistEnabled";
    static final String BLACKLIST_ENABLED_KEY = "blacklistEnabled";

    private final StorageMap params;
    private final StorageMap lastTransfer; // [Hash160 account: long timestamp]
    private final StorageMap whitelist;
    private final StorageMap blacklist;

    public TransferRestrictions(StorageContext ctx, String namespace) {
        params = new StorageMap(ctx, namespace + ".restrictions");
        lastTransfer = new StorageMap(ctx, namespace + ".lastTransfer");
        whitelist = new StorageMap(ctx, namespace + ".whitelist");
        blacklist = new StorageMap(ctx, namespace + ".blacklist");
    }

    public long getLockupEndTimestamp() {
        return params.getLongOrZero(LOCKUP_END_KEY);
    }

    public void setLockupEndTimestamp(long timestamp) {
        params.put(LOCKUP_END_KEY, timestamp);
    }

    public int getMaxSharesPerInvestorBP() {
        Integer bp = params.get(MAX_SHARES_BP_KEY, Integer.class);
        return bp == null ? 0 : bp;
    }

    public void setMaxSharesPerInvestorBP(int bp) {
        params.put(MAX_SHARES_BP_KEY, bp);
    }

    public long getMinHoldingPeriod() {
        return params.getLongOrZero(MIN_HOLDING_PERIOD_KEY);
    }

    public void setMinHoldingPeriod(long seconds) {
        params.put(MIN_HOLDING_PERIOD_KEY, seconds);
    }

    public boolean isTransferPaused() {
        return params.getBoolean(PAUSED_KEY);
    }

    public void setTransferPaused(boolean paused) {
        params.put(PAUSED_KEY, paused);
    }

    public boolean isWhitelistEnabled() {
        return params.getBoolean(WHITELIST_ENABLED_KEY);
    }

    public void setWhitelistEnabled(boolean enabled) {
        params.put(WHITELIST_ENABLED_KEY, enabled);
    }

    public boolean isBlacklistEnabled() {
        return params.getBoolean(BLACKLIST_ENABLED_KEY);
    }

    public void setBlacklistEnabled(boolean enabled) {
        params.put(BLACKLIST_ENABLED_KEY, enabled);
    }

    public boolean isWhitelisted(Hash160 account) {
        return whitelist.getBoolean(account);
    }

    public void setWhitelisted(Hash160 account, boolean whitelisted) {
        if (whitelisted) {
            whitelist.put(account, true);
        } else {
            whitelist.delete(account);
        }
    }

    public boolean isBlacklisted(Hash160 account) {
        return blacklist.getBoolean(account);
    }

    public void setBlacklisted(Hash160 account, boolean blacklisted) {
        if (blacklisted) {
            blacklist.put(account, true);
        } else {
            blacklist.delete(account);
        }
    }

    /**
     * @return the time of the last inbound transfer to {@code account}, or 0 if it never received any.
     */
    public long getLastTransferTimestamp(Hash160 account) {
        return lastTransfer.getLongOrZero(account);
    }

    public void recordInboundTransfer(Hash160 account, long timestamp) {
        lastTransfer.put(account, timestamp);
    }
}
