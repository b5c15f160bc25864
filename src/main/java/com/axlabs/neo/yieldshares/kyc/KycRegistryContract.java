package com.axlabs.neo.yieldshares.kyc;

import com.axlabs.neo.yieldshares.ErrorCode;
import com.axlabs.neo.yieldshares.runtime.Runtime;
import com.axlabs.neo.yieldshares.runtime.SmartContract;
import com.axlabs.neo.yieldshares.runtime.StorageMap;
import io.neow3j.types.Hash160;

import java.util.List;

/**
 * Keeps the identity verification state of accounts.
 * <p>
 * Whitelist membership is managed by the owner or the governance contract. The blacklist and the tier labels are
 * managed by the owner only.
 */
public class KycRegistryContract extends SmartContract implements KycRegistry {

    //region EVENTS
    public static final String WHITELISTED = "Whitelisted";
    public static final String UNWHITELISTED = "Unwhitelisted";
    public static final String BLACKLISTED = "Blacklisted";
    public static final String UNBLACKLISTED = "Unblacklisted";
    //endregion EVENTS

    static final String OWNER_KEY = "owner";
    static final String GOVERNANCE_KEY = "governance";
    static final String WHITELIST_ENABLED_KEY = "whitelistEnabled";
    static final String BLACKLIST_ENABLED_KEY = "blacklistEnabled";

    private final StorageMap properties = storageMap("properties");
    private final StorageMap whitelist = storageMap("whitelist"); // [Hash160 account: Boolean]
    private final StorageMap blacklist = storageMap("blacklist"); // [Hash160 account: Boolean]
    private final StorageMap tiers = storageMap("tiers"); // [Hash160 account: String tier]

    public KycRegistryContract(Runtime runtime, String name, Hash160 owner) {
        super(runtime, name);
        properties.put(OWNER_KEY, owner);
        properties.put(WHITELIST_ENABLED_KEY, true);
        properties.put(BLACKLIST_ENABLED_KEY, true);
    }

    public Hash160 getOwner() {
        return properties.get(OWNER_KEY, Hash160.class);
    }

    public Hash160 getGovernance() {
        return properties.get(GOVERNANCE_KEY, Hash160.class);
    }

    public void setGovernance(Hash160 governance) {
        invoke("setGovernance", () -> {
            abortIfNotOwner("setGovernance");
            properties.put(GOVERNANCE_KEY, governance);
        });
    }

    public boolean isWhitelistEnabled() {
        return properties.getBoolean(WHITELIST_ENABLED_KEY);
    }

    public boolean isBlacklistEnabled() {
        return properties.getBoolean(BLACKLIST_ENABLED_KEY);
    }

    public void setWhitelistEnabled(boolean enabled) {
        invoke("setWhitelistEnabled", () -> {
            abortIfNotOwner("setWhitelistEnabled");
            properties.put(WHITELIST_ENABLED_KEY, enabled);
        });
    }

    public void setBlacklistEnabled(boolean enabled) {
        invoke("setBlacklistEnabled", () -> {
            abortIfNotOwner("setBlacklistEnabled");
            properties.put(BLACKLIST_ENABLED_KEY, enabled);
        });
    }

    @Override
    public boolean isWhitelisted(Hash160 account) {
        return !isWhitelistEnabled() || whitelist.getBoolean(account);
    }

    @Override
    public boolean isBlacklisted(Hash160 account) {
        return isBlacklistEnabled() && blacklist.getBoolean(account);
    }

    /**
     * Adds the account to the whitelist. Fails if it is already whitelisted.
     *
     * @param account The account.
     */
    @Override
    public void addToWhitelist(Hash160 account) {
        invoke("addToWhitelist", () -> {
            abortIfNotOwnerOrGovernance("addToWhitelist");
            if (whitelist.getBoolean(account))
                fireErrorAndAbort(ErrorCode.ALREADY_WHITELISTED, "Already whitelisted", "addToWhitelist");
            whitelist.put(account, true);
            fire(WHITELISTED, account);
        });
    }

    /**
     * Removes the account from the whitelist. Fails if it is not whitelisted.
     *
     * @param account The account.
     */
    @Override
    public void removeFromWhitelist(Hash160 account) {
        invoke("removeFromWhitelist", () -> {
            abortIfNotOwnerOrGovernance("removeFromWhitelist");
            if (!whitelist.getBoolean(account))
                fireErrorAndAbort(ErrorCode.NOT_WHITELISTED, "Not whitelisted", "removeFromWhitelist");
            whitelist.delete(account);
            tiers.delete(account);
            fire(UNWHITELISTED, account);
        });
    }

    /**
     * Whitelists all given accounts, skipping the ones that are already whitelisted.
     *
     * @param accounts The accounts.
     */
    @Override
    public void batchAddToWhitelist(List<Hash160> accounts) {
        invoke("batchAddToWhitelist", () -> {
            abortIfNotOwnerOrGovernance("batchAddToWhitelist");
            for (Hash160 account : accounts) {
                if (!whitelist.getBoolean(account)) {
                    whitelist.put(account, true);
                    fire(WHITELISTED, account);
                }
            }
        });
    }

    /**
     * Removes all given accounts from the whitelist, skipping the ones that are not whitelisted.
     *
     * @param accounts The accounts.
     */
    @Override
    public void batchRemoveFromWhitelist(List<Hash160> accounts) {
        invoke("batchRemoveFromWhitelist", () -> {
            abortIfNotOwnerOrGovernance("batchRemoveFromWhitelist");
            for (Hash160 account : accounts) {
                if (whitelist.getBoolean(account)) {
                    whitelist.delete(account);
                    tiers.delete(account);
                    fire(UNWHITELISTED, account);
                }
            }
        });
    }

    public void addToBlacklist(Hash160 account) {
        invoke("addToBlacklist", () -> {
            abortIfNotOwner("addToBlacklist");
            blacklist.put(account, true);
            fire(BLACKLISTED, account);
        });
    }

    public void removeFromBlacklist(Hash160 account) {
        invoke("removeFromBlacklist", () -> {
            abortIfNotOwner("removeFromBlacklist");
            blacklist.delete(account);
            fire(UNBLACKLISTED, account);
        });
    }

    /**
     * Labels a whitelisted account with a verification tier, e.g., "basic" or "accredited".
     *
     * @param account The whitelisted account.
     * @param tier    The tier label.
     */
    public void setTier(Hash160 account, String tier) {
        invoke("setTier", () -> {
            abortIfNotOwner("setTier");
            if (!whitelist.getBoolean(account))
                fireErrorAndAbort(ErrorCode.NOT_WHITELISTED, "Not whitelisted", "setTier");
            tiers.put(account, tier);
        });
    }

    /**
     * @return the tier label of the account, or null if it has none.
     */
    public String getTier(Hash160 account) {
        return tiers.get(account, String.class);
    }

    private void abortIfNotOwner(String method) {
        if (!runtime.checkWitness(getOwner())) fireErrorAndAbort(ErrorCode.UNAUTHORIZED, "Not authorised", method);
    }

    private void abortIfNotOwnerOrGovernance(String method) {
        Hash160 governance = getGovernance();
        boolean byGovernance = governance != null && governance.equals(getCallingScriptHash());
        if (!byGovernance && !runtime.checkWitness(getOwner()))
            fireErrorAndAbort(ErrorCode.UNAUTHORIZED, "Not authorised", method);
    }
}
