package com.axlabs.neo.yieldshares.kyc;

import io.neow3j.types.Hash160;

import java.util.List;

/**
 * Identity verification state consumed by the share ledgers and changed by governance.
 * <p>
 * The single-address mutators are strict toggles: adding an account that is already whitelisted, or removing one
 * that is not, fails. The batch mutators skip accounts that are already in the target state. Both behaviours are
 * part of the contract and callers may depend on either.
 */
public interface KycRegistry {

    /**
     * @return true if the account is whitelisted, or if the whitelist is disabled.
     */
    boolean isWhitelisted(Hash160 account);

    /**
     * @return true if the account is blacklisted and the blacklist is enabled.
     */
    boolean isBlacklisted(Hash160 account);

    void addToWhitelist(Hash160 account);

    void removeFromWhitelist(Hash160 account);

    void batchAddToWhitelist(List<Hash160> accounts);

    void batchRemoveFromWhitelist(List<Hash160> accounts);
}
