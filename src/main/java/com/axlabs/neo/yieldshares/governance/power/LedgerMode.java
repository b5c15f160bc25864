package com.axlabs.neo.yieldshares.governance.power;

/**
 * Selects how agreements map to share ledgers.
 */
public enum LedgerMode {

    /**
     * One {@link com.axlabs.neo.yieldshares.ledger.YieldSharesToken} per agreement.
     */
    SINGLE,

    /**
     * One {@link com.axlabs.neo.yieldshares.ledger.CombinedYieldToken} with a token class per agreement.
     */
    SHARED
}
