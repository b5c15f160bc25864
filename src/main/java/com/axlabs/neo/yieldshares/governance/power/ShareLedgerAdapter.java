package com.axlabs.neo.yieldshares.governance.power;

import com.axlabs.neo.yieldshares.ledger.Holding;

import java.math.BigInteger;
import java.util.List;

/**
 * The view governance has on the share ledgers: voting power plus the holder set for distributions and the
 * transfer restriction setter for restriction proposals.
 */
public interface ShareLedgerAdapter extends VotingPowerSource {

    /**
     * @return the current holdings of the agreement's ledger. Empty if no ledger is configured.
     */
    List<Holding> getHoldings(int agreementId);

    /**
     * Changes a transfer restriction of the agreement's ledger.
     *
     * @throws com.axlabs.neo.yieldshares.ContractException if no ledger is configured for the agreement or the
     *                                                      ledger rejects the change.
     */
    void updateTransferRestriction(int agreementId, int parameterId, BigInteger value);
}
