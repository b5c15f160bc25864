package com.axlabs.neo.yieldshares.governance.power;

import com.axlabs.neo.yieldshares.ContractException;
import com.axlabs.neo.yieldshares.ErrorCode;
import com.axlabs.neo.yieldshares.ledger.Holding;
import com.axlabs.neo.yieldshares.ledger.YieldSharesToken;
import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves agreements to their own {@link YieldSharesToken}. Ledgers are registered at deployment time.
 */
public class PerAgreementLedgerAdapter implements ShareLedgerAdapter {

    private final Map<Integer, YieldSharesToken> ledgers = new HashMap<>();

    public void register(int agreementId, YieldSharesToken token) {
        ledgers.put(agreementId, token);
    }

    public YieldSharesToken getLedger(int agreementId) {
        return ledgers.get(agreementId);
    }

    @Override
    public BigInteger balanceOf(Hash160 voter, int agreementId) {
        YieldSharesToken token = ledgers.get(agreementId);
        return token == null ? BigInteger.ZERO : token.balanceOf(voter);
    }

    @Override
    public BigInteger totalSupply(int agreementId) {
        YieldSharesToken token = ledgers.get(agreementId);
        return token == null ? BigInteger.ZERO : token.totalSupply();
    }

    @Override
    public BigInteger balanceOfAt(Hash160 voter, int agreementId, long time) {
        YieldSharesToken token = ledgers.get(agreementId);
        return token == null ? BigInteger.ZERO : token.balanceOfAt(voter, time);
    }

    @Override
    public BigInteger totalSupplyAt(int agreementId, long time) {
        YieldSharesToken token = ledgers.get(agreementId);
        return token == null ? BigInteger.ZERO : token.totalSupplyAt(time);
    }

    @Override
    public List<Holding> getHoldings(int agreementId) {
        YieldSharesToken token = ledgers.get(agreementId);
        return token == null ? Collections.emptyList() : token.getHoldings();
    }

    @Override
    public void updateTransferRestriction(int agreementId, int parameterId, BigInteger value) {
        YieldSharesToken token = ledgers.get(agreementId);
        if (token == null) {
            throw new ContractException(ErrorCode.AGREEMENT_NOT_FOUND,
                    "PerAgreementLedgerAdapter.updateTransferRestriction", "No ledger for agreement " + agreementId);
        }
        token.updateTransferRestriction(parameterId, value);
    }
}
