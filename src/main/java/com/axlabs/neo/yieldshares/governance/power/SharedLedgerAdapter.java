package com.axlabs.neo.yieldshares.governance.power;

import com.axlabs.neo.yieldshares.ContractException;
import com.axlabs.neo.yieldshares.ErrorCode;
import com.axlabs.neo.yieldshares.ledger.CombinedYieldToken;
import com.axlabs.neo.yieldshares.ledger.Holding;
import io.neow3j.types.Hash160;

import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves agreements to token classes of a shared {@link CombinedYieldToken}. Agreements without a mapped token
 * class have no voting power and no supply.
 */
public class SharedLedgerAdapter implements ShareLedgerAdapter {

    private CombinedYieldToken token;
    private final Map<Integer, Integer> tokenIds = new HashMap<>();

    public SharedLedgerAdapter() {
    }

    public SharedLedgerAdapter(CombinedYieldToken token) {
        this.token = token;
    }

    public void setLedger(CombinedYieldToken token) {
        this.token = token;
    }

    public void mapAgreement(int agreementId, int tokenId) {
        tokenIds.put(agreementId, tokenId);
    }

    /**
     * @return the token class of the agreement, or null if it is not mapped.
     */
    public Integer getTokenId(int agreementId) {
        return tokenIds.get(agreementId);
    }

    @Override
    public BigInteger balanceOf(Hash160 voter, int agreementId) {
        Integer tokenId = tokenIds.get(agreementId);
        return token == null || tokenId == null ? BigInteger.ZERO : token.balanceOf(voter, tokenId);
    }

    @Override
    public BigInteger totalSupply(int agreementId) {
        Integer tokenId = tokenIds.get(agreementId);
        return token == null || tokenId == null ? BigInteger.ZERO : token.totalSupply(tokenId);
    }

    @Override
    public BigInteger balanceOfAt(Hash160 voter, int agreementId, long time) {
        Integer tokenId = tokenIds.get(agreementId);
        return token == null || tokenId == null ? BigInteger.ZERO : token.balanceOfAt(voter, tokenId, time);
    }

    @Override
    public BigInteger totalSupplyAt(int agreementId, long time) {
        Integer tokenId = tokenIds.get(agreementId);
        return token == null || tokenId == null ? BigInteger.ZERO : token.totalSupplyAt(tokenId, time);
    }

    @Override
    public List<Holding> getHoldings(int agreementId) {
        Integer tokenId = tokenIds.get(agreementId);
        return token == null || tokenId == null ? Collections.emptyList() : token.getHoldings(tokenId);
    }

    @Override
    public void updateTransferRestriction(int agreementId, int parameterId, BigInteger value) {
        Integer tokenId = tokenIds.get(agreementId);
        if (token == null || tokenId == null) {
            throw new ContractException(ErrorCode.AGREEMENT_NOT_FOUND,
                    "SharedLedgerAdapter.updateTransferRestriction", "No token class for agreement " + agreementId);
        }
        token.updateTransferRestriction(tokenId, parameterId, value);
    }
}
