package com.axlabs.neo.yieldshares.governance;

import com.axlabs.neo.yieldshares.Config;
import com.axlabs.neo.yieldshares.YieldSharesPlatform;
import com.axlabs.neo.yieldshares.governance.power.LedgerMode;
import com.axlabs.neo.yieldshares.governance.power.SharedLedgerAdapter;
import com.axlabs.neo.yieldshares.ledger.CombinedYieldToken;
import com.axlabs.neo.yieldshares.restriction.RestrictionParameter;
import com.axlabs.neo.yieldshares.runtime.Runtime;
import io.neow3j.types.Hash160;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.axlabs.neo.yieldshares.util.TestHelper.ALICE;
import static com.axlabs.neo.yieldshares.util.TestHelper.BOB;
import static com.axlabs.neo.yieldshares.util.TestHelper.OWNER;
import static com.axlabs.neo.yieldshares.util.TestHelper.big;
import static com.axlabs.neo.yieldshares.util.TestHelper.newRuntime;
import static com.axlabs.neo.yieldshares.util.TestHelper.passAndExecute;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

public class SharedLedgerGovernanceTest {

    private Runtime runtime;
    private YieldSharesPlatform platform;
    private CombinedYieldToken token;
    private YieldSharesGov gov;

    @BeforeEach
    public void setUp() {
        Config.setProfile("shared");
        runtime = newRuntime();
        platform = YieldSharesPlatform.deploy(runtime, OWNER);
        token = platform.getCombinedToken();
        gov = platform.getGovernance();
    }

    @AfterEach
    public void tearDown() {
        Config.setProfile(null);
    }

    private void mint(Hash160 to, int tokenId, long amount) {
        runtime.send(OWNER, () -> token.mint(to, tokenId, big(amount)));
    }

    @Test
    public void map_agreements_to_token_classes() {
        assertThat(platform.getLedgerMode(), is(LedgerMode.SHARED));
        assertThat(token.getGovernance(), is(gov.getScriptHash()));

        int first = platform.createAgreement(big(10_000), 500, 12);
        int second = platform.createAgreement(big(20_000), 600, 12);
        SharedLedgerAdapter ledgers = (SharedLedgerAdapter) platform.getLedgers();

        // Token class 1 holds the platform ledger.
        assertThat(ledgers.getTokenId(YieldSharesPlatform.PLATFORM_LEDGER_ID), is(1));
        assertThat(token.getAgreementId(1), is(YieldSharesPlatform.PLATFORM_LEDGER_ID));
        assertThat(ledgers.getTokenId(first), is(2));
        assertThat(ledgers.getTokenId(second), is(3));
        assertThat(token.getAgreementId(3), is(second));
        assertThat(platform.getSharesToken(first), is(nullValue()));
    }

    @Test
    public void vote_with_shares_of_the_agreements_token_class() {
        int first = platform.createAgreement(big(10_000), 500, 12);
        int second = platform.createAgreement(big(20_000), 600, 12);
        mint(ALICE, 2, 1_000);
        mint(BOB, 3, 5_000);

        assertThat(gov.getVotingPower(ALICE, first), is(big(1_000)));
        assertThat(gov.getVotingPower(ALICE, second), is(big(0)));

        int id = runtime.send(BOB, () -> gov.createProposal(second,
                ProposalPayload.restrictionParam(RestrictionParameter.MIN_HOLDING_PERIOD_SECONDS, big(7_200)), ""));
        assertThat(passAndExecute(runtime, gov, id, BOB), is(true));

        assertThat(token.getMinHoldingPeriod(3), is(7_200L));
        assertThat(token.getMinHoldingPeriod(2), is(0L));
    }
}
