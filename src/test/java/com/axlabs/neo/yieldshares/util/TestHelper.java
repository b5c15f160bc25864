package com.axlabs.neo.yieldshares.util;

import com.axlabs.neo.yieldshares.YieldSharesPlatform;
import com.axlabs.neo.yieldshares.governance.YieldSharesGov;
import com.axlabs.neo.yieldshares.ledger.YieldSharesToken;
import com.axlabs.neo.yieldshares.runtime.Notification;
import com.axlabs.neo.yieldshares.runtime.Runtime;
import io.neow3j.types.Hash160;

import java.math.BigInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;

public class TestHelper {

    public static final long START_TIME = 1_700_000_000L;

    public static final Hash160 ALICE = Hash160.fromAddress("NM7Aky765FG8NhhwtxjXRx7jEL1cnw7PBP");
    public static final Hash160 BOB = Hash160.fromAddress("NZpsgXn9VQQoLexpuXJsrX8BsoyAhKUyiX");
    public static final Hash160 CHARLIE = Hash160.fromAddress("NdbtgSku2qLuwsBBzLx3FLtmmMdm32Ktor");
    public static final Hash160 DENISE = Hash160.fromAddress("NerDv9t8exrQRrP11jjvZKXzSXvTnmfDTo");
    public static final Hash160 EVE = Hash160.fromAddress("NZ539Rd57v5NEtAdkHyFGaWj1uGt2DecUL");
    public static final Hash160 FLORIAN = Hash160.fromAddress("NRy5bp81kScYFZHLfMBXuubFfRyboVyu7G");

    // Platform owner, used for deployment and administration.
    public static final Hash160 OWNER = FLORIAN;

    // Governance parameters of the default configuration.
    public static final long VOTING_DELAY = 86_400;
    public static final long VOTING_PERIOD = 604_800;
    public static final int QUORUM_BP = 1_000;
    public static final int THRESHOLD_BP = 100;

    public static BigInteger big(long value) {
        return BigInteger.valueOf(value);
    }

    public static Runtime newRuntime() {
        return new Runtime(START_TIME);
    }

    /**
     * Mints shares of a single ledger share token to the given account, signed by the platform owner.
     */
    public static void mintShares(YieldSharesPlatform platform, int agreementId, Hash160 to, long amount) {
        YieldSharesToken token = platform.getSharesToken(agreementId);
        platform.getRuntime().send(OWNER, () -> token.mint(to, big(amount)));
    }

    /**
     * Funds the governance contract with settlement tokens, e.g., for reserve allocations.
     */
    public static void fundGovernance(YieldSharesPlatform platform, long amount) {
        platform.getRuntime().send(OWNER, () -> platform.getPaymentToken()
                .mint(platform.getGovernance().getScriptHash(), big(amount)));
    }

    /**
     * Moves the clock into the voting window of a proposal created just now.
     */
    public static void startVoting(Runtime runtime) {
        runtime.fastForward(VOTING_DELAY);
    }

    /**
     * Moves the clock past the voting window of a proposal whose voting has started just now.
     */
    public static void endVoting(Runtime runtime) {
        runtime.fastForward(VOTING_PERIOD + 1);
    }

    public static void vote(Runtime runtime, YieldSharesGov gov, int id, Hash160 voter, int support) {
        runtime.send(voter, () -> gov.castVote(id, support));
    }

    /**
     * Runs a proposal through voting with the given voters in favour and executes it.
     *
     * @return whether the proposal was executed.
     */
    public static boolean passAndExecute(Runtime runtime, YieldSharesGov gov, int id, Hash160... supporters) {
        startVoting(runtime);
        for (Hash160 supporter : supporters) {
            vote(runtime, gov, id, supporter, 1);
        }
        endVoting(runtime);
        return runtime.send(ALICE, () -> gov.executeProposal(id));
    }

    public static Notification assertLastEvent(Runtime runtime, String eventName) {
        Notification n = runtime.getLastNotification(eventName);
        assertThat("no " + eventName + " event", n, notNullValue());
        assertThat(n.getEventName(), is(eventName));
        return n;
    }
}
