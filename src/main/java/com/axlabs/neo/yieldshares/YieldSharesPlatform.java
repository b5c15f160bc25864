package com.axlabs.neo.yieldshares;

import com.axlabs.neo.yieldshares.agreement.YieldAgreementRegistry;
import com.axlabs.neo.yieldshares.governance.GovernanceParameter;
import com.axlabs.neo.yieldshares.governance.GovernanceParameters;
import com.axlabs.neo.yieldshares.governance.YieldSharesGov;
import com.axlabs.neo.yieldshares.governance.power.LedgerMode;
import com.axlabs.neo.yieldshares.governance.power.PerAgreementLedgerAdapter;
import com.axlabs.neo.yieldshares.governance.power.ShareLedgerAdapter;
import com.axlabs.neo.yieldshares.governance.power.SharedLedgerAdapter;
import com.axlabs.neo.yieldshares.kyc.KycRegistryContract;
import com.axlabs.neo.yieldshares.ledger.CombinedYieldToken;
import com.axlabs.neo.yieldshares.ledger.YieldSharesToken;
import com.axlabs.neo.yieldshares.runtime.Runtime;
import com.axlabs.neo.yieldshares.token.SettlementToken;
import io.neow3j.types.Hash160;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * Deploys and wires the contracts of the platform from the {@link Config}.
 * <p>
 * The owner account deploys all contracts and hands the governance rights of the agreement registry, the KYC
 * registry and the share ledgers to the governance contract.
 */
public class YieldSharesPlatform {

    private static final Logger LOG = LoggerFactory.getLogger(YieldSharesPlatform.class);

    static final String MAX_SHAREHOLDERS_KEY = "max_shareholders";
    static final String POOLING_TOLERANCE_KEY = "pooling_tolerance_bp";
    static final String LEDGER_MODE_KEY = "ledger_mode";
    static final String SNAPSHOTS_KEY = "voting_power_snapshots";

    /**
     * The id of the platform-wide share ledger that KYC whitelist proposals are voted with.
     */
    public static final int PLATFORM_LEDGER_ID = 0;

    private final Runtime runtime;
    private final Hash160 owner;
    private final LedgerMode ledgerMode;
    private final int maxShareholders;
    private final int poolingToleranceBP;

    private final SettlementToken paymentToken;
    private final YieldAgreementRegistry agreementRegistry;
    private final KycRegistryContract kycRegistry;
    private final ShareLedgerAdapter ledgers;
    private final CombinedYieldToken combinedToken;
    private final YieldSharesGov governance;

    private YieldSharesPlatform(Runtime runtime, Hash160 owner) {
        this.runtime = runtime;
        this.owner = owner;
        ledgerMode = LedgerMode.valueOf(Config.getProperty(LEDGER_MODE_KEY).trim().toUpperCase());
        maxShareholders = Config.getIntProperty(MAX_SHAREHOLDERS_KEY);
        poolingToleranceBP = Config.getIntProperty(POOLING_TOLERANCE_KEY);

        paymentToken = new SettlementToken(runtime, "SettlementToken", owner);
        agreementRegistry = new YieldAgreementRegistry(runtime, "YieldAgreementRegistry", owner, paymentToken);
        kycRegistry = new KycRegistryContract(runtime, "KycRegistry", owner);
        if (ledgerMode == LedgerMode.SHARED) {
            combinedToken = new CombinedYieldToken(runtime, "CombinedYieldToken", owner, paymentToken,
                    maxShareholders, poolingToleranceBP);
            ledgers = new SharedLedgerAdapter(combinedToken);
        } else {
            combinedToken = null;
            ledgers = new PerAgreementLedgerAdapter();
        }
        governance = new YieldSharesGov(runtime, "YieldSharesGov", owner, getGovernanceConfig(),
                Config.getBooleanProperty(SNAPSHOTS_KEY), paymentToken, agreementRegistry, kycRegistry, ledgers);

        runtime.send(owner, () -> {
            agreementRegistry.setGovernance(governance.getScriptHash());
            kycRegistry.setGovernance(governance.getScriptHash());
            if (combinedToken != null) {
                combinedToken.setGovernance(governance.getScriptHash());
            }
        });
        createLedger(PLATFORM_LEDGER_ID);
        LOG.info("Deployed platform in {} ledger mode with governance at {}", ledgerMode, governance.getScriptHash());
    }

    /**
     * Deploys the platform contracts on the given runtime.
     *
     * @param runtime The runtime.
     * @param owner   The deploying account.
     * @return the deployed platform.
     */
    public static YieldSharesPlatform deploy(Runtime runtime, Hash160 owner) {
        return new YieldSharesPlatform(runtime, owner);
    }

    /**
     * Reads the initial governance parameters from the configuration.
     */
    public static GovernanceParameters getGovernanceConfig() {
        return new GovernanceParameters(
                Config.getLongProperty(GovernanceParameter.VOTING_DELAY.key()),
                Config.getLongProperty(GovernanceParameter.VOTING_PERIOD.key()),
                Config.getIntProperty(GovernanceParameter.QUORUM_BP.key()),
                Config.getIntProperty(GovernanceParameter.THRESHOLD_BP.key()));
    }

    /**
     * Registers a new agreement and sets up its share ledger.
     *
     * @return the agreement id.
     */
    public int createAgreement(BigInteger upfrontCapital, int roiBasisPoints, int termMonths) {
        int agreementId = runtime.send(owner,
                () -> agreementRegistry.createAgreement(upfrontCapital, roiBasisPoints, termMonths));
        createLedger(agreementId);
        return agreementId;
    }

    /**
     * Sets up the share ledger governance reads for the given id. The platform ledger
     * ({@link #PLATFORM_LEDGER_ID}) is set up on deployment.
     *
     * @param agreementId The agreement id.
     */
    private void createLedger(int agreementId) {
        if (ledgerMode == LedgerMode.SHARED) {
            int tokenId = runtime.send(owner, () -> combinedToken.createYieldTokenClass(agreementId));
            ((SharedLedgerAdapter) ledgers).mapAgreement(agreementId, tokenId);
        } else {
            YieldSharesToken token = new YieldSharesToken(runtime, agreementId, owner, paymentToken,
                    maxShareholders, poolingToleranceBP);
            runtime.send(owner, () -> token.setGovernance(governance.getScriptHash()));
            ((PerAgreementLedgerAdapter) ledgers).register(agreementId, token);
        }
    }

    public LedgerMode getLedgerMode() {
        return ledgerMode;
    }

    public Hash160 getOwner() {
        return owner;
    }

    public Runtime getRuntime() {
        return runtime;
    }

    public SettlementToken getPaymentToken() {
        return paymentToken;
    }

    public YieldAgreementRegistry getAgreementRegistry() {
        return agreementRegistry;
    }

    public KycRegistryContract getKycRegistry() {
        return kycRegistry;
    }

    public ShareLedgerAdapter getLedgers() {
        return ledgers;
    }

    /**
     * @return the agreement's share token in single ledger mode, or null.
     */
    public YieldSharesToken getSharesToken(int agreementId) {
        return ledgerMode == LedgerMode.SINGLE ? ((PerAgreementLedgerAdapter) ledgers).getLedger(agreementId) : null;
    }

    /**
     * @return the shared share token in shared ledger mode, or null.
     */
    public CombinedYieldToken getCombinedToken() {
        return combinedToken;
    }

    public YieldSharesGov getGovernance() {
        return governance;
    }
}
