package com.axlabs.neo.yieldshares.runtime;

import com.axlabs.neo.yieldshares.ContractException;
import com.axlabs.neo.yieldshares.ErrorCode;
import io.neow3j.types.Hash160;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.function.Supplier;

/**
 * Base class of all contracts deployed on a {@link Runtime}.
 * <p>
 * State-changing entry points wrap their body in {@link #invoke(String, Supplier)}, which runs it in a new frame
 * and holds the contract's non-reentrancy lock until the frame is left.
 */
public abstract class SmartContract {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final Runtime runtime;
    protected final StorageContext ctx;
    private final String name;
    private final Hash160 scriptHash;
    private boolean locked;

    protected SmartContract(Runtime runtime, String name) {
        this.runtime = runtime;
        this.ctx = runtime.getStorageContext();
        this.name = name;
        this.scriptHash = Runtime.contractHash(name);
        runtime.register(this);
    }

    public Hash160 getScriptHash() {
        return scriptHash;
    }

    public String getName() {
        return name;
    }

    /**
     * Creates a storage map that is private to this contract.
     *
     * @param mapName The name of the map.
     * @return the storage map.
     */
    protected StorageMap storageMap(String mapName) {
        return new StorageMap(ctx, scriptHash + "." + mapName);
    }

    protected <T> T invoke(String method, Supplier<T> body) {
        if (locked) {
            fireErrorAndAbort(ErrorCode.REENTRANT_CALL, "Reentrant call", method);
        }
        locked = true;
        try {
            return runtime.invoke(scriptHash, body);
        } finally {
            locked = false;
        }
    }

    protected void invoke(String method, Runnable body) {
        invoke(method, () -> {
            body.run();
            return null;
        });
    }

    /**
     * Runs {@code body} in a nested frame of this contract. If the body aborts, its effects are rolled back and
     * false is returned instead of propagating the abort.
     *
     * @param body The work to attempt.
     * @return true if the body completed.
     */
    protected boolean attempt(Runnable body) {
        try {
            runtime.invoke(scriptHash, () -> {
                body.run();
                return null;
            });
            return true;
        } catch (ContractException e) {
            log.debug("{} rolled back: {}", name, e.getMessage());
            return false;
        }
    }

    /**
     * Notifies the contract at {@code to} of a payment if it is a {@link PaymentReceiver}. The callback runs in the
     * receiver's own frame, so the calls it makes are made by the receiver.
     *
     * @param to     The receiving contract or account.
     * @param from   The sender of the payment.
     * @param amount The amount received.
     */
    protected void callOnPayment(Hash160 to, Hash160 from, BigInteger amount) {
        SmartContract receiver = runtime.getContract(to);
        if (receiver instanceof PaymentReceiver) {
            runtime.invoke(to, () -> {
                ((PaymentReceiver) receiver).onPayment(from, amount);
                return null;
            });
        }
    }

    protected Hash160 getCallingScriptHash() {
        return runtime.getCallingScriptHash();
    }

    protected void fire(String eventName, Object... state) {
        runtime.notify(new Notification(scriptHash, eventName, state));
    }

    protected void fireErrorAndAbort(ErrorCode code, String msg, String method) {
        log.debug("{}.{} aborted: {}", name, method, msg);
        throw new ContractException(code, getClass().getSimpleName() + "." + method, msg);
    }
}
