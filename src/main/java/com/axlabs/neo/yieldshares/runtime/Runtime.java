package com.axlabs.neo.yieldshares.runtime;

import io.neow3j.crypto.Hash;
import io.neow3j.types.Hash160;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * The execution environment the contracts run in.
 * <p>
 * Transactions are executed one at a time. Each contract invocation runs in its own frame on the invocation stack;
 * if an invocation aborts, the storage writes and notifications made inside its frame are rolled back before the
 * exception propagates to the caller. The outermost frame commits.
 */
public class Runtime {

    private static final Logger LOG = LoggerFactory.getLogger(Runtime.class);

    private final StorageContext storage = new StorageContext();
    private final Map<Hash160, SmartContract> contracts = new HashMap<>();
    private final List<Notification> notifications = new ArrayList<>();
    private final Deque<Hash160> invocationStack = new ArrayDeque<>();
    private Hash160 signer;
    private long time;

    public Runtime() {
        this(System.currentTimeMillis() / 1000);
    }

    public Runtime(long time) {
        this.time = time;
    }

    /**
     * Derives the script hash of a contract from its unique name.
     *
     * @param contractName The contract name.
     * @return the script hash.
     */
    public static Hash160 contractHash(String contractName) {
        return new Hash160(Hash.sha256AndThenRipemd160(contractName.getBytes(UTF_8)));
    }

    public StorageContext getStorageContext() {
        return storage;
    }

    /**
     * @return the current time in seconds.
     */
    public long getTime() {
        return time;
    }

    public void setTime(long time) {
        this.time = time;
    }

    public void fastForward(long seconds) {
        time += seconds;
    }

    void register(SmartContract contract) {
        if (contracts.containsKey(contract.getScriptHash())) {
            throw new IllegalStateException("Contract " + contract.getName() + " is already deployed");
        }
        contracts.put(contract.getScriptHash(), contract);
        LOG.debug("Deployed {} at {}", contract.getName(), contract.getScriptHash());
    }

    public SmartContract getContract(Hash160 scriptHash) {
        return contracts.get(scriptHash);
    }

    /**
     * @return the account that signed the transaction in progress, or null outside a transaction.
     */
    public Hash160 getSigner() {
        return signer;
    }

    public Hash160 getExecutingScriptHash() {
        return invocationStack.peek();
    }

    public Hash160 getCallingScriptHash() {
        Iterator<Hash160> it = invocationStack.iterator();
        if (!it.hasNext()) {
            return null;
        }
        it.next();
        return it.hasNext() ? it.next() : null;
    }

    /**
     * Checks if the given account authorised the current invocation, i.e., if it is the transaction signer or the
     * contract that called the executing contract.
     *
     * @param account The account to check.
     * @return true if the account is a witness of the invocation.
     */
    public boolean checkWitness(Hash160 account) {
        return account != null && (account.equals(signer) || account.equals(getCallingScriptHash()));
    }

    /**
     * Executes a transaction signed by {@code signer}.
     *
     * @param signer      The signing account.
     * @param transaction The calls making up the transaction.
     * @param <T>         The result type.
     * @return the result of the transaction.
     */
    public <T> T send(Hash160 signer, Supplier<T> transaction) {
        if (!invocationStack.isEmpty()) {
            throw new IllegalStateException("A transaction is already being executed");
        }
        this.signer = signer;
        try {
            return invoke(signer, transaction);
        } finally {
            this.signer = null;
        }
    }

    public void send(Hash160 signer, Runnable transaction) {
        send(signer, () -> {
            transaction.run();
            return null;
        });
    }

    <T> T invoke(Hash160 scriptHash, Supplier<T> call) {
        boolean outermost = invocationStack.isEmpty();
        int storageSavepoint = storage.savepoint();
        int notificationSavepoint = notifications.size();
        invocationStack.push(scriptHash);
        try {
            T result = call.get();
            if (outermost) {
                storage.commit();
            }
            return result;
        } catch (RuntimeException e) {
            storage.rollback(storageSavepoint);
            notifications.subList(notificationSavepoint, notifications.size()).clear();
            if (outermost) {
                storage.commit();
                LOG.debug("Transaction faulted: {}", e.getMessage());
            }
            throw e;
        } finally {
            invocationStack.pop();
        }
    }

    void notify(Notification notification) {
        notifications.add(notification);
    }

    public List<Notification> getNotifications() {
        return Collections.unmodifiableList(notifications);
    }

    public List<Notification> getNotifications(String eventName) {
        return notifications.stream()
                .filter(n -> n.getEventName().equals(eventName))
                .collect(Collectors.toList());
    }

    /**
     * @param eventName The event name.
     * @return the most recent notification with the given name, or null if there is none.
     */
    public Notification getLastNotification(String eventName) {
        for (int i = notifications.size() - 1; i >= 0; i--) {
            if (notifications.get(i).getEventName().equals(eventName)) {
                return notifications.get(i);
            }
        }
        return null;
    }
}
