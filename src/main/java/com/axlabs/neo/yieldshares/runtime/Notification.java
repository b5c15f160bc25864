package com.axlabs.neo.yieldshares.runtime;

import io.neow3j.types.Hash160;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An event fired by a contract during a successful invocation.
 */
public class Notification {

    private final Hash160 contract;
    private final String eventName;
    private final List<Object> state;

    public Notification(Hash160 contract, String eventName, Object... state) {
        this.contract = contract;
        this.eventName = eventName;
        this.state = Collections.unmodifiableList(Arrays.asList(state));
    }

    public Hash160 getContract() {
        return contract;
    }

    public String getEventName() {
        return eventName;
    }

    public List<Object> getState() {
        return state;
    }

    @Override
    public String toString() {
        return eventName + state;
    }
}
