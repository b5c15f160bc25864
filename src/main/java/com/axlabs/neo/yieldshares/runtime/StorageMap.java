package com.axlabs.neo.yieldshares.runtime;

import java.math.BigInteger;
import java.util.Map;

/**
 * A view on the {@link StorageContext} restricted to keys with a common prefix.
 */
public class StorageMap {

    private final StorageContext ctx;
    private final String prefix;

    public StorageMap(StorageContext ctx, String prefix) {
        this.ctx = ctx;
        this.prefix = prefix + ":";
    }

    public Object get(Object key) {
        return ctx.get(prefix + key);
    }

    public <T> T get(Object key, Class<T> type) {
        return type.cast(ctx.get(prefix + key));
    }

    public BigInteger getIntOrZero(Object key) {
        Object value = ctx.get(prefix + key);
        return value == null ? BigInteger.ZERO : (BigInteger) value;
    }

    public long getLongOrZero(Object key) {
        Object value = ctx.get(prefix + key);
        return value == null ? 0L : (Long) value;
    }

    public boolean getBoolean(Object key) {
        Object value = ctx.get(prefix + key);
        return value != null && (Boolean) value;
    }

    public void put(Object key, Object value) {
        ctx.put(prefix + key, value);
    }

    public void delete(Object key) {
        ctx.delete(prefix + key);
    }

    /**
     * @return all entries of this map, keyed by the key without prefix.
     */
    public Map<String, Object> find() {
        return ctx.find(prefix);
    }
}
