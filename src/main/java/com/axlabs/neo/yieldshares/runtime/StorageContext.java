package com.axlabs.neo.yieldshares.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Key-value storage shared by all contracts of a {@link Runtime}.
 * <p>
 * Every write is journaled so that the runtime can roll back to a savepoint when an invocation aborts. Values are
 * expected to be immutable or {@link Struct}s, which are copied on the way in and on the way out.
 */
public class StorageContext {

    private static final Object ABSENT = new Object();

    private final NavigableMap<String, Object> entries = new TreeMap<>();
    private final List<JournalEntry> journal = new ArrayList<>();

    public Object get(String key) {
        return copyOf(entries.get(key));
    }

    public void put(String key, Object value) {
        if (value == null) {
            delete(key);
            return;
        }
        Object previous = entries.put(key, copyOf(value));
        journal.add(new JournalEntry(key, previous == null ? ABSENT : previous));
    }

    public void delete(String key) {
        if (entries.containsKey(key)) {
            journal.add(new JournalEntry(key, entries.remove(key)));
        }
    }

    /**
     * Finds all entries whose key starts with the given prefix.
     *
     * @param prefix The key prefix.
     * @return the entries in key order, with the prefix removed from the keys.
     */
    public Map<String, Object> find(String prefix) {
        Map<String, Object> found = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : entries.tailMap(prefix, true).entrySet()) {
            if (!e.getKey().startsWith(prefix)) {
                break;
            }
            found.put(e.getKey().substring(prefix.length()), copyOf(e.getValue()));
        }
        return found;
    }

    int savepoint() {
        return journal.size();
    }

    void rollback(int savepoint) {
        for (int i = journal.size() - 1; i >= savepoint; i--) {
            JournalEntry e = journal.remove(i);
            if (e.previous == ABSENT) {
                entries.remove(e.key);
            } else {
                entries.put(e.key, e.previous);
            }
        }
    }

    void commit() {
        journal.clear();
    }

    private static Object copyOf(Object value) {
        if (value instanceof Struct) {
            return ((Struct) value).copy();
        }
        return value;
    }

    private static class JournalEntry {
        final String key;
        final Object previous;

        JournalEntry(String key, Object previous) {
            this.key = key;
            this.previous = previous;
        }
    }
}
