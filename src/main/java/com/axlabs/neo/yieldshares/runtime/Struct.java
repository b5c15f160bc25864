package com.axlabs.neo.yieldshares.runtime;

/**
 * A structured storage value. Storage keeps its own copy of a struct, so a struct read from storage has to be put
 * back for a change to take effect.
 */
public interface Struct {

    /**
     * @return a copy of this struct that shares no mutable state with it.
     */
    Struct copy();
}
