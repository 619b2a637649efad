package com.ozmeta.compiler.projection;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import com.ozmeta.compiler.model.physical.CanonicalRef;
import com.ozmeta.compiler.model.physical.ReverseKey;

/**
 * Physical location to canonical identity, for one target platform.
 */
public class ReverseIndex {

    private final Map<ReverseKey, CanonicalRef> entries = new HashMap<>();

    /**
     * @throws IllegalStateException when the key already maps to something else
     */
    public void register(ReverseKey key, CanonicalRef ref) {
        CanonicalRef previous = entries.putIfAbsent(key, ref);
        if (previous != null && !previous.equals(ref)) {
            throw new IllegalStateException("Reverse key " + key.asString() + " already maps to " + previous);
        }
    }

    public Optional<CanonicalRef> resolve(ReverseKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    public int size() {
        return entries.size();
    }

    public Map<ReverseKey, CanonicalRef> entries() {
        return Collections.unmodifiableMap(entries);
    }
}
