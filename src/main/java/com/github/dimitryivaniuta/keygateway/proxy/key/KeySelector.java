package com.github.dimitryivaniuta.keygateway.proxy.key;

import com.github.dimitryivaniuta.keygateway.proxy.GatewayConfigurationException;
import com.github.dimitryivaniuta.keygateway.proxy.support.KeyMasking;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Round-robin rotation over the configured API keys.
 *
 * <p>Every call to {@link #next()} claims exactly one rotation slot with a single atomic
 * increment, so concurrent callers each get a distinct slot and no slot is skipped.
 * Slot {@code s} maps to key {@code s mod N}; the first call returns the first key.
 */
public final class KeySelector {

    private final List<String> credentials;
    private final Map<String, String> aliases;
    private final AtomicLong slots = new AtomicLong();

    public KeySelector(List<String> credentials) {
        if (credentials == null || credentials.isEmpty()) {
            throw new GatewayConfigurationException("At least one API key must be configured");
        }
        this.credentials = List.copyOf(credentials);

        Map<String, String> a = new HashMap<>();
        for (int i = 0; i < this.credentials.size(); i++) {
            a.putIfAbsent(this.credentials.get(i), KeyMasking.alias(i));
        }
        this.aliases = Map.copyOf(a);
    }

    public String next() {
        long slot = slots.getAndIncrement();
        return credentials.get(Math.floorMod(slot, credentials.size()));
    }

    public int size() {
        return credentials.size();
    }

    /** Total rotation slots handed out since startup. */
    public long slotsIssued() {
        return slots.get();
    }

    /** Index of the key the next call will return. */
    public int cursor() {
        return Math.floorMod(slots.get(), credentials.size());
    }

    public List<String> credentials() {
        return credentials;
    }

    public String aliasOf(String credential) {
        return aliases.getOrDefault(credential, "unknown");
    }
}
