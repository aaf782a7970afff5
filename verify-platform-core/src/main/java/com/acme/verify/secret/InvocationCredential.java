package com.acme.verify.secret;

import com.acme.verify.spi.SecretStore;

/**
 * The shared credential as seen by a single invocation: fetched on first use, then reused for the
 * rest of that invocation. Create a new instance per invocation; instances are not shared.
 */
public final class InvocationCredential {
    private final SecretStore store;
    private final String secretId;
    private Credential cached;

    public InvocationCredential(SecretStore store, String secretId) {
        this.store = store;
        this.secretId = secretId;
    }

    public Credential get() {
        if (cached == null) {
            cached = store.fetch(secretId);
        }
        return cached;
    }

    public boolean isFetched() {
        return cached != null;
    }
}
