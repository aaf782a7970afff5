package com.acme.verify.secret;

import java.util.Objects;

/** Credential material read from the secret store. {@link #toString()} never reveals the value. */
public record Credential(String secretId, String value) {

    public Credential {
        Objects.requireNonNull(secretId, "secretId");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return "Credential[" + secretId + ", ****]";
    }
}
