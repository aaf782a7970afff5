package com.acme.verify.spi;

import com.acme.verify.secret.Credential;

/** Read-only access to named secrets. No component writes through this interface. */
public interface SecretStore {

    /**
     * @param secretId ARN or other identifier of the secret
     * @throws com.acme.verify.core.TransportException if the secret cannot be read
     */
    Credential fetch(String secretId);
}
