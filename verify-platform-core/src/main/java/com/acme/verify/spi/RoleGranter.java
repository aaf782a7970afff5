package com.acme.verify.spi;

import com.acme.verify.secret.Credential;

/** The external access-granting API. Granting a role the subject already holds is a no-op. */
public interface RoleGranter {

    void grantRole(String subject, String roleId, Credential credential);
}
