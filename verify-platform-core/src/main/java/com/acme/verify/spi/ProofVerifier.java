package com.acme.verify.spi;

import com.acme.verify.domain.VerificationOutcome;
import com.acme.verify.domain.VerificationRequest;
import com.acme.verify.render.RenderedArtifact;
import com.acme.verify.secret.Credential;

import java.util.Optional;

/** The external proof-of-personhood check. */
public interface ProofVerifier {

    /**
     * Runs the check for one request. May take minutes.
     *
     * @param artifact the rendered artifact, when the flow produced one
     * @return succeeded or failed outcome; rejections are failed outcomes, not exceptions
     * @throws com.acme.verify.core.VerifierException when the proof system cannot be reached
     */
    VerificationOutcome verify(VerificationRequest request, Credential credential, Optional<RenderedArtifact> artifact);
}
