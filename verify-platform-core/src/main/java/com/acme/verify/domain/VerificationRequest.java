package com.acme.verify.domain;

import java.util.Optional;

/**
 * A request to verify a subject. Flat fields only: the subject identifier, the action/context the
 * verification is performed for and an opaque signal forwarded to the proof system.
 */
public record VerificationRequest(String subject, String context, String signal) {

    public static final int MAX_FIELD_LENGTH = 256;

    /** Describes the first shape problem of this request, if any. */
    public Optional<String> validationProblem() {
        if (subject == null || subject.isBlank()) {
            return Optional.of("subject must not be blank");
        }
        if (context == null || context.isBlank()) {
            return Optional.of("context must not be blank");
        }
        if (subject.length() > MAX_FIELD_LENGTH) {
            return Optional.of("subject exceeds " + MAX_FIELD_LENGTH + " characters");
        }
        if (context.length() > MAX_FIELD_LENGTH) {
            return Optional.of("context exceeds " + MAX_FIELD_LENGTH + " characters");
        }
        if (signal != null && signal.length() > MAX_FIELD_LENGTH) {
            return Optional.of("signal exceeds " + MAX_FIELD_LENGTH + " characters");
        }
        return Optional.empty();
    }

    public boolean hasSignal() {
        return signal != null && !signal.isBlank();
    }
}
