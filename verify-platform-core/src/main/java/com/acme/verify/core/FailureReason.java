package com.acme.verify.core;

/**
 * Failure taxonomy of the verification pipeline. None of these trigger an in-process retry: a
 * failed attempt leaves the queue message unacknowledged and it is dead-lettered once its
 * visibility window elapses.
 */
public enum FailureReason {
    /** Malformed request. Never reaches a downstream service. */
    INVALID_INPUT,
    /** Artifact renderer failed, timed out or returned an unusable response. */
    RENDER_ERROR,
    /** External proof system failed or rejected the proof. */
    VERIFIER_ERROR,
    /** Event channel did not accept the success event. */
    PUBLISH_ERROR,
    /** A concurrency ceiling was exceeded. */
    OVERLOADED,
    /** Queue, store or bus unreachable. */
    TRANSPORT_ERROR,
    /** The invocation ran past its deadline and was abandoned. */
    DEADLINE_EXCEEDED
}
