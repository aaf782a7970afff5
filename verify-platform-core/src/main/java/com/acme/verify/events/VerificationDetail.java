package com.acme.verify.events;

/** The part of a verification event that subscribers receive. */
public record VerificationDetail(String subject, String context) {}
