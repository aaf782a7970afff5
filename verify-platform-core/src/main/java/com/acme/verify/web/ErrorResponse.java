package com.acme.verify.web;

/** Simple payload for error responses returned by exception handlers. */
public record ErrorResponse(String message, String reason, int statusCode) {}
