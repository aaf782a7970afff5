package com.acme.verify.renderer.web;

import io.micronaut.core.annotation.Introspected;

/** JSON body of {@code POST /qr}. */
@Introspected
public record QrRequest(String data) {}
