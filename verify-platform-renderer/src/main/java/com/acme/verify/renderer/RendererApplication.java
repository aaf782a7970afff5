package com.acme.verify.renderer;

import io.micronaut.runtime.Micronaut;

/**
 * Renderer Application - stateless HTTP endpoint that turns a payload into a QR code image.
 * Unauthenticated and CORS-open; admission is bounded by a fixed concurrency ceiling.
 */
public class RendererApplication {
    public static void main(String[] args) {
        Micronaut.run(RendererApplication.class, args);
    }
}
