package com.acme.verify.spi;

import com.acme.verify.render.RenderRequest;
import com.acme.verify.render.RenderedArtifact;

/**
 * Renders a verification artifact. Side-effect free: identical payloads yield identical images.
 */
public interface ArtifactRenderer {

    /**
     * @throws com.acme.verify.core.RenderException on renderer failure or timeout
     * @throws com.acme.verify.core.OverloadedException when the renderer's concurrency ceiling is hit
     */
    RenderedArtifact render(RenderRequest request);
}
