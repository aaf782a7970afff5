package com.acme.verify.render;

/** Payload to encode into a scannable artifact. Ephemeral, scoped to one verification attempt. */
public record RenderRequest(String payload) {

    public static final int MAX_PAYLOAD_LENGTH = 2048;
}
