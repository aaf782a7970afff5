package com.acme.verify.render;

import java.util.Arrays;
import java.util.Objects;

/** Image bytes produced by the renderer together with their media type. */
public record RenderedArtifact(byte[] bytes, String contentType) {

    public static final String PNG = "image/png";

    public RenderedArtifact {
        bytes = bytes == null ? new byte[0] : bytes.clone();
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    public int size() {
        return bytes.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RenderedArtifact other = (RenderedArtifact) o;
        return Arrays.equals(bytes, other.bytes) && Objects.equals(contentType, other.contentType);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(bytes) + (contentType == null ? 0 : contentType.hashCode());
    }

    @Override
    public String toString() {
        return "RenderedArtifact[" + contentType + ", " + bytes.length + " bytes]";
    }
}
