package com.raditha.copycheck.model;

/**
 * 32-bit digest of a structural fingerprint.
 * Not cryptographic: two different fingerprints may share a digest and are
 * then treated as the same shingle.
 *
 * @param value the signed 32-bit hash value
 */
public record Digest(int value) {

    /**
     * Signed base-16 rendering, e.g. {@code -1f3a} or {@code 7c}.
     */
    public String toHex() {
        return Integer.toString(value, 16);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
