package com.raditha.copycheck.shingle;

import com.raditha.copycheck.model.Digest;

/**
 * Rolling multiply-add hash of a fingerprint string.
 * <p>
 * {@code h = h * 31 + c} over the UTF-16 code units, truncated to 32 bits
 * after every step. Used only for bucketing equal fingerprints; it is not
 * collision resistant.
 */
public class ShingleHasher {

    private static final int MULTIPLIER = 31;

    public Digest hash(String fingerprint) {
        int hash = 0;
        for (int i = 0; i < fingerprint.length(); i++) {
            hash = truncate((long) hash * MULTIPLIER + fingerprint.charAt(i));
        }
        return new Digest(hash);
    }

    /**
     * Keep the low 32 bits as a signed int.
     */
    private static int truncate(long value) {
        return (int) (value & 0xFFFFFFFFL);
    }
}
