package com.raditha.metaast.fingerprint;

/**
 * Exact and normalized digests of one tree.
 */
public record Fingerprints(String exact, String normalized) {
}
