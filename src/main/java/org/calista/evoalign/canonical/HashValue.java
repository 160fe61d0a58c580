package org.calista.evoalign.canonical;

import java.util.Locale;

/**
 * Helpers for {@code "<algorithm>:<hex>"} hash strings.
 *
 * Output is always prefixed; input may be bare hex on either side of a comparison.
 */
public final class HashValue {

    public static final String SHA256 = "sha256";
    public static final String HMAC_SHA256 = "hmacsha256";

    private HashValue() {}

    /** {@code "sha256:" + hex}, hex lowercased. A prefix already present is replaced. */
    public static String sha256(String hex) {
        return SHA256 + ":" + normalize(hex).toLowerCase(Locale.ROOT);
    }

    /**
     * Strips an optional {@code algo:} prefix. {@code null} and empty map to "".
     */
    public static String normalize(String value) {
        if (value == null || value.isEmpty()) return "";
        int colon = value.indexOf(':');
        if (colon < 0) return value;
        return value.substring(colon + 1);
    }

    /** Algorithm part of the string, or "" when unprefixed. */
    public static String algorithm(String value) {
        if (value == null) return "";
        int colon = value.indexOf(':');
        return colon < 0 ? "" : value.substring(0, colon);
    }

    /**
     * True only when both sides are present and their digests match after prefix
     * normalization. Absent input is "not verified", never a vacuous match.
     */
    public static boolean verify(String expected, String actual) {
        if (expected == null || expected.isEmpty() || actual == null || actual.isEmpty()) return false;
        String e = normalize(expected);
        String a = normalize(actual);
        return !e.isEmpty() && e.equals(a);
    }
}
