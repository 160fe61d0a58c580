package org.calista.evoalign.secrecy;

import org.calista.evoalign.canonical.CanonicalJson;
import org.calista.evoalign.canonical.ContentHasher;
import org.calista.evoalign.secrecy.key.KeyProvider;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;

/**
 * Fingerprints content under one {@link HashingScheme}.
 *
 * <p>Keyed schemes resolve their HMAC key once, at construction, through the given
 * {@link KeyProvider}. A missing key is a {@link FingerprintException}; there is no
 * fallback to an unkeyed digest.</p>
 *
 * <p>Thread-safe: every digest uses its own {@link Mac}.</p>
 */
public final class SecrecyFingerprinter {

    public static final String DEFAULT_KEY_NAME = "EVOALIGN_SECRECY_HMAC_KEY";

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final HexFormat HEX = HexFormat.of();

    private final HashingScheme scheme;
    private final SecretKeySpec key; // null for plain SHA-256

    public SecrecyFingerprinter(HashingScheme scheme, KeyProvider keys) {
        this(scheme, keys, DEFAULT_KEY_NAME);
    }

    public SecrecyFingerprinter(HashingScheme scheme, KeyProvider keys, String defaultKeyName) {
        this.scheme = Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(keys, "keys");
        if (scheme.usesHmac()) {
            String name = scheme.keyLookupName(defaultKeyName == null ? DEFAULT_KEY_NAME : defaultKeyName);
            byte[] k = keys.find(name)
                    .filter(b -> b.length > 0)
                    .orElseThrow(() -> new FingerprintException("HMAC key missing for secrecy fingerprinting (" + name + ")"));
            this.key = new SecretKeySpec(k, HMAC_ALGORITHM);
        } else {
            this.key = null;
        }
    }

    public HashingScheme scheme() {
        return scheme;
    }

    /**
     * Unicode-preserving canonical form of the value, digested.
     */
    public String fingerprintItem(Object value) {
        return digest(CanonicalJson.unicodeBytes(value));
    }

    /**
     * Line endings normalized to LF, surrounding whitespace stripped. Blank text has no
     * fingerprint.
     */
    public Optional<String> fingerprintTextBlock(String text) {
        String normalized = normalizeText(text);
        if (normalized.isEmpty()) return Optional.empty();
        return Optional.of(digest(normalized.getBytes(StandardCharsets.UTF_8)));
    }

    public String digest(byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        if (key == null) {
            return scheme.digestPrefix() + ContentHasher.sha256Hex(payload);
        }
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(key);
            return scheme.digestPrefix() + HEX.formatHex(mac.doFinal(payload));
        } catch (GeneralSecurityException e) {
            throw new FingerprintException("HMAC-SHA256 unavailable: " + e.getMessage(), e);
        }
    }

    public static String normalizeLineEndings(String text) {
        if (text == null) return "";
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }

    /**
     * LF line endings, then leading and trailing Unicode whitespace removed (NBSP,
     * figure space and narrow NBSP included, which {@link String#strip()} keeps).
     */
    public static String normalizeText(String text) {
        String s = normalizeLineEndings(text);
        int start = 0;
        int end = s.length();
        while (start < end) {
            int cp = s.codePointAt(start);
            if (!isUnicodeSpace(cp)) break;
            start += Character.charCount(cp);
        }
        while (end > start) {
            int cp = s.codePointBefore(end);
            if (!isUnicodeSpace(cp)) break;
            end -= Character.charCount(cp);
        }
        return s.substring(start, end);
    }

    static boolean isUnicodeSpace(int cp) {
        return Character.isWhitespace(cp) || Character.isSpaceChar(cp) || cp == 0x85;
    }
}
