package org.calista.evoalign.secrecy;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.evoalign.secrecy.key.impl.EnvironmentKeyProvider;
import org.calista.evoalign.secrecy.key.impl.StaticKeyProvider;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class SecrecyFingerprinterTest {

    private static final HashingScheme HMAC = new HashingScheme("hmac-sha256-v1", "json-c14n-v1", "hmacsha256:", null);

    private final SecrecyFingerprinter sha = new SecrecyFingerprinter(HashingScheme.sha256V1(), StaticKeyProvider.empty());

    @Test
    void itemFingerprintMatchesKnownVector() {
        assertEquals("sha256:b463c1524601cb7b657e0717a90054c840bcac0c7070b12567297b3343f7a3b6",
                sha.fingerprintItem(Map.of("prompt", "X")));
    }

    @Test
    void itemFingerprintKeepsUnicodeLiteral() {
        assertEquals("sha256:4b8e3fd40acdad6181314bfef3c1364b9fbbc556a94ee233add8fb224f27d660",
                sha.fingerprintItem(Map.of("q", "é")));
    }

    @Test
    void keyOrderDoesNotChangeFingerprint() throws Exception {
        Map<String, Object> one = new LinkedHashMap<>();
        one.put("prompt", "X");
        one.put("answer", List.of(1, 2));
        Map<String, Object> two = new LinkedHashMap<>();
        two.put("answer", List.of(1, 2));
        two.put("prompt", "X");

        assertEquals(sha.fingerprintItem(one), sha.fingerprintItem(two));
        assertEquals(sha.fingerprintItem(one),
                sha.fingerprintItem(new ObjectMapper().readTree("{\"answer\":[1,2],\"prompt\":\"X\"}")));
    }

    @Test
    void textBlocksNormalizeLineEndingsAndWhitespace() {
        String expected = "sha256:46e0ea795802f17d0b340983ca7d7068c94d7d9172ee4daea37a1ab1168649ec";
        assertEquals(Optional.of(expected), sha.fingerprintTextBlock("Hello\r\nworld  "));
        assertEquals(Optional.of(expected), sha.fingerprintTextBlock("\n Hello\rworld\n"));
        assertEquals(Optional.empty(), sha.fingerprintTextBlock(" \r\n\t "));
    }

    @Test
    void textBlocksStripUnicodeSpaces() {
        assertEquals(sha.fingerprintTextBlock("Secret"), sha.fingerprintTextBlock("\u00a0Secret\u00a0"));
        assertEquals(sha.fingerprintTextBlock("Secret"), sha.fingerprintTextBlock("\u2007\u202fSecret\u3000\u0085"));
        assertEquals(Optional.empty(), sha.fingerprintTextBlock("\u00a0\u00a0"));
        assertEquals("a\u00a0b", SecrecyFingerprinter.normalizeText("\u00a0a\u00a0b\u00a0"));
    }

    @Test
    void hmacUsesDefaultKeyName() {
        SecrecyFingerprinter fp = new SecrecyFingerprinter(HMAC,
                StaticKeyProvider.of(SecrecyFingerprinter.DEFAULT_KEY_NAME, "secret-key"));
        assertEquals("hmacsha256:53db0bda476874c8dd7d2eede3ce39a7a34272e78ce20a6478fa3f41af4f185b",
                fp.fingerprintItem(Map.of("prompt", "X")));
        assertNotEquals(sha.fingerprintItem(Map.of("prompt", "X")), fp.fingerprintItem(Map.of("prompt", "X")));
    }

    @Test
    void hmacKeyIdSelectsKey() {
        HashingScheme scheme = new HashingScheme("hmac-sha256-v1", "json-c14n-v1", "hmacsha256:", "env:CUSTOM_KEY");
        SecrecyFingerprinter fp = new SecrecyFingerprinter(scheme,
                new EnvironmentKeyProvider(Map.of("CUSTOM_KEY", "secret-key")));
        assertEquals("hmacsha256:53db0bda476874c8dd7d2eede3ce39a7a34272e78ce20a6478fa3f41af4f185b",
                fp.fingerprintItem(Map.of("prompt", "X")));
    }

    @Test
    void missingHmacKeyFailsClosed() {
        FingerprintException e = assertThrows(FingerprintException.class,
                () -> new SecrecyFingerprinter(HMAC, StaticKeyProvider.empty()));
        assertTrue(e.getMessage().contains(SecrecyFingerprinter.DEFAULT_KEY_NAME), e.getMessage());

        assertThrows(FingerprintException.class,
                () -> new SecrecyFingerprinter(HMAC, new EnvironmentKeyProvider(Map.of(SecrecyFingerprinter.DEFAULT_KEY_NAME, ""))));
    }
}
