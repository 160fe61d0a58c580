package org.calista.evoalign.secrecy;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.evoalign.canonical.ContentHasher;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class SecretHashRegistryTest {

    private final ObjectMapper om = new ObjectMapper();

    private static final String DOC = "{"
            + "\"registry_version\":\"1.0\","
            + "\"hashing_scheme\":{\"scheme_id\":\"sha256-v1\",\"normalization_id\":\"json-c14n-v1\",\"digest_prefix\":\"sha256:\"},"
            + "\"suite_registry_hash\":\"sha256:abc\","
            + "\"suites\":["
            + "  {\"suite_id\":\"s1\",\"test_case_fingerprints\":[\"sha256:f1\",\"sha256:f2\"],\"n_test_cases\":2},"
            + "  {\"suite_id\":\"s2\",\"test_case_fingerprints\":[\"sha256:f2\"]}"
            + "]}";

    @Test
    void indexesFingerprintsBySuite() throws Exception {
        SecretHashRegistry r = SecretHashRegistry.fromTree(om.readTree(DOC));
        assertEquals("1.0", r.registryVersion());
        assertTrue(r.generatedAt().isEmpty());
        assertEquals(Set.of("s1", "s2"), r.suiteIds());
        assertEquals(Set.of("s1", "s2"), r.fingerprintIndex().get("sha256:f2"));
        assertEquals(Set.of("s1"), r.fingerprintIndex().get("sha256:f1"));
        assertEquals(2, r.suites().get(0).declaredCount());
        assertNull(r.suites().get(1).declaredCount());
    }

    @Test
    void requiredFieldsAreEnforced() throws Exception {
        FingerprintException e = assertThrows(FingerprintException.class,
                () -> SecretHashRegistry.fromTree(om.readTree("{\"registry_version\":\"1\",\"suites\":[]}")));
        assertTrue(e.getMessage().contains("hashing_scheme"), e.getMessage());

        e = assertThrows(FingerprintException.class,
                () -> SecretHashRegistry.fromTree(om.readTree(DOC.replace("\"registry_version\":\"1.0\"", "\"registry_version\":null"))));
        assertEquals("Secret hash registry missing 'registry_version'", e.getMessage());
    }

    @Test
    void suiteRootIsOrderIndependent() {
        String root = SecretHashRegistry.suiteFingerprintRoot(List.of("sha256:b", "sha256:a"));
        assertEquals(root, SecretHashRegistry.suiteFingerprintRoot(List.of("sha256:a", "sha256:b")));
        assertEquals("sha256:" + ContentHasher.sha256Hex("sha256:a\nsha256:b"), root);
    }
}
