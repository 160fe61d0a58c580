package org.calista.evoalign.canonical;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class HashValueTest {

    @Test
    void normalizeStripsPrefix() {
        assertEquals("abc", HashValue.normalize("sha256:abc"));
        assertEquals("abc", HashValue.normalize("abc"));
        assertEquals("", HashValue.normalize(null));
        assertEquals("", HashValue.normalize(""));
    }

    @Test
    void sha256AlwaysPrefixesLowercase() {
        assertEquals("sha256:abcd", HashValue.sha256("ABCD"));
        assertEquals("sha256:abcd", HashValue.sha256("sha256:abcd"));
        assertEquals("sha256", HashValue.algorithm("sha256:abcd"));
        assertEquals("", HashValue.algorithm("abcd"));
    }

    @Test
    void verifyAcceptsBareHexOnEitherSide() {
        assertTrue(HashValue.verify("sha256:abc", "abc"));
        assertTrue(HashValue.verify("abc", "sha256:abc"));
        assertFalse(HashValue.verify("sha256:abc", "sha256:abd"));
    }

    @Test
    void missingValuesNeverVerify() {
        assertFalse(HashValue.verify(null, "sha256:abc"));
        assertFalse(HashValue.verify("sha256:abc", null));
        assertFalse(HashValue.verify("", ""));
        assertFalse(HashValue.verify("sha256:", "sha256:"));
    }
}
