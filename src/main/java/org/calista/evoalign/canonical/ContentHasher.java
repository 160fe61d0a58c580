package org.calista.evoalign.canonical;

import com.fasterxml.jackson.databind.JsonNode;
import org.calista.evoalign.io.DataFiles;
import org.calista.evoalign.io.FileIO;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * ContentHasher: SHA-256 identity for structured values and files.
 *
 * <ul>
 *   <li>values: {@code "sha256:" + hex(SHA-256(CanonicalJson.asciiBytes(value)))}</li>
 *   <li>data files (.json/.yaml/.yml): parsed, then hashed as a value, so formatting and key
 *       order never change identity</li>
 *   <li>any other file: raw bytes streamed in 8 KiB chunks</li>
 * </ul>
 */
public final class ContentHasher {

    public static final int CHUNK_SIZE = 8192;

    private static final HexFormat HEX = HexFormat.of();

    private final DataFiles data;

    public ContentHasher(DataFiles data) {
        this.data = Objects.requireNonNull(data, "data");
    }

    // ---------------------------------------------------------------------
    // Values
    // ---------------------------------------------------------------------

    public static String contentHash(Object value) {
        return HashValue.SHA256 + ":" + sha256Hex(CanonicalJson.asciiBytes(value));
    }

    public static String sha256Hex(byte[] payload) {
        MessageDigest md = newSha256();
        return HEX.formatHex(md.digest(payload));
    }

    public static String sha256Hex(String text) {
        return sha256Hex(text.getBytes(StandardCharsets.UTF_8));
    }

    public static MessageDigest newSha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String hex(byte[] digest) {
        return HEX.formatHex(digest);
    }

    // ---------------------------------------------------------------------
    // Files
    // ---------------------------------------------------------------------

    /**
     * Identity of a file: canonical hash for data files, raw hash otherwise.
     */
    public String fileHash(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (DataFiles.isStructured(file)) {
            JsonNode tree = data.read(file);
            return contentHash(tree);
        }
        return rawFileHash(file);
    }

    public String rawFileHash(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        FileIO io = data.io();
        MessageDigest md = newSha256();
        byte[] buf = new byte[CHUNK_SIZE];
        try (InputStream in = io.openInputStream(file)) {
            int n;
            while ((n = in.read(buf)) != -1) {
                md.update(buf, 0, n);
            }
        }
        return HashValue.SHA256 + ":" + HEX.formatHex(md.digest());
    }
}
