package org.calista.evoalign.merkle;

import com.fasterxml.jackson.databind.JsonNode;
import org.calista.evoalign.canonical.ContentHasher;
import org.calista.evoalign.canonical.HashValue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Binary Merkle tree over hash strings, rebuilt on every call.
 *
 * <p>Internal node = SHA-256 of the UTF-8 concatenation of the two children's hex strings
 * (prefixes stripped). A level with an odd number of nodes pairs its last node with itself.
 * Roots come back as {@code "sha256:<hex>"}; no leaves means no root ("").</p>
 *
 * <p>{@link #root} is order-sensitive. {@link #artifactRoot} sorts first and is not.</p>
 */
public final class MerkleTree {

    private MerkleTree() {}

    public static String root(List<String> leaves) {
        if (leaves == null || leaves.isEmpty()) return "";

        List<String> level = new ArrayList<>(leaves.size());
        for (String leaf : leaves) level.add(HashValue.normalize(leaf));

        while (level.size() > 1) {
            level = nextLevel(level);
        }
        return HashValue.SHA256 + ":" + level.get(0);
    }

    /**
     * Replays the proof from the leaf and compares with the root after prefix normalization.
     * Never throws: empty leaf/root, a null step or an unknown position all yield false.
     */
    public static boolean verifyInclusion(String leaf, List<ProofStep> proof, String root) {
        if (leaf == null || leaf.isEmpty() || root == null || root.isEmpty()) return false;

        String current = HashValue.normalize(leaf);
        if (proof != null) {
            for (ProofStep step : proof) {
                if (step == null) return false;
                String sibling = HashValue.normalize(step.hash());
                if (ProofStep.LEFT.equals(step.position())) {
                    current = parent(sibling, current);
                } else if (ProofStep.RIGHT.equals(step.position())) {
                    current = parent(current, sibling);
                } else {
                    return false;
                }
            }
        }
        return HashValue.verify(current, root);
    }

    /** Same as {@link #verifyInclusion(String, List, String)} for a proof read from a document. */
    public static boolean verifyInclusion(String leaf, JsonNode proof, String root) {
        if (proof != null && !proof.isNull() && !proof.isArray()) return false;
        List<ProofStep> steps = new ArrayList<>();
        if (proof != null) {
            for (JsonNode n : proof) steps.add(ProofStep.fromTree(n));
        }
        return verifyInclusion(leaf, steps, root);
    }

    /**
     * Proof for {@code leaves.get(index)} under {@link #root}. On an odd level the last node's
     * sibling is itself, on the right.
     */
    public static List<ProofStep> inclusionProof(List<String> leaves, int index) {
        if (leaves == null || index < 0 || index >= leaves.size()) {
            throw new IndexOutOfBoundsException("leaf index " + index + " out of range");
        }
        List<String> level = new ArrayList<>(leaves.size());
        for (String leaf : leaves) level.add(HashValue.normalize(leaf));

        List<ProofStep> proof = new ArrayList<>();
        int pos = index;
        while (level.size() > 1) {
            if ((pos & 1) == 0) {
                String sibling = pos + 1 < level.size() ? level.get(pos + 1) : level.get(pos);
                proof.add(ProofStep.right(HashValue.SHA256 + ":" + sibling));
            } else {
                proof.add(ProofStep.left(HashValue.SHA256 + ":" + level.get(pos - 1)));
            }
            level = nextLevel(level);
            pos >>= 1;
        }
        return Collections.unmodifiableList(proof);
    }

    /**
     * Root over the non-empty {@code hashField} values of the artifacts, sorted first.
     * Values that are not strings are skipped.
     */
    public static String artifactRoot(Collection<? extends Map<String, ?>> artifacts, String hashField) {
        List<String> hashes = new ArrayList<>();
        if (artifacts != null) {
            for (Map<String, ?> a : artifacts) {
                if (a == null) continue;
                Object h = a.get(hashField);
                if (h instanceof String s && !s.isEmpty()) hashes.add(s);
            }
        }
        return sortedRoot(hashes);
    }

    /** {@link #artifactRoot(Collection, String)} over a JSON array of objects. */
    public static String artifactRoot(JsonNode artifacts, String hashField) {
        List<String> hashes = new ArrayList<>();
        if (artifacts != null && artifacts.isArray()) {
            for (JsonNode a : artifacts) {
                JsonNode h = a == null ? null : a.get(hashField);
                if (h != null && h.isTextual() && !h.textValue().isEmpty()) hashes.add(h.textValue());
            }
        }
        return sortedRoot(hashes);
    }

    private static String sortedRoot(List<String> hashes) {
        if (hashes.isEmpty()) return "";
        Collections.sort(hashes);
        return root(hashes);
    }

    private static List<String> nextLevel(List<String> level) {
        List<String> next = new ArrayList<>((level.size() + 1) / 2);
        for (int i = 0; i < level.size(); i += 2) {
            String left = level.get(i);
            String right = i + 1 < level.size() ? level.get(i + 1) : left;
            next.add(parent(left, right));
        }
        return next;
    }

    private static String parent(String leftHex, String rightHex) {
        return ContentHasher.sha256Hex(leftHex + rightHex);
    }
}
