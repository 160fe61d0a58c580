package org.calista.evoalign.canonical;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * CanonicalJson: deterministic serialization of JSON-like values.
 *
 * <p>Form: object keys sorted by code point, separators {@code ,} and {@code :} without
 * whitespace, integers in decimal, floats in shortest round-trip form
 * ({@code 1.0}, {@code 0.0001}, {@code 1e-05}, {@code 1e+16}).</p>
 *
 * <p>Two escaping policies exist and are not interchangeable:</p>
 * <ul>
 *   <li>{@link Escaping#ASCII}: provenance hashing; output is pure ASCII, so identities
 *       survive any transport encoding.</li>
 *   <li>{@link Escaping#UNICODE}: secrecy fingerprinting; non-ASCII text stays literal
 *       (UTF-8), only quotes, backslashes and control chars are escaped.</li>
 * </ul>
 *
 * Accepted values: {@code null}, {@link Boolean}, {@link CharSequence}, integral and
 * floating {@link Number}s, {@link Map} with string keys, {@link List}, object arrays and
 * Jackson {@link JsonNode} trees. Everything else (notably any {@link Set}) is rejected
 * with {@link NotSerializableException}.
 */
public final class CanonicalJson {

    public enum Escaping { ASCII, UNICODE }

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private static final Comparator<String> CODE_POINT_ORDER = (a, b) -> {
        int i = 0, j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) return Integer.compare(ca, cb);
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    };

    private CanonicalJson() {}

    /** Provenance form: ASCII-escaped. */
    public static byte[] asciiBytes(Object value) {
        return toString(value, Escaping.ASCII).getBytes(StandardCharsets.US_ASCII);
    }

    /** Fingerprint form: non-ASCII preserved, UTF-8 encoded. */
    public static byte[] unicodeBytes(Object value) {
        return toString(value, Escaping.UNICODE).getBytes(StandardCharsets.UTF_8);
    }

    public static String toString(Object value, Escaping escaping) {
        Objects.requireNonNull(escaping, "escaping");
        StringBuilder sb = new StringBuilder(64);
        write(sb, value, escaping, 0);
        return sb.toString();
    }

    // ---------------------------------------------------------------------
    // Writer
    // ---------------------------------------------------------------------

    private static void write(StringBuilder sb, Object v, Escaping esc, int depth) {
        if (depth > 512) throw new NotSerializableException("Value nesting too deep");

        if (v == null) {
            sb.append("null");
            return;
        }
        if (v instanceof JsonNode node) {
            writeNode(sb, node, esc, depth);
            return;
        }
        if (v instanceof Boolean b) {
            sb.append(b ? "true" : "false");
            return;
        }
        if (v instanceof CharSequence cs) {
            quote(sb, cs.toString(), esc);
            return;
        }
        if (v instanceof Number n) {
            writeNumber(sb, n);
            return;
        }
        if (v instanceof Set<?>) {
            throw new NotSerializableException("Sets have no canonical ordering: " + v.getClass().getName());
        }
        if (v instanceof Map<?, ?> m) {
            TreeMap<String, Object> sorted = new TreeMap<>(CODE_POINT_ORDER);
            for (Map.Entry<?, ?> e : m.entrySet()) {
                if (!(e.getKey() instanceof CharSequence key)) {
                    throw new NotSerializableException("Map keys must be strings, got: "
                            + (e.getKey() == null ? "null" : e.getKey().getClass().getName()));
                }
                sorted.put(key.toString(), e.getValue());
            }
            sb.append('{');
            boolean first = true;
            for (Map.Entry<String, Object> e : sorted.entrySet()) {
                if (!first) sb.append(',');
                first = false;
                quote(sb, e.getKey(), esc);
                sb.append(':');
                write(sb, e.getValue(), esc, depth + 1);
            }
            sb.append('}');
            return;
        }
        if (v instanceof List<?> xs) {
            sb.append('[');
            for (int i = 0; i < xs.size(); i++) {
                if (i > 0) sb.append(',');
                write(sb, xs.get(i), esc, depth + 1);
            }
            sb.append(']');
            return;
        }
        if (v instanceof Object[] arr) {
            write(sb, Arrays.asList(arr), esc, depth);
            return;
        }
        throw new NotSerializableException("Type is not JSON-serializable: " + v.getClass().getName());
    }

    private static void writeNode(StringBuilder sb, JsonNode node, Escaping esc, int depth) {
        if (node.isNull()) {
            sb.append("null");
        } else if (node.isBoolean()) {
            sb.append(node.booleanValue() ? "true" : "false");
        } else if (node.isTextual()) {
            quote(sb, node.textValue(), esc);
        } else if (node.isIntegralNumber()) {
            sb.append(node.bigIntegerValue().toString());
        } else if (node.isFloatingPointNumber()) {
            writeDouble(sb, node.doubleValue());
        } else if (node.isObject()) {
            List<String> keys = new ArrayList<>(node.size());
            node.fieldNames().forEachRemaining(keys::add);
            keys.sort(CODE_POINT_ORDER);
            sb.append('{');
            for (int i = 0; i < keys.size(); i++) {
                if (i > 0) sb.append(',');
                quote(sb, keys.get(i), esc);
                sb.append(':');
                writeNode(sb, node.get(keys.get(i)), esc, depth + 1);
            }
            sb.append('}');
        } else if (node.isArray()) {
            sb.append('[');
            for (int i = 0; i < node.size(); i++) {
                if (i > 0) sb.append(',');
                writeNode(sb, node.get(i), esc, depth + 1);
            }
            sb.append(']');
        } else {
            throw new NotSerializableException("JSON node is not serializable: " + node.getNodeType());
        }
    }

    private static void writeNumber(StringBuilder sb, Number n) {
        if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte
                || n instanceof BigInteger || n instanceof AtomicInteger || n instanceof AtomicLong) {
            sb.append(n.toString());
            return;
        }
        if (n instanceof Double d) {
            writeDouble(sb, d);
            return;
        }
        if (n instanceof Float f) {
            // float's own decimal form, not its widened binary value
            writeDouble(sb, Double.parseDouble(Float.toString(f)));
            return;
        }
        if (n instanceof BigDecimal bd) {
            writeDouble(sb, bd.doubleValue());
            return;
        }
        throw new NotSerializableException("Unsupported number type: " + n.getClass().getName());
    }

    private static void writeDouble(StringBuilder sb, double d) {
        if (!Double.isFinite(d)) throw new NotSerializableException("Non-finite number: " + d);
        sb.append(formatDouble(d));
    }

    /**
     * Shortest round-trip float text; scientific when the decimal exponent is below -4 or
     * at least 16, always with a fractional part or exponent so floats stay distinguishable
     * from integers.
     */
    static String formatDouble(double d) {
        if (d == 0.0) return (1.0 / d < 0) ? "-0.0" : "0.0";

        String sign = d < 0 ? "-" : "";
        BigDecimal bd = new BigDecimal(Double.toString(Math.abs(d))).stripTrailingZeros();
        String digits = bd.unscaledValue().toString();
        int decpt = digits.length() - bd.scale();

        StringBuilder out = new StringBuilder(sign);
        if (decpt > -4 && decpt <= 16) {
            if (decpt <= 0) {
                out.append("0.");
                for (int i = 0; i < -decpt; i++) out.append('0');
                out.append(digits);
            } else if (decpt < digits.length()) {
                out.append(digits, 0, decpt).append('.').append(digits, decpt, digits.length());
            } else {
                out.append(digits);
                for (int i = digits.length(); i < decpt; i++) out.append('0');
                out.append(".0");
            }
            return out.toString();
        }

        out.append(digits.charAt(0));
        if (digits.length() > 1) out.append('.').append(digits, 1, digits.length());
        int exp = decpt - 1;
        out.append('e').append(exp < 0 ? '-' : '+');
        int abs = Math.abs(exp);
        if (abs < 10) out.append('0');
        out.append(abs);
        return out.toString();
    }

    // ---------------------------------------------------------------------
    // Strings
    // ---------------------------------------------------------------------

    private static void quote(StringBuilder sb, String s, Escaping esc) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"': sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                case '\b': sb.append("\\b"); break;
                case '\f': sb.append("\\f"); break;
                default:
                    if (c < 0x20) {
                        unicodeEscape(sb, c);
                    } else if (esc == Escaping.ASCII) {
                        if (c > 0x7e) unicodeEscape(sb, c);
                        else sb.append(c);
                    } else {
                        if (Character.isSurrogate(c) && !isPairedSurrogate(s, i)) {
                            throw new NotSerializableException("Lone surrogate at index " + i + " has no UTF-8 form");
                        }
                        sb.append(c);
                    }
            }
        }
        sb.append('"');
    }

    private static boolean isPairedSurrogate(String s, int i) {
        char c = s.charAt(i);
        if (Character.isHighSurrogate(c)) {
            return i + 1 < s.length() && Character.isLowSurrogate(s.charAt(i + 1));
        }
        return i > 0 && Character.isHighSurrogate(s.charAt(i - 1));
    }

    private static void unicodeEscape(StringBuilder sb, char c) {
        sb.append("\\u")
                .append(HEX[(c >> 12) & 0xF])
                .append(HEX[(c >> 8) & 0xF])
                .append(HEX[(c >> 4) & 0xF])
                .append(HEX[c & 0xF]);
    }
}
