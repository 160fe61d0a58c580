package org.calista.evoalign.solvency;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Numeric fields of governance documents: JSON numbers or numeric strings, finite only.
 */
final class Numbers {

    private Numbers() {}

    static double numeric(JsonNode value, String field, String source) {
        if (value != null) {
            if (value.isNumber()) {
                double d = value.doubleValue();
                if (Double.isFinite(d)) return d;
            } else if (value.isTextual()) {
                try {
                    double d = Double.parseDouble(value.textValue().strip());
                    if (Double.isFinite(d)) return d;
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid numeric '" + field + "' in " + source, e);
                }
            }
        }
        throw new IllegalArgumentException("Invalid numeric '" + field + "' in " + source);
    }

    /** Six significant digits, trailing zeros dropped, exponent form outside [1e-4, 1e6). */
    static String g6(double v) {
        if (v == 0.0) return "0";
        if (!Double.isFinite(v)) return Double.toString(v);
        BigDecimal bd = new BigDecimal(v).round(new MathContext(6, RoundingMode.HALF_EVEN));
        int exp = bd.precision() - bd.scale() - 1;
        if (exp >= -4 && exp < 6) {
            BigDecimal s = bd.stripTrailingZeros();
            return (s.scale() < 0 ? s.setScale(0) : s).toPlainString();
        }
        BigDecimal mantissa = bd.movePointLeft(exp).stripTrailingZeros();
        String m = (mantissa.scale() < 0 ? mantissa.setScale(0) : mantissa).toPlainString();
        int abs = Math.abs(exp);
        return m + "e" + (exp < 0 ? "-" : "+") + (abs < 10 ? "0" : "") + abs;
    }
}
