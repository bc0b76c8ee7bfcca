package com.surveyprep.surveyprep.table;

import java.math.BigDecimal;

/**
 * Scalar cell helpers shared by all stages. Cells are compared by their text form so that
 * {@code 1}, {@code 1.0} and {@code "1"} read from different sources match.
 */
public final class Cells {

    private Cells() {
    }

    public static boolean isBlank(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String text) {
            return text.isBlank();
        }
        if (value instanceof Double number) {
            return number.isNaN();
        }
        if (value instanceof Float number) {
            return number.isNaN();
        }
        return false;
    }

    /**
     * Canonical text form: trimmed strings, integral numbers without a decimal part, {@code ""} for blanks.
     */
    public static String text(Object value) {
        if (isBlank(value)) {
            return "";
        }
        if (value instanceof Number number) {
            return numberText(number);
        }
        return value.toString().trim();
    }

    /**
     * Matching key for codes and strata values: like {@link #text(Object)}, but numeric strings are
     * normalized too ({@code "2.0"} and {@code 2} share the key {@code "2"}).
     */
    public static String key(Object value) {
        if (value instanceof String text && !text.isBlank()) {
            Double numeric = number(text);
            if (numeric != null) {
                return numberText(numeric);
            }
        }
        return text(value);
    }

    /**
     * Returns the numeric value of a cell, or {@code null} when it is blank or not a number.
     */
    public static Double number(Object value) {
        if (isBlank(value)) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            double parsed = Double.parseDouble(value.toString().trim());
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    public static boolean isNumeric(Object value) {
        return number(value) != null;
    }

    /**
     * True for blank cells and cells holding numeric zero.
     */
    public static boolean isEmptyOrZero(Object value) {
        if (isBlank(value)) {
            return true;
        }
        Double numeric = number(value);
        return numeric != null && numeric == 0.0d;
    }

    private static String numberText(Number number) {
        if (number instanceof Integer || number instanceof Long || number instanceof Short || number instanceof Byte) {
            return number.toString();
        }
        double value = number.doubleValue();
        if (Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
