package com.example.vectorpdf.application.render;

import java.math.BigDecimal;

/**
 * Formats numeric operands for content streams and object dictionaries.
 * Integral values print without a fraction, other values keep the shortest round-tripping
 * decimal form; PDF has no exponent notation so none is ever produced.
 */
public final class PdfNumbers {

    private static final double LONG_SAFE_LIMIT = 1e15;

    private PdfNumbers() {
    }

    /**
     * @param value finite number
     * @return PDF numeric token such as {@code 10}, {@code 0.5} or {@code -12.25}
     * @throws IllegalArgumentException for NaN or infinite values
     */
    public static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("PDF numbers must be finite: " + value);
        }
        if (value == Math.rint(value) && Math.abs(value) < LONG_SAFE_LIMIT) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /**
     * Formats several operands separated by single spaces.
     *
     * @param values operands in emission order
     * @return space separated tokens
     */
    public static String join(double... values) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                builder.append(' ');
            }
            builder.append(format(values[i]));
        }
        return builder.toString();
    }
}
