package com.example.vectorpdf.domain.model;

import java.util.List;

/**
 * Page margins in points, ordered {@code [top, right, bottom, left]} as on the wire.
 */
public record Margins(double top, double right, double bottom, double left) {

    private static final Margins NONE = new Margins(0, 0, 0, 0);

    /**
     * @return margins with every side set to zero
     */
    public static Margins none() {
        return NONE;
    }

    /**
     * Builds margins from a four-element list.
     *
     * @param values {@code [top, right, bottom, left]}
     * @return margins
     * @throws IllegalArgumentException when the list does not hold exactly four values
     */
    public static Margins of(List<Double> values) {
        if (values == null || values.size() != 4) {
            throw new IllegalArgumentException("Margins need exactly four values: " + values);
        }
        return new Margins(values.get(0), values.get(1), values.get(2), values.get(3));
    }

    /**
     * @return the four sides in wire order
     */
    public List<Double> toList() {
        return List.of(top, right, bottom, left);
    }
}
