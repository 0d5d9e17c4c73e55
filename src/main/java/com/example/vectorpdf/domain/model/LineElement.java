package com.example.vectorpdf.domain.model;

/**
 * Straight line segment between two end points. Lines are always stroked.
 */
public record LineElement(
        Double x1,
        Double y1,
        Double x2,
        Double y2,
        String stroke,
        Double strokeWidth
) implements Element {

    @Override
    public ElementType type() {
        return ElementType.LINE;
    }

    public LineElement withYs(Double newY1, Double newY2) {
        return new LineElement(x1, newY1, x2, newY2, stroke, strokeWidth);
    }
}
