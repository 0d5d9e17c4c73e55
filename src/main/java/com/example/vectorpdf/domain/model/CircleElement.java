package com.example.vectorpdf.domain.model;

/**
 * Circle described by its center and radius.
 */
public record CircleElement(
        Double cx,
        Double cy,
        Double r,
        String fill,
        String stroke,
        Double strokeWidth
) implements Element {

    @Override
    public ElementType type() {
        return ElementType.CIRCLE;
    }

    public CircleElement withCy(Double newCy) {
        return new CircleElement(cx, newCy, r, fill, stroke, strokeWidth);
    }
}
