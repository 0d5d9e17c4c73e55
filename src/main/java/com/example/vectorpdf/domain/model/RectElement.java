package com.example.vectorpdf.domain.model;

/**
 * Axis-aligned rectangle anchored at its top-left corner in web coordinates.
 */
public record RectElement(
        Double x,
        Double y,
        Double width,
        Double height,
        String fill,
        String stroke,
        Double strokeWidth
) implements Element {

    @Override
    public ElementType type() {
        return ElementType.RECT;
    }

    /**
     * Returns a copy of this rectangle with a different y coordinate.
     *
     * @param newY replacement y coordinate
     * @return new rectangle
     */
    public RectElement withY(Double newY) {
        return new RectElement(x, newY, width, height, fill, stroke, strokeWidth);
    }
}
