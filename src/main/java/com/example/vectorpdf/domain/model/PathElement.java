package com.example.vectorpdf.domain.model;

/**
 * Free-form shape described by SVG-style path data ({@code M}, {@code L}, {@code C}, {@code Z}).
 * Path coordinates are never remapped; authors supply them in PDF space.
 */
public record PathElement(
        String d,
        String fill,
        String stroke,
        Double strokeWidth
) implements Element {

    @Override
    public ElementType type() {
        return ElementType.PATH;
    }
}
