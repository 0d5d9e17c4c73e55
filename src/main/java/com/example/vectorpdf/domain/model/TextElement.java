package com.example.vectorpdf.domain.model;

/**
 * Single line of text drawn with one of the standard PDF fonts.
 * {@code font} is the resource name used in the content stream; the document assembler maps it
 * to a standard-14 BaseFont.
 */
public record TextElement(
        Double x,
        Double y,
        String font,
        Double size,
        String fill,
        String content
) implements Element {

    @Override
    public ElementType type() {
        return ElementType.TEXT;
    }

    public TextElement withY(Double newY) {
        return new TextElement(x, newY, font, size, fill, content);
    }
}
