package com.example.vectorpdf.domain.model;

/**
 * Rendered page handed from the page processor to the document assembler.
 */
public record PageResult(
        double width,
        double height,
        Margins margins,
        String contentStream,
        PageMetadata metadata
) {
}
