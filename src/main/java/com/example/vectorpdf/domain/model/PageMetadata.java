package com.example.vectorpdf.domain.model;

/**
 * Diagnostic facts recorded while a page is rendered.
 */
public record PageMetadata(
        int elementCount,
        boolean hasTransforms
) {
}
