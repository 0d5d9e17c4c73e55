package com.example.vectorpdf.domain.model;

/**
 * Document-level values after defaults have been applied.
 * Pages inherit {@code width}, {@code height} and {@code margins} unless they override them.
 */
public record DocumentAttributes(
        double width,
        double height,
        Margins margins,
        DocumentInfo info
) {
}
