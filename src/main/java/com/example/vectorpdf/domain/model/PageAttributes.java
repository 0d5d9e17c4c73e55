package com.example.vectorpdf.domain.model;

/**
 * Geometry of one page after inheritance from the document.
 */
public record PageAttributes(
        double width,
        double height,
        Margins margins
) {

    /**
     * Merges page values over document defaults; a page value wins whenever it is present.
     *
     * @param page     page as authored
     * @param document resolved document attributes
     * @return resolved page attributes
     */
    public static PageAttributes inherit(PageElement page, DocumentAttributes document) {
        double width = page.width() != null ? page.width() : document.width();
        double height = page.height() != null ? page.height() : document.height();
        Margins margins = page.margins() != null ? page.margins() : document.margins();
        return new PageAttributes(width, height, margins);
    }
}
