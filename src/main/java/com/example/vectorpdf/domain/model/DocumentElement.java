package com.example.vectorpdf.domain.model;

import java.util.List;

/**
 * Root of a document tree: Info metadata, default page geometry and the ordered pages.
 */
public record DocumentElement(
        String title,
        String author,
        String subject,
        String keywords,
        String creator,
        String producer,
        Double width,
        Double height,
        Margins margins,
        List<PageElement> pages
) implements Element {

    public DocumentElement {
        pages = pages == null ? List.of() : List.copyOf(pages);
    }

    @Override
    public ElementType type() {
        return ElementType.DOCUMENT;
    }
}
