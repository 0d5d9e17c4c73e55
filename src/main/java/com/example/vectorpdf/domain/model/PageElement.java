package com.example.vectorpdf.domain.model;

import java.util.List;

/**
 * One page of a document. Absent size attributes are inherited from the enclosing document.
 */
public record PageElement(
        Double width,
        Double height,
        Margins margins,
        List<Element> children
) implements Element {

    public PageElement {
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public ElementType type() {
        return ElementType.PAGE;
    }
}
