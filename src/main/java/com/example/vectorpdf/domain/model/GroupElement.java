package com.example.vectorpdf.domain.model;

import java.util.List;

/**
 * Container applying an ordered list of transforms to its children inside an isolated graphics state.
 */
public record GroupElement(
        List<TransformOp> transforms,
        List<Element> children
) implements Element {

    public GroupElement {
        transforms = transforms == null ? List.of() : List.copyOf(transforms);
        children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public ElementType type() {
        return ElementType.GROUP;
    }
}
