package com.example.vectorpdf.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of element tags understood by the generator.
 * The wire tag is the lower-case keyword used in hiccup trees ({@code "rect"}, {@code "g"}, ...).
 */
public enum ElementType {
    RECT("rect"),
    CIRCLE("circle"),
    LINE("line"),
    PATH("path"),
    TEXT("text"),
    GROUP("g"),
    PAGE("page"),
    DOCUMENT("document");

    private final String tag;

    ElementType(String tag) {
        this.tag = tag;
    }

    /**
     * @return keyword used for this element in hiccup trees
     */
    public String tag() {
        return tag;
    }

    /**
     * Resolves a wire tag into an element type.
     *
     * @param rawTag tag coming from the hiccup tree
     * @return matching type, or empty when the tag is unknown
     */
    public static Optional<ElementType> fromTag(String rawTag) {
        if (rawTag == null) {
            return Optional.empty();
        }
        String normalized = rawTag.trim().toLowerCase(Locale.ROOT);
        for (ElementType type : values()) {
            if (type.tag.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
