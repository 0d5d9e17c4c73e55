package com.example.vectorpdf.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optional document metadata written to the PDF Info dictionary.
 */
public record DocumentInfo(
        String title,
        String author,
        String subject,
        String keywords,
        String creator,
        String producer
) {

    private static final DocumentInfo EMPTY = new DocumentInfo(null, null, null, null, null, null);

    public static DocumentInfo empty() {
        return EMPTY;
    }

    /**
     * @return {@code true} when at least one field carries a value
     */
    public boolean hasAnyField() {
        return !entries().isEmpty();
    }

    /**
     * Lists the present fields keyed by their Info dictionary key, in a fixed order.
     *
     * @return ordered map such as {@code Title -> "Report"}
     */
    public Map<String, String> entries() {
        Map<String, String> entries = new LinkedHashMap<>();
        putIfPresent(entries, "Title", title);
        putIfPresent(entries, "Author", author);
        putIfPresent(entries, "Subject", subject);
        putIfPresent(entries, "Keywords", keywords);
        putIfPresent(entries, "Creator", creator);
        putIfPresent(entries, "Producer", producer);
        return entries;
    }

    private static void putIfPresent(Map<String, String> entries, String key, String value) {
        if (value != null) {
            entries.put(key, value);
        }
    }
}
