package com.example.vectorpdf.application.document;

import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps font resource names used in text elements to standard-14 BaseFont names.
 * Standard-14 names map to themselves, a few common aliases map to their metric-compatible
 * standard font, and anything else falls back to Helvetica.
 */
@Component
public class FontTable {

    public static final String FALLBACK_FONT = "Helvetica";

    /**
     * Default alias table.
     */
    public static final Map<String, String> ALIASES = Map.of(
            "Arial", "Helvetica",
            "Times", "Times-Roman",
            "TimesNewRoman", "Times-Roman",
            "CourierNew", "Courier"
    );

    private final Map<String, String> baseFonts;

    public FontTable() {
        this(ALIASES);
    }

    /**
     * @param aliases extra name to standard-14 name mappings
     */
    public FontTable(Map<String, String> aliases) {
        Map<String, String> table = new HashMap<>();
        for (Standard14Fonts.FontName fontName : Standard14Fonts.FontName.values()) {
            table.put(fontName.getName(), fontName.getName());
        }
        table.putAll(aliases);
        this.baseFonts = Map.copyOf(table);
    }

    /**
     * @param fontName resource name as written in the content stream
     * @return standard-14 BaseFont name
     */
    public String baseFontFor(String fontName) {
        return baseFonts.getOrDefault(fontName, FALLBACK_FONT);
    }
}
