package com.example.vectorpdf.application.render;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Encodes Java strings as PDF string objects. Every result is plain ASCII, so the emitted file has
 * exactly one byte per character.
 */
public final class PdfStrings {

    private static final char REPLACEMENT = '?';

    private PdfStrings() {
    }

    /**
     * Encodes text drawn with {@code Tj}. ASCII content becomes an escaped literal string; anything else
     * becomes a hex string of Latin-1 codes, with {@code ?} standing in for characters outside Latin-1.
     *
     * @param text text content, may be {@code null}
     * @return {@code (literal)} or {@code <HEX>}
     */
    public static String encodeText(String text) {
        if (text == null || text.isEmpty()) {
            return "()";
        }
        if (isAscii(text)) {
            return literal(text);
        }
        StringBuilder hex = new StringBuilder("<");
        for (int i = 0; i < text.length(); i++) {
            int codePoint = text.codePointAt(i);
            if (Character.isSupplementaryCodePoint(codePoint)) {
                i++;
            }
            int code = codePoint <= 0xFF ? codePoint : REPLACEMENT;
            hex.append(String.format(Locale.ROOT, "%02X", code));
        }
        return hex.append('>').toString();
    }

    /**
     * Encodes an Info dictionary value. ASCII values stay literal strings; other values are written as
     * UTF-16BE hex strings with a byte order mark, the PDF text string form for Unicode.
     *
     * @param value metadata value
     * @return PDF string token
     */
    public static String encodeInfoValue(String value) {
        if (isAscii(value)) {
            return literal(value);
        }
        StringBuilder hex = new StringBuilder("<FEFF");
        for (byte b : value.getBytes(StandardCharsets.UTF_16BE)) {
            hex.append(String.format(Locale.ROOT, "%02X", b & 0xFF));
        }
        return hex.append('>').toString();
    }

    private static String literal(String text) {
        StringBuilder builder = new StringBuilder(text.length() + 2).append('(');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> builder.append("\\\\");
                case '(' -> builder.append("\\(");
                case ')' -> builder.append("\\)");
                case '\n' -> builder.append("\\n");
                case '\r' -> builder.append("\\r");
                default -> builder.append(c);
            }
        }
        return builder.append(')').toString();
    }

    private static boolean isAscii(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) > 127) {
                return false;
            }
        }
        return true;
    }
}
