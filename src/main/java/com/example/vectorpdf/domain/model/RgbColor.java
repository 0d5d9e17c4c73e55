package com.example.vectorpdf.domain.model;

import java.util.Locale;

/**
 * Device RGB color with channels in {@code [0, 1]}.
 */
public record RgbColor(double red, double green, double blue) {

    /**
     * Converts the color back to its {@code #rrggbb} wire form.
     *
     * @return lower-case hex color
     */
    public String toHex() {
        return String.format(Locale.ROOT, "#%02x%02x%02x", toByte(red), toByte(green), toByte(blue));
    }

    private static int toByte(double channel) {
        return (int) Math.round(Math.max(0, Math.min(1, channel)) * 255.0);
    }
}
