package com.example.vectorpdf.application.render;

import com.example.vectorpdf.domain.exception.UnresolvableColorException;
import com.example.vectorpdf.domain.model.RgbColor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Resolves color values (a named color or {@code #rrggbb}) to device RGB.
 * Unresolvable input is rejected rather than replaced with black.
 */
@Component
public class ColorResolver {

    /**
     * Default named-color table.
     */
    public static final Map<String, RgbColor> NAMED_COLORS = Map.of(
            "red", new RgbColor(1, 0, 0),
            "green", new RgbColor(0, 1, 0),
            "blue", new RgbColor(0, 0, 1),
            "black", new RgbColor(0, 0, 0),
            "white", new RgbColor(1, 1, 1),
            "yellow", new RgbColor(1, 1, 0),
            "cyan", new RgbColor(0, 1, 1),
            "magenta", new RgbColor(1, 0, 1)
    );

    private static final Pattern HEX_PATTERN = Pattern.compile("^#[0-9a-fA-F]{6}$");

    private final Map<String, RgbColor> namedColors;

    public ColorResolver() {
        this(NAMED_COLORS);
    }

    /**
     * @param namedColors lookup table of lower-case color names
     */
    public ColorResolver(Map<String, RgbColor> namedColors) {
        this.namedColors = Map.copyOf(namedColors);
    }

    /**
     * Resolves a color value.
     *
     * @param color named color or {@code #rrggbb}
     * @return RGB channels in {@code [0, 1]}
     * @throws UnresolvableColorException when the value matches neither form
     */
    public RgbColor resolve(String color) {
        if (color == null) {
            throw new UnresolvableColorException(null);
        }
        RgbColor named = namedColors.get(color.toLowerCase(Locale.ROOT));
        if (named != null) {
            return named;
        }
        if (!HEX_PATTERN.matcher(color).matches()) {
            throw new UnresolvableColorException(color);
        }
        return new RgbColor(channel(color, 1), channel(color, 3), channel(color, 5));
    }

    /**
     * @param color candidate color value
     * @return whether {@link #resolve(String)} would succeed
     */
    public boolean isResolvable(String color) {
        if (color == null) {
            return false;
        }
        return namedColors.containsKey(color.toLowerCase(Locale.ROOT)) || HEX_PATTERN.matcher(color).matches();
    }

    /**
     * Resolves a color and renders it as the three operands of {@code rg} / {@code RG}.
     *
     * @param color named color or {@code #rrggbb}
     * @return operand text such as {@code 1 0 0}
     */
    public String toOperands(String color) {
        RgbColor rgb = resolve(color);
        return PdfNumbers.join(rgb.red(), rgb.green(), rgb.blue());
    }

    private static double channel(String hex, int start) {
        return Integer.parseInt(hex.substring(start, start + 2), 16) / 255.0;
    }
}
