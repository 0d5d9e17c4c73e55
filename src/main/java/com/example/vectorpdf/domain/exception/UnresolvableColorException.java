package com.example.vectorpdf.domain.exception;

/**
 * Raised when a color is neither one of the named colors nor a {@code #rrggbb} hex string.
 * Invalid colors are never replaced with a default.
 */
public class UnresolvableColorException extends DomainException {

    private final String color;

	/**
	 * @param color offending color value
	 */
    public UnresolvableColorException(String color) {
        super("Cannot resolve color: " + color);
        this.color = color;
    }

    public String getColor() {
        return color;
    }
}
