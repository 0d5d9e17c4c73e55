package com.example.vectorpdf.domain.exception;

/**
 * Raised when an element tag is unknown or cannot be rendered in the current position
 * (a page handed to the operator emitter, for instance).
 */
public class UnsupportedElementException extends DomainException {

    private final String tag;

	/**
	 * @param tag offending element tag
	 */
    public UnsupportedElementException(String tag) {
        super("Element type " + tag + " not yet implemented");
        this.tag = tag;
    }

	/**
	 * @param tag    offending element tag
	 * @param reason why the tag is rejected here
	 */
    public UnsupportedElementException(String tag, String reason) {
        super("Element type " + tag + " " + reason);
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
