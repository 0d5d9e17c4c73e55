package com.example.vectorpdf.domain.exception;

/**
 * Base type for all domain-level exceptions raised while reading, validating or rendering an element tree.
 * Subclasses identify user input problems; none of them are worth retrying with the same input.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * Creates a domain exception with a descriptive failure message.
	 *
	 * @param message explanation of which rule the input broke
	 */
    protected DomainException(String message) {
        super(message);
    }

	/**
	 * Creates a domain exception that wraps an underlying cause.
	 *
	 * @param message explanation of which rule the input broke
	 * @param cause   original exception that triggered the domain failure
	 */
    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
