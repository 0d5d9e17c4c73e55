package com.example.vectorpdf.domain.exception;

/**
 * Raised when the input is not a well-formed element tree, for example a node that is not an array,
 * a missing tag, or attributes that are not an object.
 */
public class StructuralElementException extends DomainException {

	/**
	 * @param message description of the malformed node
	 */
    public StructuralElementException(String message) {
        super(message);
    }
}
