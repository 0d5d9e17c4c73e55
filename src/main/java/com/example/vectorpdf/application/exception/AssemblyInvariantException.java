package com.example.vectorpdf.application.exception;

/**
 * Signals that an assembled document failed its own consistency check: a cross-reference offset does not
 * point at the object it names. Always a generator bug, never a problem with the input tree.
 */
public class AssemblyInvariantException extends ApplicationException {

	/**
	 * @param message which offset could not be reconciled with the emitted bytes
	 */
    public AssemblyInvariantException(String message) {
        super(message);
    }
}
