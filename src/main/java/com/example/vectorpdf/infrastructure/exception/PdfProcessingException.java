package com.example.vectorpdf.infrastructure.exception;

/**
 * Infrastructure-layer exception raised when PDFBox cannot read a generated document back.
 */
public class PdfProcessingException extends InfrastructureException {
	/**
	 * Creates the exception with a contextual message and the root cause from PDFBox.
	 *
	 * @param message description shared with the application layer
	 * @param cause   low-level PDFBox exception
	 */
    public PdfProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
