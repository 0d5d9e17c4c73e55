package com.example.vectorpdf.domain.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised when an element attribute is missing, has the wrong type, or is out of range.
 * Carries the element tag, the field name, what was expected and what was received.
 */
public class AttributeValidationException extends DomainException {

    private final String elementType;
    private final String field;
    private final String expected;
    private final Object received;

	/**
	 * @param elementType tag of the element being validated
	 * @param field       attribute name as written on the wire
	 * @param expected    short description of the accepted values
	 * @param received    offending value, {@code null} when the attribute is missing
	 */
    public AttributeValidationException(String elementType, String field, String expected, Object received) {
        super(buildMessage(elementType, field, expected, received));
        this.elementType = elementType;
        this.field = field;
        this.expected = expected;
        this.received = received;
    }

    public String getElementType() {
        return elementType;
    }

    public String getField() {
        return field;
    }

    public String getExpected() {
        return expected;
    }

    public Object getReceived() {
        return received;
    }

	/**
	 * @return the failure as a map suitable for an error payload
	 */
    public Map<String, Object> toDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("element", elementType);
        details.put("field", field);
        details.put("expected", expected);
        details.put("received", received == null ? null : String.valueOf(received));
        return details;
    }

    private static String buildMessage(String elementType, String field, String expected, Object received) {
        String context = "in " + elementType + " element, attribute '" + field + "'";
        if (received == null) {
            return "Missing " + expected + " " + context;
        }
        return "Expected " + expected + " " + context + ". Got: " + received;
    }
}
