package com.example.vectorpdf.application.validation;

import com.example.vectorpdf.domain.exception.AttributeValidationException;
import com.example.vectorpdf.domain.model.Element;

/**
 * Checks an element's own attributes (not its children) before it is rendered.
 */
public interface ElementAttributeValidator {

    /**
     * Validates the attributes of a single element.
     *
     * @param element element to check
     * @param <T>     concrete element type
     * @return the same element, unchanged, when every attribute is acceptable
     * @throws AttributeValidationException naming the first offending attribute
     */
    <T extends Element> T validate(T element);
}
