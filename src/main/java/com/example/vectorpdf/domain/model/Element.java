package com.example.vectorpdf.domain.model;

/**
 * Node of an immutable element tree.
 * Every implementation is a record; callers dispatch on {@link #type()} rather than on the class.
 */
public interface Element {

    /**
     * @return tag identifying the concrete element kind
     */
    ElementType type();
}
