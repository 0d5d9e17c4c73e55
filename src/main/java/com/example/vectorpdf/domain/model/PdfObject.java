package com.example.vectorpdf.domain.model;

/**
 * Indirect PDF object with generation 0.
 */
public record PdfObject(int number, String body) {

    public PdfObject {
        if (number < 1) {
            throw new IllegalArgumentException("Object number must be positive: " + number);
        }
    }

    /**
     * @param objectNumber number of the referenced object
     * @return {@code "N 0 R"} reference
     */
    public static String reference(int objectNumber) {
        return objectNumber + " 0 R";
    }

    /**
     * @return full object text from {@code N 0 obj} to {@code endobj}
     */
    public String serialize() {
        return number + " 0 obj\n" + body + "\nendobj";
    }
}
