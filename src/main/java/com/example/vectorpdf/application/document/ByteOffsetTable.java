package com.example.vectorpdf.application.document;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Byte offsets of the objects in an assembled file, in object-number order, and their rendering as
 * a classic cross-reference section.
 * <p>
 * Objects must be recorded as 1, 2, 3, ... so the table forms a single subsection starting at object 0.
 */
public class ByteOffsetTable {

    /**
     * Free-list head for object 0. Every entry is exactly 20 bytes including the two-character EOL.
     */
    static final String FREE_ENTRY = "0000000000 65535 f \n";

    private final List<Long> offsets = new ArrayList<>();

    /**
     * @param objectNumber next object number; must follow the previously recorded one
     * @param offset       byte offset of the object's first byte
     */
    public void record(int objectNumber, long offset) {
        if (objectNumber != offsets.size() + 1) {
            throw new IllegalStateException(
                    "Objects must be recorded in order; expected " + (offsets.size() + 1) + " but got " + objectNumber);
        }
        offsets.add(offset);
    }

    /**
     * @param objectNumber object number, starting at 1
     * @return recorded byte offset
     */
    public long offsetOf(int objectNumber) {
        return offsets.get(objectNumber - 1);
    }

    /**
     * @return number of in-use objects recorded
     */
    public int objectCount() {
        return offsets.size();
    }

    /**
     * @return {@code /Size} value for the trailer: every object plus object 0
     */
    public int size() {
        return offsets.size() + 1;
    }

    /**
     * @return the {@code xref} keyword, subsection header and one entry per object
     */
    public String toXrefSection() {
        StringBuilder xref = new StringBuilder("xref\n")
                .append("0 ").append(size()).append('\n')
                .append(FREE_ENTRY);
        for (long offset : offsets) {
            xref.append(String.format(Locale.ROOT, "%010d 00000 n \n", offset));
        }
        return xref.toString();
    }
}
