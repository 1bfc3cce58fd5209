package org.wingshape.diagnostics;

/**
 * Input table is unusable for one row or for the whole file: a required column is absent,
 * a coefficient is missing or not a number, or metadata is blank.
 *
 * Fatal for the affected unit. The message always names where the problem was found.
 */
public class DataFormatException extends IllegalArgumentException {

    private final String location;

    public DataFormatException(String location, String message) {
        super(location + ": " + message);
        this.location = location;
    }

    public DataFormatException(String location, String message, Throwable cause) {
        super(location + ": " + message, cause);
        this.location = location;
    }

    /** Where the problem was found, e.g. "row 12 (id=W-0031)" or a file name. */
    public String location() {
        return location;
    }
}
