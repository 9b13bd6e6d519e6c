package dev.bomcompare.parse;

import dev.bomcompare.IngestException;

/**
 * The payload as a whole could not be read; names the section that was missing or broken.
 */
public class PayloadParseException extends IngestException {
    private final String section;

    public PayloadParseException(String section, String message) {
        super(section + ": " + message);
        this.section = section;
    }

    public PayloadParseException(String section, String message, Throwable cause) {
        super(section + ": " + message, cause);
        this.section = section;
    }

    public String section() {
        return section;
    }
}
