package dev.bomcompare.parse;

import java.util.List;

/**
 * Records decoded from one payload, plus the entries that were skipped and why.
 */
public record ParseResult<T>(List<T> records, List<Skip> skipped) {

    public ParseResult {
        records = List.copyOf(records);
        skipped = List.copyOf(skipped);
    }

    /**
     * A single entry dropped from the batch. {@code section} locates it in the payload.
     */
    public record Skip(String section, String reason) {
        @Override
        public String toString() {
            return section + ": " + reason;
        }
    }
}
