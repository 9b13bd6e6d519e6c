package dev.bomcompare.model;

/**
 * The two stored record kinds, with the table that holds each.
 */
public enum RecordType {
    FORECAST("forecast"),
    OBSERVATION("observation");

    private final String table;

    RecordType(String table) {
        this.table = table;
    }

    public String table() {
        return table;
    }
}
