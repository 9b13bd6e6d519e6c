package dev.bomcompare.db;

import dev.bomcompare.model.DateRange;

/**
 * Read filter for stored records. A null range or station means "any".
 */
public record RecordFilter(DateRange range, String stationId) {

    public static RecordFilter all() {
        return new RecordFilter(null, null);
    }

    public static RecordFilter of(DateRange range) {
        return new RecordFilter(range, null);
    }
}
