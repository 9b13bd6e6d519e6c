package dev.bomcompare.ingest;

import dev.bomcompare.bom.Product;
import dev.bomcompare.parse.ParseResult;

import java.util.List;

/**
 * What happened to one product during an ingest cycle. {@code upserted} counts rows the store
 * actually wrote, so a replay of an older fetch reports zero.
 */
public record ProductOutcome(Product product, Status status, int upserted, List<ParseResult.Skip> skipped,
        String error) {

    public enum Status {
        /** The batch was stored; {@code upserted} counts rows a newer fetch did not already hold. */
        OK,
        /** The source reported no change since the last fetch. */
        NOT_MODIFIED,
        /** The payload parsed but held no usable records. */
        EMPTY,
        FETCH_FAILED,
        PARSE_FAILED,
        STORE_FAILED
    }

    public ProductOutcome {
        skipped = List.copyOf(skipped);
    }

    public boolean succeeded() {
        return status == Status.OK || status == Status.NOT_MODIFIED;
    }

    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append(product.name().toLowerCase(java.util.Locale.ROOT)).append('=').append(status)
                .append(" upserted=").append(upserted)
                .append(" skipped=").append(skipped.size());
        if (error != null)
            sb.append(" error=\"").append(error).append('"');
        return sb.toString();
    }
}
