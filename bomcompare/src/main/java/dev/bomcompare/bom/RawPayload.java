package dev.bomcompare.bom;

import java.time.Instant;

/**
 * Body of a product exactly as published, plus when it was fetched.
 *
 * <p>
 * {@code notModified} is set when the source answered a conditional request
 * with 304; {@code body} is then null.
 * </p>
 */
public record RawPayload(Product product, String source, String body, Instant fetchedAt, boolean notModified) {

    public static RawPayload of(Product product, String source, String body, Instant fetchedAt) {
        return new RawPayload(product, source, body, fetchedAt, false);
    }

    public static RawPayload notModified(Product product, String source, Instant fetchedAt) {
        return new RawPayload(product, source, null, fetchedAt, true);
    }
}
