package dev.bomcompare.parse;

import java.time.Instant;

/**
 * Decodes the raw text of one product into normalized records.
 *
 * <p>
 * Implementations throw {@link PayloadParseException} only when the payload as a
 * whole is unusable. A bad individual entry is reported as a
 * {@link ParseResult.Skip} and the rest of the batch is still returned.
 * </p>
 */
public interface ProductParser<T> {
    ParseResult<T> parse(String payload, Instant fetchedAt) throws PayloadParseException;
}
