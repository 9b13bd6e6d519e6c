package dev.bomcompare.bom;

import dev.bomcompare.IngestException;

/**
 * Network failure, timeout or non-success status while fetching a product.
 */
public class FetchException extends IngestException {
    private final Product product;
    private final Integer httpStatus;

    public FetchException(Product product, String message, Integer httpStatus) {
        super(message);
        this.product = product;
        this.httpStatus = httpStatus;
    }

    public FetchException(Product product, String message, Throwable cause) {
        super(message, cause);
        this.product = product;
        this.httpStatus = null;
    }

    public Product product() {
        return product;
    }

    /**
     * HTTP status of the failed response, or null when no response arrived.
     */
    public Integer httpStatus() {
        return httpStatus;
    }
}
