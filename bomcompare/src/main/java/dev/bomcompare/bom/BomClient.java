package dev.bomcompare.bom;

import dev.bomcompare.config.AppConfig;
import dev.bomcompare.metrics.ExternalApiMetrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLConnection;
import java.net.http.*;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fetches raw BoM products (precis text over FTP, observations over HTTP).
 *
 * <p>
 * HTTP fetches are conditional: the ETag / Last-Modified of the last good
 * response is replayed, and a 304 comes back as a not-modified payload. FTP and
 * file URLs are read through {@link URLConnection} with the same timeout.
 * </p>
 */
public final class BomClient {
    private static final Logger log = LoggerFactory.getLogger(BomClient.class);
    static final String METRICS_SERVICE = "BOM";

    private final HttpClient http;
    private final AppConfig cfg;
    private final Clock clock;
    private final Map<Product, Validators> validators = new ConcurrentHashMap<>();

    /**
     * Creates a client using app config and the system UTC clock.
     */
    public BomClient(AppConfig cfg) {
        this(cfg, Clock.systemUTC());
    }

    public BomClient(AppConfig cfg, Clock clock) {
        this.cfg = cfg;
        this.clock = clock;
        this.http = HttpClient.newBuilder()
                .connectTimeout(cfg.fetchTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Retrieves the current payload for a product.
     */
    public RawPayload fetch(Product product) throws FetchException {
        String url = urlFor(product);
        String scheme = URI.create(url).getScheme();
        if (scheme == null)
            throw new FetchException(product, "No scheme in product URL " + url, (Integer) null);

        scheme = scheme.toLowerCase(Locale.ROOT);
        if (scheme.equals("http") || scheme.equals("https"))
            return fetchHttp(product, url);
        return fetchUrlConnection(product, url);
    }

    /**
     * Maps a product to its configured source URL.
     */
    public String urlFor(Product product) {
        return switch (product) {
            case FORECAST -> cfg.forecastUrl();
            case OBSERVATION -> cfg.observationUrl();
        };
    }

    private RawPayload fetchHttp(Product product, String url) throws FetchException {
        HttpRequest.Builder rb = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(cfg.fetchTimeout())
                .header("User-Agent", cfg.userAgent())
                .header("Accept", "application/json, text/plain, */*")
                .GET();

        Validators v = validators.get(product);
        if (v != null) {
            if (v.etag() != null)
                rb.header("If-None-Match", v.etag());
            if (v.lastModified() != null)
                rb.header("If-Modified-Since", v.lastModified());
        }

        HttpResponse<String> resp;
        try {
            resp = http.send(rb.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            ExternalApiMetrics.record(METRICS_SERVICE, false);
            throw new FetchException(product, "Timed out after " + cfg.fetchTimeout() + " url=" + url, e);
        } catch (IOException e) {
            ExternalApiMetrics.record(METRICS_SERVICE, false);
            throw new FetchException(product, "I/O error fetching " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(product, "Interrupted fetching " + url, e);
        }

        int status = resp.statusCode();
        if (status == 304) {
            ExternalApiMetrics.record(METRICS_SERVICE, true);
            log.info("{} not modified since last fetch ({})", product, url);
            return RawPayload.notModified(product, url, clock.instant());
        }
        if (status < 200 || status >= 300) {
            ExternalApiMetrics.record(METRICS_SERVICE, false);
            throw new FetchException(product, "BoM request failed: " + status + " url=" + url, status);
        }
        ExternalApiMetrics.record(METRICS_SERVICE, true);

        String etag = resp.headers().firstValue("ETag").orElse(null);
        String lastModified = resp.headers().firstValue("Last-Modified").orElse(null);
        if (etag != null || lastModified != null)
            validators.put(product, new Validators(etag, lastModified));

        log.debug("Fetched {} from {} ({} chars)", product, url, resp.body().length());
        return RawPayload.of(product, url, resp.body(), clock.instant());
    }

    private RawPayload fetchUrlConnection(Product product, String url) throws FetchException {
        int timeoutMs = (int) Math.min(Integer.MAX_VALUE, cfg.fetchTimeout().toMillis());
        try {
            URLConnection conn = URI.create(url).toURL().openConnection();
            conn.setConnectTimeout(timeoutMs);
            conn.setReadTimeout(timeoutMs);
            conn.setRequestProperty("User-Agent", cfg.userAgent());
            String body;
            try (InputStream in = conn.getInputStream()) {
                body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            ExternalApiMetrics.record(METRICS_SERVICE, true);
            log.debug("Downloaded {} from {} ({} chars)", product, url, body.length());
            return RawPayload.of(product, url, body, clock.instant());
        } catch (java.net.SocketTimeoutException e) {
            ExternalApiMetrics.record(METRICS_SERVICE, false);
            throw new FetchException(product, "Timed out after " + Duration.ofMillis(timeoutMs) + " url=" + url, e);
        } catch (IOException | IllegalArgumentException e) {
            ExternalApiMetrics.record(METRICS_SERVICE, false);
            throw new FetchException(product, "Failed to fetch " + url + ": " + e.getMessage(), e);
        }
    }

    /**
     * Conditional-request headers remembered from the last good response.
     */
    private record Validators(String etag, String lastModified) {
    }
}
