package dev.bomcompare.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.bomcompare.model.ObservationRecord;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses a BoM station observation JSON product (e.g. IDT60801.94951.json).
 *
 * <p>
 * Readings live under {@code observations.data}; each carries its UTC time in
 * {@code aifstime_utc} as {@code yyyyMMddHHmmss}. BoM writes "-" for a value it
 * has no reading for.
 * </p>
 */
public final class ObservationJsonParser implements ProductParser<ObservationRecord> {
    private static final Logger log = LoggerFactory.getLogger(ObservationJsonParser.class);
    private static final DateTimeFormatter AIFS_UTC = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final ObjectMapper om;
    private final String defaultStationId;

    /**
     * @param defaultStationId used when a reading has no {@code wmo} number
     */
    public ObservationJsonParser(ObjectMapper om, String defaultStationId) {
        this.om = om;
        this.defaultStationId = defaultStationId;
    }

    @Override
    public ParseResult<ObservationRecord> parse(String payload, Instant fetchedAt) throws PayloadParseException {
        if (payload == null || payload.isBlank())
            throw new PayloadParseException("payload", "observation product is empty");

        JsonNode root;
        try {
            root = om.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new PayloadParseException("payload", "not valid JSON: " + e.getOriginalMessage(), e);
        }

        JsonNode data = root.path("observations").path("data");
        if (!data.isArray())
            throw new PayloadParseException("observations.data", "missing or not an array");

        List<ObservationRecord> out = new ArrayList<>();
        List<ParseResult.Skip> skipped = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < data.size(); i++) {
            String section = "observations.data[" + i + "]";
            try {
                ObservationRecord rec = reading(data.get(i), fetchedAt);
                if (!seen.add(rec.naturalKey())) {
                    skipped.add(new ParseResult.Skip(section, "duplicate reading at " + rec.observedAt()));
                    continue;
                }
                out.add(rec);
            } catch (IllegalArgumentException e) {
                skipped.add(new ParseResult.Skip(section, e.getMessage()));
            }
        }

        for (ParseResult.Skip s : skipped)
            log.warn("Skipped observation {}", s);
        log.info("Parsed {} observations (skipped={})", out.size(), skipped.size());
        return new ParseResult<>(out, skipped);
    }

    private ObservationRecord reading(JsonNode obs, Instant fetchedAt) {
        if (obs == null || !obs.isObject())
            throw new IllegalArgumentException("reading is not an object");

        String utc = text(obs, "aifstime_utc");
        if (utc == null)
            throw new IllegalArgumentException("missing aifstime_utc");
        Instant observedAt;
        try {
            observedAt = LocalDateTime.parse(utc, AIFS_UTC).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("unreadable aifstime_utc '" + utc + "'");
        }

        String station = text(obs, "wmo");
        if (station == null)
            station = defaultStationId;
        if (station == null)
            throw new IllegalArgumentException("no wmo station number");

        Double rh = number(obs, "rel_hum");
        return new ObservationRecord(
                station,
                text(obs, "name"),
                observedAt,
                number(obs, "air_temp"),
                rh == null ? null : (int) Math.round(rh),
                number(obs, "wind_spd_kmh"),
                text(obs, "wind_dir"),
                number(obs, "rain_trace"),
                fetchedAt);
    }

    /**
     * Reads a text field; null, blank and "-" all mean absent.
     */
    private static String text(JsonNode obs, String field) {
        JsonNode n = obs.get(field);
        if (n == null || n.isNull())
            return null;
        String s = n.asText().strip();
        if (s.isEmpty() || s.equals("-"))
            return null;
        return s;
    }

    /**
     * Reads a numeric field that BoM sometimes sends as a string.
     */
    private static Double number(JsonNode obs, String field) {
        JsonNode n = obs.get(field);
        if (n != null && n.isNumber())
            return n.asDouble();
        String s = text(obs, field);
        if (s == null)
            return null;
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("non-numeric " + field + " '" + s + "'");
        }
    }
}
