package dev.bomcompare.parse;

import dev.bomcompare.model.ForecastRecord;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.*;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the BoM precis forecast text product (e.g. IDT16710).
 *
 * <p>
 * The product opens with an "Issued at ..." line, then one block per day headed
 * "Forecast for the rest of Friday" / "Forecast for Saturday 2 March". Each line
 * in a block is one forecast area:
 * </p>
 *
 * <pre>
 * Dunalley         Mostly sunny.        Min 12   Max 22   Chance of any rain: 20%   Possible rainfall: 0 to 2 mm
 * </pre>
 *
 * <p>
 * Block {@code i} becomes period {@code i}, valid on the date its header names (or issue
 * date + {@code i} days for "the rest of" and undated headers).
 * </p>
 */
public final class PrecisForecastParser implements ProductParser<ForecastRecord> {
    private static final Logger log = LoggerFactory.getLogger(PrecisForecastParser.class);

    private static final Pattern ISSUED = Pattern.compile(
            "Issued at\\s+(?:(?<h>\\d{1,2})[:.](?<m>\\d{2})\\s*(?<ampm>[ap]\\.?m\\.?))?.*?\\bon\\s+"
                    + "(?:[A-Za-z]+,?\\s+)?(?<day>\\d{1,2})\\s+(?<month>[A-Za-z]+)\\s+(?<year>\\d{4})",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern SECTION = Pattern.compile("^\\s*Forecast for\\b(?<rest>.*)$");
    private static final Pattern SECTION_DATE = Pattern.compile("\\b(?<day>\\d{1,2})\\s+(?<month>[A-Za-z]+)\\b");
    private static final Pattern ENTRY = Pattern.compile("^(?<area>[A-Z][A-Za-z0-9 .'()/-]*?)\\s{2,}(?<details>\\S.*)$");

    private static final Pattern SUMMARY = Pattern.compile("^(?<summary>[^.]*[A-Za-z][^.]*\\.)");
    private static final Pattern VALUE_START = Pattern.compile(
            "^(?:(?:Min|Max)(?:imum)?\\s+[^A-Za-z\\s]|Chance of any rain:|Possible rainfall:)");
    private static final Pattern MIN = Pattern.compile("\\bMin(?:imum)?\\s+(?<v>\\S+)");
    private static final Pattern MAX = Pattern.compile("\\bMax(?:imum)?\\s+(?<v>\\S+)");
    private static final Pattern CHANCE = Pattern.compile("\\bChance of any rain:\\s*(?<v>\\S+)");
    private static final Pattern RAINFALL = Pattern.compile("\\bPossible rainfall:\\s*(?<v>.*?)(?=\\s{2,}|$)");
    private static final Pattern RAIN_RANGE = Pattern.compile(
            "^(?<lo>\\d+(?:\\.\\d+)?)\\s*(?:to|-)\\s*(?<hi>\\d+(?:\\.\\d+)?)\\s*mm\\.?$");
    private static final Pattern INTEGER = Pattern.compile("^-?\\d+$");

    private final ZoneId zone;

    /**
     * @param zone zone the product's local issue time is interpreted in
     */
    public PrecisForecastParser(ZoneId zone) {
        this.zone = zone;
    }

    @Override
    public ParseResult<ForecastRecord> parse(String payload, Instant fetchedAt) throws PayloadParseException {
        if (payload == null || payload.isBlank())
            throw new PayloadParseException("payload", "forecast product is empty");

        Matcher im = ISSUED.matcher(payload);
        if (!im.find())
            throw new PayloadParseException("issued_at", "no 'Issued at ... on <date>' line found");
        ZonedDateTime issued = issuedAt(im);
        LocalDate issueDate = issued.toLocalDate();

        List<ForecastRecord> out = new ArrayList<>();
        List<ParseResult.Skip> skipped = new ArrayList<>();

        int period = -1;
        LocalDate validDate = null;
        Set<String> seenInPeriod = new HashSet<>();
        for (String raw : payload.split("\\R")) {
            String line = raw.stripTrailing();
            Matcher sec = SECTION.matcher(line);
            if (sec.matches()) {
                period++;
                validDate = sectionDate(sec.group("rest"), issueDate, period);
                seenInPeriod.clear();
                continue;
            }
            if (period < 0 || line.isBlank())
                continue;

            String section = "period " + period;
            Matcher em = ENTRY.matcher(line);
            if (!em.matches()) {
                skipped.add(new ParseResult.Skip(section, "unrecognised line '" + line.strip() + "'"));
                continue;
            }

            String area = em.group("area").strip();
            if (!seenInPeriod.add(area)) {
                skipped.add(new ParseResult.Skip(section + " " + area, "duplicate entry for area"));
                continue;
            }

            try {
                out.add(entry(area, em.group("details").strip(), issued.toInstant(), validDate,
                        period, fetchedAt));
            } catch (IllegalArgumentException e) {
                skipped.add(new ParseResult.Skip(section + " " + area, e.getMessage()));
            }
        }

        if (period < 0)
            throw new PayloadParseException("forecast sections", "no 'Forecast for ...' section found");

        for (ParseResult.Skip s : skipped)
            log.warn("Skipped precis entry {}", s);
        log.info("Parsed {} precis forecasts over {} periods (skipped={})", out.size(), period + 1, skipped.size());
        return new ParseResult<>(out, skipped);
    }

    /**
     * Builds one record from the text after the area name.
     */
    private ForecastRecord entry(String area, String details, Instant issuedAt, LocalDate validDate, int period,
            Instant fetchedAt) {
        String summary = null;
        String values = details;
        if (!VALUE_START.matcher(details).find()) {
            Matcher sm = SUMMARY.matcher(details);
            if (sm.find()) {
                summary = sm.group("summary").strip();
                values = details.substring(sm.end());
            }
        }

        // labelled values only; the summary sentence may say "chance of rain" or "max"
        Integer min = temperature(MIN, values, "minimum");
        Integer max = temperature(MAX, values, "maximum");
        Integer chance = chance(values);
        String rainfall = rainfall(values);

        if (summary == null && min == null && max == null && chance == null && rainfall == null)
            throw new IllegalArgumentException("no forecast content in '" + details + "'");

        return new ForecastRecord(area, issuedAt, validDate, period, summary, min, max, chance, rainfall, fetchedAt);
    }

    private static Integer temperature(Pattern p, String details, String what) {
        Matcher m = p.matcher(details);
        if (!m.find())
            return null;
        String v = stripTrailingDot(m.group("v"));
        if (!INTEGER.matcher(v).matches())
            throw new IllegalArgumentException("non-numeric " + what + " '" + m.group("v") + "'");
        return Integer.parseInt(v);
    }

    private static Integer chance(String details) {
        Matcher m = CHANCE.matcher(details);
        if (!m.find())
            return null;
        String v = stripTrailingDot(m.group("v"));
        if (v.endsWith("%"))
            v = v.substring(0, v.length() - 1);
        if (!INTEGER.matcher(v).matches())
            throw new IllegalArgumentException("non-numeric rain chance '" + m.group("v") + "'");
        int pct = Integer.parseInt(v);
        if (pct < 0 || pct > 100)
            throw new IllegalArgumentException("rain chance out of range: " + pct);
        return pct;
    }

    private static String rainfall(String details) {
        Matcher m = RAINFALL.matcher(details);
        if (!m.find())
            return null;
        Matcher rm = RAIN_RANGE.matcher(m.group("v").strip());
        if (!rm.matches())
            throw new IllegalArgumentException("unreadable rainfall range '" + m.group("v").strip() + "'");
        return rm.group("lo") + " to " + rm.group("hi") + " mm";
    }

    private static String stripTrailingDot(String s) {
        return s.endsWith(".") ? s.substring(0, s.length() - 1) : s;
    }

    /**
     * Day a section applies to. "Forecast for Saturday 2 March" names it; the year comes
     * from the issue date and rolls forward across a year end.
     * "The rest of Friday", or a header without a date, falls back to issue date + period.
     */
    private static LocalDate sectionDate(String rest, LocalDate issueDate, int period) {
        Matcher dm = SECTION_DATE.matcher(rest);
        if (rest.strip().toLowerCase(Locale.ROOT).startsWith("the rest of") || !dm.find())
            return issueDate.plusDays(period);

        Month month = month(dm.group("month"));
        if (month == null)
            return issueDate.plusDays(period);
        try {
            LocalDate d = LocalDate.of(issueDate.getYear(), month, Integer.parseInt(dm.group("day")));
            if (d.isBefore(issueDate.minusMonths(6)))
                d = d.plusYears(1);
            return d;
        } catch (DateTimeException e) {
            log.warn("Unreadable section date '{}', using issue date + {}", rest.strip(), period);
            return issueDate.plusDays(period);
        }
    }

    private ZonedDateTime issuedAt(Matcher im) throws PayloadParseException {
        Month month = month(im.group("month"));
        if (month == null)
            throw new PayloadParseException("issued_at", "unknown month '" + im.group("month") + "'");

        LocalDate date;
        try {
            date = LocalDate.of(Integer.parseInt(im.group("year")), month, Integer.parseInt(im.group("day")));
        } catch (DateTimeException e) {
            throw new PayloadParseException("issued_at", "invalid issue date: " + e.getMessage(), e);
        }

        LocalTime time = LocalTime.MIDNIGHT;
        if (im.group("h") != null) {
            int h = Integer.parseInt(im.group("h"));
            int m = Integer.parseInt(im.group("m"));
            if (h < 1 || h > 12 || m > 59)
                throw new PayloadParseException("issued_at", "invalid issue time " + h + ":" + im.group("m"));
            boolean pm = im.group("ampm").toLowerCase(Locale.ROOT).startsWith("p");
            time = LocalTime.of((h % 12) + (pm ? 12 : 0), m);
        }
        return ZonedDateTime.of(date, time, zone);
    }

    /**
     * Month from a full or abbreviated English name; BoM writes "Sept".
     */
    private static Month month(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.length() < 3)
            return null;
        if (lower.equals("sept"))
            return Month.SEPTEMBER;
        for (Month m : Month.values()) {
            if (m.name().toLowerCase(Locale.ROOT).startsWith(lower))
                return m;
        }
        return null;
    }
}
