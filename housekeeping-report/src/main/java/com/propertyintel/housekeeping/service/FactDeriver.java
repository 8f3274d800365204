package com.propertyintel.housekeeping.service;

import com.propertyintel.housekeeping.config.HousekeepingReportProperties;
import com.propertyintel.housekeeping.model.FeatureFact;
import com.propertyintel.housekeeping.model.HousekeepingFact;
import com.propertyintel.housekeeping.model.HousekeepingRow;
import com.propertyintel.housekeeping.model.RoomUsageFact;
import com.propertyintel.housekeeping.model.RoomUsageRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Adds row-level facts to normalized rows. One fact per row, in input order.
 *
 * Unreadable values never fail the run: a bad Date leaves the fact without a
 * timestamp, a bad Number of Nights counts as 0.
 */
@Component
@Slf4j
public class FactDeriver {

    public static final String ARROW = " → ";

    private static final Pattern FEATURE_SEPARATORS = Pattern.compile("[|/;,]");

    private static final List<DateTimeFormatter> FALLBACK_DATE_TIMES = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            formatter("yyyy-MM-dd H:mm[:ss]"),
            formatter("M/d/yyyy h:mm[:ss] a"),
            formatter("M/d/yyyy H:mm:ss"),
            formatter("M/d/yy H:mm"),
            formatter("M/d/yy h:mm a"),
            formatter("MMM d, yyyy h:mm a"),
            formatter("MMM d, yyyy H:mm")
    );

    private static final List<DateTimeFormatter> FALLBACK_DATES = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            formatter("M/d/yyyy"),
            formatter("MMM d, yyyy"),
            formatter("d-MMM-yyyy")
    );

    private final DateTimeFormatter primaryFormat;

    public FactDeriver(HousekeepingReportProperties properties) {
        this.primaryFormat = formatter(properties.getInput().getDateFormat());
    }

    public List<HousekeepingFact> deriveHousekeeping(List<HousekeepingRow> rows) {
        List<HousekeepingFact> facts = rows.stream().map(this::derive).toList();

        long unparsed = facts.stream().filter(f -> f.getTimestamp() == null).count();
        if (unparsed > 0) {
            log.warn("{} of {} housekeeping rows have an unreadable Date", unparsed, facts.size());
        }
        return facts;
    }

    public HousekeepingFact derive(HousekeepingRow row) {
        String before = row.getHskStatusBefore();
        String after = row.getHskStatusAfter();
        return HousekeepingFact.builder()
                .row(row)
                .changed(!before.equals(after))
                .transition(before + ARROW + after)
                .timestamp(parseTimestamp(row.getDate()))
                .build();
    }

    public List<RoomUsageFact> deriveRoomUsage(List<RoomUsageRow> rows) {
        List<RoomUsageFact> facts = rows.stream().map(this::derive).toList();

        long unparsable = facts.stream().filter(RoomUsageFact::isNightsUnparsable).count();
        if (unparsable > 0) {
            log.warn("{} of {} room usage rows have a non-numeric Number of Nights, counted as 0",
                    unparsable, facts.size());
        }
        return facts;
    }

    public RoomUsageFact derive(RoomUsageRow row) {
        String raw = row.getNumberOfNights();
        Double parsed = parseNights(raw);
        return RoomUsageFact.builder()
                .row(row)
                .nights(parsed == null ? 0.0 : parsed)
                .nightsUnparsable(parsed == null && !raw.isBlank())
                .features(tokenize(row.getFeatures()))
                .build();
    }

    /** One {@link FeatureFact} per feature token of every usage row. */
    public List<FeatureFact> expandFeatures(List<RoomUsageFact> facts) {
        return facts.stream()
                .flatMap(f -> f.getFeatures().stream()
                        .map(token -> new FeatureFact(token, f.roomNumber(), f.getNights())))
                .toList();
    }

    /** Fraction of facts with a readable day; 0 for an empty table. */
    public double dateParseSuccessRate(List<HousekeepingFact> facts) {
        if (facts.isEmpty()) return 0.0;
        long parsed = facts.stream().filter(f -> f.getTimestamp() != null).count();
        return (double) parsed / facts.size();
    }

    // ── Parsing ──────────────────────────────────────────────────────────────

    LocalDateTime parseTimestamp(String value) {
        if (value == null || value.isBlank()) return null;
        String v = value.trim();

        LocalDateTime primary = tryDateTime(v, primaryFormat);
        if (primary != null) return primary;

        for (DateTimeFormatter f : FALLBACK_DATE_TIMES) {
            LocalDateTime parsed = tryDateTime(v, f);
            if (parsed != null) return parsed;
        }
        for (DateTimeFormatter f : FALLBACK_DATES) {
            LocalDate parsed = tryDate(v, f);
            if (parsed != null) return parsed.atStartOfDay();
        }
        log.debug("Unreadable Date value: '{}'", v);
        return null;
    }

    private LocalDateTime tryDateTime(String value, DateTimeFormatter f) {
        try {
            return LocalDateTime.parse(value, f);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private LocalDate tryDate(String value, DateTimeFormatter f) {
        try {
            return LocalDate.parse(value, f);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    Double parseNights(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            double d = Double.parseDouble(value.trim());
            if (Double.isNaN(d) || Double.isInfinite(d)) return null;
            return Math.max(0.0, d);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    List<String> tokenize(String features) {
        if (features == null || features.isBlank()) return List.of();
        return Arrays.stream(FEATURE_SEPARATORS.split(features))
                .map(String::trim)
                .filter(t -> !t.isEmpty())
                .toList();
    }

    /** Strict formatter for {@code pattern}; unquoted {@code y} is read as proleptic year {@code u}. */
    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(prolepticYear(pattern))
                .toFormatter(Locale.US)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    private static String prolepticYear(String pattern) {
        StringBuilder out = new StringBuilder(pattern.length());
        boolean quoted = false;
        for (char c : pattern.toCharArray()) {
            if (c == '\'') quoted = !quoted;
            out.append(!quoted && c == 'y' ? 'u' : c);
        }
        return out.toString();
    }
}
