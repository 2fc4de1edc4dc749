package com.shop.graphrecs.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.format.SignStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Best-effort parser for free-form date and timestamp text.
 * Never throws: anything it cannot read comes back as {@link Optional#empty()}.
 */
@Service
@Slf4j
public class TemporalParser {

    public static final DateTimeFormatter CANONICAL_DATE = DateTimeFormatter.ofPattern("uuuu-MM-dd");
    public static final DateTimeFormatter CANONICAL_TIMESTAMP = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss'Z'");

    // Textual renderings of missing values that show up when nullable columns are stringified
    private static final Set<String> ABSENT_TOKENS = Set.of("", "none", "null", "nan", "nat");

    // Two-digit years ("uu") resolve into 2000-2099
    private static final List<String> DATE_PATTERNS = List.of(
            "uuuu-M-d",
            "uuuu/M/d",
            "M/d/uuuu",
            "M/d/uu",
            "d.M.uuuu",
            "d MMM uuuu",
            "d MMMM uuuu",
            "MMM d, uuuu",
            "MMMM d, uuuu",
            "MMM d uuuu",
            "MMMM d uuuu"
    );

    private static final List<DateTimeFormatter> FORMATS = buildFormats();

    /**
     * Parse a calendar date.
     *
     * @return canonical {@code yyyy-MM-dd}, or empty when the value is not a readable date
     */
    public Optional<String> parseDate(Object raw) {
        return parse(raw).map(value -> {
            if (value instanceof ZonedDateTime) {
                return ((ZonedDateTime) value).toLocalDate();
            }
            if (value instanceof LocalDateTime) {
                return ((LocalDateTime) value).toLocalDate();
            }
            return (LocalDate) value;
        }).map(CANONICAL_DATE::format);
    }

    /**
     * Parse a point in time. Values without a zone are taken as UTC, zoned values are
     * converted to UTC, bare dates become midnight UTC.
     *
     * @return canonical {@code yyyy-MM-ddTHH:mm:ssZ}, or empty when the value is not readable
     */
    public Optional<String> parseTimestamp(Object raw) {
        return parse(raw).map(value -> {
            if (value instanceof ZonedDateTime) {
                return ((ZonedDateTime) value).withZoneSameInstant(ZoneOffset.UTC);
            }
            if (value instanceof LocalDateTime) {
                return ((LocalDateTime) value).atZone(ZoneOffset.UTC);
            }
            return ((LocalDate) value).atStartOfDay(ZoneOffset.UTC);
        }).map(CANONICAL_TIMESTAMP::format);
    }

    private Optional<TemporalAccessor> parse(Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String text = String.valueOf(raw).trim();
        if (ABSENT_TOKENS.contains(text.toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }

        DateTimeException lastFailure = null;
        for (DateTimeFormatter format : FORMATS) {
            try {
                return Optional.of(format.parseBest(text, ZonedDateTime::from, LocalDateTime::from, LocalDate::from));
            } catch (DateTimeException e) {
                lastFailure = e;
            }
        }
        log.debug("Unparsable temporal value '{}': {}", text, lastFailure.getMessage());
        return Optional.empty();
    }

    private static List<DateTimeFormatter> buildFormats() {
        List<DateTimeFormatter> formats = new ArrayList<>();
        for (String pattern : DATE_PATTERNS) {
            formats.add(withOptionalTime(pattern));
        }
        for (String pattern : DATE_PATTERNS) {
            formats.add(withTwelveHourTime(pattern));
        }
        formats.add(dateOnly("uuuuMMdd"));
        return List.copyOf(formats);
    }

    private static DateTimeFormatter withOptionalTime(String datePattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(datePattern)
                .optionalStart()
                    .optionalStart().appendLiteral('T').optionalEnd()
                    .optionalStart().appendLiteral(' ').optionalEnd()
                    .appendValue(ChronoField.HOUR_OF_DAY, 1, 2, SignStyle.NOT_NEGATIVE)
                    .appendLiteral(':')
                    .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
                    .optionalStart()
                        .appendLiteral(':')
                        .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
                        .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
                    .optionalEnd()
                    .optionalStart().appendLiteral(' ').optionalEnd()
                    .optionalStart().appendLiteral("UTC").optionalEnd()
                    .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
                    .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
                    .optionalStart().appendOffset("+HH", "Z").optionalEnd()
                    .optionalStart()
                        .appendLiteral('[')
                        .parseCaseSensitive()
                        .appendZoneRegionId()
                        .parseCaseInsensitive()
                        .appendLiteral(']')
                    .optionalEnd()
                .optionalEnd()
                .toFormatter(Locale.ENGLISH)
                .withChronology(IsoChronology.INSTANCE)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * Date followed by a clock time with an AM/PM marker, e.g. {@code 2023-03-05 2:30 PM}
     */
    private static DateTimeFormatter withTwelveHourTime(String datePattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(datePattern)
                .appendLiteral(' ')
                .appendValue(ChronoField.CLOCK_HOUR_OF_AMPM, 1, 2, SignStyle.NOT_NEGATIVE)
                .appendLiteral(':')
                .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
                .optionalStart()
                    .appendLiteral(':')
                    .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
                .optionalEnd()
                .optionalStart().appendLiteral(' ').optionalEnd()
                .appendText(ChronoField.AMPM_OF_DAY)
                .toFormatter(Locale.ENGLISH)
                .withChronology(IsoChronology.INSTANCE)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    private static DateTimeFormatter dateOnly(String datePattern) {
        return new DateTimeFormatterBuilder()
                .appendPattern(datePattern)
                .toFormatter(Locale.ENGLISH)
                .withChronology(IsoChronology.INSTANCE)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
