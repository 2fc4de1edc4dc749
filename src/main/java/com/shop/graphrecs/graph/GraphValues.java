package com.shop.graphrecs.graph;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;

/**
 * Coercions applied to row values before they are sent as statement parameters.
 * Mirrors Cypher's toFloat/toInteger: unreadable text becomes null instead of failing the batch.
 */
@Slf4j
public final class GraphValues {

    private GraphValues() {
    }

    /**
     * Values outside the double range become null
     */
    public static Double toFloat(String value) {
        BigDecimal number = toNumber(value);
        if (number == null) {
            return null;
        }
        double result = number.doubleValue();
        if (Double.isInfinite(result)) {
            log.warn("Float value out of range, writing null: {}", value);
            return null;
        }
        return result;
    }

    /**
     * Fractional values are truncated toward zero; values outside the long range become null
     */
    public static Long toInteger(String value) {
        BigDecimal number = toNumber(value);
        if (number == null) {
            return null;
        }
        try {
            return number.setScale(0, RoundingMode.DOWN).longValueExact();
        } catch (ArithmeticException e) {
            log.warn("Integer value out of range, writing null: {}", value);
            return null;
        }
    }

    /**
     * @param canonical yyyy-MM-dd as produced by the normalizer, or null
     */
    public static LocalDate toDate(String canonical) {
        if (canonical == null || canonical.isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(canonical);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Not a canonical date: " + canonical, e);
        }
    }

    /**
     * @param canonical yyyy-MM-ddTHH:mm:ssZ as produced by the normalizer, or null
     */
    public static ZonedDateTime toDateTime(String canonical) {
        if (canonical == null || canonical.isEmpty()) {
            return null;
        }
        try {
            return ZonedDateTime.parse(canonical);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Not a canonical timestamp: " + canonical, e);
        }
    }

    private static BigDecimal toNumber(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
