package com.salesanalytics.domain.service;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Parses the date cell of a sales row at day granularity.
 *
 * Patterns are tried in order and resolved strictly, so impossible dates
 * such as 2023-02-30 are rejected rather than adjusted. A pattern may carry
 * a time of day (dropped) or stop at the month (first day of the month).
 */
@Slf4j
public class SalesDateParser {

    public static final List<String> DEFAULT_PATTERNS = List.of(
            "uuuu-MM-dd",
            "uuuu-MM-dd HH:mm:ss",
            "uuuu-MM-dd'T'HH:mm:ss",
            "uuuu/MM/dd",
            "uuuu-MM"
    );

    private final List<DateTimeFormatter> formatters;

    public SalesDateParser() {
        this(DEFAULT_PATTERNS);
    }

    public SalesDateParser(List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("At least one date pattern is required");
        }
        this.formatters = patterns.stream()
                .map(pattern -> DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT))
                .collect(Collectors.toUnmodifiableList());
    }

    public Optional<LocalDate> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        for (DateTimeFormatter formatter : formatters) {
            try {
                TemporalAccessor parsed = formatter.parseBest(trimmed,
                        LocalDateTime::from, LocalDate::from, YearMonth::from);
                return Optional.of(toLocalDate(parsed));
            } catch (DateTimeParseException e) {
                log.trace("Date '{}' does not match {}: {}", trimmed, formatter, e.getMessage());
            }
        }
        return Optional.empty();
    }

    private static LocalDate toLocalDate(TemporalAccessor parsed) {
        if (parsed instanceof LocalDateTime) {
            return ((LocalDateTime) parsed).toLocalDate();
        }
        if (parsed instanceof YearMonth) {
            return ((YearMonth) parsed).atDay(1);
        }
        return (LocalDate) parsed;
    }
}
