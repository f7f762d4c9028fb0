package com.eyelevel.invoicetransformer.service.normalizer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * Lenient parsing of the scalar values found in source attributes. Nothing here throws: anything that
 * cannot be parsed falls back to zero or to today's date.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SourceValueParser {

    /**
     * The only date format the source system emits.
     */
    static final DateTimeFormatter SOURCE_DATE = DateTimeFormatter.ofPattern("dd/MM/uuuu")
                                                                   .withResolverStyle(ResolverStyle.STRICT);

    private static final Map<String, String> CURRENCY_NAMES = Map.of(
            "GBP", "Sterling",
            "EUR", "Euro",
            "USD", "US Dollar"
    );

    /**
     * Largest number of integer digits and of fraction digits a source amount may carry. Anything wider
     * is outside the range the source system itself can produce.
     */
    static final int MAX_INTEGER_DIGITS = 29;
    static final int MAX_FRACTION_DIGITS = 28;

    private final Clock clock;

    /**
     * Parses a {@code dd/MM/yyyy} date. An absent or malformed value yields the processing date, which
     * cannot be told apart from a source that really carried today's date.
     */
    public LocalDate isoDate(final String value) {
        final LocalDate parsed = parseDate(value);
        if (parsed != null) {
            return parsed;
        }
        if (StringUtils.hasText(value)) {
            log.debug("Date '{}' does not match dd/MM/yyyy; using the processing date", value);
        }
        return LocalDate.now(clock);
    }

    /**
     * Returns the number of days from {@code start} to {@code end}, or {@code fallback} when either
     * date is absent or malformed.
     */
    public int daysBetween(final String start, final String end, final int fallback) {
        final LocalDate startDate = parseDate(start);
        final LocalDate endDate = parseDate(end);
        if (startDate == null || endDate == null) {
            return fallback;
        }
        return (int) ChronoUnit.DAYS.between(startDate, endDate);
    }

    /**
     * Culture-invariant decimal parsing: {@code .} is the decimal point and {@code ,} groups thousands.
     * Blank, unparsable or out-of-range input yields zero; more than
     * {@value #MAX_FRACTION_DIGITS} fraction digits are rounded half-up.
     */
    public BigDecimal decimal(final String value) {
        if (!StringUtils.hasText(value)) {
            return BigDecimal.ZERO;
        }
        final BigDecimal parsed;
        try {
            parsed = new BigDecimal(StringUtils.deleteAny(value.trim(), ","));
        } catch (NumberFormatException e) {
            log.debug("Value '{}' is not a decimal; using 0", value);
            return BigDecimal.ZERO;
        }
        // precision - scale is the position of the leading digit relative to the decimal point
        final long magnitude = (long) parsed.precision() - parsed.scale();
        if (magnitude > MAX_INTEGER_DIGITS) {
            log.debug("Value '{}' is out of range; using 0", value);
            return BigDecimal.ZERO;
        }
        if (magnitude < -MAX_FRACTION_DIGITS) {
            return BigDecimal.ZERO;
        }
        if (parsed.scale() > MAX_FRACTION_DIGITS) {
            return parsed.setScale(MAX_FRACTION_DIGITS, RoundingMode.HALF_UP);
        }
        return parsed;
    }

    /**
     * Keeps only the digits of a value, e.g. {@code "SI-004512"} becomes {@code "004512"}.
     */
    public String digitsOnly(final String value) {
        if (value == null) {
            return "";
        }
        final StringBuilder digits = new StringBuilder(value.length());
        value.chars().filter(Character::isDigit).forEach(c -> digits.append((char) c));
        return digits.toString();
    }

    public String currencyName(final String currencyCode) {
        return CURRENCY_NAMES.getOrDefault(currencyCode, currencyCode);
    }

    private static LocalDate parseDate(final String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim(), SOURCE_DATE);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
