package com.netcourier.docstruct.service.dedup;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Date forms recognised in extracted values. Slash dates are read month first, and only fall back to day
 * first when that is the sole valid reading.
 */
public final class DateValues {

    private static final List<DateTimeFormatter> FORMATS = List.of(
            formatter("uuuu-M-d"),
            formatter("uuuu/M/d"),
            formatter("M/d/uuuu"),
            formatter("d/M/uuuu"),
            formatter("d-M-uuuu"),
            formatter("d.M.uuuu"),
            formatter("d-MMM-uuuu"),
            formatter("d-MMM-uu"),
            formatter("d-MMMM-uuuu"),
            formatter("d MMM uuuu"),
            formatter("d MMMM uuuu"),
            formatter("MMM d, uuuu"),
            formatter("MMMM d, uuuu")
    );

    private DateValues() {
    }

    public static Optional<LocalDate> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String candidate = value.strip();
        for (DateTimeFormatter format : FORMATS) {
            try {
                return Optional.of(LocalDate.parse(candidate, format));
            } catch (DateTimeParseException ignored) {
                // try the next form
            }
        }
        return Optional.empty();
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
