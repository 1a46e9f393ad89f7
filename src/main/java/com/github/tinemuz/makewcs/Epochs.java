/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.makewcs;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Observation date handling. Header dates come as {@code YYYY-MM-DD},
 * optionally followed by {@code Thh:mm:ss}; interpolation works on decimal
 * years.
 */
public final class Epochs {
    private static final double EPOCH_YEAR = 1970.0;
    private static final double SECONDS_PER_YEAR = 365.25 * 86_400.0;

    private Epochs() {}

    /**
     * Parse a DATE-OBS style value. Any time part is ignored.
     *
     * @throws IllegalArgumentException if the date cannot be parsed
     */
    public static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing observation date");
        }
        String datePart = value.trim();
        int t = datePart.indexOf('T');
        if (t >= 0) datePart = datePart.substring(0, t);
        try {
            return LocalDate.parse(datePart);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unparsable observation date '" + value + "'", e);
        }
    }

    /** Decimal year of a date at 00:00. */
    public static double decimalYear(LocalDate date) {
        return decimalYear(date.atStartOfDay());
    }

    /**
     * Decimal year in Julian years of 365.25 days counted from 1970-01-01T00:00.
     * Equal time intervals give equal differences, also across year boundaries.
     */
    public static double decimalYear(LocalDateTime dateTime) {
        double seconds = dateTime.toEpochSecond(ZoneOffset.UTC);
        return EPOCH_YEAR + seconds / SECONDS_PER_YEAR;
    }
}
