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

/**
 * Which distortion solution to read from a table.
 *
 * <p>Also serves as the cache key for loaded models, so two chips that need
 * the same row share one lookup.</p>
 *
 * @param table table name as given in the image header
 * @param chip detector chip id
 * @param filter1 first filter, already normalised
 * @param filter2 second filter, already normalised
 * @param direction solution direction
 * @param date observation date, needed when V2/V3 come from an offset table
 */
public record CalibrationKey(
        String table, int chip, String filter1, String filter2, Direction direction, LocalDate date) {

    public static final String CLEAR = "CLEAR";

    public CalibrationKey {
        filter1 = normalizeFilter(filter1);
        filter2 = normalizeFilter(filter2);
        if (direction == null) direction = Direction.FORWARD;
    }

    /** Blank filters read as CLEAR, and every CLEARn position collapses to CLEAR. */
    public static String normalizeFilter(String filter) {
        if (filter == null || filter.isBlank()) return CLEAR;
        String f = filter.trim();
        return f.startsWith(CLEAR) ? CLEAR : f;
    }
}
