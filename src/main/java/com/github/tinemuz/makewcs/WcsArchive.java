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

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Backup copy of a chip's WCS taken before it was first updated.
 *
 * @param prefix character prepended to the active keyword names
 * @param state archived WCS values
 * @param timestamp when the copy was made ({@code WCSCDATE})
 */
public record WcsArchive(String prefix, WcsState state, String timestamp) {

    /** Default archive prefix: {@code CD1_1} is backed up as {@code OCD1_1}. */
    public static final String DEFAULT_PREFIX = "O";

    /** Time format of {@code WCSCDATE}. */
    static final DateTimeFormatter ARCHIVE_TIME = DateTimeFormatter.ofPattern("HH:mm:ss (dd/MM/yyyy)");

    public WcsArchive {
        checkPrefix(prefix);
    }

    /**
     * A longer prefix would truncate {@code CRPIX1} and {@code CRPIX2} (and the
     * other numbered keywords) to the same eight-character archive name.
     *
     * @throws IllegalArgumentException unless {@code prefix} is one letter or digit
     */
    static void checkPrefix(String prefix) {
        if (prefix.length() != 1 || !Character.isLetterOrDigit(prefix.charAt(0))) {
            throw new IllegalArgumentException("Archive prefix must be a single letter or digit: '" + prefix + "'");
        }
    }

    /** Archive timestamp for the current time. */
    static String now() {
        return LocalDateTime.now().format(ARCHIVE_TIME);
    }

    /** Archive keyword name of each active keyword. */
    public Map<WcsKeyword, String> backupKeywords() {
        Map<WcsKeyword, String> names = new LinkedHashMap<>();
        for (WcsKeyword k : WcsKeyword.values()) names.put(k, k.archiveName(prefix));
        return names;
    }

    /**
     * Archive keyword to value, including the plate scale entry and
     * {@code WCSCDATE}.
     */
    public Map<String, Object> values() {
        Map<String, Object> values = new LinkedHashMap<>();
        for (WcsKeyword k : WcsKeyword.values()) values.put(k.archiveName(prefix), k.valueOf(state));
        values.put(WcsKeyword.ARCHIVE_DATE, timestamp);
        return values;
    }

    /** Archived value of an active keyword. */
    public Object valueOf(WcsKeyword keyword) {
        return keyword.valueOf(state);
    }
}
