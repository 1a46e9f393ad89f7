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

import java.util.Set;

/**
 * Keyword access to one FITS-style header.
 *
 * <p>Values are {@link String}, {@link Double}, {@link Integer} or
 * {@link Boolean}. Lookups of absent keywords return {@code null}; the typed
 * helpers take a default instead.</p>
 */
public interface Header {

    /** Raw value of a keyword, or {@code null} when absent. */
    Object get(String keyword);

    /** Set (or add) a keyword. */
    void put(String keyword, Object value);

    boolean containsKey(String keyword);

    /** Keyword names in header order. */
    Set<String> keywords();

    /**
     * String value of a keyword, trimmed, or {@code null} when absent. A value
     * that runs into the card's comment delimiter loses the trailing slash.
     */
    default String getString(String keyword) {
        Object value = get(keyword);
        if (value == null) return null;
        String s = value.toString().trim();
        if (s.endsWith("/")) s = s.substring(0, s.length() - 1).trim();
        return s;
    }

    /** Numeric value of a keyword, or {@code defaultValue} when absent or unparsable. */
    default double getDouble(String keyword, double defaultValue) {
        Object value = get(keyword);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).doubleValue();
        String s = getString(keyword);
        try {
            return Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /** Integer value of a keyword, or {@code defaultValue} when absent or not an integer. */
    default int getInt(String keyword, int defaultValue) {
        Object value = get(keyword);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        String s = getString(keyword);
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
