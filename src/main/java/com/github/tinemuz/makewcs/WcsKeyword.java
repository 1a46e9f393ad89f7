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

import java.util.Map;

/**
 * The WCS keywords that are read, written and archived, with the FITS name
 * of each. {@link #PSCALE} is not a header keyword; it is only carried in
 * the archive.
 */
public enum WcsKeyword {
    NAXIS1("NAXIS1"),
    NAXIS2("NAXIS2"),
    CRPIX1("CRPIX1"),
    CRPIX2("CRPIX2"),
    CRVAL1("CRVAL1"),
    CRVAL2("CRVAL2"),
    CTYPE1("CTYPE1"),
    CTYPE2("CTYPE2"),
    CD1_1("CD1_1"),
    CD1_2("CD1_2"),
    CD2_1("CD2_1"),
    CD2_2("CD2_2"),
    ORIENTAT("ORIENTAT"),
    PSCALE(null);

    /** Keyword holding the time the archive copy was made. */
    public static final String ARCHIVE_DATE = "WCSCDATE";
    /** FITS keyword names are at most this long. */
    public static final int MAX_KEYWORD_LENGTH = 8;

    private final String fitsName;

    WcsKeyword(String fitsName) {
        this.fitsName = fitsName;
    }

    /** FITS keyword name, or {@code null} for {@link #PSCALE}. */
    public String fitsName() {
        return fitsName;
    }

    public boolean inHeader() {
        return fitsName != null;
    }

    /**
     * Name of the archive copy of this keyword under {@code prefix}, cut to
     * eight characters ({@code ORIENTAT} under {@code O} is {@code OORIENTA}).
     */
    public String archiveName(String prefix) {
        if (this == PSCALE) return prefix.toLowerCase() + "pscale";
        String name = prefix + fitsName;
        return name.length() <= MAX_KEYWORD_LENGTH ? name : name.substring(0, MAX_KEYWORD_LENGTH);
    }

    /** Look up the header-backed keyword with this FITS name, or {@code null}. */
    public static WcsKeyword forFitsName(String name) {
        for (WcsKeyword k : values()) {
            if (k.inHeader() && k.fitsName.equals(name)) return k;
        }
        return null;
    }

    /** Value of this keyword in a WCS state. */
    public Object valueOf(WcsState s) {
        switch (this) {
            case NAXIS1: return s.naxis1();
            case NAXIS2: return s.naxis2();
            case CRPIX1: return s.crpix1();
            case CRPIX2: return s.crpix2();
            case CRVAL1: return s.crval1();
            case CRVAL2: return s.crval2();
            case CTYPE1: return s.ctype1();
            case CTYPE2: return s.ctype2();
            case CD1_1: return s.cd11();
            case CD1_2: return s.cd12();
            case CD2_1: return s.cd21();
            case CD2_2: return s.cd22();
            case ORIENTAT: return s.orient();
            case PSCALE: return s.pscale();
            default: throw new AssertionError(this);
        }
    }

    /** Write every header-backed keyword of {@code s} to {@code header}. */
    public static void writeTo(Header header, WcsState s) {
        for (WcsKeyword k : values()) {
            if (k.inHeader()) header.put(k.fitsName, k.valueOf(s));
        }
    }

    /**
     * Build a state from keyword values. Orientation and plate scale are
     * recomputed from the CD matrix.
     */
    static WcsState stateOf(Map<WcsKeyword, Object> values) {
        return WcsState.of(
                number(values, CRVAL1),
                number(values, CRVAL2),
                number(values, CRPIX1),
                number(values, CRPIX2),
                number(values, CD1_1),
                number(values, CD1_2),
                number(values, CD2_1),
                number(values, CD2_2),
                (int) number(values, NAXIS1),
                (int) number(values, NAXIS2),
                String.valueOf(values.get(CTYPE1)).trim(),
                String.valueOf(values.get(CTYPE2)).trim());
    }

    private static double number(Map<WcsKeyword, Object> values, WcsKeyword k) {
        Object v = values.get(k);
        if (v instanceof Number) return ((Number) v).doubleValue();
        return Double.parseDouble(String.valueOf(v).trim());
    }
}
