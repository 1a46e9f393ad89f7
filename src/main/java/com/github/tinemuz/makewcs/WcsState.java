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

/**
 * Snapshot of the linear WCS of one chip.
 *
 * <p>{@code orient} and {@code pscale} are derived from the CD matrix by
 * {@link #of}: {@code orient = atan2(cd12, cd22)} and
 * {@code pscale = sqrt(cd11^2 + cd21^2) * 3600}. The plate scale only looks
 * at the first CD column; see {@link #computePscale}.</p>
 */
public record WcsState(
        double crval1,
        double crval2,
        double crpix1,
        double crpix2,
        double cd11,
        double cd12,
        double cd21,
        double cd22,
        int naxis1,
        int naxis2,
        double orient,
        double pscale,
        String ctype1,
        String ctype2) {

    public static final String TAN_RA = "RA---TAN";
    public static final String TAN_DEC = "DEC--TAN";

    /** Build a state, deriving orientation and plate scale from the CD matrix. */
    public static WcsState of(
            double crval1,
            double crval2,
            double crpix1,
            double crpix2,
            double cd11,
            double cd12,
            double cd21,
            double cd22,
            int naxis1,
            int naxis2,
            String ctype1,
            String ctype2) {
        return new WcsState(crval1, crval2, crpix1, crpix2, cd11, cd12, cd21, cd22, naxis1, naxis2,
                computeOrient(cd12, cd22), computePscale(cd11, cd21), ctype1, ctype2);
    }

    /** Position angle of the Y axis in degrees. */
    public static double computeOrient(double cd12, double cd22) {
        return Math.toDegrees(Math.atan2(cd12, cd22));
    }

    /**
     * Plate scale in arcsec/pixel from the first CD column only. This is not
     * the Jacobian scale {@code sqrt(|det CD|)}; the two agree only for
     * square pixels without skew.
     */
    public static double computePscale(double cd11, double cd21) {
        return Math.sqrt(cd11 * cd11 + cd21 * cd21) * 3600.0;
    }

    public double determinant() {
        return cd11 * cd22 - cd12 * cd21;
    }
}
