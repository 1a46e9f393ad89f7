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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polynomial geometric distortion solution of one chip.
 *
 * <p>{@code fx[i][j]} and {@code fy[i][j]} multiply {@code x^j * y^(i-j)},
 * both relative to the reference pixel, giving V2/V3-aligned offsets in
 * arcsec. Only {@code i > 0, j <= i} is populated.</p>
 */
public final class DistortionModel {
    private static final Logger log = LoggerFactory.getLogger(DistortionModel.class);
    private static final int MIN_ORDER = 3;

    private final int chip;
    private final String filter1;
    private final String filter2;
    private final Direction direction;
    private final int order;
    private final double[][] fx;
    private final double[][] fy;
    private final RefPix refPix;

    DistortionModel(
            int chip,
            String filter1,
            String filter2,
            Direction direction,
            int order,
            double[][] fx,
            double[][] fy,
            RefPix refPix) {
        this.chip = chip;
        this.filter1 = filter1;
        this.filter2 = filter2;
        this.direction = direction;
        this.order = order;
        this.fx = fx;
        this.fy = fy;
        this.refPix = refPix;
    }

    /**
     * Read the first row of an IDC table matching the key.
     *
     * <p>A row matches when its filters equal the requested ones, its
     * direction equals the requested direction and its DETCHIP is the
     * requested chip or the {@code -999} wildcard. V2REF/V3REF come from the
     * row when the table has them, otherwise from {@code offsetTable}
     * interpolated to the key's date.</p>
     *
     * @param offsetTable OFFTAB, may be {@code null}
     * @throws CalibrationLookupException if no row matches
     * @throws CalibrationFileException if a needed column is missing or a
     *     cell cannot be parsed
     */
    public static DistortionModel load(
            CalibrationTable table, CalibrationKey key, CalibrationTable offsetTable) {
        try {
            return read(table, key, offsetTable);
        } catch (IllegalArgumentException e) {
            throw new CalibrationFileException(table.name(), e.getMessage(), e);
        }
    }

    private static DistortionModel read(
            CalibrationTable table, CalibrationKey key, CalibrationTable offsetTable) {
        String filter1 = key.filter1();
        String filter2 = key.filter2();

        String detector = table.headerValue("DETECTOR");
        if (detector == null) detector = table.headerValue("CAMERA");
        if ("SBC".equals(detector)) {
            if (CalibrationKey.CLEAR.equals(filter1)) {
                filter1 = "F115LP";
                filter2 = "N/A";
            }
            if (CalibrationKey.CLEAR.equals(filter2)) filter2 = "N/A";
        }

        int row = findRow(table, key.chip(), filter1, filter2, key.direction());
        if (row < 0) {
            throw new CalibrationLookupException(
                    "Problem finding row in IDCTAB " + table.name() + "! Could not find row matching"
                            + " CHIP: " + key.chip() + " FILTERS: " + filter1 + "," + filter2);
        }
        log.info("- IDCTAB: Distortion model from row {} for chip {} : {} and {}",
                row + 1, key.chip(), filter1, filter2);

        int norder = table.hasHeader("NORDER") ? Integer.parseInt(table.headerValue("NORDER").trim()) : MIN_ORDER;
        int order = Math.max(norder, MIN_ORDER);
        double[][] fx = new double[order + 1][order + 1];
        double[][] fy = new double[order + 1][order + 1];
        String xPrefix = table.hasColumn("CX10") ? "CX" : "A";
        String yPrefix = table.hasColumn("CX10") ? "CY" : "B";
        for (int i = 1; i <= norder; i++) {
            for (int j = 0; j <= i; j++) {
                fx[i][j] = table.getDouble(row, xPrefix + i + j);
                fy[i][j] = table.getDouble(row, yPrefix + i + j);
            }
        }

        ReferencePointing pointing;
        if (table.hasColumn("V2REF")) {
            double theta = table.hasColumn("THETA") ? table.getDouble(row, "THETA") : 0.0;
            pointing = new ReferencePointing(
                    table.getDouble(row, "V2REF"), table.getDouble(row, "V3REF"), theta);
        } else if (offsetTable != null) {
            if (key.date() == null) {
                throw new WcsUpdateException(ErrorKind.INCOMPLETE_WCS,
                        "DATE-OBS is needed to read OFFTAB " + offsetTable.name());
            }
            pointing = OffsetTableInterpolator.interpolate(offsetTable, key.date(), key.chip());
        } else {
            double theta = table.hasColumn("THETA") ? table.getDouble(row, "THETA") : 0.0;
            pointing = new ReferencePointing(0.0, 0.0, theta);
        }

        double pscale = Math.round(table.getDouble(row, "SCALE") * 1e8) / 1e8;
        RefPix refPix = new RefPix(
                table.getDouble(row, "XREF"),
                table.getDouble(row, "YREF"),
                table.getDouble(row, "XSIZE"),
                table.getDouble(row, "YSIZE"),
                pointing.v2ref(),
                pointing.v3ref(),
                pointing.theta(),
                pscale,
                0.0,
                0.0,
                true,
                false);

        // Normalised tables store unit linear terms; scale them to arcsec
        if (fx[1][1] == 1.0 && Math.abs(fx[1][1]) != pscale) {
            scale(fx, pscale);
            scale(fy, pscale);
        }
        return new DistortionModel(
                key.chip(), filter1, filter2, key.direction(), order, fx, fy, refPix);
    }

    /**
     * A distortion-free solution: order 3 with linear terms equal to the plate
     * scale, referenced to ({@code xref}, {@code yref}).
     */
    public static DistortionModel identity(int chip, double xref, double yref, double pscale) {
        double[][] fx = new double[MIN_ORDER + 1][MIN_ORDER + 1];
        double[][] fy = new double[MIN_ORDER + 1][MIN_ORDER + 1];
        fx[1][1] = pscale;
        fy[1][0] = pscale;
        RefPix refPix = new RefPix(xref, yref, 2 * xref, 2 * yref, 0.0, 0.0, 0.0, pscale,
                0.0, 0.0, false, true);
        return new DistortionModel(chip, CalibrationKey.CLEAR, CalibrationKey.CLEAR,
                Direction.FORWARD, MIN_ORDER, fx, fy, refPix);
    }

    private static int findRow(
            CalibrationTable table, int chip, String filter1, String filter2, Direction direction) {
        for (int i = 0; i < table.rowCount(); i++) {
            String rowFilter1;
            String rowFilter2;
            if (table.hasColumn("FILTER1") && table.hasColumn("FILTER2")) {
                rowFilter1 = clearPosition(table.getString(i, "FILTER1"));
                rowFilter2 = clearPosition(table.getString(i, "FILTER2"));
            } else {
                rowFilter1 = table.hasColumn("OPT_ELEM")
                        ? clearPosition(table.getString(i, "OPT_ELEM"))
                        : filter1;
                if (table.hasColumn("FILTER")) {
                    String filter = clearPosition(table.getString(i, "FILTER"));
                    if (table.hasColumn("OPT_ELEM")) {
                        rowFilter2 = filter;
                    } else {
                        rowFilter1 = filter;
                        rowFilter2 = CalibrationKey.CLEAR;
                    }
                } else {
                    rowFilter2 = filter2;
                }
            }

            int rowChip = table.hasColumn("DETCHIP")
                    ? OffsetTableInterpolator.parseChip(table.getString(i, "DETCHIP"))
                    : 1;
            Direction rowDirection = table.hasColumn("DIRECTION")
                    ? Direction.fromTable(table.getString(i, "DIRECTION"))
                    : Direction.FORWARD;

            if (rowFilter1.equals(filter1) && rowFilter2.equals(filter2)
                    && rowDirection == direction
                    && (rowChip == chip || rowChip == OffsetTableInterpolator.ANY_CHIP)) {
                return i;
            }
        }
        return -1;
    }

    private static String clearPosition(String filter) {
        String f = filter.trim();
        return f.startsWith(CalibrationKey.CLEAR) ? f.substring(0, 5) : f;
    }

    private static void scale(double[][] m, double factor) {
        for (double[] row : m) {
            for (int j = 0; j < row.length; j++) row[j] *= factor;
        }
    }

    /**
     * Re-express the solution about a point offset by ({@code xs}, {@code ys})
     * pixels from the current reference pixel, as needed for subarrays whose
     * reference pixel is not the detector's.
     */
    public DistortionModel shift(double xs, double ys) {
        int k = order + 1;
        double[][] sx = new double[k][k];
        double[][] sy = new double[k][k];
        for (int m = 0; m < k; m++) {
            for (int n = 0; n <= m; n++) {
                for (int i = m; i < k; i++) {
                    for (int j = n; j <= i - (m - n); j++) {
                        double w = binomial(j, n) * binomial(i - j, m - n)
                                * Math.pow(xs, j - n) * Math.pow(ys, (i - j) - (m - n));
                        sx[m][n] += fx[i][j] * w;
                        sy[m][n] += fy[i][j] * w;
                    }
                }
            }
        }
        sx[0][0] -= xs;
        sy[0][0] -= ys;
        return new DistortionModel(chip, filter1, filter2, direction, order, sx, sy, refPix);
    }

    /**
     * The same solution for data binned {@code factor} x {@code factor}: each
     * degree-i coefficient grows by {@code factor^i}.
     */
    public DistortionModel binned(int factor) {
        if (factor == 1) return this;
        double[][] bx = new double[order + 1][order + 1];
        double[][] by = new double[order + 1][order + 1];
        for (int i = 0; i <= order; i++) {
            double f = Math.pow(factor, i);
            for (int j = 0; j <= order; j++) {
                bx[i][j] = fx[i][j] * f;
                by[i][j] = fy[i][j] * f;
            }
        }
        return new DistortionModel(chip, filter1, filter2, direction, order, bx, by,
                refPix.binned(factor));
    }

    static double binomial(int n, int k) {
        if (k < 0 || k > n) return 0.0;
        double r = 1.0;
        for (int i = 1; i <= k; i++) r = r * (n - k + i) / i;
        return r;
    }

    public int chip() {
        return chip;
    }

    public String filter1() {
        return filter1;
    }

    public String filter2() {
        return filter2;
    }

    public Direction direction() {
        return direction;
    }

    public int order() {
        return order;
    }

    public double fx(int i, int j) {
        return fx[i][j];
    }

    public double fy(int i, int j) {
        return fy[i][j];
    }

    /** Copy of the X coefficient matrix, {@code (order+1) x (order+1)}. */
    public double[][] fx() {
        return copy(fx);
    }

    /** Copy of the Y coefficient matrix, {@code (order+1) x (order+1)}. */
    public double[][] fy() {
        return copy(fy);
    }

    public RefPix refPix() {
        return refPix;
    }

    private static double[][] copy(double[][] m) {
        double[][] c = new double[m.length][];
        for (int i = 0; i < m.length; i++) c[i] = m[i].clone();
        return c;
    }
}
