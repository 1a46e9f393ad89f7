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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the time-dependent aperture pointing of a chip from an offset table
 * (OFFTAB), interpolating linearly between the two calibration epochs that
 * bracket the observation.
 *
 * <p>Observations after the newest epoch, or before the oldest, use the
 * nearest row unchanged: the table is never extrapolated.</p>
 */
public final class OffsetTableInterpolator {
    private static final Logger log = LoggerFactory.getLogger(OffsetTableInterpolator.class);

    /** Chip id in a DETCHIP column that matches any chip. */
    public static final int ANY_CHIP = -999;

    private OffsetTableInterpolator() {}

    /**
     * Interpolate V2REF, V3REF and THETA for {@code chip} at {@code date}.
     *
     * @throws CalibrationLookupException if no row applies to the chip
     * @throws CalibrationFileException if a needed column is missing or a
     *     cell cannot be parsed
     */
    public static ReferencePointing interpolate(CalibrationTable table, LocalDate date, int chip) {
        try {
            return read(table, date, chip);
        } catch (IllegalArgumentException e) {
            throw new CalibrationFileException(table.name(), e.getMessage(), e);
        }
    }

    private static ReferencePointing read(CalibrationTable table, LocalDate date, int chip) {
        double target = Epochs.decimalYear(date);

        List<Epoch> candidates = new ArrayList<>();
        for (int i = 0; i < table.rowCount(); i++) {
            int rowChip = table.hasColumn("DETCHIP") ? parseChip(table.getString(i, "DETCHIP")) : 1;
            if (rowChip != chip && rowChip != ANY_CHIP) continue;
            double when = Epochs.decimalYear(Epochs.parseDate(table.getString(i, "OBSDATE")));
            candidates.add(new Epoch(i, when));
        }
        if (candidates.isEmpty()) {
            throw new CalibrationLookupException(
                    "Row corresponding to DETCHIP of " + chip + " was not found in " + table.name());
        }
        // newest first
        candidates.sort(Comparator.comparingDouble(Epoch::decimalYear).reversed());

        Epoch after = null;
        Epoch before = null;
        for (Epoch e : candidates) {
            if (target >= e.decimalYear && after == null) {
                // at or beyond the newest calibration
                after = e;
                break;
            }
            if (target <= e.decimalYear) {
                after = e;
                continue;
            }
            before = e;
            break;
        }

        if (before == null) {
            log.info("- OFFTAB: Offset defined by row {}", after.row + 1);
            return pointing(table, after.row);
        }
        log.info("- OFFTAB: Offset interpolated from rows {} and {}", before.row + 1, after.row + 1);

        double fraction = (target - before.decimalYear) / (after.decimalYear - before.decimalYear);
        ReferencePointing start = pointing(table, before.row);
        ReferencePointing end = pointing(table, after.row);
        return new ReferencePointing(
                start.v2ref() + fraction * (end.v2ref() - start.v2ref()),
                start.v3ref() + fraction * (end.v3ref() - start.v3ref()),
                start.theta() + fraction * (end.theta() - start.theta()));
    }

    private static ReferencePointing pointing(CalibrationTable table, int row) {
        double theta = table.hasColumn("THETA") ? table.getDouble(row, "THETA") : 0.0;
        return new ReferencePointing(
                table.getDouble(row, "V2REF"), table.getDouble(row, "V3REF"), theta);
    }

    /** DETCHIP values that are not integers read as chip 1. */
    static int parseChip(String value) {
        try {
            return (int) Math.round(Double.parseDouble(value.trim()));
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    private record Epoch(int row, double decimalYear) {}
}
