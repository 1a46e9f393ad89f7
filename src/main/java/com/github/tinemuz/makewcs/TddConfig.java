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
 * Constants of the time-dependent distortion zero-point correction of one
 * detector.
 *
 * @param rotationDeg rotation of the skew axes
 * @param normalization pixel normalisation of the rotated anchor offsets
 * @param center detector pixel about which anchors are measured
 * @param v23Scale conversion of the correction into V2/V3 arcsec
 * @param anchors zero-point pixel of each chip
 */
public record TddConfig(
        double rotationDeg,
        double normalization,
        double center,
        double v23Scale,
        Map<Integer, double[]> anchors) {

    /** ACS/WFC skew correction constants. */
    public static final TddConfig ACS_WFC = new TddConfig(2.234529, 2048.0, 2048.0, 0.05,
            Map.of(1, new double[] {2048.0, 3072.0}, 2, new double[] {2048.0, 1024.0}));

    /** Anchor of {@code chip} relative to {@link #center()}. */
    public double[] anchorOffset(int chip) {
        double[] a = anchors.get(chip);
        if (a == null) {
            throw new UnsupportedInstrumentException("No TDD zero-point anchor for chip " + chip);
        }
        return new double[] {a[0] - center, a[1] - center};
    }
}
