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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Zero-point shift of a chip's V2/V3 aperture caused by the time-dependent
 * skew of the detector.
 *
 * <p>The anchor of each chip, relative to the detector centre, is skewed by
 * {@code [[beta, alpha], [alpha, -beta]]}, rotated into the V2/V3 frame and
 * normalised; the result is in units of the configured V2/V3 scale.</p>
 */
public final class TimeDependentCorrection {
    private static final Logger log = LoggerFactory.getLogger(TimeDependentCorrection.class);

    private static final TimeDependentCorrection DISABLED =
            new TimeDependentCorrection(null, TddCoefficients.Terms.ZERO);

    private final TddConfig config;
    private final TddCoefficients.Terms terms;

    private TimeDependentCorrection(TddConfig config, TddCoefficients.Terms terms) {
        this.config = config;
        this.terms = terms;
    }

    /** A correction that leaves every aperture where it is. */
    public static TimeDependentCorrection disabled() {
        return DISABLED;
    }

    public static TimeDependentCorrection forDate(TddConfig config, TddCoefficients coefficients, LocalDate date) {
        TddCoefficients.Terms terms = coefficients.at(date);
        log.debug("TDD coefficients for {}: alpha={} beta={}", date, terms.alpha(), terms.beta());
        return new TimeDependentCorrection(config, terms);
    }

    public boolean isApplied() {
        return config != null;
    }

    public double alpha() {
        return terms.alpha();
    }

    public double beta() {
        return terms.beta();
    }

    /**
     * Correction vector of {@code chip} before the V2/V3 scale is applied.
     *
     * @param chip detector chip
     * @param scale ratio of the reference plate scale to the chip's linear X term
     * @return {@code [dx, dy]}, zero when disabled
     */
    public double[] correction(int chip, double scale) {
        if (config == null) {
            return new double[] {0.0, 0.0};
        }
        double[] xy0 = config.anchorOffset(chip);
        double b = terms.beta();
        double a = terms.alpha();
        double[] skewed = {b * xy0[0] + a * xy0[1], a * xy0[0] - b * xy0[1]};
        double[] rotated = Angles.multiply(Angles.rotationMatrix(config.rotationDeg()), skewed);
        return new double[] {
            rotated[0] / config.normalization() * scale,
            rotated[1] / config.normalization() * scale
        };
    }

    /**
     * Corrected V2/V3 of an aperture: the X correction is added to V2 and the
     * Y correction subtracted from V3.
     */
    public ReferencePointing apply(RefPix refPix, int chip, double scale) {
        double[] c = correction(chip, scale);
        double s = config == null ? 0.0 : config.v23Scale();
        return new ReferencePointing(refPix.v2ref() + c[0] * s, refPix.v3ref() - c[1] * s, refPix.theta());
    }
}
