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
import java.time.temporal.ChronoUnit;

/**
 * Source of the time-dependent skew terms for an observation date.
 */
@FunctionalInterface
public interface TddCoefficients {

    /** Reference epoch of the linear drift model. */
    LocalDate WFC_EPOCH = LocalDate.of(2004, 7, 1);

    /**
     * Linear drift of the ACS/WFC skew, measured in years from
     * {@link #WFC_EPOCH}.
     */
    TddCoefficients WFC_SKEW_DRIFT = date -> {
        double years = ChronoUnit.DAYS.between(WFC_EPOCH, date) / 365.25;
        return new Terms(0.095 + 0.090 * years / 2.5, -0.029 - 0.030 * years / 2.5);
    };

    /** No drift. */
    TddCoefficients NONE = date -> Terms.ZERO;

    Terms at(LocalDate date);

    record Terms(double alpha, double beta) {
        public static final Terms ZERO = new Terms(0.0, 0.0);
    }
}
