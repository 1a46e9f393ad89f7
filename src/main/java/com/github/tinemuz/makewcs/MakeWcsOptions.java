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

import java.util.Objects;

/**
 * Settings of one {@link MakeWcs} run.
 */
public final class MakeWcsOptions {
    private final String prefix;
    private final boolean tddCorrection;
    private final boolean restore;
    private final TddCoefficients tddCoefficients;

    private MakeWcsOptions(Builder builder) {
        this.prefix = builder.prefix;
        this.tddCorrection = builder.tddCorrection;
        this.restore = builder.restore;
        this.tddCoefficients = builder.tddCoefficients;
    }

    public static MakeWcsOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Archive keyword prefix, a single character. */
    public String prefix() {
        return prefix;
    }

    /** Whether the time-dependent skew correction may be applied. */
    public boolean tddCorrection() {
        return tddCorrection;
    }

    /** Whether to restore archived keywords instead of recomputing. */
    public boolean restore() {
        return restore;
    }

    public TddCoefficients tddCoefficients() {
        return tddCoefficients;
    }

    public static final class Builder {
        private String prefix = WcsArchive.DEFAULT_PREFIX;
        private boolean tddCorrection = true;
        private boolean restore = false;
        private TddCoefficients tddCoefficients = TddCoefficients.WFC_SKEW_DRIFT;

        private Builder() {}

        public Builder prefix(String prefix) {
            Objects.requireNonNull(prefix, "prefix");
            WcsArchive.checkPrefix(prefix);
            this.prefix = prefix;
            return this;
        }

        public Builder tddCorrection(boolean tddCorrection) {
            this.tddCorrection = tddCorrection;
            return this;
        }

        public Builder restore(boolean restore) {
            this.restore = restore;
            return this;
        }

        public Builder tddCoefficients(TddCoefficients tddCoefficients) {
            this.tddCoefficients = Objects.requireNonNull(tddCoefficients, "tddCoefficients");
            return this;
        }

        public MakeWcsOptions build() {
            return new MakeWcsOptions(this);
        }
    }
}
