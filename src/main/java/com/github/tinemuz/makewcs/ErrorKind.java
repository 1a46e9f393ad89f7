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
 * Classification of the ways a WCS update can fail.
 *
 * <p>Each kind carries the {@link Scope} it invalidates so a batch driver can
 * tell a failure that only costs the current image (or chip) from one that
 * must stop the whole run.</p>
 */
public enum ErrorKind {
    /** No calibration row matched the requested chip/filters/direction. */
    CALIBRATION_LOOKUP(Scope.IMAGE),
    /** A calibration or data file could not be opened or parsed. */
    CALIBRATION_IO(Scope.IMAGE),
    /** An image header lacks keywords every WCS needs. */
    INCOMPLETE_WCS(Scope.IMAGE),
    /** PA_V3 was found neither in the image nor in its support file. */
    MISSING_ROLL_ANGLE(Scope.IMAGE),
    /** Instrument or detector has no parity/extension configuration. */
    UNSUPPORTED_INSTRUMENT(Scope.IMAGE),
    /** The WCS is not a gnomonic (TAN) projection. */
    UNSUPPORTED_PROJECTION(Scope.CHIP),
    /** The CD matrix cannot be inverted. */
    SINGULAR_MATRIX(Scope.CHIP),
    /** The sky position lies on the degenerate side of the projection. */
    GEOMETRY_RANGE(Scope.CHIP);

    /** How much work a failure of this kind invalidates. */
    public enum Scope {
        CHIP,
        IMAGE,
        PROCESS
    }

    private final Scope scope;

    ErrorKind(Scope scope) {
        this.scope = scope;
    }

    public Scope scope() {
        return scope;
    }

    /**
     * Whether a batch driver may log this failure and continue with the next
     * image. Chip-level failures abort the image they occur in.
     */
    public boolean isSkippable() {
        return scope != Scope.PROCESS;
    }
}
