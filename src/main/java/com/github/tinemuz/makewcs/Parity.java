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
 * Detector parity: the sign flips taking V2/V3 offsets into the detector's
 * pixel axes. Only diagonal matrices occur in practice.
 *
 * @param xx sign applied to the X axis
 * @param yy sign applied to the Y axis
 */
public record Parity(double xx, double yy) {
    public static final Parity IDENTITY = new Parity(1.0, 1.0);
    /** {@code [[1,0],[0,-1]]}, e.g. ACS/WFC. */
    public static final Parity FLIP_Y = new Parity(1.0, -1.0);
    /** {@code [[-1,0],[0,1]]}, e.g. ACS/HRC, WFPC2. */
    public static final Parity FLIP_X = new Parity(-1.0, 1.0);
}
