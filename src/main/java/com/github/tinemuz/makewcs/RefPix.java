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
 * Reference-pixel metadata of a distortion solution.
 *
 * @param xref reference pixel X on the full detector
 * @param yref reference pixel Y on the full detector
 * @param xsize detector size in X
 * @param ysize detector size in Y
 * @param v2ref V2 of the reference pixel (arcsec)
 * @param v3ref V3 of the reference pixel (arcsec)
 * @param theta chip rotation relative to V3 (degrees)
 * @param pscale plate scale (arcsec/pixel)
 * @param xdelta extra X shift
 * @param ydelta extra Y shift
 * @param defaultScale whether the table scale is used as the output scale
 * @param centered whether the solution is expressed about the frame center
 */
public record RefPix(
        double xref,
        double yref,
        double xsize,
        double ysize,
        double v2ref,
        double v3ref,
        double theta,
        double pscale,
        double xdelta,
        double ydelta,
        boolean defaultScale,
        boolean centered) {

    /** Copy describing the same detector read out with {@code factor} x {@code factor} binning. */
    public RefPix binned(int factor) {
        return new RefPix(xref / factor, yref / factor, xsize / factor, ysize / factor,
                v2ref, v3ref, theta, pscale * factor, xdelta, ydelta, defaultScale, centered);
    }
}
