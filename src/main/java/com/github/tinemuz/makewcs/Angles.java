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
 * Small angle helpers shared by the projection and composition code.
 * All public methods work in degrees unless the name says otherwise.
 */
public final class Angles {
    private Angles() {}

    /**
     * Remainder of {@code value / modulus} with the sign of the modulus, so
     * right ascensions always land in {@code [0, modulus)}.
     */
    public static double positiveMod(double value, double modulus) {
        double r = value % modulus;
        return r < 0 ? r + modulus : r;
    }

    /**
     * Difference {@code a - b} wrapped across the 360 degree line so that
     * small separations stay small.
     */
    public static double diffAngles(double a, double b) {
        double diff = a - b;
        if (diff > 180.0) diff -= 360.0;
        if (diff < -180.0) diff += 360.0;
        return diff;
    }

    /**
     * 2x2 rotation matrix {@code [[cos, sin], [-sin, cos]]} for an angle in
     * degrees.
     */
    public static double[][] rotationMatrix(double thetaDeg) {
        double t = Math.toRadians(thetaDeg);
        double c = Math.cos(t);
        double s = Math.sin(t);
        return new double[][] {{c, s}, {-s, c}};
    }

    /** Matrix product {@code a * b} of two 2x2 matrices. */
    static double[][] multiply(double[][] a, double[][] b) {
        return new double[][] {
            {a[0][0] * b[0][0] + a[0][1] * b[1][0], a[0][0] * b[0][1] + a[0][1] * b[1][1]},
            {a[1][0] * b[0][0] + a[1][1] * b[1][0], a[1][0] * b[0][1] + a[1][1] * b[1][1]}
        };
    }

    /** Product of a 2x2 matrix and a column vector. */
    static double[] multiply(double[][] m, double[] v) {
        return new double[] {m[0][0] * v[0] + m[0][1] * v[1], m[1][0] * v[0] + m[1][1] * v[1]};
    }

    /**
     * Format a sky position as sexagesimal strings {@code {"h:m:s", "d:m:s"}}.
     * Right ascension is divided into hours; declination keeps its sign on
     * the degree field.
     */
    public static String[] toSexagesimal(double raDeg, double decDeg) {
        double raHours = raDeg / 15.0;
        double raMin = (raHours - Math.floor(raHours)) * 60.0;
        double raSec = (raMin - Math.floor(raMin)) * 60.0;

        double absDec = Math.abs(decDeg);
        double decMin = (absDec - Math.floor(absDec)) * 60.0;
        double decSec = (decMin - Math.floor(decMin)) * 60.0;

        String ra = (int) raHours + ":" + (int) raMin + ":" + raSec;
        String dec = (decDeg < 0 ? "-" : "") + (int) absDec + ":" + (int) decMin + ":" + decSec;
        return new String[] {ra, dec};
    }
}
