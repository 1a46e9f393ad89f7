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

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AnglesTest {

    @Test
    @DisplayName("Angle differences take the short way round")
    void diffAngles() {
        assertEquals(-2.0, Angles.diffAngles(359.0, 1.0), 1e-12);
        assertEquals(2.0, Angles.diffAngles(1.0, 359.0), 1e-12);
        assertEquals(10.0, Angles.diffAngles(40.0, 30.0), 1e-12);
    }

    @Test
    @DisplayName("Positive modulus")
    void positiveMod() {
        assertEquals(350.0, Angles.positiveMod(-10.0, 360.0), 1e-12);
        assertEquals(10.0, Angles.positiveMod(370.0, 360.0), 1e-12);
    }

    @Test
    @DisplayName("Rotation matrix and its inverse")
    void rotation() {
        double[][] r = Angles.multiply(Angles.rotationMatrix(30.0), Angles.rotationMatrix(-30.0));
        assertEquals(1.0, r[0][0], 1e-15);
        assertEquals(0.0, r[0][1], 1e-15);
        assertEquals(0.0, r[1][0], 1e-15);
        assertEquals(1.0, r[1][1], 1e-15);
        assertEquals(0.5, Angles.rotationMatrix(30.0)[0][1], 1e-15);
    }

    @Test
    @DisplayName("Sexagesimal formatting")
    void sexagesimal() {
        String[] s = Angles.toSexagesimal(15.0, -0.5);
        assertEquals("1:0:0.0", s[0]);
        assertEquals("-0:30:0.0", s[1]);
    }

    @Test
    @DisplayName("Observation dates ignore the time part")
    void parseDate() {
        assertEquals(LocalDate.of(2004, 7, 1), Epochs.parseDate("2004-07-01T12:00:00"));
        assertEquals(LocalDate.of(2004, 7, 1), Epochs.parseDate(" 2004-07-01 "));
        assertThrows(IllegalArgumentException.class, () -> Epochs.parseDate("01/07/04"));
        assertThrows(IllegalArgumentException.class, () -> Epochs.parseDate(""));
    }

    @Test
    @DisplayName("Decimal years increase through the day and across years")
    void decimalYear() {
        double midnight = Epochs.decimalYear(LocalDate.of(2000, 12, 31));
        double noon = Epochs.decimalYear(LocalDateTime.of(2000, 12, 31, 12, 0));
        double next = Epochs.decimalYear(LocalDate.of(2001, 1, 1));
        assertEquals(0.5 / 365.25, noon - midnight, 1e-12);
        assertTrue(next > noon);
    }
}
