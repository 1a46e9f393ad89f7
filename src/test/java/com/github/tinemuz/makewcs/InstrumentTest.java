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

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class InstrumentTest {

    @Test
    @DisplayName("Instrument names are matched case-insensitively")
    void fromHeader() {
        assertEquals(Instrument.ACS, Instrument.fromHeader("acs"));
        assertEquals(Instrument.WFPC2, Instrument.fromHeader(" WFPC2 "));
        assertThrows(UnsupportedInstrumentException.class, () -> Instrument.fromHeader("FOC"));
        assertThrows(UnsupportedInstrumentException.class, () -> Instrument.fromHeader(null));
    }

    @Test
    @DisplayName("Parity is per detector for ACS and WFC3, per instrument otherwise")
    void parity() {
        assertEquals(Parity.FLIP_Y, Instrument.ACS.parity("WFC"));
        assertEquals(Parity.FLIP_X, Instrument.ACS.parity("HRC"));
        assertEquals(Parity.FLIP_X, Instrument.WFC3.parity("UVIS"));
        assertEquals(Parity.FLIP_X, Instrument.STIS.parity("CCD"));
        assertEquals(Parity.IDENTITY, Instrument.WFC3.parity("default"));
        assertThrows(UnsupportedInstrumentException.class, () -> Instrument.ACS.parity("PC"));
    }

    @Test
    @DisplayName("Filter keywords")
    void filterKeywords() {
        assertEquals("FILTNAM1", Instrument.WFPC2.filter1Keyword());
        assertEquals("FILTER", Instrument.NICMOS.filter1Keyword());
        assertNull(Instrument.NICMOS.filter2Keyword());
        assertEquals("FILTER2", Instrument.ACS.filter2Keyword());
    }

    @Test
    @DisplayName("Only ACS/WFC carries a skew correction, only ACS a velocity aberration factor")
    void tddAndAberration() {
        assertTrue(Instrument.ACS.tddConfig("WFC").isPresent());
        assertTrue(Instrument.ACS.tddConfig("HRC").isEmpty());
        assertTrue(Instrument.WFC3.tddConfig("UVIS").isEmpty());
        assertTrue(Instrument.ACS.hasVelocityAberration());
        assertFalse(Instrument.WFPC2.hasVelocityAberration());
    }

    @Test
    @DisplayName("Reference chip conventions")
    void referenceChip() {
        assertEquals(new Instrument.ReferenceChip(2, 1),
                Instrument.ACS.referenceChip("WFC", 1, null, List.of(2, 1)));
        assertEquals(new Instrument.ReferenceChip(1, 1),
                Instrument.ACS.referenceChip("WFC", 1, null, List.of(1)));
        assertEquals(new Instrument.ReferenceChip(1, 1),
                Instrument.ACS.referenceChip("HRC", 1, null, List.of(1)));
        assertEquals(new Instrument.ReferenceChip(2, 1),
                Instrument.NICMOS.referenceChip("2", 2, 2, List.of(2)));
        assertEquals(new Instrument.ReferenceChip(3, 3),
                Instrument.WFPC2.referenceChip("1", 2, null, List.of(1, 2, 3, 4)));
        assertEquals(new Instrument.ReferenceChip(2, 1),
                Instrument.WFPC2.referenceChip("2", 2, null, List.of(2, 4)));
        assertEquals(new Instrument.ReferenceChip(1, 1),
                Instrument.STIS.referenceChip("CCD", 1, null, List.of(1, 1)));
    }
}
