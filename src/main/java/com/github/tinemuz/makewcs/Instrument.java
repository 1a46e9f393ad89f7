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

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-instrument configuration: filter keywords, detector parity, reference
 * chip convention and TDD constants.
 */
public enum Instrument {
    ACS("FILTER1", "FILTER2", null,
            Map.of("WFC", Parity.FLIP_Y, "HRC", Parity.FLIP_X, "SBC", Parity.FLIP_X)),
    WFPC2("FILTNAM1", "FILTNAM2", Parity.FLIP_X, Map.of()),
    STIS("FILTER1", "FILTER2", Parity.FLIP_X, Map.of()),
    NICMOS("FILTER", null, Parity.FLIP_X, Map.of()),
    WFC3("FILTER", null, null, Map.of("UVIS", Parity.FLIP_X, "IR", Parity.FLIP_X));

    private static final String DEFAULT_DETECTOR = "default";

    private final String filter1Keyword;
    private final String filter2Keyword;
    private final Parity instrumentParity;
    private final Map<String, Parity> detectorParity;

    Instrument(
            String filter1Keyword,
            String filter2Keyword,
            Parity instrumentParity,
            Map<String, Parity> detectorParity) {
        this.filter1Keyword = filter1Keyword;
        this.filter2Keyword = filter2Keyword;
        this.instrumentParity = instrumentParity;
        this.detectorParity = detectorParity;
    }

    /**
     * Instrument named by an INSTRUME value.
     *
     * @throws UnsupportedInstrumentException for anything else
     */
    public static Instrument fromHeader(String name) {
        if (name == null) {
            throw new UnsupportedInstrumentException("Image has no INSTRUME keyword");
        }
        for (Instrument i : values()) {
            if (i.name().equalsIgnoreCase(name.trim())) return i;
        }
        throw new UnsupportedInstrumentException("Instrument " + name + " not supported yet");
    }

    public String filter1Keyword() {
        return filter1Keyword;
    }

    /** Second filter keyword, or {@code null} for single-wheel instruments. */
    public String filter2Keyword() {
        return filter2Keyword;
    }

    /**
     * Parity of a detector. WFPC2, STIS and NICMOS have one parity for the
     * whole instrument.
     *
     * @throws UnsupportedInstrumentException if the detector is unknown
     */
    public Parity parity(String detector) {
        if (instrumentParity != null) return instrumentParity;
        if (detector != null) {
            Parity p = detectorParity.get(detector.trim().toUpperCase());
            if (p != null) return p;
            if (DEFAULT_DETECTOR.equalsIgnoreCase(detector.trim())) return Parity.IDENTITY;
        }
        throw new UnsupportedInstrumentException(
                "Detector " + detector + " of " + name() + " not supported at this time");
    }

    /** TDD constants, present only for ACS/WFC. */
    public Optional<TddConfig> tddConfig(String detector) {
        if (this == ACS && "WFC".equalsIgnoreCase(detector)) return Optional.of(TddConfig.ACS_WFC);
        return Optional.empty();
    }

    /** Only ACS reports a velocity aberration scale factor (VAFACTOR). */
    public boolean hasVelocityAberration() {
        return this == ACS;
    }

    /**
     * Choose the reference chip of an image.
     *
     * @param detector DETECTOR keyword of the primary header
     * @param chip chip id of the extension being updated
     * @param camera CAMERA keyword (NICMOS), may be {@code null}
     * @param extensionDetectors DETECTOR value of each science extension
     *     (WFPC2 chip numbers), in extension order
     */
    public ReferenceChip referenceChip(
            String detector, int chip, Integer camera, List<Integer> extensionDetectors) {
        int count = extensionDetectors.size();
        switch (this) {
            case ACS:
                if ("WFC".equalsIgnoreCase(detector)) {
                    return new ReferenceChip(count > 1 ? 2 : chip, 1);
                }
                return new ReferenceChip(1, 1);
            case NICMOS:
                return new ReferenceChip(camera != null ? camera : 1, 1);
            case WFPC2:
                int idx = extensionDetectors.indexOf(3);
                if (idx < 0) return new ReferenceChip(extensionDetectors.isEmpty() ? 1 : extensionDetectors.get(0), 1);
                return new ReferenceChip(3, idx + 1);
            default:
                return new ReferenceChip(1, 1);
        }
    }

    /**
     * Chip whose WCS defines the reference tangent plane.
     *
     * @param chip chip id
     * @param extension 1-based science extension holding it
     */
    public record ReferenceChip(int chip, int extension) {}
}
