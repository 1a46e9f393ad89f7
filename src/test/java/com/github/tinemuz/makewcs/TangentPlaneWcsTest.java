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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TangentPlaneWcsTest {

    private static final double PIXEL_TOLERANCE = 1e-6; // pixels
    private static final double ANGLE_TOLERANCE = 1e-9; // degrees
    private static final double S = 0.05 / 3600.0; // 0.05 arcsec/pixel in degrees
    // power of two, so frame resizing divides exactly
    private static final double EXACT = Math.scalb(1.0, -16);

    static MapHeader wcsHeader(double crval1, double crval2, double crpix1, double crpix2,
            double cd11, double cd12, double cd21, double cd22) {
        return new MapHeader()
                .with("NAXIS", 2)
                .with("NAXIS1", 4096)
                .with("NAXIS2", 2048)
                .with("CTYPE1", WcsState.TAN_RA)
                .with("CTYPE2", WcsState.TAN_DEC)
                .with("CRPIX1", crpix1)
                .with("CRPIX2", crpix2)
                .with("CRVAL1", crval1)
                .with("CRVAL2", crval2)
                .with("CD1_1", cd11)
                .with("CD1_2", cd12)
                .with("CD2_1", cd21)
                .with("CD2_2", cd22)
                .with("ORIENTAT", 0.0);
    }

    private static TangentPlaneWcs eastLeft(double crval1, double crval2) {
        return TangentPlaneWcs.fromHeader(wcsHeader(crval1, crval2, 2048, 1024, -S, 0, 0, S), null);
    }

    @Nested
    @DisplayName("Projection")
    class ProjectionTests {

        @Test
        @DisplayName("Reference pixel maps to the reference sky position")
        void referencePixelMapsToCrval() {
            TangentPlaneWcs wcs = eastLeft(150.0, 30.0);
            SkyPosition p = wcs.xy2rd(2048, 1024);
            assertEquals(150.0, p.ra(), ANGLE_TOLERANCE);
            assertEquals(30.0, p.dec(), ANGLE_TOLERANCE);
        }

        @Test
        @DisplayName("Pixel to sky and back recovers the pixel")
        void roundTrip() {
            TangentPlaneWcs wcs = TangentPlaneWcs.fromHeader(
                    wcsHeader(210.5, -45.0, 2048, 1024, -S * 0.9, S * 0.3, S * 0.3, S * 0.9), null);
            double[][] pixels = {{0, 0}, {4096, 2048}, {1, 2047}, {3000.25, 17.5}};
            for (double[] xy : pixels) {
                PixelPosition back = wcs.rd2xy(wcs.xy2rd(xy[0], xy[1]));
                assertEquals(xy[0], back.x(), PIXEL_TOLERANCE, "x of " + xy[0] + "," + xy[1]);
                assertEquals(xy[1], back.y(), PIXEL_TOLERANCE, "y of " + xy[0] + "," + xy[1]);
            }
        }

        @Test
        @DisplayName("Right ascension stays in [0, 360) across the zero meridian")
        void raWraps() {
            TangentPlaneWcs wcs = eastLeft(359.9999, 0.0);
            // east is to the left: decreasing x increases RA
            SkyPosition p = wcs.xy2rd(0, 1024);
            assertTrue(p.ra() >= 0.0 && p.ra() < 360.0, "RA in [0, 360): " + p.ra());
            assertTrue(p.ra() < 1.0, "wrapped past zero: " + p.ra());
        }

        @Test
        @DisplayName("Singular CD matrix cannot be inverted")
        void singularMatrix() {
            TangentPlaneWcs wcs = TangentPlaneWcs.fromHeader(
                    wcsHeader(10.0, 10.0, 1, 1, S, S, S, S), null);
            WcsUpdateException e = assertThrows(SingularMatrixException.class, () -> wcs.rd2xy(10.0, 10.0));
            assertEquals(ErrorKind.SINGULAR_MATRIX, e.kind());
        }

        @Test
        @DisplayName("Position on the far hemisphere is out of range")
        void farSideOutOfRange() {
            TangentPlaneWcs wcs = eastLeft(0.0, 0.0);
            WcsUpdateException e = assertThrows(GeometryRangeException.class, () -> wcs.rd2xy(180.0, 0.0));
            assertEquals(ErrorKind.GEOMETRY_RANGE, e.kind());
        }

        @Test
        @DisplayName("Non-TAN projections are refused")
        void nonTanRefused() {
            MapHeader h = wcsHeader(10.0, 10.0, 1, 1, -S, 0, 0, S).with("CTYPE1", "RA---SIN").with("CTYPE2", "DEC--SIN");
            TangentPlaneWcs wcs = TangentPlaneWcs.fromHeader(h, null);
            assertThrows(UnsupportedProjectionException.class, () -> wcs.xy2rd(1, 1));
        }

        @Test
        @DisplayName("Missing WCS keyword is reported")
        void missingKeyword() {
            MapHeader h = new MapHeader().with("NAXIS1", 10).with("NAXIS2", 10);
            WcsUpdateException e = assertThrows(WcsUpdateException.class, () -> TangentPlaneWcs.fromHeader(h, null));
            assertEquals(ErrorKind.INCOMPLETE_WCS, e.kind());
        }

        @Test
        @DisplayName("Constant-valued extensions take their size from NPIX1/NPIX2")
        void constantExtension() {
            MapHeader h = wcsHeader(10.0, 10.0, 1, 1, -S, 0, 0, S)
                    .with("NAXIS", 0).with("PIXVALUE", 0.0).with("NPIX1", 512).with("NPIX2", 256);
            TangentPlaneWcs wcs = TangentPlaneWcs.fromHeader(h, null);
            assertEquals(512, wcs.naxis1());
            assertEquals(256, wcs.naxis2());
        }
    }

    @Nested
    @DisplayName("Derived quantities")
    class DerivedTests {

        @Test
        @DisplayName("Orientation and plate scale follow the CD matrix")
        void orientAndScale() {
            double r = Math.toRadians(30.0);
            TangentPlaneWcs wcs = TangentPlaneWcs.fromHeader(
                    wcsHeader(10, 10, 1, 1, -S * Math.cos(r), S * Math.sin(r), S * Math.sin(r), S * Math.cos(r)), null);
            assertEquals(30.0, wcs.orient(), 1e-9);
            assertEquals(0.05, wcs.pscale(), 1e-12);
        }

        @Test
        @DisplayName("Plate scale uses the first CD column only, not the Jacobian")
        void plateScaleIgnoresSecondColumn() {
            TangentPlaneWcs wcs = TangentPlaneWcs.fromHeader(wcsHeader(10, 10, 1, 1, -S, 0, 0, 2 * S), null);
            double jacobian = Math.sqrt(Math.abs(wcs.state().determinant())) * 3600.0;
            assertEquals(0.05, wcs.pscale(), 1e-12);
            assertNotEquals(jacobian, wcs.pscale(), 1e-3);
        }

        @Test
        @DisplayName("rotateCD lands on the target orientation and back")
        void rotateAndBack() {
            TangentPlaneWcs wcs = eastLeft(10.0, 10.0);
            WcsState before = wcs.state();

            wcs.rotateCD(30.0);
            assertEquals(30.0, wcs.orient(), 1e-9);
            assertEquals(30.0, WcsState.computeOrient(wcs.cd12(), wcs.cd22()), 1e-9);

            wcs.rotateCD(0.0);
            assertEquals(before.cd11(), wcs.cd11(), 1e-18);
            assertEquals(before.cd12(), wcs.cd12(), 1e-18);
            assertEquals(before.cd21(), wcs.cd21(), 1e-18);
            assertEquals(before.cd22(), wcs.cd22(), 1e-18);
        }

        @Test
        @DisplayName("rotateCD and back restores the WFC-parity CD matrix the updater builds")
        void rotateAndBackFlippedParity() {
            double[][] cd = new ReferenceFrameComposer(Parity.FLIP_Y).referenceCd(25.0, 0.05);
            TangentPlaneWcs wcs = new TangentPlaneWcs(WcsState.of(10.0, 10.0, 2048, 1024,
                    cd[0][0], cd[0][1], cd[1][0], cd[1][1], 4096, 2048, WcsState.TAN_RA, WcsState.TAN_DEC));
            WcsState before = wcs.state();
            assertEquals(-155.0, before.orient(), 1e-9);

            wcs.rotateCD(70.0);
            assertEquals(70.0, WcsState.computeOrient(wcs.cd12(), wcs.cd22()), 1e-9);

            wcs.rotateCD(before.orient());
            assertEquals(before.cd11(), wcs.cd11(), 1e-17);
            assertEquals(before.cd12(), wcs.cd12(), 1e-17);
            assertEquals(before.cd21(), wcs.cd21(), 1e-17);
            assertEquals(before.cd22(), wcs.cd22(), 1e-17);
        }

        @Test
        @DisplayName("recenter is a no-op when already centered")
        void recenterNoOp() {
            TangentPlaneWcs wcs = eastLeft(10.0, 10.0);
            WcsState before = wcs.state();
            wcs.recenter();
            assertEquals(before, wcs.state());
        }

        @Test
        @DisplayName("recenter moves the reference pixel and keeps the center's sky position")
        void recenterOffCenter() {
            TangentPlaneWcs wcs = TangentPlaneWcs.fromHeader(wcsHeader(10.0, 20.0, 1000, 500, -S, 0, 0, S), null);
            SkyPosition center = wcs.xy2rd(2048, 1024);

            wcs.recenter();

            assertEquals(2048.0, wcs.crpix1());
            assertEquals(1024.0, wcs.crpix2());
            assertEquals(center.ra(), wcs.crval1(), ANGLE_TOLERANCE);
            assertEquals(center.dec(), wcs.crval2(), ANGLE_TOLERANCE);
            assertEquals(0.05, wcs.pscale(), 0.05 * 1e-2);
        }

        @Test
        @DisplayName("updateWcs rescales the frame and rebuilds the CD matrix")
        void updateWcs() {
            TangentPlaneWcs wcs = TangentPlaneWcs.fromHeader(wcsHeader(10, 10, 2048, 1024, -EXACT, 0, 0, EXACT), null);
            wcs.updateWcs(2 * EXACT * 3600.0, 45.0, null, new SkyPosition(11.0, 12.0), null);

            assertEquals(2048, wcs.naxis1());
            assertEquals(1024, wcs.naxis2());
            assertEquals(1024.0, wcs.crpix1());
            assertEquals(512.0, wcs.crpix2());
            assertEquals(11.0, wcs.crval1());
            assertEquals(12.0, wcs.crval2());
            assertEquals(45.0, wcs.orient(), 1e-9);
            assertEquals(2 * EXACT * 3600.0, wcs.pscale(), 1e-12);
        }

        @Test
        @DisplayName("scaleWcs keeps the skew when asked to")
        void scaleWcsRetain() {
            TangentPlaneWcs wcs = TangentPlaneWcs.fromHeader(
                    wcsHeader(10, 10, 2048, 1024, -EXACT, 0.125 * EXACT, 0, EXACT), null);
            double skew = wcs.cd12() / wcs.cd22();
            wcs.scaleWcs(2 * EXACT * 3600.0, true);
            assertEquals(2 * EXACT * 3600.0, wcs.pscale(), 1e-12);
            assertEquals(skew, wcs.cd12() / wcs.cd22(), 1e-12);
            assertEquals(2048, wcs.naxis1());
            assertEquals(1024.0, wcs.crpix1());
        }
    }

    @Nested
    @DisplayName("Archive")
    class ArchiveTests {

        @Test
        @DisplayName("Loading a header without backup creates one with the default prefix")
        void archiveOnLoad() {
            TangentPlaneWcs wcs = eastLeft(10.0, 10.0);
            assertEquals("O", wcs.prefix());
            assertEquals(10.0, wcs.archivedValue(WcsKeyword.CRVAL1));
        }

        @Test
        @DisplayName("An existing archive is not replaced without overwrite")
        void writeOnce() {
            TangentPlaneWcs wcs = eastLeft(10.0, 10.0);
            wcs.setCrval(11.0, 12.0);

            assertFalse(wcs.archive(null, false));
            assertEquals(10.0, wcs.archivedValue(WcsKeyword.CRVAL1));

            assertTrue(wcs.archive(null, true));
            assertEquals(11.0, wcs.archivedValue(WcsKeyword.CRVAL1));
        }

        @Test
        @DisplayName("restore brings back the archived values")
        void restore() {
            TangentPlaneWcs wcs = eastLeft(10.0, 10.0);
            WcsState original = wcs.state();

            wcs.setCrval(11.0, 12.0);
            wcs.setCd(S, 0, 0, S);
            wcs.update();
            wcs.restore();

            assertEquals(original, wcs.state());
        }

        @Test
        @DisplayName("copy is independent of the original")
        void copyIsIndependent() {
            TangentPlaneWcs wcs = eastLeft(10.0, 10.0);
            TangentPlaneWcs copy = wcs.copy();
            copy.setCrpix(1.0, 1.0);
            assertEquals(2048.0, wcs.crpix1());
            assertEquals("O", copy.prefix());
        }
    }
}
