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
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MakeWcsTest {

    private static final double S = 0.05 / 3600.0;
    private static final double ANGLE_TOLERANCE = 1e-9; // degrees
    private static final double CD_TOLERANCE = 1e-11; // degrees/pixel
    private static final double CHIP_SEPARATION = 100.0 / 3600.0; // V3 300" vs 200"

    static final CalibrationSource RESOURCES = name -> CalibrationTable.fromResource(
            "idctab/" + CalibrationSource.baseName(name).replace(".fits", ".txt"));

    static MapHeader acsPrimary() {
        return new MapHeader()
                .with("INSTRUME", "ACS")
                .with("DETECTOR", "WFC")
                .with("IDCTAB", "jref$acs_wfc_idc.fits")
                .with("FILTER1", "CLEAR1L")
                .with("FILTER2", "F606W")
                .with("DATE-OBS", "2006-03-15")
                .with("PA_V3", 0.0)
                .with("TDDCORR", "PERFORM");
    }

    static MapHeader science(int chip) {
        return TangentPlaneWcsTest.wcsHeader(150.0, 30.0, 2048, 1024, -0.9 * S, 0.1 * S, 0.1 * S, 0.9 * S)
                .with("CCDCHIP", chip);
    }

    private static MakeWcs makeWcs(boolean tdd) {
        return new MakeWcs(RESOURCES, MakeWcsOptions.builder().tddCorrection(tdd).build());
    }

    private static double d(Header h, String keyword) {
        return h.getDouble(keyword, Double.NaN);
    }

    @Nested
    @DisplayName("Updating")
    class UpdateTests {

        @Test
        @DisplayName("Single chip at zero roll gets the parity-signed plate scale as its CD matrix")
        void singleChip() {
            MapHeader ext = science(2);
            ImageResult result = makeWcs(false).run(Exposure.of("j8single", acsPrimary(), List.of(ext)));

            assertEquals(ImageResult.Status.UPDATED, result.status());
            assertEquals(1, result.extensions());
            assertTrue(result.isSuccess());

            assertEquals(150.0, d(ext, "CRVAL1"), ANGLE_TOLERANCE);
            assertEquals(30.0, d(ext, "CRVAL2"), ANGLE_TOLERANCE);
            assertEquals(2048.0, d(ext, "CRPIX1"));
            assertEquals(1024.0, d(ext, "CRPIX2"));
            assertEquals(S, d(ext, "CD1_1"), CD_TOLERANCE);
            assertEquals(0.0, d(ext, "CD1_2"), CD_TOLERANCE);
            assertEquals(0.0, d(ext, "CD2_1"), CD_TOLERANCE);
            assertEquals(-S, d(ext, "CD2_2"), CD_TOLERANCE);
        }

        @Test
        @DisplayName("Previous values are archived and SIP keywords added")
        void archiveAndSip() {
            MapHeader ext = science(2);
            makeWcs(false).run(Exposure.of("j8single", acsPrimary(), List.of(ext)));

            assertEquals(-0.9 * S, d(ext, "OCD1_1"));
            assertEquals(150.0, d(ext, "OCRVAL1"));
            assertEquals(WcsState.TAN_RA, ext.getString("OCTYPE1"));
            assertTrue(ext.containsKey("WCSCDATE"));

            assertEquals("RA---TAN-SIP", ext.getString("CTYPE1"));
            assertEquals("DEC--TAN-SIP", ext.getString("CTYPE2"));
            assertEquals(3, ext.getInt("A_ORDER", 0));
            assertEquals(2e-5, d(ext, "A_0_2"), 1e-15);
            assertEquals(200.0, d(ext, "IDCV3REF"));
            assertFalse(ext.containsKey("TDDALPHA"));
        }

        @Test
        @DisplayName("Second WFC chip is placed by its V3 offset from the reference chip")
        void twoChips() {
            MapHeader ext1 = science(2);
            MapHeader ext2 = science(1);
            ImageResult result = makeWcs(false).run(Exposure.of("j8pair", acsPrimary(), List.of(ext1, ext2)));

            assertEquals(2, result.extensions());
            assertEquals(150.0, d(ext2, "CRVAL1"), 1e-7);
            assertEquals(CHIP_SEPARATION, d(ext2, "CRVAL2") - d(ext1, "CRVAL2"), 1e-7);
            assertEquals(S, d(ext2, "CD1_1"), 1e-10);
            assertEquals(-S, d(ext2, "CD2_2"), 1e-10);
            assertEquals(300.0, d(ext2, "IDCV3REF"));
        }

        @Test
        @DisplayName("Velocity aberration stretches the chip separation and the CD matrix")
        void velocityAberration() {
            double va = 1.0001;
            MapHeader ext1 = science(2).with("VAFACTOR", va);
            MapHeader ext2 = science(1).with("VAFACTOR", va);
            makeWcs(false).run(Exposure.of("j8va", acsPrimary(), List.of(ext1, ext2)));

            assertEquals(va * CHIP_SEPARATION, d(ext2, "CRVAL2") - d(ext1, "CRVAL2"), 1e-7);
            assertEquals(va * S, d(ext1, "CD1_1"), CD_TOLERANCE);
        }

        @Test
        @DisplayName("Time-dependent correction records its terms and barely moves the chips")
        void timeDependentCorrection() {
            MapHeader ext1 = science(2);
            MapHeader ext2 = science(1);
            makeWcs(true).run(Exposure.of("j8tdd", acsPrimary(), List.of(ext1, ext2)));

            TddCoefficients.Terms terms = TddCoefficients.WFC_SKEW_DRIFT.at(LocalDate.of(2006, 3, 15));
            assertEquals(terms.alpha(), d(ext2, "TDDALPHA"), 1e-15);
            assertEquals(terms.beta(), d(ext2, "TDDBETA"), 1e-15);
            assertEquals(CHIP_SEPARATION, d(ext2, "CRVAL2") - d(ext1, "CRVAL2"), 1e-5);
            // archive still holds the values from before the first pass
            assertEquals(30.0, d(ext2, "OCRVAL2"));
        }

        @Test
        @DisplayName("TDDCORR=OMIT switches the correction off")
        void tddOmitted() {
            MapHeader ext = science(2);
            makeWcs(true).run(Exposure.of("j8omit", acsPrimary().with("TDDCORR", "OMIT"), List.of(ext)));
            assertFalse(ext.containsKey("TDDALPHA"));
        }

        @Test
        @DisplayName("Subarray keeps its own reference pixel")
        void subarray() {
            MapHeader ext = TangentPlaneWcsTest.wcsHeader(150.0, 30.0, 1948, 974, -S, 0, 0, S)
                    .with("CCDCHIP", 2).with("LTV1", -100.0).with("LTV2", -50.0);
            makeWcs(false).run(Exposure.of("j8sub", acsPrimary(), List.of(ext)));

            assertEquals(1948.0, d(ext, "CRPIX1"), 1e-9);
            assertEquals(974.0, d(ext, "CRPIX2"), 1e-9);
            assertEquals(150.0, d(ext, "CRVAL1"), ANGLE_TOLERANCE);
            assertEquals(30.0, d(ext, "CRVAL2"), ANGLE_TOLERANCE);
        }

        @Test
        @DisplayName("Roll angle falls back to the support file")
        void supportFileRoll() {
            MapHeader noRoll = new MapHeader();
            acsPrimary().keywords().stream().filter(k -> !k.equals("PA_V3"))
                    .forEach(k -> noRoll.put(k, acsPrimary().get(k)));
            MapHeader ext = science(2);

            ImageResult result = makeWcs(false).run(
                    Exposure.of("j8spt", noRoll, List.of(ext), new MapHeader().with("PA_V3", 0.0)));

            assertEquals(ImageResult.Status.UPDATED, result.status());
            assertEquals(S, d(ext, "CD1_1"), CD_TOLERANCE);
        }

        @Test
        @DisplayName("WFPC2 takes its aperture from the offset table")
        void wfpc2OffsetTable() {
            MapHeader primary = new MapHeader()
                    .with("INSTRUME", "WFPC2")
                    .with("IDCTAB", "uref$wfpc2_idc.fits")
                    .with("OFFTAB", "uref$wfpc2_off.fits")
                    .with("FILTNAM1", "F555W")
                    .with("FILTNAM2", "")
                    .with("MODE", "FULL")
                    .with("DATE-OBS", "1995-01-01")
                    .with("PA_V3", 45.0);
            MapHeader ext = TangentPlaneWcsTest.wcsHeader(10.0, -5.0, 400, 400, -S, 0, 0, S).with("DETECTOR", 3);

            ImageResult result = makeWcs(true).run(Exposure.of("u2wfpc2", primary, List.of(ext)));

            assertEquals(ImageResult.Status.UPDATED, result.status());
            assertEquals(-30.2, d(ext, "IDCV2REF"), 1e-9);
            assertEquals(3e-6, d(ext, "A_2_0"), 1e-15);
            assertFalse(ext.containsKey("TDDALPHA"));
        }
    }

    @Nested
    @DisplayName("Restoring")
    class RestoreTests {

        @Test
        @DisplayName("Restore mode brings back the archived WCS")
        void restore() {
            MapHeader ext1 = science(2);
            MapHeader ext2 = science(1);
            Exposure exposure = Exposure.of("j8pair", acsPrimary(), List.of(ext1, ext2));
            makeWcs(false).run(exposure);
            assertNotEquals(30.0, d(ext2, "CRVAL2"), 1e-6);

            MakeWcs restore = new MakeWcs(RESOURCES, MakeWcsOptions.builder().restore(true).build());
            ImageResult result = restore.run(exposure);

            assertEquals(ImageResult.Status.RESTORED, result.status());
            assertEquals(2, result.extensions());
            assertEquals(30.0, d(ext2, "CRVAL2"));
            assertEquals(-0.9 * S, d(ext2, "CD1_1"));
            assertEquals(WcsState.TAN_RA, ext2.getString("CTYPE1"));
        }

        @Test
        @DisplayName("Restore uses the prefix found in the header, keeping numbered keywords apart")
        void restoreFoundPrefix() {
            MapHeader ext1 = science(2);
            MapHeader ext2 = science(1);
            Exposure exposure = Exposure.of("j8wpair", acsPrimary(), List.of(ext1, ext2));
            new MakeWcs(RESOURCES, MakeWcsOptions.builder().prefix("W").tddCorrection(false).build()).run(exposure);
            assertEquals(1024.0, d(ext2, "WCRPIX2"));
            assertEquals(30.0, d(ext2, "WCRVAL2"));
            assertFalse(ext2.containsKey("OCRVAL2"));

            ImageResult result = new MakeWcs(RESOURCES, MakeWcsOptions.builder().restore(true).build()).run(exposure);

            assertEquals(2, result.extensions());
            assertEquals(2048.0, d(ext2, "CRPIX1"));
            assertEquals(1024.0, d(ext2, "CRPIX2"));
            assertEquals(150.0, d(ext2, "CRVAL1"));
            assertEquals(30.0, d(ext2, "CRVAL2"));
            assertEquals(-0.9 * S, d(ext2, "CD1_1"));
        }

        @Test
        @DisplayName("Restoring an image that was never updated changes nothing")
        void restoreUntouched() {
            MapHeader ext = science(2);
            MakeWcs restore = new MakeWcs(RESOURCES, MakeWcsOptions.builder().restore(true).build());
            ImageResult result = restore.run(Exposure.of("j8new", acsPrimary(), List.of(ext)));

            assertEquals(0, result.extensions());
            assertEquals(-0.9 * S, d(ext, "CD1_1"));
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Images without IDCTAB are skipped")
        void noIdctab() {
            MapHeader primary = acsPrimary();
            MapHeader withoutTable = new MapHeader();
            primary.keywords().stream().filter(k -> !k.equals("IDCTAB")).forEach(k -> withoutTable.put(k, primary.get(k)));

            ImageResult result = makeWcs(false).run(Exposure.of("j8none", withoutTable, List.of(science(2))));
            assertEquals(ImageResult.Status.SKIPPED, result.status());
            assertNull(result.errorKind());
        }

        @Test
        @DisplayName("Images whose IDCTAB cannot be found are skipped")
        void idctabNotFound() {
            MapHeader ext = science(2);
            ImageResult result = makeWcs(false).run(
                    Exposure.of("j8lost", acsPrimary().with("IDCTAB", "jref$lost_idc.fits"), List.of(ext)));
            assertEquals(ImageResult.Status.SKIPPED, result.status());
            assertTrue(result.message().contains("lost_idc.fits"), result.message());
            assertFalse(ext.containsKey("OCRVAL1"));
        }

        @Test
        @DisplayName("A missing roll angle fails that image and the batch continues")
        void missingRoll() {
            MapHeader noRoll = new MapHeader();
            acsPrimary().keywords().stream().filter(k -> !k.equals("PA_V3"))
                    .forEach(k -> noRoll.put(k, acsPrimary().get(k)));
            MapHeader good = science(2);

            List<ImageResult> results = makeWcs(false).run(List.of(
                    Exposure.of("j8noroll", noRoll, List.of(science(2))),
                    Exposure.of("j8good", acsPrimary(), List.of(good))));

            assertEquals(ImageResult.Status.FAILED, results.get(0).status());
            assertEquals(ErrorKind.MISSING_ROLL_ANGLE, results.get(0).errorKind());
            assertEquals(0, results.get(0).extensions());
            assertEquals(ImageResult.Status.UPDATED, results.get(1).status());
            assertTrue(good.containsKey("A_ORDER"));
        }

        @Test
        @DisplayName("Extensions updated before a failure keep their new WCS")
        void notTransactional() {
            MapHeader ext1 = science(2);
            MapHeader ext2 = science(5);
            ImageResult result = makeWcs(false).run(Exposure.of("j8half", acsPrimary(), List.of(ext1, ext2)));

            assertEquals(ImageResult.Status.FAILED, result.status());
            assertEquals(ErrorKind.CALIBRATION_LOOKUP, result.errorKind());
            assertEquals(1, result.extensions());
            assertEquals("RA---TAN-SIP", ext1.getString("CTYPE1"));
            assertEquals(WcsState.TAN_RA, ext2.getString("CTYPE1"));
            assertFalse(ext2.containsKey("OCRVAL1"));
        }

        @Test
        @DisplayName("A malformed IDCTAB fails its image and the batch continues")
        void malformedTable() {
            CalibrationTable broken = CalibrationTable.builder("bad_idc.fits")
                    .header("NORDER", 3)
                    .columns("DETCHIP", "DIRECTION", "FILTER1", "FILTER2", "SCALE")
                    .row(2, "FORWARD", "CLEAR1L", "F606W", 0.05)
                    .build();
            CalibrationSource source = name -> name.contains("bad_idc") ? broken : RESOURCES.open(name);
            MapHeader skipped = science(2);
            MapHeader good = science(2);

            List<ImageResult> results = new MakeWcs(source, MakeWcsOptions.builder().tddCorrection(false).build())
                    .run(List.of(
                            Exposure.of("j8bad", acsPrimary().with("IDCTAB", "jref$bad_idc.fits"), List.of(skipped)),
                            Exposure.of("j8good", acsPrimary(), List.of(good))));

            assertEquals(ImageResult.Status.FAILED, results.get(0).status());
            assertEquals(ErrorKind.CALIBRATION_IO, results.get(0).errorKind());
            assertTrue(results.get(0).message().contains("bad_idc.fits"), results.get(0).message());
            assertEquals(WcsState.TAN_RA, skipped.getString("CTYPE1"));
            assertEquals(ImageResult.Status.UPDATED, results.get(1).status());
            assertTrue(good.containsKey("A_ORDER"));
        }

        @Test
        @DisplayName("Unsupported instruments fail the image")
        void unsupportedInstrument() {
            ImageResult result = makeWcs(false).run(
                    Exposure.of("x0foc", acsPrimary().with("INSTRUME", "FOC"), List.of(science(1))));
            assertEquals(ErrorKind.UNSUPPORTED_INSTRUMENT, result.errorKind());
        }

        @Test
        @DisplayName("An empty batch is rejected")
        void emptyBatch() {
            assertThrows(IllegalArgumentException.class, () -> makeWcs(false).run(List.of()));
        }
    }

    @Nested
    @DisplayName("Options")
    class OptionTests {

        @Test
        @DisplayName("Defaults")
        void defaults() {
            MakeWcsOptions o = MakeWcsOptions.defaults();
            assertEquals("O", o.prefix());
            assertTrue(o.tddCorrection());
            assertFalse(o.restore());
            assertSame(TddCoefficients.WFC_SKEW_DRIFT, o.tddCoefficients());
        }

        @Test
        @DisplayName("Archive prefix is a single letter or digit")
        void prefixLength() {
            assertThrows(IllegalArgumentException.class, () -> MakeWcsOptions.builder().prefix(""));
            assertThrows(IllegalArgumentException.class, () -> MakeWcsOptions.builder().prefix("OLD"));
            assertThrows(IllegalArgumentException.class, () -> MakeWcsOptions.builder().prefix("_"));
            assertEquals("W", MakeWcsOptions.builder().prefix("W").build().prefix());
        }
    }
}
