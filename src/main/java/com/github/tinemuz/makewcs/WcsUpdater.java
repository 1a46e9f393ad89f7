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

import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recomputes the WCS of one science extension from its distortion model,
 * the telescope roll and the WCS of the exposure's reference chip.
 *
 * <p>The extension header receives the new linear WCS, an archive of the
 * values it replaced (unless one exists) and the SIP keywords of its
 * distortion model. The reference extension receives an archive of its own
 * values when it has none. Distortion models are cached for the lifetime of
 * the updater.</p>
 */
public final class WcsUpdater {
    private static final Logger log = LoggerFactory.getLogger(WcsUpdater.class);

    private final CalibrationSource calibrationSource;
    private final String prefix;
    private final Map<CalibrationKey, DistortionModel> models = new HashMap<>();
    private final Map<String, CalibrationTable> tables = new HashMap<>();

    public WcsUpdater(CalibrationSource calibrationSource, String prefix) {
        this.calibrationSource = calibrationSource;
        this.prefix = prefix;
    }

    /**
     * Update science extension {@code index} (0-based) of an exposure.
     *
     * @param idctab distortion table named by the exposure
     * @param tdd skew terms to apply, or {@code null} for none
     * @throws WcsUpdateException if the extension cannot be updated; headers
     *     already written stay written
     */
    public void update(Exposure exposure, int index, String idctab, TddCoefficients tdd) {
        Header primary = exposure.primaryHeader();
        Header extension = exposure.scienceHeaders().get(index);
        Header hdr = new MergedHeader(primary, extension);

        Instrument instrument = Instrument.fromHeader(hdr.getString("INSTRUME"));
        String offtab = hdr.getString("OFFTAB");
        String dateObs = hdr.getString("DATE-OBS");
        LocalDate date = dateObs == null ? null : parseDate(dateObs);
        log.debug("OFFTAB, DATE-OBS: {}, {}", offtab, dateObs);
        log.info("-Updating image {}[sci,{}]", exposure.name(), index + 1);

        double paV3 = rollAngle(exposure, hdr);
        String detector = hdr.getString("DETECTOR");
        String filter1 = hdr.getString(instrument.filter1Keyword());
        String filter2 = instrument.filter2Keyword() == null ? null : hdr.getString(instrument.filter2Keyword());
        int binned = instrument == Instrument.WFPC2 && "AREA".equals(hdr.getString("MODE")) ? 2 : 1;

        Parity parity = instrument.parity(detector);
        double vaFactor = instrument.hasVelocityAberration() ? hdr.getDouble("VAFACTOR", 1.0) : 1.0;
        if (instrument.hasVelocityAberration()) log.debug("VA factor: {}", vaFactor);

        int chip = chipId(hdr);
        Integer camera = hdr.containsKey("CAMERA") ? hdr.getInt("CAMERA", 1) : null;
        Instrument.ReferenceChip ref = instrument.referenceChip(
                detector, chip, camera, extensionDetectors(exposure));
        log.debug("-PA_V3 : {} CHIP #{}", paV3, chip);

        TimeDependentCorrection correction = TimeDependentCorrection.disabled();
        if (tdd != null) {
            TddConfig config = instrument.tddConfig(detector).orElse(null);
            if (config != null) {
                if (date == null) {
                    throw new WcsUpdateException(ErrorKind.INCOMPLETE_WCS,
                            "DATE-OBS is needed for the time-dependent distortion correction");
                }
                correction = TimeDependentCorrection.forDate(config, tdd, date);
            }
        }

        DistortionModel model = model(idctab, offtab, chip, filter1, filter2, date, binned);
        RefPix refPix = model.refPix();

        TangentPlaneWcs old = TangentPlaneWcs.fromHeader(extension, prefix);
        old.restore();

        // subarray placement relative to the model's reference pixel
        double ltv1 = hdr.getDouble("LTV1", 0.0);
        double ltv2 = hdr.getDouble("LTV2", 0.0);
        double offsetX = old.crpix1() - ltv1 - refPix.xref();
        double offsetY = old.crpix2() - ltv2 - refPix.yref();
        double ltvOffX = 0.0;
        double ltvOffY = 0.0;
        PixelPosition offShift = new PixelPosition(0.0, 0.0);
        if (ltv1 != 0.0 || ltv2 != 0.0) {
            ltvOffX = ltv1 + offsetX;
            ltvOffY = ltv2 + offsetY;
            offShift = new PixelPosition(offsetX + refPix.xref() + ltv1, offsetY + refPix.yref() + ltv2);
            model = model.shift(offsetX, offsetY);
        }

        DistortionModel refModel = model(idctab, offtab, ref.chip(), filter1, filter2, date, binned);
        RefPix refRefPix = refModel.refPix();

        Header refExtension = exposure.scienceHeaders().get(ref.extension() - 1);
        log.debug("Reference image: {}[sci,{}]", exposure.name(), ref.extension());
        TangentPlaneWcs reference = TangentPlaneWcs.fromHeader(refExtension, prefix);
        WcsArchiver.writeArchive(refExtension, reference, false);
        reference.restore();

        double dec = reference.crval2();
        double tddScale = reference.pscale() / model.fx(1, 1);
        ReferencePointing refPointing = correction.apply(refRefPix, ref.chip(), tddScale);
        ReferencePointing pointing = correction.apply(refPix, chip, tddScale);

        double pv = ReferenceFrameComposer.troll(paV3, dec, refPointing.v2ref(), refPointing.v3ref())
                + refRefPix.theta();

        ReferenceFrameComposer composer = new ReferenceFrameComposer(parity);
        TangentPlaneWcs frame = composer.referenceFrame(
                reference,
                new PixelPosition(refRefPix.xref() + ltvOffX, refRefPix.yref() + ltvOffY),
                offShift,
                pv,
                refRefPix.pscale());
        log.debug("  Reference Chip Scale (arcsec/pix): {}", refRefPix.pscale());

        PixelPosition offset = composer.apertureOffset(
                pointing.v2ref(), pointing.v3ref(),
                refPointing.v2ref(), refPointing.v3ref(),
                refRefPix.theta(), refRefPix.pscale(), offShift);

        double dtheta = refPix.theta() != 0.0 ? refPix.theta() - refRefPix.theta() : 0.0;
        TangentPlaneWcs updated = old.copy();
        composer.placeChip(frame, updated, offset,
                new PixelPosition(refPix.xref() + ltvOffX, refPix.yref() + ltvOffY), model, dtheta);
        composer.applyVelocityAberration(frame, updated, vaFactor);

        WcsKeyword.writeTo(extension, updated.state());
        WcsArchiver.writeArchive(extension, updated, false);
        SipConverter.write(extension, model, correction);
        log.info("-Updated WCS of {}[sci,{}]: {}", exposure.name(), index + 1, updated);
    }

    /**
     * Whether a calibration table can be opened. An opened table is kept for
     * later lookups.
     */
    public boolean isAvailable(String name) {
        try {
            table(name);
            return true;
        } catch (CalibrationFileException e) {
            log.warn("Calibration table {} could not be opened: {}", name, e.getCause().getMessage());
            return false;
        }
    }

    /** Number of distortion models loaded so far. */
    int cachedModels() {
        return models.size();
    }

    private double rollAngle(Exposure exposure, Header hdr) {
        if (hdr.containsKey("PA_V3")) {
            return hdr.getDouble("PA_V3", 0.0);
        }
        Header support = exposure.supportHeader().orElse(null);
        if (support != null && support.containsKey("PA_V3")) {
            log.debug("PA_V3 taken from the support file of {}", exposure.name());
            return support.getDouble("PA_V3", 0.0);
        }
        throw new MissingRollAngleException(exposure.name());
    }

    /**
     * Chip id of an extension: a numeric CAMERA, else CCDCHIP, else a
     * numeric DETECTOR, else 1.
     */
    static int chipId(Header hdr) {
        String camera = hdr.getString("CAMERA");
        if (camera != null && isDigits(camera)) return Integer.parseInt(camera);
        String ccdchip = hdr.getString("CCDCHIP");
        if (ccdchip != null && !ccdchip.isEmpty()) return hdr.getInt("CCDCHIP", 1);
        String detector = hdr.getString("DETECTOR");
        if (detector != null && isDigits(detector)) return Integer.parseInt(detector);
        return 1;
    }

    private static boolean isDigits(String s) {
        return !s.isEmpty() && s.chars().allMatch(Character::isDigit);
    }

    private static List<Integer> extensionDetectors(Exposure exposure) {
        List<Integer> detectors = new ArrayList<>();
        for (Header h : exposure.scienceHeaders()) {
            detectors.add(h.getInt("DETECTOR", 1));
        }
        return detectors;
    }

    private static LocalDate parseDate(String dateObs) {
        try {
            return Epochs.parseDate(dateObs);
        } catch (IllegalArgumentException e) {
            throw new WcsUpdateException(ErrorKind.INCOMPLETE_WCS, "Unreadable DATE-OBS '" + dateObs + "'", e);
        }
    }

    private DistortionModel model(
            String idctab, String offtab, int chip, String filter1, String filter2, LocalDate date, int binned) {
        CalibrationKey key = new CalibrationKey(idctab, chip, filter1, filter2, Direction.FORWARD, date);
        DistortionModel model = models.get(key);
        if (model == null) {
            CalibrationTable table = table(idctab);
            CalibrationTable offsetTable = null;
            if (!table.hasColumn("V2REF") && hasTable(offtab)) {
                offsetTable = table(offtab);
            }
            model = DistortionModel.load(table, key, offsetTable);
            models.put(key, model);
        }
        return binned > 1 ? model.binned(binned) : model;
    }

    private CalibrationTable table(String name) {
        CalibrationTable table = tables.get(name);
        if (table != null) return table;
        try {
            table = calibrationSource.open(name);
        } catch (IOException e) {
            throw new CalibrationFileException(name, e);
        }
        tables.put(name, table);
        return table;
    }

    private static boolean hasTable(String name) {
        return name != null && !name.isBlank() && !"N/A".equalsIgnoreCase(name.trim());
    }
}
