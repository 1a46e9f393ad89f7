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

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Batch driver: updates (or restores) the WCS of every science extension of
 * each exposure.
 *
 * <p>Exposures are independent. A skippable failure ends the exposure it
 * occurs in and is reported in its {@link ImageResult}; extensions updated
 * before the failure keep their new values.</p>
 *
 * <pre>{@code
 * MakeWcs makeWcs = new MakeWcs(new DirectoryCalibrationSource(jref), MakeWcsOptions.defaults());
 * List<ImageResult> results = makeWcs.run(exposures);
 * }</pre>
 */
public final class MakeWcs {
    private static final Logger log = LoggerFactory.getLogger(MakeWcs.class);

    public static final String VERSION = "1.1.2";

    private final CalibrationSource calibrationSource;
    private final MakeWcsOptions options;

    public MakeWcs(CalibrationSource calibrationSource, MakeWcsOptions options) {
        this.calibrationSource = calibrationSource;
        this.options = options;
    }

    /**
     * Process every exposure in order.
     *
     * @throws IllegalArgumentException if {@code exposures} is empty
     * @throws WcsUpdateException on a failure that is not skippable
     */
    public List<ImageResult> run(List<Exposure> exposures) {
        log.info("+ MAKEWCS Version {}", VERSION);
        if (exposures.isEmpty()) {
            throw new IllegalArgumentException("No valid input files found.");
        }
        WcsUpdater updater = new WcsUpdater(calibrationSource, options.prefix());
        List<ImageResult> results = new ArrayList<>();
        for (Exposure exposure : exposures) {
            results.add(process(exposure, updater));
        }
        return results;
    }

    public ImageResult run(Exposure exposure) {
        return run(List.of(exposure)).get(0);
    }

    private ImageResult process(Exposure exposure, WcsUpdater updater) {
        Header primary = exposure.primaryHeader();
        if (options.restore()) {
            return restore(exposure);
        }

        String idctab = primary.getString("IDCTAB");
        if (idctab == null || idctab.isEmpty()) {
            log.warn("No IDCTAB specified. No correction can be done for file {}", exposure.name());
            return ImageResult.skipped(exposure.name(), "No IDCTAB specified");
        }
        if (!updater.isAvailable(idctab)) {
            log.warn("IDCTAB {} could not be found. WCS keywords for file {} will not be updated.",
                    idctab, exposure.name());
            return ImageResult.skipped(exposure.name(), "IDCTAB " + idctab + " could not be found");
        }

        int done = 0;
        try {
            Instrument instrument = Instrument.fromHeader(primary.getString("INSTRUME"));
            boolean tdd = applyTdd(instrument, primary);
            int count = exposure.scienceHeaders().size();
            for (int i = 0; i < count; i++) {
                updater.update(exposure, i, idctab, null);
                if (tdd) {
                    log.info("Applying time-dependent distortion corrections...");
                    updater.update(exposure, i, idctab, options.tddCoefficients());
                }
                done++;
            }
        } catch (WcsUpdateException e) {
            if (!e.kind().isSkippable()) throw e;
            log.error("WCS of {} not updated past extension {}: {}", exposure.name(), done, e.getMessage());
            return ImageResult.failed(exposure.name(), done, e);
        }
        return ImageResult.updated(exposure.name(), done);
    }

    private boolean applyTdd(Instrument instrument, Header primary) {
        if (!options.tddCorrection() || instrument.tddConfig(primary.getString("DETECTOR")).isEmpty()) {
            return false;
        }
        return !"OMIT".equals(primary.getString("TDDCORR"));
    }

    private ImageResult restore(Exposure exposure) {
        int restored = 0;
        List<Header> science = exposure.scienceHeaders();
        for (int i = 0; i < science.size(); i++) {
            log.info("Restoring original WCS values for {}[sci,{}]", exposure.name(), i + 1);
            Header header = science.get(i);
            String found = WcsArchiver.findPrefix(header);
            if (WcsArchiver.restoreWcs(header, found != null ? found : options.prefix()) > 0) {
                restored++;
            } else {
                log.error("Could not restore WCS keywords for {}[sci,{}]", exposure.name(), i + 1);
            }
        }
        return ImageResult.restored(exposure.name(), restored);
    }
}
