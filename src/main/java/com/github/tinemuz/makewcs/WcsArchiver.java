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

import java.util.EnumMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves archived WCS values between a {@link TangentPlaneWcs} and a header.
 *
 * <p>Archive keywords are the active names with a prefix prepended and cut
 * to eight characters ({@code OCD1_1}, {@code OORIENTA}). Existing archive
 * keywords in a header are never replaced unless the caller asks to
 * overwrite.</p>
 */
public final class WcsArchiver {
    private static final Logger log = LoggerFactory.getLogger(WcsArchiver.class);

    private WcsArchiver() {}

    /**
     * Find the archive prefix already used in a header: the first character
     * of any keyword whose remainder is a WCS keyword name.
     *
     * @return the prefix, or {@code null} if the header has no archive
     */
    public static String findPrefix(Header header) {
        for (String key : header.keywords()) {
            if (key.length() < 2 || !Character.isLetterOrDigit(key.charAt(0))) continue;
            if (WcsKeyword.forFitsName(key.substring(1)) != null) return key.substring(0, 1);
        }
        return null;
    }

    /**
     * Attach an archive to {@code wcs}. If the header already holds archive
     * keywords their prefix and values are adopted (an archive keyword that is
     * missing falls back to the active keyword); otherwise the current WCS
     * values are archived under {@code prefix}.
     */
    public static void readArchive(Header header, TangentPlaneWcs wcs, String prefix) {
        String found = findPrefix(header);
        if (found == null) {
            wcs.archive(prefix, false);
            return;
        }

        WcsState current = wcs.state();
        Map<WcsKeyword, Object> values = new EnumMap<>(WcsKeyword.class);
        for (WcsKeyword k : WcsKeyword.values()) {
            if (!k.inHeader()) continue;
            String archiveName = k.archiveName(found);
            Object value = header.get(archiveName);
            if (value == null) value = header.get(k.fitsName());
            if (value == null) value = k.valueOf(current);
            values.put(k, value);
        }
        WcsState archived = WcsKeyword.stateOf(values);

        String timestamp = header.getString(WcsKeyword.ARCHIVE_DATE);
        if (timestamp == null) timestamp = WcsArchive.now();
        wcs.adoptArchive(new WcsArchive(found, archived, timestamp));
    }

    /**
     * Write the archive of {@code wcs} into {@code header}. Only keywords whose
     * active counterpart exists in the header are archived; existing archive
     * keywords are kept unless {@code overwrite} is set. {@code WCSCDATE} is
     * added when absent.
     *
     * @return number of archive keywords written
     */
    public static int writeArchive(Header header, TangentPlaneWcs wcs, boolean overwrite) {
        WcsArchive archive = wcs.archive();
        if (archive == null) return 0;

        int written = 0;
        for (WcsKeyword k : WcsKeyword.values()) {
            if (!k.inHeader()) continue;
            String archiveName = k.archiveName(archive.prefix());
            if (header.containsKey(archiveName) && !overwrite) {
                log.debug("WCS keyword {} already exists! Not overwriting.", archiveName);
                continue;
            }
            if (header.containsKey(k.fitsName())) {
                header.put(archiveName, archive.valueOf(k));
                written++;
            }
        }
        if (!header.containsKey(WcsKeyword.ARCHIVE_DATE)) {
            header.put(WcsKeyword.ARCHIVE_DATE, archive.timestamp());
        }
        return written;
    }

    /**
     * Copy archived values back onto the active keywords of a header.
     *
     * @param prefix archive prefix; {@code null} uses the one found in the header
     * @return number of keywords restored, 0 when no archive was found
     */
    public static int restoreWcs(Header header, String prefix) {
        String p = prefix != null ? prefix : findPrefix(header);
        if (p == null) {
            log.warn("No original WCS values found.");
            return 0;
        }
        int restored = 0;
        for (WcsKeyword k : WcsKeyword.values()) {
            if (!k.inHeader()) continue;
            Object value = header.get(k.archiveName(p));
            if (value != null) {
                header.put(k.fitsName(), value);
                restored++;
            }
        }
        if (restored == 0) log.warn("No original WCS values found for prefix {}.", p);
        return restored;
    }
}
