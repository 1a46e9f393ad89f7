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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mutable gnomonic (TAN) WCS of one chip.
 *
 * <p>Holds the active CRVAL/CRPIX/CD values, converts between pixel and sky
 * positions and keeps an optional {@link WcsArchive} of the values the chip
 * had before it was updated. The archive is write-once: {@link #archive}
 * refuses to replace it unless asked to overwrite.</p>
 */
public final class TangentPlaneWcs {
    private static final Logger log = LoggerFactory.getLogger(TangentPlaneWcs.class);

    private double crval1;
    private double crval2;
    private double crpix1;
    private double crpix2;
    private double cd11;
    private double cd12;
    private double cd21;
    private double cd22;
    private int naxis1;
    private int naxis2;
    private String ctype1;
    private String ctype2;
    private double orient;
    private double pscale;
    // created from scratch rather than read from a header
    private final boolean fresh;
    private WcsArchive archive;

    public TangentPlaneWcs(WcsState state) {
        this(state, false);
    }

    private TangentPlaneWcs(WcsState state, boolean fresh) {
        this.fresh = fresh;
        apply(state);
        update();
    }

    /**
     * A WCS created from scratch: unit CD matrix, reference pixel at the
     * origin, plate scale fixed to {@code pscale}.
     */
    public static TangentPlaneWcs create(int naxis1, int naxis2, double pscale) {
        WcsState s = WcsState.of(0.0, 0.0, 0.0, 0.0, 1.0, 1.0, 1.0, 1.0, naxis1, naxis2,
                WcsState.TAN_RA, WcsState.TAN_DEC);
        TangentPlaneWcs wcs = new TangentPlaneWcs(s, true);
        wcs.pscale = pscale;
        return wcs;
    }

    /**
     * Read the WCS of one extension and attach its archive: an archive found
     * in the header is adopted, otherwise the current values are archived
     * under {@code prefix} (default {@code "O"}).
     *
     * @throws WcsUpdateException if a required WCS keyword is missing
     */
    public static TangentPlaneWcs fromHeader(Header header, String prefix) {
        TangentPlaneWcs wcs = new TangentPlaneWcs(readState(header));
        WcsArchiver.readArchive(header, wcs, prefix);
        return wcs;
    }

    static WcsState readState(Header header) {
        int naxis1;
        int naxis2;
        if (header.getInt("NAXIS", -1) == 0 && header.containsKey("PIXVALUE")) {
            // constant-valued extension
            naxis1 = header.getInt(required(header, "NPIX1"), 0);
            naxis2 = header.getInt(required(header, "NPIX2"), 0);
        } else {
            naxis1 = header.getInt(required(header, "NAXIS1"), 0);
            naxis2 = header.getInt(required(header, "NAXIS2"), 0);
        }
        return WcsState.of(
                header.getDouble(required(header, "CRVAL1"), 0.0),
                header.getDouble(required(header, "CRVAL2"), 0.0),
                header.getDouble(required(header, "CRPIX1"), 0.0),
                header.getDouble(required(header, "CRPIX2"), 0.0),
                header.getDouble(required(header, "CD1_1"), 0.0),
                header.getDouble(required(header, "CD1_2"), 0.0),
                header.getDouble(required(header, "CD2_1"), 0.0),
                header.getDouble(required(header, "CD2_2"), 0.0),
                naxis1,
                naxis2,
                header.getString(required(header, "CTYPE1")),
                header.getString(required(header, "CTYPE2")));
    }

    private static String required(Header header, String keyword) {
        if (!header.containsKey(keyword)) {
            throw new WcsUpdateException(ErrorKind.INCOMPLETE_WCS,
                    "Header does not contain required WCS keyword " + keyword);
        }
        return keyword;
    }

    /** Current values as an immutable snapshot. */
    public WcsState state() {
        return new WcsState(crval1, crval2, crpix1, crpix2, cd11, cd12, cd21, cd22,
                naxis1, naxis2, orient, pscale, ctype1, ctype2);
    }

    /** Independent copy, archive included. */
    public TangentPlaneWcs copy() {
        TangentPlaneWcs c = new TangentPlaneWcs(state(), fresh);
        c.pscale = pscale;
        c.archive = archive;
        return c;
    }

    private void apply(WcsState s) {
        crval1 = s.crval1();
        crval2 = s.crval2();
        crpix1 = s.crpix1();
        crpix2 = s.crpix2();
        cd11 = s.cd11();
        cd12 = s.cd12();
        cd21 = s.cd21();
        cd22 = s.cd22();
        naxis1 = s.naxis1();
        naxis2 = s.naxis2();
        ctype1 = s.ctype1();
        ctype2 = s.ctype2();
    }

    /** Recompute plate scale and orientation from the CD matrix. */
    public void update() {
        pscale = fresh ? 1.0 : WcsState.computePscale(cd11, cd21);
        orient = WcsState.computeOrient(cd12, cd22);
    }

    /**
     * Pixel to sky through the TAN projection.
     *
     * @return position with right ascension in {@code [0, 360)}
     * @throws UnsupportedProjectionException if the WCS is not TAN
     */
    public SkyPosition xy2rd(double x, double y) {
        requireTan();
        double dx = x - crpix1;
        double dy = y - crpix2;
        double xi = Math.toRadians(cd11 * dx + cd12 * dy);
        double eta = Math.toRadians(cd21 * dx + cd22 * dy);
        double ra0 = Math.toRadians(crval1);
        double dec0 = Math.toRadians(crval2);

        double denom = Math.cos(dec0) - eta * Math.sin(dec0);
        double ra = Math.atan2(xi, denom) + ra0;
        double dec = Math.atan2(eta * Math.cos(dec0) + Math.sin(dec0),
                Math.sqrt(denom * denom + xi * xi));

        return new SkyPosition(Angles.positiveMod(Math.toDegrees(ra), 360.0), Math.toDegrees(dec));
    }

    public SkyPosition xy2rd(PixelPosition p) {
        return xy2rd(p.x(), p.y());
    }

    /**
     * Sky to pixel, the inverse of {@link #xy2rd}.
     *
     * @throws SingularMatrixException if the CD matrix has no inverse
     * @throws GeometryRangeException if the position is 90 degrees or more
     *     from the tangent point
     */
    public PixelPosition rd2xy(double ra, double dec) {
        requireTan();
        double det = cd11 * cd22 - cd12 * cd21;
        if (det == 0.0) throw new SingularMatrixException();

        double inv11 = cd22 / det;
        double inv12 = -cd12 / det;
        double inv21 = -cd21 / det;
        double inv22 = cd11 / det;

        double ra0 = Math.toRadians(crval1);
        double dec0 = Math.toRadians(crval2);
        double r = Math.toRadians(ra);
        double d = Math.toRadians(dec);

        double bottom = Math.sin(d) * Math.sin(dec0) + Math.cos(d) * Math.cos(dec0) * Math.cos(r - ra0);
        if (bottom <= 0.0) throw new GeometryRangeException(ra, dec);

        double xi = Math.toDegrees(Math.cos(d) * Math.sin(r - ra0) / bottom);
        double eta = Math.toDegrees(
                (Math.sin(d) * Math.cos(dec0) - Math.cos(d) * Math.sin(dec0) * Math.cos(r - ra0)) / bottom);

        return new PixelPosition(inv11 * xi + inv12 * eta + crpix1, inv21 * xi + inv22 * eta + crpix2);
    }

    public PixelPosition rd2xy(SkyPosition p) {
        return rd2xy(p.ra(), p.dec());
    }

    /**
     * Rotate the CD matrix so that its orientation becomes {@code target}
     * degrees. The matrix is multiplied by the rotation of
     * {@code orient - target}; for the usual east-left sky parity that lands
     * exactly on {@code target}.
     */
    public void rotateCD(double target) {
        double delta = WcsState.computeOrient(cd12, cd22) - target;
        if (delta == 0.0) return;

        double[][] rot = Angles.rotationMatrix(delta);
        double[][] cd = Angles.multiply(new double[][] {{cd11, cd12}, {cd21, cd22}}, rot);
        cd11 = cd[0][0];
        cd12 = cd[0][1];
        cd21 = cd[1][0];
        cd22 = cd[1][1];
        orient = target;
    }

    /**
     * Move the reference pixel to the frame center, keeping the sky position
     * of every pixel to first order (C. Cox, 2004).
     */
    public void recenter() {
        requireTan();
        double cx = naxis1 / 2.0;
        double cy = naxis2 / 2.0;
        if (crpix1 == cx && crpix2 == cy) return;

        SkyPosition center = xy2rd(cx, cy);
        double ra = Math.toRadians(center.ra());
        double dec = Math.toRadians(center.dec());
        double dec0 = Math.toRadians(crval2);

        double dx = cx - crpix1;
        double dy = cy - crpix2;
        double dE = Math.toRadians(cd11 * dx + cd12 * dy);
        double dN = Math.toRadians(cd21 * dx + cd22 * dy);
        double dEdN = 1 + dE * dE + dN * dN;
        double cosdec = Math.cos(dec);
        double sindec = Math.sin(dec);
        double cosdec0 = Math.cos(dec0);
        double sindec0 = Math.sin(dec0);

        double n1 = cosdec * cosdec + dE * dE + dN * dN * sindec * sindec;
        double draDE = (cosdec0 - dN * sindec0) / n1;
        double draDN = dE * sindec0 / n1;
        double ddecDE = -dE * Math.tan(dec) / dEdN;
        double ddecDN = (1 / cosdec) * ((cosdec0 / Math.sqrt(dEdN)) - (dN * sindec / dEdN));

        double cd11n = cosdec * (cd11 * draDE + cd21 * draDN);
        double cd12n = cosdec * (cd12 * draDE + cd22 * draDN);
        double cd21n = cd11 * ddecDE + cd21 * ddecDN;
        double cd22n = cd12 * ddecDE + cd22 * ddecDN;

        crpix1 = cx;
        crpix2 = cy;
        crval1 = Math.toDegrees(ra);
        crval2 = Math.toDegrees(dec);
        cd11 = cd11n;
        cd12 = cd12n;
        cd21 = cd21n;
        cd22 = cd22n;
        update();
    }

    /**
     * Reset the WCS from an absolute plate scale and orientation. Arguments
     * left {@code null} keep their current value. A new plate scale resizes
     * the frame and re-centers the reference pixel; {@code size} wins over
     * that.
     */
    public void updateWcs(
            Double pixelScale, Double newOrient, PixelPosition refpos, SkyPosition refval, int[] size) {
        boolean updateCd = false;
        double pa;
        if (newOrient != null && newOrient != orient) {
            pa = Math.toRadians(newOrient);
            orient = newOrient;
            updateCd = true;
        } else {
            pa = Math.toRadians(orient);
        }

        double scale = pscale;
        Double ratio = null;
        if (pixelScale != null && pixelScale != pscale) {
            ratio = pixelScale / pscale;
            scale = pixelScale;
            pscale = pixelScale;
            updateCd = true;
        }

        if (ratio != null) {
            naxis1 = (int) (naxis1 / ratio);
            naxis2 = (int) (naxis2 / ratio);
            crpix1 = naxis1 / 2.0;
            crpix2 = naxis2 / 2.0;
        }
        if (size != null) {
            naxis1 = size[0];
            naxis2 = size[1];
        }
        if (refpos != null) {
            crpix1 = refpos.x();
            crpix2 = refpos.y();
        }
        if (refval != null) {
            crval1 = refval.ra();
            crval2 = refval.dec();
        }

        if (updateCd) {
            double s = scale / 3600.0;
            cd11 = -s * Math.cos(pa);
            cd12 = s * Math.sin(pa);
            cd21 = cd12;
            cd22 = -cd11;
        }
        if (!fresh) update();
        else orient = WcsState.computeOrient(cd12, cd22);
    }

    /**
     * Change the plate scale, resizing the frame around its center. With
     * {@code retain} the CD matrix is scaled so any skew it carries is kept;
     * otherwise it is rebuilt as a pure rotation.
     */
    public void scaleWcs(double pixelScale, boolean retain) {
        double ratio = pixelScale / pscale;
        naxis1 = (int) (naxis1 / ratio);
        naxis2 = (int) (naxis2 / ratio);
        crpix1 = naxis1 / 2.0;
        crpix2 = naxis2 / 2.0;

        if (retain) {
            cd11 *= ratio;
            cd12 *= ratio;
            cd21 *= ratio;
            cd22 *= ratio;
        } else {
            double pa = Math.toRadians(orient);
            double s = pixelScale / 3600.0;
            cd11 = -s * Math.cos(pa);
            cd12 = s * Math.sin(pa);
            cd21 = cd12;
            cd22 = -cd11;
        }
        update();
    }

    /**
     * Record the current values as the archive copy.
     *
     * @param prefix archive prefix, or {@code null} to keep the existing one
     *     (default {@code "O"})
     * @param overwrite replace an existing archive
     * @return whether an archive was written
     */
    public boolean archive(String prefix, boolean overwrite) {
        if (archive != null && !overwrite) {
            log.warn("Backup WCS keywords already exist! No backup made."
                    + " The values can only be overridden with overwrite.");
            return false;
        }
        String p = prefix;
        if (p == null) p = archive != null ? archive.prefix() : WcsArchive.DEFAULT_PREFIX;
        archive = new WcsArchive(p, state(), WcsArchive.now());
        return true;
    }

    /** Reset the active values to the archived ones. No-op without an archive. */
    public void restore() {
        if (archive == null) return;
        apply(archive.state());
        update();
    }

    /** Adopt an archive found in a header. */
    void adoptArchive(WcsArchive found) {
        this.archive = found;
    }

    /** The archive copy, or {@code null} if none has been taken. */
    public WcsArchive archive() {
        return archive;
    }

    public String prefix() {
        return archive == null ? null : archive.prefix();
    }

    /** Archived value of {@code keyword}. */
    public Object archivedValue(WcsKeyword keyword) {
        if (archive == null) {
            throw new IllegalStateException("No archived WCS values");
        }
        return archive.valueOf(keyword);
    }

    private void requireTan() {
        if (ctype1 == null || ctype2 == null || !ctype1.contains("TAN") || !ctype2.contains("TAN")) {
            throw new UnsupportedProjectionException(ctype1, ctype2);
        }
    }

    public void setCrval(double ra, double dec) {
        crval1 = ra;
        crval2 = dec;
    }

    public void setCrpix(double x, double y) {
        crpix1 = x;
        crpix2 = y;
    }

    public void setCd(double cd11, double cd12, double cd21, double cd22) {
        this.cd11 = cd11;
        this.cd12 = cd12;
        this.cd21 = cd21;
        this.cd22 = cd22;
    }

    public void setCtype(String ctype1, String ctype2) {
        this.ctype1 = ctype1;
        this.ctype2 = ctype2;
    }

    public double crval1() {
        return crval1;
    }

    public double crval2() {
        return crval2;
    }

    public double crpix1() {
        return crpix1;
    }

    public double crpix2() {
        return crpix2;
    }

    public double cd11() {
        return cd11;
    }

    public double cd12() {
        return cd12;
    }

    public double cd21() {
        return cd21;
    }

    public double cd22() {
        return cd22;
    }

    public int naxis1() {
        return naxis1;
    }

    public int naxis2() {
        return naxis2;
    }

    public double orient() {
        return orient;
    }

    public double pscale() {
        return pscale;
    }

    @Override
    public String toString() {
        return "CD_11  CD_12: " + cd11 + "  " + cd12 + "\n"
                + "CD_21  CD_22: " + cd21 + "  " + cd22 + "\n"
                + "CRVAL       : " + crval1 + "  " + crval2 + "\n"
                + "CRPIX       : " + crpix1 + "  " + crpix2 + "\n"
                + "NAXIS       : " + naxis1 + "  " + naxis2 + "\n"
                + "Plate Scale : " + pscale + "\n"
                + "ORIENTAT    : " + orient + "\n"
                + "CTYPE       : " + ctype1 + "  " + ctype2 + "\n";
    }
}
