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
 * Builds the reference tangent plane from the telescope roll and places any
 * chip on it from the chips' V2/V3 apertures.
 *
 * <p>The reference plane has the orientation of the reference chip at its
 * aperture and the reference chip's plate scale; a target chip's CRVAL and CD
 * matrix are then read off that plane by projecting its aperture offset and
 * its linear distortion terms through it.</p>
 */
public final class ReferenceFrameComposer {
    private final Parity parity;

    public ReferenceFrameComposer(Parity parity) {
        this.parity = parity;
    }

    public Parity parity() {
        return parity;
    }

    /**
     * Orientation of the detector Y axis at an aperture, from the roll about
     * V1, the declination of the target and the aperture's V2/V3 position
     * (C. Cox, STScI Generic Conversion).
     *
     * <p>An aperture on the V1 axis leaves the spherical triangle undefined;
     * there the side angles are taken as zero and the result is
     * {@code 180 + paV3}.</p>
     *
     * @param paV3 roll angle of the V3 axis in degrees
     * @param dec declination of the target in degrees
     * @param v2 aperture V2 in arcsec
     * @param v3 aperture V3 in arcsec
     * @return position angle in degrees
     */
    public static double troll(double paV3, double dec, double v2, double v3) {
        double roll = Math.toRadians(paV3);
        double d = Math.toRadians(dec);
        double rv2 = Math.toRadians(v2 / 3600.0);
        double rv3 = Math.toRadians(v3 / 3600.0);

        double s2 = Math.sin(rv2) * Math.sin(rv2);
        double s3 = Math.sin(rv3) * Math.sin(rv3);
        double sinRho = Math.sqrt(s2 + s3 - s2 * s3);
        if (sinRho == 0.0) {
            return 180.0 + paV3;
        }
        double rho = Math.asin(sinRho);
        double beta = Math.asin(clamp(Math.sin(rv3) / sinRho));
        if (rv2 < 0) beta = Math.PI - beta;
        double gamma = Math.asin(clamp(Math.sin(rv2) / sinRho));
        if (rv3 < 0) gamma = Math.PI - gamma;

        double a = Math.PI / 2.0 + roll - beta;
        double b = Math.atan2(Math.sin(a) * Math.cos(d),
                Math.sin(d) * sinRho - Math.cos(d) * Math.cos(rho) * Math.cos(a));
        return Math.toDegrees(Math.PI - (gamma + b));
    }

    // rounding can push a sine ratio just past 1
    private static double clamp(double v) {
        return Math.max(-1.0, Math.min(1.0, v));
    }

    /**
     * CD matrix of the reference plane: the parity-signed rotation by
     * {@code orient} scaled to {@code pscale} arcsec/pixel.
     */
    public double[][] referenceCd(double orient, double pscale) {
        double pv = Math.toRadians(orient);
        double scale = pscale / 3600.0;
        return new double[][] {
            {parity.xx() * Math.cos(pv) * scale, parity.xx() * -Math.sin(pv) * scale},
            {parity.yy() * Math.sin(pv) * scale, parity.yy() * Math.cos(pv) * scale}
        };
    }

    /**
     * Turn the (archived) WCS of the reference chip into the reference
     * plane.
     *
     * @param reference reference chip WCS holding its original values; the
     *     returned frame is a modified copy
     * @param referencePixel pixel of the reference chip's aperture, whose sky
     *     position becomes the frame's CRVAL
     * @param frameCrpix reference pixel of the frame
     * @param orient orientation at the reference aperture including the
     *     chip rotation, in degrees
     * @param pscale reference chip plate scale in arcsec/pixel
     */
    public TangentPlaneWcs referenceFrame(
            TangentPlaneWcs reference,
            PixelPosition referencePixel,
            PixelPosition frameCrpix,
            double orient,
            double pscale) {
        SkyPosition crval = reference.xy2rd(referencePixel);
        TangentPlaneWcs frame = reference.copy();
        frame.setCrval(crval.ra(), crval.dec());
        frame.setCrpix(frameCrpix.x(), frameCrpix.y());
        double[][] cd = referenceCd(orient, pscale);
        frame.setCd(cd[0][0], cd[0][1], cd[1][0], cd[1][1]);
        frame.update();
        return frame;
    }

    /**
     * Pixel position on the reference plane of a chip's aperture.
     *
     * <p>The V2/V3 separation is converted to reference pixels; its bearing
     * carries the parity signs and the reference chip rotation.</p>
     *
     * @param v2 target aperture V2 (arcsec)
     * @param v3 target aperture V3 (arcsec)
     * @param v2ref reference aperture V2 (arcsec)
     * @param v3ref reference aperture V3 (arcsec)
     * @param referenceTheta reference chip rotation (degrees)
     * @param pscale reference plate scale (arcsec/pixel)
     * @param shift subarray offset added to the result
     */
    public PixelPosition apertureOffset(
            double v2,
            double v3,
            double v2ref,
            double v3ref,
            double referenceTheta,
            double pscale,
            PixelPosition shift) {
        double off = Math.sqrt((v2 - v2ref) * (v2 - v2ref) + (v3 - v3ref) * (v3 - v3ref)) / pscale;
        double bearing;
        if (v3 == v3ref) {
            bearing = 0.0;
        } else {
            bearing = Math.atan2(parity.xx() * (v2 - v2ref), parity.yy() * (v3 - v3ref));
        }
        bearing += Math.toRadians(referenceTheta);
        return new PixelPosition(off * Math.sin(bearing) + shift.x(), off * Math.cos(bearing) + shift.y());
    }

    /**
     * Give {@code target} the CRVAL, CRPIX and CD matrix it has on the
     * reference plane.
     *
     * @param frame the reference plane
     * @param target WCS to update in place
     * @param offset target aperture on the reference plane
     * @param crpix new reference pixel of the target
     * @param model target distortion model; its linear terms set the scale and skew
     * @param dtheta target chip rotation minus reference chip rotation (degrees)
     */
    public void placeChip(
            TangentPlaneWcs frame,
            TangentPlaneWcs target,
            PixelPosition offset,
            PixelPosition crpix,
            DistortionModel model,
            double dtheta) {
        SkyPosition crval = frame.xy2rd(offset);
        target.setCrval(crval.ra(), crval.dec());
        target.setCrpix(crpix.x(), crpix.y());

        // one-pixel steps along the target axes, in reference pixels
        double refScale = frame.pscale() / 3600.0;
        double delXX = model.fx(1, 1) / refScale / 3600.0;
        double delYX = model.fy(1, 1) / refScale / 3600.0;
        double delXY = model.fx(1, 0) / refScale / 3600.0;
        double delYY = model.fy(1, 0) / refScale / 3600.0;

        double rr = Math.toRadians(dtheta);
        double dXX = Math.cos(rr) * delXX - Math.sin(rr) * delYX;
        double dYX = Math.sin(rr) * delXX + Math.cos(rr) * delYX;
        double dXY = Math.cos(rr) * delXY - Math.sin(rr) * delYY;
        double dYY = Math.sin(rr) * delXY + Math.cos(rr) * delYY;

        SkyPosition ab = frame.xy2rd(offset.x() + dXX, offset.y() + dYX);
        SkyPosition cd = frame.xy2rd(offset.x() + dXY, offset.y() + dYY);

        double cosDec = Math.cos(Math.toRadians(crval.dec()));
        target.setCd(
                Angles.diffAngles(ab.ra(), crval.ra()) * cosDec,
                Angles.diffAngles(cd.ra(), crval.ra()) * cosDec,
                Angles.diffAngles(ab.dec(), crval.dec()),
                Angles.diffAngles(cd.dec(), crval.dec()));
        target.update();
    }

    /**
     * Apply velocity aberration: move the target CRVAL away from the frame
     * CRVAL by {@code factor} and scale the CD matrix by it. No-op for a
     * factor of 1.
     */
    public void applyVelocityAberration(TangentPlaneWcs frame, TangentPlaneWcs target, double factor) {
        if (factor == 1.0) return;
        target.setCrval(
                frame.crval1() + factor * Angles.diffAngles(target.crval1(), frame.crval1()),
                frame.crval2() + factor * Angles.diffAngles(target.crval2(), frame.crval2()));
        target.setCd(target.cd11() * factor, target.cd12() * factor,
                target.cd21() * factor, target.cd22() * factor);
        target.update();
    }
}
