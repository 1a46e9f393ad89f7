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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Expresses the higher-order terms of a distortion model as SIP
 * polynomial keywords relative to the model's own linear terms.
 */
public final class SipConverter {
    public static final String SIP_CTYPE1 = "RA---TAN-SIP";
    public static final String SIP_CTYPE2 = "DEC--TAN-SIP";

    private SipConverter() {}

    /**
     * SIP keywords in header order: {@code A_p_q}/{@code B_p_q} for every
     * term of degree 2 or more, the SIP projection types, the polynomial
     * orders and the bookkeeping keywords used to re-derive the linear
     * terms later.
     *
     * @param model distortion model of the chip
     * @param tdd time-dependent correction used for this chip; its terms are
     *     recorded only when it was applied
     * @throws SingularMatrixException when the linear terms have no inverse
     */
    public static Map<String, Object> convert(DistortionModel model, TimeDependentCorrection tdd) {
        RefPix refPix = model.refPix();
        double f = refPix.pscale() / 3600.0;
        double a = model.fx(1, 1) / 3600.0;
        double b = model.fx(1, 0) / 3600.0;
        double c = model.fy(1, 1) / 3600.0;
        double d = model.fy(1, 0) / 3600.0;
        double det = (a * d - b * c) * refPix.pscale();
        if (det == 0.0) {
            throw new SingularMatrixException();
        }

        int order = model.order();
        Map<String, Object> keywords = new LinkedHashMap<>();
        for (int n = 2; n <= order; n++) {
            for (int m = 0; m <= n; m++) {
                double fx = model.fx(n, m);
                double fy = model.fy(n, m);
                keywords.put(String.format("A_%d_%d", m, n - m), f * (d * fx - b * fy) / det);
                keywords.put(String.format("B_%d_%d", m, n - m), f * (a * fy - c * fx) / det);
            }
        }

        keywords.put("CTYPE1", SIP_CTYPE1);
        keywords.put("CTYPE2", SIP_CTYPE2);
        keywords.put("A_ORDER", order);
        keywords.put("B_ORDER", order);

        keywords.put("IDCSCALE", refPix.pscale());
        keywords.put("IDCV2REF", refPix.v2ref());
        keywords.put("IDCV3REF", refPix.v3ref());
        keywords.put("IDCTHETA", refPix.theta());
        keywords.put("OCX10", model.fx(1, 0));
        keywords.put("OCX11", model.fx(1, 1));
        keywords.put("OCY10", model.fy(1, 0));
        keywords.put("OCY11", model.fy(1, 1));

        if (tdd.isApplied()) {
            keywords.put("TDDALPHA", tdd.alpha());
            keywords.put("TDDBETA", tdd.beta());
        }
        return keywords;
    }

    /** Convert and write the keywords into {@code header}. */
    public static void write(Header header, DistortionModel model, TimeDependentCorrection tdd) {
        convert(model, tdd).forEach(header::put);
    }
}
