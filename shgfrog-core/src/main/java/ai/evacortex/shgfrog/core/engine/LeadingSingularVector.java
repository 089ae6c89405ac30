/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.engine;

import ai.evacortex.shgfrog.core.exceptions.EstimationFailedException;
import ai.evacortex.shgfrog.core.math.ComplexMatrix;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

/**
 * Leading left singular vector of a complex matrix {@code O = A + iB}.
 *
 * <p>Uses the real embedding {@code [[A, -B], [B, A]]}. Its singular values are
 * those of O, each twice; any unit vector {@code [x; y]} of the leading left
 * pair gives {@code u = x + iy} up to a global phase.</p>
 */
final class LeadingSingularVector {

    private LeadingSingularVector() {}

    static double[][] of(ComplexMatrix o) {
        int n = o.size();
        double[][] embedded = new double[2 * n][2 * n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                double a = o.re(i, j);
                double b = o.im(i, j);
                if (!Double.isFinite(a) || !Double.isFinite(b)) {
                    throw new EstimationFailedException("matrix holds a non-finite entry at (" + i + ", " + j + ")");
                }
                embedded[i][j] = a;
                embedded[i][j + n] = -b;
                embedded[i + n][j] = b;
                embedded[i + n][j + n] = a;
            }
        }

        SingularValueDecomposition svd;
        try {
            svd = new SingularValueDecomposition(new Array2DRowRealMatrix(embedded, false));
        } catch (MathIllegalStateException | MathArithmeticException e) {
            throw new EstimationFailedException("singular value decomposition did not converge", e);
        }

        double[] sigma = svd.getSingularValues();
        if (sigma.length == 0 || !Double.isFinite(sigma[0]) || !(sigma[0] > 0.0)) {
            throw new EstimationFailedException("leading singular value is "
                    + (sigma.length == 0 ? "missing" : String.valueOf(sigma[0])));
        }

        RealMatrix u = svd.getU();
        double[] re = new double[n];
        double[] im = new double[n];
        for (int i = 0; i < n; i++) {
            re[i] = u.getEntry(i, 0);
            im[i] = u.getEntry(i + n, 0);
            if (!Double.isFinite(re[i]) || !Double.isFinite(im[i])) {
                throw new EstimationFailedException("singular vector holds a non-finite entry at " + i);
            }
        }
        return new double[][]{re, im};
    }
}
