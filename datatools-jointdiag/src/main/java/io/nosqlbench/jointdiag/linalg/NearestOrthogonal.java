/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.jointdiag.linalg;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

import java.util.ArrayList;
import java.util.List;

/**
 * Nearest orthogonal (unitary) matrix by polar factorization.
 *
 * <p>Given A = W&Sigma;V<sup>H</sup>, the closest matrix to A in Frobenius norm
 * with orthonormal columns is W&middot;V<sup>H</sup>: the singular values are
 * discarded. Rectangular input uses the thin decomposition.
 *
 * <p>Complex input goes through the real embedding; the polar factor of
 * &phi;(A) is &phi;(polar(A)) whenever A has full rank. For rank-deficient
 * input the embedded factor is not unique and may lose the complex structure,
 * so when the folded result is not unitary the factor is rebuilt from the
 * eigendecomposition of A<sup>H</sup>A: W = A&middot;V&middot;&Sigma;<sup>-1</sup>
 * on the nonzero singular values, with the null directions completed by
 * complex Gram-Schmidt.
 */
public final class NearestOrthogonal {

    /// Largest entry of |P^H P - I| accepted from the SVD path.
    private static final double UNITARY_TOLERANCE = 1e-9;

    /// Singular values below this fraction of the largest count as zero.
    private static final double RANK_TOLERANCE = 1e-8;

    private NearestOrthogonal() {
        // Utility class
    }

    /**
     * Projects {@code a} onto the nearest matrix with orthonormal columns.
     *
     * @param a any matrix with at least as many rows as columns
     * @return W&middot;V<sup>H</sup> from the SVD of {@code a}
     */
    public static FieldMatrix<Complex> project(FieldMatrix<Complex> a) {
        if (a.getRowDimension() < a.getColumnDimension()) {
            throw new IllegalArgumentException("polar factor needs rows >= columns, got "
                + a.getRowDimension() + "x" + a.getColumnDimension());
        }
        FieldMatrix<Complex> p = ComplexMatrices.isReal(a)
            ? ComplexMatrices.fromReal(polar(ComplexMatrices.realPart(a)))
            : ComplexMatrices.unembed(polar(ComplexMatrices.embed(a)));
        if (unitaryDeviation(p) <= UNITARY_TOLERANCE) {
            return p;
        }
        return polarFromGram(a);
    }

    /// Largest entry of |P^H P - I|.
    static double unitaryDeviation(FieldMatrix<Complex> p) {
        FieldMatrix<Complex> gram = ComplexMatrices.adjointMultiply(p, p);
        double worst = 0.0;
        for (int r = 0; r < gram.getRowDimension(); r++) {
            for (int c = 0; c < gram.getColumnDimension(); c++) {
                Complex entry = r == c ? gram.getEntry(r, c).subtract(Complex.ONE) : gram.getEntry(r, c);
                worst = Math.max(worst, entry.abs());
            }
        }
        return worst;
    }

    private static RealMatrix polar(RealMatrix a) {
        SingularValueDecomposition svd = new SingularValueDecomposition(a);
        return svd.getU().multiply(svd.getVT());
    }

    private static FieldMatrix<Complex> polarFromGram(FieldMatrix<Complex> a) {
        int rows = a.getRowDimension();
        int cols = a.getColumnDimension();
        HermitianEigenDecomposition eig = HermitianEigenDecomposition.of(ComplexMatrices.adjointMultiply(a, a));
        double[] lambda = eig.eigenvalues();
        FieldMatrix<Complex> v = eig.eigenvectors();
        double cutoff = RANK_TOLERANCE * Math.sqrt(Math.max(lambda[0], 0.0));

        List<Complex[]> basis = new ArrayList<>(cols);
        Complex[][] w = new Complex[cols][];
        for (int c = 0; c < cols; c++) {
            double sigma = Math.sqrt(Math.max(lambda[c], 0.0));
            if (sigma <= cutoff) {
                continue;
            }
            Complex[] image = orthogonalize(a.operate(v.getColumn(c)), basis);
            double norm = HermitianEigenDecomposition.squaredNorm(image);
            if (norm > 0.25 * sigma * sigma) {
                w[c] = HermitianEigenDecomposition.normalize(image);
                basis.add(w[c]);
            }
        }
        for (int c = 0; c < cols; c++) {
            if (w[c] == null) {
                w[c] = completion(rows, basis);
                basis.add(w[c]);
            }
        }

        FieldMatrix<Complex> wm = ComplexMatrices.zeros(rows, cols);
        for (int c = 0; c < cols; c++) {
            for (int r = 0; r < rows; r++) {
                wm.setEntry(r, c, w[c][r]);
            }
        }
        return wm.multiply(ComplexMatrices.conjugateTranspose(v));
    }

    /// Unit vector orthogonal to `basis`, taken from the standard basis vector with the largest residual.
    private static Complex[] completion(int rows, List<Complex[]> basis) {
        Complex[] best = null;
        double bestNorm = -1.0;
        for (int r = 0; r < rows; r++) {
            Complex[] e = new Complex[rows];
            for (int i = 0; i < rows; i++) {
                e[i] = i == r ? Complex.ONE : Complex.ZERO;
            }
            Complex[] residual = orthogonalize(e, basis);
            double norm = HermitianEigenDecomposition.squaredNorm(residual);
            if (norm > bestNorm) {
                best = residual;
                bestNorm = norm;
            }
        }
        return HermitianEigenDecomposition.normalize(best);
    }

    // two passes of Gram-Schmidt
    private static Complex[] orthogonalize(Complex[] x, List<Complex[]> basis) {
        return HermitianEigenDecomposition.residual(HermitianEigenDecomposition.residual(x, basis), basis);
    }
}
