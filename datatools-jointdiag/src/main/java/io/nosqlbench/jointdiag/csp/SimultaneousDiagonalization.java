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

package io.nosqlbench.jointdiag.csp;

import io.nosqlbench.jointdiag.linalg.ComplexMatrices;
import io.nosqlbench.jointdiag.linalg.HermitianEigenDecomposition;
import io.nosqlbench.jointdiag.whitening.ExplainedVariance;
import io.nosqlbench.jointdiag.whitening.ExplainedVarianceSearch;
import io.nosqlbench.jointdiag.whitening.PreWhiteningBuilder;
import io.nosqlbench.jointdiag.whitening.WhiteningTransform;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Objects;

/// Closed-form simultaneous diagonalization of two covariance matrices
/// (common spatial pattern).
///
/// ## Algorithm
///
/// ```text
///   W  = whitening(C1 + C2)             n × p,  W^H (C1 + C2) W = I
///   W^H C1 W = U Λ U^H                  Λ descending
///   F  = W · U                          n × p
///   iF = U^H · iW                       p × n
/// ```
///
/// F^H·C1·F = Λ and F^H·C2·F = I − Λ are both diagonal, so each filter
/// splits the pooled variance between the two classes in proportion λ : 1−λ.
///
/// @param forward F, the filters (columns)
/// @param inverse iF, the patterns (rows), left-inverse of F
/// @param eigenvalues diagonal of F^H·C1·F, descending in [0, 1] for PSD input
/// @param whitening the whitening of C1 + C2
public record SimultaneousDiagonalization(
    FieldMatrix<Complex> forward,
    FieldMatrix<Complex> inverse,
    double[] eigenvalues,
    WhiteningTransform whitening
) {

    private static final Logger logger = LogManager.getLogger(SimultaneousDiagonalization.class);

    public SimultaneousDiagonalization {
        eigenvalues = eigenvalues.clone();
    }

    @Override
    public double[] eigenvalues() {
        return eigenvalues.clone();
    }

    /// Full-rank decomposition.
    public static SimultaneousDiagonalization of(FieldMatrix<Complex> c1, FieldMatrix<Complex> c2) {
        return of(c1, c2, ExplainedVariance.dimension(c1.getRowDimension()));
    }

    /// Decomposition restricted to the subspace of C1 + C2 chosen by `explainedVariance`.
    public static SimultaneousDiagonalization of(FieldMatrix<Complex> c1, FieldMatrix<Complex> c2,
                                                 ExplainedVariance explainedVariance) {
        Objects.requireNonNull(c1, "c1");
        Objects.requireNonNull(c2, "c2");
        Objects.requireNonNull(explainedVariance, "explainedVariance");
        if (c1.getRowDimension() != c2.getRowDimension() || c1.getColumnDimension() != c2.getColumnDimension()) {
            throw new IllegalArgumentException("C1 is " + c1.getRowDimension() + "x" + c1.getColumnDimension()
                + " but C2 is " + c2.getRowDimension() + "x" + c2.getColumnDimension());
        }
        WhiteningTransform w = PreWhiteningBuilder.whitening(c1.add(c2), explainedVariance,
            ExplainedVarianceSearch.FIRST_AT_OR_ABOVE);
        HermitianEigenDecomposition eig = HermitianEigenDecomposition.of(
            ComplexMatrices.congruence(w.forward(), c1, w.forward()));
        FieldMatrix<Complex> u = eig.eigenvectors();
        FieldMatrix<Complex> forward = w.forward().multiply(u);
        FieldMatrix<Complex> inverse = ComplexMatrices.conjugateTranspose(u).multiply(w.inverse());
        logger.debug("simultaneous diagonalization: {} -> {} dimensions", c1.getRowDimension(), w.dimension());
        return new SimultaneousDiagonalization(forward, inverse, eig.eigenvalues(), w);
    }

    /// Diagonal of F^H·C2·F, that is 1 − λ.
    public double[] complementEigenvalues() {
        double[] out = new double[eigenvalues.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = 1.0 - eigenvalues[i];
        }
        return out;
    }

    /// Retained subspace size p.
    public int dimension() {
        return eigenvalues.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SimultaneousDiagonalization other)) {
            return false;
        }
        return forward.equals(other.forward)
            && inverse.equals(other.inverse)
            && Arrays.equals(eigenvalues, other.eigenvalues)
            && whitening.equals(other.whitening);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(forward, inverse, whitening) + Arrays.hashCode(eigenvalues);
    }

    @Override
    public String toString() {
        return "SimultaneousDiagonalization[dimension=" + eigenvalues.length
            + ", eigenvalues=" + Arrays.toString(eigenvalues) + "]";
    }
}
