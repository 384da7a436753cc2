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

package io.nosqlbench.jointdiag.whitening;

import io.nosqlbench.jointdiag.covariance.CovarianceArray;
import io.nosqlbench.jointdiag.linalg.ComplexMatrices;
import io.nosqlbench.jointdiag.linalg.HermitianEigenDecomposition;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Builds per-group, possibly dimension-reducing, whitening transforms.
///
/// ## Algorithm
///
/// ```text
///   1. p ← explicit dimension, or searched on the accumulated spectrum of
///          mean_{κ,i} C(κ,i,i)
///   2. for each group i:
///        C̄_i = mean_κ C(κ,i,i)
///        C̄_i = U Λ U^H                 (descending)
///        F_i  = U[:, 0..p) · Λ_p^{-1/2}
///        iF_i = Λ_p^{1/2} · U[:, 0..p)^H
/// ```
///
/// The same p is used for every group so the whitened problem has a common
/// dimension. When the groups differ in dimension there is no grand mean;
/// each group's own selection is made and the smallest p is kept.
///
/// Hermitian symmetry of the input is the caller's contract and is not
/// re-validated.
public final class PreWhiteningBuilder {

    private static final Logger logger = LogManager.getLogger(PreWhiteningBuilder.class);

    private PreWhiteningBuilder() {
        // Utility class
    }

    /// Builds one whitening transform per group.
    ///
    /// @param array the covariance array
    /// @param explainedVariance requested subspace size
    /// @param search search strategy for fraction targets
    /// @return m transforms, sharing the same dimension p
    public static List<WhiteningTransform> build(CovarianceArray array,
                                                 ExplainedVariance explainedVariance,
                                                 ExplainedVarianceSearch search) {
        Objects.requireNonNull(array, "array");
        Objects.requireNonNull(explainedVariance, "explainedVariance");
        Objects.requireNonNull(search, "search");
        int m = array.groups();

        List<FieldMatrix<Complex>> groupMeans = new ArrayList<>(m);
        int minDimension = Integer.MAX_VALUE;
        for (int i = 0; i < m; i++) {
            groupMeans.add(array.trialMean(i, i));
            minDimension = Math.min(minDimension, array.groupDimension(i));
        }

        int p;
        if (explainedVariance.isDimension()) {
            p = Math.min(explainedVariance.dimension(), minDimension);
        } else if (array.hasCommonDimension()) {
            double[] spectrum = HermitianEigenDecomposition.of(array.grandWithinGroupMean()).eigenvalues();
            p = explainedVariance.resolve(ExplainedVarianceSearch.accumulate(spectrum), search);
        } else {
            p = minDimension;
            for (FieldMatrix<Complex> mean : groupMeans) {
                double[] spectrum = HermitianEigenDecomposition.of(mean).eigenvalues();
                p = Math.min(p, explainedVariance.resolve(ExplainedVarianceSearch.accumulate(spectrum), search));
            }
        }

        List<WhiteningTransform> transforms = new ArrayList<>(m);
        for (int i = 0; i < m; i++) {
            WhiteningTransform w = whitening(groupMeans.get(i), p);
            logger.debug("group {}: whitening {} -> {} dimensions, explained variance {}",
                i, array.groupDimension(i), p, w.explainedVariance());
            transforms.add(w);
        }
        return transforms;
    }

    /// Whitening of a single Hermitian positive-definite matrix onto its top
    /// `dimension` eigen-directions.
    ///
    /// @throws IllegalArgumentException if a retained eigenvalue is not positive
    public static WhiteningTransform whitening(FieldMatrix<Complex> covariance, int dimension) {
        HermitianEigenDecomposition eig = HermitianEigenDecomposition.of(covariance);
        double[] values = eig.eigenvalues();
        FieldMatrix<Complex> vectors = eig.eigenvectors();
        int n = values.length;
        int p = Math.max(1, Math.min(dimension, n));

        FieldMatrix<Complex> forward = ComplexMatrices.zeros(n, p);
        FieldMatrix<Complex> inverse = ComplexMatrices.zeros(p, n);
        for (int c = 0; c < p; c++) {
            if (!(values[c] > 0.0)) {
                throw new IllegalArgumentException("covariance is not positive definite on the retained "
                    + "subspace: eigenvalue " + c + " is " + values[c]);
            }
            double root = Math.sqrt(values[c]);
            for (int r = 0; r < n; r++) {
                Complex u = vectors.getEntry(r, c);
                forward.setEntry(r, c, u.divide(root));
                inverse.setEntry(c, r, u.conjugate().multiply(root));
            }
        }
        return new WhiteningTransform(forward, inverse, p, values, ExplainedVarianceSearch.accumulate(values));
    }

    /// Whitening with the subspace size chosen by `explainedVariance`.
    public static WhiteningTransform whitening(FieldMatrix<Complex> covariance,
                                               ExplainedVariance explainedVariance,
                                               ExplainedVarianceSearch search) {
        double[] spectrum = HermitianEigenDecomposition.of(covariance).eigenvalues();
        int p = explainedVariance.resolve(ExplainedVarianceSearch.accumulate(spectrum), search);
        return whitening(covariance, p);
    }

    /// Transforms the array into the whitened space, G(κ,i,j) = F_i^H · C(κ,i,j) · F_j.
    public static CovarianceArray whiten(CovarianceArray array, List<WhiteningTransform> transforms) {
        if (transforms.size() != array.groups()) {
            throw new IllegalArgumentException("expected " + array.groups() + " whitening transforms, got "
                + transforms.size());
        }
        return array.map((t, i, j, c) ->
            ComplexMatrices.congruence(transforms.get(i).forward(), c, transforms.get(j).forward()));
    }
}
