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

package io.nosqlbench.jointdiag.covariance;

import io.nosqlbench.jointdiag.linalg.ComplexMatrices;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;

import java.util.List;
import java.util.Objects;

/// Sample (cross-)covariance estimator, C(κ,i,j) = X̃_κi · X̃_κj^H / t.
///
/// X̃ is the data matrix oriented variables × samples after the
/// [Centering] policy has been applied, and t is the number of samples.
///
/// ## Orientation of complex data
///
/// With [SampleDimension#ROWS] a samples × variables matrix Y is read as the
/// plain transpose of the variables × samples layout, X̃ = Y^T, so the estimate
/// is Y^T · conj(Y) / t. The same observations therefore give the same
/// covariance in either layout. This is the complex conjugate of the adjoint
/// convention Y^H · Y / t; callers holding data in that convention pass
/// conj(Y), or equivalently Y^H with [SampleDimension#COLUMNS].
///
/// ## Usage
///
/// ```java
/// CrossCovarianceEstimator scm = SampleCrossCovarianceEstimator.builder()
///     .sampleDimension(SampleDimension.ROWS)
///     .centering(Centering.sampleMean())
///     .build();
/// CovarianceArray c = scm.estimate(data, m, k);
/// ```
public final class SampleCrossCovarianceEstimator implements CrossCovarianceEstimator {

    private final SampleDimension sampleDimension;
    private final Centering centering;

    private SampleCrossCovarianceEstimator(Builder builder) {
        this.sampleDimension = builder.sampleDimension;
        this.centering = builder.centering;
    }

    /// Estimator with samples as columns and no centering.
    public static SampleCrossCovarianceEstimator defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public CovarianceArray estimate(List<List<FieldMatrix<Complex>>> data, int groups, int trials) {
        Objects.requireNonNull(data, "data");
        if (data.size() != trials) {
            throw new IllegalArgumentException("expected " + trials + " trials of data, got " + data.size());
        }
        CovarianceArray.Builder builder = CovarianceArray.builder(trials, groups);
        for (int t = 0; t < trials; t++) {
            List<FieldMatrix<Complex>> trial = data.get(t);
            if (trial.size() != groups) {
                throw new IllegalArgumentException("trial " + t + " has " + trial.size()
                    + " data matrices, expected " + groups);
            }
            Complex[][][] centered = new Complex[groups][][];
            for (int i = 0; i < groups; i++) {
                centered[i] = center(i, orient(trial.get(i)));
            }
            int samples = centered[0].length == 0 ? 0 : centered[0][0].length;
            for (int i = 1; i < groups; i++) {
                int other = centered[i].length == 0 ? 0 : centered[i][0].length;
                if (other != samples) {
                    throw new IllegalArgumentException("trial " + t + ": group " + i + " has " + other
                        + " samples, group 0 has " + samples);
                }
            }
            if (samples == 0) {
                throw new IllegalArgumentException("trial " + t + " has no samples");
            }
            for (int i = 0; i < groups; i++) {
                for (int j = i; j < groups; j++) {
                    builder.set(t, i, j, crossProduct(centered[i], centered[j], samples));
                }
            }
        }
        return builder.build();
    }

    /// Returns the data as variables × samples; ROWS input is transposed without conjugation.
    private Complex[][] orient(FieldMatrix<Complex> x) {
        return sampleDimension == SampleDimension.COLUMNS
            ? x.getData()
            : x.transpose().getData();
    }

    private Complex[][] center(int group, Complex[][] variables) {
        Complex[] mean = centering.mean(group, variables);
        if (mean == null) {
            return variables;
        }
        Complex[][] out = new Complex[variables.length][];
        for (int v = 0; v < variables.length; v++) {
            out[v] = new Complex[variables[v].length];
            for (int s = 0; s < variables[v].length; s++) {
                out[v][s] = variables[v][s].subtract(mean[v]);
            }
        }
        return out;
    }

    private static FieldMatrix<Complex> crossProduct(Complex[][] xi, Complex[][] xj, int samples) {
        double[][] re = new double[xi.length][xj.length];
        double[][] im = new double[xi.length][xj.length];
        for (int r = 0; r < xi.length; r++) {
            for (int c = 0; c < xj.length; c++) {
                double sumRe = 0.0;
                double sumIm = 0.0;
                for (int s = 0; s < samples; s++) {
                    Complex a = xi[r][s];
                    Complex b = xj[c][s];
                    // a * conj(b)
                    sumRe += a.getReal() * b.getReal() + a.getImaginary() * b.getImaginary();
                    sumIm += a.getImaginary() * b.getReal() - a.getReal() * b.getImaginary();
                }
                re[r][c] = sumRe / samples;
                im[r][c] = sumIm / samples;
            }
        }
        return ComplexMatrices.fromParts(re, im);
    }

    /// Builder for [SampleCrossCovarianceEstimator].
    public static final class Builder {
        private SampleDimension sampleDimension = SampleDimension.COLUMNS;
        private Centering centering = Centering.none();

        /// Sets which axis of a data matrix indexes samples.
        public Builder sampleDimension(SampleDimension dimension) {
            this.sampleDimension = Objects.requireNonNull(dimension, "dimension");
            return this;
        }

        /// Sets the mean-removal policy.
        public Builder centering(Centering centering) {
            this.centering = Objects.requireNonNull(centering, "centering");
            return this;
        }

        public SampleCrossCovarianceEstimator build() {
            return new SampleCrossCovarianceEstimator(this);
        }
    }
}
