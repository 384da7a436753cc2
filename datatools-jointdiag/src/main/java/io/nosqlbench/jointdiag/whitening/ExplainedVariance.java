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

/// Requested size of the whitened subspace.
///
/// Either an explicit dimension p, or a target fraction of the total
/// spectral energy to retain, from which p is searched on the accumulated
/// normalized eigenvalues.
public final class ExplainedVariance {

    /// Default explained-variance target.
    public static final double DEFAULT_FRACTION = 0.999;

    private final double fraction;
    private final int dimension;

    private ExplainedVariance(double fraction, int dimension) {
        this.fraction = fraction;
        this.dimension = dimension;
    }

    /// The default target, 0.999 of the total variance.
    public static ExplainedVariance defaults() {
        return fraction(DEFAULT_FRACTION);
    }

    /// Retain at least `fraction` of the total variance.
    ///
    /// @param fraction in (0, 1]
    public static ExplainedVariance fraction(double fraction) {
        if (!(fraction > 0.0 && fraction <= 1.0)) {
            throw new IllegalArgumentException("explained variance must be in (0, 1], got " + fraction);
        }
        return new ExplainedVariance(fraction, 0);
    }

    /// Retain exactly `dimension` directions (clamped to the matrix size).
    public static ExplainedVariance dimension(int dimension) {
        if (dimension < 1) {
            throw new IllegalArgumentException("subspace dimension must be at least 1, got " + dimension);
        }
        return new ExplainedVariance(Double.NaN, dimension);
    }

    /// True when an explicit dimension was requested.
    public boolean isDimension() {
        return dimension > 0;
    }

    /// The requested fraction; NaN for an explicit dimension.
    public double fraction() {
        return fraction;
    }

    /// The requested dimension; 0 for a fraction target.
    public int dimension() {
        return dimension;
    }

    /// Resolves the subspace size for a spectrum.
    ///
    /// @param accumulated accumulated normalized eigenvalues, descending spectrum
    /// @param search the search strategy for fraction targets
    /// @return p in [1, accumulated.length]
    public int resolve(double[] accumulated, ExplainedVarianceSearch search) {
        int n = accumulated.length;
        if (isDimension()) {
            return Math.min(dimension, n);
        }
        return search.search(accumulated, fraction);
    }

    @Override
    public String toString() {
        return isDimension() ? "dimension(" + dimension + ")" : "fraction(" + fraction + ")";
    }
}
