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

package io.nosqlbench.jointdiag.solver;

import io.nosqlbench.jointdiag.covariance.CrossCovarianceEstimator;
import io.nosqlbench.jointdiag.covariance.SampleCrossCovarianceEstimator;
import io.nosqlbench.jointdiag.covariance.TrialWeighting;
import io.nosqlbench.jointdiag.trace.IterationObserver;
import io.nosqlbench.jointdiag.whitening.ExplainedVariance;
import io.nosqlbench.jointdiag.whitening.ExplainedVarianceSearch;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Immutable configuration of an OJoB solve.
///
/// ## Options
///
/// | Option | Default | Meaning |
/// |--------|---------|---------|
/// | `fullModel` | false | also diagonalize within-group terms (j = i) |
/// | `preWhite` | false | whiten (and reduce) first; invertibility + scaling constraint instead of orthogonality |
/// | `sort` | true | resolve sign and order of the solution |
/// | `init` | none | caller-seeded starting transforms, one per group |
/// | `tolerance` | 0 → √ε | relative-change threshold |
/// | `maxIterations` | 1000 | iteration cap |
/// | `verbose` | false | log progress at INFO |
/// | `explainedVariance` | 0.999 | whitened subspace size (fraction or dimension) |
/// | `varianceSearch` | FIRST_AT_OR_ABOVE | search over accumulated eigenvalues |
/// | `trace1` | false | normalize within-group covariances to unit trace |
/// | `weighting` | NONE | per-trial, per-group weights |
/// | `estimator` | sample cross-covariance | used for raw data input |
/// | `observer` | NOOP | iteration callbacks |
///
/// ## Usage
///
/// ```java
/// OJoBOptions options = OJoBOptions.builder()
///     .preWhite(true)
///     .explainedVariance(ExplainedVariance.fraction(0.99))
///     .maxIterations(500)
///     .build();
/// ```
public final class OJoBOptions {

    /// Default iteration cap.
    public static final int DEFAULT_MAX_ITERATIONS = 1000;

    /// √ε for double precision, the default tolerance.
    public static final double DEFAULT_TOLERANCE = Math.sqrt(Math.ulp(1.0));

    private final boolean fullModel;
    private final boolean preWhite;
    private final boolean sort;
    private final List<FieldMatrix<Complex>> init;
    private final double tolerance;
    private final int maxIterations;
    private final boolean verbose;
    private final ExplainedVariance explainedVariance;
    private final ExplainedVarianceSearch varianceSearch;
    private final boolean trace1;
    private final TrialWeighting weighting;
    private final CrossCovarianceEstimator estimator;
    private final IterationObserver observer;

    private OJoBOptions(Builder builder) {
        this.fullModel = builder.fullModel;
        this.preWhite = builder.preWhite;
        this.sort = builder.sort;
        this.init = builder.init;
        this.tolerance = builder.tolerance;
        this.maxIterations = builder.maxIterations;
        this.verbose = builder.verbose;
        this.explainedVariance = builder.explainedVariance;
        this.varianceSearch = builder.varianceSearch;
        this.trace1 = builder.trace1;
        this.weighting = builder.weighting;
        this.estimator = builder.estimator;
        this.observer = builder.observer;
    }

    /// Options with every default.
    public static OJoBOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean fullModel() {
        return fullModel;
    }

    public boolean preWhite() {
        return preWhite;
    }

    public boolean sort() {
        return sort;
    }

    /// Seeds, or `null` for the eigenvector initialization.
    public List<FieldMatrix<Complex>> init() {
        return init;
    }

    /// The tolerance as configured; 0 means "use the default".
    public double tolerance() {
        return tolerance;
    }

    /// The tolerance the solver uses.
    public double effectiveTolerance() {
        return tolerance == 0.0 ? DEFAULT_TOLERANCE : tolerance;
    }

    public int maxIterations() {
        return maxIterations;
    }

    public boolean verbose() {
        return verbose;
    }

    public ExplainedVariance explainedVariance() {
        return explainedVariance;
    }

    public ExplainedVarianceSearch varianceSearch() {
        return varianceSearch;
    }

    public boolean trace1() {
        return trace1;
    }

    public TrialWeighting weighting() {
        return weighting;
    }

    public CrossCovarianceEstimator estimator() {
        return estimator;
    }

    public IterationObserver observer() {
        return observer;
    }

    @Override
    public String toString() {
        return "OJoBOptions{fullModel=" + fullModel + ", preWhite=" + preWhite + ", sort=" + sort
            + ", init=" + (init == null ? "none" : init.size() + " seeds")
            + ", tolerance=" + effectiveTolerance() + ", maxIterations=" + maxIterations
            + ", explainedVariance=" + explainedVariance + ", varianceSearch=" + varianceSearch
            + ", trace1=" + trace1 + "}";
    }

    /// Builder for [OJoBOptions].
    public static final class Builder {
        private boolean fullModel = false;
        private boolean preWhite = false;
        private boolean sort = true;
        private List<FieldMatrix<Complex>> init = null;
        private double tolerance = 0.0;
        private int maxIterations = DEFAULT_MAX_ITERATIONS;
        private boolean verbose = false;
        private ExplainedVariance explainedVariance = ExplainedVariance.defaults();
        private ExplainedVarianceSearch varianceSearch = ExplainedVarianceSearch.FIRST_AT_OR_ABOVE;
        private boolean trace1 = false;
        private TrialWeighting weighting = TrialWeighting.NONE;
        private CrossCovarianceEstimator estimator = SampleCrossCovarianceEstimator.defaults();
        private IterationObserver observer = IterationObserver.NOOP;

        /// Includes within-group terms (j = i) in the objective and updates.
        public Builder fullModel(boolean fullModel) {
            this.fullModel = fullModel;
            return this;
        }

        /// Enables dimensionality-reducing pre-whitening.
        public Builder preWhite(boolean preWhite) {
            this.preWhite = preWhite;
            return this;
        }

        /// Enables or disables the ambiguity resolution pass.
        public Builder sort(boolean sort) {
            this.sort = sort;
            return this;
        }

        /// Seeds the starting transforms, one per group. The matrices are copied.
        public Builder init(List<FieldMatrix<Complex>> seeds) {
            if (seeds == null) {
                this.init = null;
                return this;
            }
            List<FieldMatrix<Complex>> copies = new ArrayList<>(seeds.size());
            for (FieldMatrix<Complex> seed : seeds) {
                copies.add(Objects.requireNonNull(seed, "seed").copy());
            }
            this.init = List.copyOf(copies);
            return this;
        }

        /// Sets the relative-change tolerance; 0 selects √ε.
        public Builder tolerance(double tolerance) {
            if (!(tolerance >= 0.0)) {
                throw new IllegalArgumentException("tolerance must be non-negative, got " + tolerance);
            }
            this.tolerance = tolerance;
            return this;
        }

        /// Sets the iteration cap.
        public Builder maxIterations(int maxIterations) {
            if (maxIterations < 1) {
                throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
            }
            this.maxIterations = maxIterations;
            return this;
        }

        /// Logs every sweep at INFO.
        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder explainedVariance(ExplainedVariance explainedVariance) {
            this.explainedVariance = Objects.requireNonNull(explainedVariance, "explainedVariance");
            return this;
        }

        public Builder varianceSearch(ExplainedVarianceSearch varianceSearch) {
            this.varianceSearch = Objects.requireNonNull(varianceSearch, "varianceSearch");
            return this;
        }

        /// Normalizes within-group covariances to unit trace before solving.
        public Builder trace1(boolean trace1) {
            this.trace1 = trace1;
            return this;
        }

        public Builder weighting(TrialWeighting weighting) {
            this.weighting = Objects.requireNonNull(weighting, "weighting");
            return this;
        }

        /// Estimator used when the input is raw data.
        public Builder estimator(CrossCovarianceEstimator estimator) {
            this.estimator = Objects.requireNonNull(estimator, "estimator");
            return this;
        }

        public Builder observer(IterationObserver observer) {
            this.observer = Objects.requireNonNull(observer, "observer");
            return this;
        }

        public OJoBOptions build() {
            return new OJoBOptions(this);
        }
    }
}
