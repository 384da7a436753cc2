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

import io.nosqlbench.jointdiag.covariance.CovarianceArray;
import io.nosqlbench.jointdiag.covariance.CovarianceNormalizer;
import io.nosqlbench.jointdiag.linalg.ComplexMatrices;
import io.nosqlbench.jointdiag.linalg.HermitianEigenDecomposition;
import io.nosqlbench.jointdiag.linalg.NearestOrthogonal;
import io.nosqlbench.jointdiag.trace.IterationObserver;
import io.nosqlbench.jointdiag.trace.LoggingIterationObserver;
import io.nosqlbench.jointdiag.whitening.PreWhiteningBuilder;
import io.nosqlbench.jointdiag.whitening.WhiteningTransform;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Orthogonal Joint Blind Source Separation (OJoB) iterative solver.
///
/// ## Purpose
///
/// Finds m transforms U_1..U_m maximizing the sum of squared diagonal
/// entries of U_i^H · C(κ,i,j) · U_j over all trials κ and group pairs
/// i ≠ j (and i = j with `fullModel`), subject to U_i being orthogonal
/// (unitary), or, with pre-whitening, to mean_κ U_i^H C(κ,i,i) U_i = I.
///
/// One routine covers every call pattern:
///
/// | m | k | problem |
/// |---|---|---------|
/// | 1 | ≥ 3 | approximate joint diagonalization |
/// | > 1 | 1 | generalized MCA / CCA of m datasets |
/// | > 1 | > 1 | joint blind source separation over k trials |
///
/// ## Algorithm
///
/// ```text
///   INITIALIZING   U_i ← seeds, or eigvecs( Σ_{κ, j≠i} G(κ,i,j) G(κ,i,j)^H )
///        │
///        ▼
///   ITERATING      for i = 1..m                       (Gauss-Seidel: later groups
///                    for η = 1..n                      see the updated earlier ones)
///                      R  = Σ_{κ, j≠i} Ω Ω^H,   Ω[:,κ] = G(κ,i,j) · U_j[:,η]
///                      U_i[:,η] ← R · U_i[:,η]         (power iteration)
///                    acc += ss(U_i) / n
///                    U_i ← W·V^H,  U_i = WΣV^H         (nearest orthogonal)
///                  metric = √(acc / m)
///        │
///        ▼
///   CONVERGED | DIVERGED | MAX_ITER_REACHED
/// ```
///
/// ## Usage
///
/// ```java
/// OJoBSolver solver = new OJoBSolver(OJoBOptions.builder().fullModel(true).build());
/// DiagonalizationResult result = solver.solve(covariances);
/// ```
///
/// ## Thread Safety
///
/// A solver holds only its immutable options; every call to
/// [#solve(CovarianceArray)] sizes a fresh [SolverWorkspace], so one
/// instance may serve concurrent solves on independent inputs.
///
/// @see AmbiguityResolver
/// @see PreWhiteningBuilder
public final class OJoBSolver {

    private static final Logger logger = LogManager.getLogger(OJoBSolver.class);

    private final OJoBOptions options;

    public OJoBSolver(OJoBOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /// Rejects underdetermined problems: fewer than 3 trials with a single group.
    ///
    /// @throws InvalidConfigurationException when k < 3 and m < 2, or either is below 1
    public static void validate(int groups, int trials) {
        if (groups < 1 || trials < 1) {
            throw new InvalidConfigurationException("m and k must be at least 1, got m=" + groups
                + ", k=" + trials);
        }
        if (trials < 3 && groups < 2) {
            throw new InvalidConfigurationException("Either k must be at least 3 or m must be at least 2, got m="
                + groups + ", k=" + trials);
        }
    }

    /// Solves from a caller-supplied covariance array.
    public DiagonalizationResult solve(CovarianceArray covariances) {
        return solve(covariances, InputForm.COVARIANCE);
    }

    /// Solves, recording which input form the array came from.
    public DiagonalizationResult solve(CovarianceArray covariances, InputForm inputForm) {
        Objects.requireNonNull(covariances, "covariances");
        int m = covariances.groups();
        int k = covariances.trials();
        validate(m, k);
        logger.debug("OJoB solve: m={}, k={}, options={}", m, k, options);

        CovarianceArray c = CovarianceNormalizer.normalize(covariances, options.trace1(), options.weighting());

        List<WhiteningTransform> whitening = List.of();
        CovarianceArray g = c;
        if (options.preWhite()) {
            whitening = PreWhiteningBuilder.build(c, options.explainedVariance(), options.varianceSearch());
            g = PreWhiteningBuilder.whiten(c, whitening);
        }
        if (!g.hasCommonDimension()) {
            throw new InvalidConfigurationException("all groups must share one dimension; enable preWhite "
                + "to reduce groups of different dimension to a common subspace");
        }
        int n = g.groupDimension(0);

        List<FieldMatrix<Complex>> us = initialize(g, n);
        SolverWorkspace workspace = new SolverWorkspace(n, k);
        ConvergenceState state = new ConvergenceState(options.effectiveTolerance(), options.maxIterations());
        IterationObserver observer = options.verbose()
            ? IterationObserver.compose(new LoggingIterationObserver(), options.observer())
            : options.observer();

        observer.onStart(m, k, n);
        boolean done = false;
        while (!done) {
            double metric = sweep(g, us, workspace);
            done = state.record(metric);
            observer.onIteration(state.iteration(), state.metric(), state.convergence());
        }
        observer.onComplete(state.outcome(), state.iteration(), state.convergence());
        reportOutcome(state);

        Complex[] lambda;
        if (options.sort()) {
            lambda = m == 1
                ? AmbiguityResolver.resolveSingleGroup(us.get(0), g)
                : AmbiguityResolver.resolveMultiGroup(us, g);
        } else {
            lambda = AmbiguityResolver.unsortedAverages(us, g);
        }
        return OutputAssembler.assemble(us, whitening, lambda, state, inputForm);
    }

    /// One Gauss-Seidel sweep over all groups; returns the sweep metric.
    private double sweep(CovarianceArray g, List<FieldMatrix<Complex>> us, SolverWorkspace workspace) {
        int m = us.size();
        int n = workspace.dimension();
        double accumulated = 0.0;
        for (int i = 0; i < m; i++) {
            FieldMatrix<Complex> u = us.get(i);
            for (int eta = 0; eta < n; eta++) {
                workspace.clearAccumulator();
                if (m == 1) {
                    workspace.accumulate(g, 0, 0, u, eta);
                } else {
                    for (int j = 0; j < m; j++) {
                        if (j != i || options.fullModel()) {
                            workspace.accumulate(g, i, j, us.get(j), eta);
                        }
                    }
                }
                u.setColumn(eta, workspace.applyAccumulator(u, eta));
            }
            accumulated += ComplexMatrices.sumOfSquares(u) / n;
            us.set(i, NearestOrthogonal.project(u));
        }
        return Math.sqrt(accumulated / m);
    }

    /// Seeds, or eigenvectors of the mean of G(κ,i,j)·G(κ,i,j)^H.
    private List<FieldMatrix<Complex>> initialize(CovarianceArray g, int n) {
        int m = g.groups();
        List<FieldMatrix<Complex>> seeds = options.init();
        List<FieldMatrix<Complex>> us = new ArrayList<>(m);
        if (seeds != null) {
            if (seeds.size() != m) {
                throw new InvalidConfigurationException("expected " + m + " initial transforms, got " + seeds.size());
            }
            for (int i = 0; i < m; i++) {
                FieldMatrix<Complex> seed = seeds.get(i);
                if (seed.getRowDimension() != n || seed.getColumnDimension() != n) {
                    throw new InvalidConfigurationException("initial transform " + i + " is "
                        + seed.getRowDimension() + "x" + seed.getColumnDimension() + ", expected " + n + "x" + n);
                }
                us.add(seed.copy());
            }
            return us;
        }
        for (int i = 0; i < m; i++) {
            List<FieldMatrix<Complex>> products = new ArrayList<>();
            for (int t = 0; t < g.trials(); t++) {
                for (int j = 0; j < m; j++) {
                    if (m == 1 || j != i || options.fullModel()) {
                        FieldMatrix<Complex> gij = g.get(t, i, j);
                        products.add(gij.multiply(ComplexMatrices.conjugateTranspose(gij)));
                    }
                }
            }
            us.add(HermitianEigenDecomposition.of(ComplexMatrices.mean(products)).eigenvectors());
        }
        return us;
    }

    private void reportOutcome(ConvergenceState state) {
        switch (state.outcome()) {
            case DIVERGED -> logger.warn("OJoB diverged at iteration {} (convergence {})",
                state.iteration(), state.convergence());
            case MAX_ITER_REACHED -> logger.warn(
                "OJoB reached the max number of iterations ({}) before convergence: {} > tolerance {}",
                state.iteration(), state.convergence(), state.tolerance());
            default -> logger.debug("OJoB converged after {} iterations (convergence {})",
                state.iteration(), state.convergence());
        }
    }
}
