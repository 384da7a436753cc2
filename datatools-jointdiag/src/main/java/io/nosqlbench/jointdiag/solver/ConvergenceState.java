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

/**
 * Convergence bookkeeping of one solve.
 *
 * <p>After every sweep the solver records the sweep metric
 * &radic;(&Sigma;<sub>i</sub> ss(U<sub>i</sub>)/n / m). The relative change
 * <pre>
 * conv = |metric - previous| / previous
 * </pre>
 * is defined as 1.0 on the first sweep, which forces at least two sweeps.
 * The loop stops when {@code 0 <= conv <= tolerance} (converged), when conv
 * is not finite (diverging), or when the iteration cap is reached.
 *
 * <p>Not thread-safe; one instance per solve.
 */
public final class ConvergenceState {

    private final double tolerance;
    private final int maxIterations;

    private int iteration = 0;
    private double metric = Double.NaN;
    private double previousMetric = Double.NaN;
    private double convergence = 1.0;
    private boolean converged = false;
    private boolean diverging = false;

    /**
     * @param tolerance relative-change threshold, must be positive
     * @param maxIterations iteration cap, at least 1
     */
    public ConvergenceState(double tolerance, int maxIterations) {
        if (!(tolerance > 0.0)) {
            throw new IllegalArgumentException("tolerance must be positive, got " + tolerance);
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
        this.tolerance = tolerance;
        this.maxIterations = maxIterations;
    }

    /**
     * Records the metric of a completed sweep.
     *
     * @param sweepMetric the metric of the sweep just finished
     * @return true when the loop must stop
     */
    public boolean record(double sweepMetric) {
        iteration++;
        previousMetric = metric;
        metric = sweepMetric;
        convergence = iteration == 1 ? 1.0 : Math.abs((metric - previousMetric) / previousMetric);
        diverging = !Double.isFinite(convergence);
        converged = !diverging && convergence >= 0.0 && convergence <= tolerance;
        return converged || diverging || iteration >= maxIterations;
    }

    /** Why the loop stopped; meaningful once {@link #record(double)} returned true. */
    public SolverOutcome outcome() {
        if (converged) {
            return SolverOutcome.CONVERGED;
        }
        return diverging ? SolverOutcome.DIVERGED : SolverOutcome.MAX_ITER_REACHED;
    }

    public int iteration() {
        return iteration;
    }

    public double metric() {
        return metric;
    }

    public double previousMetric() {
        return previousMetric;
    }

    public double convergence() {
        return convergence;
    }

    public double tolerance() {
        return tolerance;
    }

    public int maxIterations() {
        return maxIterations;
    }

    public boolean isConverged() {
        return converged;
    }

    public boolean isDiverging() {
        return diverging;
    }
}
