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

package io.nosqlbench.jointdiag.trace;

import io.nosqlbench.jointdiag.solver.SolverOutcome;

/// Observer interface for monitoring the OJoB iteration loop.
///
/// ## Purpose
///
/// Gives visibility into a running solve by providing callbacks at key points:
///
/// ```text
/// ┌─────────────────────────────────────────────────────────────────┐
/// │                        SOLVE LIFECYCLE                          │
/// └─────────────────────────────────────────────────────────────────┘
///
///   ┌──────────┐
///   │ onStart  │ ──► groups, trials and working dimension are known
///   └──────────┘
///        │
///        ▼
///   ┌─────────────┐
///   │ onIteration │ ──► once per full sweep over all groups
///   │ (repeated)  │
///   └─────────────┘
///        │
///        ▼
///   ┌────────────┐
///   │ onComplete │ ──► converged, diverged or iteration cap reached
///   └────────────┘
/// ```
///
/// ## Usage
///
/// ```java
/// try (NdjsonIterationTraceObserver trace = new NdjsonIterationTraceObserver(Path.of("ojob.ndjson"))) {
///     OJoBOptions options = OJoBOptions.builder().observer(trace).build();
///     DiagonalizationResult result = JointDiagonalizer.ojob(covariances, options);
/// }
/// ```
///
/// @see NdjsonIterationTraceObserver
/// @see LoggingIterationObserver
public interface IterationObserver {

    /// No-op observer that does nothing.
    ///
    /// Use this as a default when no observation is needed.
    IterationObserver NOOP = new IterationObserver() {
        @Override
        public void onStart(int groups, int trials, int dimension) {
            // No-op
        }

        @Override
        public void onIteration(int iteration, double metric, double convergence) {
            // No-op
        }

        @Override
        public void onComplete(SolverOutcome outcome, int iterations, double convergence) {
            // No-op
        }
    };

    /// Called once before the first sweep.
    ///
    /// @param groups m
    /// @param trials k
    /// @param dimension the working dimension n (p after pre-whitening)
    void onStart(int groups, int trials, int dimension);

    /// Called after every sweep.
    ///
    /// @param iteration the one-based sweep number
    /// @param metric the sweep metric, √(mean squared column norm)
    /// @param convergence the relative change of the metric (1.0 on the first sweep)
    void onIteration(int iteration, double metric, double convergence);

    /// Called when the loop has terminated.
    ///
    /// @param outcome why the loop stopped
    /// @param iterations the number of sweeps run
    /// @param convergence the final relative change
    void onComplete(SolverOutcome outcome, int iterations, double convergence);

    /// Forwards every callback to `first`, then to `second`.
    static IterationObserver compose(IterationObserver first, IterationObserver second) {
        if (first == NOOP) {
            return second;
        }
        if (second == NOOP) {
            return first;
        }
        return new IterationObserver() {
            @Override
            public void onStart(int groups, int trials, int dimension) {
                first.onStart(groups, trials, dimension);
                second.onStart(groups, trials, dimension);
            }

            @Override
            public void onIteration(int iteration, double metric, double convergence) {
                first.onIteration(iteration, metric, convergence);
                second.onIteration(iteration, metric, convergence);
            }

            @Override
            public void onComplete(SolverOutcome outcome, int iterations, double convergence) {
                first.onComplete(outcome, iterations, convergence);
                second.onComplete(outcome, iterations, convergence);
            }
        };
    }

    /// Formats an object as a compact JSON string using the shared Gson configuration.
    ///
    /// @param state the object to format
    /// @return compact JSON string representation
    static String toCompactJson(Object state) {
        return JointDiagGsonConfig.compactGson().toJson(state);
    }
}
