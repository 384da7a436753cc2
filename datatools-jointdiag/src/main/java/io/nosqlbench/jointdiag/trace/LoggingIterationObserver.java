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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Reports solver progress through Log4j at INFO level.
///
/// This is what the `verbose` option attaches to a solve.
public final class LoggingIterationObserver implements IterationObserver {

    private static final Logger logger = LogManager.getLogger(LoggingIterationObserver.class);

    @Override
    public void onStart(int groups, int trials, int dimension) {
        logger.info("Iterating OJoB algorithm: m={}, k={}, n={}", groups, trials, dimension);
    }

    @Override
    public void onIteration(int iteration, double metric, double convergence) {
        logger.info("iteration: {}; convergence: {}", iteration, convergence);
    }

    @Override
    public void onComplete(SolverOutcome outcome, int iterations, double convergence) {
        if (outcome == SolverOutcome.CONVERGED) {
            logger.info("Convergence has been attained after {} iterations.", iterations);
        } else {
            logger.info("Convergence has not been attained ({} after {} iterations, convergence {}).",
                outcome, iterations, convergence);
        }
    }
}
