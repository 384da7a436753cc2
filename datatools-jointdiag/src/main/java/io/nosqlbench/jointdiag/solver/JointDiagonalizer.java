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
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;

import java.util.List;
import java.util.Objects;

/// Entry points for joint diagonalization.
///
/// ```java
/// // from covariance matrices
/// DiagonalizationResult r = JointDiagonalizer.ojob(covariances, OJoBOptions.defaults());
///
/// // from data: k trials of m data matrices
/// DiagonalizationResult r = JointDiagonalizer.ojob(data, m, k, OJoBOptions.defaults());
/// ```
public final class JointDiagonalizer {

    private JointDiagonalizer() {
        // Utility class
    }

    /// Solves from a covariance array.
    public static DiagonalizationResult ojob(CovarianceArray covariances, OJoBOptions options) {
        return new OJoBSolver(options).solve(covariances, InputForm.COVARIANCE);
    }

    /// Solves from raw data; covariances are estimated with `options.estimator()`.
    ///
    /// @param data k lists of m data matrices
    /// @param groups m
    /// @param trials k
    /// @throws InvalidConfigurationException when k < 3 and m < 2
    public static DiagonalizationResult ojob(List<List<FieldMatrix<Complex>>> data, int groups, int trials,
                                             OJoBOptions options) {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(options, "options");
        OJoBSolver.validate(groups, trials);
        CovarianceArray covariances = options.estimator().estimate(data, groups, trials);
        return new OJoBSolver(options).solve(covariances, InputForm.DATA);
    }
}
