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

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;

import java.util.List;

/// Turns raw per-trial, per-group data matrices into a [CovarianceArray].
///
/// `data.get(trial).get(group)` is the data matrix of one group in one
/// trial. All groups of a trial must share the same number of samples.
public interface CrossCovarianceEstimator {

    /// Estimates every C(κ, i, j).
    ///
    /// @param data k lists of m data matrices
    /// @param groups m
    /// @param trials k
    /// @return the estimated covariance array
    CovarianceArray estimate(List<List<FieldMatrix<Complex>>> data, int groups, int trials);
}
