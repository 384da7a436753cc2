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

/// Per-trial, per-group weight applied to the covariance array before solving.
///
/// The weight of entry (κ, i, j) is √(w(κ,i) · w(κ,j)), so within-group
/// covariances are scaled by w(κ,i) and the Hermitian layout is kept.
///
/// ```java
/// // down-weight noisy trials by their total power
/// TrialWeighting byPower = (trial, group, c) -> 1.0 / ComplexMatrices.trace(c).getReal();
/// ```
@FunctionalInterface
public interface TrialWeighting {

    /// No weighting: every weight is 1.
    TrialWeighting NONE = (trial, group, covariance) -> 1.0;

    /// Computes the weight of one trial of one group.
    ///
    /// @param trial the zero-based trial index κ
    /// @param group the zero-based group index i
    /// @param covariance the within-group covariance C(κ, i, i)
    /// @return a non-negative weight
    double weight(int trial, int group, FieldMatrix<Complex> covariance);

    /// Fixed weights per trial, shared by all groups.
    ///
    /// @param perTrial one non-negative weight per trial
    /// @return a weighting returning `perTrial[trial]`
    static TrialWeighting fixed(double[] perTrial) {
        double[] weights = perTrial.clone();
        for (double w : weights) {
            if (!(w >= 0.0)) {
                throw new IllegalArgumentException("weights must be non-negative, got " + w);
            }
        }
        return (trial, group, covariance) -> weights[trial];
    }
}
