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

import io.nosqlbench.jointdiag.trace.JointDiagGsonConfig;
import io.nosqlbench.jointdiag.whitening.WhiteningTransform;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Result of an OJoB solve.
///
/// For group i, `transforms().get(i)` is U_i (n_i × p, the basis/forward
/// transform; a source estimate is U_i^H · X) and `inverses().get(i)` is its
/// left-inverse V_i (p × n_i). Without pre-whitening V_i = U_i^H.
///
/// @param transforms U_i, one per group
/// @param inverses V_i, one per group
/// @param diagonalAverages λ, mean diagonal of the transformed (cross-)covariances
/// @param iterations number of sweeps run
/// @param convergence final relative change
/// @param outcome why the loop stopped
/// @param whitening the whitening transforms, empty without pre-whitening
/// @param inputForm whether the solve started from data or covariances
public record DiagonalizationResult(
    List<FieldMatrix<Complex>> transforms,
    List<FieldMatrix<Complex>> inverses,
    Complex[] diagonalAverages,
    int iterations,
    double convergence,
    SolverOutcome outcome,
    List<WhiteningTransform> whitening,
    InputForm inputForm
) {
    public DiagonalizationResult {
        transforms = List.copyOf(transforms);
        inverses = List.copyOf(inverses);
        diagonalAverages = diagonalAverages.clone();
        whitening = List.copyOf(whitening);
    }

    /// λ, one entry per retained column.
    @Override
    public Complex[] diagonalAverages() {
        return diagonalAverages.clone();
    }

    /// Number of groups, m.
    public int groups() {
        return transforms.size();
    }

    /// U of a single-group solve.
    ///
    /// @throws IllegalStateException when the solve had more than one group
    public FieldMatrix<Complex> transform() {
        requireSingleGroup();
        return transforms.get(0);
    }

    /// V of a single-group solve.
    ///
    /// @throws IllegalStateException when the solve had more than one group
    public FieldMatrix<Complex> inverse() {
        requireSingleGroup();
        return inverses.get(0);
    }

    public FieldMatrix<Complex> transform(int group) {
        return transforms.get(group);
    }

    public FieldMatrix<Complex> inverse(int group) {
        return inverses.get(group);
    }

    /// Real parts of λ; for resolved solutions these carry all of λ.
    public double[] realAverages() {
        double[] re = new double[diagonalAverages.length];
        for (int i = 0; i < re.length; i++) {
            re[i] = diagonalAverages[i].getReal();
        }
        return re;
    }

    public boolean converged() {
        return outcome == SolverOutcome.CONVERGED;
    }

    public boolean preWhitened() {
        return !whitening.isEmpty();
    }

    /// JSON summary: shape, outcome and λ, without the matrices.
    public String summaryJson() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("groups", groups());
        summary.put("dimension", diagonalAverages.length);
        summary.put("inputForm", inputForm);
        summary.put("outcome", outcome);
        summary.put("iterations", iterations);
        summary.put("convergence", convergence);
        summary.put("preWhitened", preWhitened());
        summary.put("diagonalAverages", diagonalAverages);
        return JointDiagGsonConfig.gson().toJson(summary);
    }

    private void requireSingleGroup() {
        if (transforms.size() != 1) {
            throw new IllegalStateException("result has " + transforms.size()
                + " groups; use transform(int) / inverse(int)");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DiagonalizationResult other)) {
            return false;
        }
        return iterations == other.iterations
            && Double.compare(convergence, other.convergence) == 0
            && outcome == other.outcome
            && inputForm == other.inputForm
            && transforms.equals(other.transforms)
            && inverses.equals(other.inverses)
            && Arrays.equals(diagonalAverages, other.diagonalAverages)
            && whitening.equals(other.whitening);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(transforms, inverses, iterations, convergence, outcome, whitening, inputForm);
        return 31 * result + Arrays.hashCode(diagonalAverages);
    }

    @Override
    public String toString() {
        return "DiagonalizationResult[groups=" + transforms.size()
            + ", outcome=" + outcome
            + ", iterations=" + iterations
            + ", convergence=" + convergence
            + ", diagonalAverages=" + Arrays.toString(diagonalAverages) + "]";
    }
}
