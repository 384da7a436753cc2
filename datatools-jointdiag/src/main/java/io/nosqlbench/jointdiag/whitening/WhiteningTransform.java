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

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;

import java.util.Arrays;
import java.util.Objects;

/// Whitening transform of one group.
///
/// `forward` is n × p and satisfies forward^H · C · forward = I_p for the
/// covariance C it was built from; `inverse` is p × n with
/// inverse · forward = I_p.
///
/// @param forward F, the whitening (basis) transform
/// @param inverse iF, the left-inverse of F
/// @param dimension p, the retained subspace size
/// @param eigenvalues all n eigenvalues of C, descending
/// @param accumulated accumulated normalized eigenvalues
public record WhiteningTransform(
    FieldMatrix<Complex> forward,
    FieldMatrix<Complex> inverse,
    int dimension,
    double[] eigenvalues,
    double[] accumulated
) {
    public WhiteningTransform {
        Objects.requireNonNull(forward, "forward");
        Objects.requireNonNull(inverse, "inverse");
        eigenvalues = eigenvalues.clone();
        accumulated = accumulated.clone();
    }

    @Override
    public double[] eigenvalues() {
        return eigenvalues.clone();
    }

    @Override
    public double[] accumulated() {
        return accumulated.clone();
    }

    /// Fraction of the total variance retained by the p kept directions.
    public double explainedVariance() {
        return accumulated[dimension - 1];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WhiteningTransform other)) {
            return false;
        }
        return dimension == other.dimension
            && forward.equals(other.forward)
            && inverse.equals(other.inverse)
            && Arrays.equals(eigenvalues, other.eigenvalues)
            && Arrays.equals(accumulated, other.accumulated);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(forward, inverse, dimension);
        result = 31 * result + Arrays.hashCode(eigenvalues);
        return 31 * result + Arrays.hashCode(accumulated);
    }

    @Override
    public String toString() {
        return "WhiteningTransform[dimension=" + dimension
            + ", eigenvalues=" + Arrays.toString(eigenvalues) + "]";
    }
}
