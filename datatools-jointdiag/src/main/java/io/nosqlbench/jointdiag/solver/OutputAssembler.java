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

import io.nosqlbench.jointdiag.linalg.ComplexMatrices;
import io.nosqlbench.jointdiag.whitening.WhiteningTransform;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;

import java.util.ArrayList;
import java.util.List;

/// Composes the final forward and inverse transforms.
///
/// ```text
///   pre-whitened:  U_i ← F_i · U_i      V_i = U_i^H · iF_i   (U_i before back-substitution)
///   otherwise:                          V_i = U_i^H
/// ```
final class OutputAssembler {

    private OutputAssembler() {
    }

    static DiagonalizationResult assemble(List<FieldMatrix<Complex>> us,
                                          List<WhiteningTransform> whitening,
                                          Complex[] diagonalAverages,
                                          ConvergenceState state,
                                          InputForm inputForm) {
        int m = us.size();
        List<FieldMatrix<Complex>> transforms = new ArrayList<>(m);
        List<FieldMatrix<Complex>> inverses = new ArrayList<>(m);
        for (int i = 0; i < m; i++) {
            FieldMatrix<Complex> u = us.get(i);
            if (whitening.isEmpty()) {
                transforms.add(u);
                inverses.add(ComplexMatrices.conjugateTranspose(u));
            } else {
                WhiteningTransform w = whitening.get(i);
                inverses.add(ComplexMatrices.adjointMultiply(u, w.inverse()));
                transforms.add(w.forward().multiply(u));
            }
        }
        return new DiagonalizationResult(
            List.copyOf(transforms),
            List.copyOf(inverses),
            diagonalAverages,
            state.iteration(),
            state.convergence(),
            state.outcome(),
            List.copyOf(whitening),
            inputForm
        );
    }
}
