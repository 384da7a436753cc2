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

package io.nosqlbench.jointdiag.csp;

import io.nosqlbench.jointdiag.TestMatrices;
import io.nosqlbench.jointdiag.linalg.ComplexMatrices;
import io.nosqlbench.jointdiag.whitening.ExplainedVariance;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class SimultaneousDiagonalizationTest {

    private static final double TOL = 1e-9;

    @ParameterizedTest
    @ValueSource(booleans = {false, true})
    void filtersWhitenThePooledCovarianceAndSplitIt(boolean complex) {
        Random rng = new Random(complex ? 601 : 600);
        FieldMatrix<Complex> c1 = TestMatrices.randomCovariance(rng, 5, 40, complex);
        FieldMatrix<Complex> c2 = TestMatrices.randomCovariance(rng, 5, 40, complex);

        SimultaneousDiagonalization csp = SimultaneousDiagonalization.of(c1, c2);
        FieldMatrix<Complex> f = csp.forward();

        assertEquals(5, csp.dimension());
        TestMatrices.assertMatrixEquals(ComplexMatrices.identity(5), ComplexMatrices.congruence(f, c1.add(c2), f), TOL);
        FieldMatrix<Complex> d1 = ComplexMatrices.congruence(f, c1, f);
        FieldMatrix<Complex> d2 = ComplexMatrices.congruence(f, c2, f);
        assertEquals(0.0, ComplexMatrices.offDiagonalNorm(d1), TOL);
        assertEquals(0.0, ComplexMatrices.offDiagonalNorm(d2), TOL);

        double[] lambda = csp.eigenvalues();
        double[] complement = csp.complementEigenvalues();
        for (int e = 0; e < lambda.length; e++) {
            assertEquals(lambda[e], d1.getEntry(e, e).getReal(), TOL);
            assertEquals(complement[e], d2.getEntry(e, e).getReal(), TOL);
            assertTrue(lambda[e] > 0.0 && lambda[e] < 1.0);
            if (e > 0) {
                assertTrue(lambda[e - 1] >= lambda[e]);
            }
        }
        TestMatrices.assertMatrixEquals(ComplexMatrices.identity(5), csp.inverse().multiply(f), TOL);
    }

    @Test
    void explainedVarianceReducesTheSubspace() {
        Random rng = new Random(610);
        FieldMatrix<Complex> c1 = TestMatrices.randomCovariance(rng, 6, 40, false);
        FieldMatrix<Complex> c2 = TestMatrices.randomCovariance(rng, 6, 40, false);

        SimultaneousDiagonalization csp = SimultaneousDiagonalization.of(c1, c2, ExplainedVariance.dimension(2));
        assertEquals(2, csp.dimension());
        assertEquals(6, csp.forward().getRowDimension());
        assertEquals(2, csp.forward().getColumnDimension());
        assertEquals(2, csp.inverse().getRowDimension());
        TestMatrices.assertMatrixEquals(ComplexMatrices.identity(2),
            ComplexMatrices.congruence(csp.forward(), c1.add(c2), csp.forward()), TOL);
    }

    @Test
    void mismatchedShapesAreRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> SimultaneousDiagonalization.of(ComplexMatrices.identity(2), ComplexMatrices.identity(3)));
    }
}
