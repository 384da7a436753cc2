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

import io.nosqlbench.jointdiag.TestMatrices;
import io.nosqlbench.jointdiag.covariance.CovarianceArray;
import io.nosqlbench.jointdiag.linalg.ComplexMatrices;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class AmbiguityResolverTest {

    private static final double EPS = 1e-12;

    @Test
    void singleGroupSortsByMagnitudeAndKeepsSigns() {
        CovarianceArray g = CovarianceArray.singleGroup(List.of(
            TestMatrices.diagonal(1, -5, 3), TestMatrices.diagonal(1, -5, 3), TestMatrices.diagonal(1, -5, 3)));
        FieldMatrix<Complex> u = ComplexMatrices.identity(3);

        Complex[] lambda = AmbiguityResolver.resolveSingleGroup(u, g);

        assertEquals(-5.0, lambda[0].getReal(), EPS);
        assertEquals(3.0, lambda[1].getReal(), EPS);
        assertEquals(1.0, lambda[2].getReal(), EPS);
        assertEquals(Complex.ONE, u.getEntry(1, 0));
        assertEquals(Complex.ONE, u.getEntry(2, 1));
        assertEquals(Complex.ONE, u.getEntry(0, 2));
    }

    @Test
    void twoGroupsAreAlignedThenSorted() {
        CovarianceArray g = CovarianceArray.builder(1, 2)
            .set(0, 0, 0, ComplexMatrices.identity(3))
            .set(0, 1, 1, ComplexMatrices.identity(3))
            .set(0, 0, 1, TestMatrices.diagonal(1, -4, 2))
            .build();
        List<FieldMatrix<Complex>> us = identities(2, 3);

        Complex[] lambda = AmbiguityResolver.resolveMultiGroup(us, g);

        assertArrayEquals(new double[]{4, 2, 1}, realParts(lambda), EPS);
        // the flip lands on the second group only
        assertEquals(1.0, us.get(0).getEntry(1, 0).getReal(), EPS);
        assertEquals(-1.0, us.get(1).getEntry(1, 0).getReal(), EPS);
    }

    @Test
    void partnersOfTheLeadingPairAreAlignedToTheFirstGroup() {
        CovarianceArray g = CovarianceArray.builder(1, 3)
            .set(0, 0, 0, ComplexMatrices.identity(2))
            .set(0, 1, 1, ComplexMatrices.identity(2))
            .set(0, 2, 2, ComplexMatrices.identity(2))
            .set(0, 0, 1, TestMatrices.diagonal(-3, 1))
            .set(0, 0, 2, TestMatrices.diagonal(-2, 1))
            .set(0, 1, 2, TestMatrices.diagonal(6, 1))
            .build();
        List<FieldMatrix<Complex>> us = identities(3, 2);

        Complex[] lambda = AmbiguityResolver.resolveMultiGroup(us, g);

        // leading pair is (1, 2); group 0 is the only partner and is flipped against group 1
        assertEquals(-1.0, us.get(0).getEntry(0, 0).getReal(), EPS);
        assertEquals(1.0, us.get(1).getEntry(0, 0).getReal(), EPS);
        assertEquals(1.0, us.get(2).getEntry(0, 0).getReal(), EPS);
        assertEquals(22.0 / 6.0, lambda[0].getReal(), EPS);
        assertEquals(1.0, lambda[1].getReal(), EPS);
    }

    @Test
    void complexPhaseIsRotatedOntoThePositiveAxis() {
        FieldMatrix<Complex> c01 = ComplexMatrices.zeros(2, 2);
        c01.setEntry(0, 0, new Complex(0, 2));
        c01.setEntry(1, 1, new Complex(-1, 1));
        CovarianceArray g = CovarianceArray.builder(1, 2)
            .set(0, 0, 0, ComplexMatrices.identity(2))
            .set(0, 1, 1, ComplexMatrices.identity(2))
            .set(0, 0, 1, c01)
            .build();
        List<FieldMatrix<Complex>> us = identities(2, 2);

        Complex[] lambda = AmbiguityResolver.resolveMultiGroup(us, g);

        assertEquals(2.0, lambda[0].getReal(), EPS);
        assertEquals(0.0, lambda[0].getImaginary(), EPS);
        assertEquals(Math.sqrt(2.0), lambda[1].getReal(), EPS);
        assertEquals(0.0, lambda[1].getImaginary(), EPS);
        TestMatrices.assertOrthonormalColumns(us.get(1), EPS);
    }

    @Test
    void zeroColumnsAreLeftInPlace() {
        CovarianceArray g = CovarianceArray.builder(1, 2)
            .set(0, 0, 0, ComplexMatrices.identity(2))
            .set(0, 1, 1, ComplexMatrices.identity(2))
            .set(0, 0, 1, ComplexMatrices.zeros(2, 2))
            .build();
        List<FieldMatrix<Complex>> us = identities(2, 2);
        Complex[] lambda = AmbiguityResolver.resolveMultiGroup(us, g);
        assertEquals(0.0, lambda[0].abs(), EPS);
        TestMatrices.assertMatrixEquals(ComplexMatrices.identity(2), us.get(0), 0.0);
        TestMatrices.assertMatrixEquals(ComplexMatrices.identity(2), us.get(1), 0.0);
    }

    @Test
    void alignmentFactors() {
        assertNull(AmbiguityResolver.alignment(new Complex(2, 0), true));
        assertEquals(new Complex(-1, 0), AmbiguityResolver.alignment(new Complex(-2, 0), true));
        assertNull(AmbiguityResolver.alignment(Complex.ZERO, false));
        Complex d = new Complex(3, -4);
        Complex aligned = d.multiply(AmbiguityResolver.alignment(d, false));
        assertEquals(5.0, aligned.getReal(), EPS);
        assertEquals(0.0, aligned.getImaginary(), EPS);
    }

    @Test
    void unsortedAveragesKeepColumnOrder() {
        CovarianceArray g = CovarianceArray.builder(1, 2)
            .set(0, 0, 0, ComplexMatrices.identity(3))
            .set(0, 1, 1, ComplexMatrices.identity(3))
            .set(0, 0, 1, TestMatrices.diagonal(1, -4, 2))
            .build();
        Complex[] lambda = AmbiguityResolver.unsortedAverages(identities(2, 3), g);
        assertArrayEquals(new double[]{1, -4, 2}, realParts(lambda), EPS);
    }

    private static List<FieldMatrix<Complex>> identities(int m, int n) {
        List<FieldMatrix<Complex>> us = new ArrayList<>(m);
        for (int i = 0; i < m; i++) {
            us.add(ComplexMatrices.identity(n));
        }
        return us;
    }

    private static double[] realParts(Complex[] values) {
        double[] re = new double[values.length];
        for (int i = 0; i < re.length; i++) {
            re[i] = values[i].getReal();
        }
        return re;
    }
}
