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

import io.nosqlbench.jointdiag.TestMatrices;
import io.nosqlbench.jointdiag.linalg.ComplexMatrices;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class CovarianceArrayTest {

    private static final double EPS = 1e-12;

    @Test
    void lowerTriangleIsConjugateTransposeOfUpper() {
        Random rng = new Random(1);
        FieldMatrix<Complex> c01 = TestMatrices.gaussian(rng, 3, 2, true);
        CovarianceArray array = CovarianceArray.builder(1, 2)
            .set(0, 0, 0, TestMatrices.randomCovariance(rng, 3, 10, true))
            .set(0, 1, 1, TestMatrices.randomCovariance(rng, 2, 10, true))
            .set(0, 0, 1, c01)
            .build();
        TestMatrices.assertMatrixEquals(ComplexMatrices.conjugateTranspose(c01), array.get(0, 1, 0), EPS);
        assertEquals(3, array.groupDimension(0));
        assertEquals(2, array.groupDimension(1));
        assertFalse(array.hasCommonDimension());
        assertFalse(array.isReal());
        assertThrows(IllegalStateException.class, array::grandWithinGroupMean);
    }

    @Test
    void missingEntryIsRejected() {
        CovarianceArray.Builder builder = CovarianceArray.builder(1, 2)
            .set(0, 0, 0, ComplexMatrices.identity(2))
            .set(0, 1, 1, ComplexMatrices.identity(2));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, builder::build);
        assertTrue(e.getMessage().contains("missing entry"));
    }

    @Test
    void crossCovarianceShapeIsValidated() {
        CovarianceArray.Builder builder = CovarianceArray.builder(1, 2)
            .set(0, 0, 0, ComplexMatrices.identity(2))
            .set(0, 1, 1, ComplexMatrices.identity(3))
            .set(0, 0, 1, ComplexMatrices.zeros(2, 2));
        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void nonSquareWithinGroupCovarianceIsRejected() {
        CovarianceArray.Builder builder = CovarianceArray.builder(1, 1)
            .set(0, 0, 0, ComplexMatrices.zeros(2, 3));
        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void invalidShapeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> CovarianceArray.builder(0, 1));
        assertThrows(IllegalArgumentException.class, () -> CovarianceArray.builder(1, 0));
    }

    @Test
    void builtArrayIsIndependentOfBuilder() {
        CovarianceArray.Builder builder = CovarianceArray.builder(1, 1).set(0, 0, 0, TestMatrices.diagonal(1, 2));
        CovarianceArray array = builder.build();
        builder.set(0, 0, 0, TestMatrices.diagonal(5, 5));
        assertEquals(new Complex(3, 0), ComplexMatrices.trace(array.get(0, 0, 0)));
    }

    @Test
    void meansOverTrialsAndGroups() {
        CovarianceArray array = CovarianceArray.ofRealTrials(
            new double[][]{{1, 0}, {0, 1}},
            new double[][]{{3, 1}, {1, 3}},
            new double[][]{{2, -1}, {-1, 2}});
        assertEquals(3, array.trials());
        assertEquals(1, array.groups());
        assertTrue(array.isReal());
        FieldMatrix<Complex> expected = ComplexMatrices.fromReal(new double[][]{{2, 0}, {0, 2}});
        TestMatrices.assertMatrixEquals(expected, array.trialMean(0, 0), EPS);
        TestMatrices.assertMatrixEquals(expected, array.grandWithinGroupMean(), EPS);
    }

    @Test
    void singleTrialReadsUpperTriangle() {
        @SuppressWarnings("unchecked")
        FieldMatrix<Complex>[][] blocks = new FieldMatrix[2][2];
        blocks[0][0] = TestMatrices.diagonal(1, 1);
        blocks[1][1] = TestMatrices.diagonal(2, 2);
        blocks[0][1] = ComplexMatrices.fromParts(new double[][]{{0, 1}, {0, 0}}, new double[][]{{1, 0}, {0, 0}});
        CovarianceArray array = CovarianceArray.singleTrial(blocks);
        assertEquals(1, array.trials());
        assertEquals(new Complex(0, -1), array.get(0, 1, 0).getEntry(0, 0));
        assertEquals(new Complex(1, 0), array.get(0, 1, 0).getEntry(1, 0));
    }

    @Test
    void mapKeepsHermitianLayout() {
        Random rng = new Random(4);
        CovarianceArray array = TestMatrices.randomArray(rng, 2, 3, 3, 12, true);
        CovarianceArray doubled = array.map((t, i, j, c) -> ComplexMatrices.scale(c, 2.0));
        for (int t = 0; t < 2; t++) {
            for (int i = 0; i < 3; i++) {
                for (int j = 0; j < 3; j++) {
                    TestMatrices.assertMatrixEquals(ComplexMatrices.scale(array.get(t, i, j), 2.0),
                        doubled.get(t, i, j), EPS);
                }
            }
        }
    }

    @Test
    void singleGroupFactoryKeepsTrialOrder() {
        CovarianceArray array = CovarianceArray.singleGroup(List.of(
            TestMatrices.diagonal(1, 1), TestMatrices.diagonal(2, 2), TestMatrices.diagonal(3, 3)));
        assertEquals(new Complex(4, 0), ComplexMatrices.trace(array.get(1, 0, 0)));
        assertTrue(array.hasCommonDimension());
    }
}
