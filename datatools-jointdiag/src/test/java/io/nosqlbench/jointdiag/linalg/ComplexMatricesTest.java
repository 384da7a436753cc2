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

package io.nosqlbench.jointdiag.linalg;

import io.nosqlbench.jointdiag.TestMatrices;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class ComplexMatricesTest {

    private static final double EPS = 1e-12;

    @Test
    void conjugateTransposeSwapsAndConjugates() {
        FieldMatrix<Complex> a = ComplexMatrices.fromParts(
            new double[][]{{1, 2, 3}, {4, 5, 6}},
            new double[][]{{1, 0, -1}, {0, 2, 0}});
        FieldMatrix<Complex> h = ComplexMatrices.conjugateTranspose(a);
        assertEquals(3, h.getRowDimension());
        assertEquals(2, h.getColumnDimension());
        assertEquals(new Complex(3, 1), h.getEntry(2, 0));
        assertEquals(new Complex(5, -2), h.getEntry(1, 1));
    }

    @Test
    void adjointMultiplyMatchesExplicitProduct() {
        Random rng = new Random(7);
        FieldMatrix<Complex> a = TestMatrices.gaussian(rng, 4, 3, true);
        FieldMatrix<Complex> b = TestMatrices.gaussian(rng, 4, 2, true);
        FieldMatrix<Complex> expected = ComplexMatrices.conjugateTranspose(a).multiply(b);
        TestMatrices.assertMatrixEquals(expected, ComplexMatrices.adjointMultiply(a, b), EPS);
    }

    @Test
    void adjointMultiplyRejectsMismatchedRows() {
        assertThrows(IllegalArgumentException.class,
            () -> ComplexMatrices.adjointMultiply(ComplexMatrices.zeros(3, 2), ComplexMatrices.zeros(2, 2)));
    }

    @Test
    void embedAndUnembedRoundTripComplexMatrix() {
        Random rng = new Random(11);
        FieldMatrix<Complex> a = TestMatrices.gaussian(rng, 3, 2, true);
        TestMatrices.assertMatrixEquals(a, ComplexMatrices.unembed(ComplexMatrices.embed(a)), EPS);
    }

    @Test
    void embeddingIsMultiplicative() {
        Random rng = new Random(13);
        FieldMatrix<Complex> a = TestMatrices.gaussian(rng, 3, 3, true);
        FieldMatrix<Complex> b = TestMatrices.gaussian(rng, 3, 3, true);
        double[][] left = ComplexMatrices.embed(a.multiply(b)).getData();
        double[][] right = ComplexMatrices.embed(a).multiply(ComplexMatrices.embed(b)).getData();
        for (int r = 0; r < left.length; r++) {
            assertArrayEquals(left[r], right[r], 1e-10);
        }
    }

    @Test
    void isRealDetectsImaginaryParts() {
        assertTrue(ComplexMatrices.isReal(ComplexMatrices.fromReal(new double[][]{{1, 2}, {3, 4}})));
        FieldMatrix<Complex> a = ComplexMatrices.identity(2);
        a.setEntry(0, 1, new Complex(0, 1e-300));
        assertFalse(ComplexMatrices.isReal(a));
    }

    @Test
    void meanTraceAndSumOfSquares() {
        FieldMatrix<Complex> a = TestMatrices.diagonal(1, 2);
        FieldMatrix<Complex> b = TestMatrices.diagonal(3, 6);
        FieldMatrix<Complex> mean = ComplexMatrices.mean(List.of(a, b));
        assertEquals(new Complex(6, 0), ComplexMatrices.trace(mean));
        assertEquals(2.0 * 2.0 + 4.0 * 4.0, ComplexMatrices.sumOfSquares(mean), EPS);
        assertEquals(0.0, ComplexMatrices.offDiagonalNorm(mean), EPS);
        assertThrows(IllegalArgumentException.class, () -> ComplexMatrices.mean(List.of()));
    }

    @Test
    void offDiagonalNormIgnoresDiagonal() {
        FieldMatrix<Complex> a = ComplexMatrices.fromParts(
            new double[][]{{9, 3}, {0, 9}},
            new double[][]{{0, 0}, {4, 0}});
        assertEquals(5.0, ComplexMatrices.offDiagonalNorm(a), EPS);
    }

    @Test
    void columnOperationsWorkInPlace() {
        FieldMatrix<Complex> a = ComplexMatrices.fromReal(new double[][]{{1, 2}, {3, 4}});
        ComplexMatrices.swapColumns(a, 0, 1);
        assertEquals(new Complex(2, 0), a.getEntry(0, 0));
        assertEquals(new Complex(3, 0), a.getEntry(1, 1));
        ComplexMatrices.scaleColumn(a, 0, new Complex(0, 1));
        assertEquals(new Complex(0, 2), a.getEntry(0, 0));
        assertEquals(new Complex(0, 4), a.getEntry(1, 0));
    }

    @Test
    void hermitianPartIsHermitian() {
        FieldMatrix<Complex> a = TestMatrices.gaussian(new Random(17), 4, 4, true);
        FieldMatrix<Complex> h = ComplexMatrices.hermitianPart(a);
        TestMatrices.assertMatrixEquals(ComplexMatrices.conjugateTranspose(h), h, EPS);
    }
}
