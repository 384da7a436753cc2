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

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.FieldMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/// Eigendecomposition of a Hermitian (real symmetric) matrix.
///
/// Eigenvalues are real and reported in descending order; the eigenvectors
/// are the orthonormal columns of [#eigenvectors()] in the same order.
///
/// ## Strategy
///
/// | Input | Path |
/// |-------|------|
/// | real symmetric | commons-math3 [EigenDecomposition] of the symmetrized real part |
/// | complex Hermitian | symmetric eigendecomposition of the 2n real embedding |
///
/// For the complex path every eigenvalue of A appears twice in φ(A). Each
/// embedded eigenvector (a; b) yields a complex eigenvector a + ib; n of these
/// candidates are selected by complex Gram-Schmidt, keeping high eigenvalues
/// first, and the eigenvalues are recomputed as Rayleigh quotients.
///
/// The input is not checked for Hermitian symmetry; its Hermitian part is
/// what gets decomposed.
public final class HermitianEigenDecomposition {

    /// Squared residual a candidate needs to be accepted on the first pass.
    private static final double ACCEPT_RESIDUAL = 0.5;

    private final double[] eigenvalues;
    private final FieldMatrix<Complex> eigenvectors;

    private HermitianEigenDecomposition(double[] eigenvalues, FieldMatrix<Complex> eigenvectors) {
        this.eigenvalues = eigenvalues;
        this.eigenvectors = eigenvectors;
    }

    /// Decomposes `a`, choosing the real path when `a` has no imaginary part.
    public static HermitianEigenDecomposition of(FieldMatrix<Complex> a) {
        ComplexMatrices.requireSquare(a);
        return ComplexMatrices.isReal(a) ? ofReal(a) : ofComplex(a);
    }

    private static HermitianEigenDecomposition ofReal(FieldMatrix<Complex> a) {
        RealMatrix real = ComplexMatrices.realPart(a);
        RealMatrix symmetric = real.add(real.transpose()).scalarMultiply(0.5);
        EigenDecomposition eig = new EigenDecomposition(symmetric);
        int n = symmetric.getRowDimension();

        Integer[] order = descendingOrder(eig.getRealEigenvalues());
        double[] values = new double[n];
        double[][] vectors = new double[n][n];
        for (int c = 0; c < n; c++) {
            int source = order[c];
            values[c] = eig.getRealEigenvalue(source);
            RealVector v = eig.getEigenvector(source);
            for (int r = 0; r < n; r++) {
                vectors[r][c] = v.getEntry(r);
            }
        }
        return new HermitianEigenDecomposition(values, ComplexMatrices.fromReal(vectors));
    }

    private static HermitianEigenDecomposition ofComplex(FieldMatrix<Complex> a) {
        FieldMatrix<Complex> h = ComplexMatrices.hermitianPart(a);
        int n = h.getRowDimension();
        EigenDecomposition eig = new EigenDecomposition(ComplexMatrices.embed(h));

        Integer[] order = descendingOrder(eig.getRealEigenvalues());
        List<Complex[]> candidates = new ArrayList<>(2 * n);
        for (Integer index : order) {
            RealVector z = eig.getEigenvector(index);
            Complex[] v = new Complex[n];
            for (int r = 0; r < n; r++) {
                v[r] = new Complex(z.getEntry(r), z.getEntry(r + n));
            }
            candidates.add(normalize(v));
        }

        List<Complex[]> accepted = new ArrayList<>(n);
        boolean[] used = new boolean[candidates.size()];
        for (int c = 0; c < candidates.size() && accepted.size() < n; c++) {
            Complex[] residual = residual(candidates.get(c), accepted);
            if (squaredNorm(residual) > ACCEPT_RESIDUAL) {
                accepted.add(normalize(residual));
                used[c] = true;
            }
        }
        // degenerate clusters can leave gaps; fill them with the best remaining candidates
        while (accepted.size() < n) {
            int best = -1;
            double bestNorm = -1.0;
            Complex[] bestResidual = null;
            for (int c = 0; c < candidates.size(); c++) {
                if (used[c]) {
                    continue;
                }
                Complex[] residual = residual(candidates.get(c), accepted);
                double norm = squaredNorm(residual);
                if (norm > bestNorm) {
                    best = c;
                    bestNorm = norm;
                    bestResidual = residual;
                }
            }
            used[best] = true;
            accepted.add(normalize(bestResidual));
        }

        double[] rayleigh = new double[n];
        for (int c = 0; c < n; c++) {
            rayleigh[c] = rayleighQuotient(h, accepted.get(c));
        }
        Integer[] finalOrder = descendingOrder(rayleigh);
        double[] values = new double[n];
        Complex[][] vectors = new Complex[n][n];
        for (int c = 0; c < n; c++) {
            int source = finalOrder[c];
            values[c] = rayleigh[source];
            Complex[] v = accepted.get(source);
            for (int r = 0; r < n; r++) {
                vectors[r][c] = v[r];
            }
        }
        return new HermitianEigenDecomposition(values, ComplexMatrices.fromComplex(vectors));
    }

    /// Eigenvalues in descending order.
    public double[] eigenvalues() {
        return eigenvalues.clone();
    }

    /// Orthonormal eigenvectors as columns, ordered like [#eigenvalues()].
    public FieldMatrix<Complex> eigenvectors() {
        return eigenvectors.copy();
    }

    private static Integer[] descendingOrder(double[] values) {
        Integer[] order = new Integer[values.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> values[i]).reversed());
        return order;
    }

    static Complex[] residual(Complex[] v, List<Complex[]> basis) {
        Complex[] r = v.clone();
        for (Complex[] b : basis) {
            Complex projection = innerProduct(b, r);
            for (int i = 0; i < r.length; i++) {
                r[i] = r[i].subtract(b[i].multiply(projection));
            }
        }
        return r;
    }

    /// <x, y> = x^H y
    static Complex innerProduct(Complex[] x, Complex[] y) {
        double re = 0.0;
        double im = 0.0;
        for (int i = 0; i < x.length; i++) {
            re += x[i].getReal() * y[i].getReal() + x[i].getImaginary() * y[i].getImaginary();
            im += x[i].getReal() * y[i].getImaginary() - x[i].getImaginary() * y[i].getReal();
        }
        return new Complex(re, im);
    }

    static double squaredNorm(Complex[] v) {
        double sum = 0.0;
        for (Complex z : v) {
            sum += z.getReal() * z.getReal() + z.getImaginary() * z.getImaginary();
        }
        return sum;
    }

    static Complex[] normalize(Complex[] v) {
        double norm = Math.sqrt(squaredNorm(v));
        Complex[] out = new Complex[v.length];
        for (int i = 0; i < v.length; i++) {
            out[i] = v[i].divide(norm);
        }
        return out;
    }

    private static double rayleighQuotient(FieldMatrix<Complex> h, Complex[] v) {
        Complex[] hv = h.operate(v);
        return innerProduct(v, hv).getReal();
    }
}
