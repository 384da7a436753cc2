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

import io.nosqlbench.jointdiag.covariance.CovarianceArray;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;

import java.util.Arrays;

/// Scratch buffers of one solve, sized once per invocation.
///
/// ```text
///   projections  Ω   n × k    Ω[:, κ] = G(κ,i,j) · U_j[:, η]
///   accumulator  R   n × n    R += Ω · Ω^H   for every partner j
/// ```
///
/// Both buffers are held as split real/imaginary arrays and reused for
/// every column, group and sweep. Nothing survives past the solve that
/// created the workspace.
public final class SolverWorkspace {

    private final int dimension;
    private final int trials;

    private final double[][] accumulatorRe;
    private final double[][] accumulatorIm;
    private final double[][] projectionsRe;
    private final double[][] projectionsIm;

    /// @param dimension n, the working dimension
    /// @param trials k
    public SolverWorkspace(int dimension, int trials) {
        this.dimension = dimension;
        this.trials = trials;
        this.accumulatorRe = new double[dimension][dimension];
        this.accumulatorIm = new double[dimension][dimension];
        this.projectionsRe = new double[dimension][trials];
        this.projectionsIm = new double[dimension][trials];
    }

    public int dimension() {
        return dimension;
    }

    public int trials() {
        return trials;
    }

    /// Zeroes the accumulator before a new column.
    public void clearAccumulator() {
        for (int r = 0; r < dimension; r++) {
            Arrays.fill(accumulatorRe[r], 0.0);
            Arrays.fill(accumulatorIm[r], 0.0);
        }
    }

    /// Adds Σ_κ (G(κ,i,j)·u)(G(κ,i,j)·u)^H to the accumulator, u = column `column` of `partner`.
    ///
    /// @param g the (possibly whitened) covariance array
    /// @param i the group being updated
    /// @param j the partner group
    /// @param partner U_j
    /// @param column η
    public void accumulate(CovarianceArray g, int i, int j, FieldMatrix<Complex> partner, int column) {
        for (int t = 0; t < trials; t++) {
            FieldMatrix<Complex> c = g.get(t, i, j);
            for (int r = 0; r < dimension; r++) {
                double re = 0.0;
                double im = 0.0;
                for (int x = 0; x < dimension; x++) {
                    Complex a = c.getEntry(r, x);
                    Complex u = partner.getEntry(x, column);
                    re += a.getReal() * u.getReal() - a.getImaginary() * u.getImaginary();
                    im += a.getReal() * u.getImaginary() + a.getImaginary() * u.getReal();
                }
                projectionsRe[r][t] = re;
                projectionsIm[r][t] = im;
            }
        }
        for (int r = 0; r < dimension; r++) {
            for (int c = 0; c < dimension; c++) {
                double re = 0.0;
                double im = 0.0;
                for (int t = 0; t < trials; t++) {
                    // Ω[r,t] * conj(Ω[c,t])
                    re += projectionsRe[r][t] * projectionsRe[c][t] + projectionsIm[r][t] * projectionsIm[c][t];
                    im += projectionsIm[r][t] * projectionsRe[c][t] - projectionsRe[r][t] * projectionsIm[c][t];
                }
                accumulatorRe[r][c] += re;
                accumulatorIm[r][c] += im;
            }
        }
    }

    /// Power-iteration step: returns R · (column `column` of `target`).
    public Complex[] applyAccumulator(FieldMatrix<Complex> target, int column) {
        Complex[] out = new Complex[dimension];
        for (int r = 0; r < dimension; r++) {
            double re = 0.0;
            double im = 0.0;
            for (int x = 0; x < dimension; x++) {
                Complex u = target.getEntry(x, column);
                re += accumulatorRe[r][x] * u.getReal() - accumulatorIm[r][x] * u.getImaginary();
                im += accumulatorRe[r][x] * u.getImaginary() + accumulatorIm[r][x] * u.getReal();
            }
            out[r] = new Complex(re, im);
        }
        return out;
    }
}
