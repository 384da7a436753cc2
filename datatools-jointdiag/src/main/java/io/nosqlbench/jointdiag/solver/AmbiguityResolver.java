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
import io.nosqlbench.jointdiag.linalg.ComplexMatrices;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;

import java.util.List;

/// Fixes the sign and column-order ambiguity of an OJoB solution.
///
/// The objective is invariant to a joint permutation of the columns of all
/// U_i and, per group, to a sign (phase, for complex data) of each column.
/// Resolution picks a canonical representative.
///
/// ## Single group (m = 1)
///
/// D = mean_κ diag(U^H G(κ) U). For each position e, the remaining column with
/// the largest |D[η]| is swapped into e. Signs are left untouched. The
/// returned diagonal is in non-increasing order of magnitude.
///
/// ## Multiple groups (m > 1)
///
/// D_ij = mean_κ diag(U_i^H G(κ,i,j) U_j) for every ordered pair i ≠ j.
/// For each position e:
///
/// 1. find the largest |D_ij[η]| over pairs i < j and columns η ≥ e
/// 2. align column η of U_j so that D_ij[η] becomes non-negative
/// 3. align column η of every other group x so that D_ix[η] becomes non-negative
/// 4. swap column η into position e in every group
/// 5. recompute all D_ij
///
/// The returned sequence is the mean over ordered pairs i ≠ j of D_ij.
///
/// Alignment multiplies a column by conj(d)/|d|. For real data this is the
/// sign flip, applied only when d is negative; for complex data any phase
/// away from the positive real axis is removed.
///
/// Ties go to the first maximum in scan order (pairs by ascending i then j,
/// then ascending η); a position whose remaining entries are all zero is
/// left in place.
public final class AmbiguityResolver {

    private AmbiguityResolver() {
        // Utility class
    }

    /// Single-group resolution, reordering the columns of `u` in place.
    ///
    /// @return the trial-averaged diagonal in the resolved order
    public static Complex[] resolveSingleGroup(FieldMatrix<Complex> u, CovarianceArray g) {
        Complex[] d = pairDiagonal(u, u, g, 0, 0);
        int n = d.length;
        for (int e = 0; e < n; e++) {
            int best = e;
            double max = 0.0;
            for (int eta = e; eta < n; eta++) {
                double abs = d[eta].abs();
                if (abs > max) {
                    max = abs;
                    best = eta;
                }
            }
            if (best != e) {
                ComplexMatrices.swapColumns(u, best, e);
                Complex tmp = d[best];
                d[best] = d[e];
                d[e] = tmp;
            }
        }
        return d;
    }

    /// Multi-group resolution, aligning and reordering the columns of every
    /// U_i in place.
    ///
    /// @return the mean over ordered pairs i ≠ j of the resolved diagonals
    public static Complex[] resolveMultiGroup(List<FieldMatrix<Complex>> us, CovarianceArray g) {
        int m = us.size();
        int n = us.get(0).getColumnDimension();
        boolean real = g.isReal();
        Complex[][][] d = pairDiagonals(us, g);

        for (int e = 0; e < n; e++) {
            int bestI = -1;
            int bestJ = -1;
            int bestEta = -1;
            double max = 0.0;
            for (int i = 0; i < m - 1; i++) {
                for (int j = i + 1; j < m; j++) {
                    for (int eta = e; eta < n; eta++) {
                        double abs = d[i][j][eta].abs();
                        if (abs > max) {
                            max = abs;
                            bestI = i;
                            bestJ = j;
                            bestEta = eta;
                        }
                    }
                }
            }
            if (bestEta < 0) {
                continue;
            }

            Complex phase = alignment(d[bestI][bestJ][bestEta], real);
            if (phase != null) {
                ComplexMatrices.scaleColumn(us.get(bestJ), bestEta, phase);
            }
            // D_{i*,x} does not depend on U_{j*}, so the pre-flip values still apply
            for (int x = 0; x < m; x++) {
                if (x == bestI || x == bestJ) {
                    continue;
                }
                Complex partnerPhase = alignment(d[bestI][x][bestEta], real);
                if (partnerPhase != null) {
                    ComplexMatrices.scaleColumn(us.get(x), bestEta, partnerPhase);
                }
            }
            for (FieldMatrix<Complex> u : us) {
                ComplexMatrices.swapColumns(u, bestEta, e);
            }
            d = pairDiagonals(us, g);
        }
        return meanOverPairs(d, m, n);
    }

    /// Trial-averaged diagonals without any resolution, for `sort = false`.
    public static Complex[] unsortedAverages(List<FieldMatrix<Complex>> us, CovarianceArray g) {
        if (us.size() == 1) {
            return pairDiagonal(us.get(0), us.get(0), g, 0, 0);
        }
        return meanOverPairs(pairDiagonals(us, g), us.size(), us.get(0).getColumnDimension());
    }

    /// Factor turning `d` into a non-negative real, or `null` when none is needed.
    static Complex alignment(Complex d, boolean real) {
        if (real) {
            return d.getReal() < 0.0 ? new Complex(-1.0, 0.0) : null;
        }
        double abs = d.abs();
        if (abs == 0.0 || (d.getImaginary() == 0.0 && d.getReal() >= 0.0)) {
            return null;
        }
        return d.conjugate().divide(abs);
    }

    /// D_ij for every ordered pair i ≠ j; diagonal slots stay null.
    private static Complex[][][] pairDiagonals(List<FieldMatrix<Complex>> us, CovarianceArray g) {
        int m = us.size();
        Complex[][][] d = new Complex[m][m][];
        for (int i = 0; i < m; i++) {
            for (int j = 0; j < m; j++) {
                if (i != j) {
                    d[i][j] = pairDiagonal(us.get(i), us.get(j), g, i, j);
                }
            }
        }
        return d;
    }

    /// mean_κ of u_i[:,η]^H · G(κ,i,j) · u_j[:,η] for every η.
    private static Complex[] pairDiagonal(FieldMatrix<Complex> ui, FieldMatrix<Complex> uj,
                                          CovarianceArray g, int i, int j) {
        int n = ui.getColumnDimension();
        int k = g.trials();
        Complex[] d = new Complex[n];
        for (int eta = 0; eta < n; eta++) {
            Complex[] left = ui.getColumn(eta);
            Complex[] right = uj.getColumn(eta);
            Complex sum = Complex.ZERO;
            for (int t = 0; t < k; t++) {
                Complex[] cu = g.get(t, i, j).operate(right);
                for (int r = 0; r < left.length; r++) {
                    sum = sum.add(left[r].conjugate().multiply(cu[r]));
                }
            }
            d[eta] = sum.divide(k);
        }
        return d;
    }

    private static Complex[] meanOverPairs(Complex[][][] d, int m, int n) {
        Complex[] mean = new Complex[n];
        int pairs = m * (m - 1);
        for (int eta = 0; eta < n; eta++) {
            Complex sum = Complex.ZERO;
            for (int i = 0; i < m; i++) {
                for (int j = 0; j < m; j++) {
                    if (i != j) {
                        sum = sum.add(d[i][j][eta]);
                    }
                }
            }
            mean[eta] = sum.divide(pairs);
        }
        return mean;
    }
}
