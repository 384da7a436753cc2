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

import io.nosqlbench.jointdiag.linalg.ComplexMatrices;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.FieldMatrix;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Three-index collection of covariance and cross-covariance matrices.
///
/// ## Layout
///
/// ```text
///   trial κ ∈ [0, k)     group pair (i, j) ∈ [0, m) × [0, m)
///
///              j=0        j=1        ...
///   i=0   [ C(κ,0,0)   C(κ,0,1)   ... ]     C(κ,i,j) is n_i × n_j
///   i=1   [ C(κ,1,0)   C(κ,1,1)   ... ]     C(κ,j,i) = C(κ,i,j)^H
///   ...
/// ```
///
/// Within-group entries C(κ,i,i) are Hermitian and, for well-formed input,
/// positive semi-definite. That is the caller's contract; it is not
/// re-validated here.
///
/// ## Shapes
///
/// - m = 1, k ≥ 3: approximate joint diagonalization of k matrices
/// - m > 1, k = 1: one trial, m groups
/// - m > 1, k > 1: k trials of m groups
///
/// Instances are immutable once built. [#map(EntryMapper)] returns a
/// transformed copy.
public final class CovarianceArray {

    private final int trials;
    private final int groups;
    private final FieldMatrix<Complex>[][][] entries;
    private final boolean real;

    private CovarianceArray(int trials, int groups, FieldMatrix<Complex>[][][] entries) {
        this.trials = trials;
        this.groups = groups;
        this.entries = entries;
        this.real = scanReal(entries);
    }

    /// Starts a builder for k trials of m groups.
    public static Builder builder(int trials, int groups) {
        return new Builder(trials, groups);
    }

    /// One group, one covariance matrix per trial.
    public static CovarianceArray singleGroup(List<FieldMatrix<Complex>> trialCovariances) {
        Builder builder = builder(trialCovariances.size(), 1);
        for (int t = 0; t < trialCovariances.size(); t++) {
            builder.set(t, 0, 0, trialCovariances.get(t));
        }
        return builder.build();
    }

    /// One trial, full m × m block of (cross-)covariances.
    ///
    /// Only the upper triangle including the diagonal is read; the lower
    /// triangle is filled with conjugate transposes.
    public static CovarianceArray singleTrial(FieldMatrix<Complex>[][] blocks) {
        int m = blocks.length;
        Builder builder = builder(1, m);
        for (int i = 0; i < m; i++) {
            for (int j = i; j < m; j++) {
                builder.set(0, i, j, blocks[i][j]);
            }
        }
        return builder.build();
    }

    /// Convenience for real single-group input.
    public static CovarianceArray ofRealTrials(double[][]... trialCovariances) {
        List<FieldMatrix<Complex>> list = new ArrayList<>(trialCovariances.length);
        for (double[][] c : trialCovariances) {
            list.add(ComplexMatrices.fromReal(c));
        }
        return singleGroup(list);
    }

    /// Number of trials, k.
    public int trials() {
        return trials;
    }

    /// Number of groups, m.
    public int groups() {
        return groups;
    }

    /// Dimension n_i of group i.
    public int groupDimension(int group) {
        return entries[0][group][group].getRowDimension();
    }

    /// True when every group has the same dimension.
    public boolean hasCommonDimension() {
        for (int i = 1; i < groups; i++) {
            if (groupDimension(i) != groupDimension(0)) {
                return false;
            }
        }
        return true;
    }

    /// True when no entry carries an imaginary part.
    public boolean isReal() {
        return real;
    }

    /// Entry C(trial, i, j). The returned matrix is shared; do not mutate it.
    public FieldMatrix<Complex> get(int trial, int i, int j) {
        return entries[trial][i][j];
    }

    /// Mean over trials of C(κ, i, j).
    public FieldMatrix<Complex> trialMean(int i, int j) {
        List<FieldMatrix<Complex>> list = new ArrayList<>(trials);
        for (int t = 0; t < trials; t++) {
            list.add(entries[t][i][j]);
        }
        return ComplexMatrices.mean(list);
    }

    /// Mean over trials and groups of the within-group covariances.
    ///
    /// @throws IllegalStateException if the groups differ in dimension
    public FieldMatrix<Complex> grandWithinGroupMean() {
        if (!hasCommonDimension()) {
            throw new IllegalStateException("groups differ in dimension; no grand mean exists");
        }
        List<FieldMatrix<Complex>> list = new ArrayList<>(trials * groups);
        for (int t = 0; t < trials; t++) {
            for (int i = 0; i < groups; i++) {
                list.add(entries[t][i][i]);
            }
        }
        return ComplexMatrices.mean(list);
    }

    /// Returns a copy with every entry replaced by `mapper`.
    ///
    /// The mapper is applied to the upper triangle i ≤ j; the lower triangle
    /// is the conjugate transpose, so the Hermitian layout is preserved.
    public CovarianceArray map(EntryMapper mapper) {
        Builder builder = builder(trials, groups);
        for (int t = 0; t < trials; t++) {
            for (int i = 0; i < groups; i++) {
                for (int j = i; j < groups; j++) {
                    builder.set(t, i, j, mapper.apply(t, i, j, entries[t][i][j]));
                }
            }
        }
        return builder.build();
    }

    private static boolean scanReal(FieldMatrix<Complex>[][][] entries) {
        for (FieldMatrix<Complex>[][] trial : entries) {
            for (FieldMatrix<Complex>[] row : trial) {
                for (FieldMatrix<Complex> entry : row) {
                    if (!ComplexMatrices.isReal(entry)) {
                        return false;
                    }
                }
            }
        }
        return true;
    }

    /// Transformation of a single entry, used by [#map(EntryMapper)].
    @FunctionalInterface
    public interface EntryMapper {
        FieldMatrix<Complex> apply(int trial, int i, int j, FieldMatrix<Complex> entry);
    }

    /// Builder for [CovarianceArray].
    public static final class Builder {
        private final int trials;
        private final int groups;
        private final FieldMatrix<Complex>[][][] entries;

        @SuppressWarnings("unchecked")
        private Builder(int trials, int groups) {
            if (trials < 1 || groups < 1) {
                throw new IllegalArgumentException("trials and groups must be at least 1, got k="
                    + trials + ", m=" + groups);
            }
            this.trials = trials;
            this.groups = groups;
            this.entries = new FieldMatrix[trials][groups][groups];
        }

        /// Sets C(trial, i, j) and, for i ≠ j, C(trial, j, i) = C^H.
        public Builder set(int trial, int i, int j, FieldMatrix<Complex> covariance) {
            Objects.requireNonNull(covariance, "covariance");
            entries[trial][i][j] = covariance;
            if (i != j) {
                entries[trial][j][i] = ComplexMatrices.conjugateTranspose(covariance);
            }
            return this;
        }

        /// Validates presence and shapes, then freezes the array.
        public CovarianceArray build() {
            for (int t = 0; t < trials; t++) {
                for (int i = 0; i < groups; i++) {
                    for (int j = 0; j < groups; j++) {
                        if (entries[t][i][j] == null) {
                            throw new IllegalArgumentException("missing entry (trial=" + t
                                + ", i=" + i + ", j=" + j + ")");
                        }
                    }
                }
            }
            int[] dims = new int[groups];
            for (int i = 0; i < groups; i++) {
                FieldMatrix<Complex> c = entries[0][i][i];
                if (!c.isSquare()) {
                    throw new IllegalArgumentException("within-group covariance of group " + i
                        + " is not square");
                }
                dims[i] = c.getRowDimension();
            }
            for (int t = 0; t < trials; t++) {
                for (int i = 0; i < groups; i++) {
                    for (int j = 0; j < groups; j++) {
                        FieldMatrix<Complex> c = entries[t][i][j];
                        if (c.getRowDimension() != dims[i] || c.getColumnDimension() != dims[j]) {
                            throw new IllegalArgumentException("entry (trial=" + t + ", i=" + i
                                + ", j=" + j + ") is " + c.getRowDimension() + "x"
                                + c.getColumnDimension() + ", expected " + dims[i] + "x" + dims[j]);
                        }
                    }
                }
            }
            FieldMatrix<Complex>[][][] frozen = entries.clone();
            for (int t = 0; t < trials; t++) {
                frozen[t] = entries[t].clone();
                for (int i = 0; i < groups; i++) {
                    frozen[t][i] = entries[t][i].clone();
                }
            }
            return new CovarianceArray(trials, groups, frozen);
        }
    }
}
