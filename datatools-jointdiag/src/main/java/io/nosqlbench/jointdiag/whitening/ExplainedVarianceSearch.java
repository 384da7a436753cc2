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

/// Search over the accumulated normalized eigenvalue sequence.
///
/// Both strategies return a subspace size p in [1, n] (1-based count of
/// retained eigen-directions).
public enum ExplainedVarianceSearch {

    /// First position whose accumulated value is at or above the target.
    FIRST_AT_OR_ABOVE {
        @Override
        public int search(double[] accumulated, double target) {
            for (int i = 0; i < accumulated.length; i++) {
                if (accumulated[i] >= target) {
                    return i + 1;
                }
            }
            return accumulated.length;
        }
    },

    /// Last position whose accumulated value is at or below the target.
    LAST_AT_OR_BELOW {
        @Override
        public int search(double[] accumulated, double target) {
            int p = 1;
            for (int i = 0; i < accumulated.length; i++) {
                if (accumulated[i] <= target) {
                    p = i + 1;
                }
            }
            return p;
        }
    };

    /// Finds p for `target` on `accumulated`.
    public abstract int search(double[] accumulated, double target);

    /// Accumulated eigenvalues normalized to unit sum.
    ///
    /// @param descending eigenvalues in descending order
    /// @return the running sum of `descending / sum(descending)`
    public static double[] accumulate(double[] descending) {
        double total = 0.0;
        for (double v : descending) {
            total += v;
        }
        double[] acc = new double[descending.length];
        double running = 0.0;
        for (int i = 0; i < descending.length; i++) {
            running += descending[i] / total;
            acc[i] = running;
        }
        return acc;
    }
}
