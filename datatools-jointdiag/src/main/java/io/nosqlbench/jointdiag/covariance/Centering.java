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

import org.apache.commons.math3.complex.Complex;

import java.util.Arrays;

/// Mean-removal policy applied to each group's data before estimation.
///
/// Means are returned per variable; `null` means "do not subtract".
@FunctionalInterface
public interface Centering {

    /// Returns the mean to subtract from group `group`, or `null` for none.
    ///
    /// @param group the zero-based group index
    /// @param variables the variables × samples data of one trial of the group
    /// @return one mean per variable, or `null`
    Complex[] mean(int group, Complex[][] variables);

    /// No centering; data are assumed to be zero-mean already.
    static Centering none() {
        return (group, variables) -> null;
    }

    /// Subtracts the sample mean of each variable, trial by trial.
    static Centering sampleMean() {
        return (group, variables) -> {
            Complex[] mean = new Complex[variables.length];
            for (int v = 0; v < variables.length; v++) {
                double re = 0.0;
                double im = 0.0;
                for (Complex z : variables[v]) {
                    re += z.getReal();
                    im += z.getImaginary();
                }
                int t = variables[v].length;
                mean[v] = new Complex(re / t, im / t);
            }
            return mean;
        };
    }

    /// Subtracts caller-supplied means, one vector per group.
    static Centering fixed(Complex[]... perGroup) {
        Complex[][] means = new Complex[perGroup.length][];
        for (int i = 0; i < perGroup.length; i++) {
            means[i] = Arrays.copyOf(perGroup[i], perGroup[i].length);
        }
        return (group, variables) -> {
            Complex[] mean = means[group];
            if (mean.length != variables.length) {
                throw new IllegalArgumentException("mean of group " + group + " has " + mean.length
                    + " entries, data has " + variables.length + " variables");
            }
            return mean;
        };
    }
}
