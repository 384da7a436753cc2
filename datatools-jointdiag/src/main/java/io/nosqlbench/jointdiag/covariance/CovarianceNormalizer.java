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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Opt-in normalization of a covariance array, run once before solving.
 *
 * <ul>
 *   <li><b>trace</b>: C(κ,i,j) is divided by &radic;(tr C(κ,i,i) &middot; tr C(κ,j,j)),
 *       so every within-group covariance ends with unit trace.</li>
 *   <li><b>weighting</b>: C(κ,i,j) is multiplied by &radic;(w(κ,i) &middot; w(κ,j)),
 *       with the weights computed on the (trace-normalized) within-group covariances.</li>
 * </ul>
 *
 * <p>The input array is never mutated; a normalized copy is returned.
 */
public final class CovarianceNormalizer {

    private static final Logger logger = LogManager.getLogger(CovarianceNormalizer.class);

    private CovarianceNormalizer() {
        // Utility class
    }

    /**
     * Applies trace normalization and/or weighting.
     *
     * @param array the covariance array
     * @param trace1 whether to normalize within-group covariances to unit trace
     * @param weighting the weighting strategy, {@link TrialWeighting#NONE} for none
     * @return the normalized array, or {@code array} itself when nothing is requested
     */
    public static CovarianceArray normalize(CovarianceArray array, boolean trace1, TrialWeighting weighting) {
        Objects.requireNonNull(array, "array");
        Objects.requireNonNull(weighting, "weighting");
        CovarianceArray result = array;
        if (trace1) {
            double[][] traces = withinGroupTraces(result);
            result = result.map((t, i, j, c) ->
                ComplexMatrices.scale(c, 1.0 / Math.sqrt(traces[t][i] * traces[t][j])));
            logger.debug("normalized {} trials x {} groups to unit trace", array.trials(), array.groups());
        }
        if (weighting != TrialWeighting.NONE) {
            CovarianceArray source = result;
            double[][] weights = new double[source.trials()][source.groups()];
            for (int t = 0; t < source.trials(); t++) {
                for (int i = 0; i < source.groups(); i++) {
                    weights[t][i] = weighting.weight(t, i, source.get(t, i, i));
                    if (!(weights[t][i] >= 0.0)) {
                        throw new IllegalArgumentException("weight of trial " + t + ", group " + i
                            + " must be non-negative, got " + weights[t][i]);
                    }
                }
            }
            result = source.map((t, i, j, c) -> ComplexMatrices.scale(c, Math.sqrt(weights[t][i] * weights[t][j])));
        }
        return result;
    }

    private static double[][] withinGroupTraces(CovarianceArray array) {
        double[][] traces = new double[array.trials()][array.groups()];
        for (int t = 0; t < array.trials(); t++) {
            for (int i = 0; i < array.groups(); i++) {
                double tr = ComplexMatrices.trace(array.get(t, i, i)).getReal();
                if (!(tr > 0.0)) {
                    throw new IllegalArgumentException("covariance of trial " + t + ", group " + i
                        + " has non-positive trace " + tr);
                }
                traces[t][i] = tr;
            }
        }
        return traces;
    }
}
