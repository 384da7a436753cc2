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

/// Terminal state of the OJoB iteration loop.
public enum SolverOutcome {
    /// The relative change of the sweep metric fell to or below the tolerance.
    CONVERGED,
    /// The sweep metric became non-finite; the current solution is returned.
    DIVERGED,
    /// The iteration cap was reached first; the best-so-far solution is returned.
    MAX_ITER_REACHED
}
