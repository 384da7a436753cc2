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

/// Orientation of a raw data matrix: which axis indexes samples.
public enum SampleDimension {
    /// Samples are rows; a data matrix is samples × variables and is read as the
    /// plain transpose of the [#COLUMNS] layout.
    ROWS,
    /// Samples are columns; a data matrix is variables × samples.
    COLUMNS
}
