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

package io.nosqlbench.jointdiag.trace;

import com.google.gson.Gson;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class JointDiagGsonConfigTest {

    @Test
    void complexValuesUseReImObjects() {
        Gson gson = JointDiagGsonConfig.compactGson();
        assertEquals("{\"re\":1.5,\"im\":-2.0}", gson.toJson(new Complex(1.5, -2.0)));
        assertEquals(new Complex(1.5, -2.0), gson.fromJson("{\"im\":-2.0,\"re\":1.5,\"unit\":\"x\"}", Complex.class));
    }

    @Test
    void complexArraysInsideMapsAreWritten() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("lambda", new Complex[]{new Complex(1, 0), new Complex(0, 1)});
        assertEquals("{\"lambda\":[{\"re\":1.0,\"im\":0.0},{\"re\":0.0,\"im\":1.0}]}",
            JointDiagGsonConfig.compactGson().toJson(map));
    }

    @Test
    void specialFloatsAndHtmlCharactersSurvive() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("conv", Double.POSITIVE_INFINITY);
        map.put("note", "a<b");
        assertEquals("{\"conv\":Infinity,\"note\":\"a<b\"}", JointDiagGsonConfig.compactGson().toJson(map));
    }

    @Test
    void prettyInstanceIndents() {
        assertTrue(JointDiagGsonConfig.gson().toJson(Map.of("k", 1)).contains("\n"));
    }
}
