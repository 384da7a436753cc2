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
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import org.apache.commons.math3.complex.Complex;

import java.io.IOException;

/// Centralized Gson configuration for traces and result summaries.
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | [#gson()] only | Human-readable summaries |
/// | HTML escaping | Disabled | Cleaner numeric output |
/// | Special floats | Allowed | NaN convergence values survive |
/// | [Complex] adapter | Registered | `{"re":1.0,"im":0.0}` |
///
/// ## Thread Safety
///
/// The [Gson] instances are thread-safe and shared.
public final class JointDiagGsonConfig {

    private static final Gson INSTANCE = builder().setPrettyPrinting().create();
    private static final Gson COMPACT = builder().create();

    private JointDiagGsonConfig() {
        // Utility class
    }

    /// Returns the shared pretty-printing Gson instance.
    public static Gson gson() {
        return INSTANCE;
    }

    /// Returns the shared compact Gson instance, one record per line.
    public static Gson compactGson() {
        return COMPACT;
    }

    /// Creates a new GsonBuilder with the joint diagonalization defaults.
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .registerTypeAdapter(Complex.class, new ComplexTypeAdapter());
    }

    /// Writes [Complex] values as `{"re":…,"im":…}`.
    static final class ComplexTypeAdapter extends TypeAdapter<Complex> {

        @Override
        public void write(JsonWriter out, Complex value) throws IOException {
            if (value == null) {
                out.nullValue();
                return;
            }
            out.beginObject();
            out.name("re").value(value.getReal());
            out.name("im").value(value.getImaginary());
            out.endObject();
        }

        @Override
        public Complex read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            double re = 0.0;
            double im = 0.0;
            in.beginObject();
            while (in.hasNext()) {
                String name = in.nextName();
                switch (name) {
                    case "re" -> re = in.nextDouble();
                    case "im" -> im = in.nextDouble();
                    default -> in.skipValue();
                }
            }
            in.endObject();
            return new Complex(re, im);
        }
    }
}
