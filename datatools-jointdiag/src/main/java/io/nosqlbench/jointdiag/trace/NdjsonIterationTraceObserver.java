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

import io.nosqlbench.jointdiag.solver.SolverOutcome;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;

/// IterationObserver that writes NDJSON (newline-delimited JSON) trace files.
///
/// ## Output Format
///
/// Each line is a JSON object representing an event:
///
/// ```json
/// {"event":"solve_start","timestamp":1234567890,"groups":2,"trials":10,"dimension":10}
/// {"event":"iteration","timestamp":1234567891,"iteration":1,"metric":3.52,"convergence":1.0}
/// {"event":"solve_complete","timestamp":1234567892,"outcome":"CONVERGED","iterations":14,"convergence":8.1E-9}
/// ```
///
/// ## Thread Safety
///
/// Writes are synchronized, although a single solve calls the observer from one thread.
///
/// @see IterationObserver
public final class NdjsonIterationTraceObserver implements IterationObserver, Closeable {

    private final BufferedWriter writer;
    private final Object writeLock = new Object();

    /// Creates an NDJSON trace observer that writes to a file.
    ///
    /// @param outputPath path to write trace output
    /// @throws IOException if the file cannot be opened for writing
    public NdjsonIterationTraceObserver(Path outputPath) throws IOException {
        this.writer = Files.newBufferedWriter(outputPath,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE);
    }

    /// Creates an NDJSON trace observer that writes to a Writer.
    ///
    /// @param writer the writer to use (caller retains ownership)
    public NdjsonIterationTraceObserver(Writer writer) {
        this.writer = (writer instanceof BufferedWriter bw)
            ? bw
            : new BufferedWriter(writer);
    }

    @Override
    public void onStart(int groups, int trials, int dimension) {
        Map<String, Object> event = event("solve_start");
        event.put("groups", groups);
        event.put("trials", trials);
        event.put("dimension", dimension);
        writeEvent(event);
    }

    @Override
    public void onIteration(int iteration, double metric, double convergence) {
        Map<String, Object> event = event("iteration");
        event.put("iteration", iteration);
        event.put("metric", metric);
        event.put("convergence", convergence);
        writeEvent(event);
    }

    @Override
    public void onComplete(SolverOutcome outcome, int iterations, double convergence) {
        Map<String, Object> event = event("solve_complete");
        event.put("outcome", outcome);
        event.put("iterations", iterations);
        event.put("convergence", convergence);
        writeEvent(event);
    }

    // insertion order keeps "event" first on each line
    private static Map<String, Object> event(String name) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("event", name);
        event.put("timestamp", System.currentTimeMillis());
        return event;
    }

    private void writeEvent(Map<String, Object> event) {
        synchronized (writeLock) {
            try {
                writer.write(IterationObserver.toCompactJson(event));
                writer.newLine();
                writer.flush();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write trace event", e);
            }
        }
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
