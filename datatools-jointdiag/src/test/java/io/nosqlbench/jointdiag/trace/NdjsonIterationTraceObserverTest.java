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

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.nosqlbench.jointdiag.TestMatrices;
import io.nosqlbench.jointdiag.covariance.CovarianceArray;
import io.nosqlbench.jointdiag.solver.DiagonalizationResult;
import io.nosqlbench.jointdiag.solver.JointDiagonalizer;
import io.nosqlbench.jointdiag.solver.OJoBOptions;
import io.nosqlbench.jointdiag.solver.SolverOutcome;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
class NdjsonIterationTraceObserverTest {

    @TempDir
    Path tempDir;

    @Test
    void writesOneLinePerEvent() {
        StringWriter out = new StringWriter();
        NdjsonIterationTraceObserver observer = new NdjsonIterationTraceObserver(out);
        observer.onStart(2, 10, 5);
        observer.onIteration(1, 3.5, 1.0);
        observer.onComplete(SolverOutcome.MAX_ITER_REACHED, 1, 1.0);

        String[] lines = out.toString().split("\\R");
        assertEquals(3, lines.length);
        JsonObject start = JsonParser.parseString(lines[0]).getAsJsonObject();
        assertEquals("solve_start", start.get("event").getAsString());
        assertEquals(5, start.get("dimension").getAsInt());
        JsonObject iteration = JsonParser.parseString(lines[1]).getAsJsonObject();
        assertEquals(3.5, iteration.get("metric").getAsDouble());
        JsonObject complete = JsonParser.parseString(lines[2]).getAsJsonObject();
        assertEquals("MAX_ITER_REACHED", complete.get("outcome").getAsString());
        assertTrue(lines[0].startsWith("{\"event\":\"solve_start\""));
    }

    @Test
    void traceFileHasOneIterationLinePerSweep() throws IOException {
        Path trace = tempDir.resolve("ojob.ndjson");
        CovarianceArray c = TestMatrices.randomArray(new Random(700), 4, 2, 3, 20, false);
        DiagonalizationResult result;
        try (NdjsonIterationTraceObserver observer = new NdjsonIterationTraceObserver(trace)) {
            result = JointDiagonalizer.ojob(c, OJoBOptions.builder().observer(observer).build());
        }

        List<String> lines = Files.readAllLines(trace);
        long iterations = lines.stream().filter(l -> l.contains("\"event\":\"iteration\"")).count();
        assertEquals(result.iterations(), iterations);
        assertEquals(result.iterations() + 2, lines.size());
        assertTrue(lines.get(lines.size() - 1).contains(result.outcome().name()));
    }

    @Test
    void nonFiniteConvergenceIsStillWritten() {
        StringWriter out = new StringWriter();
        new NdjsonIterationTraceObserver(out).onIteration(2, 0.0, Double.NaN);
        assertTrue(out.toString().contains("NaN"));
    }

    @Test
    void composeForwardsToBoth() {
        StringWriter first = new StringWriter();
        StringWriter second = new StringWriter();
        IterationObserver both = IterationObserver.compose(
            new NdjsonIterationTraceObserver(first), new NdjsonIterationTraceObserver(second));
        both.onIteration(1, 1.0, 1.0);
        assertTrue(first.toString().contains("\"event\":\"iteration\""));
        assertTrue(second.toString().contains("\"event\":\"iteration\""));
        assertSame(IterationObserver.NOOP, IterationObserver.compose(IterationObserver.NOOP, IterationObserver.NOOP));
    }
}
