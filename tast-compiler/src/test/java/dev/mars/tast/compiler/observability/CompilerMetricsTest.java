/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.tast.compiler.observability;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Without an OpenTelemetry SDK the instruments are no-ops, so these tests cover
 * the singleton and the in-process gauge state.
 */
class CompilerMetricsTest {

    @Test
    void testSingleton() {
        assertSame(CompilerMetrics.getInstance(), CompilerMetrics.getInstance());
    }

    @Test
    void testActiveBuildsGauge() {
        CompilerMetrics metrics = CompilerMetrics.getInstance();
        long before = metrics.getActiveBuilds();

        metrics.recordBuildStarted();
        metrics.recordBuildStarted();
        assertEquals(before + 2, metrics.getActiveBuilds());

        metrics.recordBuildFinished();
        metrics.recordBuildFinished();
        assertEquals(before, metrics.getActiveBuilds());
    }

    @Test
    void testRecordingDoesNotThrow() {
        CompilerMetrics metrics = CompilerMetrics.getInstance();

        assertDoesNotThrow(() -> {
            metrics.recordFilesParsed(3);
            metrics.recordFilesParsed(0);
            metrics.recordFilesFailed(1, "parse");
            metrics.recordFilesFailed(1, null);
            metrics.recordValidationIssues(2, 1);
            metrics.recordPlanCompiled("Auth", "topological", 0.002, 4);
            metrics.recordPlanFailed("Auth", "topological", null);
        });
    }
}
