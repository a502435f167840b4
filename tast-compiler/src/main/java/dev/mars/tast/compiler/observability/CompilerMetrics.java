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

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the Tast compiler.
 *
 * Provides:
 * - tast.compiler.builds.active (gauge) - Builds currently in progress
 * - tast.compiler.files.parsed (counter) - Source files parsed successfully
 * - tast.compiler.files.failed (counter) - Source files rejected by the lexer or parser
 * - tast.compiler.validation.issues (counter) - Validation errors and warnings, by severity
 * - tast.compiler.plans.compiled (counter) - Plans compiled
 * - tast.compiler.plans.failed (counter) - Plan compilations that failed
 * - tast.compiler.plan.duration.seconds (histogram) - Plan compilation time
 * - tast.compiler.plan.steps (histogram) - Steps per compiled plan
 *
 * Without an OpenTelemetry SDK on the classpath every instrument is a no-op.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-08
 * @version 1.0
 */
public class CompilerMetrics {

    private static final Logger logger = LoggerFactory.getLogger(CompilerMetrics.class);
    private static final String METER_NAME = "tast-compiler";

    private static CompilerMetrics instance;

    private final LongCounter filesParsed;
    private final LongCounter filesFailed;
    private final LongCounter validationIssues;
    private final LongCounter plansCompiled;
    private final LongCounter plansFailed;

    private final DoubleHistogram planDuration;
    private final DoubleHistogram planSteps;

    private final AtomicLong activeBuilds = new AtomicLong(0);

    private static final AttributeKey<String> GRAPH_NAME_KEY = AttributeKey.stringKey("graph.name");
    private static final AttributeKey<String> TRAVERSAL_KEY = AttributeKey.stringKey("traversal");
    private static final AttributeKey<String> SEVERITY_KEY = AttributeKey.stringKey("severity");
    private static final AttributeKey<String> FAILURE_REASON_KEY = AttributeKey.stringKey("failure.reason");

    private CompilerMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        filesParsed = meter.counterBuilder("tast.compiler.files.parsed")
                .setDescription("Number of source files parsed successfully")
                .setUnit("1")
                .build();

        filesFailed = meter.counterBuilder("tast.compiler.files.failed")
                .setDescription("Number of source files rejected by the lexer or parser")
                .setUnit("1")
                .build();

        validationIssues = meter.counterBuilder("tast.compiler.validation.issues")
                .setDescription("Number of validation issues found")
                .setUnit("1")
                .build();

        plansCompiled = meter.counterBuilder("tast.compiler.plans.compiled")
                .setDescription("Number of plans compiled")
                .setUnit("1")
                .build();

        plansFailed = meter.counterBuilder("tast.compiler.plans.failed")
                .setDescription("Number of failed plan compilations")
                .setUnit("1")
                .build();

        planDuration = meter.histogramBuilder("tast.compiler.plan.duration.seconds")
                .setDescription("Plan compilation time in seconds")
                .setUnit("s")
                .build();

        planSteps = meter.histogramBuilder("tast.compiler.plan.steps")
                .setDescription("Number of steps per compiled plan")
                .setUnit("1")
                .build();

        meter.gaugeBuilder("tast.compiler.builds.active")
                .setDescription("Number of builds currently in progress")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeBuilds.get()));

        logger.debug("CompilerMetrics initialized");
    }

    /**
     * Get the singleton instance of CompilerMetrics.
     */
    public static synchronized CompilerMetrics getInstance() {
        if (instance == null) {
            instance = new CompilerMetrics();
        }
        return instance;
    }

    public void recordBuildStarted() {
        activeBuilds.incrementAndGet();
    }

    public void recordBuildFinished() {
        activeBuilds.decrementAndGet();
    }

    public long getActiveBuilds() {
        return activeBuilds.get();
    }

    public void recordFilesParsed(int count) {
        if (count > 0) {
            filesParsed.add(count);
        }
    }

    public void recordFilesFailed(int count, String failureReason) {
        if (count > 0) {
            filesFailed.add(count, Attributes.of(FAILURE_REASON_KEY,
                    failureReason != null ? failureReason : "unknown"));
        }
    }

    public void recordValidationIssues(int errors, int warnings) {
        if (errors > 0) {
            validationIssues.add(errors, Attributes.of(SEVERITY_KEY, "error"));
        }
        if (warnings > 0) {
            validationIssues.add(warnings, Attributes.of(SEVERITY_KEY, "warning"));
        }
    }

    /**
     * Record a plan compiled successfully.
     */
    public void recordPlanCompiled(String graphName, String traversal, double durationSeconds, int stepCount) {
        Attributes attrs = Attributes.builder()
                .put(GRAPH_NAME_KEY, graphName)
                .put(TRAVERSAL_KEY, traversal)
                .build();

        plansCompiled.add(1, attrs);
        planDuration.record(durationSeconds, attrs);
        planSteps.record(stepCount, attrs);
    }

    /**
     * Record a plan compilation that failed.
     */
    public void recordPlanFailed(String graphName, String traversal, String failureReason) {
        Attributes attrs = Attributes.builder()
                .put(GRAPH_NAME_KEY, graphName)
                .put(TRAVERSAL_KEY, traversal)
                .put(FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown")
                .build();

        plansFailed.add(1, attrs);
    }
}
