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


package dev.mars.tast.emit;

import dev.mars.tast.compiler.plan.Plan;

/**
 * Renders a compiled plan as text. Rendering never alters the plan.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-09
 * @version 1.0
 */
public interface PlanRenderer {

    /**
     * Block-style YAML with keys in plan order.
     */
    String toYaml(Plan plan) throws RenderException;

    /**
     * Indented JSON with the same shape as {@link #toYaml(Plan)}.
     */
    String toJson(Plan plan) throws RenderException;

    /**
     * A human-readable Markdown report.
     */
    String toMarkdown(Plan plan);

    /**
     * JUnit XML for CI dashboards. Every step becomes a test case that has not
     * run yet, with its entries listed in {@code <system-out>}.
     */
    String toJunitXml(Plan plan);
}
