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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.mars.tast.compiler.plan.PlanInput;
import dev.mars.tast.compiler.plan.Plan;
import dev.mars.tast.compiler.plan.PlanStep;
import dev.mars.tast.compiler.plan.PlanStepEntry;
import dev.mars.tast.core.LiteralValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Renders plans with Jackson (JSON), SnakeYAML (YAML) and plain string building
 * (Markdown, JUnit XML). YAML is dumped from the same map projection Jackson produces, so
 * both formats share field names and ordering.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-09-09
 * @version 1.0
 */
public class DefaultPlanRenderer implements PlanRenderer {

    private static final Logger logger = LoggerFactory.getLogger(DefaultPlanRenderer.class);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Yaml yaml;

    public DefaultPlanRenderer() {
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        options.setIndicatorIndent(0);
        options.setPrettyFlow(true);
        this.yaml = new Yaml(options);
    }

    @Override
    public String toYaml(Plan plan) throws RenderException {
        Objects.requireNonNull(plan, "Plan cannot be null");
        try {
            Map<String, Object> projection = objectMapper.convertValue(plan, MAP_TYPE);
            String rendered = yaml.dump(projection);
            logger.debug("Rendered plan '{}' as YAML ({} chars)", plan.getName(), rendered.length());
            return rendered;
        } catch (IllegalArgumentException | YAMLException e) {
            throw new RenderException("YAML", e);
        }
    }

    @Override
    public String toJson(Plan plan) throws RenderException {
        Objects.requireNonNull(plan, "Plan cannot be null");
        try {
            String rendered = objectMapper.writeValueAsString(plan);
            logger.debug("Rendered plan '{}' as JSON ({} chars)", plan.getName(), rendered.length());
            return rendered;
        } catch (JsonProcessingException e) {
            throw new RenderException("JSON", e);
        }
    }

    @Override
    public String toMarkdown(Plan plan) {
        Objects.requireNonNull(plan, "Plan cannot be null");
        StringBuilder out = new StringBuilder();
        out.append("# Test Plan: ").append(plan.getName()).append("\n\n");
        out.append("**Traversal:** ").append(plan.getTraversal())
                .append(" | **Nodes:** ").append(plan.getNodesTotal())
                .append(" | **Edges:** ").append(plan.getEdgesTotal()).append('\n');

        if (!plan.getConfig().isEmpty()) {
            out.append("\n**Config:** ").append(renderData(plan.getConfig())).append('\n');
        }

        for (PlanStep step : plan.getSteps()) {
            out.append("\n---\n\n");
            appendStep(out, step);
        }
        return out.toString();
    }

    @Override
    public String toJunitXml(Plan plan) {
        Objects.requireNonNull(plan, "Plan cannot be null");
        String name = escapeXml(plan.getName());
        int tests = plan.getSteps().size();
        StringBuilder out = new StringBuilder();
        out.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        out.append("<testsuites name=\"").append(name).append("\" tests=\"").append(tests).append("\" time=\"0\">\n");
        out.append("  <testsuite name=\"").append(name).append("\" tests=\"").append(tests).append("\" time=\"0\">\n");

        for (PlanStep step : plan.getSteps()) {
            out.append("    <testcase name=\"").append(escapeXml(step.getNode()))
                    .append("\" classname=\"").append(name).append("\">\n");
            List<PlanStepEntry> entries = new ArrayList<>(step.getPreconditions());
            entries.addAll(step.getActions());
            entries.addAll(step.getAssertions());
            if (!entries.isEmpty()) {
                out.append("      <system-out>\n");
                for (PlanStepEntry entry : entries) {
                    out.append("        ").append(escapeXml(capitalize(entry.getKeyword()) + " " + entry.getText()))
                            .append('\n');
                }
                out.append("      </system-out>\n");
            }
            out.append("    </testcase>\n");
        }

        out.append("  </testsuite>\n");
        out.append("</testsuites>\n");
        logger.debug("Rendered plan '{}' as JUnit XML with {} test case(s)", plan.getName(), tests);
        return out.toString();
    }

    private void appendStep(StringBuilder out, PlanStep step) {
        out.append("## Step ").append(step.getOrder()).append(": ").append(step.getNode()).append("\n\n");
        if (step.getDescription() != null) {
            out.append("> ").append(step.getDescription()).append("\n\n");
        }
        if (!step.getTags().isEmpty()) {
            List<String> tags = new ArrayList<>();
            for (String tag : step.getTags()) {
                tags.add("`" + tag + "`");
            }
            out.append("**Tags:** ").append(String.join(", ", tags)).append("\n\n");
        }
        if (!step.getDependsOn().isEmpty()) {
            out.append("**Depends on:** ").append(String.join(", ", step.getDependsOn())).append("\n\n");
        }

        appendEntries(out, "Preconditions", step.getPreconditions());
        appendEntries(out, "Actions", step.getActions());
        appendEntries(out, "Assertions", step.getAssertions());

        if (!step.getInputs().isEmpty() || !step.getOutputs().isEmpty()) {
            out.append("### Data Flow\n");
            if (!step.getInputs().isEmpty()) {
                List<String> inputs = new ArrayList<>();
                for (Map.Entry<String, PlanInput> input : step.getInputs().entrySet()) {
                    inputs.add(input.getKey() + " (" + input.getValue().getSource() + ")");
                }
                out.append("- **Inputs:** ").append(String.join(", ", inputs)).append('\n');
            }
            if (!step.getOutputs().isEmpty()) {
                out.append("- **Outputs:** ").append(String.join(", ", step.getOutputs().keySet())).append('\n');
            }
            out.append('\n');
        }
    }

    private void appendEntries(StringBuilder out, String title, List<PlanStepEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }
        out.append("### ").append(title).append('\n');
        for (PlanStepEntry entry : entries) {
            out.append("- **").append(capitalize(entry.getKeyword())).append("** ").append(entry.getText()).append('\n');
            for (Map.Entry<String, LiteralValue> data : entry.getData().entrySet()) {
                out.append("  - `").append(data.getKey()).append("`: ").append(data.getValue()).append('\n');
            }
        }
        out.append('\n');
    }

    private static String capitalize(String word) {
        return word.isEmpty() ? word : Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }

    static String escapeXml(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&':
                    escaped.append("&amp;");
                    break;
                case '<':
                    escaped.append("&lt;");
                    break;
                case '>':
                    escaped.append("&gt;");
                    break;
                case '"':
                    escaped.append("&quot;");
                    break;
                case '\'':
                    escaped.append("&apos;");
                    break;
                default:
                    escaped.append(c);
            }
        }
        return escaped.toString();
    }

    private static String renderData(Map<String, LiteralValue> data) {
        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, LiteralValue> entry : data.entrySet()) {
            parts.add("`" + entry.getKey() + "` = " + entry.getValue());
        }
        return String.join(", ", parts);
    }
}
