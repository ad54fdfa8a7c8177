package com.blueprintarchitect.core.validation.impl;

import com.blueprintarchitect.core.config.EngineConfig.ValidationSettings;
import com.blueprintarchitect.core.graph.BlueprintGraph;
import com.blueprintarchitect.core.model.ComponentType;
import com.blueprintarchitect.core.validation.ArchitecturalPattern;
import com.blueprintarchitect.core.validation.IssueKind;
import com.blueprintarchitect.core.validation.ValidationCheck;
import com.blueprintarchitect.core.validation.ValidationContext;
import com.blueprintarchitect.core.validation.ValidationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Classifies the topology. Informational only: it never produces an error.
 *
 * <p>Thresholds come from {@link ValidationSettings}; a graph matching none of the
 * patterns yields a single warning.
 */
public class PatternClassificationCheck implements ValidationCheck {

    private static final Logger log = LoggerFactory.getLogger(PatternClassificationCheck.class);

    public static final String PATTERN_CLASSIFIED = "pattern_classified";
    public static final String UNKNOWN_PATTERN = "unknown_pattern";

    @Override
    public String getId() {
        return "pattern";
    }

    @Override
    public int getPriority() {
        return 40;
    }

    @Override
    public List<ValidationIssue> check(ValidationContext context) {
        Set<ArchitecturalPattern> patterns = classify(context.graph(), context.settings());
        log.debug("Blueprint '{}' classified as {}", context.blueprint().name(), patterns);

        if (patterns.contains(ArchitecturalPattern.UNKNOWN)) {
            return List.of(ValidationIssue.warning(IssueKind.PATTERN, UNKNOWN_PATTERN,
                    String.format("Topology matches no known pattern (%d components, %d connections)",
                        context.graph().nodeCount(), context.graph().edgeCount()))
                .withSuggestion("Restructure as a pipeline, request/response, fan-out or fan-in flow"));
        }
        String names = patterns.stream().map(ArchitecturalPattern::reportName).collect(Collectors.joining(", "));
        return List.of(ValidationIssue.info(IssueKind.PATTERN, PATTERN_CLASSIFIED,
            "Architecture classified as: " + names));
    }

    /**
     * Returns every pattern the graph matches, or {@link ArchitecturalPattern#UNKNOWN} alone.
     *
     * @param graph blueprint graph
     * @param settings thresholds
     * @return matched patterns
     */
    public static Set<ArchitecturalPattern> classify(BlueprintGraph graph, ValidationSettings settings) {
        Set<ArchitecturalPattern> patterns = EnumSet.noneOf(ArchitecturalPattern.class);
        if (graph.edgeCount() <= graph.nodeCount() + settings.pipelineEdgeSlack()) {
            patterns.add(ArchitecturalPattern.PIPELINE);
        }
        if (graph.nodes().containsValue(ComponentType.API_ENDPOINT)) {
            patterns.add(ArchitecturalPattern.REQUEST_RESPONSE);
        }
        for (String node : graph.nodes().keySet()) {
            if (graph.outDegree(node) > settings.fanOutThreshold()) {
                patterns.add(ArchitecturalPattern.FAN_OUT);
            }
            if (graph.inDegree(node) > settings.fanInThreshold()) {
                patterns.add(ArchitecturalPattern.FAN_IN);
            }
        }
        if (patterns.isEmpty()) {
            patterns.add(ArchitecturalPattern.UNKNOWN);
        }
        return patterns;
    }
}
