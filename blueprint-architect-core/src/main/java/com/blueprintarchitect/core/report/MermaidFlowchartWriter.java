package com.blueprintarchitect.core.report;

import com.blueprintarchitect.core.model.Binding;
import com.blueprintarchitect.core.model.Component;
import com.blueprintarchitect.core.model.SystemBlueprint;

/**
 * Renders a blueprint as a Mermaid flowchart wrapped in a Markdown code block.
 *
 * <p>Node shapes follow the component role: origins are stadiums, storage is a
 * cylinder, endpoints are hexagons, controllers are diamonds, sinks are flags and
 * everything else a rectangle. Transformations label their edge; conditional
 * bindings are dotted.
 *
 * <p><b>Example output:</b>
 * <pre>
 * flowchart LR
 *   ingest(["ingest&lt;br/&gt;Source"])
 *   orders_db[("orders_db&lt;br/&gt;Store")]
 *   ingest -->|convert_a_to_b| orders_db
 * </pre>
 */
public class MermaidFlowchartWriter {

    private static final String NEWLINE = "\n";
    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";
    private static final String FLOWCHART_LR = "flowchart LR\n";
    private static final String ID_SANITIZATION_PATTERN = "[^a-zA-Z0-9_]";

    /**
     * Renders the blueprint.
     *
     * @param blueprint typed blueprint
     * @return Markdown with a Mermaid flowchart
     */
    public String write(SystemBlueprint blueprint) {
        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(blueprint.name()).append(NEWLINE.repeat(2));
        if (blueprint.description() != null) {
            sb.append(blueprint.description()).append(NEWLINE.repeat(2));
        }
        sb.append(CODE_BLOCK_START).append(FLOWCHART_LR);

        for (Component component : blueprint.components()) {
            sb.append("  ").append(node(component)).append(NEWLINE);
        }
        for (Binding binding : blueprint.bindings()) {
            String arrow = binding.condition() != null ? " -.-> " : " --> ";
            String label = binding.hasTransformation() ? "|" + escape(binding.transformation()) + "|" : "";
            for (Binding.Target target : binding.targets()) {
                sb.append("  ").append(sanitizeId(binding.fromComponent()))
                    .append(arrow.stripTrailing()).append(label).append(' ')
                    .append(sanitizeId(target.component())).append(NEWLINE);
            }
        }

        sb.append(CODE_BLOCK_END);
        return sb.toString();
    }

    private String node(Component component) {
        String id = sanitizeId(component.name());
        String text = "\"" + escape(component.name()) + "<br/>" + component.type().blueprintName() + "\"";
        return switch (component.type().role()) {
            case ORIGIN -> id + "([" + text + "])";
            case STORAGE -> id + "[(" + text + ")]";
            case ENDPOINT -> id + "{{" + text + "}}";
            case ORCHESTRATOR -> id + "{" + text + "}";
            case TERMINAL -> id + ">" + text + "]";
            case PROCESSOR -> id + "[" + text + "]";
        };
    }

    private String sanitizeId(String id) {
        if (id == null) {
            return "unknown";
        }
        return id.replaceAll(ID_SANITIZATION_PATTERN, "_");
    }

    private String escape(String text) {
        return text.replace("\"", "'").replace("|", "/");
    }
}
