package com.blueprintarchitect.core.parser;

import java.util.regex.Pattern;

/**
 * Field names of the raw blueprint document.
 */
public final class BlueprintFields {

    public static final String SCHEMA_VERSION = "schema_version";
    public static final String SYSTEM = "system";
    public static final String NAME = "name";
    public static final String DESCRIPTION = "description";
    public static final String VERSION = "version";
    public static final String COMPONENTS = "components";
    public static final String BINDINGS = "bindings";
    public static final String POLICY = "policy";
    public static final String SCHEMAS = "schemas";

    public static final String TYPE = "type";
    public static final String INPUTS = "inputs";
    public static final String OUTPUTS = "outputs";
    public static final String DURABLE = "durable";
    public static final String TERMINAL_HINT = "terminal_hint";
    public static final String STATEFULNESS = "statefulness";

    public static final String SCHEMA = "schema";
    public static final String REQUIRED = "required";
    public static final String BOUNDARY_INGRESS = "boundary_ingress";
    public static final String BOUNDARY_EGRESS = "boundary_egress";
    public static final String REPLY_REQUIRED = "reply_required";
    public static final String SATISFIES_REPLY = "satisfies_reply";
    public static final String DATA_CLASSIFICATION = "data_classification";

    public static final String FROM_COMPONENT = "from_component";
    public static final String FROM_PORT = "from_port";
    public static final String TO_COMPONENTS = "to_components";
    public static final String TO_PORTS = "to_ports";
    public static final String TRANSFORMATION = "transformation";
    public static final String CONDITION = "condition";

    /** Legacy and singular binding forms accepted on input. */
    public static final String FROM = "from";
    public static final String TO = "to";
    public static final String TO_COMPONENT = "to_component";
    public static final String TO_PORT = "to_port";

    /** Port names used when a binding omits them. */
    public static final String DEFAULT_OUTPUT_PORT = "output";
    public static final String DEFAULT_INPUT_PORT = "input";

    /** Schema label for ports declared without one. */
    public static final String DEFAULT_PORT_SCHEMA = "common_object_schema";

    /** System and component names. */
    public static final Pattern NAME_PATTERN = Pattern.compile("^[a-z][a-z0-9_]*$");

    private BlueprintFields() {
    }
}
