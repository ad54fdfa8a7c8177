package com.blueprintarchitect.cli;

import com.blueprintarchitect.BlueprintArchitectCLI;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Runs the CLI in-process and captures what it prints.
 */
final class CommandTestSupport {

    static final String VALID_BLUEPRINT = """
        schema_version: "1.0.0"
        system:
          name: order_service
          description: REST api that stores incoming orders
          version: "1.2.0"
          components:
            - name: order_api
              type: APIEndpoint
              inputs:
                - name: request
                  schema: OrderSchema
                  boundary_ingress: true
                  reply_required: true
              outputs:
                - name: response
                  schema: OrderSchema
                  boundary_egress: true
                  satisfies_reply: true
            - name: order_validator
              type: Transformer
              inputs:
                - name: input
                  schema: OrderSchema
              outputs:
                - name: output
                  schema: OrderSchema
            - name: orders_db
              type: Store
              inputs:
                - name: input
                  schema: OrderSchema
          bindings:
            - from_component: order_api
              from_port: response
              to_components: [order_validator]
              to_ports: [input]
            - from_component: order_validator
              from_port: output
              to_components: [orders_db]
              to_ports: [input]
          policy:
            security:
              authentication_required: true
        """;

    static final String UNBOUND_BLUEPRINT = """
        schema_version: "1.0.0"
        system:
          name: click_capture
          components:
            - name: clicks
              type: Source
            - name: click_db
              type: Store
        """;

    static final String CONTRADICTORY_BLUEPRINT = """
        schema_version: "1.0.0"
        system:
          name: contradictory_flow
          components:
            - name: ingest
              type: Source
            - name: final_step
              type: Transformer
              terminal_hint: true
              inputs:
                - name: input
                  schema: ItemSchema
              outputs:
                - name: output
                  schema: ItemSchema
          bindings:
            - from_component: ingest
              from_port: output
              to_components: [final_step]
              to_ports: [input]
        """;

    static final String BROKEN_BLUEPRINT = """
        system:
          name: Broken-System
          components:
            - name: Ingest
              type: Source
        """;

    private CommandTestSupport() {
    }

    /**
     * Result of one in-process run.
     *
     * @param exitCode exit code
     * @param out captured standard output
     * @param err captured standard error
     */
    record Run(int exitCode, String out, String err) {}

    static Run run(String... args) {
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            int exitCode = BlueprintArchitectCLI.commandLine().execute(args);
            return new Run(exitCode, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }
}
