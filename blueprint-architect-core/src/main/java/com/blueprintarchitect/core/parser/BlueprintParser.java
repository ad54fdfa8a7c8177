package com.blueprintarchitect.core.parser;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Turns a raw document into a typed {@link com.blueprintarchitect.core.model.SystemBlueprint}.
 *
 * <p>Implementations check field shapes and apply defaults. They never throw for a
 * malformed document; problems are returned in the {@link ParseResult}.
 */
public interface BlueprintParser {

    /**
     * Parses a raw document.
     *
     * @param document raw document root
     * @return typed blueprint or structural errors
     */
    ParseResult parse(JsonNode document);
}
