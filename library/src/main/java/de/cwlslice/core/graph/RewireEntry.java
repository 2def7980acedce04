package de.cwlslice.core.graph;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Synthetic top-level input replacing a dangling dependency.
 */
public record RewireEntry(String id, JsonNode type) {}
