/**
 * Jackson support: {@link works.delta.jackson.JacksonValueTree} lets the engine work on
 * {@link tools.jackson.databind.JsonNode} trees, and {@link works.delta.jackson.DeltaJson}
 * goes one step further to JSON text.
 */
package works.delta.jackson;
