/**
 * In-memory instances of described types.
 * <p>
 * Aggregates and arrays are mutable containers ({@link works.delta.instances.StructInstance},
 * {@link works.delta.instances.ArrayInstance}) so that deserialization can overlay
 * values onto an existing destination. Scalars and bitfield words are immutable boxed values.
 */
package works.delta.instances;
