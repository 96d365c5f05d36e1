/**
 * Descriptor-driven conversion between in-memory instances and JSON value trees,
 * with diffing against a baseline on the way out and overlaying onto a baseline on the way in.
 * <p>
 * Start with a {@link works.delta.TypeRegistry} describing the types,
 * then create a {@link works.delta.DeltaCodec} over a {@link works.delta.tree.ValueTree}
 * and get a {@link works.delta.StructConverter} for each type.
 */
package works.delta;
