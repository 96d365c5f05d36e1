/**
 * The type descriptor model: an immutable, closed set of records describing
 * the shape of every convertible type.
 * <p>
 * A descriptor tree is akin to a type expression.
 * {@link works.delta.types.AggregateType} and {@link works.delta.types.FixedArrayType} nest other descriptors directly;
 * {@link works.delta.types.TypeRef} names a type held by a {@link works.delta.TypeRegistry TypeRegistry},
 * which is how self-referential structures such as linked lists are described.
 * <p>
 * Descriptors say nothing about JSON. The mapping to a value tree is the job of
 * {@link works.delta.codec}.
 */
package works.delta.types;
