package works.delta.types;

/**
 * Describes the shape of one convertible type.
 * <p>
 * Descriptors are immutable, built once, and shared by every conversion of the type they describe.
 * The conversion engine dispatches on the concrete descriptor class; descriptors themselves carry no
 * conversion logic.
 * <p>
 * The {@link Object#toString() toString} method should return
 * a compact human-readable representation
 * suitable for log messages and debugging.
 */
public sealed interface TypeDescriptor permits
	AggregateType,
	BackReferenceType,
	BitfieldGroupType,
	FixedArrayType,
	OwnedPointerType,
	ScalarType,
	TaggedUnionType,
	TypeRef
{
	/**
	 * @return a short string naming this type in error messages.
	 * There are no uniqueness requirements; it's only a troubleshooting hint.
	 */
	String briefIdentifier();
}
